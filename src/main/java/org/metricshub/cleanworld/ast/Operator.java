package org.metricshub.cleanworld.ast;


/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CleanWorld
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

/**
 * Binary operators, grouped by the operand types they accept.
 */
public enum Operator {
	PLUS("+"),
	MINUS("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	EQ("=="),
	NEQ("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">="),
	AND("&&"),
	OR("||");

	private final String symbol;

	Operator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return true for <code>+ - * /</code>
	 */
	public boolean isArithmetic() {
		return this == PLUS || this == MINUS || this == MULTIPLY || this == DIVIDE;
	}

	/**
	 * @return true for the comparison operators
	 */
	public boolean isRelational() {
		return this == EQ || this == NEQ || this == LT || this == LE || this == GT || this == GE;
	}

	/**
	 * @return true for <code>&amp;&amp;</code> and <code>||</code>
	 */
	public boolean isLogical() {
		return this == AND || this == OR;
	}

	/**
	 * @param symbol operator text
	 * @return the operator
	 * @throws IllegalArgumentException when the text is not a binary operator
	 */
	public static Operator fromSymbol(String symbol) {
		for (Operator op : values()) {
			if (op.symbol.equals(symbol)) {
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown binary operator: " + symbol);
	}

	@Override
	public String toString() {
		return symbol;
	}
}
