package org.metricshub.cleanworld.jrt;


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
 * Content of one world cell, with the character used to render it.
 */
public enum CellState {
	EMPTY('.'),
	OBSTACLE('#'),
	DIRT('*'),
	ENTRY('I'),
	EXIT('O');

	private final char symbol;

	CellState(char symbol) {
		this.symbol = symbol;
	}

	public char getSymbol() {
		return symbol;
	}

	/**
	 * @param symbol rendering character
	 * @return the cell state
	 * @throws IllegalArgumentException for an unknown character
	 */
	public static CellState fromSymbol(char symbol) {
		for (CellState s : values()) {
			if (s.symbol == symbol) {
				return s;
			}
		}
		throw new IllegalArgumentException("Unknown cell symbol: '" + symbol + "'");
	}
}
