package org.metricshub.cleanworld.frontend;


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
 * Lexer token kinds.
 * <p>
 * The declaration order is significant: the lexer tries the kinds in this
 * order (operators before keywords before literals and identifiers), and the
 * 1-based position of a kind is its token id in a token listing.
 */
public enum TokenKind {
	EQ,
	NEQ,
	LE,
	GE,
	AND,
	OR,
	ASSIGN,
	LT,
	GT,
	PLUS,
	MINUS,
	STAR,
	SLASH,
	NOT,
	SEMI,
	COMMA,
	COLON,
	LPAREN,
	RPAREN,

	PROGRAM,
	BEGIN,
	END,
	VAR,
	FUNC,
	RETURN,
	IF,
	THEN,
	ELSE,
	WHILE,
	DO,
	PRINT,
	BREAK,
	WORLD,
	AGENT,

	TYPE,
	BOOL,
	DIR,

	INT,
	STR,
	ID,

	ERROR;

	private static final int ERROR_ID = 999;

	/**
	 * @return the numeric token id used in token listings
	 */
	public int id() {
		return this == ERROR ? ERROR_ID : ordinal() + 1;
	}

	/**
	 * @return true for <code>int</code>, <code>string</code>, <code>bool</code>
	 *         and direction literals
	 */
	public boolean isLiteral() {
		return this == INT || this == STR || this == BOOL || this == DIR;
	}

	/**
	 * @return true for the six comparison operators
	 */
	public boolean isRelational() {
		return this == EQ || this == NEQ || this == LT || this == LE || this == GT || this == GE;
	}
}
