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

import java.util.List;
import java.util.Objects;

/**
 * One lexical token: the line it was found on, its kind and its text.
 * Tokens are immutable and are also the leaves of the concrete syntax tree.
 */
public final class Token implements CstElement {

	private final int line;
	private final TokenKind kind;
	private final String lexeme;

	/**
	 * @param line 1-based source line
	 * @param kind token kind
	 * @param lexeme token text as found in the source
	 */
	public Token(int line, TokenKind kind, String lexeme) {
		this.line = line;
		this.kind = Objects.requireNonNull(kind, "kind");
		this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
	}

	public int getLine() {
		return line;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getLexeme() {
		return lexeme;
	}

	@Override
	public boolean isToken() {
		return true;
	}

	@Override
	public void collectLeaves(List<Token> leaves) {
		leaves.add(this);
	}

	@Override
	public void dump(StringBuilder out, int level) {
		for (int i = 0; i < level; i++) {
			out.append("  ");
		}
		out.append(this).append('\n');
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return line == other.line && kind == other.kind && lexeme.equals(other.lexeme);
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, kind, lexeme);
	}

	@Override
	public String toString() {
		return "[" + kind + "] '" + lexeme + "'";
	}
}
