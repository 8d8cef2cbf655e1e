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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text form of a token stream: one token per line, as
 * <code>line tid kind lexeme</code>.
 * <p>
 * This lets a token stream produced by any tokenizer be saved, inspected and
 * handed over to the parser.
 */
public final class TokenListing {

	private TokenListing() {}

	/**
	 * @param tokens tokens to list
	 * @return the listing, one line per token
	 */
	public static String format(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token t : tokens) {
			sb
					.append(
							String
									.format(
											Locale.ROOT,
											"%3d  %3d  %-7s %s",
											t.getLine(),
											t.getKind().id(),
											t.getKind().name(),
											t.getLexeme()))
					.append('\n');
		}
		return sb.toString();
	}

	/**
	 * Reads a listing back. Blank lines, lines with fewer than three columns and
	 * {@link TokenKind#ERROR} entries are skipped. The token id column is not
	 * trusted: the kind name decides.
	 *
	 * @param listing listing text
	 * @return the tokens
	 * @throws IllegalArgumentException on a non numeric line number or an
	 *         unknown token kind
	 */
	public static List<Token> parse(String listing) {
		List<Token> tokens = new ArrayList<Token>();
		String[] rows = listing.split("\\r?\\n");
		for (int i = 0; i < rows.length; i++) {
			String row = rows[i].trim();
			if (row.isEmpty()) {
				continue;
			}
			String[] parts = row.split("\\s+", 4);
			if (parts.length < 3) {
				continue;
			}
			String kindName = parts[2].trim();
			if (TokenKind.ERROR.name().equals(kindName)) {
				continue;
			}
			int line;
			try {
				line = Integer.parseInt(parts[0]);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid line number '" + parts[0] + "' in token listing row " + (i + 1), e);
			}
			TokenKind kind;
			try {
				kind = TokenKind.valueOf(kindName);
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Unknown token kind '" + kindName + "' in token listing row " + (i + 1), e);
			}
			String lexeme = parts.length > 3 ? parts[3].trim() : "";
			tokens.add(new Token(line, kind, lexeme));
		}
		return tokens;
	}
}
