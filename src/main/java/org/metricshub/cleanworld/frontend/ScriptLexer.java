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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts CleanWorld program text into the token stream consumed by the
 * {@link CleanParser}.
 * <p>
 * Token patterns are tried in {@link TokenKind} declaration order and the
 * first match wins, so keywords shadow identifiers only when they form a
 * whole word. A character that no pattern accepts becomes an
 * {@link TokenKind#ERROR} token and scanning resumes after it; the parser
 * reports the error.
 */
public final class ScriptLexer {

	private static final Map<TokenKind, Pattern> PATTERNS = new EnumMap<TokenKind, Pattern>(TokenKind.class);

	static {
		PATTERNS.put(TokenKind.EQ, Pattern.compile("=="));
		PATTERNS.put(TokenKind.NEQ, Pattern.compile("!="));
		PATTERNS.put(TokenKind.LE, Pattern.compile("<="));
		PATTERNS.put(TokenKind.GE, Pattern.compile(">="));
		PATTERNS.put(TokenKind.AND, Pattern.compile("&&"));
		PATTERNS.put(TokenKind.OR, Pattern.compile("\\|\\|"));
		PATTERNS.put(TokenKind.ASSIGN, Pattern.compile("="));
		PATTERNS.put(TokenKind.LT, Pattern.compile("<"));
		PATTERNS.put(TokenKind.GT, Pattern.compile(">"));
		PATTERNS.put(TokenKind.PLUS, Pattern.compile("\\+"));
		PATTERNS.put(TokenKind.MINUS, Pattern.compile("-"));
		PATTERNS.put(TokenKind.STAR, Pattern.compile("\\*"));
		PATTERNS.put(TokenKind.SLASH, Pattern.compile("/"));
		PATTERNS.put(TokenKind.NOT, Pattern.compile("!"));
		PATTERNS.put(TokenKind.SEMI, Pattern.compile(";"));
		PATTERNS.put(TokenKind.COMMA, Pattern.compile(","));
		PATTERNS.put(TokenKind.COLON, Pattern.compile(":"));
		PATTERNS.put(TokenKind.LPAREN, Pattern.compile("\\("));
		PATTERNS.put(TokenKind.RPAREN, Pattern.compile("\\)"));

		keyword(TokenKind.PROGRAM, "program");
		keyword(TokenKind.BEGIN, "begin");
		keyword(TokenKind.END, "end");
		keyword(TokenKind.VAR, "var");
		keyword(TokenKind.FUNC, "func");
		keyword(TokenKind.RETURN, "return");
		keyword(TokenKind.IF, "if");
		keyword(TokenKind.THEN, "then");
		keyword(TokenKind.ELSE, "else");
		keyword(TokenKind.WHILE, "while");
		keyword(TokenKind.DO, "do");
		keyword(TokenKind.PRINT, "print");
		keyword(TokenKind.BREAK, "break");
		keyword(TokenKind.WORLD, "world");
		keyword(TokenKind.AGENT, "agent");

		keyword(TokenKind.TYPE, "int", "bool", "string");
		keyword(TokenKind.BOOL, "true", "false");
		keyword(TokenKind.DIR, "N", "E", "S", "W");

		PATTERNS.put(TokenKind.INT, Pattern.compile("\\d+"));
		PATTERNS.put(TokenKind.STR, Pattern.compile("\"([^\"\\\\\\n]|\\\\.)*\""));
		PATTERNS.put(TokenKind.ID, Pattern.compile("[A-Za-z_][A-Za-z0-9_]*"));
	}

	private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\n]+");
	private static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");
	private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*[\\s\\S]*?\\*/");

	private static void keyword(TokenKind kind, String... words) {
		StringBuilder regex = new StringBuilder();
		for (String word : words) {
			if (regex.length() > 0) {
				regex.append('|');
			}
			regex.append("\\b").append(word).append("\\b");
		}
		PATTERNS.put(kind, Pattern.compile(regex.toString()));
	}

	private ScriptLexer() {}

	/**
	 * Scans the specified program text.
	 *
	 * @param source program text
	 * @return the tokens, in source order
	 */
	public static List<Token> tokenize(String source) {
		List<Token> tokens = new ArrayList<Token>();
		int pos = 0;
		int line = 1;
		int length = source.length();

		while (pos < length) {
			int skipped = skip(source, pos, WHITESPACE);
			if (skipped < 0) {
				skipped = skip(source, pos, LINE_COMMENT);
			}
			if (skipped < 0) {
				skipped = skip(source, pos, BLOCK_COMMENT);
			}
			if (skipped >= 0) {
				line += countNewlines(source, pos, skipped);
				pos = skipped;
				continue;
			}

			Token token = null;
			for (Map.Entry<TokenKind, Pattern> entry : PATTERNS.entrySet()) {
				Matcher m = region(entry.getValue(), source, pos);
				if (m.lookingAt()) {
					String lexeme = m.group();
					token = new Token(line, entry.getKey(), lexeme);
					line += countNewlines(source, pos, m.end());
					pos = m.end();
					break;
				}
			}
			if (token == null) {
				char bad = source.charAt(pos);
				token = new Token(line, TokenKind.ERROR, String.valueOf(bad));
				if (bad == '\n') {
					line++;
				}
				pos++;
			}
			tokens.add(token);
		}
		return Collections.unmodifiableList(tokens);
	}

	private static Matcher region(Pattern pattern, String source, int pos) {
		Matcher m = pattern.matcher(source);
		m.region(pos, source.length());
		// let \b look at the character before the region
		m.useTransparentBounds(true);
		m.useAnchoringBounds(false);
		return m;
	}

	private static int skip(String source, int pos, Pattern pattern) {
		Matcher m = region(pattern, source, pos);
		return m.lookingAt() ? m.end() : -1;
	}

	private static int countNewlines(String source, int from, int to) {
		int count = 0;
		for (int i = from; i < to; i++) {
			if (source.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}
}
