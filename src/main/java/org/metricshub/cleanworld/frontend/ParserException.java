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
 * Syntax error raised by the {@link CleanParser}. The first error aborts the
 * parse: there is no recovery.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;
	private final String expected;
	private final String actual;

	/**
	 * @param lineNumber line of the offending token, or -1 at end of input
	 * @param expected description of what the grammar required
	 * @param actual description of the token found instead
	 */
	public ParserException(int lineNumber, String expected, String actual) {
		super("Expected " + expected + ", got " + actual);
		this.lineNumber = lineNumber;
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * @return the offending line number, or -1 when the input ended
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	public String getExpected() {
		return expected;
	}

	public String getActual() {
		return actual;
	}
}
