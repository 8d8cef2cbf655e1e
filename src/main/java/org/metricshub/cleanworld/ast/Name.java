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

import java.util.Locale;

/**
 * An identifier as written in the source, together with its canonical key.
 * <p>
 * Names are case-insensitive: two names are equal when their keys are equal.
 * Symbol tables, runtime variable maps and the builtin table are all keyed by
 * {@link #getKey()}.
 */
public final class Name {

	private final String text;
	private final String key;

	/**
	 * @param text identifier as written
	 */
	public Name(String text) {
		this.text = text;
		this.key = canonical(text);
	}

	/**
	 * @param text identifier
	 * @return the lookup key of the identifier
	 */
	public static String canonical(String text) {
		return text.toLowerCase(Locale.ROOT);
	}

	/**
	 * @return the identifier as written in the source
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the lower-case lookup key
	 */
	public String getKey() {
		return key;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Name && key.equals(((Name) o).key);
	}

	@Override
	public int hashCode() {
		return key.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
