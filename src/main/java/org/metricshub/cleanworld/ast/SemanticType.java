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
 * Static types known to the semantic analyzer.
 * <p>
 * Only <code>int</code>, <code>bool</code> and <code>string</code> can be
 * written in a program (as parameter and return types). The others are given
 * to literals, builtins and the <code>world</code>/<code>agent</code> handles.
 * {@link #ANY} only appears as a builtin parameter type and accepts any
 * printable value.
 */
public enum SemanticType {
	INT("int"),
	BOOL("bool"),
	STRING("string"),
	DIR("dir"),
	WORLD("world"),
	AGENT("agent"),
	VOID("void"),
	ANY("any");

	private final String typeName;

	SemanticType(String typeName) {
		this.typeName = typeName;
	}

	/**
	 * @return the type name as written in programs and messages
	 */
	public String getTypeName() {
		return typeName;
	}

	/**
	 * @return true if a value of this type can be printed
	 */
	public boolean isPrintable() {
		return this == INT || this == BOOL || this == STRING || this == DIR;
	}

	/**
	 * Resolve a type name written in a program, ignoring case.
	 *
	 * @param name type name
	 * @return the type
	 * @throws IllegalArgumentException when no type has this name
	 */
	public static SemanticType fromName(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		for (SemanticType t : values()) {
			if (t.typeName.equals(key)) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown type: " + name);
	}

	@Override
	public String toString() {
		return typeName;
	}
}
