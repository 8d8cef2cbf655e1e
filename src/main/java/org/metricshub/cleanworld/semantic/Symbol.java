package org.metricshub.cleanworld.semantic;


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

import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.SemanticType;

/**
 * Entry of a {@link SymbolTable}.
 */
public final class Symbol {

	private final Name name;
	private final SymbolKind kind;
	private final SemanticType type;
	private final int line;
	private final FunctionSignature signature;

	/**
	 * @param name declared name
	 * @param kind what the name stands for
	 * @param type type of the value, the return type for a function
	 * @param line declaration line, 0 for predefined symbols
	 * @param signature function signature, null unless kind is
	 *        {@link SymbolKind#FUNCTION}
	 */
	public Symbol(Name name, SymbolKind kind, SemanticType type, int line, FunctionSignature signature) {
		this.name = name;
		this.kind = kind;
		this.type = type;
		this.line = line;
		this.signature = signature;
	}

	static Symbol variable(Name name, SymbolKind kind, SemanticType type, int line) {
		return new Symbol(name, kind, type, line, null);
	}

	static Symbol function(Name name, FunctionSignature signature, int line) {
		return new Symbol(name, SymbolKind.FUNCTION, signature.getReturnType(), line, signature);
	}

	public Name getName() {
		return name;
	}

	public SymbolKind getKind() {
		return kind;
	}

	public SemanticType getType() {
		return type;
	}

	public int getLine() {
		return line;
	}

	/**
	 * @return the signature of a function symbol, null otherwise
	 */
	public FunctionSignature getSignature() {
		return signature;
	}

	@Override
	public String toString() {
		return kind + " " + name + " : " + (signature != null ? signature : type);
	}
}
