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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.SemanticType;

/**
 * One scope of the scope chain: names declared in this scope, keyed by their
 * canonical form, and a link to the enclosing scope.
 */
public class SymbolTable {

	/** Predefined name of the world handle. */
	public static final Name WORLD = new Name("world");

	/** Predefined name of the agent handle. */
	public static final Name AGENT = new Name("agent");

	private final SymbolTable parent;
	private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

	/**
	 * @param parent enclosing scope, null for the global scope
	 */
	public SymbolTable(SymbolTable parent) {
		this.parent = parent;
	}

	/**
	 * @return a global scope holding the <code>world</code> and
	 *         <code>agent</code> handles
	 */
	public static SymbolTable createGlobalScope() {
		SymbolTable global = new SymbolTable(null);
		global.declare(Symbol.variable(WORLD, SymbolKind.OBJECT, SemanticType.WORLD, 0));
		global.declare(Symbol.variable(AGENT, SymbolKind.OBJECT, SemanticType.AGENT, 0));
		return global;
	}

	/**
	 * @return a new scope nested in this one
	 */
	public SymbolTable enterScope() {
		return new SymbolTable(this);
	}

	/**
	 * @return the enclosing scope, null for the global scope
	 */
	public SymbolTable getParent() {
		return parent;
	}

	/**
	 * Add a symbol to this scope.
	 *
	 * @param symbol symbol to add
	 * @throws SemanticException when the name is already declared in this
	 *         scope
	 */
	public void declare(Symbol symbol) {
		String key = symbol.getName().getKey();
		Symbol existing = symbols.get(key);
		if (existing != null) {
			throw new SemanticException(
					"Redeclaration of '" + symbol.getName() + "' (already declared as " + existing.getKind().name().toLowerCase(Locale.ROOT)
							+ (existing.getLine() > 0 ? " on line " + existing.getLine() : "") + ")",
					symbol.getLine());
		}
		symbols.put(key, symbol);
	}

	/**
	 * Look a name up in this scope, then in the enclosing ones.
	 *
	 * @param name name to resolve
	 * @return the innermost symbol with this name, or null
	 */
	public Symbol lookup(Name name) {
		for (SymbolTable scope = this; scope != null; scope = scope.parent) {
			Symbol symbol = scope.symbols.get(name.getKey());
			if (symbol != null) {
				return symbol;
			}
		}
		return null;
	}

	/**
	 * @param name name to resolve
	 * @return the symbol declared in this very scope, or null
	 */
	public Symbol lookupLocal(Name name) {
		return symbols.get(name.getKey());
	}

	/**
	 * @return the symbols of this scope, in declaration order
	 */
	public Collection<Symbol> getSymbols() {
		return Collections.unmodifiableCollection(symbols.values());
	}
}
