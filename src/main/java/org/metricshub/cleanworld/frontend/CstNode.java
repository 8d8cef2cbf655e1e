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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the concrete syntax tree. One node per grammar production, labeled
 * with the production name, holding every token (punctuation included) and
 * sub-production in source order.
 */
public final class CstNode implements CstElement {

	private final String label;
	private final List<CstElement> children = new ArrayList<CstElement>();

	/**
	 * @param label grammar production name
	 */
	public CstNode(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @param child token or node to append
	 * @return the appended child
	 */
	<T extends CstElement> T add(T child) {
		children.add(child);
		return child;
	}

	/**
	 * @return the children, in source order
	 */
	public List<CstElement> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public int size() {
		return children.size();
	}

	public CstElement get(int index) {
		return children.get(index);
	}

	/**
	 * @param index child position
	 * @return the child as a token
	 * @throws IllegalStateException when the child is a node
	 */
	public Token token(int index) {
		CstElement e = children.get(index);
		if (!e.isToken()) {
			throw new IllegalStateException("Child " + index + " of " + label + " is not a token");
		}
		return (Token) e;
	}

	/**
	 * @param index child position
	 * @return the child as a node
	 * @throws IllegalStateException when the child is a token
	 */
	public CstNode node(int index) {
		CstElement e = children.get(index);
		if (e.isToken()) {
			throw new IllegalStateException("Child " + index + " of " + label + " is not a node");
		}
		return (CstNode) e;
	}

	/**
	 * @param childLabel production name
	 * @return the first child node with this label, or null
	 */
	public CstNode find(String childLabel) {
		for (CstElement e : children) {
			if (!e.isToken() && ((CstNode) e).label.equals(childLabel)) {
				return (CstNode) e;
			}
		}
		return null;
	}

	/**
	 * @param kind token kind
	 * @return true if a direct child token has this kind
	 */
	public boolean hasToken(TokenKind kind) {
		for (CstElement e : children) {
			if (e.isToken() && ((Token) e).getKind() == kind) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return all token leaves of this subtree, in source order
	 */
	public List<Token> leaves() {
		List<Token> leaves = new ArrayList<Token>();
		collectLeaves(leaves);
		return leaves;
	}

	@Override
	public boolean isToken() {
		return false;
	}

	@Override
	public void collectLeaves(List<Token> leaves) {
		for (CstElement e : children) {
			e.collectLeaves(leaves);
		}
	}

	@Override
	public void dump(StringBuilder out, int level) {
		for (int i = 0; i < level; i++) {
			out.append("  ");
		}
		out.append(label).append('\n');
		for (CstElement e : children) {
			e.dump(out, level + 1);
		}
	}

	/**
	 * Dump a text representation of this tree to the print stream.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		ps.print(toTreeString());
	}

	/**
	 * @return the indented text representation of this tree
	 */
	public String toTreeString() {
		StringBuilder sb = new StringBuilder();
		dump(sb, 0);
		return sb.toString();
	}

	@Override
	public String toString() {
		return label;
	}
}
