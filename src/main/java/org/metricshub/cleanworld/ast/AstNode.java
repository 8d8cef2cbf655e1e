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

import java.io.PrintStream;
import java.util.List;

/**
 * Base class of every abstract syntax tree node.
 * <p>
 * The set of subclasses is closed: each concrete node is a final class of
 * this package, identified by its {@link NodeKind}, and processed through
 * {@link #accept(AstVisitor, Object)}. A node keeps the source line it was
 * built from, which every later stage uses in its error messages, and the
 * static type the semantic analyzer resolved for it.
 */
public abstract class AstNode {

	private final int lineNo;
	private SemanticType type;

	protected AstNode(int lineNo) {
		this.lineNo = lineNo;
	}

	/**
	 * @return the source line of this node
	 */
	public final int getLineNumber() {
		return lineNo;
	}

	/**
	 * @return the resolved static type, or null before semantic analysis
	 */
	public final SemanticType getType() {
		return type;
	}

	/**
	 * Record the static type of this node. Called by the semantic analyzer.
	 *
	 * @param type resolved type
	 */
	public final void setType(SemanticType type) {
		this.type = type;
	}

	/**
	 * @return the variant of this node
	 */
	public abstract NodeKind getKind();

	/**
	 * Double dispatch entry point.
	 *
	 * @param <R> result type of the visitor
	 * @param <A> argument type of the visitor
	 * @param visitor visitor to call back
	 * @param arg argument handed over to the visitor
	 * @return what the visitor returns for this node
	 */
	public abstract <R, A> R accept(AstVisitor<R, A> visitor, A arg);

	/**
	 * @return the child nodes, in source order; optional children that are
	 *         absent are left out
	 */
	public abstract List<AstNode> getChildren();

	/**
	 * @return the one line description used in tree dumps
	 */
	protected String describe() {
		return getClass().getSimpleName();
	}

	/**
	 * Dump a text representation of this node and its subtree to the print
	 * stream, one node per line, indented by depth.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public final void dump(PrintStream ps) {
		ps.print(toTreeString());
	}

	/**
	 * @return the text representation of this subtree
	 */
	public final String toTreeString() {
		StringBuilder sb = new StringBuilder();
		dump(sb, 0);
		return sb.toString();
	}

	private void dump(StringBuilder sb, int level) {
		for (int i = 0; i < level; i++) {
			sb.append("  ");
		}
		sb.append(describe()).append(" [line ").append(lineNo).append(']');
		if (type != null) {
			sb.append(" : ").append(type);
		}
		sb.append('\n');
		for (AstNode child : getChildren()) {
			child.dump(sb, level + 1);
		}
	}

	@Override
	public String toString() {
		return describe();
	}
}
