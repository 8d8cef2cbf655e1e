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

import java.util.ArrayList;
import java.util.List;

/**
 * <code>if cond then ... [else ...] end</code>. An <code>else if</code>
 * chain is an else branch holding a single nested IfStmt.
 */
public final class IfStmt extends AstNode {

	private final AstNode condition;
	private final StmtList thenBranch;
	private final StmtList elseBranch;

	/**
	 * @param lineNo source line of the <code>if</code> keyword
	 * @param condition boolean condition
	 * @param thenBranch statements run when the condition holds
	 * @param elseBranch statements run otherwise, or null
	 */
	public IfStmt(int lineNo, AstNode condition, StmtList thenBranch, StmtList elseBranch) {
		super(lineNo);
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public AstNode getCondition() {
		return condition;
	}

	public StmtList getThenBranch() {
		return thenBranch;
	}

	/**
	 * @return the else branch, or null when there is none
	 */
	public StmtList getElseBranch() {
		return elseBranch;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.IF_STMT;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visit(this, arg);
	}

	@Override
	public List<AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>(3);
		children.add(condition);
		children.add(thenBranch);
		if (elseBranch != null) {
			children.add(elseBranch);
		}
		return children;
	}
}
