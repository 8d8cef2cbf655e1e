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

import java.util.Arrays;
import java.util.List;

/**
 * <code>target = value;</code> where the target is an {@link Identifier},
 * a {@link WorldRef} or an {@link AgentRef}.
 */
public final class AssignStmt extends AstNode {

	private final AstNode target;
	private final AstNode value;

	public AssignStmt(int lineNo, AstNode target, AstNode value) {
		super(lineNo);
		this.target = target;
		this.value = value;
	}

	public AstNode getTarget() {
		return target;
	}

	public AstNode getValue() {
		return value;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.ASSIGN_STMT;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visit(this, arg);
	}

	@Override
	public List<AstNode> getChildren() {
		return Arrays.asList(target, value);
	}
}
