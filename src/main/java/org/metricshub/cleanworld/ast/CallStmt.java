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
import java.util.Collections;
import java.util.List;

/**
 * A call used as a statement. The result, if any, is discarded.
 */
public final class CallStmt extends AstNode implements CallSite {

	private final Name name;
	private final List<AstNode> arguments;

	public CallStmt(int lineNo, Name name, List<AstNode> arguments) {
		super(lineNo);
		this.name = name;
		this.arguments = Collections.unmodifiableList(new ArrayList<AstNode>(arguments));
	}

	@Override
	public Name getName() {
		return name;
	}

	@Override
	public List<AstNode> getArguments() {
		return arguments;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.CALL_STMT;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visit(this, arg);
	}

	@Override
	public List<AstNode> getChildren() {
		return arguments;
	}

	@Override
	protected String describe() {
		return "CallStmt " + name;
	}
}
