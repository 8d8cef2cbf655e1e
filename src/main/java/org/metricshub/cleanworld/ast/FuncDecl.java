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
 * A function definition. The <code>main</code> function is represented the
 * same way, with no parameters and a <code>void</code> return type.
 */
public final class FuncDecl extends AstNode {

	private final Name name;
	private final List<Param> params;
	private final SemanticType returnType;
	private final StmtList body;

	/**
	 * @param lineNo source line of the <code>func</code> keyword
	 * @param name function name
	 * @param params formal parameters, in order
	 * @param returnType declared return type, {@link SemanticType#VOID} when
	 *        none is declared
	 * @param body function body
	 */
	public FuncDecl(int lineNo, Name name, List<Param> params, SemanticType returnType, StmtList body) {
		super(lineNo);
		this.name = name;
		this.params = Collections.unmodifiableList(new ArrayList<Param>(params));
		this.returnType = returnType;
		this.body = body;
	}

	public Name getName() {
		return name;
	}

	public List<Param> getParams() {
		return params;
	}

	public SemanticType getReturnType() {
		return returnType;
	}

	public StmtList getBody() {
		return body;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.FUNC_DECL;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visit(this, arg);
	}

	@Override
	public List<AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>(params);
		children.add(body);
		return children;
	}

	@Override
	protected String describe() {
		return "FuncDecl " + name + "() : " + returnType;
	}
}
