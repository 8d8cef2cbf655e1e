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
 * Root of the tree: global variable declarations, user functions and the
 * <code>main</code> function.
 */
public final class Program extends AstNode {

	private final Name name;
	private final List<VarDecl> globals;
	private final List<FuncDecl> functions;
	private final FuncDecl main;

	/**
	 * @param lineNo source line of the <code>program</code> keyword
	 * @param name program name
	 * @param globals top-level <code>var</code> declarations
	 * @param functions user functions, <code>main</code> excluded
	 * @param main the <code>main</code> function
	 */
	public Program(int lineNo, Name name, List<VarDecl> globals, List<FuncDecl> functions, FuncDecl main) {
		super(lineNo);
		this.name = name;
		this.globals = Collections.unmodifiableList(new ArrayList<VarDecl>(globals));
		this.functions = Collections.unmodifiableList(new ArrayList<FuncDecl>(functions));
		this.main = main;
	}

	public Name getName() {
		return name;
	}

	public List<VarDecl> getGlobals() {
		return globals;
	}

	public List<FuncDecl> getFunctions() {
		return functions;
	}

	public FuncDecl getMain() {
		return main;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.PROGRAM;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visit(this, arg);
	}

	@Override
	public List<AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>(globals);
		children.addAll(functions);
		children.add(main);
		return children;
	}

	@Override
	protected String describe() {
		return "Program " + name;
	}
}
