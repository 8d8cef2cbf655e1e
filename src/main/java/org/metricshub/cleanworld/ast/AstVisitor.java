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

/**
 * Operation over the abstract syntax tree, one method per node variant.
 *
 * @param <R> result of visiting a node
 * @param <A> context argument passed down the traversal
 */
public interface AstVisitor<R, A> {

	R visit(Program node, A arg);

	R visit(VarDecl node, A arg);

	R visit(FuncDecl node, A arg);

	R visit(Param node, A arg);

	R visit(StmtList node, A arg);

	R visit(AssignStmt node, A arg);

	R visit(CallStmt node, A arg);

	R visit(PrintStmt node, A arg);

	R visit(IfStmt node, A arg);

	R visit(WhileStmt node, A arg);

	R visit(BreakStmt node, A arg);

	R visit(ReturnStmt node, A arg);

	R visit(BinaryOp node, A arg);

	R visit(UnaryOp node, A arg);

	R visit(Literal node, A arg);

	R visit(Identifier node, A arg);

	R visit(WorldRef node, A arg);

	R visit(AgentRef node, A arg);

	R visit(FuncCallExpr node, A arg);
}
