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
 * Discriminant of the AST node variants, one constant per concrete
 * {@link AstNode} class.
 */
public enum NodeKind {
	PROGRAM,
	VAR_DECL,
	FUNC_DECL,
	PARAM,
	STMT_LIST,
	ASSIGN_STMT,
	CALL_STMT,
	PRINT_STMT,
	IF_STMT,
	WHILE_STMT,
	BREAK_STMT,
	RETURN_STMT,
	BINARY_OP,
	UNARY_OP,
	LITERAL,
	IDENTIFIER,
	WORLD_REF,
	AGENT_REF,
	FUNC_CALL_EXPR
}
