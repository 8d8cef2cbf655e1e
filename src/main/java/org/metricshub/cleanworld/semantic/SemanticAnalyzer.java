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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.cleanworld.ast.AgentRef;
import org.metricshub.cleanworld.ast.AssignStmt;
import org.metricshub.cleanworld.ast.AstNode;
import org.metricshub.cleanworld.ast.AstVisitor;
import org.metricshub.cleanworld.ast.BinaryOp;
import org.metricshub.cleanworld.ast.BreakStmt;
import org.metricshub.cleanworld.ast.CallSite;
import org.metricshub.cleanworld.ast.CallStmt;
import org.metricshub.cleanworld.ast.FuncCallExpr;
import org.metricshub.cleanworld.ast.FuncDecl;
import org.metricshub.cleanworld.ast.Identifier;
import org.metricshub.cleanworld.ast.IfStmt;
import org.metricshub.cleanworld.ast.Literal;
import org.metricshub.cleanworld.ast.LiteralKind;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.NodeKind;
import org.metricshub.cleanworld.ast.Param;
import org.metricshub.cleanworld.ast.PrintStmt;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.ast.ReturnStmt;
import org.metricshub.cleanworld.ast.SemanticType;
import org.metricshub.cleanworld.ast.StmtList;
import org.metricshub.cleanworld.ast.UnaryOp;
import org.metricshub.cleanworld.ast.UnaryOperator;
import org.metricshub.cleanworld.ast.VarDecl;
import org.metricshub.cleanworld.ast.WhileStmt;
import org.metricshub.cleanworld.ast.WorldRef;
import org.metricshub.cleanworld.util.CleanLogger;
import org.slf4j.Logger;

/**
 * Checks the scope and type rules of a program and annotates every
 * statement and expression with its {@link SemanticType}.
 * <p>
 * The analysis runs in two passes. The declaration pass registers the
 * global variables and the signatures of all user functions in the global
 * scope, so that a function can be called before (or from within) its own
 * definition. The body pass then checks <code>main</code> and each function
 * body, each in its own scope holding the parameters.
 * <p>
 * The visitor argument is the current scope; the returned value is the type
 * of the visited node. The first violation aborts the analysis with a
 * {@link SemanticException}.
 */
public class SemanticAnalyzer implements AstVisitor<SemanticType, SymbolTable> {

	private static final Logger LOG = CleanLogger.getLogger(SemanticAnalyzer.class);

	private SymbolTable globalScope;

	// state of the function body being checked
	private FuncDecl currentFunction;
	private int loopDepth;

	/**
	 * Check the program.
	 *
	 * @param program program to check
	 * @return the global scope, holding the global variables, the user
	 *         functions and the predefined handles
	 * @throws SemanticException upon the first violation
	 */
	public SymbolTable analyze(Program program) {
		globalScope = SymbolTable.createGlobalScope();
		program.accept(this, globalScope);
		return globalScope;
	}

	/**
	 * @return the global scope of the last analysis, or null
	 */
	public SymbolTable getGlobalScope() {
		return globalScope;
	}

	private static SemanticException error(AstNode node, String msg) {
		return new SemanticException(msg, node.getLineNumber());
	}

	private static SemanticType typed(AstNode node, SemanticType type) {
		node.setType(type);
		return type;
	}

	@Override
	public SemanticType visit(Program node, SymbolTable scope) {
		// declaration pass
		for (VarDecl decl : node.getGlobals()) {
			decl.accept(this, scope);
		}
		for (FuncDecl func : node.getFunctions()) {
			declareFunction(func, scope);
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("Declared {} global symbols", scope.getSymbols().size());
		}

		// body pass
		node.getMain().accept(this, scope);
		for (FuncDecl func : node.getFunctions()) {
			func.accept(this, scope);
		}
		return typed(node, SemanticType.VOID);
	}

	// var declarations are always int
	@Override
	public SemanticType visit(VarDecl node, SymbolTable scope) {
		for (Name name : node.getNames()) {
			scope.declare(Symbol.variable(name, SymbolKind.VARIABLE, SemanticType.INT, node.getLineNumber()));
		}
		return typed(node, SemanticType.VOID);
	}

	private void declareFunction(FuncDecl func, SymbolTable scope) {
		if (Builtin.lookup(func.getName()) != null) {
			throw error(func, "Cannot redefine built-in '" + func.getName() + "'");
		}
		List<SemanticType> paramTypes = new ArrayList<SemanticType>();
		for (Param p : func.getParams()) {
			paramTypes.add(p.getDeclaredType());
		}
		FunctionSignature signature = new FunctionSignature(paramTypes, func.getReturnType());
		scope.declare(Symbol.function(func.getName(), signature, func.getLineNumber()));
	}

	@Override
	public SemanticType visit(FuncDecl node, SymbolTable scope) {
		SymbolTable functionScope = scope.enterScope();
		for (Param p : node.getParams()) {
			if (functionScope.lookupLocal(p.getName()) != null) {
				throw error(p, "multiply defined parameter " + p.getName() + " in function " + node.getName());
			}
			p.accept(this, functionScope);
		}
		currentFunction = node;
		loopDepth = 0;
		try {
			node.getBody().accept(this, functionScope);
		} finally {
			currentFunction = null;
		}
		return typed(node, node.getReturnType());
	}

	@Override
	public SemanticType visit(Param node, SymbolTable scope) {
		scope.declare(Symbol.variable(node.getName(), SymbolKind.PARAMETER, node.getDeclaredType(), node.getLineNumber()));
		return typed(node, node.getDeclaredType());
	}

	@Override
	public SemanticType visit(StmtList node, SymbolTable scope) {
		for (AstNode stmt : node.getStatements()) {
			stmt.accept(this, scope);
		}
		return typed(node, SemanticType.VOID);
	}

	// the assigned type is not checked against the target: globals are
	// untyped slots at runtime and world/agent are checked by the interpreter
	@Override
	public SemanticType visit(AssignStmt node, SymbolTable scope) {
		AstNode target = node.getTarget();
		if (target.getKind() == NodeKind.IDENTIFIER) {
			Name name = ((Identifier) target).getName();
			Symbol symbol = scope.lookup(name);
			if (symbol == null) {
				throw error(target, "Undeclared identifier '" + name + "'");
			}
			if (!symbol.getKind().isAssignable()) {
				throw error(target, "Cannot assign to '" + name + "'; it is a function");
			}
			target.setType(symbol.getType());
		} else {
			target.accept(this, scope);
		}
		SemanticType valueType = node.getValue().accept(this, scope);
		return typed(node, valueType);
	}

	// a call statement may discard a non-void result
	@Override
	public SemanticType visit(CallStmt node, SymbolTable scope) {
		return typed(node, checkCall(node, node, scope, false));
	}

	@Override
	public SemanticType visit(FuncCallExpr node, SymbolTable scope) {
		return typed(node, checkCall(node, node, scope, true));
	}

	private SemanticType checkCall(AstNode node, CallSite call, SymbolTable scope, boolean usedAsValue) {
		Name name = call.getName();
		FunctionSignature signature;
		Builtin builtin = Builtin.lookup(name);
		if (builtin != null) {
			signature = builtin.getSignature();
		} else {
			Symbol symbol = scope.lookup(name);
			if (symbol == null || symbol.getKind() != SymbolKind.FUNCTION) {
				throw error(node, "Undeclared function '" + name + "'");
			}
			signature = symbol.getSignature();
		}
		if (usedAsValue && signature.getReturnType() == SemanticType.VOID) {
			throw error(node, "Procedure '" + name + "' used in expression");
		}
		List<AstNode> args = call.getArguments();
		if (args.size() != signature.getArity()) {
			throw error(node, "'" + name + "' expects " + signature.getArity() + " args, got " + args.size());
		}
		for (int i = 0; i < args.size(); i++) {
			AstNode arg = args.get(i);
			SemanticType expected = signature.getParameterTypes().get(i);
			SemanticType actual = arg.accept(this, scope);
			if (expected == SemanticType.ANY) {
				if (!actual.isPrintable()) {
					throw error(arg, "Arg " + (i + 1) + " of '" + name + "' must be a printable type (int, bool, string, dir), got " + actual);
				}
			} else if (expected == SemanticType.DIR) {
				if (arg.getKind() != NodeKind.LITERAL || ((Literal) arg).getLiteralKind() != LiteralKind.DIR) {
					throw error(arg, "Arg " + (i + 1) + " of '" + name + "' must be a direction literal (N, E, S or W)");
				}
			} else if (actual != expected) {
				throw error(arg, "Arg " + (i + 1) + " of '" + name + "' expects " + expected + ", got " + actual);
			}
		}
		return signature.getReturnType();
	}

	@Override
	public SemanticType visit(PrintStmt node, SymbolTable scope) {
		SemanticType type = node.getExpression().accept(this, scope);
		if (!type.isPrintable()) {
			throw error(node, "Cannot print type '" + type + "'");
		}
		return typed(node, SemanticType.VOID);
	}

	@Override
	public SemanticType visit(IfStmt node, SymbolTable scope) {
		if (node.getCondition().accept(this, scope) != SemanticType.BOOL) {
			throw error(node.getCondition(), "If condition must be bool, got " + node.getCondition().getType());
		}
		node.getThenBranch().accept(this, scope);
		if (node.getElseBranch() != null) {
			node.getElseBranch().accept(this, scope);
		}
		return typed(node, SemanticType.VOID);
	}

	@Override
	public SemanticType visit(WhileStmt node, SymbolTable scope) {
		if (node.getCondition().accept(this, scope) != SemanticType.BOOL) {
			throw error(node.getCondition(), "While condition must be bool, got " + node.getCondition().getType());
		}
		loopDepth++;
		try {
			node.getBody().accept(this, scope);
		} finally {
			loopDepth--;
		}
		return typed(node, SemanticType.VOID);
	}

	@Override
	public SemanticType visit(BreakStmt node, SymbolTable scope) {
		if (loopDepth == 0) {
			throw error(node, "cannot break; not within a loop");
		}
		return typed(node, SemanticType.VOID);
	}

	@Override
	public SemanticType visit(ReturnStmt node, SymbolTable scope) {
		SemanticType expected = currentFunction.getReturnType();
		AstNode value = node.getValue();
		if (expected == SemanticType.VOID) {
			if (value != null) {
				throw error(node, "Void function '" + currentFunction.getName() + "' cannot return a value");
			}
			return typed(node, SemanticType.VOID);
		}
		if (value == null) {
			throw error(node, "Function '" + currentFunction.getName() + "' must return " + expected);
		}
		SemanticType actual = value.accept(this, scope);
		if (actual != expected) {
			throw error(node, "Return type mismatch in '" + currentFunction.getName() + "': expected " + expected + ", got " + actual);
		}
		return typed(node, actual);
	}

	@Override
	public SemanticType visit(BinaryOp node, SymbolTable scope) {
		SemanticType left = node.getLeft().accept(this, scope);
		SemanticType right = node.getRight().accept(this, scope);
		if (node.getOperator().isArithmetic()) {
			if (left != SemanticType.INT || right != SemanticType.INT) {
				throw error(node, "Operator " + node.getOperator() + " requires int operands, got " + left + " and " + right);
			}
			return typed(node, SemanticType.INT);
		}
		if (node.getOperator().isRelational()) {
			if (left != right) {
				throw error(node, "Operator " + node.getOperator() + " requires operands of the same type, got " + left + " and " + right);
			}
			return typed(node, SemanticType.BOOL);
		}
		if (left != SemanticType.BOOL || right != SemanticType.BOOL) {
			throw error(node, "Operator " + node.getOperator() + " requires bool operands, got " + left + " and " + right);
		}
		return typed(node, SemanticType.BOOL);
	}

	@Override
	public SemanticType visit(UnaryOp node, SymbolTable scope) {
		SemanticType operand = node.getOperand().accept(this, scope);
		if (node.getOperator() == UnaryOperator.NOT) {
			if (operand != SemanticType.BOOL) {
				throw error(node, "Operator ! requires bool, got " + operand);
			}
		} else if (operand != SemanticType.INT) {
			throw error(node, "Unary " + node.getOperator() + " requires int, got " + operand);
		}
		return typed(node, operand);
	}

	@Override
	public SemanticType visit(Literal node, SymbolTable scope) {
		return typed(node, node.getLiteralKind().getType());
	}

	@Override
	public SemanticType visit(Identifier node, SymbolTable scope) {
		Symbol symbol = scope.lookup(node.getName());
		if (symbol == null) {
			throw error(node, "Undeclared identifier '" + node.getName() + "'");
		}
		if (symbol.getKind() == SymbolKind.FUNCTION) {
			throw error(node, "cannot use " + node.getName() + " as a variable; it is a function");
		}
		return typed(node, symbol.getType());
	}

	@Override
	public SemanticType visit(WorldRef node, SymbolTable scope) {
		return typed(node, SemanticType.WORLD);
	}

	@Override
	public SemanticType visit(AgentRef node, SymbolTable scope) {
		return typed(node, SemanticType.AGENT);
	}
}
