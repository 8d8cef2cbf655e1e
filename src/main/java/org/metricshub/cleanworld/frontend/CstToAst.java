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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.cleanworld.ast.AgentRef;
import org.metricshub.cleanworld.ast.AssignStmt;
import org.metricshub.cleanworld.ast.AstNode;
import org.metricshub.cleanworld.ast.BinaryOp;
import org.metricshub.cleanworld.ast.BreakStmt;
import org.metricshub.cleanworld.ast.CallStmt;
import org.metricshub.cleanworld.ast.FuncCallExpr;
import org.metricshub.cleanworld.ast.FuncDecl;
import org.metricshub.cleanworld.ast.Identifier;
import org.metricshub.cleanworld.ast.IfStmt;
import org.metricshub.cleanworld.ast.Literal;
import org.metricshub.cleanworld.ast.LiteralKind;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.Operator;
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

/**
 * Builds the abstract syntax tree out of the concrete syntax tree produced by
 * {@link CleanParser}.
 * <p>
 * The walk is purely structural: keywords and punctuation are dropped,
 * single-child expression levels collapse, and operator chains fold into
 * left-associative {@link BinaryOp} nodes. No name or type is checked here.
 * <p>
 * The CST is trusted to come from {@link CleanParser}: a node that does not
 * have the expected shape is an {@link IllegalStateException}.
 */
public class CstToAst {

	private static final String MAIN = "main";
	private static final String WORLD = "world";
	private static final String AGENT = "agent";

	/**
	 * @param root the <code>program</code> node of a concrete syntax tree
	 * @return the abstract syntax tree of the program
	 */
	public Program transform(CstNode root) {
		expectLabel(root, "program");
		Token name = root.token(1);
		CstNode topItems = root.node(3);

		List<VarDecl> globals = new ArrayList<VarDecl>();
		List<FuncDecl> functions = new ArrayList<FuncDecl>();
		for (CstElement item : topItems.getChildren()) {
			CstNode node = (CstNode) item;
			if ("var_decl".equals(node.getLabel())) {
				globals.add(varDecl(node));
			} else {
				functions.add(funcDecl(node));
			}
		}
		FuncDecl main = mainDecl(root.node(4));
		return new Program(root.token(0).getLine(), new Name(name.getLexeme()), globals, functions, main);
	}

	private VarDecl varDecl(CstNode node) {
		List<Name> names = new ArrayList<Name>();
		for (Token t : node.node(1).leaves()) {
			if (t.getKind() == TokenKind.ID) {
				names.add(new Name(t.getLexeme()));
			}
		}
		return new VarDecl(node.token(0).getLine(), names);
	}

	private FuncDecl funcDecl(CstNode node) {
		Token name = node.token(1);
		List<Param> params = new ArrayList<Param>();
		CstNode paramsNode = node.find("params");
		if (paramsNode != null) {
			for (CstElement e : paramsNode.getChildren()) {
				if (!e.isToken()) {
					CstNode param = (CstNode) e;
					Token id = param.token(0);
					params.add(new Param(id.getLine(), new Name(id.getLexeme()), type(param.token(2))));
				}
			}
		}
		SemanticType returnType = SemanticType.VOID;
		if (node.hasToken(TokenKind.COLON)) {
			for (CstElement e : node.getChildren()) {
				if (e.isToken() && ((Token) e).getKind() == TokenKind.TYPE) {
					returnType = type((Token) e);
				}
			}
		}
		StmtList body = stmtList(node.find("stmt_list"), name.getLine());
		return new FuncDecl(node.token(0).getLine(), new Name(name.getLexeme()), params, returnType, body);
	}

	private FuncDecl mainDecl(CstNode node) {
		expectLabel(node, "main_decl");
		return new FuncDecl(
				node.token(0).getLine(),
				new Name(MAIN),
				Collections.<Param>emptyList(),
				SemanticType.VOID,
				stmtList(node.find("stmt_list"), node.token(0).getLine()));
	}

	private static SemanticType type(Token t) {
		return SemanticType.fromName(t.getLexeme());
	}

	// STATEMENTS

	// an empty list takes the line of the keyword in front of it
	private StmtList stmtList(CstNode node, int fallbackLine) {
		expectLabel(node, "stmt_list");
		List<AstNode> statements = new ArrayList<AstNode>();
		for (CstElement e : node.getChildren()) {
			statements.add(statement(((CstNode) e).node(0)));
		}
		List<Token> leaves = node.leaves();
		return new StmtList(leaves.isEmpty() ? fallbackLine : leaves.get(0).getLine(), statements);
	}

	private AstNode statement(CstNode node) {
		int line = node.token(0).getLine();
		switch (node.getLabel()) {
		case "assign_stmt":
			return new AssignStmt(line, assignTarget(node.token(0)), expr(node.node(2)));
		case "call_stmt":
			return new CallStmt(line, new Name(node.token(0).getLexeme()), args(node.find("args")));
		case "print_stmt":
			return new PrintStmt(line, expr(node.node(2)));
		case "if_stmt":
			return ifStmt(node);
		case "while_stmt":
			return new WhileStmt(line, expr(node.node(1)), stmtList(node.node(3), node.token(2).getLine()));
		case "break_stmt":
			return new BreakStmt(line);
		case "return_stmt":
			return new ReturnStmt(line, node.size() > 2 ? expr(node.node(1)) : null);
		default:
			throw new IllegalStateException("Unexpected statement node: " + node.getLabel());
		}
	}

	private IfStmt ifStmt(CstNode node) {
		int line = node.token(0).getLine();
		AstNode condition = expr(node.node(1));
		StmtList thenBranch = stmtList(node.node(3), node.token(2).getLine());
		StmtList elseBranch = null;
		if (node.hasToken(TokenKind.ELSE)) {
			CstNode branch = node.node(5);
			if ("if_stmt".equals(branch.getLabel())) {
				IfStmt nested = ifStmt(branch);
				elseBranch = new StmtList(nested.getLineNumber(), Collections.<AstNode>singletonList(nested));
			} else {
				elseBranch = stmtList(branch, node.token(4).getLine());
			}
		}
		return new IfStmt(line, condition, thenBranch, elseBranch);
	}

	private static AstNode assignTarget(Token t) {
		AstNode ref = handleRef(t);
		return ref != null ? ref : new Identifier(t.getLine(), new Name(t.getLexeme()));
	}

	/**
	 * @return a WorldRef or AgentRef when the token names one of the handles,
	 *         null otherwise
	 */
	private static AstNode handleRef(Token t) {
		String key = Name.canonical(t.getLexeme());
		if (t.getKind() == TokenKind.WORLD || WORLD.equals(key)) {
			return new WorldRef(t.getLine());
		}
		if (t.getKind() == TokenKind.AGENT || AGENT.equals(key)) {
			return new AgentRef(t.getLine());
		}
		return null;
	}

	private List<AstNode> args(CstNode node) {
		List<AstNode> args = new ArrayList<AstNode>();
		if (node == null) {
			return args;
		}
		for (CstElement e : node.getChildren()) {
			if (!e.isToken()) {
				args.add(expr((CstNode) e));
			}
		}
		return args;
	}

	// EXPRESSIONS

	private AstNode expr(CstNode node) {
		switch (node.getLabel()) {
		case "expr":
			return expr(node.node(0));
		case "or_expr":
		case "and_expr":
		case "rel_expr":
		case "add_expr":
		case "mul_expr":
			return binaryChain(node);
		case "unary":
			return unary(node);
		case "primary":
			return primary(node);
		default:
			throw new IllegalStateException("Unexpected expression node: " + node.getLabel());
		}
	}

	// operand (op operand)* folds to ((operand op operand) op operand) ...
	private AstNode binaryChain(CstNode node) {
		AstNode result = expr(node.node(0));
		for (int i = 1; i + 1 < node.size(); i += 2) {
			Token op = node.token(i);
			AstNode right = expr(node.node(i + 1));
			result = new BinaryOp(op.getLine(), Operator.fromSymbol(op.getLexeme()), result, right);
		}
		return result;
	}

	private AstNode unary(CstNode node) {
		if (node.size() == 1) {
			return expr(node.node(0));
		}
		Token op = node.token(0);
		return new UnaryOp(op.getLine(), UnaryOperator.fromSymbol(op.getLexeme()), expr(node.node(1)));
	}

	private AstNode primary(CstNode node) {
		if (node.get(0).isToken() && node.token(0).getKind() == TokenKind.LPAREN) {
			return expr(node.node(1));
		}
		Token t = node.token(0);
		switch (t.getKind()) {
		case ID:
			if (node.size() > 1) {
				return new FuncCallExpr(t.getLine(), new Name(t.getLexeme()), args(node.find("args")));
			}
			AstNode ref = handleRef(t);
			return ref != null ? ref : new Identifier(t.getLine(), new Name(t.getLexeme()));
		case WORLD:
		case AGENT:
			return handleRef(t);
		case INT:
			return new Literal(t.getLine(), LiteralKind.INT, t.getLexeme());
		case STR:
			return new Literal(t.getLine(), LiteralKind.STRING, unquote(t.getLexeme()));
		case BOOL:
			return new Literal(t.getLine(), LiteralKind.BOOL, t.getLexeme());
		case DIR:
			return new Literal(t.getLine(), LiteralKind.DIR, t.getLexeme());
		default:
			throw new IllegalStateException("Unexpected primary token: " + t);
		}
	}

	/**
	 * Remove the surrounding quotes of a string literal and decode its escape
	 * sequences. An unknown escape keeps the escaped character.
	 *
	 * @param lexeme string literal as written, quotes included
	 * @return the string value
	 */
	static String unquote(String lexeme) {
		String body = lexeme;
		if (body.length() >= 2 && body.charAt(0) == '"' && body.charAt(body.length() - 1) == '"') {
			body = body.substring(1, body.length() - 1);
		}
		StringBuilder sb = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				char next = body.charAt(++i);
				switch (next) {
				case 'n':
					sb.append('\n');
					break;
				case 't':
					sb.append('\t');
					break;
				default:
					sb.append(next);
					break;
				}
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	private static void expectLabel(CstNode node, String label) {
		if (node == null || !label.equals(node.getLabel())) {
			throw new IllegalStateException("Expected a " + label + " node, got " + node);
		}
	}
}
