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
import java.util.Locale;

/**
 * Converts a CleanWorld token stream into a concrete syntax tree.
 * <p>
 * This is a recursive descent parser with one method per grammar rule. It
 * looks at the current token and, in three places, at the token after it:
 * to tell an assignment from a call statement, a call from a bare identifier
 * in a primary, and to find the <code>func main</code> boundary among the
 * top-level declarations.
 * <p>
 * The first syntax error throws a {@link ParserException}; there is no error
 * recovery.
 */
public class CleanParser {

	private final List<Token> tokens;
	private int index;

	/**
	 * @param tokens token stream to parse
	 */
	public CleanParser(List<Token> tokens) {
		this.tokens = tokens == null ? Collections.<Token>emptyList() : new ArrayList<Token>(tokens);
	}

	/**
	 * Parse the token stream. Build and return the root of the concrete
	 * syntax tree which represents the program.
	 *
	 * @return The concrete syntax tree of this program.
	 * @throws ParserException upon the first syntax error, on an empty token
	 *         stream, or when tokens remain after the program
	 */
	public CstNode parse() {
		if (tokens.isEmpty()) {
			throw new ParserException(-1, "'PROGRAM'", "empty token stream");
		}
		index = 0;
		CstNode program = PROGRAM();
		if (current() != null) {
			throw new ParserException(current().getLine(), "end of input after program", describe(current()));
		}
		return program;
	}

	// SUPPORTING FUNCTIONS/METHODS

	private Token current() {
		return index < tokens.size() ? tokens.get(index) : null;
	}

	private Token lookahead(int distance) {
		int i = index + distance;
		return i < tokens.size() ? tokens.get(i) : null;
	}

	private boolean peek(TokenKind kind) {
		Token t = current();
		return t != null && t.getKind() == kind;
	}

	private boolean peekAny(TokenKind... kinds) {
		for (TokenKind kind : kinds) {
			if (peek(kind)) {
				return true;
			}
		}
		return false;
	}

	private Token expect(TokenKind kind) {
		return expect(kind, null);
	}

	private Token expect(TokenKind kind, String lexeme) {
		Token t = current();
		if (t != null && t.getKind() == kind && (lexeme == null || t.getLexeme().equals(lexeme))) {
			index++;
			return t;
		}
		String expected = "'" + kind + "'";
		if (lexeme != null) {
			expected += " ('" + lexeme + "')";
		}
		throw error(expected);
	}

	// only int, bool and string can be written in a declaration
	private Token expectDeclarableType() {
		Token t = current();
		if (t != null && t.getKind() == TokenKind.TYPE) {
			String name = t.getLexeme().toLowerCase(Locale.ROOT);
			if ("int".equals(name) || "bool".equals(name) || "string".equals(name)) {
				index++;
				return t;
			}
		}
		throw error("'TYPE' (int, bool or string)");
	}

	private Token advance() {
		Token t = current();
		index++;
		return t;
	}

	private ParserException error(String expected) {
		Token t = current();
		if (t == null) {
			int line = tokens.get(tokens.size() - 1).getLine();
			return new ParserException(line, expected, "end of input");
		}
		return new ParserException(t.getLine(), expected, describe(t));
	}

	private static String describe(Token t) {
		return "'" + t.getKind() + "' ('" + t.getLexeme() + "')";
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : program ID begin TOP_ITEMS MAIN_DECL end
	CstNode PROGRAM() {
		CstNode node = new CstNode("program");
		node.add(expect(TokenKind.PROGRAM));
		node.add(expect(TokenKind.ID));
		node.add(expect(TokenKind.BEGIN));
		node.add(TOP_ITEMS());
		node.add(MAIN_DECL());
		node.add(expect(TokenKind.END));
		return node;
	}

	// TOP_ITEMS : ( VAR_DECL | FUNC_DECL )*
	// stops in front of "func main"
	CstNode TOP_ITEMS() {
		CstNode node = new CstNode("top_items");
		while (peekAny(TokenKind.VAR, TokenKind.FUNC)) {
			if (peek(TokenKind.VAR)) {
				node.add(VAR_DECL());
			} else {
				Token next = lookahead(1);
				if (next != null && "main".equals(next.getLexeme())) {
					break;
				}
				node.add(FUNC_DECL());
			}
		}
		return node;
	}

	// MAIN_DECL : func main ( ) begin STMT_LIST end
	CstNode MAIN_DECL() {
		CstNode node = new CstNode("main_decl");
		node.add(expect(TokenKind.FUNC));
		node.add(expect(TokenKind.ID, "main"));
		node.add(expect(TokenKind.LPAREN));
		node.add(expect(TokenKind.RPAREN));
		node.add(expect(TokenKind.BEGIN));
		node.add(STMT_LIST());
		node.add(expect(TokenKind.END));
		return node;
	}

	// VAR_DECL : var ID_LIST ;
	CstNode VAR_DECL() {
		CstNode node = new CstNode("var_decl");
		node.add(expect(TokenKind.VAR));
		node.add(ID_LIST());
		node.add(expect(TokenKind.SEMI));
		return node;
	}

	// ID_LIST : ID ( , ID )*
	CstNode ID_LIST() {
		CstNode node = new CstNode("id_list");
		node.add(expect(TokenKind.ID));
		while (peek(TokenKind.COMMA)) {
			node.add(expect(TokenKind.COMMA));
			node.add(expect(TokenKind.ID));
		}
		return node;
	}

	// FUNC_DECL : func ID ( [PARAMS] ) [: TYPE] begin STMT_LIST end
	CstNode FUNC_DECL() {
		CstNode node = new CstNode("func_decl");
		node.add(expect(TokenKind.FUNC));
		node.add(expect(TokenKind.ID));
		node.add(expect(TokenKind.LPAREN));
		if (!peek(TokenKind.RPAREN)) {
			node.add(PARAMS());
		}
		node.add(expect(TokenKind.RPAREN));
		if (peek(TokenKind.COLON)) {
			node.add(expect(TokenKind.COLON));
			node.add(expectDeclarableType());
		}
		node.add(expect(TokenKind.BEGIN));
		node.add(STMT_LIST());
		node.add(expect(TokenKind.END));
		return node;
	}

	// PARAMS : PARAM ( , PARAM )*
	CstNode PARAMS() {
		CstNode node = new CstNode("params");
		node.add(PARAM());
		while (peek(TokenKind.COMMA)) {
			node.add(expect(TokenKind.COMMA));
			node.add(PARAM());
		}
		return node;
	}

	// PARAM : ID : TYPE
	CstNode PARAM() {
		CstNode node = new CstNode("param");
		node.add(expect(TokenKind.ID));
		node.add(expect(TokenKind.COLON));
		node.add(expectDeclarableType());
		return node;
	}

	// STMT_LIST : STMT*
	CstNode STMT_LIST() {
		CstNode node = new CstNode("stmt_list");
		while (peekAny(
				TokenKind.ID,
				TokenKind.PRINT,
				TokenKind.IF,
				TokenKind.WHILE,
				TokenKind.BREAK,
				TokenKind.RETURN,
				TokenKind.WORLD,
				TokenKind.AGENT)) {
			node.add(STMT());
		}
		return node;
	}

	// STMT : PRINT_STMT | IF_STMT | WHILE_STMT | BREAK_STMT | RETURN_STMT | ASSIGN_STMT | CALL_STMT
	CstNode STMT() {
		CstNode node = new CstNode("stmt");
		if (peek(TokenKind.PRINT)) {
			node.add(PRINT_STMT());
		} else if (peek(TokenKind.IF)) {
			node.add(IF_STMT());
		} else if (peek(TokenKind.WHILE)) {
			node.add(WHILE_STMT());
		} else if (peek(TokenKind.BREAK)) {
			node.add(BREAK_STMT());
		} else if (peek(TokenKind.RETURN)) {
			node.add(RETURN_STMT());
		} else if (peekAny(TokenKind.WORLD, TokenKind.AGENT)) {
			node.add(ASSIGN_STMT());
		} else if (peek(TokenKind.ID)) {
			Token next = lookahead(1);
			if (next != null && next.getKind() == TokenKind.ASSIGN) {
				node.add(ASSIGN_STMT());
			} else if (next != null && next.getKind() == TokenKind.LPAREN) {
				node.add(CALL_STMT());
			} else {
				index++;
				throw error("'ASSIGN' or 'LPAREN' after identifier");
			}
		} else {
			throw error("a statement");
		}
		return node;
	}

	// ASSIGN_STMT : ( ID | world | agent ) = EXPR ;
	CstNode ASSIGN_STMT() {
		CstNode node = new CstNode("assign_stmt");
		if (peekAny(TokenKind.WORLD, TokenKind.AGENT)) {
			node.add(advance());
		} else {
			node.add(expect(TokenKind.ID));
		}
		node.add(expect(TokenKind.ASSIGN));
		node.add(EXPR());
		node.add(expect(TokenKind.SEMI));
		return node;
	}

	// CALL_STMT : ID ( [ARGS] ) ;
	CstNode CALL_STMT() {
		CstNode node = new CstNode("call_stmt");
		node.add(expect(TokenKind.ID));
		node.add(expect(TokenKind.LPAREN));
		if (!peek(TokenKind.RPAREN)) {
			node.add(ARGS());
		}
		node.add(expect(TokenKind.RPAREN));
		node.add(expect(TokenKind.SEMI));
		return node;
	}

	// PRINT_STMT : print ( EXPR ) ;
	CstNode PRINT_STMT() {
		CstNode node = new CstNode("print_stmt");
		node.add(expect(TokenKind.PRINT));
		node.add(expect(TokenKind.LPAREN));
		node.add(EXPR());
		node.add(expect(TokenKind.RPAREN));
		node.add(expect(TokenKind.SEMI));
		return node;
	}

	// IF_STMT : if EXPR then STMT_LIST [ else ( IF_STMT | STMT_LIST end ) | end ]
	// an "else if" chain is closed by the innermost if
	CstNode IF_STMT() {
		CstNode node = new CstNode("if_stmt");
		node.add(expect(TokenKind.IF));
		node.add(EXPR());
		node.add(expect(TokenKind.THEN));
		node.add(STMT_LIST());
		if (peek(TokenKind.ELSE)) {
			node.add(expect(TokenKind.ELSE));
			if (peek(TokenKind.IF)) {
				node.add(IF_STMT());
				return node;
			}
			node.add(STMT_LIST());
		}
		node.add(expect(TokenKind.END));
		return node;
	}

	// WHILE_STMT : while EXPR do STMT_LIST end
	CstNode WHILE_STMT() {
		CstNode node = new CstNode("while_stmt");
		node.add(expect(TokenKind.WHILE));
		node.add(EXPR());
		node.add(expect(TokenKind.DO));
		node.add(STMT_LIST());
		node.add(expect(TokenKind.END));
		return node;
	}

	// BREAK_STMT : break ;
	CstNode BREAK_STMT() {
		CstNode node = new CstNode("break_stmt");
		node.add(expect(TokenKind.BREAK));
		node.add(expect(TokenKind.SEMI));
		return node;
	}

	// RETURN_STMT : return [EXPR] ;
	CstNode RETURN_STMT() {
		CstNode node = new CstNode("return_stmt");
		node.add(expect(TokenKind.RETURN));
		if (!peek(TokenKind.SEMI)) {
			node.add(EXPR());
		}
		node.add(expect(TokenKind.SEMI));
		return node;
	}

	// ARGS : EXPR ( , EXPR )*
	CstNode ARGS() {
		CstNode node = new CstNode("args");
		node.add(EXPR());
		while (peek(TokenKind.COMMA)) {
			node.add(expect(TokenKind.COMMA));
			node.add(EXPR());
		}
		return node;
	}

	// EXPR : OR_EXPR
	CstNode EXPR() {
		CstNode node = new CstNode("expr");
		node.add(OR_EXPR());
		return node;
	}

	// OR_EXPR : AND_EXPR ( || AND_EXPR )*
	CstNode OR_EXPR() {
		CstNode node = new CstNode("or_expr");
		node.add(AND_EXPR());
		while (peek(TokenKind.OR)) {
			node.add(expect(TokenKind.OR));
			node.add(AND_EXPR());
		}
		return node;
	}

	// AND_EXPR : REL_EXPR ( && REL_EXPR )*
	CstNode AND_EXPR() {
		CstNode node = new CstNode("and_expr");
		node.add(REL_EXPR());
		while (peek(TokenKind.AND)) {
			node.add(expect(TokenKind.AND));
			node.add(REL_EXPR());
		}
		return node;
	}

	// REL_EXPR : ADD_EXPR [ (==|!=|<|<=|>|>=) ADD_EXPR ]
	// comparisons do not chain
	CstNode REL_EXPR() {
		CstNode node = new CstNode("rel_expr");
		node.add(ADD_EXPR());
		Token t = current();
		if (t != null && t.getKind().isRelational()) {
			node.add(advance());
			node.add(ADD_EXPR());
		}
		return node;
	}

	// ADD_EXPR : MUL_EXPR ( (+|-) MUL_EXPR )*
	CstNode ADD_EXPR() {
		CstNode node = new CstNode("add_expr");
		node.add(MUL_EXPR());
		while (peekAny(TokenKind.PLUS, TokenKind.MINUS)) {
			node.add(advance());
			node.add(MUL_EXPR());
		}
		return node;
	}

	// MUL_EXPR : UNARY ( (*|/) UNARY )*
	CstNode MUL_EXPR() {
		CstNode node = new CstNode("mul_expr");
		node.add(UNARY());
		while (peekAny(TokenKind.STAR, TokenKind.SLASH)) {
			node.add(advance());
			node.add(UNARY());
		}
		return node;
	}

	// UNARY : (!|-|+) UNARY | PRIMARY
	CstNode UNARY() {
		CstNode node = new CstNode("unary");
		if (peekAny(TokenKind.NOT, TokenKind.MINUS, TokenKind.PLUS)) {
			node.add(advance());
			node.add(UNARY());
		} else {
			node.add(PRIMARY());
		}
		return node;
	}

	// PRIMARY : ( EXPR ) | ID ( [ARGS] ) | ID | INT | STR | BOOL | DIR | world | agent
	CstNode PRIMARY() {
		CstNode node = new CstNode("primary");
		Token t = current();
		if (t == null) {
			throw error("an expression");
		}
		switch (t.getKind()) {
		case LPAREN:
			node.add(expect(TokenKind.LPAREN));
			node.add(EXPR());
			node.add(expect(TokenKind.RPAREN));
			break;
		case ID:
			node.add(advance());
			Token next = current();
			if (next != null && next.getKind() == TokenKind.LPAREN) {
				node.add(expect(TokenKind.LPAREN));
				if (!peek(TokenKind.RPAREN)) {
					node.add(ARGS());
				}
				node.add(expect(TokenKind.RPAREN));
			}
			break;
		case INT:
		case STR:
		case BOOL:
		case DIR:
		case WORLD:
		case AGENT:
			node.add(advance());
			break;
		default:
			throw error("an expression");
		}
		return node;
	}

	// CHECKSTYLE.ON: MethodName
}
