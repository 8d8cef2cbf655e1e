package org.metricshub.cleanworld.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class CleanParserTest {

	private static final String SAMPLE = String
			.join(
					"\n",
					"program sample begin",
					"  var count, total;",
					"  func add(a: int, b: int): int begin",
					"    return a + b;",
					"  end",
					"  func main() begin",
					"    world = init_world(8, 6);",
					"    agent = set_agent(world, 1, 1, E);",
					"    while !front_is_blocked(agent) do",
					"      move_forward(agent);",
					"      count = add(count, 1);",
					"      if count > 3 then break; end",
					"    end",
					"    if count == 0 then print(\"none\"); else if count < 2 then print(\"one\"); else print(count); end",
					"  end",
					"end");

	private static CstNode parse(String source) {
		return new CleanParser(ScriptLexer.tokenize(source)).parse();
	}

	private static ParserException parseError(String source) {
		return assertThrows(ParserException.class, () -> parse(source));
	}

	@Test
	public void testLeavesAreTheTokens() {
		List<Token> tokens = ScriptLexer.tokenize(SAMPLE);
		CstNode root = new CleanParser(tokens).parse();
		assertEquals("program", root.getLabel());
		assertEquals(tokens, root.leaves());
	}

	@Test
	public void testTopLevelShape() {
		CstNode root = parse(SAMPLE);
		CstNode topItems = root.node(3);
		assertEquals("top_items", topItems.getLabel());
		assertEquals(2, topItems.size());
		assertEquals("var_decl", topItems.node(0).getLabel());
		assertEquals("func_decl", topItems.node(1).getLabel());
		assertEquals("main_decl", root.node(4).getLabel());
	}

	@Test
	public void testElseIfNestsTheIf() {
		CstNode root = parse(
				"program p begin func main() begin\n"
						+ "if true then print(1); else if false then print(2); else print(3); end\n"
						+ "end end");
		CstNode ifStmt = root.node(4).find("stmt_list").node(0).node(0);
		assertEquals("if_stmt", ifStmt.getLabel());
		assertEquals(6, ifStmt.size());
		assertEquals("if_stmt", ifStmt.node(5).getLabel());
	}

	@Test
	public void testRelationalDoesNotChain() {
		ParserException e = parseError("program p begin func main() begin print(1 < 2 < 3); end end");
		assertEquals("'RPAREN'", e.getExpected());
		assertTrue(e.getActual(), e.getActual().contains("LT"));
	}

	@Test
	public void testMissingSemicolon() {
		ParserException e = parseError("program p begin\nfunc main() begin\nprint(1)\nend\nend");
		assertEquals(4, e.getLineNumber());
		assertEquals("'SEMI'", e.getExpected());
		assertEquals("'END' ('end')", e.getActual());
		assertEquals("Expected 'SEMI', got 'END' ('end')", e.getMessage());
	}

	@Test
	public void testBareIdentifierStatement() {
		ParserException e = parseError("program p begin func main() begin x; end end");
		assertEquals("'ASSIGN' or 'LPAREN' after identifier", e.getExpected());
	}

	@Test
	public void testMissingMain() {
		ParserException e = parseError("program p begin\nvar x;\nend");
		assertEquals(3, e.getLineNumber());
		assertEquals("'FUNC'", e.getExpected());
	}

	@Test
	public void testOtherFunctionIsNotMain() {
		ParserException e = parseError("program p begin func start() begin end end");
		assertEquals("'FUNC'", e.getExpected());
		assertEquals("'END' ('end')", e.getActual());
	}

	@Test
	public void testFunctionAfterMainIsTrailing() {
		ParserException e = parseError("program p begin func main() begin end end func f() begin end");
		assertEquals("end of input after program", e.getExpected());
	}

	@Test
	public void testEndOfInput() {
		ParserException e = parseError("program p begin\nfunc main() begin\nprint(");
		assertEquals("end of input", e.getActual());
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testEmptyTokenStream() {
		ParserException e = assertThrows(ParserException.class, () -> new CleanParser(Collections.<Token>emptyList()).parse());
		assertEquals(-1, e.getLineNumber());
		assertThrows(ParserException.class, () -> new CleanParser(null).parse());
	}

	@Test
	public void testErrorTokenIsReported() {
		ParserException e = parseError("program p begin func main() begin x = 1 @ 2; end end");
		assertTrue(e.getActual(), e.getActual().contains("ERROR"));
	}

	@Test
	public void testOptionalParts() {
		CstNode root = parse("program p begin func f() begin return; end func main() begin f(); end end");
		CstNode f = root.node(3).node(0);
		assertNull(f.find("params"));
		assertTrue(!f.hasToken(TokenKind.COLON));
		CstNode call = root.node(4).find("stmt_list").node(0).node(0);
		assertEquals("call_stmt", call.getLabel());
		assertNull(call.find("args"));
		assertNotNull(f.find("stmt_list"));
	}

	private static List<Token> withTypeLexeme(String source, String lexeme) {
		List<Token> tokens = new ArrayList<Token>();
		for (Token t : ScriptLexer.tokenize(source)) {
			if (t.getKind() == TokenKind.TYPE) {
				t = new Token(t.getLine(), TokenKind.TYPE, lexeme);
			}
			tokens.add(t);
		}
		return tokens;
	}

	@Test
	public void testUndeclarableTypeIsRejected() {
		String source = "program p begin\nfunc f(a: int) begin end\nfunc main() begin f(1); end end";
		for (String lexeme : new String[] { "float", "world", "agent", "void", "any" }) {
			List<Token> tokens = withTypeLexeme(source, lexeme);
			ParserException e = assertThrows(ParserException.class, () -> new CleanParser(tokens).parse());
			assertEquals("'TYPE' (int, bool or string)", e.getExpected());
			assertEquals("'TYPE' ('" + lexeme + "')", e.getActual());
			assertEquals(2, e.getLineNumber());
		}
	}

	@Test
	public void testReturnTypeIsChecked() {
		List<Token> tokens = withTypeLexeme("program p begin func f(): int begin return 1; end func main() begin end end", "dir");
		ParserException e = assertThrows(ParserException.class, () -> new CleanParser(tokens).parse());
		assertEquals("'TYPE' (int, bool or string)", e.getExpected());
	}
}
