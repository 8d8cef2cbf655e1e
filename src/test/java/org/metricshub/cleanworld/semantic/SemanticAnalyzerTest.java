package org.metricshub.cleanworld.semantic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.cleanworld.ast.AssignStmt;
import org.metricshub.cleanworld.ast.BinaryOp;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.ast.SemanticType;
import org.metricshub.cleanworld.frontend.CleanParser;
import org.metricshub.cleanworld.frontend.CstToAst;
import org.metricshub.cleanworld.frontend.ScriptLexer;

public class SemanticAnalyzerTest {

	private static Program build(String source) {
		return new CstToAst().transform(new CleanParser(ScriptLexer.tokenize(source)).parse());
	}

	private static SymbolTable analyze(String source) {
		return new SemanticAnalyzer().analyze(build(source));
	}

	private static String inMain(String... statements) {
		return "program t begin\nvar x;\nfunc main() begin\n" + String.join("\n", statements) + "\nend\nend";
	}

	private static SemanticException rejected(String source) {
		return assertThrows(SemanticException.class, () -> analyze(source));
	}

	private static void assertRejected(String source, String messagePart, int line) {
		SemanticException e = rejected(source);
		assertTrue("message was: " + e.getMessage(), e.getMessage().contains(messagePart));
		assertEquals("line of: " + e.getMessage(), line, e.getLineNumber());
	}

	@Test
	public void testWellFormedProgram() {
		SymbolTable global = analyze(
				"program demo begin\n"
						+ "var steps;\n"
						+ "func sweep(n: int): int begin\n"
						+ "  while n > 0 && !front_is_blocked(agent) do\n"
						+ "    move_forward(agent);\n"
						+ "    if is_dirty(agent) then clean(agent); end\n"
						+ "    n = n - 1;\n"
						+ "  end\n"
						+ "  return dirt_remaining(world);\n"
						+ "end\n"
						+ "func main() begin\n"
						+ "  world = init_world(10, 8);\n"
						+ "  agent = set_agent(world, 1, 1, E);\n"
						+ "  steps = sweep(20);\n"
						+ "  print(\"left: \");\n"
						+ "  print(steps);\n"
						+ "end\n"
						+ "end");
		Symbol steps = global.lookup(new Name("STEPS"));
		assertNotNull(steps);
		assertEquals(SymbolKind.VARIABLE, steps.getKind());
		assertEquals(SemanticType.INT, steps.getType());
		Symbol sweep = global.lookup(new Name("sweep"));
		assertEquals(SymbolKind.FUNCTION, sweep.getKind());
		assertEquals(SemanticType.INT, sweep.getSignature().getReturnType());
		assertEquals(SemanticType.WORLD, global.lookup(SymbolTable.WORLD).getType());
		assertNull(global.lookup(new Name("n")));
	}

	@Test
	public void testExpressionsAreAnnotated() {
		Program program = build(inMain("x = 1 + 2 * 3;"));
		new SemanticAnalyzer().analyze(program);
		AssignStmt assign = (AssignStmt) program.getMain().getBody().getStatements().get(0);
		assertEquals(SemanticType.INT, assign.getValue().getType());
		assertEquals(SemanticType.INT, ((BinaryOp) assign.getValue()).getRight().getType());
		assertEquals(SemanticType.INT, assign.getTarget().getType());
	}

	@Test
	public void testFunctionUsedBeforeDefinition() {
		analyze("program t begin\nfunc a(): int begin return b(); end\nfunc b(): int begin return a(); end\nfunc main() begin print(a()); end\nend");
	}

	@Test
	public void testCaseInsensitiveNames() {
		analyze("program t begin\nvar Total;\nfunc Twice(Count: int): int begin return COUNT * 2; end\nfunc main() begin TOTAL = twice(total); end\nend");
	}

	@Test
	public void testUndeclaredIdentifier() {
		assertRejected(inMain("y = 1;"), "Undeclared identifier 'y'", 4);
		assertRejected(inMain("print(y);"), "Undeclared identifier 'y'", 4);
	}

	@Test
	public void testUndeclaredFunction() {
		assertRejected(inMain("go(agent);"), "Undeclared function 'go'", 4);
	}

	@Test
	public void testProcedureInExpression() {
		assertRejected(inMain("x = move_forward(agent);"), "Procedure 'move_forward' used in expression", 4);
	}

	@Test
	public void testDiscardedResultIsAllowed() {
		analyze(inMain("world = init_world(5, 5);", "dirt_remaining(world);"));
	}

	@Test
	public void testArity() {
		assertRejected(inMain("world = init_world(5);"), "'init_world' expects 2 args, got 1", 4);
	}

	@Test
	public void testArgumentTypes() {
		assertRejected(inMain("world = init_world(5, true);"), "Arg 2 of 'init_world' expects int, got bool", 4);
		assertRejected(inMain("clean(world);"), "Arg 1 of 'clean' expects agent, got world", 4);
	}

	@Test
	public void testDirectionMustBeALiteral() {
		assertRejected(inMain("agent = set_agent(world, 1, 1, \"X\");"), "must be a direction literal", 4);
		assertRejected(inMain("agent = set_agent(world, 1, 1, x);"), "Arg 4 of 'set_agent'", 4);
	}

	@Test
	public void testPrintableTypes() {
		analyze(inMain("print(1);", "print(true);", "print(\"s\");", "print(N);"));
		assertRejected(inMain("print(world);"), "Cannot print type 'world'", 4);
	}

	@Test
	public void testConditionsMustBeBool() {
		assertRejected(inMain("if x then end"), "If condition must be bool, got int", 4);
		assertRejected(inMain("while \"a\" do end"), "While condition must be bool, got string", 4);
	}

	@Test
	public void testBreakOutsideLoop() {
		assertRejected(inMain("break;"), "cannot break; not within a loop", 4);
		assertRejected(
				"program t begin\nfunc f() begin\nbreak;\nend\nfunc main() begin while true do f(); end end\nend",
				"cannot break",
				3);
		analyze(inMain("while true do if x > 1 then break; end end"));
	}

	@Test
	public void testReturnRules() {
		assertRejected(
				"program t begin\nfunc f() begin\nreturn 1;\nend\nfunc main() begin end\nend",
				"Void function 'f' cannot return a value",
				3);
		assertRejected(
				"program t begin\nfunc f(): int begin\nreturn;\nend\nfunc main() begin end\nend",
				"Function 'f' must return int",
				3);
		assertRejected(
				"program t begin\nfunc f(): int begin\nreturn true;\nend\nfunc main() begin end\nend",
				"expected int, got bool",
				3);
		analyze(inMain("return;"));
	}

	@Test
	public void testOperators() {
		assertRejected(inMain("x = 1 + true;"), "requires int operands", 4);
		assertRejected(inMain("if 1 == \"1\" then end"), "requires operands of the same type", 4);
		assertRejected(inMain("if 1 && true then end"), "requires bool operands", 4);
		assertRejected(inMain("if !1 then end"), "Operator ! requires bool", 4);
		assertRejected(inMain("x = -true;"), "requires int", 4);
		analyze(inMain("if \"a\" < \"b\" then end", "if N == E then end"));
	}

	@Test
	public void testRedeclarations() {
		assertRejected("program t begin\nvar a;\nvar A;\nfunc main() begin end\nend", "Redeclaration of 'A'", 3);
		assertRejected("program t begin\nvar f;\nfunc f() begin end\nfunc main() begin end\nend", "Redeclaration of 'f'", 3);
		assertRejected("program t begin\nvar World;\nfunc main() begin end\nend", "Redeclaration of 'World'", 2);
	}

	@Test
	public void testDuplicateParameter() {
		assertRejected(
				"program t begin\nfunc f(a: int, A: bool) begin end\nfunc main() begin end\nend",
				"multiply defined parameter A in function f",
				2);
	}

	@Test
	public void testBuiltinCannotBeRedefined() {
		assertRejected("program t begin\nfunc clean(a: int) begin end\nfunc main() begin end\nend", "Cannot redefine built-in 'clean'", 2);
	}

	@Test
	public void testFunctionIsNotAVariable() {
		String header = "program t begin\nfunc f(): int begin return 1; end\nfunc main() begin\n";
		assertRejected(header + "print(f);\nend\nend", "cannot use f as a variable; it is a function", 4);
		assertRejected(header + "f = 2;\nend\nend", "Cannot assign to 'f'", 4);
	}

	@Test
	public void testParameterShadowsGlobal() {
		analyze("program t begin\nvar x;\nfunc f(x: bool) begin if x then end end\nfunc main() begin f(true); end\nend");
	}

	@Test
	public void testMainIsCheckedFirst() {
		SemanticException e = rejected(
				"program t begin\nfunc f() begin\nbreak;\nend\nfunc main() begin\nprint(y);\nend\nend");
		assertEquals(6, e.getLineNumber());
	}
}
