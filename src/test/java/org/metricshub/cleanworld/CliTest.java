package org.metricshub.cleanworld;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.cleanworld.CleanWorldTestSupport.cliTest;
import static org.metricshub.cleanworld.CleanWorldTestSupport.mainProgram;

import org.junit.Test;
import org.metricshub.cleanworld.CleanWorldTestSupport.TestResult;
import org.metricshub.cleanworld.frontend.ScriptLexer;
import org.metricshub.cleanworld.frontend.TokenListing;
import org.metricshub.cleanworld.util.CleanSettings;
import org.metricshub.cleanworld.util.ScriptFileSource;

public class CliTest {

	private static final String HELLO = mainProgram("print(\"hello\");");

	@Test
	public void testRunProgram() throws Exception {
		cliTest("hello").program(HELLO).expect("hello\n").runAndAssert();
	}

	@Test
	public void testRunWithDashF() throws Exception {
		cliTest("-f").args("--seed", "4", "--max-iterations", "10", "-f").program(HELLO).expect("hello\n").runAndAssert();
	}

	@Test
	public void testCheckOnly() throws Exception {
		cliTest("--check")
				.args("--check")
				.program(HELLO)
				.expect("Static semantics check: SUCCESS\n")
				.runAndAssert();
		cliTest("-c").args("-c").program(HELLO).expect("Static semantics check: SUCCESS\n").runAndAssert();
	}

	@Test
	public void testDumpTokensDoesNotRun() throws Exception {
		TestResult result = cliTest("--dump-tokens").args("--dump-tokens").program(HELLO).run();
		result.assertExpected();
		assertEquals(TokenListing.format(ScriptLexer.tokenize(HELLO)), result.output());
		assertFalse(result.output().contains("hello\n"));
	}

	@Test
	public void testDumpCstAndAst() throws Exception {
		TestResult result = cliTest("--dump-cst --dump-ast").args("--dump-cst", "--dump-ast").program(HELLO).run();
		result.assertExpected();
		String[] lines = result.lines();
		assertEquals("program", lines[0]);
		assertTrue(result.output().contains("  [PROGRAM] 'program'\n"));
		assertTrue(result.output().contains("Program t [line 1]"));
		assertTrue(result.output().contains("Literal \"hello\" [line 3] : string"));
	}

	@Test
	public void testTokenFile() throws Exception {
		cliTest("-T")
				.tokens(TokenListing.format(ScriptLexer.tokenize(mainProgram("print(6 * 7);"))))
				.expect("42\n")
				.runAndAssert();
	}

	@Test
	public void testInvalidTokenFile() throws Exception {
		TestResult result = cliTest("bad token listing").tokens("1 0 PROGRAM program\n1 1 FLOAT 1.5\n").expectExit(1).run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("IOException: Invalid token file "));
		assertTrue(result.errorOutput(), result.errorOutput().contains("Unknown token kind 'FLOAT' in token listing row 2"));
		assertFalse(result.errorOutput(), result.errorOutput().contains("Failed to parse arguments"));
		assertEquals("", result.output());
	}

	@Test
	public void testSyntaxErrorReport() throws Exception {
		TestResult result = cliTest("syntax error").program("program p begin", "func main() begin", "print(1)", "end", "end").expectExit(1).run();
		result.assertExpected();
		assertEquals("ParserException (line 4): Expected 'SEMI', got 'END' ('end')\n", result.errorOutput().replace("\r\n", "\n"));
		assertEquals("", result.output());
	}

	@Test
	public void testSemanticErrorReport() throws Exception {
		TestResult result = cliTest("semantic error").args("--check").program(mainProgram("break;")).expectExit(1).run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("SemanticException (line 3): cannot break; not within a loop"));
		assertEquals("", result.output());
	}

	@Test
	public void testRuntimeErrorReport() throws Exception {
		TestResult result = cliTest("runtime error").program(mainProgram("print(1);", "print(1 / 0);")).expectExit(1).run();
		result.assertExpected();
		assertEquals("1\n", result.output());
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("CleanRuntimeException (line 4): Division by zero"));
	}

	@Test
	public void testLoopCapOption() throws Exception {
		TestResult result = cliTest("--max-iterations")
				.args("--max-iterations", "3")
				.program(mainProgram("while true do end"))
				.expectExit(1)
				.run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().contains("maximum iterations (3)"));
	}

	@Test
	public void testUsage() throws Exception {
		TestResult result = cliTest("no arguments").run();
		result.assertExpected();
		assertEquals("Usage:", result.lines()[0]);
		TestResult help = cliTest("-h").args("-h").run();
		help.assertExpected();
		assertEquals(result.output(), help.output());
	}

	@Test
	public void testBadArguments() throws Exception {
		TestResult unknown = cliTest("unknown").args("--bogus").expectExit(1).run();
		unknown.assertExpected();
		assertTrue(unknown.errorOutput(), unknown.errorOutput().contains("Unknown parameter: --bogus"));
		cliTest("help with others").args("-h", "--check").expectExit(1).runAndAssert();
		cliTest("missing value").args("--seed").expectExit(1).runAndAssert();
		cliTest("not a number").args("--max-iterations", "many").program(HELLO).expectExit(1).runAndAssert();
		cliTest("zero cap").args("--max-iterations", "0").program(HELLO).expectExit(1).runAndAssert();
		cliTest("no program").args("--check").expectExit(1).runAndAssert();
		cliTest("two programs").args("a.clean").program(HELLO).expectExit(1).runAndAssert();
		cliTest("program and tokens").tokens("1 20 PROGRAM program").program(HELLO).expectExit(1).runAndAssert();
	}

	@Test
	public void testMissingFile() throws Exception {
		TestResult result = cliTest("missing file").args("/nonexistent/dir/none.clean").expectExit(1).run();
		result.assertExpected();
		assertTrue(result.errorOutput(), result.errorOutput().contains("none.clean"));
	}

	@Test
	public void testParseCommandLineArguments() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "--seed", "9", "--max-iterations", "50", "-c", "prog.clean" });
		CleanSettings settings = cli.getSettings();
		assertEquals(9, settings.getRandomSeed());
		assertEquals(50, settings.getMaxLoopIterations());
		assertTrue(cli.isCheckOnly());
		assertEquals("prog.clean", ((ScriptFileSource) cli.getScriptSource()).getFilePath());
		assertNull(cli.getTokenFile());
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "" }));
	}
}
