package org.metricshub.cleanworld;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.metricshub.cleanworld.CleanWorldTestSupport.mainProgram;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.ast.SemanticType;
import org.metricshub.cleanworld.backend.ExecutionContext;
import org.metricshub.cleanworld.frontend.ParserException;
import org.metricshub.cleanworld.semantic.SemanticException;
import org.metricshub.cleanworld.util.CleanSettings;
import org.metricshub.cleanworld.util.ScriptSource;

public class CleanWorldTest {

	@Test
	public void testRun() {
		assertEquals("3\n", new CleanWorld().run(mainProgram("print(1 + 2);")));
	}

	@Test
	public void testStagesKeepTheirTrees() {
		CleanWorld cleanWorld = new CleanWorld();
		Program program = cleanWorld.compile(mainProgram("print(true);"));
		assertNotNull(cleanWorld.getLastCst());
		assertEquals("program", cleanWorld.getLastCst().getLabel());
		assertEquals(program, cleanWorld.getLastAst());
		assertEquals(SemanticType.VOID, program.getMain().getType());
	}

	@Test
	public void testSemanticErrorKeepsUncheckedTree() {
		CleanWorld cleanWorld = new CleanWorld();
		assertThrows(SemanticException.class, () -> cleanWorld.compile(mainProgram("print(undeclared);")));
		assertNotNull(cleanWorld.getLastAst());
		assertNull(cleanWorld.getLastAst().getMain().getType());
	}

	@Test
	public void testSyntaxErrorClearsTrees() {
		CleanWorld cleanWorld = new CleanWorld();
		cleanWorld.compile(mainProgram("print(1);"));
		assertThrows(ParserException.class, () -> cleanWorld.compile("program p begin"));
		assertNull(cleanWorld.getLastCst());
		assertNull(cleanWorld.getLastAst());
	}

	@Test
	public void testInvokeScriptSource() throws Exception {
		ScriptSource source = new ScriptSource(
				ScriptSource.DESCRIPTION_INLINE_SCRIPT,
				new StringReader("program p begin var n; func main() begin n = 6 * 7; end end"));
		CleanSettings settings = new CleanSettings();
		ExecutionContext context = new CleanWorld().invoke(source, settings);
		assertEquals(Long.valueOf(42), context.getGlobal("n"));
		assertEquals(1, context.getGlobals().size());
	}

	@Test
	public void testSameSeedSameRun() {
		String program = mainProgram("world = init_world(9, 7);", "print(dirt_remaining(world));");
		CleanSettings first = new CleanSettings();
		first.setRandomSeed(11);
		CleanSettings second = new CleanSettings();
		second.setRandomSeed(11);
		assertEquals(new CleanWorld().run(program, first), new CleanWorld().run(program, second));
	}

	@Test
	public void testRunKeepsCallerSettings() {
		ByteArrayOutputStream callerOut = new ByteArrayOutputStream();
		PrintStream callerStream = new PrintStream(callerOut, true, StandardCharsets.UTF_8);
		CleanSettings settings = new CleanSettings();
		settings.setOutputStream(callerStream);
		settings.setMaxLoopIterations(5);
		String program = "program p begin var i; func main() begin while i < 5 do i = i + 1; end print(i); end end";
		assertEquals("5\n", new CleanWorld().run(program, settings));
		assertSame(callerStream, settings.getOutputStream());
		assertEquals(0, callerOut.size());
		assertEquals(5, settings.getMaxLoopIterations());
	}
}
