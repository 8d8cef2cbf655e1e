package org.metricshub.cleanworld.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.cleanworld.CleanWorldTestSupport.cleanTest;
import static org.metricshub.cleanworld.CleanWorldTestSupport.mainProgram;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.cleanworld.CleanWorld;
import org.metricshub.cleanworld.CleanWorldTestSupport.TestResult;
import org.metricshub.cleanworld.jrt.Agent;
import org.metricshub.cleanworld.jrt.BSDRandom;
import org.metricshub.cleanworld.jrt.CleanRuntimeException;
import org.metricshub.cleanworld.jrt.Direction;
import org.metricshub.cleanworld.jrt.World;
import org.metricshub.cleanworld.util.CleanSettings;

public class InterpreterTest {

	@Test
	public void testPrecedence() throws Exception {
		cleanTest("precedence")
				.program(mainProgram("print(1 + 2 * 3);", "print((1 + 2) * 3);", "print(1 < 2 && 2 < 3);", "print(10 - 4 - 3);", "print(true || false && false);"))
				.expectLines("7", "9", "true", "3", "true")
				.runAndAssert();
	}

	@Test
	public void testDivisionRoundsTowardNegativeInfinity() throws Exception {
		cleanTest("floor division")
				.program(mainProgram("print(7 / 2);", "print(-7 / 2);", "print(7 / -2);", "print(-8 / 2);"))
				.expectLines("3", "-4", "-4", "-4")
				.runAndAssert();
	}

	@Test
	public void testDivisionByZero() throws Exception {
		cleanTest("division by zero")
				.program(mainProgram("print(1);", "print(5 / (3 - 3));"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("Division by zero")
				.atLine(4)
				.runAndAssert();
	}

	@Test
	public void testOverflow() throws Exception {
		cleanTest("overflow")
				.program(mainProgram("print(9223372036854775807 + 1);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("Integer overflow")
				.runAndAssert();
		cleanTest("largest literal")
				.program(mainProgram("print(-9223372036854775807 - 1);"))
				.expect("-9223372036854775808\n")
				.runAndAssert();
	}

	@Test
	public void testPrintValues() throws Exception {
		cleanTest("print values")
				.program(mainProgram("print(\"a\\tb\");", "print(S);", "print(false);", "print(\"abc\" < \"abd\");", "print(!true);"))
				.expectLines("a\tb", "S", "false", "true", "false")
				.runAndAssert();
	}

	@Test
	public void testGlobalsStartAtZero() throws Exception {
		TestResult result = cleanTest("globals")
				.program("program g begin", "var a, b;", "func main() begin", "b = b + 2;", "print(a);", "end", "end")
				.expectLines("0")
				.run();
		result.assertExpected();
		assertEquals(Long.valueOf(2), result.context().getGlobal("B"));
	}

	@Test
	public void testElseIfChain() throws Exception {
		cleanTest("else if")
				.program(
						"program p begin",
						"var i;",
						"func main() begin",
						"while i < 4 do",
						"if i == 0 then print(\"zero\");",
						"else if i == 1 then print(\"one\");",
						"else print(i); end",
						"i = i + 1;",
						"end",
						"end",
						"end")
				.expectLines("zero", "one", "2", "3")
				.runAndAssert();
	}

	@Test
	public void testLoopCapAllowsExactlyMaxIterations() throws Exception {
		TestResult result = cleanTest("loop cap reached, not exceeded")
				.program("program p begin", "var i;", "func main() begin", "while i < 10 do i = i + 1; end", "end", "end")
				.maxIterations(10)
				.run();
		result.assertExpected();
		assertEquals(Long.valueOf(10), result.context().getGlobal("i"));
	}

	@Test
	public void testLoopCapExceeded() throws Exception {
		cleanTest("loop cap exceeded")
				.program("program p begin", "var i;", "func main() begin", "while i < 10 do i = i + 1; end", "end", "end")
				.maxIterations(9)
				.expectThrow(CleanRuntimeException.class)
				.withMessage("While loop exceeded maximum iterations (9). Possible infinite loop.")
				.atLine(4)
				.runAndAssert();
	}

	@Test
	public void testInfiniteLoopIsStopped() throws Exception {
		cleanTest("infinite loop")
				.program(mainProgram("while true do end"))
				.maxIterations(1000)
				.expectThrow(CleanRuntimeException.class)
				.withMessage("maximum iterations (1000)")
				.runAndAssert();
	}

	@Test
	public void testDefaultLoopCap() throws Exception {
		CleanSettings settings = new CleanSettings();
		settings.setOutputStream(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
		assertEquals(100000, settings.getMaxLoopIterations());
		ExecutionContext context = new ExecutionContext(settings);
		CleanWorld cleanWorld = new CleanWorld();
		CleanRuntimeException e = assertThrows(
				CleanRuntimeException.class,
				() -> new Interpreter()
						.execute(
								cleanWorld.compile("program p begin\nvar i;\nfunc main() begin\nwhile true do i = i + 1; end\nend\nend\n"),
								context));
		assertTrue(e.getMessage(), e.getMessage().contains("maximum iterations (100000)"));
		assertEquals(4, e.getLineNumber());
		assertEquals(Long.valueOf(100000), context.getGlobal("i"));
	}

	@Test
	public void testBreakLeavesInnermostLoop() throws Exception {
		cleanTest("nested break")
				.program(
						"program p begin",
						"var i, j;",
						"func main() begin",
						"while i < 3 do",
						"j = 0;",
						"while true do",
						"if j == i then break; end",
						"j = j + 1;",
						"end",
						"print(j);",
						"i = i + 1;",
						"end",
						"end",
						"end")
				.expectLines("0", "1", "2")
				.runAndAssert();
	}

	@Test
	public void testParameterShadowsGlobal() throws Exception {
		cleanTest("shadowing")
				.program(
						"program p begin",
						"var x;",
						"func f(x: int) begin x = x + 99; print(x); end",
						"func main() begin",
						"x = 1;",
						"f(5);",
						"print(x);",
						"end",
						"end")
				.expectLines("104", "1")
				.runAndAssert();
	}

	@Test
	public void testFunctionWritesGlobal() throws Exception {
		cleanTest("global write")
				.program(
						"program p begin",
						"var total;",
						"func add(n: int) begin total = total + n; end",
						"func main() begin add(3); add(4); print(total); end",
						"end")
				.expect("7\n")
				.runAndAssert();
	}

	@Test
	public void testReturnFromNestedLoop() throws Exception {
		cleanTest("nested return")
				.program(
						"program p begin",
						"var i;",
						"func firstAbove(limit: int): int begin",
						"  i = 0;",
						"  while true do",
						"    while true do",
						"      if i * i > limit then return i; end",
						"      i = i + 1;",
						"    end",
						"  end",
						"  return -1;",
						"end",
						"func main() begin",
						"  print(firstAbove(50));",
						"  print(firstAbove(0));",
						"  print(\"done\");",
						"end",
						"end")
				.expectLines("8", "1", "done")
				.runAndAssert();
	}

	@Test
	public void testReturnWithoutValueEndsProcedure() throws Exception {
		cleanTest("early return")
				.program(
						"program p begin",
						"func f(b: bool) begin if b then return; end print(\"after\"); end",
						"func main() begin f(true); f(false); end",
						"end")
				.expectLines("after")
				.runAndAssert();
	}

	@Test
	public void testMissingReturnValue() throws Exception {
		cleanTest("no return value")
				.program(
						"program p begin",
						"func f(): int begin if false then return 1; end end",
						"func main() begin",
						"print(f());",
						"end",
						"end")
				.expectThrow(CleanRuntimeException.class)
				.withMessage("Function 'f' did not return a value")
				.atLine(4)
				.runAndAssert();
	}

	@Test
	public void testRecursion() throws Exception {
		cleanTest("recursion")
				.program(
						"program p begin",
						"func fact(n: int): int begin",
						"if n <= 1 then return 1; end",
						"return n * fact(n - 1);",
						"end",
						"func fib(n: int): int begin if n < 2 then return n; end return fib(n - 1) + fib(n - 2); end",
						"func main() begin print(fact(20)); print(fib(15)); end",
						"end")
				.expectLines("2432902008176640000", "610")
				.runAndAssert();
	}

	@Test
	public void testRunawayRecursion() throws Exception {
		cleanTest("runaway recursion")
				.program(
						"program p begin",
						"func down(n: int): int begin return down(n + 1); end",
						"func main() begin print(down(0)); end",
						"end")
				.expectThrow(CleanRuntimeException.class)
				.withMessage("Stack overflow")
				.runAndAssert();
	}

	@Test
	public void testNamesIgnoreCase() throws Exception {
		cleanTest("case insensitive names")
				.program(
						"program p begin",
						"var Count;",
						"func Bump(): int begin COUNT = count + 1; return Count; end",
						"func main() begin bump(); print(BUMP()); end",
						"end")
				.expect("2\n")
				.runAndAssert();
	}

	@Test
	public void testWorldNotInitialized() throws Exception {
		cleanTest("world not initialized")
				.program(mainProgram("print(dirt_remaining(world));"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("world not initialized")
				.atLine(3)
				.runAndAssert();
	}

	@Test
	public void testAgentNotInitialized() throws Exception {
		cleanTest("agent not initialized")
				.program(mainProgram("world = init_world(5, 5);", "clean(agent);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("agent not initialized")
				.atLine(4)
				.runAndAssert();
	}

	@Test
	public void testAgentOnObstacle() throws Exception {
		cleanTest("agent on the border")
				.program(mainProgram("world = init_world(5, 5);", "agent = set_agent(world, 0, 1, N);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("set_agent: position (0, 1) is an obstacle")
				.atLine(4)
				.runAndAssert();
		cleanTest("agent outside")
				.program(mainProgram("world = init_world(5, 5);", "agent = set_agent(world, 7, 1, N);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("is outside World(5x5)")
				.runAndAssert();
	}

	@Test
	public void testWorldTooSmall() throws Exception {
		cleanTest("tiny world")
				.program(mainProgram("world = init_world(2, 9);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("init_world: World dimensions must be at least 3x3")
				.runAndAssert();
	}

	@Test
	public void testWorldTooLarge() throws Exception {
		cleanTest("huge world")
				.program(mainProgram("world = init_world(2000000000, 3);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("init_world: World dimensions 2000000000x3 exceed the maximum of 1000000 cells")
				.atLine(3)
				.runAndAssert();
		cleanTest("world size overflows")
				.program(mainProgram("world = init_world(2000000000, 2000000000);"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("exceed the maximum of 1000000 cells")
				.runAndAssert();
		cleanTest("largest world")
				.program(mainProgram("world = init_world(1000, 1000);", "print(dirt_remaining(world) > 0);"))
				.expectLines("true")
				.runAndAssert();
	}

	@Test
	public void testWorldMustHoldAWorld() throws Exception {
		cleanTest("world = 5")
				.program(mainProgram("world = 5;"))
				.expectThrow(CleanRuntimeException.class)
				.withMessage("world must be assigned a world value, got int 5")
				.runAndAssert();
	}

	@Test
	public void testDiscardedResult() throws Exception {
		cleanTest("discarded result")
				.program(mainProgram("world = init_world(6, 6);", "dirt_remaining(world);", "print(\"ok\");"))
				.expect("ok\n")
				.runAndAssert();
	}

	@Test
	public void testAgentSweep() throws Exception {
		int seed = 3;
		World expected = new World(12, 9, new BSDRandom(seed));
		int row = -1;
		int col = -1;
		for (int r = 1; r < expected.getHeight() - 1 && row < 0; r++) {
			for (int c = 1; c < expected.getWidth() - 1; c++) {
				if (!expected.isBlocked(r, c)) {
					row = r;
					col = c;
					break;
				}
			}
		}
		Agent reference = new Agent(expected, row, col, Direction.E);
		for (int turn = 0; turn < 4; turn++) {
			while (!reference.frontIsBlocked()) {
				reference.clean();
				reference.moveForward();
			}
			reference.clean();
			reference.turnRight();
		}

		TestResult result = cleanTest("sweep")
				.program(
						"program sweep begin",
						"var turns;",
						"func main() begin",
						"  world = init_world(12, 9);",
						"  agent = set_agent(world, " + row + ", " + col + ", E);",
						"  while turns < 4 do",
						"    while !front_is_blocked(agent) do",
						"      if is_dirty(agent) then clean(agent); end",
						"      move_forward(agent);",
						"    end",
						"    clean(agent);",
						"    turn_right(agent);",
						"    turns = turns + 1;",
						"  end",
						"  print(dirt_remaining(world));",
						"end",
						"end")
				.seed(seed)
				.run();
		result.assertExpected();
		assertEquals(expected.dirtRemaining() + "\n", result.output());
		ExecutionContext context = result.context();
		assertNotNull(context.getWorld());
		assertEquals(expected.render(), context.getWorld().render());
		assertEquals(reference.getRow(), context.getAgent().getRow());
		assertEquals(reference.getCol(), context.getAgent().getCol());
		assertEquals(reference.getDirtCollected(), context.getAgent().getDirtCollected());
	}

	@Test
	public void testContextAfterRun() throws Exception {
		TestResult result = cleanTest("context").program(mainProgram("print(1);")).run();
		result.assertExpected();
		assertNull(result.context().getWorld());
		assertNull(result.context().getAgent());
		assertEquals(0, result.context().getStack().depth());
	}
}
