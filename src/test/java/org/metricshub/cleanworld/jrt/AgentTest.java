package org.metricshub.cleanworld.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AgentTest {

	private static World room() {
		return World.fromRows(
				"I####",
				"#.*.#",
				"#.#.#",
				"#**.O",
				"#####");
	}

	@Test
	public void testBlockedMoveKeepsPosition() {
		Agent agent = new Agent(room(), 1, 1, Direction.N);
		assertTrue(agent.frontIsBlocked());
		assertFalse(agent.moveForward());
		assertEquals(1, agent.getRow());
		assertEquals(1, agent.getCol());
	}

	@Test
	public void testMoveForward() {
		Agent agent = new Agent(room(), 1, 1, Direction.E);
		assertFalse(agent.frontIsBlocked());
		assertTrue(agent.moveForward());
		assertEquals(1, agent.getRow());
		assertEquals(2, agent.getCol());
		agent.turnRight();
		assertEquals(Direction.S, agent.getDirection());
		// obstacle at (2, 2)
		assertFalse(agent.moveForward());
	}

	@Test
	public void testFourTurnsMakeACircle() {
		Agent agent = new Agent(room(), 1, 1, Direction.W);
		agent.turnRight();
		assertEquals(Direction.N, agent.getDirection());
		agent.turnRight();
		agent.turnRight();
		agent.turnRight();
		assertEquals(Direction.W, agent.getDirection());
	}

	@Test
	public void testClean() {
		World world = room();
		Agent agent = new Agent(world, 3, 1, Direction.E);
		assertEquals(3, world.dirtRemaining());
		assertTrue(agent.isDirty());
		assertTrue(agent.clean());
		assertFalse(agent.isDirty());
		assertFalse(agent.clean());
		agent.moveForward();
		assertTrue(agent.clean());
		assertEquals(2, agent.getDirtCollected());
		assertEquals(1, world.dirtRemaining());
	}

	@Test
	public void testExitIsNotBlocked() {
		Agent agent = new Agent(room(), 3, 3, Direction.E);
		assertTrue(agent.moveForward());
		assertTrue(agent.getWorld().isExit(agent.getRow(), agent.getCol()));
		// the grid ends after the exit
		assertTrue(agent.frontIsBlocked());
	}

	@Test
	public void testInvalidPlacement() {
		World world = room();
		assertThrows(IllegalArgumentException.class, () -> new Agent(world, 2, 2, Direction.N));
		assertThrows(IllegalArgumentException.class, () -> new Agent(world, 5, 1, Direction.N));
		assertThrows(IllegalArgumentException.class, () -> new Agent(world, -1, 0, Direction.N));
	}

	@Test
	public void testDirectionSymbols() {
		assertEquals(Direction.S, Direction.fromSymbol("s"));
		assertEquals(Direction.E, Direction.N.turnRight());
		assertEquals(Direction.N, Direction.W.turnRight());
		assertThrows(IllegalArgumentException.class, () -> Direction.fromSymbol("X"));
	}
}
