package org.metricshub.cleanworld.jrt;


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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The cleaning robot: a position and an orientation in a {@link World}, plus
 * the amount of dirt collected so far.
 * <p>
 * The agent is always inside the grid and never on an obstacle.
 */
public class Agent {

	private final World world;
	private int row;
	private int col;
	private Direction direction;
	private int dirtCollected;

	/**
	 * @param world world the agent moves in
	 * @param row starting row
	 * @param col starting column
	 * @param direction starting orientation
	 * @throws IllegalArgumentException when the position is outside the grid or
	 *         on an obstacle
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The agent moves in the world shared with the program, not a copy.")
	public Agent(World world, int row, int col, Direction direction) {
		if (!world.isValid(row, col)) {
			throw new IllegalArgumentException("position (" + row + ", " + col + ") is outside " + world);
		}
		if (world.isBlocked(row, col)) {
			throw new IllegalArgumentException("position (" + row + ", " + col + ") is an obstacle");
		}
		this.world = world;
		this.row = row;
		this.col = col;
		this.direction = direction;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The world is shared with the program, not owned by the agent.")
	public World getWorld() {
		return world;
	}

	public int getRow() {
		return row;
	}

	public int getCol() {
		return col;
	}

	public Direction getDirection() {
		return direction;
	}

	public int getDirtCollected() {
		return dirtCollected;
	}

	/**
	 * @return true if the cell ahead is outside the grid or an obstacle
	 */
	public boolean frontIsBlocked() {
		return world.isBlocked(row + direction.getRowDelta(), col + direction.getColDelta());
	}

	/**
	 * Advance one cell, unless the cell ahead is blocked.
	 *
	 * @return true if the agent moved
	 */
	public boolean moveForward() {
		if (frontIsBlocked()) {
			return false;
		}
		row += direction.getRowDelta();
		col += direction.getColDelta();
		return true;
	}

	/**
	 * Rotate a quarter turn clockwise.
	 */
	public void turnRight() {
		direction = direction.turnRight();
	}

	public boolean isDirty() {
		return world.isDirt(row, col);
	}

	/**
	 * Remove the dirt under the agent, if any.
	 *
	 * @return true if some dirt was collected
	 */
	public boolean clean() {
		if (world.clean(row, col)) {
			dirtCollected++;
			return true;
		}
		return false;
	}

	@Override
	public String toString() {
		return "Agent(" + row + ", " + col + ", " + direction + ")";
	}
}
