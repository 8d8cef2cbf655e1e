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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.cleanworld.util.CleanLogger;
import org.slf4j.Logger;

/**
 * Rectangular grid the agent cleans.
 * <p>
 * The border is made of obstacles, except for the entry cell in the
 * top-left corner and up to two exit cells, one on the bottom side and one
 * on the right side. The interior holds randomly placed obstacles and dirt.
 * The dimensions never change after construction, and the only change a
 * cell can go through is from {@link CellState#DIRT} to
 * {@link CellState#EMPTY}.
 * <p>
 * Coordinates are <code>(row, col)</code>, both 0-based, row 0 being the
 * north side.
 */
public class World {

	private static final Logger LOG = CleanLogger.getLogger(World.class);

	/** Smallest accepted width and height. */
	public static final int MIN_SIZE = 3;

	/** Largest accepted number of cells, <code>width * height</code>. */
	public static final int MAX_CELLS = 1_000_000;

	private final int width;
	private final int height;
	private final CellState[][] grid;
	private final List<int[]> exits = new ArrayList<int[]>();

	/**
	 * Create and lay out a new world.
	 *
	 * @param width number of columns, at least {@link #MIN_SIZE}
	 * @param height number of rows, at least {@link #MIN_SIZE}
	 * @param random generator used to place obstacles and dirt
	 * @throws IllegalArgumentException when a dimension is too small or the
	 *         world would hold more than {@link #MAX_CELLS} cells
	 */
	public World(int width, int height, BSDRandom random) {
		this(width, height);
		layOut(random);
		if (LOG.isDebugEnabled()) {
			LOG.debug("Created {} with {} dirt cells", this, dirtRemaining());
		}
	}

	private World(int width, int height) {
		if (width < MIN_SIZE || height < MIN_SIZE) {
			throw new IllegalArgumentException(
					"World dimensions must be at least " + MIN_SIZE + "x" + MIN_SIZE + ", got " + width + "x" + height);
		}
		int cells;
		try {
			cells = Math.multiplyExact(width, height);
		} catch (ArithmeticException e) {
			cells = Integer.MAX_VALUE;
		}
		if (cells > MAX_CELLS) {
			throw new IllegalArgumentException(
					"World dimensions " + width + "x" + height + " exceed the maximum of " + MAX_CELLS + " cells");
		}
		this.width = width;
		this.height = height;
		this.grid = new CellState[height][width];
	}

	/**
	 * Build a world from a text map, one string per row, using the
	 * {@link CellState} symbols. No random content is added.
	 *
	 * @param rows the map, all rows of the same length
	 * @return the world
	 * @throws IllegalArgumentException on a ragged or too small map or an
	 *         unknown symbol
	 */
	public static World fromRows(String... rows) {
		int h = rows.length;
		int w = h == 0 ? 0 : rows[0].length();
		World world = new World(w, h);
		for (int r = 0; r < h; r++) {
			if (rows[r].length() != w) {
				throw new IllegalArgumentException("Row " + r + " has length " + rows[r].length() + ", expected " + w);
			}
			for (int c = 0; c < w; c++) {
				CellState state = CellState.fromSymbol(rows[r].charAt(c));
				world.grid[r][c] = state;
				if (state == CellState.EXIT) {
					world.exits.add(new int[] { r, c });
				}
			}
		}
		return world;
	}

	private void layOut(BSDRandom random) {
		for (int r = 0; r < height; r++) {
			for (int c = 0; c < width; c++) {
				boolean border = r == 0 || r == height - 1 || c == 0 || c == width - 1;
				grid[r][c] = border ? CellState.OBSTACLE : CellState.EMPTY;
			}
		}
		grid[0][0] = CellState.ENTRY;
		addExit(height - 1, width / 2);
		addExit(height / 2, width - 1);

		// obstacles only land on empty cells, so some attempts place nothing
		int obstacleCount = width * height / 10;
		for (int i = 0; i < obstacleCount; i++) {
			int r = random.nextInt(1, height - 2);
			int c = random.nextInt(1, width - 2);
			if (grid[r][c] == CellState.EMPTY) {
				grid[r][c] = CellState.OBSTACLE;
			}
		}

		int dirtCount = width * height / 3;
		int placed = 0;
		int attempts = 0;
		while (placed < dirtCount && attempts < dirtCount * 3) {
			int r = random.nextInt(1, height - 2);
			int c = random.nextInt(1, width - 2);
			if (grid[r][c] == CellState.EMPTY) {
				grid[r][c] = CellState.DIRT;
				placed++;
			}
			attempts++;
		}
	}

	private void addExit(int row, int col) {
		grid[row][col] = CellState.EXIT;
		exits.add(new int[] { row, col });
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * @return true if the position is inside the grid
	 */
	public boolean isValid(int row, int col) {
		return row >= 0 && row < height && col >= 0 && col < width;
	}

	/**
	 * @return true if the position is outside the grid or holds an obstacle
	 */
	public boolean isBlocked(int row, int col) {
		return !isValid(row, col) || grid[row][col] == CellState.OBSTACLE;
	}

	/**
	 * @return true if the position is inside the grid and holds dirt
	 */
	public boolean isDirt(int row, int col) {
		return isValid(row, col) && grid[row][col] == CellState.DIRT;
	}

	/**
	 * Remove the dirt at the position, if any.
	 *
	 * @return true if there was dirt to remove
	 */
	public boolean clean(int row, int col) {
		if (isDirt(row, col)) {
			grid[row][col] = CellState.EMPTY;
			return true;
		}
		return false;
	}

	/**
	 * @return the number of cells still holding dirt
	 */
	public int dirtRemaining() {
		int count = 0;
		for (CellState[] row : grid) {
			for (CellState cell : row) {
				if (cell == CellState.DIRT) {
					count++;
				}
			}
		}
		return count;
	}

	public boolean isExit(int row, int col) {
		for (int[] exit : exits) {
			if (exit[0] == row && exit[1] == col) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the exit positions, as <code>{row, col}</code> pairs
	 */
	public List<int[]> getExits() {
		List<int[]> copy = new ArrayList<int[]>();
		for (int[] exit : exits) {
			copy.add(exit.clone());
		}
		return Collections.unmodifiableList(copy);
	}

	/**
	 * @param row row
	 * @param col column
	 * @return the state of the cell
	 * @throws IndexOutOfBoundsException outside the grid
	 */
	public CellState getCell(int row, int col) {
		if (!isValid(row, col)) {
			throw new IndexOutOfBoundsException("(" + row + ", " + col + ") is outside " + this);
		}
		return grid[row][col];
	}

	/**
	 * @return the grid, one line per row, using the {@link CellState} symbols
	 */
	public String render() {
		StringBuilder sb = new StringBuilder((width + 1) * height);
		for (CellState[] row : grid) {
			for (CellState cell : row) {
				sb.append(cell.getSymbol());
			}
			sb.append('\n');
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "World(" + width + "x" + height + ")";
	}
}
