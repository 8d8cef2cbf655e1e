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

import java.util.Locale;

/**
 * Compass orientation of the agent. Rows grow southward and columns grow
 * eastward; the declaration order is the clockwise turning order.
 */
public enum Direction {
	N(-1, 0),
	E(0, 1),
	S(1, 0),
	W(0, -1);

	private final int rowDelta;
	private final int colDelta;

	Direction(int rowDelta, int colDelta) {
		this.rowDelta = rowDelta;
		this.colDelta = colDelta;
	}

	public int getRowDelta() {
		return rowDelta;
	}

	public int getColDelta() {
		return colDelta;
	}

	/**
	 * @return the direction a quarter turn clockwise from this one
	 */
	public Direction turnRight() {
		Direction[] all = values();
		return all[(ordinal() + 1) % all.length];
	}

	/**
	 * @param symbol <code>N</code>, <code>E</code>, <code>S</code> or
	 *        <code>W</code>, in any case
	 * @return the direction
	 * @throws IllegalArgumentException for any other text
	 */
	public static Direction fromSymbol(String symbol) {
		String key = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
		for (Direction d : values()) {
			if (d.name().equals(key)) {
				return d;
			}
		}
		throw new IllegalArgumentException("invalid direction '" + symbol + "', must be N, E, S, or W");
	}
}
