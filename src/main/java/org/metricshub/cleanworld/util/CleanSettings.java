package org.metricshub.cleanworld.util;


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
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single CleanWorld run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking CleanWorld programmatically, from within Java code.
 */
public class CleanSettings {

	/** Default cap on the number of iterations of a single <code>while</code> loop. */
	public static final int DEFAULT_MAX_LOOP_ITERATIONS = 100000;

	/** Default seed of the generator that lays out obstacles and dirt. */
	public static final int DEFAULT_RANDOM_SEED = 1;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum number of times the body of one <code>while</code> loop may run
	 * before the interpreter gives up with a runaway-loop error.
	 */
	private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;

	/**
	 * Seed used for the world layout, so that a run can be reproduced.
	 */
	private int randomSeed = DEFAULT_RANDOM_SEED;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("maxLoopIterations = ").append(getMaxLoopIterations()).append(newLine);
		desc.append("randomSeed = ").append(getRandomSeed()).append(newLine);

		return desc.toString();
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream OutputStream to use for print statements
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return the maximum number of iterations of one loop
	 */
	public int getMaxLoopIterations() {
		return maxLoopIterations;
	}

	/**
	 * @param maxLoopIterations the maximum number of iterations of one loop, must be positive
	 */
	public void setMaxLoopIterations(int maxLoopIterations) {
		if (maxLoopIterations <= 0) {
			throw new IllegalArgumentException("Maximum loop iterations must be positive, got " + maxLoopIterations);
		}
		this.maxLoopIterations = maxLoopIterations;
	}

	/**
	 * @return the seed of the world layout generator
	 */
	public int getRandomSeed() {
		return randomSeed;
	}

	/**
	 * @param randomSeed the seed of the world layout generator
	 */
	public void setRandomSeed(int randomSeed) {
		this.randomSeed = randomSeed;
	}
}
