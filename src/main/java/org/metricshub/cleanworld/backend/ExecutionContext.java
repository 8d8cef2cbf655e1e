package org.metricshub.cleanworld.backend;


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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.cleanworld.ast.FuncDecl;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.jrt.Agent;
import org.metricshub.cleanworld.jrt.BSDRandom;
import org.metricshub.cleanworld.jrt.World;
import org.metricshub.cleanworld.util.CleanSettings;

/**
 * State of one program run, handed to every evaluation call of the
 * {@link Interpreter}: global variables, user functions, the call stack, the
 * <code>world</code> and <code>agent</code> handles and the run settings.
 * <p>
 * Once the run is over, the context can be inspected to read the final
 * values of the globals and the state of the world.
 */
public class ExecutionContext {

	private final CleanSettings settings;
	private final BSDRandom random;
	private final Map<String, Object> globals = new LinkedHashMap<String, Object>();
	private final Map<String, FuncDecl> functions = new HashMap<String, FuncDecl>();
	private final RuntimeStack stack = new RuntimeStack();

	private World world;
	private Agent agent;
	private boolean breaking;

	/**
	 * @param settings run settings
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Settings are shared with the caller that supplied them.")
	public ExecutionContext(CleanSettings settings) {
		this.settings = settings;
		this.random = new BSDRandom(settings.getRandomSeed());
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Settings are shared with the caller that supplied them.")
	public CleanSettings getSettings() {
		return settings;
	}

	PrintStream getOutput() {
		return settings.getOutputStream();
	}

	BSDRandom getRandom() {
		return random;
	}

	RuntimeStack getStack() {
		return stack;
	}

	Map<String, Object> getGlobalMap() {
		return globals;
	}

	Map<String, FuncDecl> getFunctionMap() {
		return functions;
	}

	/**
	 * @return the global variables, keyed by canonical name
	 */
	public Map<String, Object> getGlobals() {
		return Collections.unmodifiableMap(globals);
	}

	/**
	 * @param name variable name, in any case
	 * @return the value of the global variable, or null if it does not exist
	 */
	public Object getGlobal(String name) {
		return globals.get(Name.canonical(name));
	}

	/**
	 * @return the current world, or null if none was assigned
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The live world is exposed so that callers can inspect it after the run.")
	public World getWorld() {
		return world;
	}

	void setWorld(World world) {
		this.world = world;
	}

	/**
	 * @return the current agent, or null if none was assigned
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The live agent is exposed so that callers can inspect it after the run.")
	public Agent getAgent() {
		return agent;
	}

	void setAgent(Agent agent) {
		this.agent = agent;
	}

	boolean isBreaking() {
		return breaking;
	}

	void setBreaking(boolean breaking) {
		this.breaking = breaking;
	}
}
