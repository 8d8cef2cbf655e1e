package org.metricshub.cleanworld.semantic;


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

import java.util.HashMap;
import java.util.Map;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.SemanticType;

/**
 * Functions every program can call without declaring them.
 */
public enum Builtin {
	INIT_WORLD("init_world", SemanticType.WORLD, SemanticType.INT, SemanticType.INT),
	SET_AGENT("set_agent", SemanticType.AGENT, SemanticType.WORLD, SemanticType.INT, SemanticType.INT, SemanticType.DIR),
	DIRT_REMAINING("dirt_remaining", SemanticType.INT, SemanticType.WORLD),
	IS_DIRTY("is_dirty", SemanticType.BOOL, SemanticType.AGENT),
	CLEAN("clean", SemanticType.VOID, SemanticType.AGENT),
	MOVE_FORWARD("move_forward", SemanticType.VOID, SemanticType.AGENT),
	TURN_RIGHT("turn_right", SemanticType.VOID, SemanticType.AGENT),
	FRONT_IS_BLOCKED("front_is_blocked", SemanticType.BOOL, SemanticType.AGENT),
	PRINT("print", SemanticType.VOID, SemanticType.ANY);

	private static final Map<String, Builtin> BY_NAME = new HashMap<String, Builtin>();

	static {
		for (Builtin b : values()) {
			BY_NAME.put(b.functionName, b);
		}
	}

	private final String functionName;
	private final FunctionSignature signature;

	Builtin(String functionName, SemanticType returnType, SemanticType... parameterTypes) {
		this.functionName = functionName;
		this.signature = new FunctionSignature(returnType, parameterTypes);
	}

	/**
	 * @return the name programs call this builtin by
	 */
	public String getFunctionName() {
		return functionName;
	}

	public FunctionSignature getSignature() {
		return signature;
	}

	/**
	 * @param name called name, in any case
	 * @return the builtin with this name, or null
	 */
	public static Builtin lookup(Name name) {
		return BY_NAME.get(name.getKey());
	}
}
