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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Runtime stack used by the interpreter: one frame of local variables per
 * active user function call, plus the slot the pending return value travels
 * in.
 * <p>
 * Frames map canonical parameter names to values. Globals are not kept here,
 * see {@link ExecutionContext}.
 */
class RuntimeStack {

	private final Deque<Map<String, Object>> frames = new ArrayDeque<Map<String, Object>>();

	private Object returnValue;
	private boolean returning;

	void pushFrame(Map<String, Object> locals) {
		frames.push(new HashMap<String, Object>(locals));
	}

	void popFrame() {
		frames.pop();
	}

	int depth() {
		return frames.size();
	}

	/**
	 * @param key canonical variable name
	 * @return true if the innermost frame holds this variable
	 */
	boolean hasLocal(String key) {
		Map<String, Object> locals = frames.peek();
		return locals != null && locals.containsKey(key);
	}

	Object getLocal(String key) {
		Map<String, Object> locals = frames.peek();
		assert locals != null && locals.containsKey(key);
		return locals.get(key);
	}

	void setLocal(String key, Object value) {
		Map<String, Object> locals = frames.peek();
		assert locals != null && locals.containsKey(key);
		locals.put(key, value);
	}

	/**
	 * Record a <code>return</code>. The value is null for a bare return.
	 */
	void setReturnValue(Object obj) {
		assert !returning;
		returnValue = obj;
		returning = true;
	}

	/**
	 * @return true between a <code>return</code> and the end of the call it
	 *         leaves
	 */
	boolean isReturning() {
		return returning;
	}

	/**
	 * Consume the pending return value and clear the slot.
	 *
	 * @return the returned value, or null when the function returned nothing
	 */
	Object takeReturnValue() {
		Object retval = returnValue;
		returnValue = null;
		returning = false;
		return retval;
	}

	void popAllFrames() {
		frames.clear();
		takeReturnValue();
	}
}
