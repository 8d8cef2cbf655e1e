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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.cleanworld.ast.SemanticType;

/**
 * Parameter types and return type of a function, user defined or builtin.
 */
public final class FunctionSignature {

	private final List<SemanticType> parameterTypes;
	private final SemanticType returnType;

	public FunctionSignature(List<SemanticType> parameterTypes, SemanticType returnType) {
		this.parameterTypes = Collections.unmodifiableList(new ArrayList<SemanticType>(parameterTypes));
		this.returnType = returnType;
	}

	public FunctionSignature(SemanticType returnType, SemanticType... parameterTypes) {
		this(Arrays.asList(parameterTypes), returnType);
	}

	public List<SemanticType> getParameterTypes() {
		return parameterTypes;
	}

	public int getArity() {
		return parameterTypes.size();
	}

	public SemanticType getReturnType() {
		return returnType;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < parameterTypes.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(parameterTypes.get(i));
		}
		return sb.append(") : ").append(returnType).toString();
	}
}
