package org.metricshub.cleanworld.frontend;


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

import java.util.List;

/**
 * A child of a {@link CstNode}: either a {@link Token} or a nested {@link CstNode}.
 */
public interface CstElement {

	/**
	 * @return true when this element is a token leaf
	 */
	boolean isToken();

	/**
	 * Appends the token leaves under this element, in source order.
	 *
	 * @param leaves list to append to
	 */
	void collectLeaves(List<Token> leaves);

	/**
	 * Appends an indented text representation of this element.
	 *
	 * @param out buffer to append to
	 * @param level indentation level
	 */
	void dump(StringBuilder out, int level);
}
