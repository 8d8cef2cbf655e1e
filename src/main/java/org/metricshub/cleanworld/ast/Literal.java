package org.metricshub.cleanworld.ast;


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

import java.util.Collections;
import java.util.List;

/**
 * A constant. The text is kept as found in the source, except for string
 * literals, whose quotes are removed and escape sequences decoded.
 */
public final class Literal extends AstNode {

	private final LiteralKind literalKind;
	private final String text;

	public Literal(int lineNo, LiteralKind literalKind, String text) {
		super(lineNo);
		this.literalKind = literalKind;
		this.text = text;
	}

	public LiteralKind getLiteralKind() {
		return literalKind;
	}

	public String getText() {
		return text;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.LITERAL;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visit(this, arg);
	}

	@Override
	public List<AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected String describe() {
		if (literalKind == LiteralKind.STRING) {
			return "Literal \"" + text + "\"";
		}
		return "Literal " + text;
	}
}
