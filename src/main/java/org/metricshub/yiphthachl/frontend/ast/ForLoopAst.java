package org.metricshub.yiphthachl.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Yiphthachl
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
 * <code>for each item in items</code>
 */
public final class ForLoopAst extends AstNode {

	private final String iterator;
	private final AstNode iterable;
	private final List<AstNode> body;

	public ForLoopAst(SourceLocation location, String iterator, AstNode iterable, List<AstNode> body) {
		super(NodeKind.FOR_LOOP, location);
		this.iterator = iterator;
		this.iterable = iterable;
		this.body = freeze(body);
	}

	/**
	 * @return name of the loop variable
	 */
	public String getIterator() {
		return iterator;
	}

	public AstNode getIterable() {
		return iterable;
	}

	public List<AstNode> getBody() {
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitForLoop(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + iterator;
	}
}
