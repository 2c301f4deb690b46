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
 * A conditional. The alternate is another {@link IfStatementAst} for
 * <code>otherwise if</code>, a {@link BlockAst} for <code>otherwise</code>,
 * or <code>null</code>.
 */
public final class IfStatementAst extends AstNode {

	private final AstNode condition;
	private final List<AstNode> consequent;
	private final AstNode alternate;

	public IfStatementAst(SourceLocation location, AstNode condition, List<AstNode> consequent, AstNode alternate) {
		super(NodeKind.IF_STATEMENT, location);
		this.condition = condition;
		this.consequent = freeze(consequent);
		this.alternate = alternate;
	}

	public AstNode getCondition() {
		return condition;
	}

	public List<AstNode> getConsequent() {
		return consequent;
	}

	public AstNode getAlternate() {
		return alternate;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIfStatement(this);
	}
}
