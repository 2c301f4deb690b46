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

/**
 * <code>not</code> or <code>negate</code> applied to an operand.
 */
public final class UnaryExpressionAst extends AstNode {

	private final String operator;
	private final AstNode operand;

	public UnaryExpressionAst(SourceLocation location, String operator, AstNode operand) {
		super(NodeKind.UNARY_EXPRESSION, location);
		this.operator = operator;
		this.operand = operand;
	}

	public String getOperator() {
		return operator;
	}

	public AstNode getOperand() {
		return operand;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + operator;
	}
}
