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
 * Arithmetic on two operands. The operator is an arithmetic sub-kind:
 * <code>add</code>, <code>subtract</code>, <code>multiply</code>,
 * <code>divide</code> or <code>modulo</code>.
 */
public final class BinaryExpressionAst extends AstNode {

	private final String operator;
	private final AstNode left;
	private final AstNode right;

	public BinaryExpressionAst(SourceLocation location, String operator, AstNode left, AstNode right) {
		super(NodeKind.BINARY_EXPRESSION, location);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public String getOperator() {
		return operator;
	}

	public AstNode getLeft() {
		return left;
	}

	public AstNode getRight() {
		return right;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + operator;
	}
}
