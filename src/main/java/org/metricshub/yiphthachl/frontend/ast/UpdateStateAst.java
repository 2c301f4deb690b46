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
 * <code>update counter to 0</code>
 */
public final class UpdateStateAst extends AstNode {

	private final String stateName;
	private final AstNode newValue;

	public UpdateStateAst(SourceLocation location, String stateName, AstNode newValue) {
		super(NodeKind.UPDATE_STATE, location);
		this.stateName = stateName;
		this.newValue = newValue;
	}

	public String getStateName() {
		return stateName;
	}

	public AstNode getNewValue() {
		return newValue;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitUpdateState(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + stateName;
	}
}
