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
 * <code>set name to value</code>, or <code>remember name as value</code>
 * for a state variable the user interface reacts to.
 */
public final class VariableDeclarationAst extends AstNode {

	private final String name;
	private final AstNode value;
	private final boolean state;

	public VariableDeclarationAst(SourceLocation location, String name, AstNode value, boolean state) {
		super(NodeKind.VARIABLE_DECLARATION, location);
		this.name = name;
		this.value = value;
		this.state = state;
	}

	public String getName() {
		return name;
	}

	public AstNode getValue() {
		return value;
	}

	public boolean isState() {
		return state;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitVariableDeclaration(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + name + (state ? " (state)" : "");
	}
}
