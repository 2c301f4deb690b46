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
 * <code>call greet with "Ada" and 3</code>
 */
public final class FunctionCallAst extends AstNode {

	private final String name;
	private final List<AstNode> arguments;

	public FunctionCallAst(SourceLocation location, String name, List<AstNode> arguments) {
		super(NodeKind.FUNCTION_CALL, location);
		this.name = name;
		this.arguments = freeze(arguments);
	}

	public String getName() {
		return name;
	}

	public List<AstNode> getArguments() {
		return arguments;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFunctionCall(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + name;
	}
}
