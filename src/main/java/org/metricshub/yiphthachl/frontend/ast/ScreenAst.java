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
 * One screen of the application and the statements building it.
 */
public final class ScreenAst extends AstNode {

	private final String name;
	private final List<AstNode> body;
	private final boolean main;

	public ScreenAst(SourceLocation location, String name, List<AstNode> body, boolean main) {
		super(NodeKind.SCREEN, location);
		this.name = name;
		this.body = freeze(body);
		this.main = main;
	}

	public String getName() {
		return name;
	}

	public List<AstNode> getBody() {
		return body;
	}

	/**
	 * @return whether this is the screen shown when the application starts
	 */
	public boolean isMain() {
		return main;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitScreen(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + quote(name) + (main ? " (main)" : "");
	}
}
