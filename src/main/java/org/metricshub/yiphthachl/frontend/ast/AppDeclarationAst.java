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
 * <code>create an app "Name"</code> followed by an indented block of screens.
 * Statements of the block that are not screens are kept as configuration.
 */
public final class AppDeclarationAst extends AstNode {

	private final String name;
	private final List<ScreenAst> screens;
	private final List<AstNode> configuration;

	public AppDeclarationAst(SourceLocation location, String name, List<ScreenAst> screens, List<AstNode> configuration) {
		super(NodeKind.APP_DECLARATION, location);
		this.name = name;
		this.screens = freeze(screens);
		this.configuration = freeze(configuration);
	}

	public String getName() {
		return name;
	}

	public List<ScreenAst> getScreens() {
		return screens;
	}

	public List<AstNode> getConfiguration() {
		return configuration;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitAppDeclaration(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + quote(name);
	}
}
