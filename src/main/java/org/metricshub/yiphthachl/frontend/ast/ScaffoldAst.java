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
import java.util.Map;

/**
 * Standard screen layout: an optional title bar, a body, an optional bottom
 * navigation and an optional side drawer. Any of them may be <code>null</code>.
 */
public final class ScaffoldAst extends WidgetAst {

	private final AppBarAst appBar;
	private final AstNode body;
	private final BottomNavigationAst bottomNavigation;
	private final AstNode drawer;

	public ScaffoldAst(
			SourceLocation location,
			AppBarAst appBar,
			AstNode body,
			BottomNavigationAst bottomNavigation,
			AstNode drawer,
			Map<String, Object> styles,
			Map<String, List<AstNode>> events) {
		super(NodeKind.SCAFFOLD, location, styles, events);
		this.appBar = appBar;
		this.body = body;
		this.bottomNavigation = bottomNavigation;
		this.drawer = drawer;
	}

	public AppBarAst getAppBar() {
		return appBar;
	}

	public AstNode getBody() {
		return body;
	}

	public BottomNavigationAst getBottomNavigation() {
		return bottomNavigation;
	}

	public AstNode getDrawer() {
		return drawer;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitScaffold(this);
	}
}
