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
 * The title bar at the top of a screen.
 */
public final class AppBarAst extends WidgetAst {

	private final TextAst title;

	public AppBarAst(SourceLocation location, TextAst title, Map<String, Object> styles, Map<String, List<AstNode>> events) {
		super(NodeKind.APP_BAR, location, styles, events);
		this.title = title;
	}

	/**
	 * @return the title, or <code>null</code> when there is none
	 */
	public TextAst getTitle() {
		return title;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitAppBar(this);
	}
}
