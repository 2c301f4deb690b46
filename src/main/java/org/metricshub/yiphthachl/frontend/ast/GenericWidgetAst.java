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
 * Any widget without a dedicated node class, like a checkbox, a slider or a
 * drawer. The widget type is the keyword sub-kind (<code>checkbox</code>).
 */
public final class GenericWidgetAst extends WidgetAst {

	private final String widgetType;
	private final Map<String, Object> properties;
	private final List<AstNode> children;

	public GenericWidgetAst(
			SourceLocation location,
			String widgetType,
			Map<String, Object> properties,
			List<AstNode> children,
			Map<String, Object> styles,
			Map<String, List<AstNode>> events) {
		super(NodeKind.WIDGET, location, styles, events);
		this.widgetType = widgetType;
		this.properties = freeze(properties);
		this.children = freeze(children);
	}

	public String getWidgetType() {
		return widgetType;
	}

	public Map<String, Object> getProperties() {
		return properties;
	}

	public List<AstNode> getChildren() {
		return children;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitGenericWidget(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + widgetType;
	}
}
