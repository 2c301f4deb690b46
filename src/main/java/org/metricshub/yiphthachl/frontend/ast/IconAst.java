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

public final class IconAst extends WidgetAst {

	/** Size of icons that do not specify one */
	public static final double DEFAULT_SIZE = 24;

	private final String name;
	private final double size;
	private final String color;

	public IconAst(SourceLocation location, String name, double size, String color, Map<String, Object> styles, Map<String, List<AstNode>> events) {
		super(NodeKind.ICON, location, styles, events);
		this.name = name;
		this.size = size;
		this.color = color;
	}

	public String getName() {
		return name;
	}

	public double getSize() {
		return size;
	}

	/**
	 * @return hexadecimal color code, or <code>null</code>
	 */
	public String getColor() {
		return color;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIcon(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + name;
	}
}
