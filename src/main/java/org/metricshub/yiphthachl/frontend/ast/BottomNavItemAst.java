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
 * One entry of a {@link BottomNavigationAst}: <code>"Home" with icon home</code>.
 */
public final class BottomNavItemAst extends AstNode {

	private final String label;
	private final String icon;

	public BottomNavItemAst(SourceLocation location, String label, String icon) {
		super(NodeKind.BOTTOM_NAV_ITEM, location);
		this.label = label;
		this.icon = icon;
	}

	public String getLabel() {
		return label;
	}

	public String getIcon() {
		return icon;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBottomNavItem(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + quote(label) + " icon=" + icon;
	}
}
