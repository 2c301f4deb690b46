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

public final class ButtonAst extends WidgetAst {

	/** Event kind of a button press */
	public static final String ON_PRESSED = "onPressed";

	private final AstNode label;

	public ButtonAst(SourceLocation location, AstNode label, Map<String, Object> styles, Map<String, List<AstNode>> events) {
		super(NodeKind.BUTTON, location, styles, events);
		this.label = label;
	}

	public AstNode getLabel() {
		return label;
	}

	/**
	 * @return actions run when the button is pressed, possibly empty
	 */
	public List<AstNode> getOnPressed() {
		return getEventActions(ON_PRESSED);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitButton(this);
	}
}
