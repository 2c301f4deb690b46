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
 * Children side by side.
 */
public final class RowAst extends WidgetAst {

	/** Alignment of the children when none is given */
	public static final String DEFAULT_ALIGNMENT = "start";

	private final List<AstNode> children;
	private final String alignment;

	public RowAst(SourceLocation location, List<AstNode> children, String alignment, Map<String, Object> styles, Map<String, List<AstNode>> events) {
		super(NodeKind.ROW, location, styles, events);
		this.children = freeze(children);
		this.alignment = alignment == null ? DEFAULT_ALIGNMENT : alignment;
	}

	public List<AstNode> getChildren() {
		return children;
	}

	public String getAlignment() {
		return alignment;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitRow(this);
	}
}
