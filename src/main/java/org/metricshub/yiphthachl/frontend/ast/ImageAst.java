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

public final class ImageAst extends WidgetAst {

	private final AstNode source;
	private final String alt;

	public ImageAst(SourceLocation location, AstNode source, String alt, Map<String, Object> styles, Map<String, List<AstNode>> events) {
		super(NodeKind.IMAGE, location, styles, events);
		this.source = source;
		this.alt = alt;
	}

	/**
	 * @return where the image is loaded from, usually a {@link StringLiteralAst}
	 */
	public AstNode getSource() {
		return source;
	}

	public String getAlt() {
		return alt;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitImage(this);
	}
}
