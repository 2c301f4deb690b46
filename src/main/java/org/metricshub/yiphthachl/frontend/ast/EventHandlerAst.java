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
 * An event phrase met outside of a widget, like a top-level
 * <code>when pressed</code>, with its actions.
 */
public final class EventHandlerAst extends AstNode {

	private final String eventKind;
	private final List<AstNode> actions;

	public EventHandlerAst(SourceLocation location, String eventKind, List<AstNode> actions) {
		super(NodeKind.EVENT_HANDLER, location);
		this.eventKind = eventKind;
		this.actions = freeze(actions);
	}

	/**
	 * @return event sub-kind, like <code>onPressed</code>
	 */
	public String getEventKind() {
		return eventKind;
	}

	public List<AstNode> getActions() {
		return actions;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitEventHandler(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + eventKind;
	}
}
