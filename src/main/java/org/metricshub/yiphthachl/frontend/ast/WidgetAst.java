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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of user interface widgets.
 * <p>
 * Every widget carries its style properties (like <code>color</code> mapped
 * to <code>#3B82F6</code>, or <code>bold</code> mapped to <code>true</code>)
 * and its event handlers (like <code>onPressed</code> mapped to the actions
 * to run), both in source order.
 */
public abstract class WidgetAst extends AstNode {

	private final Map<String, Object> styles;
	private final Map<String, List<AstNode>> events;

	protected WidgetAst(NodeKind kind, SourceLocation location, Map<String, Object> styles, Map<String, List<AstNode>> events) {
		super(kind, location);
		this.styles = freeze(styles);
		if (events == null || events.isEmpty()) {
			this.events = Collections.emptyMap();
		} else {
			Map<String, List<AstNode>> copy = new LinkedHashMap<>();
			for (Map.Entry<String, List<AstNode>> entry : events.entrySet()) {
				copy.put(entry.getKey(), freeze(entry.getValue()));
			}
			this.events = Collections.unmodifiableMap(copy);
		}
	}

	/**
	 * @return style property names mapped to values (<code>String</code>, <code>Double</code> or <code>Boolean</code>)
	 */
	public Map<String, Object> getStyles() {
		return styles;
	}

	/**
	 * @return event kinds mapped to their actions
	 */
	public Map<String, List<AstNode>> getEvents() {
		return events;
	}

	/**
	 * @param eventKind event kind, like <code>onPressed</code>
	 * @return actions of the event, or an empty list
	 */
	public List<AstNode> getEventActions(String eventKind) {
		List<AstNode> actions = events.get(eventKind);
		return actions == null ? Collections.<AstNode>emptyList() : actions;
	}
}
