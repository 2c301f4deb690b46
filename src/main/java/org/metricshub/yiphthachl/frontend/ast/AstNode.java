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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of the syntax tree nodes.
 * <p>
 * Nodes are immutable: they are created once by the parser and their lists
 * and maps cannot be modified. Lists keep source order, which is the only
 * sequencing information in the tree.
 */
public abstract class AstNode {

	private final NodeKind kind;
	private final SourceLocation location;

	protected AstNode(NodeKind kind, SourceLocation location) {
		this.kind = kind;
		this.location = location == null ? SourceLocation.UNKNOWN : location;
	}

	public final NodeKind getKind() {
		return kind;
	}

	public final SourceLocation getLocation() {
		return location;
	}

	/**
	 * Calls the visit method of the visitor matching this node's class.
	 *
	 * @param <R> result type of the visitor
	 * @param visitor the visitor
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(AstVisitor<R> visitor);

	/**
	 * Prints this node and its descendants, one node per line, indented by depth.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		accept(new AstDumper(ps));
	}

	/**
	 * One-line description of the node itself, without its children.
	 */
	@Override
	public String toString() {
		return kind.getLabel();
	}

	protected static <T> List<T> freeze(List<? extends T> list) {
		if (list == null || list.isEmpty()) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	protected static <V> Map<String, V> freeze(Map<String, ? extends V> map) {
		if (map == null || map.isEmpty()) {
			return Collections.emptyMap();
		}
		return Collections.unmodifiableMap(new LinkedHashMap<String, V>(map));
	}

	protected static String quote(String text) {
		return '"' + text + '"';
	}
}
