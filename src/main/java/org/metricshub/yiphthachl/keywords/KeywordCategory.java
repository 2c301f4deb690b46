package org.metricshub.yiphthachl.keywords;

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

import java.util.Locale;

/**
 * Categories of keyword phrases in a {@link KeywordTable}.
 * <p>
 * Each category is known by a key in keyword table files
 * (<code>variable.set = ...</code>). Flat categories only have one
 * sub-kind, named after the category itself; the tokens they produce carry
 * the phrase as written rather than a sub-kind.
 * <p>
 * {@link #NAVIGATION} and {@link #STATE} phrases never classify a word by
 * themselves: they only take part in phrase merging and in the action
 * sub-grammar of the parser. {@link #HTTP} and {@link #ANIMATION} phrases
 * only take part in phrase merging.
 */
public enum KeywordCategory {
	VARIABLE_DECLARATION("variable", true),
	ASSIGNMENT("assignment", true),
	FUNCTION_DECLARATION("function", true),
	FUNCTION_CALL("call", true),
	CONDITIONAL("conditional", false),
	LOOP("loop", false),
	COMPARISON("comparison", false),
	ARITHMETIC("math", false),
	WIDGET("widget", false),
	STYLE("style", false),
	EVENT("event", false),
	NAVIGATION("navigation", false),
	STATE("state", false),
	HTTP("http", false),
	ANIMATION("animation", false);

	private final String key;
	private final boolean flat;

	KeywordCategory(String key, boolean flat) {
		this.key = key;
		this.flat = flat;
	}

	/**
	 * @return the name of this category in keyword table files
	 */
	public String getKey() {
		return key;
	}

	/**
	 * @return whether this category has a single sub-kind named after the category
	 */
	public boolean isFlat() {
		return flat;
	}

	/**
	 * Looks up a category by its key, ignoring case.
	 *
	 * @param key category key, like <code>conditional</code>
	 * @return the matching category, or <code>null</code> when there is none
	 */
	public static KeywordCategory fromKey(String key) {
		String lower = key.toLowerCase(Locale.ROOT);
		for (KeywordCategory category : values()) {
			if (category.key.equals(lower)) {
				return category;
			}
		}
		return null;
	}
}
