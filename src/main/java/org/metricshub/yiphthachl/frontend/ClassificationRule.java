package org.metricshub.yiphthachl.frontend;

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

import org.metricshub.yiphthachl.keywords.KeywordCategory;
import org.metricshub.yiphthachl.keywords.KeywordTable;

/**
 * One entry of the ordered rule list used by {@link WordClassifier}: how a
 * word can be recognized as a token of some type.
 * <p>
 * Every rule has an exact test (the word is one of its phrases) and may have
 * a loose test (the word starts with, or contains, one of its phrases). Both
 * return the token value on success and <code>null</code> otherwise.
 */
public abstract class ClassificationRule {

	/**
	 * How loosely a keyword category matches words.
	 */
	public enum Match {
		/** The word is one of the phrases */
		EXACT,
		/** The word is, or starts with, one of the phrases */
		EXACT_OR_PREFIX,
		/** The word contains one of the phrases */
		CONTAINS
	}

	private final String name;

	/**
	 * @param name rule name, for logs and tests
	 */
	protected ClassificationRule(String name) {
		this.name = name;
	}

	/**
	 * @param table keywords to match against
	 * @param word lower-case word or merged phrase
	 * @return the token value if the word is one of this rule's phrases, <code>null</code> otherwise
	 */
	public abstract Object matchExact(KeywordTable table, String word);

	/**
	 * @param table keywords to match against
	 * @param word lower-case word or merged phrase
	 * @return the token value if the word loosely matches one of this rule's phrases, <code>null</code> otherwise
	 */
	public Object matchLoose(KeywordTable table, String word) {
		return null;
	}

	/**
	 * @param value a value returned by one of the match methods
	 * @return the type of the token to produce for this value
	 */
	public abstract TokenType tokenTypeFor(Object value);

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * @return a rule recognizing the boolean words of the table
	 */
	public static ClassificationRule booleanWords() {
		return new ClassificationRule("boolean") {
			@Override
			public Object matchExact(KeywordTable table, String word) {
				return table.getBooleanValue(word);
			}

			@Override
			public TokenType tokenTypeFor(Object value) {
				return TokenType.BOOLEAN_LITERAL;
			}
		};
	}

	/**
	 * @return a rule recognizing color names, whose value is the color code
	 */
	public static ClassificationRule colorNames() {
		return new ClassificationRule("color") {
			@Override
			public Object matchExact(KeywordTable table, String word) {
				return table.getColorCode(word);
			}

			@Override
			public TokenType tokenTypeFor(Object value) {
				return TokenType.COLOR_LITERAL;
			}
		};
	}

	/**
	 * A rule recognizing the phrases of a keyword category. The token value is
	 * the word itself for flat categories, the sub-kind otherwise.
	 *
	 * @param category keyword category
	 * @param tokenType type of the produced tokens
	 * @param match how loosely words match
	 * @return the rule
	 */
	public static ClassificationRule category(KeywordCategory category, TokenType tokenType, Match match) {
		return new CategoryRule(category, tokenType, match);
	}

	/**
	 * Comparison phrases; the <code>and</code>, <code>or</code> and
	 * <code>not</code> sub-kinds produce logical operators.
	 *
	 * @return the rule
	 */
	public static ClassificationRule comparison() {
		return new CategoryRule(KeywordCategory.COMPARISON, TokenType.COMPARISON_OPERATOR, Match.EXACT) {
			@Override
			public TokenType tokenTypeFor(Object value) {
				if ("and".equals(value) || "or".equals(value) || "not".equals(value)) {
					return TokenType.LOGICAL_OPERATOR;
				}
				return TokenType.COMPARISON_OPERATOR;
			}
		};
	}

	private static class CategoryRule extends ClassificationRule {

		private final KeywordCategory category;
		private final TokenType tokenType;
		private final Match match;

		CategoryRule(KeywordCategory category, TokenType tokenType, Match match) {
			super(category.getKey());
			this.category = category;
			this.tokenType = tokenType;
			this.match = match;
		}

		@Override
		public Object matchExact(KeywordTable table, String word) {
			return valueOf(table.findExact(category, word), word);
		}

		@Override
		public Object matchLoose(KeywordTable table, String word) {
			switch (match) {
			case EXACT_OR_PREFIX:
				return valueOf(table.findPrefixOf(category, word), word);
			case CONTAINS:
				return valueOf(table.findContainedIn(category, word), word);
			default:
				return null;
			}
		}

		@Override
		public TokenType tokenTypeFor(Object value) {
			return tokenType;
		}

		private Object valueOf(String subKind, String word) {
			if (subKind == null) {
				return null;
			}
			return category.isFlat() ? word : subKind;
		}
	}
}
