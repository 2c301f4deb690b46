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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.yiphthachl.frontend.ClassificationRule.Match;
import org.metricshub.yiphthachl.keywords.KeywordCategory;
import org.metricshub.yiphthachl.keywords.KeywordTable;

/**
 * Decides the token type of a word (or merged phrase) with an ordered list
 * of {@link ClassificationRule}s.
 * <p>
 * The rules are tried in two passes: first the exact test of every rule in
 * order, then the loose test of every rule in order. A complete phrase like
 * <code>when pressed</code> thus wins over the shorter phrase
 * <code>when</code> of an earlier rule, which would only match it as a prefix.
 * Words no rule recognizes are identifiers.
 */
public class WordClassifier {

	private final KeywordTable keywords;
	private final List<ClassificationRule> rules;

	/**
	 * Classifier with the default rules.
	 *
	 * @param keywords keyword table to match against
	 */
	public WordClassifier(KeywordTable keywords) {
		this(keywords, defaultRules());
	}

	/**
	 * @param keywords keyword table to match against
	 * @param rules rules, highest priority first
	 */
	public WordClassifier(KeywordTable keywords, List<ClassificationRule> rules) {
		this.keywords = keywords;
		this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
	}

	/**
	 * @return the default rules, highest priority first
	 */
	public static List<ClassificationRule> defaultRules() {
		List<ClassificationRule> rules = new ArrayList<>();
		rules.add(ClassificationRule.booleanWords());
		rules.add(ClassificationRule.colorNames());
		rules.add(ClassificationRule.category(KeywordCategory.VARIABLE_DECLARATION, TokenType.VARIABLE_DECLARATION, Match.EXACT));
		rules.add(ClassificationRule.category(KeywordCategory.ASSIGNMENT, TokenType.ASSIGNMENT, Match.EXACT));
		rules.add(ClassificationRule.category(KeywordCategory.FUNCTION_DECLARATION, TokenType.FUNCTION_DECLARATION, Match.EXACT_OR_PREFIX));
		rules.add(ClassificationRule.category(KeywordCategory.CONDITIONAL, TokenType.CONDITIONAL, Match.EXACT_OR_PREFIX));
		rules.add(ClassificationRule.category(KeywordCategory.LOOP, TokenType.LOOP, Match.EXACT_OR_PREFIX));
		rules.add(ClassificationRule.comparison());
		rules.add(ClassificationRule.category(KeywordCategory.ARITHMETIC, TokenType.ARITHMETIC_OPERATOR, Match.EXACT));
		rules.add(ClassificationRule.category(KeywordCategory.WIDGET, TokenType.WIDGET_TYPE, Match.CONTAINS));
		rules.add(ClassificationRule.category(KeywordCategory.STYLE, TokenType.STYLE_PROPERTY, Match.CONTAINS));
		rules.add(ClassificationRule.category(KeywordCategory.EVENT, TokenType.EVENT_TYPE, Match.EXACT_OR_PREFIX));
		return rules;
	}

	/**
	 * @return the rules, highest priority first
	 */
	public List<ClassificationRule> getRules() {
		return rules;
	}

	/**
	 * @param word lower-case word, or words separated by single spaces
	 * @return the token type and value for the word
	 */
	public Classification classify(String word) {
		for (ClassificationRule rule : rules) {
			Object value = rule.matchExact(keywords, word);
			if (value != null) {
				return new Classification(rule.tokenTypeFor(value), value);
			}
		}
		for (ClassificationRule rule : rules) {
			Object value = rule.matchLoose(keywords, word);
			if (value != null) {
				return new Classification(rule.tokenTypeFor(value), value);
			}
		}
		return new Classification(TokenType.IDENTIFIER, word);
	}

	/**
	 * Result of {@link WordClassifier#classify(String)}.
	 */
	public static final class Classification {

		private final TokenType type;
		private final Object value;

		Classification(TokenType type, Object value) {
			this.type = type;
			this.value = value;
		}

		public TokenType getType() {
			return type;
		}

		public Object getValue() {
			return value;
		}

		@Override
		public String toString() {
			return type + " " + value;
		}
	}
}
