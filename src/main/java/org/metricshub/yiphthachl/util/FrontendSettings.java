package org.metricshub.yiphthachl.util;

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

import org.metricshub.yiphthachl.keywords.KeywordTable;

/**
 * A simple container for the parameters of the Yiphthachl front end.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the front end programmatically, from within Java code.
 * <p>
 * Once configured, an instance is only read by the tokenizer and the parser
 * and may be shared between them.
 */
public class FrontendSettings {

	/** Default width of a tab character, in columns */
	public static final int DEFAULT_TAB_WIDTH = 4;

	/** Default maximum number of nested blocks and expressions */
	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	/**
	 * Keyword phrases used to classify words;
	 * the built-in English table by default.
	 */
	private KeywordTable keywordTable = KeywordTable.defaults();

	/**
	 * Number of indentation columns a tab counts for;
	 * <code>4</code> by default.
	 */
	private int tabWidth = DEFAULT_TAB_WIDTH;

	/**
	 * Nesting depth beyond which parsing fails hard;
	 * <code>256</code> by default.
	 */
	private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

	/**
	 * Whether the parser records a warning every time it substitutes
	 * a default value for missing input;
	 * <code>false</code> by default.
	 */
	private boolean reportDegradedDefaults = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("keywordTable = ").append(getKeywordTable()).append(newLine);
		desc.append("tabWidth = ").append(getTabWidth()).append(newLine);
		desc.append("maxNestingDepth = ").append(getMaxNestingDepth()).append(newLine);
		desc.append("reportDegradedDefaults = ").append(isReportDegradedDefaults()).append(newLine);

		return desc.toString();
	}

	/**
	 * Keyword phrases used to classify words.
	 *
	 * @return the keyword table
	 */
	public KeywordTable getKeywordTable() {
		return keywordTable;
	}

	/**
	 * Keyword phrases used to classify words.
	 *
	 * @param keywordTable the keyword table, never <code>null</code>
	 */
	public void setKeywordTable(KeywordTable keywordTable) {
		if (keywordTable == null) {
			throw new IllegalArgumentException("keywordTable must not be null");
		}
		this.keywordTable = keywordTable;
	}

	/**
	 * <p>
	 * Getter for the field <code>tabWidth</code>.
	 * </p>
	 *
	 * @return a int
	 */
	public int getTabWidth() {
		return tabWidth;
	}

	/**
	 * <p>
	 * Setter for the field <code>tabWidth</code>.
	 * </p>
	 *
	 * @param tabWidth number of columns a tab counts for, at least 1
	 */
	public void setTabWidth(int tabWidth) {
		if (tabWidth < 1) {
			throw new IllegalArgumentException("Tab width must be at least 1: " + tabWidth);
		}
		this.tabWidth = tabWidth;
	}

	/**
	 * <p>
	 * Getter for the field <code>maxNestingDepth</code>.
	 * </p>
	 *
	 * @return a int
	 */
	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	/**
	 * <p>
	 * Setter for the field <code>maxNestingDepth</code>.
	 * </p>
	 *
	 * @param maxNestingDepth the deepest nesting accepted, at least 1
	 */
	public void setMaxNestingDepth(int maxNestingDepth) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("Maximum nesting depth must be at least 1: " + maxNestingDepth);
		}
		this.maxNestingDepth = maxNestingDepth;
	}

	/**
	 * <p>
	 * isReportDegradedDefaults.
	 * </p>
	 *
	 * @return whether defaulted values produce parse warnings
	 */
	public boolean isReportDegradedDefaults() {
		return reportDegradedDefaults;
	}

	/**
	 * <p>
	 * Setter for the field <code>reportDegradedDefaults</code>.
	 * </p>
	 *
	 * @param reportDegradedDefaults a boolean
	 */
	public void setReportDegradedDefaults(boolean reportDegradedDefaults) {
		this.reportDegradedDefaults = reportDegradedDefaults;
	}
}
