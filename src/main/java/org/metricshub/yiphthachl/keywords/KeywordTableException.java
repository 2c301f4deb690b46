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

/**
 * A keyword table file could not be understood.
 */
public class KeywordTableException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * @param message what is wrong with the line
	 * @param lineNumber 1-based line number in the keyword file
	 */
	public KeywordTableException(String message, int lineNumber) {
		super(message + " (line " + lineNumber + ")");
		this.lineNumber = lineNumber;
	}

	/**
	 * @return 1-based line number in the keyword file
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
