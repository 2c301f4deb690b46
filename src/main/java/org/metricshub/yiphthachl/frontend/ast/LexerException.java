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

/**
 * Thrown by the tokenizer when its cursor reaches a state that well-formed
 * processing can never produce. Malformed source text alone never causes it.
 */
public class LexerException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	/**
	 * <p>
	 * Constructor for LexerException.
	 * </p>
	 *
	 * @param msg what went wrong
	 * @param sourceDescription name of the source being tokenized
	 * @param lineNumber 1-based line of the cursor
	 * @param column 1-based column of the cursor
	 */
	public LexerException(String msg, String sourceDescription, int lineNumber, int column) {
		super(msg + " (" + sourceDescription + ":" + lineNumber + ":" + column + ")");
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public int getColumn() {
		return column;
	}
}
