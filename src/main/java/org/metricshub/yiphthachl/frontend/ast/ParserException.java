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
 * Thrown by the parser when it cannot continue at all. The parser catches it
 * once at the top level and reports it as the single parse error.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String reason;
	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param reason what went wrong, without location
	 * @param sourceDescription name of the source being parsed
	 * @param lineNumber 1-based line of the offending token
	 * @param column 1-based column of the offending token
	 */
	public ParserException(String reason, String sourceDescription, int lineNumber, int column) {
		super(reason + " (" + sourceDescription + ":" + lineNumber + ":" + column + ")");
		this.reason = reason;
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	/**
	 * @return the message without the location suffix
	 */
	public String getReason() {
		return reason;
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
