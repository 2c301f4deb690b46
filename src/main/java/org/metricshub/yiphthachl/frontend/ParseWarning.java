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

/**
 * The parser used a default value in place of missing or unreadable input,
 * like an empty label for a button written without one. Only recorded when
 * {@link org.metricshub.yiphthachl.util.FrontendSettings#isReportDegradedDefaults()}
 * is set. Warnings never make a parse fail.
 */
public final class ParseWarning {

	private final String message;
	private final int line;
	private final int column;

	public ParseWarning(String message, int line, int column) {
		this.message = message;
		this.line = line;
		this.column = column;
	}

	public String getMessage() {
		return message;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @return <code>line:column: warning: message</code>
	 */
	@Override
	public String toString() {
		return line + ":" + column + ": warning: " + message;
	}
}
