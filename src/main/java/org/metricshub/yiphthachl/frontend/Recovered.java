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
 * A value read by a sub-parser, which may be a default standing in for input
 * that was missing. Keeps the default visible at the call site so the parser
 * can report it as a {@link ParseWarning}.
 *
 * @param <T> type of the value
 */
final class Recovered<T> {

	private final T value;
	private final String reason;

	private Recovered(T value, String reason) {
		this.value = value;
		this.reason = reason;
	}

	/**
	 * @param <T> type of the value
	 * @param value value read from the tokens
	 * @return a value that needed no default
	 */
	static <T> Recovered<T> parsed(T value) {
		return new Recovered<T>(value, null);
	}

	/**
	 * @param <T> type of the value
	 * @param value default value
	 * @param reason what was missing, like "Expected a button label"
	 * @return a defaulted value
	 */
	static <T> Recovered<T> defaulted(T value, String reason) {
		return new Recovered<T>(value, reason);
	}

	T get() {
		return value;
	}

	boolean isDefaulted() {
		return reason != null;
	}

	String getReason() {
		return reason;
	}
}
