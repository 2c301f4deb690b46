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

import java.util.Objects;

/**
 * One token of Yiphthachl source text.
 * <p>
 * The value depends on the type: a <code>String</code> for literals,
 * identifiers, comments and operator symbols, a <code>Double</code> for
 * numbers, a <code>Boolean</code> for boolean literals, the hexadecimal code
 * for colors, and the sub-kind of the keyword category (like
 * <code>onPressed</code> or <code>greaterThan</code>) for most keywords.
 * The raw text is the source text the token was read from, in its original case.
 */
public final class Token {

	private final TokenType type;
	private final Object value;
	private final int line;
	private final int column;
	private final String raw;

	/**
	 * @param type kind of token
	 * @param value decoded value
	 * @param line 1-based line where the token starts
	 * @param column 1-based column where the token starts
	 * @param raw source text of the token
	 */
	public Token(TokenType type, Object value, int line, int column, String raw) {
		this.type = Objects.requireNonNull(type, "type");
		this.value = value;
		this.line = line;
		this.column = column;
		this.raw = raw == null ? String.valueOf(value) : raw;
	}

	public TokenType getType() {
		return type;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * @return the value as a string, or an empty string when there is no value
	 */
	public String getText() {
		return value == null ? "" : value.toString();
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public String getRaw() {
		return raw;
	}

	/**
	 * @param expected a token type
	 * @param expectedValue a value, compared with {@link #getText()}
	 * @return whether this token has both the type and the value
	 */
	public boolean is(TokenType expected, String expectedValue) {
		return type == expected && getText().equals(expectedValue);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Token)) {
			return false;
		}
		Token token = (Token) other;
		return type == token.type
				&& line == token.line
				&& column == token.column
				&& Objects.equals(value, token.value)
				&& raw.equals(token.raw);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, Integer.valueOf(line), Integer.valueOf(column), raw);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(line).append(':').append(column).append(' ').append(type);
		if (type != TokenType.NEWLINE && type != TokenType.BLOCK_OPEN && type != TokenType.BLOCK_CLOSE && type != TokenType.EOF) {
			sb.append(' ');
			if (value instanceof String) {
				sb.append('"').append(value).append('"');
			} else {
				sb.append(value);
			}
		}
		return sb.toString();
	}
}
