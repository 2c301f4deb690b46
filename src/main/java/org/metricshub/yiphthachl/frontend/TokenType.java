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
 * Kinds of tokens produced by the {@link Tokenizer}.
 */
public enum TokenType {
	STRING_LITERAL,
	NUMBER_LITERAL,
	BOOLEAN_LITERAL,
	COLOR_LITERAL,
	IDENTIFIER,
	VARIABLE_DECLARATION,
	ASSIGNMENT,
	FUNCTION_DECLARATION,
	/** Reserved: function calls are recognized by the parser from identifiers */
	FUNCTION_CALL,
	CONDITIONAL,
	LOOP,
	COMPARISON_OPERATOR,
	LOGICAL_OPERATOR,
	ARITHMETIC_OPERATOR,
	WIDGET_TYPE,
	STYLE_PROPERTY,
	EVENT_TYPE,
	/** Symbols and punctuation: <code>+ - * / % = &lt; &gt; ! &amp; | [ ] { } , :</code> and their two-character forms */
	GENERIC_OPERATOR,
	COMMENT,
	NEWLINE,
	/** Indentation increased */
	BLOCK_OPEN,
	/** Indentation decreased by one level */
	BLOCK_CLOSE,
	EOF
}
