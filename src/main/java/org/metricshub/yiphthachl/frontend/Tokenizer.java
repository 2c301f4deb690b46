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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import org.metricshub.yiphthachl.frontend.WordClassifier.Classification;
import org.metricshub.yiphthachl.frontend.ast.LexerException;
import org.metricshub.yiphthachl.keywords.KeywordTable;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptSource;
import org.metricshub.yiphthachl.util.YiphthachlLogger;
import org.slf4j.Logger;

/**
 * Turns Yiphthachl source text into tokens.
 * <p>
 * Besides words, literals and operators, the tokenizer tracks indentation:
 * every increase of the leading whitespace of a line opens a block
 * ({@link TokenType#BLOCK_OPEN}) and every decrease closes one block per
 * indentation level left ({@link TokenType#BLOCK_CLOSE}). Blank lines and
 * comment-only lines leave the indentation unchanged.
 * <p>
 * Consecutive words are merged as long as they spell a keyword phrase of the
 * {@link KeywordTable} (or the beginning of one), so <code>for each</code>
 * or <code>is greater than</code> come out as a single token.
 * <p>
 * A tokenizer keeps cursor state and must not be shared between threads.
 * {@link #tokenize()} may be called again and always starts over.
 */
public class Tokenizer {

	private static final Logger LOG = YiphthachlLogger.getLogger(Tokenizer.class);

	private static final String OPERATOR_CHARACTERS = "+-*/%=<>!&|[]{},:";

	private final String source;
	private final String sourceDescription;
	private final KeywordTable keywords;
	private final WordClassifier classifier;
	private final int tabWidth;

	private List<Token> tokens;
	private Deque<Integer> indentStack;
	private int current;
	private int line;
	private int column;
	private boolean atLineStart;

	/**
	 * Tokenizer with the default settings.
	 *
	 * @param source the program text
	 */
	public Tokenizer(String source) {
		this(source, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new FrontendSettings());
	}

	/**
	 * <p>
	 * Constructor for Tokenizer.
	 * </p>
	 *
	 * @param source the program text
	 * @param sourceDescription name of the source, for error messages
	 * @param settings keyword table and tab width to use
	 */
	public Tokenizer(String source, String sourceDescription, FrontendSettings settings) {
		this.source = source == null ? "" : source;
		this.sourceDescription = sourceDescription;
		this.keywords = settings.getKeywordTable();
		this.classifier = new WordClassifier(keywords);
		this.tabWidth = settings.getTabWidth();
	}

	/**
	 * Reads the whole source text.
	 *
	 * @return the tokens, ending with {@link TokenType#EOF}
	 * @throws LexerException if the indentation bookkeeping gets corrupted
	 */
	public List<Token> tokenize() {
		tokens = new ArrayList<>();
		indentStack = new ArrayDeque<>();
		indentStack.push(Integer.valueOf(0));
		current = 0;
		line = 1;
		column = 1;
		atLineStart = true;

		while (!isAtEnd()) {
			scanToken();
		}

		// Close every block still open
		while (indentStack.size() > 1) {
			popIndentation();
			addToken(TokenType.BLOCK_CLOSE, null, line, column, "");
		}
		addToken(TokenType.EOF, null, line, column, "");

		LOG.trace("Read {} tokens from {}", tokens.size(), sourceDescription);
		return Collections.unmodifiableList(tokens);
	}

	private void scanToken() {
		if (atLineStart) {
			atLineStart = false;
			handleIndentation();
		} else {
			skipWhitespace();
		}
		if (isAtEnd()) {
			return;
		}

		char c = peek();
		if (c == '#') {
			scanComment();
		} else if (c == '\n') {
			addToken(TokenType.NEWLINE, "\n", line, column, "\n");
			advance();
			line++;
			column = 1;
			atLineStart = true;
		} else if (c == '"' || c == '\'') {
			scanString(c);
		} else if (isDigit(c)) {
			scanNumber();
		} else if (isWordStart(c)) {
			scanWord();
		} else if (OPERATOR_CHARACTERS.indexOf(c) >= 0) {
			scanOperator();
		} else {
			// unknown character
			advance();
		}
	}

	/**
	 * Measures the leading whitespace of a line and opens or closes blocks.
	 */
	private void handleIndentation() {
		int indent = 0;
		while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
			indent += advance() == '\t' ? tabWidth : 1;
		}

		// Blank and comment-only lines do not change the indentation
		if (isAtEnd() || peek() == '\n' || peek() == '\r' || peek() == '#') {
			return;
		}

		int top = indentStack.peek().intValue();
		if (indent > top) {
			indentStack.push(Integer.valueOf(indent));
			addToken(TokenType.BLOCK_OPEN, null, line, column, "");
		} else if (indent < top) {
			// An indentation between two levels closes down to the lower one
			while (indentStack.size() > 1 && indentStack.peek().intValue() > indent) {
				popIndentation();
				addToken(TokenType.BLOCK_CLOSE, null, line, column, "");
			}
		}
	}

	private void popIndentation() {
		if (indentStack.size() <= 1) {
			throw lexerException("Cannot close the outermost indentation level");
		}
		indentStack.pop();
	}

	private void skipWhitespace() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r') {
				advance();
			} else {
				return;
			}
		}
	}

	private void scanComment() {
		int start = current;
		int startColumn = column;
		advance();
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		String raw = source.substring(start, current);
		addToken(TokenType.COMMENT, raw.substring(1).trim(), line, startColumn, raw.trim());
	}

	/**
	 * Strings may span lines. A backslash only escapes the quote that opened
	 * the string; an unterminated string runs to the end of the text.
	 */
	private void scanString(char quote) {
		int start = current;
		int startLine = line;
		int startColumn = column;
		advance();

		StringBuilder value = new StringBuilder();
		while (!isAtEnd() && peek() != quote) {
			if (peek() == '\\' && peekNext() == quote) {
				advance();
			}
			char c = advance();
			if (c == '\n') {
				line++;
				column = 1;
			}
			value.append(c);
		}
		if (!isAtEnd()) {
			advance();
		}
		addToken(TokenType.STRING_LITERAL, value.toString(), startLine, startColumn, source.substring(start, current));
	}

	private void scanNumber() {
		int start = current;
		int startColumn = column;
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
			advance();
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}
		String raw = source.substring(start, current);
		addToken(TokenType.NUMBER_LITERAL, Double.valueOf(raw), line, startColumn, raw);
	}

	/**
	 * Reads a word and merges the following words while they spell a keyword
	 * phrase or the beginning of one. When the longer phrase never completes,
	 * the cursor goes back to the end of the longest complete phrase read
	 * (or of the first word).
	 */
	private void scanWord() {
		int start = current;
		int startColumn = column;
		readWord();

		String phrase = lowerCase(source.substring(start, current));
		int committedEnd = current;
		int committedColumn = column;

		while (!isAtEnd() && peek() == ' ' && current + 1 < source.length() && isWordStart(source.charAt(current + 1))) {
			int wordStart = current + 1;
			int wordEnd = wordStart;
			while (wordEnd < source.length() && isWordPart(source.charAt(wordEnd))) {
				wordEnd++;
			}
			String candidate = phrase + " " + lowerCase(source.substring(wordStart, wordEnd));
			boolean complete = keywords.isPhrase(candidate);
			if (!complete && !keywords.isPhrasePrefix(candidate)) {
				break;
			}
			column += wordEnd - current;
			current = wordEnd;
			phrase = candidate;
			if (complete) {
				committedEnd = current;
				committedColumn = column;
			}
		}

		// Roll back words of a phrase that never completed
		current = committedEnd;
		column = committedColumn;

		String raw = source.substring(start, current);
		String word = lowerCase(raw);
		Classification classification = classifier.classify(word);
		addToken(classification.getType(), classification.getValue(), line, startColumn, raw);
	}

	private void readWord() {
		while (!isAtEnd() && isWordPart(peek())) {
			advance();
		}
	}

	private void scanOperator() {
		int startColumn = column;
		char c = advance();
		String op = String.valueOf(c);
		if ((c == '=' || c == '!' || c == '<' || c == '>') && !isAtEnd() && peek() == '=') {
			op += advance();
		} else if ((c == '&' || c == '|') && !isAtEnd() && peek() == c) {
			op += advance();
		}
		addToken(TokenType.GENERIC_OPERATOR, op, line, startColumn, op);
	}

	private void addToken(TokenType type, Object value, int tokenLine, int tokenColumn, String raw) {
		tokens.add(new Token(type, value, tokenLine, tokenColumn, raw));
	}

	private boolean isAtEnd() {
		return current >= source.length();
	}

	private char peek() {
		return source.charAt(current);
	}

	private char peekNext() {
		return current + 1 < source.length() ? source.charAt(current + 1) : '\0';
	}

	private char advance() {
		column++;
		return source.charAt(current++);
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, line, column);
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isWordStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isWordPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private static String lowerCase(String text) {
		return text.toLowerCase(Locale.ROOT);
	}
}
