package org.metricshub.yiphthachl;

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

import java.io.IOException;
import java.util.List;
import org.metricshub.yiphthachl.frontend.ParseError;
import org.metricshub.yiphthachl.frontend.ParseResult;
import org.metricshub.yiphthachl.frontend.Parser;
import org.metricshub.yiphthachl.frontend.Token;
import org.metricshub.yiphthachl.frontend.Tokenizer;
import org.metricshub.yiphthachl.frontend.ast.AstNode;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptSource;
import org.metricshub.yiphthachl.util.YiphthachlLogger;
import org.slf4j.Logger;

/**
 * Entry point into the tokenizing and parsing of a Yiphthachl program.
 * This entry point is used both when Yiphthachl is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Tokenize the source, merging multi-word phrases and turning
 * indentation into block markers.
 * <li>Parse the tokens, producing a syntax tree together with the parse
 * errors and warnings.
 * </ul>
 * Every call creates its own {@link Tokenizer} and {@link Parser}, so one
 * instance can be shared between threads once its settings are no longer
 * modified.
 */
public class Yiphthachl {

	private static final Logger LOG = YiphthachlLogger.getLogger(Yiphthachl.class);

	private final FrontendSettings settings;

	/**
	 * Create a new instance with the default keyword table and settings
	 */
	public Yiphthachl() {
		this(new FrontendSettings());
	}

	/**
	 * Create a new instance with the specified settings.
	 *
	 * @param settings keyword table, tab width, nesting limit and warning switch
	 */
	public Yiphthachl(FrontendSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings must not be null");
		}
		this.settings = settings;
	}

	/**
	 * @return description of the settings in use
	 */
	public String getSettingsDescription() {
		return settings.toDescriptionString();
	}

	/**
	 * Tokenizes the specified program text.
	 *
	 * @param source program text
	 * @return the tokens, ending with EOF
	 */
	public List<Token> tokenize(String source) {
		return tokenize(source, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT);
	}

	/**
	 * Tokenizes the specified program source.
	 *
	 * @param source program source
	 * @return the tokens, ending with EOF
	 * @throws IOException if the source cannot be read
	 */
	public List<Token> tokenize(ScriptSource source) throws IOException {
		return tokenize(source.readText(), source.getDescription());
	}

	private List<Token> tokenize(String text, String description) {
		List<Token> tokens = new Tokenizer(text, description, settings).tokenize();
		LOG.debug("Tokenized {} into {} tokens", description, tokens.size());
		return tokens;
	}

	/**
	 * Tokenizes and parses the specified program text.
	 *
	 * @param source program text
	 * @return the syntax tree with the parse errors and warnings
	 */
	public ParseResult parse(String source) {
		return parse(source, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT);
	}

	/**
	 * Tokenizes and parses the specified program source.
	 *
	 * @param source program source
	 * @return the syntax tree with the parse errors and warnings
	 * @throws IOException if the source cannot be read
	 */
	public ParseResult parse(ScriptSource source) throws IOException {
		return parse(source.readText(), source.getDescription());
	}

	private ParseResult parse(String text, String description) {
		List<Token> tokens = tokenize(text, description);
		ParseResult result = new Parser(tokens, description, settings).parse();
		if (!result.isSuccessful()) {
			LOG.debug("{} has {} parse errors", description, result.getErrors().size());
		}
		return result;
	}

	/**
	 * Parses a single expression, like <code>score is greater than 10</code>.
	 *
	 * @param expression expression text
	 * @return the expression node
	 * @throws org.metricshub.yiphthachl.frontend.ast.ParserException if the
	 *         text is more than one expression or nests too deeply
	 */
	public AstNode parseExpression(String expression) {
		List<Token> tokens = tokenize(expression, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT);
		return new Parser(tokens, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, settings).parseExpression();
	}

	/**
	 * Parses the specified program text and only returns its errors.
	 *
	 * @param source program text
	 * @return the parse errors, empty when the program is usable
	 */
	public List<ParseError> validate(String source) {
		return parse(source).getErrors();
	}
}
