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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.yiphthachl.frontend.ast.AppBarAst;
import org.metricshub.yiphthachl.frontend.ast.AppDeclarationAst;
import org.metricshub.yiphthachl.frontend.ast.AssignmentAst;
import org.metricshub.yiphthachl.frontend.ast.AstNode;
import org.metricshub.yiphthachl.frontend.ast.BinaryExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.BlockAst;
import org.metricshub.yiphthachl.frontend.ast.BooleanLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.BottomNavItemAst;
import org.metricshub.yiphthachl.frontend.ast.BottomNavigationAst;
import org.metricshub.yiphthachl.frontend.ast.ButtonAst;
import org.metricshub.yiphthachl.frontend.ast.CardAst;
import org.metricshub.yiphthachl.frontend.ast.CenterAst;
import org.metricshub.yiphthachl.frontend.ast.ColorLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.ColumnAst;
import org.metricshub.yiphthachl.frontend.ast.CommentAst;
import org.metricshub.yiphthachl.frontend.ast.ComparisonExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.ContainerAst;
import org.metricshub.yiphthachl.frontend.ast.EventHandlerAst;
import org.metricshub.yiphthachl.frontend.ast.ForLoopAst;
import org.metricshub.yiphthachl.frontend.ast.FunctionCallAst;
import org.metricshub.yiphthachl.frontend.ast.FunctionDeclarationAst;
import org.metricshub.yiphthachl.frontend.ast.GenericWidgetAst;
import org.metricshub.yiphthachl.frontend.ast.GoBackAst;
import org.metricshub.yiphthachl.frontend.ast.IconAst;
import org.metricshub.yiphthachl.frontend.ast.IfStatementAst;
import org.metricshub.yiphthachl.frontend.ast.ImageAst;
import org.metricshub.yiphthachl.frontend.ast.ListLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.ListViewAst;
import org.metricshub.yiphthachl.frontend.ast.LogicalExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.MapLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.NavigateAst;
import org.metricshub.yiphthachl.frontend.ast.NumberLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.ParserException;
import org.metricshub.yiphthachl.frontend.ast.ProgramAst;
import org.metricshub.yiphthachl.frontend.ast.RepeatLoopAst;
import org.metricshub.yiphthachl.frontend.ast.RowAst;
import org.metricshub.yiphthachl.frontend.ast.ScaffoldAst;
import org.metricshub.yiphthachl.frontend.ast.ScreenAst;
import org.metricshub.yiphthachl.frontend.ast.ShowMessageAst;
import org.metricshub.yiphthachl.frontend.ast.SourceLocation;
import org.metricshub.yiphthachl.frontend.ast.StringLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.TextAst;
import org.metricshub.yiphthachl.frontend.ast.TextFieldAst;
import org.metricshub.yiphthachl.frontend.ast.UnaryExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.UpdateStateAst;
import org.metricshub.yiphthachl.frontend.ast.VariableDeclarationAst;
import org.metricshub.yiphthachl.frontend.ast.VariableReferenceAst;
import org.metricshub.yiphthachl.frontend.ast.WhileLoopAst;
import org.metricshub.yiphthachl.keywords.KeywordCategory;
import org.metricshub.yiphthachl.keywords.KeywordTable;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptSource;
import org.metricshub.yiphthachl.util.YiphthachlLogger;
import org.slf4j.Logger;

/**
 * Recursive descent parser turning the tokens of a Yiphthachl program into
 * a syntax tree.
 * <p>
 * Blocks are delimited by the {@link TokenType#BLOCK_OPEN} and
 * {@link TokenType#BLOCK_CLOSE} tokens the tokenizer derives from
 * indentation. Closing phrases like <code>end if</code> or
 * <code>end when</code> are accepted and ignored.
 * <p>
 * The parser fails in two ways:
 * <ul>
 * <li>Missing or unreadable pieces are replaced with defaults (an empty
 * string, a count of 1, an empty body) and parsing goes on. These are only
 * reported, as {@link ParseWarning}s, when
 * {@link FrontendSettings#isReportDegradedDefaults()} is set.
 * <li>Nesting deeper than {@link FrontendSettings#getMaxNestingDepth()}, or
 * input the parser cannot move past, stops the parse. The failure is
 * reported as the single {@link ParseError} of the {@link ParseResult},
 * together with the statements read until then.
 * </ul>
 * A parser keeps cursor state and must not be shared between threads.
 */
public class Parser {

	private static final Logger LOG = YiphthachlLogger.getLogger(Parser.class);

	/** Identifiers ending an identifier run inside an expression */
	private static final Set<String> EXPRESSION_STOP_WORDS = new HashSet<>(Arrays.asList("to", "as", "with", "and", "or"));

	private static final Set<String> LOGICAL_KINDS = new HashSet<>(Arrays.asList("and", "or", "not"));
	private static final Set<String> ADDITIVE_KINDS = new HashSet<>(Arrays.asList("add", "subtract"));
	private static final Set<String> MULTIPLICATIVE_KINDS = new HashSet<>(Arrays.asList("multiply", "divide", "modulo"));

	private static final String[] TEXT_CONNECTORS = { "that", "says", "saying", "shows", "displaying" };
	private static final String[] LABEL_CONNECTORS = { "that", "says", "saying", "labeled" };
	private static final String[] ARTICLES = { "the", "a", "an" };
	private static final String[] PARAMETER_INTRODUCERS = { "that", "takes", "with" };

	private final List<Token> tokens;
	private final String sourceDescription;
	private final KeywordTable keywords;
	private final int maxNestingDepth;
	private final boolean reportDegradedDefaults;

	private final List<ParseWarning> warnings = new ArrayList<>();
	private int current;
	private int depth;
	private int actionDepth;
	private boolean inCondition;

	/**
	 * Parser with the default settings.
	 *
	 * @param tokens tokens ending with {@link TokenType#EOF}
	 */
	public Parser(List<Token> tokens) {
		this(tokens, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new FrontendSettings());
	}

	/**
	 * <p>
	 * Constructor for Parser.
	 * </p>
	 *
	 * @param tokens tokens ending with {@link TokenType#EOF}
	 * @param sourceDescription name of the source, for error messages
	 * @param settings keyword table, nesting limit and warning switch
	 * @throws IllegalArgumentException when the tokens do not end with EOF
	 */
	public Parser(List<Token> tokens, String sourceDescription, FrontendSettings settings) {
		if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
			throw new IllegalArgumentException("The token list must end with an EOF token");
		}
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		this.sourceDescription = sourceDescription;
		this.keywords = settings.getKeywordTable();
		this.maxNestingDepth = settings.getMaxNestingDepth();
		this.reportDegradedDefaults = settings.isReportDegradedDefaults();
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return the program with the parse errors and warnings
	 */
	public ParseResult parse() {
		reset();
		List<AstNode> statements = new ArrayList<>();
		List<ParseError> errors = new ArrayList<>();
		try {
			PROGRAM(statements);
		} catch (ParserException pe) {
			LOG.warn("Stopped parsing {}: {}", sourceDescription, pe.getMessage());
			errors.add(new ParseError(pe.getReason(), pe.getLineNumber(), pe.getColumn()));
		}

		LOG.debug("Parsed {} top-level statements from {} ({} errors, {} warnings)", statements.size(), sourceDescription, errors.size(), warnings.size());
		return new ParseResult(new ProgramAst(new SourceLocation(1, 1), statements), errors, warnings);
	}

	/**
	 * Parses the token list as a single expression, like
	 * <code>count is greater than 3 and done is no</code>. The
	 * <code>is</code> / <code>equals</code> words compare, as in conditions.
	 *
	 * @return the expression
	 * @throws ParserException when tokens remain after the expression
	 */
	public AstNode parseExpression() {
		reset();
		skipNewlines();
		AstNode expression = CONDITION();
		skipNewlines();
		if (!isAtEnd()) {
			throw parserException("Unexpected " + describe(peek()) + " after the expression", peek());
		}
		return expression;
	}

	/**
	 * @return warnings of the last parse
	 */
	public List<ParseWarning> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	private void reset() {
		current = 0;
		depth = 0;
		actionDepth = 0;
		inCondition = false;
		warnings.clear();
	}

	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : { NEWLINE | BLOCK_CLOSE | STATEMENT } EOF
	private void PROGRAM(List<AstNode> statements) {
		while (true) {
			skipNewlines();
			if (isAtEnd()) {
				return;
			}
			if (check(TokenType.BLOCK_CLOSE)) {
				advance();
				continue;
			}
			int before = current;
			STATEMENT_OR_BLOCK(statements);
			ensureProgress(before);
		}
	}

	// STATEMENT_LIST : { NEWLINE | STATEMENT_OR_BLOCK } until BLOCK_CLOSE or EOF
	private void STATEMENT_LIST(List<AstNode> statements, boolean stopAtEndFunction) {
		while (true) {
			skipNewlines();
			if (check(TokenType.BLOCK_CLOSE) || isAtEnd() || (stopAtEndFunction && peekEndFunction())) {
				return;
			}
			int before = current;
			STATEMENT_OR_BLOCK(statements);
			ensureProgress(before);
		}
	}

	// STATEMENT_OR_BLOCK : BLOCK | STATEMENT
	// A block nobody asked for contributes its statements to the enclosing list
	private void STATEMENT_OR_BLOCK(List<AstNode> statements) {
		if (check(TokenType.BLOCK_OPEN)) {
			warn("Unexpected indentation", peek());
			statements.addAll(recover(BLOCK(), peek()));
			return;
		}
		AstNode statement = actionDepth > 0 ? ACTION() : STATEMENT();
		if (statement != null) {
			statements.add(statement);
		}
	}

	// BLOCK : NEWLINE* BLOCK_OPEN STATEMENT_LIST BLOCK_CLOSE
	private Recovered<List<AstNode>> BLOCK() {
		skipNewlines();
		if (!check(TokenType.BLOCK_OPEN)) {
			return Recovered.<List<AstNode>>defaulted(new ArrayList<AstNode>(), "Expected an indented block. Found: " + describe(peek()));
		}
		Token open = advance();
		enter(open);
		List<AstNode> statements = new ArrayList<>();
		STATEMENT_LIST(statements, false);
		leave();
		optBlockClose();
		return Recovered.parsed(statements);
	}

	// STATEMENT : COMMENT | APP_DECLARATION | SCREEN | WIDGET | VARIABLE_DECLARATION | FUNCTION_DECLARATION
	// | IF_STATEMENT | LOOP | EVENT_HANDLER | IDENTIFIER_STATEMENT | MATH_STATEMENT
	private AstNode STATEMENT() {
		skipNewlines();
		Token token = peek();
		switch (token.getType()) {
		case COMMENT:
			advance();
			return new CommentAst(location(token), token.getText());
		case WIDGET_TYPE:
			if ("app".equals(token.getText())) {
				return APP_DECLARATION();
			}
			if ("screen".equals(token.getText())) {
				return SCREEN();
			}
			return WIDGET();
		case VARIABLE_DECLARATION:
			return VARIABLE_DECLARATION();
		case FUNCTION_DECLARATION:
			return FUNCTION_DECLARATION();
		case CONDITIONAL:
			if ("if".equals(token.getText())) {
				return IF_STATEMENT();
			}
			// "end if" and friends
			advance();
			if (!"end".equals(token.getText())) {
				warn("'" + token.getRaw() + "' without a matching condition", token);
			}
			return null;
		case LOOP:
			return LOOP();
		case EVENT_TYPE:
			return EVENT_HANDLER();
		case IDENTIFIER:
			return IDENTIFIER_STATEMENT();
		case ARITHMETIC_OPERATOR:
			return MATH_STATEMENT();
		case GENERIC_OPERATOR:
			if (arithmeticKind(token) != null) {
				return MATH_STATEMENT();
			}
			advance();
			return null;
		case NEWLINE:
		case BLOCK_CLOSE:
		case EOF:
			return null;
		default:
			// Literals and keywords that cannot start a statement
			advance();
			return null;
		}
	}

	// APP_DECLARATION : app ( STRING | IDENTIFIER* ) BLOCK
	private AstNode APP_DECLARATION() {
		Token app = advance();
		Recovered<String> name;
		if (check(TokenType.STRING_LITERAL)) {
			name = Recovered.parsed(advance().getText());
		} else {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER)) {
				words.add(advance().getText());
			}
			name = words.isEmpty() ? Recovered.defaulted("My App", "Expected an app name") : Recovered.parsed(joinWords(words));
		}

		List<ScreenAst> screens = new ArrayList<>();
		List<AstNode> configuration = new ArrayList<>();
		for (AstNode statement : recover(BLOCK(), app)) {
			if (statement instanceof ScreenAst) {
				screens.add((ScreenAst) statement);
			} else {
				configuration.add(statement);
			}
		}
		return new AppDeclarationAst(location(app), recover(name, app), screens, configuration);
	}

	// SCREEN : screen [ STRING | IDENTIFIER* ] BLOCK
	private AstNode SCREEN() {
		Token screen = advance();
		boolean main = hasWord(screen.getRaw(), "main");
		Recovered<String> name;
		if (check(TokenType.STRING_LITERAL)) {
			name = Recovered.parsed(advance().getText());
		} else {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER) && !peekIs("with", "using")) {
				words.add(advance().getText());
			}
			if (!words.isEmpty()) {
				name = Recovered.parsed(joinWords(words));
			} else if (main) {
				name = Recovered.parsed("main");
			} else {
				name = Recovered.defaulted("main", "Expected a screen name");
			}
		}
		List<AstNode> body = recover(BLOCK(), screen);
		return new ScreenAst(location(screen), recover(name, screen), body, main);
	}

	// VARIABLE_DECLARATION : VARIABLE_DECLARATION IDENTIFIER* [ ASSIGNMENT ] EXPRESSION
	private AstNode VARIABLE_DECLARATION() {
		Token declaration = advance();
		boolean state = keywords.getPhrases(KeywordCategory.STATE, "remember").contains(declaration.getText());
		List<String> words = new ArrayList<>();
		while (check(TokenType.IDENTIFIER) && !isAssignmentKeyword()) {
			words.add(advance().getText());
		}
		String name = recover(name(words, "Expected a variable name"), declaration);
		if (isAssignmentKeyword()) {
			advance();
		}
		AstNode value = EXPRESSION();
		return new VariableDeclarationAst(location(declaration), name, value, state);
	}

	// FUNCTION_DECLARATION : FUNCTION_DECLARATION ( STRING | IDENTIFIER* ) [ (that|takes|with)+ PARAMETERS ] FUNCTION_BODY
	// PARAMETERS : IDENTIFIER+ { (and|,) IDENTIFIER+ }
	private AstNode FUNCTION_DECLARATION() {
		Token function = advance();
		Recovered<String> name;
		if (check(TokenType.STRING_LITERAL)) {
			name = Recovered.parsed(advance().getText());
		} else {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER) && !peekIs(PARAMETER_INTRODUCERS)) {
				words.add(advance().getText());
			}
			name = name(words, "Expected a function name");
		}

		List<String> parameters = new ArrayList<>();
		if (peekIs(PARAMETER_INTRODUCERS)) {
			while (peekIs(PARAMETER_INTRODUCERS)) {
				advance();
			}
			while (check(TokenType.IDENTIFIER)) {
				List<String> words = new ArrayList<>();
				while (check(TokenType.IDENTIFIER) && !peekWord("and")) {
					words.add(advance().getText());
				}
				if (!words.isEmpty()) {
					parameters.add(joinName(words));
				}
				if (peekWord("and") || isSymbol(",")) {
					advance();
				}
			}
		}

		List<AstNode> body = FUNCTION_BODY(function);
		return new FunctionDeclarationAst(location(function), recover(name, function), parameters, body);
	}

	// FUNCTION_BODY : NEWLINE* BLOCK_OPEN STATEMENT_LIST [ end function NEWLINE* ] BLOCK_CLOSE
	private List<AstNode> FUNCTION_BODY(Token function) {
		skipNewlines();
		if (!check(TokenType.BLOCK_OPEN)) {
			return recover(Recovered.<List<AstNode>>defaulted(new ArrayList<AstNode>(), "Expected the function body as an indented block"), function);
		}
		Token open = advance();
		enter(open);
		List<AstNode> body = new ArrayList<>();
		STATEMENT_LIST(body, true);
		leave();
		if (peekEndFunction()) {
			consumeEndFunction();
			skipNewlines();
		}
		optBlockClose();
		return body;
	}

	// IF_STATEMENT : if CONDITION BLOCK [ elseif IF_STATEMENT | else BLOCK ]
	private IfStatementAst IF_STATEMENT() {
		Token ifToken = advance();
		AstNode condition = CONDITION();
		List<AstNode> consequent = recover(BLOCK(), ifToken);

		AstNode alternate = null;
		int mark = current;
		skipNewlines();
		if (checkValue(TokenType.CONDITIONAL, "elseif")) {
			// Each link of an "otherwise if" chain nests one level deeper
			enter(peek());
			alternate = IF_STATEMENT();
			leave();
		} else if (checkValue(TokenType.CONDITIONAL, "else")) {
			Token elseToken = advance();
			alternate = new BlockAst(location(elseToken), recover(BLOCK(), elseToken));
		} else {
			current = mark;
		}
		return new IfStatementAst(location(ifToken), condition, consequent, alternate);
	}

	// CONDITION : EXPRESSION, where "is" and "equals" compare
	private AstNode CONDITION() {
		boolean outer = inCondition;
		inCondition = true;
		try {
			return EXPRESSION();
		} finally {
			inCondition = outer;
		}
	}

	// LOOP : FOR_LOOP | WHILE_LOOP | REPEAT_LOOP
	private AstNode LOOP() {
		Token loop = peek();
		switch (loop.getText()) {
		case "for":
			return FOR_LOOP();
		case "while":
			return WHILE_LOOP();
		case "repeat":
			return REPEAT_LOOP();
		default:
			// "times", "end repeat"
			advance();
			return null;
		}
	}

	// FOR_LOOP : for IDENTIFIER* ( in | of ) EXPRESSION BLOCK
	private AstNode FOR_LOOP() {
		Token forToken = advance();
		List<String> words = new ArrayList<>();
		while (check(TokenType.IDENTIFIER) && !peekIs("in", "of")) {
			words.add(advance().getText());
		}
		Recovered<String> iterator = words.isEmpty() ? Recovered.defaulted("item", "Expected a loop variable") : Recovered.parsed(joinName(words));
		if (peekIs("in", "of")) {
			advance();
		}
		AstNode iterable = EXPRESSION();
		List<AstNode> body = recover(BLOCK(), forToken);
		return new ForLoopAst(location(forToken), recover(iterator, forToken), iterable, body);
	}

	// WHILE_LOOP : while CONDITION BLOCK
	private AstNode WHILE_LOOP() {
		Token whileToken = advance();
		AstNode condition = CONDITION();
		List<AstNode> body = recover(BLOCK(), whileToken);
		return new WhileLoopAst(location(whileToken), condition, body);
	}

	// REPEAT_LOOP : repeat ( NUMBER | PRIMARY ) [ times ] BLOCK
	private AstNode REPEAT_LOOP() {
		Token repeat = advance();
		Recovered<AstNode> count;
		if (check(TokenType.NUMBER_LITERAL) || (check(TokenType.IDENTIFIER) && !isEndOfExpression())) {
			count = Recovered.parsed(PRIMARY());
		} else {
			count = Recovered.<AstNode>defaulted(new NumberLiteralAst(location(repeat), 1), "Expected a repeat count");
		}
		if (peekIs("times", "time")) {
			advance();
		}
		AstNode countNode = recover(count, repeat);
		List<AstNode> body = recover(BLOCK(), repeat);
		return new RepeatLoopAst(location(repeat), countNode, body);
	}

	// EVENT_HANDLER : EVENT_TYPE EVENT_ACTIONS
	private AstNode EVENT_HANDLER() {
		Token event = advance();
		return new EventHandlerAst(location(event), event.getText(), EVENT_ACTIONS(event));
	}

	// EVENT_ACTIONS : NEWLINE* BLOCK | ACTION
	private List<AstNode> EVENT_ACTIONS(Token event) {
		actionDepth++;
		try {
			if (check(TokenType.NEWLINE) || check(TokenType.BLOCK_OPEN)) {
				return recover(BLOCK(), event);
			}
			List<AstNode> actions = new ArrayList<>();
			if (!isStructural()) {
				AstNode action = ACTION();
				if (action != null) {
					actions.add(action);
				}
			} else {
				warn("Expected an action after '" + event.getRaw() + "'", event);
			}
			return actions;
		} finally {
			actionDepth--;
		}
	}

	// ACTION : SHOW_MESSAGE | GO_BACK | NAVIGATE | UPDATE_STATE | STATEMENT
	private AstNode ACTION() {
		Token token = peek();
		if (token.getType() == TokenType.IDENTIFIER) {
			String text = token.getText();
			String navigation = keywords.findExact(KeywordCategory.NAVIGATION, text);
			if (hasWord(text, "show") || hasWord(text, "message")) {
				return SHOW_MESSAGE();
			}
			if ("back".equals(navigation) || hasWord(text, "back")) {
				return GO_BACK();
			}
			if ("goto".equals(navigation) || hasWord(text, "go") || hasWord(text, "navigate") || hasWord(text, "goto")) {
				return NAVIGATE();
			}
			if ("update".equals(keywords.findExact(KeywordCategory.STATE, text))) {
				return UPDATE_STATE();
			}
		}
		return STATEMENT();
	}

	// SHOW_MESSAGE : show [ message | a | the ]* EXPRESSION
	private AstNode SHOW_MESSAGE() {
		Token show = advance();
		while (peekWord("message", "a", "the")) {
			advance();
		}
		Recovered<AstNode> message;
		if (isEndOfExpression()) {
			message = Recovered.<AstNode>defaulted(new StringLiteralAst(location(show), ""), "Expected a message to show");
		} else {
			message = Recovered.parsed(EXPRESSION());
		}
		return new ShowMessageAst(location(show), recover(message, show));
	}

	// GO_BACK : go back
	private AstNode GO_BACK() {
		Token back = advance();
		return new GoBackAst(location(back));
	}

	// NAVIGATE : go [ to ] ( STRING | IDENTIFIER* )
	private AstNode NAVIGATE() {
		Token go = advance();
		if (peekIs("to")) {
			advance();
		}
		Recovered<String> screen;
		if (check(TokenType.STRING_LITERAL)) {
			screen = Recovered.parsed(advance().getText());
		} else {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER)) {
				words.add(advance().getText());
			}
			screen = words.isEmpty() ? Recovered.defaulted("", "Expected a screen to go to") : Recovered.parsed(joinWords(words));
		}
		return new NavigateAst(location(go), recover(screen, go));
	}

	// UPDATE_STATE : update IDENTIFIER* [ ASSIGNMENT ] EXPRESSION
	private AstNode UPDATE_STATE() {
		Token update = advance();
		List<String> words = new ArrayList<>();
		while (check(TokenType.IDENTIFIER) && !isAssignmentKeyword()) {
			words.add(advance().getText());
		}
		String name = recover(name(words, "Expected the state to update"), update);
		if (isAssignmentKeyword()) {
			advance();
		}
		return new UpdateStateAst(location(update), name, EXPRESSION());
	}

	// IDENTIFIER_STATEMENT : FUNCTION_CALL | IDENTIFIER+ [ ASSIGNMENT EXPRESSION ]
	private AstNode IDENTIFIER_STATEMENT() {
		Token first = peek();
		if (keywords.findExact(KeywordCategory.FUNCTION_CALL, first.getText()) != null) {
			return FUNCTION_CALL();
		}
		List<String> words = new ArrayList<>();
		while (check(TokenType.IDENTIFIER) && !isAssignmentKeyword()) {
			words.add(advance().getText());
		}
		if (words.isEmpty()) {
			advance();
			return null;
		}
		VariableReferenceAst reference = new VariableReferenceAst(location(first), joinName(words));
		if (isAssignmentKeyword()) {
			advance();
			return new AssignmentAst(location(first), reference, EXPRESSION());
		}
		return reference;
	}

	// FUNCTION_CALL : call IDENTIFIER+ [ with ARGUMENTS ]
	// ARGUMENTS : COMPARISON_EXPRESSION { (and|,) COMPARISON_EXPRESSION }
	private AstNode FUNCTION_CALL() {
		Token call = advance();
		List<String> words = new ArrayList<>();
		while (check(TokenType.IDENTIFIER) && !peekWord("with") && !isAssignmentKeyword()) {
			words.add(advance().getText());
		}
		String name = recover(name(words, "Expected the name of the function to call"), call);

		List<AstNode> arguments = new ArrayList<>();
		if (peekWord("with")) {
			advance();
			do {
				arguments.add(COMPARISON_EXPRESSION());
			} while (optArgumentSeparator());
		}
		return new FunctionCallAst(location(call), name, arguments);
	}

	private boolean optArgumentSeparator() {
		if (peekWord("and") || isSymbol(",")) {
			advance();
			return !isStructural();
		}
		return false;
	}

	// MATH_STATEMENT : ARITHMETIC EXPRESSION [ ( to | from ) EXPRESSION ]
	private AstNode MATH_STATEMENT() {
		Token operatorToken = advance();
		String operator = arithmeticKind(operatorToken);
		SourceLocation location = location(operatorToken);
		AstNode value = EXPRESSION();
		if (peekIs("to", "from")) {
			advance();
			AstNode target = EXPRESSION();
			return new AssignmentAst(location, target, new BinaryExpressionAst(location, operator, target, value));
		}
		return new BinaryExpressionAst(location, operator, value, new NumberLiteralAst(location, 0));
	}

	// EXPRESSION : LOGICAL_AND { or LOGICAL_AND }
	private AstNode EXPRESSION() {
		AstNode left = LOGICAL_AND();
		while (isLogical("or")) {
			Token operator = advance();
			AstNode right = LOGICAL_AND();
			left = new LogicalExpressionAst(location(operator), "or", left, right);
		}
		return left;
	}

	// LOGICAL_AND : COMPARISON_EXPRESSION { and COMPARISON_EXPRESSION }
	private AstNode LOGICAL_AND() {
		AstNode left = COMPARISON_EXPRESSION();
		while (isLogical("and")) {
			Token operator = advance();
			AstNode right = COMPARISON_EXPRESSION();
			left = new LogicalExpressionAst(location(operator), "and", left, right);
		}
		return left;
	}

	// COMPARISON_EXPRESSION : ADDITIVE_EXPRESSION { COMPARISON ADDITIVE_EXPRESSION }
	private AstNode COMPARISON_EXPRESSION() {
		AstNode left = ADDITIVE_EXPRESSION();
		String operator;
		while ((operator = comparisonKind(peek())) != null) {
			Token operatorToken = advance();
			AstNode right = ADDITIVE_EXPRESSION();
			left = new ComparisonExpressionAst(location(operatorToken), operator, left, right);
		}
		return left;
	}

	// ADDITIVE_EXPRESSION : MULTIPLICATIVE_EXPRESSION { (add|subtract) MULTIPLICATIVE_EXPRESSION }
	private AstNode ADDITIVE_EXPRESSION() {
		AstNode left = MULTIPLICATIVE_EXPRESSION();
		String operator;
		while ((operator = arithmeticKind(peek())) != null && ADDITIVE_KINDS.contains(operator)) {
			Token operatorToken = advance();
			AstNode right = MULTIPLICATIVE_EXPRESSION();
			left = new BinaryExpressionAst(location(operatorToken), operator, left, right);
		}
		return left;
	}

	// MULTIPLICATIVE_EXPRESSION : UNARY_EXPRESSION { (multiply|divide|modulo) UNARY_EXPRESSION }
	private AstNode MULTIPLICATIVE_EXPRESSION() {
		AstNode left = UNARY_EXPRESSION();
		String operator;
		while ((operator = arithmeticKind(peek())) != null && MULTIPLICATIVE_KINDS.contains(operator)) {
			Token operatorToken = advance();
			AstNode right = UNARY_EXPRESSION();
			left = new BinaryExpressionAst(location(operatorToken), operator, left, right);
		}
		return left;
	}

	// UNARY_EXPRESSION : ( not | - ) UNARY_EXPRESSION | PRIMARY
	private AstNode UNARY_EXPRESSION() {
		Token token = peek();
		String operator = null;
		if (isLogical("not")) {
			operator = "not";
		} else if (token.is(TokenType.GENERIC_OPERATOR, "-")) {
			operator = "negate";
		}
		if (operator == null) {
			return PRIMARY();
		}
		advance();
		enter(token);
		AstNode operand = UNARY_EXPRESSION();
		leave();
		return new UnaryExpressionAst(location(token), operator, operand);
	}

	// PRIMARY : STRING | NUMBER | BOOLEAN | COLOR | LIST_LITERAL | MAP_LITERAL | IDENTIFIER_EXPRESSION
	private AstNode PRIMARY() {
		Token token = peek();
		switch (token.getType()) {
		case STRING_LITERAL:
			advance();
			return new StringLiteralAst(location(token), token.getText());
		case NUMBER_LITERAL:
			advance();
			return new NumberLiteralAst(location(token), ((Double) token.getValue()).doubleValue());
		case BOOLEAN_LITERAL:
			advance();
			return new BooleanLiteralAst(location(token), ((Boolean) token.getValue()).booleanValue());
		case COLOR_LITERAL:
			advance();
			return new ColorLiteralAst(location(token), token.getText());
		case IDENTIFIER:
			if (!isEndOfExpression()) {
				return IDENTIFIER_EXPRESSION();
			}
			break;
		case GENERIC_OPERATOR:
			if (isSymbol("[")) {
				return LIST_LITERAL();
			}
			if (isSymbol("{")) {
				return MAP_LITERAL();
			}
			break;
		default:
			break;
		}

		// Skip what cannot be a value, but never a line or block boundary
		if (!isStructural()) {
			advance();
		}
		return recover(Recovered.<AstNode>defaulted(new StringLiteralAst(location(token), ""), "Expected a value. Found: " + describe(token)), token);
	}

	// IDENTIFIER_EXPRESSION : IDENTIFIER+, the words joined with '_'
	private AstNode IDENTIFIER_EXPRESSION() {
		Token first = peek();
		List<String> words = new ArrayList<>();
		while (check(TokenType.IDENTIFIER) && !isEndOfExpression()) {
			words.add(advance().getText());
		}
		return new VariableReferenceAst(location(first), joinName(words));
	}

	// LIST_LITERAL : '[' { EXPRESSION [ ',' ] } ']'
	private AstNode LIST_LITERAL() {
		Token open = advance();
		enter(open);
		List<AstNode> elements = new ArrayList<>();
		while (!isSymbol("]") && !isStructural()) {
			if (isSymbol(",")) {
				advance();
				continue;
			}
			elements.add(EXPRESSION());
		}
		leave();
		if (isSymbol("]")) {
			advance();
		} else {
			warn("Missing ']' at the end of the list", open);
		}
		return new ListLiteralAst(location(open), elements);
	}

	// MAP_LITERAL : '{' { KEY ':' EXPRESSION [ ',' ] } '}'
	private AstNode MAP_LITERAL() {
		Token open = advance();
		enter(open);
		Map<String, AstNode> entries = new LinkedHashMap<>();
		while (!isSymbol("}") && !isStructural()) {
			if (isSymbol(",")) {
				advance();
				continue;
			}
			Token keyToken = peek();
			if (keyToken.getType() == TokenType.GENERIC_OPERATOR) {
				advance();
				warn("Expected a key. Found: " + describe(keyToken), keyToken);
				continue;
			}
			String key = MAP_KEY();
			AstNode value;
			if (isSymbol(":")) {
				advance();
				value = EXPRESSION();
			} else {
				value = recover(Recovered.<AstNode>defaulted(new StringLiteralAst(location(keyToken), ""), "Expected ':' after the key " + key), keyToken);
			}
			entries.put(key, value);
		}
		leave();
		if (isSymbol("}")) {
			advance();
		} else {
			warn("Missing '}' at the end of the map", open);
		}
		return new MapLiteralAst(location(open), entries);
	}

	// MAP_KEY : STRING | IDENTIFIER+ | any other word
	private String MAP_KEY() {
		if (check(TokenType.STRING_LITERAL)) {
			return advance().getText();
		}
		if (check(TokenType.IDENTIFIER)) {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER)) {
				words.add(advance().getText());
			}
			return joinName(words);
		}
		// a keyword used as a key, like "size" or "color it"
		return advance().getRaw().toLowerCase(Locale.ROOT).replace(' ', '_');
	}

	// WIDGET : SCAFFOLD | APP_BAR | LINEAR_LAYOUT | CENTER | BOX | TEXT | BUTTON | IMAGE | ICON
	// | TEXT_FIELD | LIST_VIEW | BOTTOM_NAVIGATION | GENERIC_WIDGET
	private AstNode WIDGET() {
		Token widget = advance();
		switch (widget.getText()) {
		case "scaffold":
			return SCAFFOLD(widget);
		case "appBar":
			return APP_BAR(widget);
		case "column":
		case "row":
			return LINEAR_LAYOUT(widget);
		case "center":
			return CENTER(widget);
		case "container":
		case "card":
			return BOX(widget);
		case "text":
			return TEXT(widget);
		case "button":
			return BUTTON(widget);
		case "image":
			return IMAGE(widget);
		case "icon":
			return ICON(widget);
		case "textField":
			return TEXT_FIELD(widget);
		case "listView":
			return LIST_VIEW(widget);
		case "bottomNav":
			return BOTTOM_NAVIGATION(widget);
		default:
			return GENERIC_WIDGET(widget);
		}
	}

	// SCAFFOLD : scaffold INLINE_MODIFIERS [ NEWLINE* BLOCK_OPEN { BODY_SECTION | STYLE | EVENT | STATEMENT } BLOCK_CLOSE ]
	private AstNode SCAFFOLD(Token widget) {
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);

		AppBarAst appBar = null;
		AstNode body = null;
		BottomNavigationAst bottomNavigation = null;
		AstNode drawer = null;
		List<AstNode> loose = new ArrayList<>();

		int mark = current;
		skipNewlines();
		if (check(TokenType.BLOCK_OPEN)) {
			Token open = advance();
			enter(open);
			while (true) {
				skipNewlines();
				if (check(TokenType.BLOCK_CLOSE) || isAtEnd()) {
					break;
				}
				int before = current;
				if (check(TokenType.STYLE_PROPERTY) || check(TokenType.COLOR_LITERAL)) {
					STYLE(parts);
				} else if (check(TokenType.EVENT_TYPE)) {
					EVENT(parts);
				} else if (peekBodySection()) {
					if (body != null) {
						warn("The scaffold body is given twice", peek());
					}
					body = BODY_SECTION();
				} else {
					List<AstNode> statements = new ArrayList<>();
					STATEMENT_OR_BLOCK(statements);
					for (AstNode statement : statements) {
						switch (statement.getKind()) {
						case APP_BAR:
							appBar = (AppBarAst) statement;
							break;
						case BOTTOM_NAVIGATION:
							bottomNavigation = (BottomNavigationAst) statement;
							break;
						case COLUMN:
						case ROW:
						case CENTER:
						case CONTAINER:
							if (body != null) {
								warn("The scaffold body is given twice", widget);
							}
							body = statement;
							break;
						case WIDGET:
							if ("drawer".equals(((GenericWidgetAst) statement).getWidgetType())) {
								drawer = statement;
							} else {
								loose.add(statement);
							}
							break;
						case COMMENT:
							break;
						default:
							loose.add(statement);
							break;
						}
					}
				}
				ensureProgress(before);
			}
			leave();
			optBlockClose();
		} else {
			current = mark;
		}

		body = withLooseWidgets(body, loose, location(widget));
		return new ScaffoldAst(location(widget), appBar, body, bottomNavigation, drawer, parts.styles, parts.events);
	}

	/**
	 * An identifier run containing "body" alone on its line, like
	 * <code>in the body</code>, introduces the scaffold body.
	 */
	private boolean peekBodySection() {
		int i = current;
		boolean body = false;
		while (tokens.get(i).getType() == TokenType.IDENTIFIER) {
			if ("body".equals(tokens.get(i).getText())) {
				body = true;
			}
			i++;
		}
		if (tokens.get(i).is(TokenType.GENERIC_OPERATOR, ":")) {
			i++;
		}
		TokenType after = tokens.get(i).getType();
		return body && (after == TokenType.NEWLINE || after == TokenType.BLOCK_OPEN || after == TokenType.EOF);
	}

	// BODY_SECTION : IDENTIFIER* body IDENTIFIER* [ ':' ] BLOCK
	private AstNode BODY_SECTION() {
		Token first = peek();
		while (check(TokenType.IDENTIFIER)) {
			advance();
		}
		if (isSymbol(":")) {
			advance();
		}
		List<AstNode> children = recover(BLOCK(), first);
		return new ColumnAst(location(first), children, null, null, null);
	}

	/**
	 * Widgets placed directly in a scaffold join its body: appended to a
	 * column, row or container body, or gathered with the body in a new column.
	 */
	private static AstNode withLooseWidgets(AstNode body, List<AstNode> loose, SourceLocation location) {
		if (loose.isEmpty()) {
			return body;
		}
		if (body == null) {
			return new ColumnAst(location, loose, null, null, null);
		}
		List<AstNode> children = new ArrayList<>();
		if (body instanceof ColumnAst) {
			ColumnAst column = (ColumnAst) body;
			children.addAll(column.getChildren());
			children.addAll(loose);
			return new ColumnAst(column.getLocation(), children, column.getAlignment(), column.getStyles(), column.getEvents());
		}
		if (body instanceof RowAst) {
			RowAst row = (RowAst) body;
			children.addAll(row.getChildren());
			children.addAll(loose);
			return new RowAst(row.getLocation(), children, row.getAlignment(), row.getStyles(), row.getEvents());
		}
		if (body instanceof ContainerAst) {
			ContainerAst container = (ContainerAst) body;
			children.addAll(container.getChildren());
			children.addAll(loose);
			return new ContainerAst(container.getLocation(), children, container.getStyles(), container.getEvents());
		}
		children.add(body);
		children.addAll(loose);
		return new ColumnAst(location, children, null, null, null);
	}

	// APP_BAR : appBar [ (that|says|with|titled|title)+ ] [ STRING ] INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode APP_BAR(Token widget) {
		while (peekIs("that", "says", "with", "titled", "title")) {
			advance();
		}
		TextAst title = null;
		if (check(TokenType.STRING_LITERAL)) {
			Token text = advance();
			title = new TextAst(location(text), new StringLiteralAst(location(text), text.getText()), null, null);
		}
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, false, widget);
		return new AppBarAst(location(widget), title, parts.styles, parts.events);
	}

	// LINEAR_LAYOUT : ( column | row ) INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode LINEAR_LAYOUT(Token widget) {
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, true, widget);
		String alignment = alignmentOf(parts.styles);
		if ("row".equals(widget.getText())) {
			return new RowAst(location(widget), parts.children, alignment, parts.styles, parts.events);
		}
		return new ColumnAst(location(widget), parts.children, alignment, parts.styles, parts.events);
	}

	private static String alignmentOf(Map<String, Object> styles) {
		if (styles.containsKey("alignCenter")) {
			return "center";
		}
		if (styles.containsKey("alignRight")) {
			return "end";
		}
		if (styles.containsKey("alignLeft")) {
			return "start";
		}
		return null;
	}

	// CENTER : center INLINE_MODIFIERS WIDGET_BLOCK, keeping the first child only
	private AstNode CENTER(Token widget) {
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, true, widget);
		AstNode child = parts.children.isEmpty() ? null : parts.children.get(0);
		if (parts.children.size() > 1) {
			warn("Only the first widget of '" + widget.getRaw() + "' is kept", widget);
		}
		return new CenterAst(location(widget), child, parts.styles, parts.events);
	}

	// BOX : ( container | card ) INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode BOX(Token widget) {
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, true, widget);
		if ("card".equals(widget.getText())) {
			return new CardAst(location(widget), parts.children, parts.styles, parts.events);
		}
		return new ContainerAst(location(widget), parts.children, parts.styles, parts.events);
	}

	// TEXT : text [ (that|says|saying|shows|displaying)+ ] [ the|a|an ] CONTENT INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode TEXT(Token widget) {
		while (peekIs(TEXT_CONNECTORS)) {
			advance();
		}
		while (peekWord(ARTICLES)) {
			advance();
		}
		AstNode content = recover(CONTENT(new StringLiteralAst(location(widget), ""), "Expected the text to show"), widget);
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, false, widget);
		return new TextAst(location(widget), content, parts.styles, parts.events);
	}

	// BUTTON : button [ (that|says|saying|labeled)+ ] CONTENT INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode BUTTON(Token widget) {
		while (peekIs(LABEL_CONNECTORS)) {
			advance();
		}
		AstNode label = recover(CONTENT(new StringLiteralAst(location(widget), "Button"), "Expected a button label"), widget);
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, false, widget);
		return new ButtonAst(location(widget), label, parts.styles, parts.events);
	}

	// CONTENT : STRING | IDENTIFIER_EXPRESSION
	private Recovered<AstNode> CONTENT(AstNode defaultContent, String reason) {
		if (check(TokenType.STRING_LITERAL)) {
			Token text = advance();
			return Recovered.<AstNode>parsed(new StringLiteralAst(location(text), text.getText()));
		}
		if (check(TokenType.IDENTIFIER) && !isEndOfExpression()) {
			return Recovered.parsed(IDENTIFIER_EXPRESSION());
		}
		return Recovered.defaulted(defaultContent, reason);
	}

	// IMAGE : image [ from ] STRING [ described [ as ] STRING ] { STYLE } WIDGET_BLOCK
	private AstNode IMAGE(Token widget) {
		if (peekIs("from")) {
			advance();
		}
		Recovered<AstNode> source;
		if (check(TokenType.STRING_LITERAL)) {
			Token text = advance();
			source = Recovered.<AstNode>parsed(new StringLiteralAst(location(text), text.getText()));
		} else {
			source = Recovered.<AstNode>defaulted(new StringLiteralAst(location(widget), ""), "Expected where to load the image from");
		}
		String alt = "";
		if (peekWord("described")) {
			advance();
			if (peekIs("as")) {
				advance();
			}
			if (check(TokenType.STRING_LITERAL)) {
				alt = advance().getText();
			}
		}
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, false);
		WIDGET_BLOCK(parts, false, widget);
		return new ImageAst(location(widget), recover(source, widget), alt, parts.styles, parts.events);
	}

	// ICON : icon [ of | named ] ( STRING | IDENTIFIER+ ) { STYLE } WIDGET_BLOCK
	private AstNode ICON(Token widget) {
		while (peekWord("of", "named")) {
			advance();
		}
		Recovered<String> name;
		if (check(TokenType.STRING_LITERAL)) {
			name = Recovered.parsed(advance().getText());
		} else {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER) && !isEndOfExpression()) {
				words.add(advance().getText());
			}
			name = words.isEmpty() ? Recovered.defaulted("star", "Expected an icon name") : Recovered.parsed(joinName(words));
		}
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, false);
		WIDGET_BLOCK(parts, false, widget);

		Object size = parts.styles.get("size");
		Object color = parts.styles.get("color");
		return new IconAst(
				location(widget),
				recover(name, widget),
				size instanceof Double ? ((Double) size).doubleValue() : IconAst.DEFAULT_SIZE,
				color instanceof String ? (String) color : null,
				parts.styles,
				parts.events);
	}

	// TEXT_FIELD : textField [ (with|saying|placeholder|hint)+ ] [ STRING ] INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode TEXT_FIELD(Token widget) {
		while (peekIs("with", "saying", "placeholder", "hint")) {
			advance();
		}
		String placeholder = check(TokenType.STRING_LITERAL) ? advance().getText() : "";
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, false, widget);
		return new TextFieldAst(location(widget), placeholder, parts.styles, parts.events);
	}

	// LIST_VIEW : listView INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode LIST_VIEW(Token widget) {
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, true, widget);
		return new ListViewAst(location(widget), parts.children, parts.styles, parts.events);
	}

	// BOTTOM_NAVIGATION : bottomNav { STYLE } [ NEWLINE* NAV_BLOCK ]
	private AstNode BOTTOM_NAVIGATION(Token widget) {
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, false);
		List<BottomNavItemAst> items = new ArrayList<>();

		int mark = current;
		skipNewlines();
		if (check(TokenType.BLOCK_OPEN)) {
			NAV_BLOCK(items, parts);
		} else {
			current = mark;
		}
		return new BottomNavigationAst(location(widget), items, parts.styles, parts.events);
	}

	// NAV_BLOCK : BLOCK_OPEN { NAV_ITEM | STYLE | NAV_BLOCK } BLOCK_CLOSE
	// An over-indented block contributes its items to the enclosing one
	private void NAV_BLOCK(List<BottomNavItemAst> items, WidgetParts parts) {
		Token open = advance();
		enter(open);
		while (true) {
			skipNewlines();
			if (check(TokenType.BLOCK_CLOSE) || isAtEnd()) {
				break;
			}
			if (check(TokenType.BLOCK_OPEN)) {
				warn("Unexpected indentation", peek());
				NAV_BLOCK(items, parts);
			} else if (check(TokenType.STRING_LITERAL) || check(TokenType.IDENTIFIER)) {
				items.add(NAV_ITEM());
			} else if (check(TokenType.STYLE_PROPERTY) || check(TokenType.COLOR_LITERAL)) {
				STYLE(parts);
			} else {
				warn("Ignored " + describe(peek()) + " in the bottom navigation", peek());
				advance();
			}
		}
		leave();
		optBlockClose();
	}

	// NAV_ITEM : ( STRING | IDENTIFIER* ) [ with [ icon ] ( STRING | IDENTIFIER ) ]
	private BottomNavItemAst NAV_ITEM() {
		Token first = peek();
		Recovered<String> label;
		if (check(TokenType.STRING_LITERAL)) {
			label = Recovered.parsed(advance().getText());
		} else {
			List<String> words = new ArrayList<>();
			while (check(TokenType.IDENTIFIER) && !peekIs("with", "icon")) {
				words.add(advance().getText());
			}
			label = words.isEmpty() ? Recovered.defaulted("", "Expected a navigation label") : Recovered.parsed(joinWords(words));
		}
		String icon = "circle";
		if (peekIs("with", "icon")) {
			advance();
			if (peekWord("icon")) {
				advance();
			}
			if (check(TokenType.STRING_LITERAL) || check(TokenType.IDENTIFIER)) {
				icon = advance().getText();
			}
		}
		return new BottomNavItemAst(location(first), recover(label, first), icon);
	}

	// GENERIC_WIDGET : WIDGET_TYPE [ (that|says|saying|labeled)+ ] [ STRING ] INLINE_MODIFIERS WIDGET_BLOCK
	private AstNode GENERIC_WIDGET(Token widget) {
		while (peekIs(LABEL_CONNECTORS)) {
			advance();
		}
		Map<String, Object> properties = new LinkedHashMap<>();
		if (check(TokenType.STRING_LITERAL)) {
			properties.put("label", advance().getText());
		}
		WidgetParts parts = new WidgetParts();
		INLINE_MODIFIERS(parts, true);
		WIDGET_BLOCK(parts, true, widget);
		return new GenericWidgetAst(location(widget), widget.getText(), properties, parts.children, parts.styles, parts.events);
	}

	// INLINE_MODIFIERS : { STYLE | EVENT }
	private void INLINE_MODIFIERS(WidgetParts parts, boolean acceptEvents) {
		while (true) {
			if (check(TokenType.STYLE_PROPERTY) || check(TokenType.COLOR_LITERAL)) {
				STYLE(parts);
			} else if (acceptEvents && check(TokenType.EVENT_TYPE)) {
				EVENT(parts);
			} else {
				return;
			}
		}
	}

	// STYLE : COLOR | STYLE_PROPERTY [ NUMBER | STRING | COLOR | BOOLEAN | IDENTIFIER ]
	private void STYLE(WidgetParts parts) {
		Token property = advance();
		if (property.getType() == TokenType.COLOR_LITERAL) {
			parts.styles.put("color", property.getText());
			return;
		}
		// A property alone, like "bold", is a flag
		Object value = Boolean.TRUE;
		Token next = peek();
		switch (next.getType()) {
		case NUMBER_LITERAL:
		case STRING_LITERAL:
		case COLOR_LITERAL:
		case BOOLEAN_LITERAL:
			advance();
			value = next.getValue();
			break;
		case IDENTIFIER:
			if (!isEndOfExpression()) {
				advance();
				value = next.getText();
			}
			break;
		default:
			break;
		}
		parts.styles.put(property.getText(), value);
	}

	// EVENT : EVENT_TYPE EVENT_ACTIONS
	private void EVENT(WidgetParts parts) {
		Token event = advance();
		List<AstNode> actions = EVENT_ACTIONS(event);
		List<AstNode> existing = parts.events.get(event.getText());
		if (existing == null) {
			parts.events.put(event.getText(), actions);
		} else {
			existing.addAll(actions);
		}
	}

	// WIDGET_BLOCK : [ NEWLINE* BLOCK_OPEN { STYLE | EVENT | STATEMENT_OR_BLOCK } BLOCK_CLOSE ]
	private void WIDGET_BLOCK(WidgetParts parts, boolean acceptsChildren, Token widget) {
		int mark = current;
		skipNewlines();
		if (!check(TokenType.BLOCK_OPEN)) {
			current = mark;
			return;
		}
		Token open = advance();
		enter(open);
		while (true) {
			skipNewlines();
			if (check(TokenType.BLOCK_CLOSE) || isAtEnd()) {
				break;
			}
			int before = current;
			if (check(TokenType.STYLE_PROPERTY) || check(TokenType.COLOR_LITERAL)) {
				STYLE(parts);
			} else if (check(TokenType.EVENT_TYPE)) {
				EVENT(parts);
			} else {
				Token first = peek();
				List<AstNode> statements = new ArrayList<>();
				STATEMENT_OR_BLOCK(statements);
				if (acceptsChildren) {
					parts.children.addAll(statements);
				} else {
					for (AstNode statement : statements) {
						if (!(statement instanceof CommentAst)) {
							warn("'" + widget.getRaw() + "' cannot contain " + statement.getKind().getLabel(), first);
						}
					}
				}
			}
			ensureProgress(before);
		}
		leave();
		optBlockClose();
	}

	// CHECKSTYLE.ON: MethodName

	private Token peek() {
		return tokens.get(current);
	}

	private Token peek(int offset) {
		return tokens.get(Math.min(current + offset, tokens.size() - 1));
	}

	private Token advance() {
		Token token = peek();
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	private boolean isAtEnd() {
		return peek().getType() == TokenType.EOF;
	}

	private boolean check(TokenType type) {
		return peek().getType() == type;
	}

	private boolean checkValue(TokenType type, String value) {
		return peek().is(type, value);
	}

	private boolean isSymbol(String symbol) {
		return checkValue(TokenType.GENERIC_OPERATOR, symbol);
	}

	private boolean isStructural() {
		TokenType type = peek().getType();
		return type == TokenType.NEWLINE || type == TokenType.BLOCK_OPEN || type == TokenType.BLOCK_CLOSE || type == TokenType.EOF;
	}

	private void skipNewlines() {
		while (check(TokenType.NEWLINE)) {
			advance();
		}
	}

	private void optBlockClose() {
		if (check(TokenType.BLOCK_CLOSE)) {
			advance();
		}
	}

	/**
	 * Whether the next token is one of the given words, or a merged phrase
	 * containing one of them as a whole word.
	 */
	private boolean peekIs(String... words) {
		Token token = peek();
		if (!isWordToken(token)) {
			return false;
		}
		for (String word : words) {
			if (token.getText().equals(word) || hasWord(token.getRaw(), word)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Whether the value of the next token is exactly one of the given words.
	 */
	private boolean peekWord(String... words) {
		Token token = peek();
		if (!isWordToken(token)) {
			return false;
		}
		for (String word : words) {
			if (token.getText().equals(word)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isWordToken(Token token) {
		switch (token.getType()) {
		case STRING_LITERAL:
		case NUMBER_LITERAL:
		case COMMENT:
		case NEWLINE:
		case BLOCK_OPEN:
		case BLOCK_CLOSE:
		case EOF:
			return false;
		default:
			return true;
		}
	}

	/**
	 * The only place where the closing phrase of a construct matters:
	 * <code>end function</code> ends a function body early.
	 */
	private boolean peekEndFunction() {
		Token token = peek();
		if (token.getType() != TokenType.IDENTIFIER) {
			return false;
		}
		if (token.getText().contains("end function")) {
			return true;
		}
		return "end".equals(token.getText()) && peek(1).is(TokenType.IDENTIFIER, "function");
	}

	private void consumeEndFunction() {
		Token token = advance();
		if (!token.getText().contains("end function")) {
			advance();
		}
	}

	private boolean isAssignmentKeyword() {
		Token token = peek();
		return token.getType() == TokenType.ASSIGNMENT
				|| (token.getType() == TokenType.IDENTIFIER && keywords.findExact(KeywordCategory.ASSIGNMENT, token.getText()) != null);
	}

	private boolean isEndOfExpression() {
		if (isStructural() || check(TokenType.ASSIGNMENT)) {
			return true;
		}
		return check(TokenType.IDENTIFIER) && EXPRESSION_STOP_WORDS.contains(peek().getText());
	}

	/**
	 * @return whether the next token is the logical operator of the given kind, as a word or a symbol
	 */
	private boolean isLogical(String kind) {
		Token token = peek();
		if (token.getType() == TokenType.LOGICAL_OPERATOR) {
			return kind.equals(token.getText());
		}
		return token.getType() == TokenType.GENERIC_OPERATOR && kind.equals(keywords.findExact(KeywordCategory.COMPARISON, token.getText()));
	}

	/**
	 * @return the comparison sub-kind of the token, or <code>null</code> if it does not compare
	 */
	private String comparisonKind(Token token) {
		switch (token.getType()) {
		case COMPARISON_OPERATOR:
			return token.getText();
		case ASSIGNMENT:
			if (!inCondition) {
				return null;
			}
			return nonLogical(keywords.findExact(KeywordCategory.COMPARISON, token.getText()));
		case GENERIC_OPERATOR:
			return nonLogical(keywords.findExact(KeywordCategory.COMPARISON, token.getText()));
		default:
			return null;
		}
	}

	private static String nonLogical(String kind) {
		return kind == null || LOGICAL_KINDS.contains(kind) ? null : kind;
	}

	/**
	 * @return the arithmetic sub-kind of the token, or <code>null</code> if it is not an arithmetic operator
	 */
	private String arithmeticKind(Token token) {
		if (token.getType() == TokenType.ARITHMETIC_OPERATOR) {
			return token.getText();
		}
		if (token.getType() == TokenType.GENERIC_OPERATOR) {
			return keywords.findExact(KeywordCategory.ARITHMETIC, token.getText());
		}
		return null;
	}

	private void enter(Token token) {
		depth++;
		if (depth > maxNestingDepth) {
			throw parserException("Nesting deeper than " + maxNestingDepth + " levels", token);
		}
	}

	private void leave() {
		depth--;
	}

	private void ensureProgress(int before) {
		if (current == before && !isAtEnd()) {
			throw parserException("Cannot parse " + describe(peek()), peek());
		}
	}

	private <T> T recover(Recovered<T> recovered, Token at) {
		if (recovered.isDefaulted()) {
			warn(recovered.getReason(), at);
		}
		return recovered.get();
	}

	private void warn(String message, Token at) {
		if (reportDegradedDefaults) {
			warnings.add(new ParseWarning(message, at.getLine(), at.getColumn()));
		}
		LOG.trace("{}:{}: {}", at.getLine(), at.getColumn(), message);
	}

	private ParserException parserException(String msg, Token at) {
		return new ParserException(msg, sourceDescription, at.getLine(), at.getColumn());
	}

	private static Recovered<String> name(List<String> words, String reason) {
		return words.isEmpty() ? Recovered.defaulted("", reason) : Recovered.parsed(joinName(words));
	}

	/**
	 * "my favorite color" becomes "my_favorite_color".
	 */
	private static String joinName(List<String> words) {
		StringBuilder name = new StringBuilder();
		for (String word : words) {
			if (name.length() > 0) {
				name.append('_');
			}
			name.append(word.replace(' ', '_'));
		}
		return name.toString();
	}

	private static String joinWords(List<String> words) {
		return String.join(" ", words);
	}

	private static boolean hasWord(String phrase, String word) {
		for (String part : phrase.toLowerCase(Locale.ROOT).split(" ")) {
			if (part.equals(word)) {
				return true;
			}
		}
		return false;
	}

	private static String describe(Token token) {
		switch (token.getType()) {
		case EOF:
			return "end of input";
		case NEWLINE:
			return "end of line";
		case BLOCK_OPEN:
			return "indentation";
		case BLOCK_CLOSE:
			return "end of block";
		default:
			return "'" + token.getRaw() + "'";
		}
	}

	private static SourceLocation location(Token token) {
		return new SourceLocation(token.getLine(), token.getColumn());
	}

	/**
	 * Styles, events and children collected while parsing a widget.
	 */
	private static final class WidgetParts {
		private final Map<String, Object> styles = new LinkedHashMap<>();
		private final Map<String, List<AstNode>> events = new LinkedHashMap<>();
		private final List<AstNode> children = new ArrayList<>();
	}
}
