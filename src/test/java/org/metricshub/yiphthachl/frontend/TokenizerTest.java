package org.metricshub.yiphthachl.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptSource;

public class TokenizerTest {

	private static List<Token> tokenize(String source) {
		return new Tokenizer(source).tokenize();
	}

	private static List<TokenType> types(List<Token> tokens) {
		List<TokenType> types = new ArrayList<>();
		for (Token token : tokens) {
			types.add(token.getType());
		}
		return types;
	}

	private static List<Token> withoutStructure(List<Token> tokens) {
		List<Token> result = new ArrayList<>();
		for (Token token : tokens) {
			switch (token.getType()) {
			case NEWLINE:
			case BLOCK_OPEN:
			case BLOCK_CLOSE:
			case EOF:
				break;
			default:
				result.add(token);
			}
		}
		return result;
	}

	private static int count(List<Token> tokens, TokenType type) {
		int n = 0;
		for (Token token : tokens) {
			if (token.getType() == type) {
				n++;
			}
		}
		return n;
	}

	@Test
	public void testEmptySource() {
		List<Token> tokens = tokenize("");
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
	}

	@Test
	public void testIndentationIsBalanced() {
		String source = "if x is 1\n"
				+ "    if y is 2\n"
				+ "        set z to 3\n"
				+ "    set w to 4\n"
				+ "set v to 5\n"
				+ "a column\n"
				+ "    a row\n"
				+ "        a text \"deep\"\n";
		List<Token> tokens = tokenize(source);
		int depth = 0;
		for (Token token : tokens) {
			if (token.getType() == TokenType.BLOCK_OPEN) {
				depth++;
			} else if (token.getType() == TokenType.BLOCK_CLOSE) {
				depth--;
			}
			assertTrue("Depth must never be negative", depth >= 0);
		}
		assertEquals(4, count(tokens, TokenType.BLOCK_OPEN));
		assertEquals(4, count(tokens, TokenType.BLOCK_CLOSE));
		assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).getType());
	}

	@Test
	public void testBlockMarkersComeBeforeTheIndentedLine() {
		List<Token> tokens = tokenize("repeat 2 times\n    set x to 1\nset y to 2");
		assertEquals(TokenType.NEWLINE, tokens.get(3).getType());
		assertEquals(TokenType.BLOCK_OPEN, tokens.get(4).getType());
		assertEquals(TokenType.VARIABLE_DECLARATION, tokens.get(5).getType());
		assertEquals(TokenType.BLOCK_CLOSE, tokens.get(10).getType());
		assertEquals("set", tokens.get(11).getText());
		assertEquals(3, tokens.get(11).getLine());
	}

	@Test
	public void testDedentClosesDownToTheNearestLowerLevel() {
		// 6 spaces sits between the levels 4 and 8
		List<Token> tokens = tokenize("a\n    b\n        c\n      d\n");
		assertEquals(2, count(tokens, TokenType.BLOCK_OPEN));
		assertEquals(2, count(tokens, TokenType.BLOCK_CLOSE));
		List<TokenType> expected = new ArrayList<>();
		expected.add(TokenType.IDENTIFIER);
		expected.add(TokenType.NEWLINE);
		expected.add(TokenType.BLOCK_OPEN);
		expected.add(TokenType.IDENTIFIER);
		expected.add(TokenType.NEWLINE);
		expected.add(TokenType.BLOCK_OPEN);
		expected.add(TokenType.IDENTIFIER);
		expected.add(TokenType.NEWLINE);
		expected.add(TokenType.BLOCK_CLOSE);
		expected.add(TokenType.IDENTIFIER);
		expected.add(TokenType.NEWLINE);
		expected.add(TokenType.BLOCK_CLOSE);
		expected.add(TokenType.EOF);
		assertEquals(expected, types(tokens));
	}

	@Test
	public void testBlankAndCommentLinesKeepTheIndentation() {
		List<Token> tokens = tokenize("if x\n    set a to 1\n\n# note\n    set b to 2\n");
		assertEquals(1, count(tokens, TokenType.BLOCK_OPEN));
		assertEquals(1, count(tokens, TokenType.BLOCK_CLOSE));
		assertEquals(1, count(tokens, TokenType.COMMENT));
	}

	@Test
	public void testTabsCountAsTabWidth() {
		FrontendSettings settings = new FrontendSettings();
		settings.setTabWidth(4);
		List<Token> tokens = new Tokenizer("if x\n\tset a to 1\n    set b to 2\n", ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, settings).tokenize();
		assertEquals("A tab and four spaces are the same level", 1, count(tokens, TokenType.BLOCK_OPEN));

		settings.setTabWidth(2);
		tokens = new Tokenizer("if x\n\tset a to 1\n    set b to 2\n", ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, settings).tokenize();
		assertEquals(2, count(tokens, TokenType.BLOCK_OPEN));
		assertEquals(2, count(tokens, TokenType.BLOCK_CLOSE));
	}

	@Test
	public void testForEachIsOneToken() {
		List<Token> tokens = withoutStructure(tokenize("for each fruit in fruits"));
		assertEquals(4, tokens.size());
		assertEquals(TokenType.LOOP, tokens.get(0).getType());
		assertEquals("for", tokens.get(0).getValue());
		assertEquals("for each", tokens.get(0).getRaw());
		assertEquals("fruit", tokens.get(1).getText());
		assertEquals("in", tokens.get(2).getText());
	}

	@Test
	public void testPhraseMergingRollsBack() {
		// "is greater" is the start of a phrase, "is greater thing" is not
		List<Token> tokens = withoutStructure(tokenize("x is greater thing"));
		assertEquals(4, tokens.size());
		assertEquals(TokenType.ASSIGNMENT, tokens.get(1).getType());
		assertEquals("is", tokens.get(1).getRaw());
		assertEquals("greater", tokens.get(2).getText());

		tokens = withoutStructure(tokenize("x is greater than 3"));
		assertEquals(3, tokens.size());
		assertEquals(TokenType.COMPARISON_OPERATOR, tokens.get(1).getType());
		assertEquals("greaterThan", tokens.get(1).getValue());
	}

	@Test
	public void testHttpAndAnimationPhrasesMerge() {
		List<Token> tokens = withoutStructure(tokenize("get data from \"https://example.com\"\nfade in logo"));
		assertEquals(4, tokens.size());
		assertEquals("get data from", tokens.get(0).getRaw());
		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals("fade in", tokens.get(2).getRaw());
		assertEquals("logo", tokens.get(3).getRaw());
	}

	@Test
	public void testMergingKeepsTheLongestCompletePhrase() {
		List<Token> tokens = withoutStructure(tokenize("otherwise if x"));
		assertEquals(2, tokens.size());
		assertEquals("elseif", tokens.get(0).getValue());
		assertEquals("otherwise if", tokens.get(0).getRaw());
	}

	@Test
	public void testEventPhrase() {
		List<Token> tokens = withoutStructure(tokenize("When Pressed"));
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EVENT_TYPE, tokens.get(0).getType());
		assertEquals("onPressed", tokens.get(0).getValue());
		assertEquals("When Pressed", tokens.get(0).getRaw());
	}

	@Test
	public void testIdentifiersAreLowerCased() {
		Token token = withoutStructure(tokenize("Counter")).get(0);
		assertEquals(TokenType.IDENTIFIER, token.getType());
		assertEquals("counter", token.getValue());
		assertEquals("Counter", token.getRaw());
	}

	@Test
	public void testStrings() {
		List<Token> tokens = withoutStructure(tokenize("\"Hello, world\" 'it''s' \"say \\\"hi\\\"\""));
		assertEquals("Hello, world", tokens.get(0).getValue());
		assertEquals("\"Hello, world\"", tokens.get(0).getRaw());
		assertEquals("it", tokens.get(1).getValue());
		assertEquals("s", tokens.get(2).getValue());
		assertEquals("say \"hi\"", tokens.get(3).getValue());
	}

	@Test
	public void testBackslashOnlyEscapesTheQuote() {
		Token token = withoutStructure(tokenize("\"a\\nb\"")).get(0);
		assertEquals("a\\nb", token.getValue());
	}

	@Test
	public void testStringsSpanLines() {
		List<Token> tokens = tokenize("\"one\ntwo\" x");
		assertEquals(TokenType.STRING_LITERAL, tokens.get(0).getType());
		assertEquals("one\ntwo", tokens.get(0).getValue());
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(2, tokens.get(1).getLine());
	}

	@Test
	public void testUnterminatedStringRunsToTheEnd() {
		List<Token> tokens = tokenize("\"never closed");
		assertEquals(2, tokens.size());
		assertEquals("never closed", tokens.get(0).getValue());
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = withoutStructure(tokenize("42 3.14 7."));
		assertEquals(Double.valueOf(42), tokens.get(0).getValue());
		assertEquals(Double.valueOf(3.14), tokens.get(1).getValue());
		assertEquals(Double.valueOf(7), tokens.get(2).getValue());
		assertEquals("A dot without digits is not part of the number", 3, tokens.size());
	}

	@Test
	public void testComments() {
		List<Token> tokens = withoutStructure(tokenize("set x to 1 # the start value\n"));
		Token comment = tokens.get(tokens.size() - 1);
		assertEquals(TokenType.COMMENT, comment.getType());
		assertEquals("the start value", comment.getValue());
		assertEquals("# the start value", comment.getRaw());
	}

	@Test
	public void testOperators() {
		List<Token> tokens = withoutStructure(tokenize("a == b != c <= d >= e < f && g || h [ ] { } , : + - * / %"));
		List<String> operators = new ArrayList<>();
		for (Token token : tokens) {
			if (token.getType() == TokenType.GENERIC_OPERATOR) {
				operators.add(token.getText());
			}
		}
		assertEquals(
				"[==, !=, <=, >=, <, &&, ||, [, ], {, }, ,, :, +, -, *, /, %]",
				operators.toString());
	}

	@Test
	public void testUnknownCharactersAreSkipped() {
		List<Token> tokens = withoutStructure(tokenize("set x @ to 1"));
		assertEquals(4, tokens.size());
		assertEquals(TokenType.VARIABLE_DECLARATION, tokens.get(0).getType());
		assertEquals(TokenType.ASSIGNMENT, tokens.get(2).getType());
	}

	@Test
	public void testLinesAndColumns() {
		List<Token> tokens = tokenize("set x to 1\n  a button");
		Token x = tokens.get(1);
		assertEquals(1, x.getLine());
		assertEquals(5, x.getColumn());
		Token button = withoutStructure(tokens).get(4);
		assertEquals(TokenType.WIDGET_TYPE, button.getType());
		assertEquals(2, button.getLine());
		assertEquals(3, button.getColumn());
	}

	@Test
	public void testTokenizingTwiceGivesTheSameTokens() {
		String source = "remember counter as 0\na button that says \"+\"\n    when pressed\n        add 1 to counter\n";
		assertEquals(tokenize(source), tokenize(source));

		Tokenizer tokenizer = new Tokenizer(source);
		assertEquals(tokenizer.tokenize(), tokenizer.tokenize());
	}

	@Test
	public void testTokenToString() {
		List<Token> tokens = tokenize("set x");
		assertEquals("1:1 VARIABLE_DECLARATION \"set\"", tokens.get(0).toString());
		assertEquals("1:6 EOF", tokens.get(2).toString());
	}
}
