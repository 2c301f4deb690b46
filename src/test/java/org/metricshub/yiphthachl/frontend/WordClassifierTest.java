package org.metricshub.yiphthachl.frontend;

import static org.junit.Assert.*;

import java.util.Collections;
import org.junit.Test;
import org.metricshub.yiphthachl.frontend.WordClassifier.Classification;
import org.metricshub.yiphthachl.keywords.KeywordCategory;
import org.metricshub.yiphthachl.keywords.KeywordTable;

public class WordClassifierTest {

	private static final WordClassifier CLASSIFIER = new WordClassifier(KeywordTable.defaults());

	private static void assertClassified(String word, TokenType expectedType, Object expectedValue) {
		Classification classification = CLASSIFIER.classify(word);
		assertEquals("Type of '" + word + "'", expectedType, classification.getType());
		assertEquals("Value of '" + word + "'", expectedValue, classification.getValue());
	}

	@Test
	public void testLiterals() {
		assertClassified("yes", TokenType.BOOLEAN_LITERAL, Boolean.TRUE);
		assertClassified("false", TokenType.BOOLEAN_LITERAL, Boolean.FALSE);
		assertClassified("blue", TokenType.COLOR_LITERAL, "#3B82F6");
	}

	@Test
	public void testFlatCategoriesKeepTheWord() {
		assertClassified("remember", TokenType.VARIABLE_DECLARATION, "remember");
		assertClassified("to", TokenType.ASSIGNMENT, "to");
		assertClassified("define function", TokenType.FUNCTION_DECLARATION, "define function");
	}

	@Test
	public void testOtherCategoriesGiveTheSubKind() {
		assertClassified("otherwise if", TokenType.CONDITIONAL, "elseif");
		assertClassified("for each", TokenType.LOOP, "for");
		assertClassified("is greater than", TokenType.COMPARISON_OPERATOR, "greaterThan");
		assertClassified("plus", TokenType.ARITHMETIC_OPERATOR, "add");
		assertClassified("a button", TokenType.WIDGET_TYPE, "button");
		assertClassified("make it bold", TokenType.STYLE_PROPERTY, "bold");
	}

	@Test
	public void testLogicalWordsAreNoComparisons() {
		assertClassified("and", TokenType.LOGICAL_OPERATOR, "and");
		assertClassified("or", TokenType.LOGICAL_OPERATOR, "or");
		assertClassified("not", TokenType.LOGICAL_OPERATOR, "not");
	}

	@Test
	public void testPriorityBetweenCategories() {
		// "is" is both an assignment word and a comparison phrase
		assertClassified("is", TokenType.ASSIGNMENT, "is");
		// "times" is both a loop word and a multiplication
		assertClassified("times", TokenType.LOOP, "times");
	}

	@Test
	public void testExactMatchesWinOverLooseOnes() {
		// "when pressed" starts with the conditional "when"
		assertClassified("when pressed", TokenType.EVENT_TYPE, "onPressed");
		assertClassified("when", TokenType.CONDITIONAL, "if");
	}

	@Test
	public void testLooseMatches() {
		assertClassified("a big clickable button", TokenType.WIDGET_TYPE, "button");
		assertClassified("iffy", TokenType.CONDITIONAL, "if");
	}

	@Test
	public void testPhraseOnlyCategoriesDoNotClassify() {
		assertClassified("go back", TokenType.IDENTIFIER, "go back");
		assertClassified("change", TokenType.IDENTIFIER, "change");
		assertClassified("call", TokenType.IDENTIFIER, "call");
	}

	@Test
	public void testIdentifiers() {
		assertClassified("counter", TokenType.IDENTIFIER, "counter");
		assertClassified("score", TokenType.IDENTIFIER, "score");
	}

	@Test
	public void testCustomRules() {
		WordClassifier widgetsOnly = new WordClassifier(
				KeywordTable.defaults(),
				Collections.singletonList(ClassificationRule.category(KeywordCategory.WIDGET, TokenType.WIDGET_TYPE, ClassificationRule.Match.EXACT)));
		assertEquals(TokenType.WIDGET_TYPE, widgetsOnly.classify("a button").getType());
		assertEquals(TokenType.IDENTIFIER, widgetsOnly.classify("a big clickable button").getType());
		assertEquals(TokenType.IDENTIFIER, widgetsOnly.classify("yes").getType());
	}

	@Test
	public void testDefaultRuleOrder() {
		assertEquals(12, WordClassifier.defaultRules().size());
		assertEquals(12, CLASSIFIER.getRules().size());
	}
}
