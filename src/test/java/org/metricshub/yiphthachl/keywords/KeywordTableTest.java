package org.metricshub.yiphthachl.keywords;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;

public class KeywordTableTest {

	private static final KeywordTable DEFAULTS = KeywordTable.defaults();

	@Test
	public void testFindExactReturnsFirstSubKind() {
		assertEquals("greaterThan", DEFAULTS.findExact(KeywordCategory.COMPARISON, "is greater than"));
		assertEquals("elseif", DEFAULTS.findExact(KeywordCategory.CONDITIONAL, "otherwise if"));
		assertEquals("for", DEFAULTS.findExact(KeywordCategory.LOOP, "for each"));
		assertNull(DEFAULTS.findExact(KeywordCategory.LOOP, "for each item"));
	}

	@Test
	public void testLooseLookups() {
		assertEquals("Prefix lookups are plain startsWith", "if", DEFAULTS.findPrefixOf(KeywordCategory.CONDITIONAL, "iffy"));
		assertEquals("onPressed", DEFAULTS.findPrefixOf(KeywordCategory.EVENT, "when pressed twice"));
		assertEquals("button", DEFAULTS.findContainedIn(KeywordCategory.WIDGET, "a big clickable button"));
		assertEquals("Sub-kind order decides between overlapping phrases", "text", DEFAULTS.findContainedIn(KeywordCategory.WIDGET, "a text field"));
		assertNull(DEFAULTS.findContainedIn(KeywordCategory.WIDGET, "counter"));
	}

	@Test
	public void testPhrasesAndPrefixes() {
		assertTrue(DEFAULTS.isPhrase("when pressed"));
		assertTrue("Color names are phrases", DEFAULTS.isPhrase("blue"));
		assertTrue(DEFAULTS.isPhrasePrefix("is greater"));
		assertTrue(DEFAULTS.isPhrasePrefix("when"));
		assertFalse("A complete phrase with no longer phrase is no prefix", DEFAULTS.isPhrasePrefix("otherwise if"));
		assertFalse(DEFAULTS.isPhrasePrefix("counter"));
	}

	@Test
	public void testPhraseOnlyCategories() {
		assertEquals("back", DEFAULTS.findExact(KeywordCategory.NAVIGATION, "go back"));
		assertEquals("update", DEFAULTS.findExact(KeywordCategory.STATE, "change"));
		assertTrue(DEFAULTS.isPhrasePrefix("go"));
		assertEquals("fetch", DEFAULTS.findExact(KeywordCategory.HTTP, "get data from"));
		assertEquals("fadeIn", DEFAULTS.findExact(KeywordCategory.ANIMATION, "fade in"));
		assertTrue(DEFAULTS.isPhrasePrefix("get data"));
	}

	@Test
	public void testColorsAndBooleans() {
		assertEquals("#3B82F6", DEFAULTS.getColorCode("blue"));
		assertNull(DEFAULTS.getColorCode("turquoise"));
		assertEquals(Boolean.TRUE, DEFAULTS.getBooleanValue("yes"));
		assertEquals(Boolean.FALSE, DEFAULTS.getBooleanValue("no"));
		assertNull(DEFAULTS.getBooleanValue("maybe"));
	}

	@Test
	public void testBuilderNormalizesPhrases() {
		KeywordTable table = KeywordTable
				.builder()
				.phrases(KeywordCategory.EVENT, "onPressed", "  When   PRESSED ", "when pressed", "on tap")
				.build();
		assertEquals(Arrays.asList("when pressed", "on tap"), table.getPhrases(KeywordCategory.EVENT, "onPressed"));
		assertTrue(table.isPhrasePrefix("when"));
		assertTrue(table.getSubKinds(KeywordCategory.WIDGET).isEmpty());
	}

	@Test
	public void testFlatCategoryRejectsSubKinds() {
		assertThrows(IllegalArgumentException.class, () -> KeywordTable.builder().flat(KeywordCategory.LOOP, "for"));
	}

	@Test
	public void testToBuilderLeavesOriginalUntouched() {
		KeywordTable table = DEFAULTS.toBuilder().clearCategory(KeywordCategory.EVENT).clearColors().build();
		assertTrue(table.getSubKinds(KeywordCategory.EVENT).isEmpty());
		assertNull(table.getColorCode("blue"));
		assertEquals("onPressed", DEFAULTS.findExact(KeywordCategory.EVENT, "when pressed"));
		assertEquals("#3B82F6", DEFAULTS.getColorCode("blue"));
	}

	@Test
	public void testCategoryKeys() {
		assertSame(KeywordCategory.ARITHMETIC, KeywordCategory.fromKey("Math"));
		assertSame(KeywordCategory.FUNCTION_CALL, KeywordCategory.fromKey("call"));
		assertNull(KeywordCategory.fromKey("colour"));
		assertTrue(KeywordCategory.ASSIGNMENT.isFlat());
		assertFalse(KeywordCategory.WIDGET.isFlat());
	}
}
