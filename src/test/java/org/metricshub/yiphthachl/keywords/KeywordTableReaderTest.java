package org.metricshub.yiphthachl.keywords;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import org.junit.Test;

public class KeywordTableReaderTest {

	private static Path resource(String name) throws URISyntaxException {
		return Paths.get(KeywordTableReaderTest.class.getResource(name).toURI());
	}

	private static KeywordTable read(String text) throws IOException {
		return new KeywordTableReader().read(new StringReader(text), "test");
	}

	@Test
	public void testFileReplacesNamedCategoriesOnly() throws Exception {
		KeywordTable table = new KeywordTableReader().read(resource("/keywords/custom-keywords.txt"));

		assertEquals("onPressed", table.findExact(KeywordCategory.EVENT, "bij klik"));
		assertNull("The default event phrases are replaced", table.findExact(KeywordCategory.EVENT, "when pressed"));
		assertNull("Sub-kinds missing from the file are gone too", table.findExact(KeywordCategory.EVENT, "on hover"));
		assertEquals(Arrays.asList("zet", "onthoud"), table.getPhrases(KeywordCategory.VARIABLE_DECLARATION, "variable"));

		assertEquals("Untouched categories keep the defaults", "greaterThan", table.findExact(KeywordCategory.COMPARISON, "is greater than"));

		assertEquals("#FF0000", table.getColorCode("rood"));
		assertNull(table.getColorCode("blue"));
		assertEquals(Boolean.TRUE, table.getBooleanValue("ja"));
		assertNull(table.getBooleanValue("yes"));
		assertTrue(table.isPhrasePrefix("wanneer"));
	}

	@Test
	public void testSubKindKeepsItsCase() throws Exception {
		KeywordTable table = read("Event.onSubmit = When Sent\n");
		assertEquals("onSubmit", table.findExact(KeywordCategory.EVENT, "when sent"));
	}

	@Test
	public void testCommentsAndBlankLines() throws Exception {
		KeywordTable table = read("# only a comment\n\n   \nmath.add = plus, +\n");
		assertEquals(Arrays.asList("plus", "+"), table.getPhrases(KeywordCategory.ARITHMETIC, "add"));
		assertNull(table.findExact(KeywordCategory.ARITHMETIC, "minus"));
	}

	@Test
	public void testBaseTable() throws Exception {
		KeywordTable base = KeywordTable.builder().color("mint", "#98FF98").build();
		KeywordTable table = new KeywordTableReader(base).read(new StringReader("loop.for = voor elke\n"), "test");
		assertEquals("#98FF98", table.getColorCode("mint"));
		assertEquals("for", table.findExact(KeywordCategory.LOOP, "voor elke"));
		assertTrue(table.getSubKinds(KeywordCategory.WIDGET).isEmpty());
	}

	@Test
	public void testMalformedLinesReportTheirLineNumber() {
		assertMalformed("# header\nwidget.button = a button\njust words\n", 3, "Expecting 'key = value'");
		assertMalformed("loop.for =  , \n", 1, "No value for loop.for");
		assertMalformed("\nevent. = on tap\n", 2, "Missing name after 'event.'");
		assertMalformed("color.red = red\n", 1, "Expecting 'color.name = #RRGGBB'");
		assertMalformed("boolean.maybe = perhaps\n", 1, "Expecting boolean.true or boolean.false");
		assertMalformed("gesture.swipe = swipe left\n", 1, "Unknown keyword category: gesture");
		assertMalformed("widget = a button\n", 1, "Category widget needs a sub-kind");
	}

	private static void assertMalformed(String text, int expectedLine, String expectedMessage) {
		KeywordTableException e = assertThrows(KeywordTableException.class, () -> read(text));
		assertEquals("Line of: " + text, expectedLine, e.getLineNumber());
		assertTrue(e.getMessage() + " should contain " + expectedMessage, e.getMessage().contains(expectedMessage));
		assertTrue(e.getMessage().endsWith("(line " + expectedLine + ")"));
	}

	@Test
	public void testMissingFile() {
		assertThrows(IOException.class, () -> new KeywordTableReader().read(Paths.get("does-not-exist.keywords")));
	}
}
