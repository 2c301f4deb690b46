package org.metricshub.yiphthachl;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.Test;
import org.metricshub.yiphthachl.frontend.ParseError;
import org.metricshub.yiphthachl.frontend.ParseResult;
import org.metricshub.yiphthachl.frontend.Token;
import org.metricshub.yiphthachl.frontend.TokenType;
import org.metricshub.yiphthachl.frontend.ast.AppDeclarationAst;
import org.metricshub.yiphthachl.frontend.ast.BooleanLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.ComparisonExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.ScaffoldAst;
import org.metricshub.yiphthachl.frontend.ast.ScreenAst;
import org.metricshub.yiphthachl.frontend.ast.VariableDeclarationAst;
import org.metricshub.yiphthachl.keywords.KeywordTableReader;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptFileSource;
import org.metricshub.yiphthachl.util.ScriptSource;

public class YiphthachlTest {

	static Path resource(String name) throws Exception {
		return Paths.get(YiphthachlTest.class.getResource(name).toURI());
	}

	private static String deepList() {
		StringBuilder source = new StringBuilder("set x to ");
		for (int i = 0; i < 300; i++) {
			source.append('[');
		}
		return source.toString();
	}

	@Test
	public void testParse() {
		ParseResult result = new Yiphthachl().parse("set x to 1\nset y to x");
		assertTrue(result.isSuccessful());
		assertEquals(2, result.getProgram().getStatements().size());
	}

	@Test
	public void testSettingsAreRequired() {
		assertThrows(IllegalArgumentException.class, () -> new Yiphthachl(null));
	}

	@Test
	public void testTokenizeScriptSource() throws Exception {
		List<Token> tokens = new Yiphthachl().tokenize(new ScriptSource("demo", new StringReader("a button \"Go\"")));
		assertEquals(3, tokens.size());
		assertEquals(TokenType.WIDGET_TYPE, tokens.get(0).getType());
		assertEquals("button", tokens.get(0).getText());
		assertEquals(TokenType.STRING_LITERAL, tokens.get(1).getType());
		assertEquals(TokenType.EOF, tokens.get(2).getType());
	}

	@Test
	public void testParseProgramFile() throws Exception {
		ScriptFileSource source = new ScriptFileSource(resource("/programs/counter.yip").toString());
		ParseResult result = new Yiphthachl().parse(source);
		assertTrue(result.getErrors().toString(), result.isSuccessful());
		assertEquals(2, result.getProgram().getStatements().size());

		AppDeclarationAst app = (AppDeclarationAst) result.getProgram().getStatements().get(1);
		assertEquals("Counter", app.getName());
		ScreenAst main = app.getScreens().get(0);
		assertTrue(main.isMain());
		assertEquals(2, main.getBody().size());
		ScaffoldAst scaffold = (ScaffoldAst) main.getBody().get(1);
		assertNotNull(scaffold.getAppBar());
		assertNotNull(scaffold.getBody());
	}

	@Test
	public void testValidate() {
		Yiphthachl yiphthachl = new Yiphthachl();
		assertTrue(yiphthachl.validate("set x to 1").isEmpty());

		List<ParseError> errors = yiphthachl.validate(deepList());
		assertEquals(1, errors.size());
		assertEquals(1, errors.get(0).getLine());
	}

	@Test
	public void testParseExpression() {
		ComparisonExpressionAst comparison = (ComparisonExpressionAst) new Yiphthachl().parseExpression("score is at least 10");
		assertEquals("greaterOrEqual", comparison.getOperator());
	}

	@Test
	public void testCustomKeywords() throws Exception {
		FrontendSettings settings = new FrontendSettings();
		settings.setKeywordTable(new KeywordTableReader().read(resource("/keywords/custom-keywords.txt")));
		Yiphthachl yiphthachl = new Yiphthachl(settings);

		VariableDeclarationAst declaration = (VariableDeclarationAst) yiphthachl.parse("zet klaar to ja").getProgram().getStatements().get(0);
		assertEquals("klaar", declaration.getName());
		assertTrue(((BooleanLiteralAst) declaration.getValue()).getValue());

		assertFalse(
				"Replaced phrases no longer declare",
				yiphthachl.parse("set x to 1").getProgram().getStatements().get(0) instanceof VariableDeclarationAst);
	}

	@Test
	public void testSettingsDescription() {
		FrontendSettings settings = new FrontendSettings();
		settings.setTabWidth(2);
		String description = new Yiphthachl(settings).getSettingsDescription();
		assertTrue(description, description.contains("tabWidth = 2"));
		assertTrue(description, description.contains("maxNestingDepth = 256"));
	}
}
