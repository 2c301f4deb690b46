package org.metricshub.yiphthachl.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.yiphthachl.frontend.ast.AppBarAst;
import org.metricshub.yiphthachl.frontend.ast.AppDeclarationAst;
import org.metricshub.yiphthachl.frontend.ast.AssignmentAst;
import org.metricshub.yiphthachl.frontend.ast.AstNode;
import org.metricshub.yiphthachl.frontend.ast.BinaryExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.BlockAst;
import org.metricshub.yiphthachl.frontend.ast.BooleanLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.BottomNavigationAst;
import org.metricshub.yiphthachl.frontend.ast.ButtonAst;
import org.metricshub.yiphthachl.frontend.ast.CenterAst;
import org.metricshub.yiphthachl.frontend.ast.ColorLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.ColumnAst;
import org.metricshub.yiphthachl.frontend.ast.CommentAst;
import org.metricshub.yiphthachl.frontend.ast.ComparisonExpressionAst;
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
import org.metricshub.yiphthachl.frontend.ast.LogicalExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.MapLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.NavigateAst;
import org.metricshub.yiphthachl.frontend.ast.NodeKind;
import org.metricshub.yiphthachl.frontend.ast.NumberLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.ParserException;
import org.metricshub.yiphthachl.frontend.ast.ProgramAst;
import org.metricshub.yiphthachl.frontend.ast.RepeatLoopAst;
import org.metricshub.yiphthachl.frontend.ast.RowAst;
import org.metricshub.yiphthachl.frontend.ast.ScaffoldAst;
import org.metricshub.yiphthachl.frontend.ast.ScreenAst;
import org.metricshub.yiphthachl.frontend.ast.ShowMessageAst;
import org.metricshub.yiphthachl.frontend.ast.StringLiteralAst;
import org.metricshub.yiphthachl.frontend.ast.TextAst;
import org.metricshub.yiphthachl.frontend.ast.TextFieldAst;
import org.metricshub.yiphthachl.frontend.ast.UnaryExpressionAst;
import org.metricshub.yiphthachl.frontend.ast.UpdateStateAst;
import org.metricshub.yiphthachl.frontend.ast.VariableDeclarationAst;
import org.metricshub.yiphthachl.frontend.ast.VariableReferenceAst;
import org.metricshub.yiphthachl.frontend.ast.WhileLoopAst;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptSource;

public class ParserTest {

	private static ParseResult parse(String source) {
		return parse(source, new FrontendSettings());
	}

	private static ParseResult parse(String source, FrontendSettings settings) {
		List<Token> tokens = new Tokenizer(source, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, settings).tokenize();
		return new Parser(tokens, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, settings).parse();
	}

	/**
	 * Parses a program expected to be free of errors.
	 */
	private static List<AstNode> statements(String source) {
		ParseResult result = parse(source);
		assertTrue("Unexpected errors: " + result.getErrors(), result.isSuccessful());
		return result.getProgram().getStatements();
	}

	private static AstNode single(String source) {
		List<AstNode> statements = statements(source);
		assertEquals("Statements of: " + source, 1, statements.size());
		return statements.get(0);
	}

	private static AstNode expression(String source) {
		return new Parser(new Tokenizer(source).tokenize()).parseExpression();
	}

	private static String name(AstNode node) {
		assertTrue(node + " is not a variable reference", node instanceof VariableReferenceAst);
		return ((VariableReferenceAst) node).getName();
	}

	private static double number(AstNode node) {
		assertTrue(node + " is not a number", node instanceof NumberLiteralAst);
		return ((NumberLiteralAst) node).getValue();
	}

	private static String string(AstNode node) {
		assertTrue(node + " is not a string", node instanceof StringLiteralAst);
		return ((StringLiteralAst) node).getValue();
	}

	@Test
	public void testEmptySource() {
		ParseResult result = parse("");
		assertEquals(0, result.getProgram().getStatements().size());
		assertTrue(result.getErrors().isEmpty());
		assertTrue(result.getWarnings().isEmpty());

		List<AstNode> onlyComment = statements("\n\n   \n# just a thought\n");
		assertEquals(1, onlyComment.size());
		assertTrue(onlyComment.get(0) instanceof CommentAst);
	}

	@Test
	public void testCounterButton() {
		List<AstNode> statements = statements(
				"remember counter as 0\n"
						+ "a button that says \"+\"\n"
						+ "    when pressed\n"
						+ "        add 1 to counter\n"
						+ "    end when\n");
		assertEquals(2, statements.size());

		VariableDeclarationAst counter = (VariableDeclarationAst) statements.get(0);
		assertEquals("counter", counter.getName());
		assertTrue(counter.isState());
		assertEquals(0, number(counter.getValue()), 0);

		ButtonAst button = (ButtonAst) statements.get(1);
		assertEquals("+", string(button.getLabel()));
		List<AstNode> actions = button.getOnPressed();
		assertEquals(1, actions.size());

		AssignmentAst assignment = (AssignmentAst) actions.get(0);
		assertEquals("counter", name(assignment.getTarget()));
		BinaryExpressionAst sum = (BinaryExpressionAst) assignment.getValue();
		assertEquals("add", sum.getOperator());
		assertEquals("counter", name(sum.getLeft()));
		assertEquals(1, number(sum.getRight()), 0);
	}

	@Test
	public void testMultiWordIdentifier() {
		assertEquals("my_favorite_color", name(single("my favorite color")));
	}

	@Test
	public void testVariableDeclarations() {
		VariableDeclarationAst plain = (VariableDeclarationAst) single("set total price to 12.5");
		assertEquals("total_price", plain.getName());
		assertFalse(plain.isState());
		assertEquals(12.5, number(plain.getValue()), 0);

		VariableDeclarationAst flag = (VariableDeclarationAst) single("let ready be yes");
		assertTrue(((BooleanLiteralAst) flag.getValue()).getValue());

		VariableDeclarationAst color = (VariableDeclarationAst) single("make theme as blue");
		assertEquals("#3B82F6", ((ColorLiteralAst) color.getValue()).getCode());

		VariableDeclarationAst copy = (VariableDeclarationAst) single("set greeting to user name");
		assertEquals("user_name", name(copy.getValue()));
	}

	@Test
	public void testAssignment() {
		AssignmentAst assignment = (AssignmentAst) single("score is 10");
		assertEquals("score", name(assignment.getTarget()));
		assertEquals(10, number(assignment.getValue()), 0);
	}

	@Test
	public void testIfOtherwiseChain() {
		IfStatementAst first = (IfStatementAst) single(
				"if score is greater than 10\n"
						+ "    set result to 1\n"
						+ "otherwise if score is greater than 5\n"
						+ "    set result to 2\n"
						+ "otherwise\n"
						+ "    set result to 3\n"
						+ "end if\n");
		ComparisonExpressionAst condition = (ComparisonExpressionAst) first.getCondition();
		assertEquals("greaterThan", condition.getOperator());
		assertEquals("score", name(condition.getLeft()));
		assertEquals(10, number(condition.getRight()), 0);
		assertEquals(1, first.getConsequent().size());

		IfStatementAst second = (IfStatementAst) first.getAlternate();
		assertEquals(1, second.getConsequent().size());

		BlockAst last = (BlockAst) second.getAlternate();
		VariableDeclarationAst three = (VariableDeclarationAst) last.getStatements().get(0);
		assertEquals(3, number(three.getValue()), 0);
	}

	@Test
	public void testIfWithoutElse() {
		List<AstNode> statements = statements("if done\n    set x to 1\nset y to 2\n");
		assertEquals(2, statements.size());
		IfStatementAst conditional = (IfStatementAst) statements.get(0);
		assertNull(conditional.getAlternate());
		assertEquals("done", name(conditional.getCondition()));
	}

	@Test
	public void testIsComparesInConditions() {
		IfStatementAst conditional = (IfStatementAst) single("if name is \"Bob\"\n    set x to 1\n");
		ComparisonExpressionAst condition = (ComparisonExpressionAst) conditional.getCondition();
		assertEquals("equals", condition.getOperator());
		assertEquals("Bob", string(condition.getRight()));
	}

	@Test
	public void testOrphanOtherwise() {
		FrontendSettings settings = new FrontendSettings();
		settings.setReportDegradedDefaults(true);
		ParseResult result = parse("otherwise\n    set x to 1\n", settings);
		assertTrue(result.isSuccessful());
		assertFalse(result.getWarnings().isEmpty());
		assertTrue(result.getWarnings().get(0).getMessage().contains("without a matching condition"));
		assertEquals("The indented statements still count", 1, result.getProgram().getStatements().size());
	}

	@Test
	public void testFunctionDeclaration() {
		FunctionDeclarationAst function = (FunctionDeclarationAst) single(
				"define function greet that takes name and age\n"
						+ "    set greeting to name\n"
						+ "    end function\n");
		assertEquals("greet", function.getName());
		assertEquals(2, function.getParameters().size());
		assertEquals("name", function.getParameters().get(0));
		assertEquals("age", function.getParameters().get(1));
		assertEquals(1, function.getBody().size());
	}

	@Test
	public void testEndFunctionOutsideTheBodyIsAnIdentifier() {
		List<AstNode> statements = statements("define function reset\n    set x to 0\nend function\n");
		assertEquals(2, statements.size());
		assertEquals("end_function", name(statements.get(1)));
	}

	@Test
	public void testFunctionCall() {
		FunctionCallAst call = (FunctionCallAst) single("call greet with \"Bob\" and 3");
		assertEquals("greet", call.getName());
		assertEquals(2, call.getArguments().size());
		assertEquals("Bob", string(call.getArguments().get(0)));
		assertEquals(3, number(call.getArguments().get(1)), 0);

		FunctionCallAst bare = (FunctionCallAst) single("run reset all");
		assertEquals("reset_all", bare.getName());
		assertTrue(bare.getArguments().isEmpty());
	}

	@Test
	public void testLoops() {
		ForLoopAst forLoop = (ForLoopAst) single("for each fruit in fruits\n    set x to fruit\n");
		assertEquals("fruit", forLoop.getIterator());
		assertEquals("fruits", name(forLoop.getIterable()));
		assertEquals(1, forLoop.getBody().size());

		WhileLoopAst whileLoop = (WhileLoopAst) single("while count is less than 10\n    add 1 to count\n");
		assertEquals("lessThan", ((ComparisonExpressionAst) whileLoop.getCondition()).getOperator());
		assertTrue(whileLoop.getBody().get(0) instanceof AssignmentAst);

		RepeatLoopAst repeat = (RepeatLoopAst) single("repeat 3 times\n    add 2 to total\n");
		assertEquals(3, number(repeat.getCount()), 0);
		assertEquals(1, repeat.getBody().size());

		RepeatLoopAst byName = (RepeatLoopAst) single("repeat rounds times\n    add 2 to total\n");
		assertEquals("rounds", name(byName.getCount()));
	}

	@Test
	public void testMathStatements() {
		AssignmentAst subtract = (AssignmentAst) single("subtract 2 from lives");
		assertEquals("lives", name(subtract.getTarget()));
		BinaryExpressionAst difference = (BinaryExpressionAst) subtract.getValue();
		assertEquals("subtract", difference.getOperator());
		assertSame("The target node is shared", subtract.getTarget(), difference.getLeft());

		BinaryExpressionAst alone = (BinaryExpressionAst) single("add 5");
		assertEquals("add", alone.getOperator());
		assertEquals(5, number(alone.getLeft()), 0);
		assertEquals(0, number(alone.getRight()), 0);
	}

	@Test
	public void testPrecedence() {
		BinaryExpressionAst sum = (BinaryExpressionAst) expression("1 + 2 * 3");
		assertEquals("add", sum.getOperator());
		assertEquals(1, number(sum.getLeft()), 0);
		BinaryExpressionAst product = (BinaryExpressionAst) sum.getRight();
		assertEquals("multiply", product.getOperator());

		BinaryExpressionAst leftAssociative = (BinaryExpressionAst) expression("10 minus 4 minus 3");
		assertEquals(3, number(leftAssociative.getRight()), 0);
		assertEquals("subtract", ((BinaryExpressionAst) leftAssociative.getLeft()).getOperator());
	}

	@Test
	public void testLogicalExpressions() {
		LogicalExpressionAst or = (LogicalExpressionAst) expression("x is 1 and y is 2 or done");
		assertEquals("or", or.getOperator());
		LogicalExpressionAst and = (LogicalExpressionAst) or.getLeft();
		assertEquals("and", and.getOperator());
		assertEquals("equals", ((ComparisonExpressionAst) and.getLeft()).getOperator());
		assertEquals("done", name(or.getRight()));

		LogicalExpressionAst symbols = (LogicalExpressionAst) expression("a1 && b1 || c1");
		assertEquals("or", symbols.getOperator());
	}

	@Test
	public void testUnaryExpressions() {
		UnaryExpressionAst not = (UnaryExpressionAst) expression("not done");
		assertEquals("not", not.getOperator());
		assertEquals("done", name(not.getOperand()));

		UnaryExpressionAst negate = (UnaryExpressionAst) expression("- 5");
		assertEquals("negate", negate.getOperator());
		assertEquals(5, number(negate.getOperand()), 0);
	}

	@Test
	public void testComparisonSymbols() {
		ComparisonExpressionAst comparison = (ComparisonExpressionAst) expression("score >= 10");
		assertEquals("greaterOrEqual", comparison.getOperator());
	}

	@Test
	public void testParseExpressionRejectsLeftovers() {
		assertThrows(ParserException.class, () -> expression("1 + 2\nset x to 3"));
	}

	@Test
	public void testListAndMapLiterals() {
		VariableDeclarationAst fruits = (VariableDeclarationAst) single("set fruits to [\"apple\", \"banana\", 3]");
		ListLiteralAst list = (ListLiteralAst) fruits.getValue();
		assertEquals(3, list.getElements().size());
		assertEquals("banana", string(list.getElements().get(1)));

		VariableDeclarationAst user = (VariableDeclarationAst) single("set user to {name: \"Bob\", \"home town\": \"Paris\", age: 30}");
		MapLiteralAst map = (MapLiteralAst) user.getValue();
		assertEquals(3, map.getEntries().size());
		List<String> keys = new ArrayList<>(map.getEntries().keySet());
		assertEquals("name", keys.get(0));
		assertEquals("home town", keys.get(1));
		assertEquals("age", keys.get(2));
		assertEquals(30, number(map.getEntries().get("age")), 0);

		ListLiteralAst nested = (ListLiteralAst) expression("[[1, 2], []]");
		assertEquals(2, nested.getElements().size());
		assertTrue(((ListLiteralAst) nested.getElements().get(1)).getElements().isEmpty());
	}

	@Test
	public void testComments() {
		List<AstNode> statements = statements("# the counter\nset x to 1\n");
		assertEquals(2, statements.size());
		assertEquals("the counter", ((CommentAst) statements.get(0)).getText());
	}

	@Test
	public void testTextWidget() {
		TextAst text = (TextAst) single("a text that says \"Hello\" make it bold\n");
		assertEquals("Hello", string(text.getContent()));
		assertEquals(Boolean.TRUE, text.getStyles().get("bold"));

		TextAst variable = (TextAst) single("some text shows the score");
		assertEquals("score", name(variable.getContent()));
	}

	@Test
	public void testWidgetBlockStyles() {
		TextAst text = (TextAst) single("a text \"Title\"\n    font size 24\n    red\n    padding \"small\"\n");
		assertEquals(Double.valueOf(24), text.getStyles().get("fontSize"));
		assertEquals("#EF4444", text.getStyles().get("color"));
		assertEquals("small", text.getStyles().get("padding"));
	}

	@Test
	public void testLayouts() {
		ColumnAst column = (ColumnAst) single(
				"a column\n"
						+ "    align center\n"
						+ "    a text \"One\"\n"
						+ "    a row\n"
						+ "        a text \"Two\"\n"
						+ "        a text \"Three\"\n");
		assertEquals("center", column.getAlignment());
		assertEquals(2, column.getChildren().size());
		RowAst row = (RowAst) column.getChildren().get(1);
		assertEquals(RowAst.DEFAULT_ALIGNMENT, row.getAlignment());
		assertEquals(2, row.getChildren().size());
	}

	@Test
	public void testCenterKeepsOneChild() {
		CenterAst center = (CenterAst) single("in the center\n    a text \"A\"\n    a text \"B\"\n");
		assertTrue(center.getChild() instanceof TextAst);
	}

	@Test
	public void testImageIconAndTextField() {
		ImageAst image = (ImageAst) single("an image from \"logo.png\" described as \"Logo\"");
		assertEquals("logo.png", string(image.getSource()));
		assertEquals("Logo", image.getAlt());

		IconAst icon = (IconAst) single("an icon named home\n    size 32\n    green\n");
		assertEquals("home", icon.getName());
		assertEquals(32, icon.getSize(), 0);
		assertEquals("#22C55E", icon.getColor());

		TextFieldAst field = (TextFieldAst) single("a text field with placeholder \"Your name\"");
		assertEquals("Your name", field.getPlaceholder());
	}

	@Test
	public void testGenericWidget() {
		GenericWidgetAst checkbox = (GenericWidgetAst) single("a checkbox that says \"Agree\"\n    when changed\n        set agreed to yes\n");
		assertEquals(NodeKind.WIDGET, checkbox.getKind());
		assertEquals("checkbox", checkbox.getWidgetType());
		assertEquals("Agree", checkbox.getProperties().get("label"));
		assertEquals(1, checkbox.getEventActions("onChanged").size());
	}

	@Test
	public void testScaffoldBucketsItsChildren() {
		ScaffoldAst scaffold = (ScaffoldAst) single(
				"use a scaffold\n"
						+ "    a title bar \"Home\"\n"
						+ "    a text \"Hello\"\n"
						+ "    bottom navigation\n"
						+ "        \"Home\" with icon home\n"
						+ "        \"Settings\" with icon settings\n");
		AppBarAst appBar = scaffold.getAppBar();
		assertEquals("Home", string(appBar.getTitle().getContent()));

		ColumnAst body = (ColumnAst) scaffold.getBody();
		assertEquals(1, body.getChildren().size());
		assertTrue(body.getChildren().get(0) instanceof TextAst);

		BottomNavigationAst navigation = scaffold.getBottomNavigation();
		assertEquals(2, navigation.getItems().size());
		assertEquals("Settings", navigation.getItems().get(1).getLabel());
		assertEquals("settings", navigation.getItems().get(1).getIcon());
		assertNull(scaffold.getDrawer());
	}

	@Test
	public void testOverIndentedNavigationItem() {
		ScaffoldAst scaffold = (ScaffoldAst) single(
				"use a scaffold\n"
						+ "    bottom navigation\n"
						+ "        \"Home\" with icon home\n"
						+ "            \"Extra\" with icon star\n"
						+ "        \"Settings\" with icon settings\n"
						+ "    a drawer\n");
		BottomNavigationAst navigation = scaffold.getBottomNavigation();
		assertEquals(3, navigation.getItems().size());
		assertEquals("Extra", navigation.getItems().get(1).getLabel());
		assertEquals("Settings", navigation.getItems().get(2).getLabel());
		assertEquals("The scaffold block is still open after the items", "drawer", ((GenericWidgetAst) scaffold.getDrawer()).getWidgetType());
	}

	@Test
	public void testScaffoldBodySection() {
		ScaffoldAst scaffold = (ScaffoldAst) single(
				"use a scaffold\n"
						+ "    in the body\n"
						+ "        a text \"Hi\"\n"
						+ "    a button \"Go\"\n"
						+ "    a drawer\n");
		ColumnAst body = (ColumnAst) scaffold.getBody();
		assertEquals("Loose widgets join the body", 2, body.getChildren().size());
		assertTrue(body.getChildren().get(1) instanceof ButtonAst);
		assertEquals("drawer", ((GenericWidgetAst) scaffold.getDrawer()).getWidgetType());
	}

	@Test
	public void testAppAndScreens() {
		AppDeclarationAst app = (AppDeclarationAst) single(
				"create an app \"Todo\"\n"
						+ "    the main screen\n"
						+ "        a text \"Welcome\"\n"
						+ "    define screen settings\n"
						+ "        a text \"Settings\"\n"
						+ "    set theme to \"dark\"\n");
		assertEquals("Todo", app.getName());
		assertEquals(2, app.getScreens().size());
		ScreenAst main = app.getScreens().get(0);
		assertTrue(main.isMain());
		assertEquals("main", main.getName());
		ScreenAst settings = app.getScreens().get(1);
		assertFalse(settings.isMain());
		assertEquals("settings", settings.getName());
		assertEquals(1, settings.getBody().size());
		assertEquals(1, app.getConfiguration().size());
	}

	@Test
	public void testEventActions() {
		ButtonAst button = (ButtonAst) single(
				"a button \"Save\"\n"
						+ "    when pressed\n"
						+ "        show message \"Saved\"\n"
						+ "        go to settings\n"
						+ "        go back\n"
						+ "        change counter to 5\n"
						+ "        if done\n"
						+ "            show message \"Done\"\n");
		List<AstNode> actions = button.getOnPressed();
		assertEquals(5, actions.size());
		assertEquals("Saved", string(((ShowMessageAst) actions.get(0)).getMessage()));
		assertEquals("settings", ((NavigateAst) actions.get(1)).getScreenName());
		assertTrue(actions.get(2) instanceof GoBackAst);
		UpdateStateAst update = (UpdateStateAst) actions.get(3);
		assertEquals("counter", update.getStateName());
		assertEquals(5, number(update.getNewValue()), 0);

		IfStatementAst nested = (IfStatementAst) actions.get(4);
		assertTrue("Actions also apply to nested blocks", nested.getConsequent().get(0) instanceof ShowMessageAst);
	}

	@Test
	public void testInlineEventAction() {
		ButtonAst button = (ButtonAst) single("a button \"Back\" when pressed go back");
		assertEquals(1, button.getOnPressed().size());
		assertTrue(button.getOnPressed().get(0) instanceof GoBackAst);
	}

	@Test
	public void testTopLevelEventHandler() {
		EventHandlerAst handler = (EventHandlerAst) single("when clicked\n    go to \"Profile\"\n");
		assertEquals("onPressed", handler.getEventKind());
		assertEquals("Profile", ((NavigateAst) handler.getActions().get(0)).getScreenName());
	}

	@Test
	public void testShowMessageIsNoActionAtTopLevel() {
		List<AstNode> statements = statements("show message \"Hi\"");
		assertEquals(1, statements.size());
		assertEquals("show_message", name(statements.get(0)));
	}

	@Test
	public void testDegradedDefaultsAreSilentByDefault() {
		ParseResult result = parse("a button\nrepeat\n    set x to 1\n");
		assertTrue(result.isSuccessful());
		assertTrue(result.getWarnings().isEmpty());
		ButtonAst button = (ButtonAst) result.getProgram().getStatements().get(0);
		assertEquals("Button", string(button.getLabel()));
		RepeatLoopAst repeat = (RepeatLoopAst) result.getProgram().getStatements().get(1);
		assertEquals(1, number(repeat.getCount()), 0);
	}

	@Test
	public void testDegradedDefaultsAreReported() {
		FrontendSettings settings = new FrontendSettings();
		settings.setReportDegradedDefaults(true);
		ParseResult result = parse("a button\nset x to\nfor each\n", settings);
		assertTrue("Warnings are no errors", result.isSuccessful());

		List<String> messages = new ArrayList<>();
		for (ParseWarning warning : result.getWarnings()) {
			messages.add(warning.getMessage());
		}
		assertTrue(messages.toString(), messages.contains("Expected a button label"));
		assertTrue(messages.toString(), messages.contains("Expected a loop variable"));
		assertTrue(messages.toString(), messages.stream().anyMatch(m -> m.startsWith("Expected a value")));
		assertTrue(messages.toString(), messages.stream().anyMatch(m -> m.startsWith("Expected an indented block")));
		assertEquals(1, result.getWarnings().get(0).getLine());
	}

	@Test
	public void testNestingTooDeepStopsTheParse() {
		FrontendSettings settings = new FrontendSettings();
		settings.setMaxNestingDepth(2);
		ParseResult result = parse(
				"set a to 1\n"
						+ "if x\n"
						+ "    if y\n"
						+ "        if z\n"
						+ "            set b to 2\n",
				settings);
		assertFalse(result.isSuccessful());
		assertEquals(1, result.getErrors().size());
		assertTrue(result.getErrors().get(0).getMessage().contains("Nesting deeper than 2 levels"));
		assertEquals("Statements before the failure are kept", 1, result.getProgram().getStatements().size());
	}

	@Test
	public void testDeepListsStopTheParse() {
		StringBuilder source = new StringBuilder("set x to ");
		for (int i = 0; i < 300; i++) {
			source.append('[');
		}
		ParseResult result = parse(source.toString());
		assertEquals(1, result.getErrors().size());
	}

	private static String elseIfChain(int links) {
		StringBuilder source = new StringBuilder("if x\n    set a to 0\n");
		for (int i = 1; i <= links; i++) {
			source.append("otherwise if x\n    set a to ").append(i).append('\n');
		}
		return source.toString();
	}

	@Test
	public void testElseIfChainCountsTowardsNesting() {
		FrontendSettings settings = new FrontendSettings();
		settings.setMaxNestingDepth(3);
		assertTrue(parse(elseIfChain(2), settings).isSuccessful());

		ParseResult result = parse(elseIfChain(5), settings);
		assertEquals(1, result.getErrors().size());
		assertTrue(result.getErrors().get(0).getMessage().contains("Nesting deeper than 3 levels"));
	}

	@Test
	public void testVeryLongElseIfChainIsReportedAsAnError() {
		ParseResult result = parse(elseIfChain(10000));
		assertEquals(1, result.getErrors().size());
		assertTrue(result.getErrors().get(0).getMessage().contains("Nesting deeper than 256 levels"));
		assertTrue(result.getProgram().getStatements().isEmpty());
	}

	@Test
	public void testTokensMustEndWithEof() {
		assertThrows(IllegalArgumentException.class, () -> new Parser(Collections.<Token>emptyList()));
		List<Token> noEof = Collections.singletonList(new Token(TokenType.IDENTIFIER, "x", 1, 1, "x"));
		assertThrows(IllegalArgumentException.class, () -> new Parser(noEof));
	}

	@Test
	public void testParseIsRepeatable() {
		Parser parser = new Parser(new Tokenizer("set x to 1\nset y to 2").tokenize());
		ProgramAst first = parser.parse().getProgram();
		ProgramAst second = parser.parse().getProgram();
		assertEquals(2, first.getStatements().size());
		assertEquals(2, second.getStatements().size());
	}

	@Test
	public void testLocations() {
		List<AstNode> statements = statements("set x to 1\n\n  a button \"Go\"\n");
		assertEquals(1, statements.get(0).getLocation().getLine());
		assertEquals(3, statements.get(1).getLocation().getLine());
		assertEquals(3, statements.get(1).getLocation().getColumn());
	}
}
