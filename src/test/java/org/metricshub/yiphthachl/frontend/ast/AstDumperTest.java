package org.metricshub.yiphthachl.frontend.ast;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.yiphthachl.frontend.ParseResult;
import org.metricshub.yiphthachl.frontend.Parser;
import org.metricshub.yiphthachl.frontend.Tokenizer;

public class AstDumperTest {

	private static final SourceLocation HERE = new SourceLocation(1, 1);

	private static String dump(AstNode node) throws UnsupportedEncodingException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(bytes, true, "UTF-8");
		node.dump(ps);
		ps.flush();
		return bytes.toString("UTF-8").replace(System.lineSeparator(), "\n");
	}

	private static ProgramAst parse(String source) {
		ParseResult result = new Parser(new Tokenizer(source).tokenize()).parse();
		assertTrue(result.getErrors().toString(), result.isSuccessful());
		return result.getProgram();
	}

	private static String lines(String... lines) {
		StringBuilder sb = new StringBuilder();
		for (String line : lines) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}

	@Test
	public void testCounterProgram() throws Exception {
		ProgramAst program = parse(
				"remember counter as 0\n"
						+ "a button that says \"+\"\n"
						+ "    when pressed\n"
						+ "        add 1 to counter\n");
		assertEquals(
				lines(
						"Program",
						"  VariableDeclaration counter (state)",
						"    value:",
						"      NumberLiteral 0",
						"  Button",
						"    event onPressed:",
						"      Assignment",
						"        target:",
						"          VariableReference counter",
						"        value:",
						"          BinaryExpression add",
						"            VariableReference counter",
						"            NumberLiteral 1",
						"    label:",
						"      StringLiteral \"+\""),
				dump(program));
	}

	@Test
	public void testIfStatement() throws Exception {
		AstNode statement = parse("if done\n    set x to 1.5\notherwise\n    go\n").getStatements().get(0);
		assertEquals(
				lines(
						"IfStatement",
						"  condition:",
						"    VariableReference done",
						"  then:",
						"    VariableDeclaration x",
						"      value:",
						"        NumberLiteral 1.5",
						"  else:",
						"    Block",
						"      VariableReference go"),
				dump(statement));
	}

	@Test
	public void testLayoutWithStyles() throws Exception {
		AstNode column = parse("a column\n    align center\n    a text \"Hi\"\n").getStatements().get(0);
		assertEquals(
				lines(
						"Column align=center",
						"  styles: {alignCenter=true}",
						"  Text",
						"    content:",
						"      StringLiteral \"Hi\""),
				dump(column));
	}

	@Test
	public void testMapEntriesAreLabeled() throws Exception {
		Map<String, AstNode> entries = new LinkedHashMap<>();
		entries.put("name", new StringLiteralAst(HERE, "Bob"));
		entries.put("tags", new ListLiteralAst(HERE, Arrays.<AstNode>asList(new BooleanLiteralAst(HERE, true))));
		assertEquals(
				lines(
						"MapLiteral",
						"  name:",
						"    StringLiteral \"Bob\"",
						"  tags:",
						"    ListLiteral",
						"      BooleanLiteral true"),
				dump(new MapLiteralAst(HERE, entries)));
	}

	@Test
	public void testEmptyChildListsArePrintedWithoutLabel() throws Exception {
		WhileLoopAst loop = new WhileLoopAst(HERE, new VariableReferenceAst(HERE, "running"), Collections.<AstNode>emptyList());
		assertEquals(lines("WhileLoop", "  condition:", "    VariableReference running"), dump(loop));
	}

	@Test
	public void testNodeDescriptions() {
		assertEquals("Screen \"home\" (main)", new ScreenAst(HERE, "home", Collections.<AstNode>emptyList(), true).toString());
		assertEquals("NumberLiteral 0.25", new NumberLiteralAst(HERE, 0.25).toString());
		assertEquals("NumberLiteral -3", new NumberLiteralAst(HERE, -3).toString());
		assertEquals("Navigate \"settings\"", new NavigateAst(HERE, "settings").toString());
		assertEquals("GoBack", new GoBackAst(HERE).toString());
	}
}
