package org.metricshub.yiphthachl;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.yiphthachl.util.ScriptFileSource;
import org.metricshub.yiphthachl.util.ScriptSource;

public class CliTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private Cli cli(String stdin) throws Exception {
		InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
		return new Cli(in, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
	}

	private int run(String... args) throws Exception {
		Cli cli = cli("");
		cli.parse(args);
		return cli.run();
	}

	private String out() throws Exception {
		return out.toString("UTF-8").replace(System.lineSeparator(), "\n");
	}

	private String err() throws Exception {
		return err.toString("UTF-8").replace(System.lineSeparator(), "\n");
	}

	private static String rejected(String... args) {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new Cli().parse(args));
		return e.getMessage();
	}

	@Test
	public void testSummary() throws Exception {
		assertEquals(0, run("set x to 1\nset y to 2"));
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT + ": 2 statements, 0 errors, 0 warnings\n", out());
		assertEquals("", err());
	}

	@Test
	public void testHelp() throws Exception {
		assertEquals(0, run("-h"));
		assertTrue(out().startsWith("Usage:\n"));
		assertTrue(out().contains("--dump-syntax"));
	}

	@Test
	public void testHelpMustBeAlone() {
		assertEquals("When printing help/usage output, we do not accept other arguments.", rejected("--tokens", "-?"));
	}

	@Test
	public void testBadArguments() {
		assertEquals("Unknown parameter: --bogus", rejected("--bogus"));
		assertEquals("Need additional argument for -f", rejected("-f"));
		assertEquals("Unexpected argument: extra", rejected("set x to 1", "extra"));
		assertEquals("--tab-width expects a number: wide", rejected("--tab-width", "wide"));
		assertEquals("--tab-width must be at least 1: 0", rejected("--tab-width", "0"));
		assertTrue(rejected("-k", "no/such/keywords.txt", "x").startsWith("Failed to read keywords 'no/such/keywords.txt'"));
	}

	@Test
	public void testOptions() throws Exception {
		Cli cli = cli("");
		cli.parse(new String[] { "--tab-width", "2", "-w", "--tokens", "--dump-syntax", "x" });
		assertEquals(2, cli.getSettings().getTabWidth());
		assertTrue(cli.getSettings().isReportDegradedDefaults());
		assertTrue(cli.isDumpTokens());
		assertTrue(cli.isDumpSyntaxTree());
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, cli.getScriptSource().getDescription());
	}

	@Test
	public void testTokens() throws Exception {
		assertEquals(0, run("--tokens", "set x"));
		assertEquals("1:1 VARIABLE_DECLARATION \"set\"\n1:5 IDENTIFIER \"x\"\n1:6 EOF\n", out());
	}

	@Test
	public void testDumpSyntax() throws Exception {
		assertEquals(0, run("--dump-syntax", "set x to 1"));
		assertEquals("Program\n  VariableDeclaration x\n    value:\n      NumberLiteral 1\n", out());
	}

	@Test
	public void testStandardInput() throws Exception {
		Cli cli = cli("go back\n");
		cli.parse(new String[] { "-" });
		assertEquals(0, cli.run());
		assertEquals("<stdin>: 1 statements, 0 errors, 0 warnings\n", out());
	}

	@Test
	public void testWarnings() throws Exception {
		assertEquals("Warnings alone do not fail", 0, run("-w", "a button"));
		assertTrue(out().endsWith("1 warnings\n"));
		assertEquals("1:1: warning: Expected a button label\n", err());
	}

	@Test
	public void testErrorsFailTheRun() throws Exception {
		StringBuilder program = new StringBuilder("set x to ");
		for (int i = 0; i < 300; i++) {
			program.append('[');
		}
		assertEquals(1, run(program.toString()));
		assertTrue(out().contains(": 0 statements, 1 errors, 0 warnings"));
		assertTrue(err(), err().contains("Nesting deeper than 256 levels"));
	}

	@Test
	public void testProgramFile() throws Exception {
		String path = YiphthachlTest.resource("/programs/counter.yip").toString();
		Cli cli = cli("");
		cli.parse(new String[] { "-f", path });
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals(0, cli.run());
		assertEquals(path + ": 2 statements, 0 errors, 0 warnings\n", out());
	}

	@Test
	public void testKeywordFile() throws Exception {
		String keywords = YiphthachlTest.resource("/keywords/custom-keywords.txt").toString();
		assertEquals(0, run("-k", keywords, "--dump-syntax", "onthoud teller as 0"));
		assertEquals("Program\n  VariableDeclaration teller\n    value:\n      NumberLiteral 0\n", out());
	}

	@Test
	public void testCreate() throws Exception {
		Cli cli = Cli.create(
				new String[] { "--tokens", "-" },
				new ByteArrayInputStream("red".getBytes(StandardCharsets.UTF_8)),
				new PrintStream(out, true, "UTF-8"),
				new PrintStream(err, true, "UTF-8"));
		assertTrue(cli.isDumpTokens());
		assertEquals("1:1 COLOR_LITERAL \"#EF4444\"\n1:4 EOF\n", out());
	}
}
