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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.yiphthachl.frontend.ParseError;
import org.metricshub.yiphthachl.frontend.ParseResult;
import org.metricshub.yiphthachl.frontend.ParseWarning;
import org.metricshub.yiphthachl.frontend.Token;
import org.metricshub.yiphthachl.frontend.ast.LexerException;
import org.metricshub.yiphthachl.keywords.KeywordTableException;
import org.metricshub.yiphthachl.keywords.KeywordTableReader;
import org.metricshub.yiphthachl.util.FrontendSettings;
import org.metricshub.yiphthachl.util.ScriptFileSource;
import org.metricshub.yiphthachl.util.ScriptSource;

/**
 * Command-line interface for Yiphthachl.
 * <p>
 * Reads a program from a file, from the command line or from the standard
 * input, and prints its tokens, its syntax tree or a one-line summary.
 * Parse errors are printed as <code>line:column: message</code> and make
 * {@link #run()} return 1.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "yiphthachl.jar";
		}
		JAR_NAME = myName;
	}

	private final FrontendSettings settings = new FrontendSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private ScriptSource scriptSource;
	private boolean dumpTokens;
	private boolean dumpSyntaxTree;
	private boolean printWarnings;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which the program is read when no source is given
	 * @param out stream where tokens, syntax trees and summaries are written
	 * @param err stream where parse errors and warnings are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link FrontendSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public FrontendSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given on the command line, or <code>null</code>
	 *         before {@link #parse(String[])}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the program itself
				break;
			} else if (arg.equals("-")) {
				// single dash: read the program from the standard input
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load the program from a file
				checkParameterHasArgument(args, argIdx);
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-k")) {
				// -k filename : replace keyword categories with the ones of a file
				checkParameterHasArgument(args, argIdx);
				String file = args[++argIdx];
				try {
					settings.setKeywordTable(new KeywordTableReader().read(Paths.get(file)));
				} catch (IOException | KeywordTableException ex) {
					throw new IllegalArgumentException("Failed to read keywords '" + file + "': " + ex.getMessage(), ex);
				}
			} else if (arg.equals("--tab-width")) {
				// --tab-width n : columns counted for a tab character
				checkParameterHasArgument(args, argIdx);
				settings.setTabWidth(parsePositiveInt(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--tokens")) {
				dumpTokens = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("-w") || arg.equals("--warnings")) {
				// -w/--warnings : report the values the parser had to make up
				printWarnings = true;
				settings.setReportDegradedDefaults(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx < args.length) {
				scriptSource = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[argIdx++]));
			} else {
				scriptSource = new ScriptSource("<stdin>", new InputStreamReader(in, StandardCharsets.UTF_8));
			}
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parsePositiveInt(String option, String value) {
		try {
			int result = Integer.parseInt(value);
			if (result < 1) {
				throw new IllegalArgumentException(option + " must be at least 1: " + value);
			}
			return result;
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException(option + " expects a number: " + value, nfe);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the exit status: 0 when the program parsed without errors, 1 otherwise
	 * @throws IOException if the program cannot be read
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return 0;
		}
		if (scriptSource == null) {
			throw new IllegalStateException("parse() must be called before run()");
		}

		Yiphthachl yiphthachl = new Yiphthachl(settings);
		String text = scriptSource.readText();
		ScriptSource source = new ScriptSource(scriptSource.getDescription(), new StringReader(text));

		if (dumpTokens) {
			List<Token> tokens = yiphthachl.tokenize(source);
			for (Token token : tokens) {
				out.println(token);
			}
			source = new ScriptSource(scriptSource.getDescription(), new StringReader(text));
		}

		ParseResult result = yiphthachl.parse(source);
		if (dumpSyntaxTree) {
			result.getProgram().dump(out);
		}
		if (!dumpTokens && !dumpSyntaxTree) {
			out.println(summary(result));
		}
		if (printWarnings) {
			for (ParseWarning warning : result.getWarnings()) {
				err.println(warning);
			}
		}
		for (ParseError error : result.getErrors()) {
			err.println(error);
		}
		return result.isSuccessful() ? 0 : 1;
	}

	private String summary(ParseResult result) {
		return scriptSource.getDescription()
				+ ": "
				+ result.getProgram().getStatements().size()
				+ " statements, "
				+ result.getErrors().size()
				+ " errors, "
				+ result.getWarnings().size()
				+ " warnings";
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f program-filename]" +
								" [-k keywords-filename]" +
								" [--tab-width n]" +
								" [--tokens]" +
								" [--dump-syntax]" +
								" [-w|--warnings]" +
								" [program]");
		dest.println();
		dest.println(" -f filename = Use contents of filename as the program.");
		dest.println(" -k filename = Read keyword phrases from filename.");
		dest.println("                 Categories found in the file replace the built-in ones.");
		dest.println(" --tab-width n = Count a tab as n columns of indentation (default 4).");
		dest.println(" --tokens = Print the tokens, one per line.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" -w, --warnings = Print the places where a default value was assumed.");
		dest.println();
		dest.println(" Without -f or program, the program is read from the standard input.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for the program
	 * @param os output stream for tokens, trees and summaries
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if the program cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			System.exit(cli.run());
		} catch (LexerException e) {
			System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
