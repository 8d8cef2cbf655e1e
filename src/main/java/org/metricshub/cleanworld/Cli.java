package org.metricshub.cleanworld;


/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CleanWorld
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
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.frontend.CstNode;
import org.metricshub.cleanworld.frontend.ParserException;
import org.metricshub.cleanworld.frontend.Token;
import org.metricshub.cleanworld.frontend.TokenListing;
import org.metricshub.cleanworld.jrt.CleanRuntimeException;
import org.metricshub.cleanworld.semantic.SemanticException;
import org.metricshub.cleanworld.util.CleanLogger;
import org.metricshub.cleanworld.util.CleanSettings;
import org.metricshub.cleanworld.util.ScriptFileSource;
import org.metricshub.cleanworld.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for CleanWorld.
 */
public final class Cli {

	private static final Logger LOG = CleanLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "cleanworld.jar";
		}
		JAR_NAME = myName;
	}

	private final CleanSettings settings = new CleanSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private String tokenFile;

	private boolean dumpTokens;
	private boolean dumpCst;
	private boolean dumpAst;
	private boolean checkOnly;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance printing program output, dumps and usage to the
	 * supplied stream.
	 *
	 * @param out stream where program output is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link CleanSettings} configured from the command
	 * line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CleanSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given on the command line, or null when a
	 *         token file is used
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * @return the token listing file given with <code>-T</code>, or null
	 */
	public String getTokenFile() {
		return tokenFile;
	}

	public boolean isCheckOnly() {
		return checkOnly;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException on an unknown option, a missing option
	 *         value or a missing program
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// program file given without -f
				setScriptSource(new ScriptFileSource(arg));
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				setScriptSource(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-T")) {
				// -T filename : read a token listing instead of program text
				checkParameterHasArgument(args, argIdx);
				tokenFile = args[++argIdx];
			} else if (arg.equals("--dump-tokens")) {
				dumpTokens = true;
			} else if (arg.equals("--dump-cst")) {
				dumpCst = true;
			} else if (arg.equals("--dump-ast")) {
				dumpAst = true;
			} else if (arg.equals("-c") || arg.equals("--check")) {
				// -c/--check : compile only
				checkOnly = true;
			} else if (arg.equals("--max-iterations")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxLoopIterations(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--seed")) {
				checkParameterHasArgument(args, argIdx);
				settings.setRandomSeed(parseInt(arg, args[++argIdx]));
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

		if (scriptSource == null && tokenFile == null) {
			throw new IllegalArgumentException("CleanWorld program not provided.");
		}
		if (scriptSource != null && tokenFile != null) {
			throw new IllegalArgumentException("A program file and a token file cannot be used together.");
		}
	}

	private void setScriptSource(ScriptSource source) {
		if (scriptSource != null) {
			throw new IllegalArgumentException("Only one program can be run at a time.");
		}
		scriptSource = source;
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

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'", e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 * <p>
	 * Dumps and <code>--check</code> stop after compilation; otherwise the
	 * program runs.
	 *
	 * @throws IOException if the program or token file cannot be read, or the
	 *         token file is not a valid listing
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		CleanWorld cleanWorld = new CleanWorld();
		List<Token> tokens;
		if (tokenFile != null) {
			String listing = new String(Files.readAllBytes(Paths.get(tokenFile)), StandardCharsets.UTF_8);
			try {
				tokens = TokenListing.parse(listing);
			} catch (IllegalArgumentException e) {
				throw new IOException("Invalid token file " + tokenFile + ": " + e.getMessage(), e);
			}
		} else {
			tokens = cleanWorld.tokenize(scriptSource.readFully());
		}
		if (dumpTokens) {
			out.print(TokenListing.format(tokens));
		}

		Program program = cleanWorld.compile(tokens);
		if (dumpCst) {
			CstNode cst = cleanWorld.getLastCst();
			if (cst != null) {
				cst.dump(out);
			}
		}
		if (dumpAst) {
			program.dump(out);
		}
		if (checkOnly) {
			out.println("Static semantics check: SUCCESS");
			return;
		}
		if (dumpTokens || dumpCst || dumpAst) {
			// If only dumping information, no need to execute the program
			return;
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("Running with settings:\n{}", settings.toDescriptionString());
		}
		cleanWorld.invoke(program, settings);
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
								" [--dump-tokens]" +
								" [--dump-cst]" +
								" [--dump-ast]" +
								" [-c|--check]" +
								" [--max-iterations n]" +
								" [--seed n]" +
								" ([-f] program-filename | -T tokens-filename)");
		dest.println();
		dest.println(" -f filename = Use contents of filename as the program.");
		dest.println(" -T filename = Read a token listing (line tid kind lexeme) instead of program text.");
		dest.println(" --dump-tokens = Print the token listing.");
		dest.println(" --dump-cst = Print the concrete syntax tree.");
		dest.println(" --dump-ast = Print the abstract syntax tree.");
		dest.println(" -c, --check = Check the program without running it.");
		dest.println(" --max-iterations n = Maximum number of iterations of a single while loop (default "
				+ CleanSettings.DEFAULT_MAX_LOOP_ITERATIONS + ").");
		dest.println(" --seed n = Seed of the world layout generator (default " + CleanSettings.DEFAULT_RANDOM_SEED + ").");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Parses the arguments and runs the CLI, reporting any failure on the
	 * error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for program output
	 * @param err stream for error messages
	 * @return the process exit code: 0 on success, 1 on any error
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (ParserException e) {
			return report(err, e, e.getLineNumber());
		} catch (SemanticException e) {
			return report(err, e, e.getLineNumber());
		} catch (CleanRuntimeException e) {
			return report(err, e, e.getLineNumber());
		} catch (IllegalArgumentException e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return 1;
		} catch (IOException | UncheckedIOException e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		} finally {
			out.flush();
		}
	}

	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	private static int report(PrintStream err, RuntimeException e, int lineNumber) {
		if (lineNumber >= 0) {
			err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), lineNumber, e.getMessage());
		} else {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
		return 1;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int code = execute(args, System.out, System.err);
		if (code != 0) {
			System.exit(code);
		}
	}
}
