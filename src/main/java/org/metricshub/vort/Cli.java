package org.metricshub.vort;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Vortlang
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import org.metricshub.vort.frontend.Token;
import org.metricshub.vort.frontend.ast.CompileException;
import org.metricshub.vort.frontend.ast.Program;
import org.metricshub.vort.toolchain.GccToolchain;
import org.metricshub.vort.toolchain.NativeToolchain;
import org.metricshub.vort.toolchain.ToolchainResult;
import org.metricshub.vort.util.DurationFormat;
import org.metricshub.vort.util.ScriptFileSource;
import org.metricshub.vort.util.VortLogger;
import org.metricshub.vort.util.VortSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for Vortlang.
 */
public final class Cli {

	private static final Logger LOGGER = VortLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "vortlang.jar";
		}
		JAR_NAME = myName;
	}

	private final VortSettings settings = new VortSettings();
	private final PrintStream out;
	private final PrintStream err;

	/**
	 * Toolchain given by the caller, or {@code null} to run the configured C
	 * compiler.
	 */
	private final NativeToolchain toolchain;

	private ScriptFileSource scriptSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err, null);
	}

	/**
	 * Creates a CLI instance using the supplied streams and toolchain.
	 *
	 * @param out stream where progress messages and dumps are written
	 * @param err stream where diagnostics and warnings are written
	 * @param toolchain compiler of the generated C, or {@code null} to use
	 *        the one named by the <code>--cc</code> option
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err, NativeToolchain toolchain) {
		this.out = out;
		this.err = err;
		this.toolchain = toolchain;
	}

	/**
	 * Returns the mutable {@link VortSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public VortSettings getSettings() {
		return settings;
	}

	/**
	 * @return the source file given on the command line, or {@code null}
	 */
	public ScriptFileSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
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
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one source file can be compiled at a time: " + arg);
				}
				scriptSource = new ScriptFileSource(arg);
			} else if (arg.equals("-o")) {
				// -o path : executable (or C file with -S) to produce
				checkParameterHasArgument(args, argIdx);
				settings.setOutputPath(args[++argIdx]);
			} else if (arg.equals("-S") || arg.equals("--emit-c")) {
				settings.setEmitCOnly(true);
			} else if (arg.equals("-k") || arg.equals("--keep-c")) {
				settings.setKeepCFile(true);
			} else if (arg.equals("--cc")) {
				checkParameterHasArgument(args, argIdx);
				settings.setCCompiler(args[++argIdx]);
			} else if (arg.equals("--sandbox")) {
				settings.setSandbox(true);
			} else if (arg.equals("-w") || arg.equals("--no-warnings")) {
				settings.setWarningsEnabled(false);
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--dump-tokens")) {
				settings.setDumpTokens(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
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
			throw new IllegalArgumentException("Vortlang source file not provided.");
		}
		if (!Files.isRegularFile(Paths.get(scriptSource.getFilePath()))) {
			throw new IllegalArgumentException("Error reading file " + scriptSource.getFilePath() + ": no such file");
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

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the source cannot be read or the outputs written
	 * @throws InterruptedException if interrupted while waiting for the C
	 *         compiler
	 * @throws ExitException with code 1 when the compilation fails
	 */
	public void run() throws IOException, InterruptedException, ExitException {
		if (printUsage) {
			usage(out);
			return;
		}
		LOGGER.debug("Settings:\n{}", settings.toDescriptionString());

		Instant start = Instant.now();
		Vort vort = new Vort(settings);

		CompilationResult result;
		try {
			if (settings.isDumpTokens()) {
				for (Token token : vort.tokenize(scriptSource)) {
					out.println(token);
				}
			}
			result = vort.compile(scriptSource);
		} catch (CompileException e) {
			err.print(e.getDiagnostic());
			throw new ExitException(1, e.getMessage());
		}

		if (settings.isDumpSyntaxTree()) {
			Program ast = vort.getLastAst();
			if (ast != null) {
				ast.dump(out);
			}
		}
		for (String warning : result.getWarnings()) {
			err.println("Warning: " + warning);
		}

		String stem = scriptSource.getStem();
		if (settings.isEmitCOnly()) {
			Path cFile = Paths.get(settings.getOutputPath() != null ? settings.getOutputPath() : stem + ".c");
			Files.write(cFile, result.getCSource().getBytes(StandardCharsets.UTF_8));
			out.println("Generated C code for " + stem + ".vl in " + cFile);
			return;
		}

		String executable = settings.getOutputPath(stem);
		Path cFile = Paths.get(cFileFor(executable));
		Files.write(cFile, result.getCSource().getBytes(StandardCharsets.UTF_8));
		ToolchainResult built;
		try {
			NativeToolchain cc = toolchain != null ? toolchain : new GccToolchain(settings.getCCompiler());
			built = cc.compile(cFile, Paths.get(executable));
		} catch (IOException e) {
			err.println("Error: Failed to execute " + settings.getCCompiler() + ": " + e.getMessage());
			throw new ExitException(1, e.getMessage());
		} finally {
			if (!settings.isKeepCFile()) {
				Files.deleteIfExists(cFile);
			}
		}

		if (!built.isSuccess()) {
			err.println("Error: C compilation failed: " + built.getOutput());
			throw new ExitException(1, "C compilation failed with exit code " + built.getExitCode());
		}

		String duration = DurationFormat.format(Duration.between(start, Instant.now()));
		out.println("Successfully compiled " + stem + ".vl to " + executable + " in " + duration);
	}

	/**
	 * Name of the intermediate C file: the executable path with its
	 * <code>.exe</code> extension replaced by <code>.c</code>.
	 */
	static String cFileFor(String executable) {
		if (executable.endsWith(".exe")) {
			return executable.substring(0, executable.length() - 4) + ".c";
		}
		return executable + ".c";
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
								" [-o output-filename]" +
								" [-S|--emit-c]" +
								" [-k|--keep-c]" +
								" [--cc compiler]" +
								" [--sandbox]" +
								" [-w|--no-warnings]" +
								" [--dump-syntax]" +
								" [--dump-tokens]" +
								" source.vl");
		dest.println();
		dest.println(" -o filename = Executable to produce (default: <source>.exe).");
		dest.println(" -S, --emit-c = Only write the generated C code (to -o, or <source>.c).");
		dest.println(" -k, --keep-c = Keep the generated C file after building the executable.");
		dest.println(" --cc compiler = C compiler to run (default: " + VortSettings.DEFAULT_C_COMPILER + ").");
		dest.println(" --sandbox = Reject functions written in raw C (newfn $c).");
		dest.println(" -w, --no-warnings = Do not report unused variables.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --dump-tokens = Print the tokens.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for progress messages
	 * @param es error stream for diagnostics
	 * @param toolchain compiler of the generated C, or {@code null} for the
	 *        configured one
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, PrintStream os, PrintStream es, NativeToolchain toolchain)
			throws Exception {
		Cli cli = new Cli(os, es, toolchain);
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
			cli.run();
		} catch (ExitException e) {
			System.exit(e.getCode());
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println("Please see the help/usage output (cmd line switch '-h').");
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
