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
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import org.metricshub.vort.backend.CodeGenerator;
import org.metricshub.vort.frontend.AnalysisResult;
import org.metricshub.vort.frontend.SemanticAnalyzer;
import org.metricshub.vort.frontend.Token;
import org.metricshub.vort.frontend.VortLexer;
import org.metricshub.vort.frontend.VortParser;
import org.metricshub.vort.frontend.ast.Program;
import org.metricshub.vort.util.ScriptSource;
import org.metricshub.vort.util.VortCompileSettings;
import org.metricshub.vort.util.VortLogger;
import org.metricshub.vort.util.VortSettings;
import org.slf4j.Logger;

/**
 * Entry point into the compilation of a Vortlang program to C.
 * This entry point is used both when Vortlang is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Scan the source into tokens.
 * <li>Parse the tokens, producing an abstract syntax tree.
 * <li>Look for unused variables in the syntax tree.
 * <li>Traverse the syntax tree, producing C source.
 * </ul>
 * Every stage stops on the first error and the later stages are not run.
 * Turning the C source into an executable is left to a
 * {@link org.metricshub.vort.toolchain.NativeToolchain}.
 */
public class Vort {

	private static final Logger LOGGER = VortLogger.getLogger(Vort.class);

	private final VortCompileSettings settings;

	/**
	 * The last parsed {@link Program} produced during compilation.
	 */
	private Program lastAst;

	/**
	 * Create a new instance with the default settings
	 */
	public Vort() {
		this(new VortSettings());
	}

	/**
	 * @param settings compilation settings (sandbox, warnings)
	 */
	public Vort(VortCompileSettings settings) {
		this.settings = settings;
	}

	/**
	 * Returns the last parsed AST produced by {@link #parse(ScriptSource)}.
	 *
	 * @return the last {@link Program}, or {@code null} if nothing was parsed
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getLastAst() {
		return lastAst;
	}

	/**
	 * Scans a source.
	 *
	 * @param script the source
	 * @return the tokens, ending with an end-of-file token
	 * @throws IOException if the source cannot be read
	 */
	public List<Token> tokenize(ScriptSource script) throws IOException {
		return new VortLexer(script.getDescription(), script.getContent()).tokenize();
	}

	/**
	 * Scans and parses a source.
	 *
	 * @param script the source
	 * @return the syntax tree
	 * @throws IOException if the source cannot be read
	 */
	public Program parse(ScriptSource script) throws IOException {
		String source = script.getContent();
		List<Token> tokens = new VortLexer(script.getDescription(), source).tokenize();
		lastAst = new VortParser(tokens, script.getDescription(), source).parse();
		return lastAst;
	}

	/**
	 * Looks for unused variables. Returns no warnings when they are disabled in
	 * the settings.
	 *
	 * @param program the syntax tree
	 * @return the program and its warnings
	 */
	public AnalysisResult analyze(Program program) {
		if (!settings.isWarningsEnabled()) {
			return new AnalysisResult(program, Collections.<String>emptyList());
		}
		return new SemanticAnalyzer().analyze(program);
	}

	/**
	 * Generates the C source of a program.
	 *
	 * @param program the syntax tree
	 * @return the C source
	 */
	public String generate(Program program) {
		return new CodeGenerator(settings.isSandbox()).generate(program);
	}

	/**
	 * Runs the whole pipeline on a source.
	 *
	 * @param script the source
	 * @return the C source and the warnings
	 * @throws IOException if the source cannot be read
	 * @throws org.metricshub.vort.frontend.ast.CompileException on the first
	 *         lexical, syntax or code generation error
	 */
	public CompilationResult compile(ScriptSource script) throws IOException {
		Program program = parse(script);
		AnalysisResult analysis = analyze(program);
		String cSource = generate(analysis.getProgram());
		LOGGER
				.debug(
						"{}: {} statements, {} warnings, {} characters of C",
						script.getDescription(),
						program.getStatements().size(),
						analysis.getWarnings().size(),
						cSource.length());
		return new CompilationResult(cSource, analysis.getWarnings());
	}

	/**
	 * Convenience overload compiling an inline source.
	 *
	 * @param source the Vortlang source text
	 * @return the C source and the warnings
	 */
	public CompilationResult compile(String source) {
		try {
			return compile(ScriptSource.fromString(ScriptSource.DESCRIPTION_INLINE_SCRIPT, source));
		} catch (IOException e) {
			// reading from a string cannot fail
			throw new IllegalStateException(e);
		}
	}
}
