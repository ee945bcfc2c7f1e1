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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.vort.VortTestSupport.CliResult;

public class CliTest {

	private static final String HELLO = "let g = \"hi\"\nprint(g)\n";

	@Test
	public void testSuccessfulBuild() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("native build with the default toolchain settings")
				.file("hello.vl", HELLO)
				.argument("-o", "{{TEMPDIR}}/hello.exe", "{{TEMPDIR}}/hello.vl")
				.runAndAssert();
		assertTrue(result.output(), result.output().startsWith("Successfully compiled hello.vl to "));
		assertTrue(result.output(), result.output().trim().endsWith("s"));
		assertTrue(result.exists("hello.exe"));
		assertFalse("the intermediate C file is removed", result.exists("hello.c"));
		assertEquals("", result.error());
	}

	@Test
	public void testKeepCFile() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("-k keeps the intermediate C file")
				.file("hello.vl", HELLO)
				.argument("-k", "-o", "{{TEMPDIR}}/hello.exe", "{{TEMPDIR}}/hello.vl")
				.runAndAssert();
		assertTrue(result.readFile("hello.c").contains("printf(\"%s\\n\", g);"));
	}

	@Test
	public void testEmitCOnly() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("-S writes the C source without building")
				.file("hello.vl", HELLO)
				.toolchain(VortTestSupport.failingToolchain("must not be called"))
				.argument("--emit-c", "-o", "{{TEMPDIR}}/out.c", "{{TEMPDIR}}/hello.vl")
				.runAndAssert();
		assertTrue(result.readFile("out.c").startsWith("#include <stdio.h>\n"));
		assertTrue(result.output(), result.output().startsWith("Generated C code for hello.vl in "));
	}

	@Test
	public void testWarningsArePrintedToTheErrorStream() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("unused variables are reported on stderr")
				.file("unused.vl", "let a = \"x\"\nprint(\"done\")\n")
				.argument("-o", "{{TEMPDIR}}/unused.exe", "{{TEMPDIR}}/unused.vl")
				.runAndAssert();
		assertEquals("Warning: Unused variable 'a' at line 1" + System.lineSeparator(), result.error());
	}

	@Test
	public void testNoWarnings() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("-w silences the unused variable warnings")
				.file("unused.vl", "let a = \"x\"\n")
				.argument("-w", "-o", "{{TEMPDIR}}/unused.exe", "{{TEMPDIR}}/unused.vl")
				.runAndAssert();
		assertEquals("", result.error());
	}

	@Test
	public void testSyntaxErrorDiagnostic() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("syntax errors are rendered with the source line")
				.file("bad.vl", "print(\"a\")\nlet = \"x\"\n")
				.argument("-o", "{{TEMPDIR}}/bad.exe", "{{TEMPDIR}}/bad.vl")
				.expectExit(1)
				.runAndAssert();
		String path = result.tempDir().resolve("bad.vl").toString();
		assertEquals(
				"Error in " + path + ":2:5\n"
						+ "  Expected variable name\n"
						+ "\n"
						+ "   2 | let = \"x\"\n"
						+ "     |     ^\n"
						+ "\n"
						+ "Hint: Check your syntax and try again\n",
				result.error());
		assertFalse(result.exists("bad.exe"));
		assertFalse(result.exists("bad.c"));
	}

	@Test
	public void testCodeGenerationErrorDiagnostic() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("code generation errors have no position")
				.file("undeclared.vl", "print(x)\n")
				.argument("-o", "{{TEMPDIR}}/undeclared.exe", "{{TEMPDIR}}/undeclared.vl")
				.expectExit(1)
				.runAndAssert();
		assertEquals("Error: Variable 'x' used before declaration\n", result.error());
	}

	@Test
	public void testToolchainFailure() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("C compiler errors are shown verbatim")
				.file("hello.vl", HELLO)
				.toolchain(VortTestSupport.failingToolchain("hello.c:1: error: boom"))
				.argument("-o", "{{TEMPDIR}}/hello.exe", "{{TEMPDIR}}/hello.vl")
				.expectExit(1)
				.runAndAssert();
		assertTrue(result.error(), result.error().contains("C compilation failed: hello.c:1: error: boom"));
		assertFalse(result.exists("hello.c"));
	}

	@Test
	public void testDumpSyntaxAndTokens() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("--dump-tokens and --dump-syntax")
				.file("hello.vl", HELLO)
				.argument("--dump-tokens", "--dump-syntax", "-S", "-o", "{{TEMPDIR}}/hello.c", "{{TEMPDIR}}/hello.vl")
				.runAndAssert();
		String output = result.output();
		assertTrue(output, output.contains("1:1 KW_LET (let)"));
		assertTrue(output, output.contains("2:1 KW_PRINT (print)"));
		assertTrue(output, output.contains("Program"));
		assertTrue(output, output.contains(" TextDeclaration"));
		assertTrue(output, output.contains(" PrintStatement"));
	}

	@Test
	public void testSandboxOption() throws Exception {
		CliResult result = VortTestSupport
				.cliTest("--sandbox rejects raw C functions")
				.file("raw.vl", "newfn $c beep() {{{ putchar(7); }}}\n")
				.argument("--sandbox", "-o", "{{TEMPDIR}}/raw.exe", "{{TEMPDIR}}/raw.vl")
				.expectExit(1)
				.runAndAssert();
		assertTrue(result.error(), result.error().startsWith("Error: C code function 'beep'"));
	}

	@Test
	public void testUsage() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(out, true, StandardCharsets.UTF_8.name());
		Cli.create(new String[] { "-h" }, ps, ps, VortTestSupport.fakeToolchain());
		String usage = out.toString(StandardCharsets.UTF_8.name());
		assertTrue(usage, usage.startsWith("Usage:"));
		assertTrue(usage, usage.contains("--emit-c"));
	}

	@Test
	public void testParseOptions() {
		Cli cli = new Cli(System.out, System.err, null);
		cli.parse(new String[] { "--cc", "clang", "-k", "--sandbox", "-w", "pom.xml" });
		assertEquals("clang", cli.getSettings().getCCompiler());
		assertTrue(cli.getSettings().isKeepCFile());
		assertTrue(cli.getSettings().isSandbox());
		assertFalse(cli.getSettings().isWarningsEnabled());
		assertEquals("pom.xml", cli.getScriptSource().getFilePath());
		assertEquals("pom.exe", cli.getSettings().getOutputPath(cli.getScriptSource().getStem()));
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--unknown" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-o" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-w" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "missing-file.vl" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "a.vl" }));
	}

	@Test
	public void testCFileName() {
		assertEquals("hello.c", Cli.cFileFor("hello.exe"));
		assertEquals("bin/hello.c", Cli.cFileFor("bin/hello"));
	}
}
