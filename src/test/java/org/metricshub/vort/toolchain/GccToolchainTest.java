package org.metricshub.vort.toolchain;

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
import static org.junit.Assume.assumeTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.metricshub.vort.Vort;

public class GccToolchainTest {

	private static final boolean IS_POSIX = !System
			.getProperty("os.name", "")
			.toLowerCase(Locale.ROOT)
			.contains("win");

	/**
	 * Runs a shell script in place of the C compiler: the script receives the
	 * same arguments gcc would, <code>-o</code> and the executable path.
	 */
	private static ToolchainResult runAsCompiler(String script) throws Exception {
		Path dir = Files.createTempDirectory("vort-cc");
		Path cSource = dir.resolve("prog.c");
		Files.write(cSource, script.getBytes(StandardCharsets.UTF_8));
		return new GccToolchain("sh").compile(cSource, dir.resolve("prog.exe"));
	}

	@Test
	public void testSuccessCapturesOutput() throws Exception {
		assumeTrue(IS_POSIX);
		ToolchainResult result = runAsCompiler("echo \"args: $1 $(basename $2)\"\n");
		assertTrue(result.isSuccess());
		assertEquals(0, result.getExitCode());
		assertEquals("args: -o prog.exe\n", result.getOutput());
	}

	@Test
	public void testFailureCapturesStandardError() throws Exception {
		assumeTrue(IS_POSIX);
		ToolchainResult result = runAsCompiler("echo 'prog.c:1: error' >&2\nexit 3\n");
		assertFalse(result.isSuccess());
		assertEquals(3, result.getExitCode());
		assertEquals("prog.c:1: error\n", result.getOutput());
	}

	@Test
	public void testMissingCompiler() throws Exception {
		Path dir = Files.createTempDirectory("vort-cc");
		GccToolchain toolchain = new GccToolchain("no-such-compiler-vortlang");
		assertThrows(IOException.class, () -> toolchain.compile(dir.resolve("a.c"), dir.resolve("a.exe")));
	}

	private static boolean isGccAvailable() {
		try {
			Process process = new ProcessBuilder("gcc", "--version").redirectErrorStream(true).start();
			process.getInputStream().transferTo(new ByteArrayOutputStream());
			return process.waitFor(30, TimeUnit.SECONDS) && process.exitValue() == 0;
		} catch (IOException e) {
			return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	@Test
	public void testGeneratedArithmeticRunsInDoublePrecision() throws Exception {
		assumeTrue(IS_POSIX && isGccAvailable());
		Path dir = Files.createTempDirectory("vort-native");
		Path cSource = dir.resolve("division.c");
		Path executable = dir.resolve("division.exe");
		String code = new Vort()
				.compile("num half = 7 / 2\nnum big = 100000 * 100000\nprint(half)\nprint(big)\nprint(o\"{1 / 4}\")\n")
				.getCSource();
		Files.write(cSource, code.getBytes(StandardCharsets.UTF_8));

		ToolchainResult built = new GccToolchain("gcc").compile(cSource, executable);
		assertTrue(built.getOutput(), built.isSuccess());

		Process run = new ProcessBuilder(executable.toString()).redirectErrorStream(true).start();
		String output = new String(run.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
		assertEquals(0, run.waitFor());
		assertEquals("3.5\n1e+10\n0.25\n", output);
	}
}
