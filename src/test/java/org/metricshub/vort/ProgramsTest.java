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

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.vort.util.ScriptFileSource;

/**
 * Non-regression suite: each Vortlang program in the src/test/resources/programs
 * directory is compiled and the generated C is compared to the corresponding
 * *.c file.
 */
@RunWith(Parameterized.class)
public class ProgramsTest {

	/**
	 * @return the list of Vortlang programs in /src/test/resources/programs
	 * @throws Exception
	 */
	@Parameters(name = "PROGRAM {0}")
	public static Iterable<String> programList() throws Exception {
		URL programsUrl = ProgramsTest.class.getResource("/programs");
		if (programsUrl == null) {
			throw new IOException("Couldn't find resource /programs");
		}

		File programsDir = new File(programsUrl.toURI());
		if (!programsDir.isDirectory()) {
			throw new IOException("/programs is not a directory");
		}

		return Arrays
				.stream(programsDir.listFiles())
				.filter(f -> f.getName().endsWith(".vl"))
				.map(File::getAbsolutePath)
				.sorted()
				.collect(Collectors.toList());
	}

	/** Path to the program to compile */
	@Parameter
	public String programPath;

	@Test
	public void test() throws Exception {
		File programFile = new File(programPath);
		String shortName = programFile.getName().substring(0, programFile.getName().length() - 3);
		File expectedFile = new File(programFile.getParentFile(), shortName + ".c");

		String expected = new String(Files.readAllBytes(expectedFile.toPath()), StandardCharsets.UTF_8)
				.replace("\r\n", "\n");
		CompilationResult result = new Vort().compile(new ScriptFileSource(programPath));
		assertEquals("Generated C for " + shortName, expected, result.getCSource());
	}
}
