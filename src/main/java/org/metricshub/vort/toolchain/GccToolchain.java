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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.metricshub.vort.util.VortLogger;
import org.slf4j.Logger;

/**
 * Runs a gcc-compatible compiler: {@code <cc> <file.c> -o <executable>}.
 */
public class GccToolchain implements NativeToolchain {

	private static final Logger LOGGER = VortLogger.getLogger(GccToolchain.class);

	private final String compilerCommand;

	/**
	 * @param compilerCommand the compiler executable, e.g. {@code gcc} or {@code clang}
	 */
	public GccToolchain(String compilerCommand) {
		this.compilerCommand = compilerCommand;
	}

	/** {@inheritDoc} */
	@Override
	public ToolchainResult compile(Path cSource, Path executable) throws IOException, InterruptedException {
		List<String> command = Arrays.asList(compilerCommand, cSource.toString(), "-o", executable.toString());
		LOGGER.info("Running {}", String.join(" ", command));

		Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
		process.getOutputStream().close();
		String output;
		try (InputStream in = process.getInputStream()) {
			ByteArrayOutputStream buffer = new ByteArrayOutputStream();
			in.transferTo(buffer);
			output = buffer.toString(StandardCharsets.UTF_8.name());
		}
		int exitCode = process.waitFor();
		LOGGER.debug("{} exited with code {}", compilerCommand, exitCode);
		return new ToolchainResult(exitCode, output);
	}
}
