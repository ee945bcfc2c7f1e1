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

/**
 * Outcome of a native compilation.
 */
public final class ToolchainResult {

	private final int exitCode;
	private final String output;

	/**
	 * @param exitCode exit code of the compiler process
	 * @param output what the compiler printed (stdout and stderr)
	 */
	public ToolchainResult(int exitCode, String output) {
		this.exitCode = exitCode;
		this.output = output;
	}

	public boolean isSuccess() {
		return exitCode == 0;
	}

	public int getExitCode() {
		return exitCode;
	}

	public String getOutput() {
		return output;
	}
}
