package org.metricshub.vort.frontend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.vort.frontend.ast.Program;

/**
 * The program handed over to code generation, and the warnings found while
 * analyzing it.
 */
public final class AnalysisResult {

	private final Program program;
	private final List<String> warnings;

	public AnalysisResult(Program program, List<String> warnings) {
		this.program = program;
		this.warnings = Collections.unmodifiableList(new ArrayList<String>(warnings));
	}

	public Program getProgram() {
		return program;
	}

	/**
	 * @return the warnings, without the {@code Warning:} prefix (unmodifiable)
	 */
	public List<String> getWarnings() {
		return warnings;
	}
}
