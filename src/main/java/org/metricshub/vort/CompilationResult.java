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

import java.util.Collections;
import java.util.List;

/**
 * Output of a successful compilation: the generated C source and the warnings
 * raised along the way.
 */
public final class CompilationResult {

	private final String cSource;
	private final List<String> warnings;

	/**
	 * @param cSource the generated C source
	 * @param warnings the warnings, possibly empty
	 */
	public CompilationResult(String cSource, List<String> warnings) {
		this.cSource = cSource;
		this.warnings = Collections.unmodifiableList(warnings);
	}

	public String getCSource() {
		return cSource;
	}

	public List<String> getWarnings() {
		return warnings;
	}
}
