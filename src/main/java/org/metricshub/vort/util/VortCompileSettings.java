package org.metricshub.vort.util;

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
 * Settings read while compiling a Vortlang source to C.
 */
public interface VortCompileSettings {

	/**
	 * @return {@code true} to reject {@code newfn $c} functions, whose body is
	 *         raw C copied unchecked into the output
	 */
	boolean isSandbox();

	/**
	 * @return {@code true} to report unused variables
	 */
	boolean isWarningsEnabled();

	/**
	 * @return {@code true} to dump the syntax tree
	 */
	boolean isDumpSyntaxTree();

	/**
	 * @return {@code true} to dump the token stream
	 */
	boolean isDumpTokens();
}
