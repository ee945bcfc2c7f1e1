package org.metricshub.vort.frontend.ast;

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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders compile errors the way they are shown to the user: a header with
 * the source path and position, the offending source line with a caret under
 * the column, and a hint.
 */
public final class Diagnostics {

	private Diagnostics() {}

	/**
	 * Formats a positioned diagnostic.
	 * <p>
	 * Example:
	 *
	 * <pre>
	 * Error in hello.vl:2:7
	 *   Unexpected character '#'
	 *
	 *    2 | print(#)
	 *      |       ^
	 *
	 * Hint: Remove or replace this character
	 * </pre>
	 *
	 * @param sourceDescription path (or description) of the source
	 * @param source full source text, used to quote the offending line
	 * @param position where the error occurred
	 * @param message what went wrong
	 * @param hint how to fix it
	 * @return the rendered diagnostic, ending with a newline
	 */
	public static String format(
			String sourceDescription,
			String source,
			SourcePosition position,
			String message,
			String hint) {
		StringBuilder error = new StringBuilder();
		error
				.append("Error in ")
				.append(sourceDescription)
				.append(':')
				.append(position.getLine())
				.append(':')
				.append(position.getColumn())
				.append('\n');
		error.append("  ").append(message).append('\n');

		List<String> lines = source == null ? List.of() : source.lines().collect(Collectors.toList());
		int lineIdx = position.getLine() - 1;
		if (lineIdx >= 0 && lineIdx < lines.size()) {
			error.append('\n').append(String.format("%4d | %s", position.getLine(), lines.get(lineIdx))).append('\n');
			StringBuilder pointer = new StringBuilder();
			for (int i = 1; i < position.getColumn(); i++) {
				pointer.append(' ');
			}
			pointer.append('^');
			error.append("     | ").append(pointer).append('\n');
		}

		error.append("\nHint: ").append(hint).append('\n');
		return error.toString();
	}

	/**
	 * Formats a diagnostic that has no source position, such as errors raised
	 * while generating code for the whole program.
	 *
	 * @param message what went wrong
	 * @return the rendered diagnostic, ending with a newline
	 */
	public static String format(String message) {
		return "Error: " + message + '\n';
	}
}
