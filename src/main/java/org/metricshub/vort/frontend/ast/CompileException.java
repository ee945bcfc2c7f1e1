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

/**
 * Base class of all the errors that abort a compilation.
 * <p>
 * The lexer and the parser always attach a {@link SourcePosition}; errors
 * raised while generating code for the whole program have none, in which case
 * {@link #getLineNumber()} and {@link #getColumnNumber()} return {@code -1}.
 */
public class CompileException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final transient SourcePosition position;
	private final String hint;
	private final String diagnostic;

	/**
	 * Creates an error without any source position.
	 *
	 * @param msg description of the error
	 */
	public CompileException(String msg) {
		super(msg);
		this.sourceDescription = null;
		this.position = null;
		this.hint = null;
		this.diagnostic = Diagnostics.format(msg);
	}

	/**
	 * Creates a positioned error and renders its diagnostic.
	 *
	 * @param msg description of the error
	 * @param hint how to fix it
	 * @param sourceDescription path (or description) of the source
	 * @param source full source text
	 * @param position where the error occurred
	 */
	public CompileException(
			String msg,
			String hint,
			String sourceDescription,
			String source,
			SourcePosition position) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.position = position;
		this.hint = hint;
		this.diagnostic = Diagnostics.format(sourceDescription, source, position, msg, hint);
	}

	/**
	 * @return the position of the error, or {@code null} when there is none
	 */
	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return position == null ? -1 : position.getLine();
	}

	/**
	 * @return the offending column number or {@code -1}
	 */
	public int getColumnNumber() {
		return position == null ? -1 : position.getColumn();
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public String getHint() {
		return hint;
	}

	/**
	 * Returns the text shown to the user for this error.
	 *
	 * @return the rendered diagnostic
	 */
	public String getDiagnostic() {
		return diagnostic;
	}
}
