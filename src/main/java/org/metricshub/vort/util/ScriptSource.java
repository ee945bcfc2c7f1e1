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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one Vortlang source.
 * This is usually a "*.vl" file given on the command line,
 * or a string when the compiler is used as a library.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_INLINE_SCRIPT="&lt;inline-script&gt;"</code> */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private String description;
	private Reader reader;
	private String content;

	/**
	 * <p>
	 * Constructor for ScriptSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object, shown in diagnostics
	 * @param reader a {@link java.io.Reader} object
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source from the given text.
	 *
	 * @param description shown in diagnostics
	 * @param text the source text
	 * @return a new source
	 */
	public static ScriptSource fromString(String description, String text) {
		return new ScriptSource(description, new StringReader(text));
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole source. The reader is consumed on the first call, later
	 * calls return the same text.
	 *
	 * @return the source text
	 * @throws IOException if the source cannot be read
	 */
	public String getContent() throws IOException {
		if (content == null) {
			StringBuilder text = new StringBuilder();
			char[] buffer = new char[8192];
			try (Reader r = getReader()) {
				if (r == null) {
					throw new IOException("No reader available for " + description);
				}
				int n;
				while ((n = r.read(buffer)) >= 0) {
					text.append(buffer, 0, n);
				}
			}
			content = text.toString();
		}
		return content;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
