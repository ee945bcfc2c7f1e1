package org.metricshub.vort.backend;

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
 * Escapes text for a C string literal.
 */
public final class TextEscaper {

	private TextEscaper() {}

	/**
	 * Escapes backslash, double quote, newline, tab and carriage return, so
	 * that the C compiler reads back exactly the original text.
	 *
	 * @param s text to embed between double quotes
	 * @return the escaped text, without the surrounding quotes
	 */
	public static String escape(String s) {
		StringBuilder result = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '\\':
				result.append("\\\\");
				break;
			case '"':
				result.append("\\\"");
				break;
			case '\n':
				result.append("\\n");
				break;
			case '\t':
				result.append("\\t");
				break;
			case '\r':
				result.append("\\r");
				break;
			default:
				result.append(c);
				break;
			}
		}
		return result.toString();
	}

	/**
	 * @param s text to embed
	 * @return the escaped text between double quotes
	 */
	public static String quote(String s) {
		return '"' + escape(s) + '"';
	}
}
