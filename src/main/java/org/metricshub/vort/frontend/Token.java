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

import org.metricshub.vort.frontend.ast.SourcePosition;

/**
 * A positioned lexical unit.
 * <p>
 * {@link #getText()} holds the identifier name, the string content (escapes
 * resolved) or the raw C code, depending on the type; {@link #getNumber()}
 * holds the value of a {@link TokenType#NUMBER}.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final double number;
	private final int line;
	private final int column;

	Token(TokenType type, String text, double number, int line, int column) {
		this.type = type;
		this.text = text;
		this.number = number;
		this.line = line;
		this.column = column;
	}

	Token(TokenType type, int line, int column) {
		this(type, null, 0, line, column);
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public double getNumber() {
		return number;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public SourcePosition getPosition() {
		return new SourcePosition(line, column);
	}

	/**
	 * @param expected token type to compare with
	 * @return whether this token is of the given type
	 */
	public boolean is(TokenType expected) {
		return type == expected;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder().append(line).append(':').append(column).append(' ').append(type.name());
		if (type == TokenType.NUMBER) {
			sb.append(" (").append(number).append(')');
		} else if (text != null) {
			sb.append(" (").append(text).append(')');
		}
		return sb.toString();
	}
}
