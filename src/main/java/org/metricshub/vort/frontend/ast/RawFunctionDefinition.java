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
 * {@code newfn $c name() {{{ ... }}}}: a function whose body is C code,
 * copied unchecked into the generated source.
 */
public final class RawFunctionDefinition extends Statement {

	private final String name;
	private final String rawCode;

	public RawFunctionDefinition(String name, String rawCode) {
		this.name = name;
		this.rawCode = rawCode;
	}

	public String getName() {
		return name;
	}

	public String getRawCode() {
		return rawCode;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitRawFunctionDefinition(this);
	}

	@Override
	public String toString() {
		return "RawFunctionDefinition " + name;
	}
}
