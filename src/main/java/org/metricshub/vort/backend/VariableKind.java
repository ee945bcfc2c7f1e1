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
 * The two disjoint namespaces of Vortlang variables, with their C
 * representation.
 */
public enum VariableKind {
	TEXT("char*", "\"\"", "%s", "text"),
	NUMERIC("double", "0.0", "%g", "numeric");

	private final String cType;
	private final String initialValue;
	private final String formatSpecifier;
	private final String description;

	VariableKind(String cType, String initialValue, String formatSpecifier, String description) {
		this.cType = cType;
		this.initialValue = initialValue;
		this.formatSpecifier = formatSpecifier;
		this.description = description;
	}

	/**
	 * @return type of the C global holding such a variable
	 */
	public String getCType() {
		return cType;
	}

	/**
	 * @return C initializer of the global, so that a variable printed before
	 *         its first assignment holds an empty text or zero
	 */
	public String getInitialValue() {
		return initialValue;
	}

	/**
	 * @return printf conversion used to print such a variable
	 */
	public String getFormatSpecifier() {
		return formatSpecifier;
	}

	public String getDescription() {
		return description;
	}
}
