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

import java.util.Collections;
import java.util.List;

/**
 * {@code name = expression}: assigns a new value to a numeric variable.
 */
public final class NumericAssignment extends Statement {

	private final String name;
	private final NumericExpression expression;
	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for NumericAssignment.
	 * </p>
	 *
	 * @param name variable name
	 * @param expression value assigned to the variable
	 * @param lineNumber line of the statement
	 */
	public NumericAssignment(String name, NumericExpression expression, int lineNumber) {
		this.name = name;
		this.expression = expression;
		this.lineNumber = lineNumber;
	}

	public String getName() {
		return name;
	}

	public NumericExpression getExpression() {
		return expression;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitNumericAssignment(this);
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		return Collections.singletonList(expression);
	}

	@Override
	public String toString() {
		return "NumericAssignment " + name + " (line " + lineNumber + ")";
	}
}
