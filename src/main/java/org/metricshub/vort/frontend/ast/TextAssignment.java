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
 * {@code name = "text"}: assigns a new value to a text variable.
 */
public final class TextAssignment extends Statement {

	private final String name;
	private final Expression expression;
	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for TextAssignment.
	 * </p>
	 *
	 * @param name variable name
	 * @param expression value assigned to the variable
	 * @param lineNumber line of the statement
	 */
	public TextAssignment(String name, Expression expression, int lineNumber) {
		this.name = name;
		this.expression = expression;
		this.lineNumber = lineNumber;
	}

	public String getName() {
		return name;
	}

	public Expression getExpression() {
		return expression;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitTextAssignment(this);
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		return Collections.singletonList(expression);
	}

	@Override
	public String toString() {
		return "TextAssignment " + name + " (line " + lineNumber + ")";
	}
}
