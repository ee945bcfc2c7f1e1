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
 * One segment of an interpolated print: literal text, an interpolated
 * {@link Expression} (a variable or a function call), or an interpolated
 * arithmetic {@link NumericExpression}.
 */
public final class FormatPart extends AstNode {

	private final String literal;
	private final Expression expression;
	private final NumericExpression numericExpression;

	private FormatPart(String literal, Expression expression, NumericExpression numericExpression) {
		this.literal = literal;
		this.expression = expression;
		this.numericExpression = numericExpression;
	}

	/**
	 * @param text literal text, printed as is
	 * @return a literal part
	 */
	public static FormatPart literal(String text) {
		return new FormatPart(text, null, null);
	}

	/**
	 * @param expression the interpolated variable or function call
	 * @return an expression part
	 */
	public static FormatPart expression(Expression expression) {
		return new FormatPart(null, expression, null);
	}

	/**
	 * @param numericExpression the interpolated arithmetic, such as <code>a + b</code>
	 * @return a numeric part
	 */
	public static FormatPart numeric(NumericExpression numericExpression) {
		return new FormatPart(null, null, numericExpression);
	}

	public boolean isLiteral() {
		return literal != null;
	}

	public boolean isNumeric() {
		return numericExpression != null;
	}

	/**
	 * @return the literal text, or {@code null} for an interpolated part
	 */
	public String getLiteral() {
		return literal;
	}

	/**
	 * @return the interpolated variable or function call, or {@code null}
	 */
	public Expression getExpression() {
		return expression;
	}

	/**
	 * @return the interpolated arithmetic, or {@code null}
	 */
	public NumericExpression getNumericExpression() {
		return numericExpression;
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		if (expression != null) {
			return Collections.singletonList(expression);
		}
		if (numericExpression != null) {
			return Collections.singletonList(numericExpression);
		}
		return Collections.<AstNode>emptyList();
	}

	@Override
	public String toString() {
		if (isLiteral()) {
			return "FormatPart literal \"" + literal + "\"";
		}
		return isNumeric() ? "FormatPart numeric" : "FormatPart expression";
	}
}
