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

import java.util.Arrays;
import java.util.List;

/**
 * {@code left op right}, built left-associatively by the parser.
 */
public final class BinaryOperation extends NumericExpression {

	/** Arithmetic operators, with the symbol used in C. */
	public enum Operator {
		ADD("+"),
		SUBTRACT("-"),
		MULTIPLY("*"),
		DIVIDE("/");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final NumericExpression left;
	private final Operator operator;
	private final NumericExpression right;

	public BinaryOperation(NumericExpression left, Operator operator, NumericExpression right) {
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public NumericExpression getLeft() {
		return left;
	}

	public Operator getOperator() {
		return operator;
	}

	public NumericExpression getRight() {
		return right;
	}

	@Override
	public <R> R accept(NumericExpressionVisitor<R> visitor) {
		return visitor.visitBinaryOperation(this);
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		return Arrays.asList(left, right);
	}

	@Override
	public String toString() {
		return "BinaryOperation " + operator.name();
	}
}
