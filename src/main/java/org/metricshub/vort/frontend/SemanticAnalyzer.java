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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.vort.frontend.ast.BinaryOperation;
import org.metricshub.vort.frontend.ast.Expression;
import org.metricshub.vort.frontend.ast.FormatPart;
import org.metricshub.vort.frontend.ast.FunctionCallStatement;
import org.metricshub.vort.frontend.ast.FunctionDefinition;
import org.metricshub.vort.frontend.ast.Grouping;
import org.metricshub.vort.frontend.ast.NumberLiteral;
import org.metricshub.vort.frontend.ast.NumericAssignment;
import org.metricshub.vort.frontend.ast.NumericDeclaration;
import org.metricshub.vort.frontend.ast.NumericExpressionVisitor;
import org.metricshub.vort.frontend.ast.NumericVariable;
import org.metricshub.vort.frontend.ast.PrintFormatStatement;
import org.metricshub.vort.frontend.ast.PrintStatement;
import org.metricshub.vort.frontend.ast.Program;
import org.metricshub.vort.frontend.ast.RawFunctionDefinition;
import org.metricshub.vort.frontend.ast.Statement;
import org.metricshub.vort.frontend.ast.StatementVisitor;
import org.metricshub.vort.frontend.ast.TextAssignment;
import org.metricshub.vort.frontend.ast.TextDeclaration;
import org.metricshub.vort.frontend.ast.VariableReference;
import org.metricshub.vort.util.VortLogger;
import org.slf4j.Logger;

/**
 * Reports variables that are declared but never read.
 * <p>
 * Variables are global wherever they are declared, so declarations and uses
 * inside function bodies count like top-level ones. A variable is used when it
 * is printed, interpolated in a format string, read in a numeric expression,
 * or copied into a text variable. The program is returned unchanged.
 */
public class SemanticAnalyzer {

	private static final Logger LOGGER = VortLogger.getLogger(SemanticAnalyzer.class);

	/**
	 * Analyzes the program.
	 *
	 * @param program the parsed program
	 * @return the same program and one warning per unused variable, in order
	 *         of first declaration
	 */
	public AnalysisResult analyze(Program program) {
		Map<String, Integer> declared = new LinkedHashMap<String, Integer>();
		Set<String> used = new HashSet<String>();

		SymbolCollector collector = new SymbolCollector(declared, used);
		for (Statement statement : program.getStatements()) {
			statement.accept(collector);
		}

		List<String> warnings = new ArrayList<String>();
		for (Map.Entry<String, Integer> entry : declared.entrySet()) {
			if (!used.contains(entry.getKey())) {
				warnings.add("Unused variable '" + entry.getKey() + "' at line " + entry.getValue());
			}
		}
		LOGGER.debug("{} variables declared, {} unused", declared.size(), warnings.size());
		return new AnalysisResult(program, warnings);
	}

	/**
	 * Records declarations (first line wins) and uses in a single walk.
	 */
	private static final class SymbolCollector implements StatementVisitor<Void>, NumericExpressionVisitor<Void> {

		private final Map<String, Integer> declared;
		private final Set<String> used;

		private SymbolCollector(Map<String, Integer> declared, Set<String> used) {
			this.declared = declared;
			this.used = used;
		}

		private void useText(Expression expression) {
			if (expression instanceof VariableReference) {
				used.add(((VariableReference) expression).getName());
			}
		}

		@Override
		public Void visitPrint(PrintStatement statement) {
			useText(statement.getExpression());
			return null;
		}

		@Override
		public Void visitPrintFormat(PrintFormatStatement statement) {
			for (FormatPart part : statement.getParts()) {
				if (part.isNumeric()) {
					part.getNumericExpression().accept(this);
				} else if (!part.isLiteral()) {
					useText(part.getExpression());
				}
			}
			return null;
		}

		@Override
		public Void visitTextDeclaration(TextDeclaration statement) {
			declared.putIfAbsent(statement.getName(), statement.getLineNumber());
			useText(statement.getExpression());
			return null;
		}

		@Override
		public Void visitNumericDeclaration(NumericDeclaration statement) {
			declared.putIfAbsent(statement.getName(), statement.getLineNumber());
			statement.getExpression().accept(this);
			return null;
		}

		@Override
		public Void visitTextAssignment(TextAssignment statement) {
			useText(statement.getExpression());
			return null;
		}

		@Override
		public Void visitNumericAssignment(NumericAssignment statement) {
			statement.getExpression().accept(this);
			return null;
		}

		@Override
		public Void visitFunctionDefinition(FunctionDefinition statement) {
			for (Statement bodyStatement : statement.getBody()) {
				bodyStatement.accept(this);
			}
			return null;
		}

		@Override
		public Void visitRawFunctionDefinition(RawFunctionDefinition statement) {
			return null;
		}

		@Override
		public Void visitFunctionCall(FunctionCallStatement statement) {
			return null;
		}

		@Override
		public Void visitNumberLiteral(NumberLiteral expression) {
			return null;
		}

		@Override
		public Void visitNumericVariable(NumericVariable expression) {
			used.add(expression.getName());
			return null;
		}

		@Override
		public Void visitBinaryOperation(BinaryOperation expression) {
			expression.getLeft().accept(this);
			expression.getRight().accept(this);
			return null;
		}

		@Override
		public Void visitGrouping(Grouping expression) {
			expression.getInner().accept(this);
			return null;
		}
	}
}
