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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.metricshub.vort.VortSandboxException;
import org.metricshub.vort.frontend.ast.BinaryOperation;
import org.metricshub.vort.frontend.ast.Expression;
import org.metricshub.vort.frontend.ast.FormatPart;
import org.metricshub.vort.frontend.ast.FunctionCallExpression;
import org.metricshub.vort.frontend.ast.FunctionCallStatement;
import org.metricshub.vort.frontend.ast.FunctionDefinition;
import org.metricshub.vort.frontend.ast.Grouping;
import org.metricshub.vort.frontend.ast.NumberLiteral;
import org.metricshub.vort.frontend.ast.NumericAssignment;
import org.metricshub.vort.frontend.ast.NumericDeclaration;
import org.metricshub.vort.frontend.ast.NumericExpression;
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
import org.metricshub.vort.frontend.ast.TextLiteral;
import org.metricshub.vort.frontend.ast.VariableReference;
import org.metricshub.vort.util.VortLogger;
import org.slf4j.Logger;

/**
 * Translates a {@link Program} into C source.
 * <p>
 * The output is laid out as follows:
 * <ul>
 * <li>the standard includes;
 * <li>one global per variable of the program, in order of first declaration
 * ({@code char*} for text starting as {@code ""}, {@code double} for
 * numbers starting as {@code 0.0}), since Vortlang
 * variables are global wherever they are declared;
 * <li>one {@code void name(void)} function per function definition;
 * <li>{@code main()}, running the top-level statements.
 * </ul>
 * All names are collected before anything is lowered, so a variable may be
 * used anywhere in the program as long as it is declared somewhere with the
 * matching kind. Arithmetic is always fully parenthesized, so the C operator
 * precedence never matters.
 */
public class CodeGenerator {

	private static final Logger LOGGER = VortLogger.getLogger(CodeGenerator.class);

	private static final String INDENT = "    ";

	private final boolean sandbox;

	/**
	 * Creates a generator accepting raw C functions.
	 */
	public CodeGenerator() {
		this(false);
	}

	/**
	 * <p>
	 * Constructor for CodeGenerator.
	 * </p>
	 *
	 * @param sandbox whether to reject {@code newfn $c} functions
	 */
	public CodeGenerator(boolean sandbox) {
		this.sandbox = sandbox;
	}

	/**
	 * Generates the C source of the program.
	 *
	 * @param program the analyzed program
	 * @return the C source
	 * @throws CodeGenerationException on the first undeclared or mistyped name
	 * @throws VortSandboxException if the program defines a raw C function in
	 *         sandbox mode
	 */
	public String generate(Program program) {
		SymbolTable symbols = collectSymbols(program.getStatements());

		StringBuilder code = new StringBuilder();
		code.append("#include <stdio.h>\n#include <stdlib.h>\n#include <string.h>\n#include <math.h>\n\n");

		for (Map.Entry<String, VariableKind> variable : symbols.getVariables().entrySet()) {
			VariableKind kind = variable.getValue();
			code
					.append(kind.getCType())
					.append(' ')
					.append(variable.getKey())
					.append(" = ")
					.append(kind.getInitialValue())
					.append(";\n");
		}
		code.append('\n');

		List<Statement> mainStatements = new ArrayList<Statement>();
		for (Statement statement : program.getStatements()) {
			if (statement instanceof FunctionDefinition) {
				FunctionDefinition function = (FunctionDefinition) statement;
				code.append("void ").append(function.getName()).append("(void) {\n");
				lower(function.getBody(), symbols, code);
				code.append("}\n\n");
			} else if (statement instanceof RawFunctionDefinition) {
				RawFunctionDefinition function = (RawFunctionDefinition) statement;
				code
						.append("void ")
						.append(function.getName())
						.append("(void) { ")
						.append(function.getRawCode())
						.append(" }\n\n");
			} else {
				mainStatements.add(statement);
			}
		}

		code.append("int main() {\n");
		lower(mainStatements, symbols, code);
		code.append(INDENT).append("return 0;\n");
		code.append("}\n");

		LOGGER
				.debug(
						"Generated {} characters of C for {} variables and {} functions",
						code.length(),
						symbols.getVariables().size(),
						symbols.getFunctions().size());
		return code.toString();
	}

	/**
	 * Collects the variables and functions of the whole program, descending
	 * into function bodies.
	 */
	private SymbolTable collectSymbols(List<Statement> statements) {
		SymbolTable symbols = new SymbolTable();
		collectSymbols(statements, symbols);
		return symbols;
	}

	private void collectSymbols(List<Statement> statements, SymbolTable symbols) {
		for (Statement statement : statements) {
			if (statement instanceof TextDeclaration) {
				symbols.declare(((TextDeclaration) statement).getName(), VariableKind.TEXT);
			} else if (statement instanceof NumericDeclaration) {
				symbols.declare(((NumericDeclaration) statement).getName(), VariableKind.NUMERIC);
			} else if (statement instanceof FunctionDefinition) {
				FunctionDefinition function = (FunctionDefinition) statement;
				symbols.defineFunction(function.getName());
				collectSymbols(function.getBody(), symbols);
			} else if (statement instanceof RawFunctionDefinition) {
				RawFunctionDefinition function = (RawFunctionDefinition) statement;
				if (sandbox) {
					throw new VortSandboxException(
							"C code function '" + function.getName() + "' is not allowed in sandbox mode");
				}
				symbols.defineFunction(function.getName());
			}
		}
	}

	private void lower(List<Statement> statements, SymbolTable symbols, StringBuilder code) {
		StatementLowering lowering = new StatementLowering(symbols, code);
		for (Statement statement : statements) {
			statement.accept(lowering);
		}
	}

	/**
	 * C double constant of a number, in plain decimal form: {@code 10.0},
	 * {@code 2.5}, never an exponent. Whole numbers keep a {@code .0} so that C
	 * does not type them as {@code int}, which would turn {@code 7 / 2} into an
	 * integer division.
	 *
	 * @param value a finite number
	 * @return its C literal
	 */
	static String formatNumber(double value) {
		String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
		return plain.indexOf('.') < 0 ? plain + ".0" : plain;
	}

	/**
	 * Lowers statements to C, one statement per line, into the given buffer.
	 */
	private static final class StatementLowering implements StatementVisitor<Void> {

		private final SymbolTable symbols;
		private final StringBuilder code;
		private final NumericLowering numericLowering;

		private StatementLowering(SymbolTable symbols, StringBuilder code) {
			this.symbols = symbols;
			this.code = code;
			this.numericLowering = new NumericLowering(symbols);
		}

		private void line(String statement) {
			code.append(INDENT).append(statement).append('\n');
		}

		/**
		 * C expression of the value assigned to a text variable.
		 */
		private String textValue(String target, Expression expression) {
			if (expression instanceof TextLiteral) {
				return TextEscaper.quote(((TextLiteral) expression).getValue());
			}
			if (expression instanceof VariableReference) {
				return textVariable(target, ((VariableReference) expression).getName());
			}
			throw new CodeGenerationException("Invalid expression for variable '" + target + "'");
		}

		private String textVariable(String target, String name) {
			VariableKind kind = symbols.getKind(name);
			if (kind == null) {
				throw new CodeGenerationException("Variable '" + name + "' used before declaration");
			}
			if (kind != VariableKind.TEXT) {
				throw new CodeGenerationException(
						"Variable '" + name + "' is numeric and cannot be assigned to text variable '" + target + "'");
			}
			return name;
		}

		private VariableKind targetKind(String name) {
			VariableKind kind = symbols.getKind(name);
			if (kind == null) {
				throw new CodeGenerationException("Variable '" + name + "' assigned before declaration");
			}
			return kind;
		}

		private String printedValue(String name, boolean newline) {
			VariableKind kind = symbols.getKind(name);
			if (kind == null) {
				throw new CodeGenerationException("Variable '" + name + "' used before declaration");
			}
			return "printf(\"" + kind.getFormatSpecifier() + (newline ? "\\n" : "") + "\", " + name + ");";
		}

		private String call(String name) {
			if (!symbols.isFunction(name)) {
				throw new CodeGenerationException("Function '" + name + "' is not defined");
			}
			return name + "();";
		}

		@Override
		public Void visitPrint(PrintStatement statement) {
			Expression expression = statement.getExpression();
			if (expression instanceof TextLiteral) {
				line("printf(\"%s\\n\", " + TextEscaper.quote(((TextLiteral) expression).getValue()) + ");");
			} else if (expression instanceof VariableReference) {
				line(printedValue(((VariableReference) expression).getName(), true));
			} else {
				throw new CodeGenerationException("Invalid expression for print statement");
			}
			return null;
		}

		@Override
		public Void visitPrintFormat(PrintFormatStatement statement) {
			for (FormatPart part : statement.getParts()) {
				if (part.isLiteral()) {
					line("printf(\"%s\", " + TextEscaper.quote(part.getLiteral()) + ");");
				} else if (part.isNumeric()) {
					String value = part.getNumericExpression().accept(numericLowering);
					line("printf(\"" + VariableKind.NUMERIC.getFormatSpecifier() + "\", " + value + ");");
				} else if (part.getExpression() instanceof VariableReference) {
					line(printedValue(((VariableReference) part.getExpression()).getName(), false));
				} else if (part.getExpression() instanceof FunctionCallExpression) {
					line(call(((FunctionCallExpression) part.getExpression()).getName()));
				} else {
					throw new CodeGenerationException("Invalid expression in format string");
				}
			}
			line("printf(\"\\n\");");
			return null;
		}

		@Override
		public Void visitTextDeclaration(TextDeclaration statement) {
			line(statement.getName() + " = " + textValue(statement.getName(), statement.getExpression()) + ";");
			return null;
		}

		@Override
		public Void visitNumericDeclaration(NumericDeclaration statement) {
			line(statement.getName() + " = " + statement.getExpression().accept(numericLowering) + ";");
			return null;
		}

		@Override
		public Void visitTextAssignment(TextAssignment statement) {
			String name = statement.getName();
			if (targetKind(name) != VariableKind.TEXT) {
				throw new CodeGenerationException("Cannot assign text to numeric variable '" + name + "'");
			}
			line(name + " = " + textValue(name, statement.getExpression()) + ";");
			return null;
		}

		@Override
		public Void visitNumericAssignment(NumericAssignment statement) {
			String name = statement.getName();
			NumericExpression expression = statement.getExpression();
			if (targetKind(name) == VariableKind.TEXT) {
				// "a = b" parses as numeric; the target decides
				if (expression instanceof NumericVariable) {
					line(name + " = " + textVariable(name, ((NumericVariable) expression).getName()) + ";");
					return null;
				}
				throw new CodeGenerationException("Cannot assign a numeric value to text variable '" + name + "'");
			}
			line(name + " = " + expression.accept(numericLowering) + ";");
			return null;
		}

		@Override
		public Void visitFunctionDefinition(FunctionDefinition statement) {
			throw new IllegalStateException("Nested function definition: " + statement.getName());
		}

		@Override
		public Void visitRawFunctionDefinition(RawFunctionDefinition statement) {
			throw new IllegalStateException("Nested function definition: " + statement.getName());
		}

		@Override
		public Void visitFunctionCall(FunctionCallStatement statement) {
			line(call(statement.getName()));
			return null;
		}
	}

	/**
	 * Lowers a numeric expression to a C expression.
	 */
	private static final class NumericLowering implements NumericExpressionVisitor<String> {

		private final SymbolTable symbols;

		private NumericLowering(SymbolTable symbols) {
			this.symbols = symbols;
		}

		@Override
		public String visitNumberLiteral(NumberLiteral expression) {
			return formatNumber(expression.getValue());
		}

		@Override
		public String visitNumericVariable(NumericVariable expression) {
			String name = expression.getName();
			VariableKind kind = symbols.getKind(name);
			if (kind == null) {
				throw new CodeGenerationException("Numerical variable '" + name + "' used before declaration");
			}
			if (kind != VariableKind.NUMERIC) {
				throw new CodeGenerationException(
						"Variable '" + name + "' is text and cannot be used in a numeric expression");
			}
			return name;
		}

		@Override
		public String visitBinaryOperation(BinaryOperation expression) {
			return "("
					+ expression.getLeft().accept(this)
					+ expression.getOperator().getSymbol()
					+ expression.getRight().accept(this)
					+ ")";
		}

		@Override
		public String visitGrouping(Grouping expression) {
			return "(" + expression.getInner().accept(this) + ")";
		}
	}
}
