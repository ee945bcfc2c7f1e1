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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.vort.frontend.ast.BinaryOperation;
import org.metricshub.vort.frontend.ast.FormatPart;
import org.metricshub.vort.frontend.ast.FunctionCallExpression;
import org.metricshub.vort.frontend.ast.FunctionCallStatement;
import org.metricshub.vort.frontend.ast.FunctionDefinition;
import org.metricshub.vort.frontend.ast.Grouping;
import org.metricshub.vort.frontend.ast.NumberLiteral;
import org.metricshub.vort.frontend.ast.NumericAssignment;
import org.metricshub.vort.frontend.ast.NumericDeclaration;
import org.metricshub.vort.frontend.ast.NumericVariable;
import org.metricshub.vort.frontend.ast.ParserException;
import org.metricshub.vort.frontend.ast.PrintFormatStatement;
import org.metricshub.vort.frontend.ast.PrintStatement;
import org.metricshub.vort.frontend.ast.RawFunctionDefinition;
import org.metricshub.vort.frontend.ast.Statement;
import org.metricshub.vort.frontend.ast.TextAssignment;
import org.metricshub.vort.frontend.ast.TextDeclaration;
import org.metricshub.vort.frontend.ast.TextLiteral;
import org.metricshub.vort.frontend.ast.VariableReference;

public class VortParserTest {

	private static List<Statement> parse(String source) {
		List<Token> tokens = new VortLexer("test.vl", source).tokenize();
		return new VortParser(tokens, "test.vl", source).parse().getStatements();
	}

	private static ParserException parseError(String source) {
		return assertThrows(ParserException.class, () -> parse(source));
	}

	@Test
	public void testDeclarations() {
		List<Statement> statements = parse("\n\nlet s = \"hi\"\nnum n = 2\n\n");
		assertEquals(2, statements.size());

		TextDeclaration text = (TextDeclaration) statements.get(0);
		assertEquals("s", text.getName());
		assertEquals(3, text.getLineNumber());
		assertEquals("hi", ((TextLiteral) text.getExpression()).getValue());

		NumericDeclaration number = (NumericDeclaration) statements.get(1);
		assertEquals("n", number.getName());
		assertEquals(4, number.getLineNumber());
		assertEquals(2, ((NumberLiteral) number.getExpression()).getValue(), 0);
	}

	@Test
	public void testPrecedence() {
		NumericDeclaration declaration = (NumericDeclaration) parse("num x = 2 + 3 * 4").get(0);
		BinaryOperation add = (BinaryOperation) declaration.getExpression();
		assertEquals(BinaryOperation.Operator.ADD, add.getOperator());
		assertEquals(2, ((NumberLiteral) add.getLeft()).getValue(), 0);
		BinaryOperation multiply = (BinaryOperation) add.getRight();
		assertEquals(BinaryOperation.Operator.MULTIPLY, multiply.getOperator());
	}

	@Test
	public void testLeftAssociativity() {
		NumericDeclaration declaration = (NumericDeclaration) parse("num x = 10 - 4 minus 3").get(0);
		BinaryOperation outer = (BinaryOperation) declaration.getExpression();
		assertEquals(BinaryOperation.Operator.SUBTRACT, outer.getOperator());
		assertEquals(3, ((NumberLiteral) outer.getRight()).getValue(), 0);
		BinaryOperation inner = (BinaryOperation) outer.getLeft();
		assertEquals(10, ((NumberLiteral) inner.getLeft()).getValue(), 0);
		assertEquals(4, ((NumberLiteral) inner.getRight()).getValue(), 0);
	}

	@Test
	public void testGrouping() {
		NumericDeclaration declaration = (NumericDeclaration) parse("num x = (a + b) divide c").get(0);
		BinaryOperation divide = (BinaryOperation) declaration.getExpression();
		assertEquals(BinaryOperation.Operator.DIVIDE, divide.getOperator());
		Grouping grouping = (Grouping) divide.getLeft();
		assertTrue(grouping.getInner() instanceof BinaryOperation);
		assertEquals("c", ((NumericVariable) divide.getRight()).getName());
	}

	@Test
	public void testAssignments() {
		List<Statement> statements = parse("a = 1 + b\nb = \"text\"\nc = d");
		NumericAssignment numeric = (NumericAssignment) statements.get(0);
		assertEquals("a", numeric.getName());
		assertEquals(1, numeric.getLineNumber());
		TextAssignment text = (TextAssignment) statements.get(1);
		assertEquals("text", ((TextLiteral) text.getExpression()).getValue());
		assertEquals(2, text.getLineNumber());
		// a bare identifier is tried as a numeric expression first
		NumericAssignment bare = (NumericAssignment) statements.get(2);
		assertEquals("d", ((NumericVariable) bare.getExpression()).getName());
	}

	@Test
	public void testInvalidAssignment() {
		ParserException e = parseError("a = print");
		assertEquals("Invalid assignment to variable 'a'", e.getMessage());
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testPrint() {
		List<Statement> statements = parse("print(\"hello\")\nprint(name)");
		assertEquals("hello", ((TextLiteral) ((PrintStatement) statements.get(0)).getExpression()).getValue());
		assertEquals("name", ((VariableReference) ((PrintStatement) statements.get(1)).getExpression()).getName());
	}

	@Test
	public void testFormatString() {
		PrintFormatStatement print = (PrintFormatStatement) parse("print(o\"a={a}, f={ callfn f() }!\")").get(0);
		List<FormatPart> parts = print.getParts();
		assertEquals(5, parts.size());
		assertEquals("a=", parts.get(0).getLiteral());
		assertEquals("a", ((VariableReference) parts.get(1).getExpression()).getName());
		assertEquals(", f=", parts.get(2).getLiteral());
		assertEquals("f", ((FunctionCallExpression) parts.get(3).getExpression()).getName());
		assertEquals("!", parts.get(4).getLiteral());
	}

	@Test
	public void testArithmeticInFormatString() {
		PrintFormatStatement print = (PrintFormatStatement) parse("print(o\"sum={a + b}\")").get(0);
		FormatPart sum = print.getParts().get(1);
		assertTrue(sum.isNumeric());
		BinaryOperation add = (BinaryOperation) sum.getNumericExpression();
		assertEquals(BinaryOperation.Operator.ADD, add.getOperator());
		assertEquals("a", ((NumericVariable) add.getLeft()).getName());
	}

	@Test
	public void testFormatStringErrors() {
		ParserException e = parseError("print(o\"a={a\")");
		assertEquals("Unclosed '{' in format string", e.getMessage());
		assertEquals(8, e.getColumnNumber());

		e = parseError("print(o\"{a +}\")");
		assertEquals("Invalid expression in format string: 'a +'", e.getMessage());
		assertEquals(
				"Invalid expression in format string: '\"x\"'",
				parseError("print(o\"{\\\"x\\\"}\")").getMessage());

		assertEquals("Expected '()' after function name", parseError("print(o\"{callfn f}\")").getMessage());
		assertEquals("Invalid expression in format string: ''", parseError("print(o\"{}\")").getMessage());
	}

	@Test
	public void testFunctions() {
		List<Statement> statements = parse(
				"newfn fn greet() {\n  let who = \"you\"\n  print(who)\n}\n"
						+ "newfn $c beep()\n{{{ putchar(7); }}}\n"
						+ "callfn greet()");
		assertEquals(3, statements.size());

		FunctionDefinition greet = (FunctionDefinition) statements.get(0);
		assertEquals("greet", greet.getName());
		assertEquals(2, greet.getBody().size());

		RawFunctionDefinition beep = (RawFunctionDefinition) statements.get(1);
		assertEquals("beep", beep.getName());
		assertEquals(" putchar(7); ", beep.getRawCode());

		assertEquals("greet", ((FunctionCallStatement) statements.get(2)).getName());
	}

	@Test
	public void testEmptyFunctionBodyAcrossLines() {
		FunctionDefinition empty = (FunctionDefinition) parse("newfn fn nothing() {\n}\n").get(0);
		assertTrue(empty.getBody().isEmpty());
	}

	@Test
	public void testNestedFunction() {
		ParserException e = parseError("newfn fn outer() { newfn fn inner() {} }");
		assertEquals("Nested function definitions are not allowed", e.getMessage());
		assertEquals(1, e.getLineNumber());
		assertEquals(20, e.getColumnNumber());
	}

	@Test
	public void testSyntaxErrors() {
		ParserException e = parseError("print(\"a\")\n  42");
		assertEquals("Expected statement", e.getMessage());
		assertEquals(2, e.getLineNumber());
		assertEquals(3, e.getColumnNumber());

		assertEquals("Expected '(' after 'print'", parseError("print \"a\"").getMessage());
		assertEquals("Expected ')' after expression", parseError("print(\"a\"").getMessage());
		assertEquals("Expected variable name", parseError("let 1 = \"a\"").getMessage());
		assertEquals("Expected expression", parseError("let a = 1").getMessage());
		assertEquals("Expected numerical expression", parseError("num a = \"x\"").getMessage());
		assertEquals("Expected ')' after expression", parseError("num a = (1 + 2").getMessage());
		assertEquals("Expected 'fn' or '$c' after 'newfn'", parseError("newfn greet() {}").getMessage());
		assertEquals("Expected '}' to end function body", parseError("newfn fn f() {\nprint(\"a\")\n").getMessage());
		assertEquals("Expected function name after 'callfn'", parseError("callfn 3").getMessage());
		assertEquals("Check your syntax and try again", parseError("callfn f(").getHint());
	}
}
