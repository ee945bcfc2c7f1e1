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
import java.util.List;
import org.metricshub.vort.frontend.ast.BinaryOperation;
import org.metricshub.vort.frontend.ast.CompileException;
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
import org.metricshub.vort.frontend.ast.NumericVariable;
import org.metricshub.vort.frontend.ast.ParserException;
import org.metricshub.vort.frontend.ast.PrintFormatStatement;
import org.metricshub.vort.frontend.ast.PrintStatement;
import org.metricshub.vort.frontend.ast.Program;
import org.metricshub.vort.frontend.ast.RawFunctionDefinition;
import org.metricshub.vort.frontend.ast.SourcePosition;
import org.metricshub.vort.frontend.ast.Statement;
import org.metricshub.vort.frontend.ast.TextAssignment;
import org.metricshub.vort.frontend.ast.TextDeclaration;
import org.metricshub.vort.frontend.ast.TextLiteral;
import org.metricshub.vort.frontend.ast.VariableReference;
import org.metricshub.vort.util.VortLogger;
import org.slf4j.Logger;

/**
 * Converts the tokens of a Vortlang source into a {@link Program}.
 * <p>
 * Recursive descent, one method per production. Arithmetic uses two
 * precedence levels (additive below multiplicative), both left-associative.
 * The parser stops at the first syntax error; there is no recovery.
 */
public class VortParser {

	private static final Logger LOGGER = VortLogger.getLogger(VortParser.class);

	private static final String HINT_SYNTAX = "Check your syntax and try again";

	private final List<Token> tokens;
	private final String sourceDescription;
	private final String source;

	private int current;

	// set while parsing a function body, functions cannot be nested
	private boolean inFunction;

	/**
	 * <p>
	 * Constructor for VortParser.
	 * </p>
	 *
	 * @param tokens tokens produced by {@link VortLexer}, ending with {@link TokenType#EOF}
	 * @param sourceDescription path of the source, shown in diagnostics
	 * @param source the source text, quoted in diagnostics
	 */
	public VortParser(List<Token> tokens, String sourceDescription, String source) {
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
			throw new IllegalArgumentException("Token list must end with EOF");
		}
		this.tokens = tokens;
		this.sourceDescription = sourceDescription;
		this.source = source;
	}

	/**
	 * Parse the tokens. Build and return the root of the abstract syntax
	 * tree which represents the Vortlang program.
	 *
	 * @return The abstract syntax tree of this program.
	 * @throws ParserException on the first syntax error
	 */
	public Program parse() {
		current = 0;
		inFunction = false;
		Program program = PROGRAM();
		LOGGER.debug("{}: {} top-level statements", sourceDescription, program.getStatements().size());
		return program;
	}

	// SUPPORTING FUNCTIONS/METHODS

	private Token peek() {
		return tokens.get(current);
	}

	private Token peekNext() {
		return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
	}

	private Token advance() {
		Token token = peek();
		if (token.getType() != TokenType.EOF) {
			current++;
		}
		return token;
	}

	private boolean check(TokenType type) {
		return peek().getType() == type;
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private Token consume(TokenType type, String message) {
		if (check(type)) {
			return advance();
		}
		throw parserException(message, HINT_SYNTAX, peek());
	}

	private void skipNewlines() {
		while (check(TokenType.NEWLINE)) {
			advance();
		}
	}

	private ParserException parserException(String msg, String hint, Token token) {
		return parserException(msg, hint, token.getPosition());
	}

	private ParserException parserException(String msg, String hint, SourcePosition position) {
		return new ParserException(msg, hint, sourceDescription, source, position);
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : \n* ( STATEMENT \n* )* EOF
	Program PROGRAM() {
		List<Statement> statements = new ArrayList<Statement>();
		skipNewlines();
		while (!check(TokenType.EOF)) {
			statements.add(STATEMENT());
			skipNewlines();
		}
		return new Program(statements);
	}

	// STATEMENT : ASSIGNMENT | PRINT | LET | NUM | FUNCTION | CALLFN
	Statement STATEMENT() {
		if (check(TokenType.IDENTIFIER) && peekNext().getType() == TokenType.EQUALS) {
			return ASSIGNMENT_STATEMENT();
		}
		Token token = peek();
		switch (token.getType()) {
		case KW_PRINT:
			advance();
			return PRINT_STATEMENT();
		case KW_LET:
			advance();
			return LET_STATEMENT();
		case KW_NUM:
			advance();
			return NUM_STATEMENT();
		case KW_NEWFN:
			return FUNCTION();
		case KW_CALLFN:
			advance();
			return CALLFN_STATEMENT();
		default:
			throw parserException(
					"Expected statement",
					"Valid statements are 'print', 'let', 'num', 'newfn', or 'callfn'",
					token);
		}
	}

	// ASSIGNMENT : ID = ( NUMERIC_EXPRESSION | TEXT_EXPRESSION )
	// A bare identifier on the right-hand side parses as numeric; the code
	// generator retypes it from the declared kind of the target.
	Statement ASSIGNMENT_STATEMENT() {
		Token nameToken = advance();
		String name = nameToken.getText();
		int lineNumber = nameToken.getLine();
		consume(TokenType.EQUALS, "Expected '=' after variable name");

		int mark = current;
		try {
			return new NumericAssignment(name, NUMERIC_EXPRESSION(), lineNumber);
		} catch (ParserException numericFailure) {
			current = mark;
		}
		try {
			return new TextAssignment(name, TEXT_EXPRESSION(), lineNumber);
		} catch (ParserException textFailure) {
			throw parserException(
					"Invalid assignment to variable '" + name + "'",
					"Variables can only be assigned string or numeric values",
					new SourcePosition(lineNumber, peek().getColumn()));
		}
	}

	// PRINT : print ( [o] STRING )
	Statement PRINT_STATEMENT() {
		consume(TokenType.OPEN_PAREN, "Expected '(' after 'print'");
		boolean formatString = match(TokenType.FORMAT_PREFIX);

		if (!formatString && check(TokenType.IDENTIFIER)) {
			String name = advance().getText();
			consume(TokenType.CLOSE_PAREN, "Expected ')' after expression");
			return new PrintStatement(new VariableReference(name));
		}

		Token literal = consume(TokenType.STRING, "Expected string literal");
		consume(TokenType.CLOSE_PAREN, "Expected ')' after expression");

		if (formatString) {
			return new PrintFormatStatement(FORMAT_STRING(literal));
		}
		return new PrintStatement(new TextLiteral(literal.getText()));
	}

	// FORMAT_STRING : ( TEXT | { FORMAT_EXPRESSION } )*
	// Parsed from the content of the literal, escapes already resolved.
	List<FormatPart> FORMAT_STRING(Token literal) {
		String s = literal.getText();
		List<FormatPart> parts = new ArrayList<FormatPart>();
		StringBuilder currentLiteral = new StringBuilder();
		int i = 0;
		while (i < s.length()) {
			char ch = s.charAt(i);
			if (ch != '{') {
				currentLiteral.append(ch);
				i++;
				continue;
			}
			if (currentLiteral.length() > 0) {
				parts.add(FormatPart.literal(currentLiteral.toString()));
				currentLiteral.setLength(0);
			}
			int close = s.indexOf('}', i + 1);
			if (close < 0) {
				throw parserException(
						"Unclosed '{' in format string",
						"Ensure all braces are properly closed",
						literal);
			}
			parts.add(FORMAT_EXPRESSION(s.substring(i + 1, close), literal));
			i = close + 1;
		}
		if (currentLiteral.length() > 0) {
			parts.add(FormatPart.literal(currentLiteral.toString()));
		}
		return parts;
	}

	// FORMAT_EXPRESSION : callfn ID () | ID | NUMERIC_EXPRESSION
	FormatPart FORMAT_EXPRESSION(String content, Token literal) {
		String trimmed = content.trim();
		if (trimmed.startsWith("callfn ")) {
			String call = trimmed.substring("callfn ".length()).trim();
			if (!call.endsWith("()")) {
				throw parserException(
						"Expected '()' after function name",
						"Function calls in format strings must end with '()'",
						literal);
			}
			String name = call.substring(0, call.length() - 2);
			if (!isIdentifier(name)) {
				throw parserException(
						"Invalid function name '" + name + "'",
						"Function names must be alphanumeric with underscores",
						literal);
			}
			return FormatPart.expression(new FunctionCallExpression(name));
		}
		if (isIdentifier(trimmed)) {
			// the kind of the variable picks the printf conversion later
			return FormatPart.expression(new VariableReference(trimmed));
		}
		NumericExpression arithmetic = parseEmbeddedArithmetic(trimmed);
		if (arithmetic == null) {
			throw parserException(
					"Invalid expression in format string: '" + trimmed + "'",
					"Use a variable name, an arithmetic expression or 'callfn functionname()'",
					literal);
		}
		return FormatPart.numeric(arithmetic);
	}

	/**
	 * Parses the content of a <code>{...}</code> span as a whole numeric
	 * expression.
	 *
	 * @return the expression, or {@code null} if the content is not one
	 */
	private NumericExpression parseEmbeddedArithmetic(String content) {
		if (content.isEmpty()) {
			return null;
		}
		try {
			List<Token> embedded = new VortLexer(sourceDescription, content).tokenize();
			VortParser parser = new VortParser(embedded, sourceDescription, content);
			NumericExpression expression = parser.NUMERIC_EXPRESSION();
			return parser.check(TokenType.EOF) ? expression : null;
		} catch (CompileException e) {
			LOGGER.debug("'{}' is not an arithmetic expression: {}", content, e.getMessage());
			return null;
		}
	}

	private static boolean isIdentifier(String s) {
		if (s.isEmpty()) {
			return false;
		}
		char first = s.charAt(0);
		if (!((first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z') || first == '_')) {
			return false;
		}
		for (int i = 1; i < s.length(); i++) {
			char ch = s.charAt(i);
			if (!Character.isLetterOrDigit(ch) && ch != '_') {
				return false;
			}
		}
		return true;
	}

	// LET : let ID = TEXT_EXPRESSION
	Statement LET_STATEMENT() {
		Token nameToken = consume(TokenType.IDENTIFIER, "Expected variable name");
		consume(TokenType.EQUALS, "Expected '=' after variable name");
		return new TextDeclaration(nameToken.getText(), TEXT_EXPRESSION(), nameToken.getLine());
	}

	// NUM : num ID = NUMERIC_EXPRESSION
	Statement NUM_STATEMENT() {
		Token nameToken = consume(TokenType.IDENTIFIER, "Expected variable name after 'num'");
		consume(TokenType.EQUALS, "Expected '=' after variable name");
		return new NumericDeclaration(nameToken.getText(), NUMERIC_EXPRESSION(), nameToken.getLine());
	}

	// FUNCTION : newfn fn ID ( ) { STATEMENT* } | newfn $c ID ( ) \n* RAW_CODE
	Statement FUNCTION() {
		Token newfn = advance();
		if (inFunction) {
			throw parserException(
					"Nested function definitions are not allowed",
					"Functions cannot be defined inside other functions",
					newfn);
		}

		if (match(TokenType.DOLLAR_C)) {
			String name = consume(TokenType.IDENTIFIER, "Expected function name after '$c'").getText();
			consume(TokenType.OPEN_PAREN, "Expected '(' after function name");
			consume(TokenType.CLOSE_PAREN, "Expected ')' after '('");
			skipNewlines();
			Token rawCode = consume(TokenType.RAW_CODE, "Expected C code block '{{{ ... }}}'");
			return new RawFunctionDefinition(name, rawCode.getText());
		}

		Token fn = peek();
		if (!fn.is(TokenType.IDENTIFIER) || !"fn".equals(fn.getText())) {
			throw parserException("Expected 'fn' or '$c' after 'newfn'", HINT_SYNTAX, fn);
		}
		advance();
		String name = consume(TokenType.IDENTIFIER, "Expected function name").getText();
		consume(TokenType.OPEN_PAREN, "Expected '(' after function name");
		consume(TokenType.CLOSE_PAREN, "Expected ')' after '('");
		consume(TokenType.OPEN_BRACE, "Expected '{' to start function body");

		inFunction = true;
		List<Statement> body = new ArrayList<Statement>();
		skipNewlines();
		while (!check(TokenType.CLOSE_BRACE) && !check(TokenType.EOF)) {
			body.add(STATEMENT());
			skipNewlines();
		}
		consume(TokenType.CLOSE_BRACE, "Expected '}' to end function body");
		inFunction = false;

		return new FunctionDefinition(name, body);
	}

	// CALLFN : callfn ID ( )
	Statement CALLFN_STATEMENT() {
		String name = consume(TokenType.IDENTIFIER, "Expected function name after 'callfn'").getText();
		consume(TokenType.OPEN_PAREN, "Expected '(' after function name");
		consume(TokenType.CLOSE_PAREN, "Expected ')' after '('");
		return new FunctionCallStatement(name);
	}

	// TEXT_EXPRESSION : STRING | ID
	Expression TEXT_EXPRESSION() {
		Token token = peek();
		if (token.is(TokenType.STRING)) {
			advance();
			return new TextLiteral(token.getText());
		}
		if (token.is(TokenType.IDENTIFIER)) {
			advance();
			return new VariableReference(token.getText());
		}
		throw parserException(
				"Expected expression",
				"Valid expressions are string literals and variable identifiers",
				token);
	}

	// NUMERIC_EXPRESSION : ADDITION
	NumericExpression NUMERIC_EXPRESSION() {
		return ADDITION();
	}

	// ADDITION : MULTIPLICATION [ (+|-) MULTIPLICATION ]*
	NumericExpression ADDITION() {
		NumericExpression expr = MULTIPLICATION();
		while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
			BinaryOperation.Operator op = advance().is(TokenType.PLUS)
					? BinaryOperation.Operator.ADD
					: BinaryOperation.Operator.SUBTRACT;
			NumericExpression right = MULTIPLICATION();

			// Build the tree in left-associative manner
			expr = new BinaryOperation(expr, op, right);
		}
		return expr;
	}

	// MULTIPLICATION : PRIMARY [ (*|/) PRIMARY ]*
	NumericExpression MULTIPLICATION() {
		NumericExpression expr = PRIMARY();
		while (check(TokenType.MULT) || check(TokenType.DIVIDE)) {
			BinaryOperation.Operator op = advance().is(TokenType.MULT)
					? BinaryOperation.Operator.MULTIPLY
					: BinaryOperation.Operator.DIVIDE;
			NumericExpression right = PRIMARY();

			// Build the tree in left-associative manner
			expr = new BinaryOperation(expr, op, right);
		}
		return expr;
	}

	// PRIMARY : NUMBER | ID | ( NUMERIC_EXPRESSION )
	NumericExpression PRIMARY() {
		Token token = peek();
		if (token.is(TokenType.NUMBER)) {
			advance();
			return new NumberLiteral(token.getNumber());
		}
		if (token.is(TokenType.IDENTIFIER)) {
			advance();
			return new NumericVariable(token.getText());
		}
		if (token.is(TokenType.OPEN_PAREN)) {
			advance();
			NumericExpression inner = NUMERIC_EXPRESSION();
			consume(TokenType.CLOSE_PAREN, "Expected ')' after expression");
			return new Grouping(inner);
		}
		throw parserException(
				"Expected numerical expression",
				"Valid expressions are numbers, variables, or parenthesized expressions",
				token);
	}

	// CHECKSTYLE.ON MethodName
}
