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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.vort.frontend.ast.LexerException;
import org.metricshub.vort.frontend.ast.SourcePosition;
import org.metricshub.vort.util.VortLogger;
import org.slf4j.Logger;

/**
 * Converts a Vortlang source into a flat list of positioned {@link Token}s.
 * <p>
 * Scanning is a single left-to-right pass without backtracking. Lines and
 * columns are 1-based; the column is reset after each newline. Newlines are
 * significant (they separate statements) and are emitted as
 * {@link TokenType#NEWLINE} tokens, while other whitespace and
 * {@code //} comments are dropped. The last token is always
 * {@link TokenType#EOF}.
 */
public class VortLexer {

	private static final Logger LOGGER = VortLogger.getLogger(VortLexer.class);

	/**
	 * Keywords, and the readable aliases of the arithmetic operators.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("print", TokenType.KW_PRINT);
		KEYWORDS.put("let", TokenType.KW_LET);
		KEYWORDS.put("num", TokenType.KW_NUM);
		KEYWORDS.put("newfn", TokenType.KW_NEWFN);
		KEYWORDS.put("callfn", TokenType.KW_CALLFN);
		KEYWORDS.put("plus", TokenType.PLUS);
		KEYWORDS.put("minus", TokenType.MINUS);
		KEYWORDS.put("times", TokenType.MULT);
		KEYWORDS.put("multiply", TokenType.MULT);
		KEYWORDS.put("divide", TokenType.DIVIDE);
	}

	private final String sourceDescription;
	private final String source;

	private final List<Token> tokens = new ArrayList<Token>();
	private final StringBuilder text = new StringBuilder();

	private int pos;
	private int c;
	private int line;
	private int column;

	/**
	 * <p>
	 * Constructor for VortLexer.
	 * </p>
	 *
	 * @param sourceDescription path of the source, shown in diagnostics
	 * @param source the source text
	 */
	public VortLexer(String sourceDescription, String source) {
		this.sourceDescription = sourceDescription;
		this.source = source;
	}

	/**
	 * Scans the whole source.
	 *
	 * @return the tokens, ending with {@link TokenType#EOF}
	 * @throws LexerException on the first malformed token
	 */
	public List<Token> tokenize() {
		tokens.clear();
		pos = 0;
		line = 1;
		column = 1;
		c = charAt(0);

		while (c >= 0) {
			lexer();
		}
		tokens.add(new Token(TokenType.EOF, line, column));

		LOGGER.debug("{}: {} tokens", sourceDescription, tokens.size());
		return Collections.unmodifiableList(new ArrayList<Token>(tokens));
	}

	private int charAt(int index) {
		return index < source.length() ? source.charAt(index) : -1;
	}

	private int peek(int offset) {
		return charAt(pos + offset);
	}

	private void read() {
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		pos++;
		c = charAt(pos);
	}

	private void emit(TokenType type) {
		tokens.add(new Token(type, line, column));
	}

	private LexerException lexerException(String msg, String hint, int errorLine, int errorColumn) {
		return new LexerException(msg, hint, sourceDescription, source, new SourcePosition(errorLine, errorColumn));
	}

	private void lexer() {
		switch (c) {
		case ' ':
		case '\t':
		case '\r':
			read();
			return;
		case '\n':
			emit(TokenType.NEWLINE);
			read();
			return;
		case '/': {
			int startColumn = column;
			read();
			if (c == '/') {
				// kill comment
				while (c >= 0 && c != '\n') {
					read();
				}
			} else {
				tokens.add(new Token(TokenType.DIVIDE, line, startColumn));
			}
			return;
		}
		case '(':
			emit(TokenType.OPEN_PAREN);
			read();
			return;
		case ')':
			emit(TokenType.CLOSE_PAREN);
			read();
			return;
		case '{':
			if (peek(1) == '{' && peek(2) == '{') {
				readRawCode();
			} else {
				emit(TokenType.OPEN_BRACE);
				read();
			}
			return;
		case '}':
			emit(TokenType.CLOSE_BRACE);
			read();
			return;
		case '=':
			emit(TokenType.EQUALS);
			read();
			return;
		case '+':
			emit(TokenType.PLUS);
			read();
			return;
		case '-':
			emit(TokenType.MINUS);
			read();
			return;
		case '*':
			emit(TokenType.MULT);
			read();
			return;
		case '"':
			readString();
			return;
		case '$':
			if (peek(1) == 'c' && !isIdentifierPart(peek(2))) {
				emit(TokenType.DOLLAR_C);
				read();
				read();
				return;
			}
			break;
		default:
			if (c >= '0' && c <= '9') {
				readNumber();
				return;
			}
			if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') {
				readIdentifier();
				return;
			}
			break;
		}

		throw lexerException(
				"Unexpected character '" + (char) c + "'",
				"Remove or replace this character",
				line,
				column);
	}

	private static boolean isIdentifierPart(int ch) {
		return ch >= 0 && (Character.isLetterOrDigit(ch) || ch == '_');
	}

	/**
	 * Reads the string and handle all escape codes.
	 */
	private void readString() {
		int startLine = line;
		int startColumn = column;
		text.setLength(0);
		read();

		while (true) {
			if (c < 0 || c == '\n') {
				throw lexerException(
						"Unterminated string literal",
						"Add a closing quote to complete the string",
						startLine,
						startColumn);
			}
			if (c == '"') {
				read();
				break;
			}
			if (c == '\\') {
				read();
				switch (c) {
				case 'n':
					text.append('\n');
					break;
				case 't':
					text.append('\t');
					break;
				case 'r':
					text.append('\r');
					break;
				case '\\':
					text.append('\\');
					break;
				case '"':
					text.append('"');
					break;
				case -1:
				case '\n':
					throw lexerException(
							"Unterminated string literal",
							"Add a closing quote to complete the string",
							startLine,
							startColumn);
				default:
					throw lexerException(
							"Invalid escape sequence '\\" + (char) c + "'",
							"Valid escape sequences are: \\n, \\t, \\r, \\\", \\\\",
							line,
							column);
				}
			} else {
				text.append((char) c);
			}
			read();
		}

		tokens.add(new Token(TokenType.STRING, text.toString(), 0, startLine, startColumn));
	}

	private void readNumber() {
		int startColumn = column;
		text.setLength(0);
		boolean hasDecimal = false;
		while ((c >= '0' && c <= '9') || (c == '.' && !hasDecimal)) {
			if (c == '.') {
				hasDecimal = true;
			}
			text.append((char) c);
			read();
		}

		String numberText = text.toString();
		double value;
		try {
			value = Double.parseDouble(numberText);
		} catch (NumberFormatException nfe) {
			value = Double.NaN;
		}
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw lexerException(
					"Invalid number format: " + numberText,
					"Ensure the number is correctly formatted",
					line,
					startColumn);
		}
		tokens.add(new Token(TokenType.NUMBER, numberText, value, line, startColumn));
	}

	private void readIdentifier() {
		int startColumn = column;
		text.setLength(0);
		while (isIdentifierPart(c)) {
			text.append((char) c);
			read();
		}

		String id = text.toString();
		TokenType keyword = KEYWORDS.get(id);
		if (keyword == null) {
			tokens.add(new Token(TokenType.IDENTIFIER, id, 0, line, startColumn));
			return;
		}
		tokens.add(new Token(keyword, id, 0, line, startColumn));

		if (keyword == TokenType.KW_PRINT && c == '(') {
			// print(o"...") is an interpolated print: flag it here so that
			// the parser never has to look at characters
			emit(TokenType.OPEN_PAREN);
			read();
			if (c == 'o' && peek(1) == '"') {
				emit(TokenType.FORMAT_PREFIX);
				read();
			}
		}
	}

	/**
	 * Reads a <code>{{{ ... }}}</code> block verbatim. Newlines inside the
	 * block are part of the code, not statement separators.
	 */
	private void readRawCode() {
		int startLine = line;
		int startColumn = column;
		text.setLength(0);
		read();
		read();
		read();

		while (!(c == '}' && peek(1) == '}' && peek(2) == '}')) {
			if (c < 0) {
				throw lexerException(
						"Unterminated C code block",
						"Close the C code block with '}}}'",
						startLine,
						startColumn);
			}
			text.append((char) c);
			read();
		}
		read();
		read();
		read();

		tokens.add(new Token(TokenType.RAW_CODE, text.toString(), 0, startLine, startColumn));
	}
}
