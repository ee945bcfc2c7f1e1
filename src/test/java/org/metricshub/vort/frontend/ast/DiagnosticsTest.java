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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class DiagnosticsTest {

	@Test
	public void testPositionedDiagnostic() {
		String source = "let a = \"x\"\nnum b = ?\n";
		assertEquals(
				"Error in demo.vl:2:9\n"
						+ "  Unexpected character '?'\n"
						+ "\n"
						+ "   2 | num b = ?\n"
						+ "     |         ^\n"
						+ "\n"
						+ "Hint: Remove or replace this character\n",
				Diagnostics
						.format(
								"demo.vl",
								source,
								new SourcePosition(2, 9),
								"Unexpected character '?'",
								"Remove or replace this character"));
	}

	@Test
	public void testLineNumberIsPadded() {
		StringBuilder source = new StringBuilder();
		for (int i = 0; i < 1234; i++) {
			source.append("print(\"x\")\n");
		}
		String diagnostic = Diagnostics.format("big.vl", source.toString(), new SourcePosition(1234, 1), "m", "h");
		assertEquals(
				"Error in big.vl:1234:1\n  m\n\n1234 | print(\"x\")\n     | ^\n\nHint: h\n",
				diagnostic);
	}

	@Test
	public void testPositionAfterTheLastLine() {
		// end of input after a trailing newline has no source line to quote
		assertEquals(
				"Error in a.vl:2:1\n  Unexpected end\n\nHint: h\n",
				Diagnostics.format("a.vl", "print(\n", new SourcePosition(2, 1), "Unexpected end", "h"));
	}

	@Test
	public void testDiagnosticWithoutPosition() {
		assertEquals("Error: Function 'f' is not defined\n", Diagnostics.format("Function 'f' is not defined"));

		CompileException e = new CompileException("boom");
		assertNull(e.getPosition());
		assertEquals(-1, e.getLineNumber());
		assertEquals(-1, e.getColumnNumber());
		assertEquals("Error: boom\n", e.getDiagnostic());
	}

	@Test
	public void testParserExceptionCarriesItsPosition() {
		ParserException e = new ParserException("Expected statement", "hint", "p.vl", "  42\n", new SourcePosition(1, 3));
		assertEquals(1, e.getLineNumber());
		assertEquals(3, e.getColumnNumber());
		assertEquals("p.vl", e.getSourceDescription());
		assertEquals("hint", e.getHint());
		assertEquals("Error in p.vl:1:3\n  Expected statement\n\n   1 |   42\n     |   ^\n\nHint: hint\n", e.getDiagnostic());
	}
}
