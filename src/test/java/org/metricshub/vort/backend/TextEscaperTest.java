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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TextEscaperTest {

	@Test
	public void testEscape() {
		assertEquals("plain", TextEscaper.escape("plain"));
		assertEquals("a\\\\b", TextEscaper.escape("a\\b"));
		assertEquals("say \\\"hi\\\"", TextEscaper.escape("say \"hi\""));
		assertEquals("1\\n2\\t3\\r", TextEscaper.escape("1\n2\t3\r"));
	}

	@Test
	public void testQuote() {
		assertEquals("\"\"", TextEscaper.quote(""));
		assertEquals("\"it's \\\"ok\\\"\"", TextEscaper.quote("it's \"ok\""));
	}
}
