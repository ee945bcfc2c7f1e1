package org.metricshub.vort.util;

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

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;

public class ScriptSourceTest {

	@Test
	public void testInlineSource() throws Exception {
		ScriptSource source = ScriptSource.fromString(ScriptSource.DESCRIPTION_INLINE_SCRIPT, "print(\"x\")");
		assertEquals("print(\"x\")", source.getContent());
		// cached after the reader is consumed
		assertEquals("print(\"x\")", source.getContent());
		assertEquals("<inline-script>", source.toString());
	}

	@Test
	public void testFileSource() throws Exception {
		Path dir = Files.createTempDirectory("vort-source");
		Path file = dir.resolve("hello.vl");
		Files.write(file, "print(\"héllo\")\n".getBytes(StandardCharsets.UTF_8));

		ScriptFileSource source = new ScriptFileSource(file.toString());
		assertEquals(file.toString(), source.getDescription());
		assertEquals("hello", source.getStem());
		assertEquals("print(\"héllo\")\n", source.getContent());
	}

	@Test
	public void testStem() {
		assertEquals("prog", new ScriptFileSource("dir/prog.vl").getStem());
		assertEquals("archive.tar", new ScriptFileSource("archive.tar.vl").getStem());
		assertEquals("noext", new ScriptFileSource("noext").getStem());
		assertEquals(".hidden", new ScriptFileSource(".hidden").getStem());
	}

	@Test
	public void testMissingFile() {
		assertThrows(UncheckedIOException.class, () -> new ScriptFileSource("does/not/exist.vl").getContent());
	}
}
