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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import org.junit.Test;

public class SymbolTableTest {

	@Test
	public void testDeclareKeepsFirstDeclarationOrder() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("b", VariableKind.NUMERIC);
		symbols.declare("a", VariableKind.TEXT);
		symbols.declare("b", VariableKind.NUMERIC);

		assertEquals(Arrays.asList("b", "a"), new ArrayList<String>(symbols.getVariables().keySet()));
		assertEquals(VariableKind.TEXT, symbols.getKind("a"));
		assertNull(symbols.getKind("c"));
	}

	@Test
	public void testKindChangeIsRejected() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("v", VariableKind.NUMERIC);
		CodeGenerationException e = assertThrows(
				CodeGenerationException.class,
				() -> symbols.declare("v", VariableKind.TEXT));
		assertEquals("Variable 'v' already declared as numeric, cannot redeclare it as text", e.getMessage());
		assertEquals(VariableKind.NUMERIC, symbols.getKind("v"));
	}

	@Test
	public void testFunctions() {
		SymbolTable symbols = new SymbolTable();
		symbols.defineFunction("f");
		assertTrue(symbols.isFunction("f"));
		assertFalse(symbols.isFunction("g"));
		assertTrue(symbols.getFunctions().contains("f"));

		assertThrows(CodeGenerationException.class, () -> symbols.defineFunction("f"));
		assertThrows(CodeGenerationException.class, () -> symbols.declare("f", VariableKind.TEXT));

		symbols.declare("x", VariableKind.TEXT);
		assertThrows(CodeGenerationException.class, () -> symbols.defineFunction("x"));
	}

	@Test
	public void testReservedNames() {
		assertTrue(SymbolTable.isReserved("main"));
		assertTrue(SymbolTable.isReserved("double"));
		assertTrue(SymbolTable.isReserved("strlen"));
		assertFalse(SymbolTable.isReserved("total"));

		SymbolTable symbols = new SymbolTable();
		assertThrows(CodeGenerationException.class, () -> symbols.declare("sqrt", VariableKind.NUMERIC));
		assertThrows(CodeGenerationException.class, () -> symbols.defineFunction("puts"));
		assertTrue(symbols.getVariables().isEmpty());
		assertTrue(symbols.getFunctions().isEmpty());
	}
}
