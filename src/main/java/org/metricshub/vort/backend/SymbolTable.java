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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Global names of a program: every variable with its kind, and every
 * function. A name keeps the kind of its first declaration for the whole
 * program, and cannot be both a variable and a function.
 */
public final class SymbolTable {

	/**
	 * Names that cannot be C globals or functions in the generated file: the C
	 * keywords, <code>main</code>, and what the included headers declare.
	 */
	private static final Set<String> RESERVED_NAMES = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											// C keywords
											"auto",
											"break",
											"case",
											"char",
											"const",
											"continue",
											"default",
											"do",
											"double",
											"else",
											"enum",
											"extern",
											"float",
											"for",
											"goto",
											"if",
											"inline",
											"int",
											"long",
											"register",
											"restrict",
											"return",
											"short",
											"signed",
											"sizeof",
											"static",
											"struct",
											"switch",
											"typedef",
											"union",
											"unsigned",
											"void",
											"volatile",
											"while",
											"_Bool",
											"_Complex",
											"_Imaginary",
											// entry point
											"main",
											// <stdio.h>
											"printf",
											"fprintf",
											"sprintf",
											"snprintf",
											"puts",
											"putchar",
											"fputs",
											"fputc",
											"getchar",
											"gets",
											"fgets",
											"scanf",
											"fopen",
											"fclose",
											"fflush",
											"fread",
											"fwrite",
											"perror",
											"remove",
											"rename",
											"stdin",
											"stdout",
											"stderr",
											"FILE",
											"EOF",
											"NULL",
											// <stdlib.h>
											"malloc",
											"calloc",
											"realloc",
											"free",
											"exit",
											"abort",
											"atexit",
											"atoi",
											"atof",
											"atol",
											"strtod",
											"strtol",
											"rand",
											"srand",
											"abs",
											"labs",
											"div",
											"getenv",
											"system",
											"qsort",
											"bsearch",
											"size_t",
											// <string.h>
											"strlen",
											"strcpy",
											"strncpy",
											"strcat",
											"strncat",
											"strcmp",
											"strncmp",
											"strchr",
											"strrchr",
											"strstr",
											"strtok",
											"strdup",
											"memcpy",
											"memmove",
											"memset",
											"memcmp",
											// <math.h>
											"sin",
											"cos",
											"tan",
											"asin",
											"acos",
											"atan",
											"atan2",
											"sinh",
											"cosh",
											"tanh",
											"exp",
											"log",
											"log10",
											"log2",
											"pow",
											"sqrt",
											"cbrt",
											"ceil",
											"floor",
											"round",
											"trunc",
											"fabs",
											"fmod",
											"hypot",
											"nan",
											"isnan",
											"isinf",
											"INFINITY",
											"NAN",
											"HUGE_VAL")));

	private final Map<String, VariableKind> variables = new LinkedHashMap<String, VariableKind>();
	private final Set<String> functions = new LinkedHashSet<String>();

	/**
	 * Declares a variable. Declaring it again with the same kind is allowed.
	 *
	 * @param name variable name
	 * @param kind kind of the declaration
	 * @throws CodeGenerationException if the name already has the other kind,
	 *         or is a function
	 */
	public void declare(String name, VariableKind kind) {
		checkNotReserved(name);
		if (functions.contains(name)) {
			throw new CodeGenerationException("cannot use " + name + " as a variable; it is a function");
		}
		VariableKind previous = variables.putIfAbsent(name, kind);
		if (previous != null && previous != kind) {
			throw new CodeGenerationException(
					"Variable '" + name + "' already declared as " + previous.getDescription()
							+ ", cannot redeclare it as " + kind.getDescription());
		}
	}

	/**
	 * Defines a function.
	 *
	 * @param name function name
	 * @throws CodeGenerationException if the function is already defined, or
	 *         the name is a variable
	 */
	public void defineFunction(String name) {
		checkNotReserved(name);
		if (variables.containsKey(name)) {
			throw new CodeGenerationException("cannot use " + name + " as a function; it is a variable");
		}
		if (!functions.add(name)) {
			throw new CodeGenerationException("function " + name + " already defined");
		}
	}

	/**
	 * @param name variable name
	 * @return the kind of the variable, or {@code null} if it is not declared
	 */
	public VariableKind getKind(String name) {
		return variables.get(name);
	}

	public boolean isFunction(String name) {
		return functions.contains(name);
	}

	/**
	 * @return variables in order of first declaration (unmodifiable)
	 */
	public Map<String, VariableKind> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	/**
	 * @return functions in order of definition (unmodifiable)
	 */
	public Set<String> getFunctions() {
		return Collections.unmodifiableSet(functions);
	}

	/**
	 * @param name a Vortlang name
	 * @return whether the name is taken by C or by the included headers
	 */
	public static boolean isReserved(String name) {
		return RESERVED_NAMES.contains(name);
	}

	private static void checkNotReserved(String name) {
		if (isReserved(name)) {
			throw new CodeGenerationException("'" + name + "' is reserved in the generated C code, choose another name");
		}
	}
}
