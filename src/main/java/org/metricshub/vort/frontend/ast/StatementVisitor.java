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

/**
 * Visitor over the {@link Statement} variants.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

	R visitPrint(PrintStatement statement);

	R visitPrintFormat(PrintFormatStatement statement);

	R visitTextDeclaration(TextDeclaration statement);

	R visitNumericDeclaration(NumericDeclaration statement);

	R visitTextAssignment(TextAssignment statement);

	R visitNumericAssignment(NumericAssignment statement);

	R visitFunctionDefinition(FunctionDefinition statement);

	R visitRawFunctionDefinition(RawFunctionDefinition statement);

	R visitFunctionCall(FunctionCallStatement statement);
}
