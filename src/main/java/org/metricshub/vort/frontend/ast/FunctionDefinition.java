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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code newfn fn name() { ... }}: a parameterless function.
 * <p>
 * The body does not open a scope: variables declared in it are globals.
 */
public final class FunctionDefinition extends Statement {

	private final String name;
	private final List<Statement> body;

	public FunctionDefinition(String name, List<Statement> body) {
		this.name = name;
		this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
	}

	public String getName() {
		return name;
	}

	public List<Statement> getBody() {
		return body;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitFunctionDefinition(this);
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		return body;
	}

	@Override
	public String toString() {
		return "FunctionDefinition " + name;
	}
}
