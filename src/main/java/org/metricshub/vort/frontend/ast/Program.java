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
 * Root of the syntax tree: the top-level statements of a source, in order.
 */
public final class Program extends AstNode {

	private final List<Statement> statements;

	/**
	 * <p>
	 * Constructor for Program.
	 * </p>
	 *
	 * @param statements top-level statements, in source order
	 */
	public Program(List<Statement> statements) {
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	/**
	 * @return the top-level statements, in source order (unmodifiable)
	 */
	public List<Statement> getStatements() {
		return statements;
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		return statements;
	}
}
