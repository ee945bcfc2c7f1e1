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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Common base of the syntax tree nodes produced by
 * {@link org.metricshub.vort.frontend.VortParser}.
 * <p>
 * Nodes are immutable: the analyzer and the code generator only read them.
 */
public abstract class AstNode {

	/**
	 * Children of this node, in source order. Leaves return an empty list.
	 *
	 * @return the child nodes
	 */
	protected List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node to the output (print)
	 * stream, one node per line, children indented
	 * under their parent.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (AstNode child : getChildren()) {
			child.dump(ps, lvl + 1);
		}
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
