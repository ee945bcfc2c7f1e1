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
 * {@code print(o"sum={a} and {callfn f()}")}: prints literal text interleaved
 * with interpolated values, followed by a newline.
 */
public final class PrintFormatStatement extends Statement {

	private final List<FormatPart> parts;

	public PrintFormatStatement(List<FormatPart> parts) {
		this.parts = Collections.unmodifiableList(new ArrayList<FormatPart>(parts));
	}

	public List<FormatPart> getParts() {
		return parts;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitPrintFormat(this);
	}

	@Override
	protected List<? extends AstNode> getChildren() {
		return parts;
	}
}
