package org.metricshub.shasta.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Shasta
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
 * A character emitted as it is, already known to be syntactically safe where
 * it stands.
 * <p>
 * A <em>verbatim</em> literal is raw source text that carries its own
 * escapes: the printer never alters it. Other literals are decoded
 * characters, subject to the printer's guards against accidental expansion.
 */
public final class Literal extends ArgChar {

	private final int codePoint;
	private final boolean verbatim;

	public Literal(int codePoint, boolean verbatim) {
		this.codePoint = codePoint;
		this.verbatim = verbatim;
	}

	public Literal(int codePoint) {
		this(codePoint, false);
	}

	public int getCodePoint() {
		return codePoint;
	}

	public boolean isVerbatim() {
		return verbatim;
	}

	@Override
	public <R> R accept(ArgCharVisitor<R> visitor) {
		return visitor.visitLiteral(this);
	}
}
