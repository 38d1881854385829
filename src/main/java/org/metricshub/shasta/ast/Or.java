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

import java.util.Objects;

/**
 * {@code left || right}
 */
public final class Or extends Command {

	private final Command left;
	private final Command right;
	private final boolean noBraces;

	/**
	 * @param left left operand
	 * @param right right operand
	 * @param noBraces whether the front end already resolved the grouping of
	 *        the operands, so that they print without braces
	 */
	public Or(Command left, Command right, boolean noBraces) {
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
		this.noBraces = noBraces;
	}

	public Or(Command left, Command right) {
		this(left, right, false);
	}

	public Command getLeft() {
		return left;
	}

	public Command getRight() {
		return right;
	}

	public boolean isNoBraces() {
		return noBraces;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitOr(this);
	}
}
