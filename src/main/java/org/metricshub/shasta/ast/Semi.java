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

import java.util.List;
import java.util.Objects;

/**
 * Sequential composition. An explicit semicolon prints as {@code a ; b};
 * otherwise the operands are printed on separate lines.
 */
public final class Semi extends Command {

	private final Command left;
	private final Command right;
	private final boolean explicitSemicolon;

	public Semi(Command left, Command right, boolean explicitSemicolon) {
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
		this.explicitSemicolon = explicitSemicolon;
	}

	public Semi(Command left, Command right) {
		this(left, right, false);
	}

	/**
	 * Builds a right-leaning chain of implicit {@link Semi} out of a statement
	 * list.
	 *
	 * @param commands the statements, at least one
	 * @return the single statement, or the chain
	 */
	public static Command sequence(List<? extends Command> commands) {
		if (commands.isEmpty()) {
			throw new IllegalArgumentException("Cannot sequence an empty statement list");
		}
		Command acc = commands.get(commands.size() - 1);
		for (int i = commands.size() - 2; i >= 0; i--) {
			acc = new Semi(commands.get(i), acc);
		}
		return acc;
	}

	public Command getLeft() {
		return left;
	}

	public Command getRight() {
		return right;
	}

	public boolean isExplicitSemicolon() {
		return explicitSemicolon;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitSemi(this);
	}
}
