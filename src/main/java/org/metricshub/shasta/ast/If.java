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
 * {@code if cond; then thenBranch; else elseBranch; fi}
 */
public final class If extends Command {

	private final Command condition;
	private final Command thenBranch;
	private final Command elseBranch;

	public If(Command condition, Command thenBranch, Command elseBranch) {
		this.condition = Objects.requireNonNull(condition, "condition");
		this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
		this.elseBranch = elseBranch;
	}

	public Command getCondition() {
		return condition;
	}

	public Command getThenBranch() {
		return thenBranch;
	}

	/**
	 * @return the else branch, or {@code null}
	 */
	public Command getElseBranch() {
		return elseBranch;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
