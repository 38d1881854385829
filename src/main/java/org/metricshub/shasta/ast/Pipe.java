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

/**
 * A pipeline {@code a | b | c}. Nested pipelines are flattened by the front
 * ends, so no item is itself a {@link Pipe}.
 */
public final class Pipe extends Command {

	private final boolean background;
	private final List<Command> items;

	public Pipe(boolean background, List<? extends Command> items) {
		this.background = background;
		this.items = Nodes.copy(items, "items");
		if (this.items.isEmpty()) {
			throw new IllegalArgumentException("A pipeline needs at least one stage");
		}
	}

	public boolean isBackground() {
		return background;
	}

	/**
	 * @return the stages, in execution order
	 */
	public List<Command> getItems() {
		return items;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitPipe(this);
	}
}
