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
 * {@code for variable in items; do body; done}
 */
public final class For extends Command {

	private final int line;
	private final Word variable;
	private final List<Word> items;
	private final Command body;

	public For(int line, Word variable, List<Word> items, Command body) {
		this.line = Nodes.line(line);
		this.variable = Objects.requireNonNull(variable, "variable");
		this.items = Nodes.copy(items, "items");
		this.body = Objects.requireNonNull(body, "body");
	}

	public int getLine() {
		return line;
	}

	public Word getVariable() {
		return variable;
	}

	public List<Word> getItems() {
		return items;
	}

	public Command getBody() {
		return body;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
