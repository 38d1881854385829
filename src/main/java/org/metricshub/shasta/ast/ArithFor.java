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
 * bash's C-style loop, {@code for ((init; cond; step)); do body; done}.
 */
public final class ArithFor extends Command {

	private final int line;
	private final List<Word> init;
	private final List<Word> condition;
	private final List<Word> step;
	private final Command body;

	public ArithFor(int line, List<Word> init, List<Word> condition, List<Word> step, Command body) {
		this.line = Nodes.line(line);
		this.init = Nodes.copy(init, "init");
		this.condition = Nodes.copy(condition, "condition");
		this.step = Nodes.copy(step, "step");
		this.body = Objects.requireNonNull(body, "body");
	}

	public int getLine() {
		return line;
	}

	public List<Word> getInit() {
		return init;
	}

	public List<Word> getCondition() {
		return condition;
	}

	public List<Word> getStep() {
		return step;
	}

	public Command getBody() {
		return body;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitArithFor(this);
	}
}
