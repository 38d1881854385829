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
 * bash's arithmetic command, {@code (( expression ))}.
 */
public final class Arith extends Command {

	private final int line;
	private final List<Word> body;

	public Arith(int line, List<Word> body) {
		this.line = Nodes.line(line);
		this.body = Nodes.copy(body, "body");
	}

	public int getLine() {
		return line;
	}

	/**
	 * @return the expression's words, printed space separated
	 */
	public List<Word> getBody() {
		return body;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitArith(this);
	}
}
