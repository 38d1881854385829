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
 * Function definition.
 */
public final class Defun extends Command {

	private final int line;
	private final Word name;
	private final Command body;
	private final boolean bashStyle;

	/**
	 * @param line source line
	 * @param name function name
	 * @param body function body
	 * @param bashStyle whether the definition uses the {@code function} keyword
	 */
	public Defun(int line, Word name, Command body, boolean bashStyle) {
		this.line = Nodes.line(line);
		this.name = Objects.requireNonNull(name, "name");
		this.body = Objects.requireNonNull(body, "body");
		this.bashStyle = bashStyle;
	}

	public int getLine() {
		return line;
	}

	public Word getName() {
		return name;
	}

	public Command getBody() {
		return body;
	}

	public boolean isBashStyle() {
		return bashStyle;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitDefun(this);
	}
}
