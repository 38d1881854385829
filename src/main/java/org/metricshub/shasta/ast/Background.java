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
 * An asynchronous command, {@code node &}.
 * <p>
 * bash chains what follows the {@code &} as a tail of the same list:
 * {@code a & b} is a background {@code a} with tail {@code b}.
 */
public final class Background extends Command {

	private final int line;
	private final Command node;
	private final List<RedirectionNode> redirections;
	private final Command tail;

	public Background(int line, Command node, List<? extends RedirectionNode> redirections, Command tail) {
		this.line = Nodes.line(line);
		this.node = Objects.requireNonNull(node, "node");
		this.redirections = Nodes.copy(redirections, "redirections");
		this.tail = tail;
	}

	public Background(int line, Command node, List<? extends RedirectionNode> redirections) {
		this(line, node, redirections, null);
	}

	public int getLine() {
		return line;
	}

	public Command getNode() {
		return node;
	}

	public List<RedirectionNode> getRedirections() {
		return redirections;
	}

	/**
	 * @return the command run after the {@code &}, or {@code null}
	 */
	public Command getTail() {
		return tail;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitBackground(this);
	}
}
