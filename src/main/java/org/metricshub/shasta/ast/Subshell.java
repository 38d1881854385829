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
 * {@code ( body ) redirections}
 */
public final class Subshell extends Command {

	private final int line;
	private final Command body;
	private final List<RedirectionNode> redirections;

	public Subshell(int line, Command body, List<? extends RedirectionNode> redirections) {
		this.line = Nodes.line(line);
		this.body = Objects.requireNonNull(body, "body");
		this.redirections = Nodes.copy(redirections, "redirections");
	}

	public int getLine() {
		return line;
	}

	public Command getBody() {
		return body;
	}

	public List<RedirectionNode> getRedirections() {
		return redirections;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitSubshell(this);
	}
}
