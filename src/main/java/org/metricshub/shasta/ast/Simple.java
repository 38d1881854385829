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

import java.util.Collections;
import java.util.List;

/**
 * A simple command: assignments, then words, then redirections.
 */
public final class Simple extends Command {

	private static final Simple EMPTY = new Simple(NO_LINE, Collections.<AssignNode>emptyList(), Collections.<Word>emptyList(), Collections.<RedirectionNode>emptyList());

	private final int line;
	private final List<AssignNode> assignments;
	private final List<Word> arguments;
	private final List<RedirectionNode> redirections;

	public Simple(int line, List<AssignNode> assignments, List<Word> arguments, List<? extends RedirectionNode> redirections) {
		this.line = Nodes.line(line);
		this.assignments = Nodes.copy(assignments, "assignments");
		this.arguments = Nodes.copy(arguments, "arguments");
		this.redirections = Nodes.copy(redirections, "redirections");
	}

	/**
	 * The command with nothing in it, standing for an absent statement list.
	 *
	 * @return the empty command
	 */
	public static Simple empty() {
		return EMPTY;
	}

	/**
	 * @return whether this command has no line, no assignment, no word and no
	 *         redirection
	 */
	public boolean isEmpty() {
		return line == NO_LINE && assignments.isEmpty() && arguments.isEmpty() && redirections.isEmpty();
	}

	public int getLine() {
		return line;
	}

	public List<AssignNode> getAssignments() {
		return assignments;
	}

	public List<Word> getArguments() {
		return arguments;
	}

	public List<RedirectionNode> getRedirections() {
		return redirections;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitSimple(this);
	}
}
