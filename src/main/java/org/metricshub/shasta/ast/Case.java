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
 * {@code case subject in patterns) body ;; ... esac}
 */
public final class Case extends Command {

	/**
	 * One {@code pattern|pattern) body ;;} clause. Clauses are nodes only in
	 * the sense that they belong to exactly one {@link Case}.
	 */
	public static final class Clause {

		private final List<Word> patterns;
		private final Command body;
		private final boolean fallthrough;

		/**
		 * @param patterns the alternatives, at least one
		 * @param body the clause body, or {@code null} when empty
		 * @param fallthrough whether the clause ends with {@code ;&}
		 */
		public Clause(List<Word> patterns, Command body, boolean fallthrough) {
			this.patterns = Nodes.copy(patterns, "patterns");
			if (this.patterns.isEmpty()) {
				throw new IllegalArgumentException("A case clause needs at least one pattern");
			}
			this.body = body;
			this.fallthrough = fallthrough;
		}

		public List<Word> getPatterns() {
			return patterns;
		}

		public Command getBody() {
			return body;
		}

		public boolean isFallthrough() {
			return fallthrough;
		}
	}

	private final int line;
	private final Word subject;
	private final List<Clause> clauses;

	public Case(int line, Word subject, List<Clause> clauses) {
		this.line = Nodes.line(line);
		this.subject = Objects.requireNonNull(subject, "subject");
		this.clauses = Nodes.copy(clauses, "clauses");
	}

	public int getLine() {
		return line;
	}

	public Word getSubject() {
		return subject;
	}

	public List<Clause> getClauses() {
		return clauses;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitCase(this);
	}
}
