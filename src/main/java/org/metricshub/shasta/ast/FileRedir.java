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
 * Redirection to or from a file, or from a string ({@code <<<}).
 */
public final class FileRedir extends RedirectionNode {

	/**
	 * Redirection operators with a file operand.
	 */
	public enum Kind {
		TO("To", ">", 1),
		CLOBBER("Clobber", ">|", 1),
		FROM("From", "<", 0),
		FROM_TO("FromTo", "<>", 0),
		APPEND("Append", ">>", 1),
		READING_STRING("ReadingString", "<<<", 0);

		private final String jsonName;
		private final String operator;
		private final int defaultFd;

		Kind(String jsonName, String operator, int defaultFd) {
			this.jsonName = jsonName;
			this.operator = operator;
			this.defaultFd = defaultFd;
		}

		public String getJsonName() {
			return jsonName;
		}

		public String getOperator() {
			return operator;
		}

		/**
		 * @return the descriptor the operator applies to when none is written
		 */
		public int getDefaultFd() {
			return defaultFd;
		}

		public static Kind fromJsonName(String name) {
			for (Kind kind : values()) {
				if (kind.jsonName.equals(name)) {
					return kind;
				}
			}
			return null;
		}
	}

	private final Kind kind;
	private final Word target;

	public FileRedir(Kind kind, FdTarget fd, Word target) {
		super(fd);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.target = Objects.requireNonNull(target, "target");
	}

	public Kind getKind() {
		return kind;
	}

	public Word getTarget() {
		return target;
	}

	@Override
	public <R> R accept(RedirectionVisitor<R> visitor) {
		return visitor.visitFile(this);
	}
}
