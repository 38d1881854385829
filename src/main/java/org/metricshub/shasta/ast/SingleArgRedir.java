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
 * Redirections with a single operand: closing a descriptor
 * ({@code n>&-}, also POSIX) and bash's redirection of both standard output
 * and error ({@code &> file}, {@code &>> file}).
 * <p>
 * For the two {@code &>} forms the operand is the target file, held as a
 * {@link FdTarget.Named} word.
 */
public final class SingleArgRedir extends RedirectionNode {

	public enum Kind {
		CLOSE_THIS("CloseThis"),
		ERR_AND_OUT("ErrAndOut"),
		APPEND_ERR_AND_OUT("AppendErrAndOut");

		private final String jsonName;

		Kind(String jsonName) {
			this.jsonName = jsonName;
		}

		public String getJsonName() {
			return jsonName;
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

	public SingleArgRedir(Kind kind, FdTarget fd) {
		super(fd);
		this.kind = Objects.requireNonNull(kind, "kind");
		if (kind != Kind.CLOSE_THIS && fd.isFixed()) {
			throw new IllegalArgumentException(kind.getJsonName() + " needs a file operand, not descriptor " + fd);
		}
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public <R> R accept(RedirectionVisitor<R> visitor) {
		return visitor.visitSingleArg(this);
	}
}
