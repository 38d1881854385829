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
 * Descriptor duplication ({@code n>&m}, {@code n<&m}), optionally moving the
 * descriptor ({@code n>&m-}).
 */
public final class DupRedir extends RedirectionNode {

	public enum Kind {
		FROM_FD("FromFD", "<&", 0),
		TO_FD("ToFD", ">&", 1);

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
	private final FdTarget target;
	private final boolean move;

	/**
	 * @param kind direction of the duplication
	 * @param fd the descriptor being redirected
	 * @param target the descriptor duplicated; a {@link FdTarget.Named}
	 *        target is a word expanding to a descriptor ({@code >&$fd})
	 * @param move whether the target is closed after the duplication
	 */
	public DupRedir(Kind kind, FdTarget fd, FdTarget target, boolean move) {
		super(fd);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.target = Objects.requireNonNull(target, "target");
		this.move = move;
	}

	public DupRedir(Kind kind, FdTarget fd, FdTarget target) {
		this(kind, fd, target, false);
	}

	public Kind getKind() {
		return kind;
	}

	public FdTarget getTarget() {
		return target;
	}

	public boolean isMove() {
		return move;
	}

	@Override
	public <R> R accept(RedirectionVisitor<R> visitor) {
		return visitor.visitDup(this);
	}
}
