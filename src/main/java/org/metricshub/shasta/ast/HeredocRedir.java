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
 * A here-document. Its header stays on the statement's line; its body is
 * printed after the end of that logical line.
 */
public final class HeredocRedir extends RedirectionNode {

	public enum Kind {
		/** Quoted delimiter: the body is taken literally. */
		HERE("Here"),
		/** Unquoted delimiter: the body is subject to expansions. */
		XHERE("XHere");

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
	private final Word body;
	private final boolean stripLeadingTabs;
	private final String delimiter;

	/**
	 * @param kind whether the body expands
	 * @param fd the descriptor fed with the body
	 * @param body the document text
	 * @param stripLeadingTabs the {@code <<-} form
	 * @param delimiter the source's delimiter, or {@code null} to let the
	 *        printer generate one
	 */
	public HeredocRedir(Kind kind, FdTarget fd, Word body, boolean stripLeadingTabs, String delimiter) {
		super(fd);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.body = Objects.requireNonNull(body, "body");
		this.stripLeadingTabs = stripLeadingTabs;
		this.delimiter = delimiter == null || delimiter.isEmpty() ? null : delimiter;
	}

	public Kind getKind() {
		return kind;
	}

	public Word getBody() {
		return body;
	}

	public boolean isStripLeadingTabs() {
		return stripLeadingTabs;
	}

	/**
	 * @return the explicit delimiter, or {@code null}
	 */
	public String getDelimiter() {
		return delimiter;
	}

	@Override
	public <R> R accept(RedirectionVisitor<R> visitor) {
		return visitor.visitHeredoc(this);
	}
}
