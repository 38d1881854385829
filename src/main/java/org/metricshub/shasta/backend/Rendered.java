package org.metricshub.shasta.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text of a command being printed, together with the here-document bodies
 * whose headers sit on its last line and that must be printed after the end
 * of that line.
 */
final class Rendered {

	static final Rendered EMPTY = new Rendered("", Collections.<String>emptyList(), false);

	private final String text;
	private final List<String> pending;
	private final boolean ampersand;

	private Rendered(String text, List<String> pending, boolean ampersand) {
		this.text = text;
		this.pending = pending;
		this.ampersand = ampersand;
	}

	static Rendered text(String text) {
		return new Rendered(text, Collections.<String>emptyList(), false);
	}

	/**
	 * @param header the here-document header
	 * @param body the body, followed by its delimiter line
	 * @return a header waiting for its body
	 */
	static Rendered heredoc(String header, String body) {
		return new Rendered(header, Collections.singletonList(body), false);
	}

	String getText() {
		return text;
	}

	List<String> getPending() {
		return pending;
	}

	/**
	 * @return whether the text ends with the {@code &} of an asynchronous
	 *         list, after which no {@code ;} may follow
	 */
	boolean endsWithAmpersand() {
		return ampersand;
	}

	boolean isEmpty() {
		return text.isEmpty() && pending.isEmpty();
	}

	Rendered prepend(String prefix) {
		return new Rendered(prefix + text, pending, ampersand);
	}

	Rendered append(String suffix) {
		return new Rendered(text + suffix, pending, suffix.isEmpty() && ampersand);
	}

	Rendered append(Rendered other) {
		return new Rendered(text + other.text, merge(pending, other.pending), other.text.isEmpty() ? ampersand : other.ampersand);
	}

	/**
	 * Joins with a blank, skipping it when either side prints nothing.
	 */
	Rendered space(Rendered other) {
		if (other.text.isEmpty()) {
			return new Rendered(text, merge(pending, other.pending), ampersand);
		}
		if (text.isEmpty()) {
			return new Rendered(other.text, merge(pending, other.pending), other.ampersand);
		}
		return append(" ").append(other);
	}

	Rendered background() {
		return new Rendered(text + " &", pending, true);
	}

	/**
	 * Ends this list before a keyword: {@code list; keyword}, or
	 * {@code list & keyword} after an asynchronous list.
	 */
	Rendered terminate(String keyword) {
		return new Rendered(text + (ampersand ? " " : "; ") + keyword, pending, false);
	}

	/**
	 * @return {@code { text; }}
	 */
	Rendered braced() {
		return new Rendered("{ " + text + (ampersand ? " }" : "; }"), pending, false);
	}

	/**
	 * @return the text, followed by the pending bodies when there are some,
	 *         without a final newline: the caller goes on with a newline
	 */
	String flushed() {
		if (pending.isEmpty()) {
			return text;
		}
		String bodies = String.join("", pending);
		return text + "\n" + bodies.substring(0, bodies.length() - 1);
	}

	/**
	 * @return the text, followed by the pending bodies when there are some
	 */
	String complete() {
		if (pending.isEmpty()) {
			return text;
		}
		return text + "\n" + String.join("", pending);
	}

	/**
	 * Same as {@link #space(Rendered)} over a list, except that the bodies
	 * pending on the joined elements are printed in the reverse order of
	 * their headers.
	 */
	static Rendered spaced(List<Rendered> items) {
		StringBuilder text = new StringBuilder();
		List<String> bodies = new ArrayList<>();
		for (Rendered item : items) {
			if (!item.text.isEmpty()) {
				if (text.length() > 0) {
					text.append(' ');
				}
				text.append(item.text);
			}
			bodies.addAll(item.pending);
		}
		Collections.reverse(bodies);
		return new Rendered(text.toString(), Collections.unmodifiableList(bodies), false);
	}

	/**
	 * Statements on successive lines. The bodies pending on a statement are
	 * printed before the next one; those of the last statement stay pending.
	 */
	static Rendered lines(List<Rendered> statements) {
		if (statements.isEmpty()) {
			return EMPTY;
		}
		StringBuilder text = new StringBuilder();
		int last = statements.size() - 1;
		for (int i = 0; i < last; i++) {
			text.append(statements.get(i).flushed()).append('\n');
		}
		Rendered tail = statements.get(last);
		return new Rendered(text.append(tail.text).toString(), tail.pending, tail.ampersand);
	}

	private static List<String> merge(List<String> first, List<String> second) {
		if (second.isEmpty()) {
			return first;
		}
		if (first.isEmpty()) {
			return second;
		}
		List<String> merged = new ArrayList<>(first.size() + second.size());
		merged.addAll(first);
		merged.addAll(second);
		return Collections.unmodifiableList(merged);
	}
}
