package org.metricshub.shasta.frontend.bash.model;

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

/**
 * Either side of a redirection ({@code REDIRECTEE}): a descriptor number or a
 * word. bash fills in one of them, depending on the instruction.
 */
public final class Redirectee {

	private final Integer dest;
	private final WordDesc filename;

	public Redirectee(Integer dest, WordDesc filename) {
		this.dest = dest;
		this.filename = filename;
	}

	public static Redirectee dest(int dest) {
		return new Redirectee(dest, null);
	}

	public static Redirectee filename(WordDesc filename) {
		return new Redirectee(null, filename);
	}

	/**
	 * @return the descriptor number, or {@code null}
	 */
	public Integer getDest() {
		return dest;
	}

	/**
	 * @return the word, or {@code null}
	 */
	public WordDesc getFilename() {
		return filename;
	}
}
