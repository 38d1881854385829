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
 * A file descriptor: either a literal number or, with bash's {@code {var}}
 * redirections, a word naming the variable that holds it.
 */
public abstract class FdTarget {

	FdTarget() {}

	/**
	 * @param fd descriptor number
	 * @return a fixed descriptor
	 */
	public static Fixed fixed(int fd) {
		return new Fixed(fd);
	}

	/**
	 * @param word the word naming the descriptor
	 * @return a named descriptor
	 */
	public static Named named(Word word) {
		return new Named(word);
	}

	/**
	 * @return whether this is a {@link Fixed} descriptor
	 */
	public abstract boolean isFixed();

	/**
	 * A literal descriptor number.
	 */
	public static final class Fixed extends FdTarget {

		private final int fd;

		private Fixed(int fd) {
			if (fd < 0) {
				throw new IllegalArgumentException("Negative file descriptor: " + fd);
			}
			this.fd = fd;
		}

		public int getFd() {
			return fd;
		}

		@Override
		public boolean isFixed() {
			return true;
		}

		@Override
		public String toString() {
			return Integer.toString(fd);
		}
	}

	/**
	 * A descriptor held by a variable, or a word operand standing where a
	 * descriptor is expected.
	 */
	public static final class Named extends FdTarget {

		private final Word word;

		private Named(Word word) {
			this.word = Objects.requireNonNull(word, "word");
		}

		public Word getWord() {
			return word;
		}

		@Override
		public boolean isFixed() {
			return false;
		}

		@Override
		public String toString() {
			return "{" + word.getChars() + "}";
		}
	}
}
