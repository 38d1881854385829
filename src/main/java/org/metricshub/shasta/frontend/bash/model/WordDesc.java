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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A word as bash's parser read it: the raw bytes of the source, quotes and
 * expansions included.
 */
public final class WordDesc {

	private final byte[] word;
	private final Set<WordDescFlag> flags;

	public WordDesc(byte[] word, Set<WordDescFlag> flags) {
		this.word = Objects.requireNonNull(word, "word").clone();
		this.flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
	}

	/**
	 * @param word UTF-8 text of the word
	 * @param flags the word flags
	 * @return a word
	 */
	public static WordDesc of(String word, WordDescFlag... flags) {
		Set<WordDescFlag> set = EnumSet.noneOf(WordDescFlag.class);
		Collections.addAll(set, flags);
		return new WordDesc(word.getBytes(StandardCharsets.UTF_8), set);
	}

	/**
	 * @return a copy of the bytes of the word
	 */
	public byte[] getWord() {
		return word.clone();
	}

	public Set<WordDescFlag> getFlags() {
		return flags;
	}

	@Override
	public String toString() {
		return new String(word, StandardCharsets.UTF_8);
	}
}
