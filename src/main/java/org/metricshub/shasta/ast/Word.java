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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * One shell word: a flat, ordered sequence of {@link ArgChar}. Concatenation
 * order is the only structure; nesting only happens inside the quoted,
 * substitution and expansion characters.
 */
public final class Word implements Iterable<ArgChar> {

	/** The word with no characters. */
	public static final Word EMPTY = new Word(new ArrayList<>());

	private final List<ArgChar> chars;

	private Word(List<ArgChar> chars) {
		this.chars = Nodes.copy(chars, "chars");
	}

	/**
	 * @param chars the characters of the word
	 * @return a word
	 */
	public static Word of(List<? extends ArgChar> chars) {
		return chars.isEmpty() ? EMPTY : new Word(new ArrayList<>(chars));
	}

	/**
	 * @param chars the characters of the word
	 * @return a word
	 */
	public static Word of(ArgChar... chars) {
		List<ArgChar> list = new ArrayList<>(chars.length);
		for (ArgChar c : chars) {
			list.add(c);
		}
		return of(list);
	}

	/**
	 * Literal characters that still obey the printer's guards ({@code $}
	 * followed by more text is escaped, {@code "} is escaped inside quotes).
	 *
	 * @param text decoded text
	 * @return a word made of {@link Literal} characters
	 */
	public static Word literal(String text) {
		return fromCodePoints(text, false);
	}

	/**
	 * Raw source text, printed back exactly as it is.
	 *
	 * @param text source text
	 * @return a word made of verbatim {@link Literal} characters
	 */
	public static Word verbatim(String text) {
		return fromCodePoints(text, true);
	}

	private static Word fromCodePoints(String text, boolean verbatim) {
		List<ArgChar> list = new ArrayList<>(text.length());
		text.codePoints().forEach(cp -> list.add(new Literal(cp, verbatim)));
		return of(list);
	}

	/**
	 * @param other the word to append
	 * @return a word holding the characters of this word followed by those of
	 *         {@code other}
	 */
	public Word concat(Word other) {
		if (other.isEmpty()) {
			return this;
		}
		if (isEmpty()) {
			return other;
		}
		List<ArgChar> list = new ArrayList<>(chars);
		list.addAll(other.chars);
		return new Word(list);
	}

	/**
	 * @return the characters, unmodifiable
	 */
	public List<ArgChar> getChars() {
		return chars;
	}

	public int size() {
		return chars.size();
	}

	public boolean isEmpty() {
		return chars.isEmpty();
	}

	public ArgChar get(int index) {
		return chars.get(index);
	}

	/**
	 * The text of a word made only of literal and escaped characters.
	 *
	 * @return the characters' text, or {@code null} when the word holds quotes,
	 *         expansions or substitutions
	 */
	public String plainText() {
		StringBuilder text = new StringBuilder();
		for (ArgChar c : chars) {
			if (c instanceof Literal) {
				text.appendCodePoint(((Literal) c).getCodePoint());
			} else if (c instanceof Escaped) {
				text.appendCodePoint(((Escaped) c).getCodePoint());
			} else {
				return null;
			}
		}
		return text.toString();
	}

	@Override
	public Iterator<ArgChar> iterator() {
		return chars.iterator();
	}
}
