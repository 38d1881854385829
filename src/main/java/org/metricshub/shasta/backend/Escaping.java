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

import org.metricshub.shasta.ast.Literal;

/**
 * Decides, per character and per {@link QuoteMode}, the text printed for a
 * literal or escaped character. Pure functions only.
 */
public final class Escaping {

	/**
	 * Characters escaped wherever they appear. {@code !} is not part of the
	 * list, non-interactive shells do not expand history.
	 */
	static final String ALWAYS_ESCAPED = "'\"`(){}$&|;";

	/** Characters escaped only outside of quotes. */
	static final String ESCAPED_WHEN_UNQUOTED = "*?[]#<>~ ";

	private Escaping() {}

	/**
	 * @param codePoint the character the source escaped
	 * @param mode printing context
	 * @return the text to print
	 */
	public static String escaped(int codePoint, QuoteMode mode) {
		String text = new String(Character.toChars(codePoint));
		if (mode == QuoteMode.LITERAL_HEREDOC) {
			return text;
		}
		if (codePoint == '\\' || ALWAYS_ESCAPED.indexOf(codePoint) >= 0) {
			return "\\" + text;
		}
		if (mode == QuoteMode.UNQUOTED && ESCAPED_WHEN_UNQUOTED.indexOf(codePoint) >= 0) {
			return "\\" + text;
		}
		return text;
	}

	/**
	 * Literal characters are printed as they are, except for a {@code $}
	 * followed by more characters of the word, which would otherwise start an
	 * expansion when the output is parsed again, and for {@code "} inside
	 * double quotes. Verbatim literals carry their own escapes and are never
	 * changed.
	 *
	 * @param c the literal
	 * @param followed whether more characters of the same word follow
	 * @param mode printing context
	 * @return the text to print
	 */
	public static String literal(Literal c, boolean followed, QuoteMode mode) {
		int codePoint = c.getCodePoint();
		String text = new String(Character.toChars(codePoint));
		if (c.isVerbatim() || mode == QuoteMode.LITERAL_HEREDOC) {
			return text;
		}
		if (codePoint == '$' && followed) {
			return "\\$";
		}
		if (codePoint == '"' && mode == QuoteMode.QUOTED) {
			return "\\\"";
		}
		return text;
	}
}
