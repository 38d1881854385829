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

import java.util.Collections;
import java.util.List;

/**
 * A simple command: words, assignments among them, and its own redirections.
 */
public final class SimpleCom implements CommandValue {

	private final int line;
	private final List<WordDesc> words;
	private final List<Redirect> redirects;

	public SimpleCom(int line, List<WordDesc> words, List<Redirect> redirects) {
		this.line = line;
		this.words = Collections.unmodifiableList(words);
		this.redirects = Collections.unmodifiableList(redirects);
	}

	public int getLine() {
		return line;
	}

	public List<WordDesc> getWords() {
		return words;
	}

	public List<Redirect> getRedirects() {
		return redirects;
	}
}
