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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One clause of a {@link CaseCom} ({@code PATTERN_LIST}).
 */
public final class Pattern {

	private final List<WordDesc> patterns;
	private final BashCommand action;
	private final Set<PatternFlag> flags;

	/**
	 * @param patterns the alternatives
	 * @param action the clause body, {@code null} when empty
	 * @param flags how the clause ends
	 */
	public Pattern(List<WordDesc> patterns, BashCommand action, Set<PatternFlag> flags) {
		this.patterns = Collections.unmodifiableList(patterns);
		this.action = action;
		this.flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
	}

	public List<WordDesc> getPatterns() {
		return patterns;
	}

	public BashCommand getAction() {
		return action;
	}

	public Set<PatternFlag> getFlags() {
		return flags;
	}
}
