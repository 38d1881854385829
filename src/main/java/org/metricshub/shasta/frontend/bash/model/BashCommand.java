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
import java.util.Objects;
import java.util.Set;

/**
 * A command as bash's parser builds it ({@code struct command}), filled in by
 * a native binding of bash's parser.
 */
public final class BashCommand {

	private final CommandType type;
	private final Set<CommandFlag> flags;
	private final int line;
	private final List<Redirect> redirects;
	private final CommandValue value;

	/**
	 * @param type the command type, which tells the class of {@code value}
	 * @param flags the command flags
	 * @param line source line, 0 when bash did not record it
	 * @param redirects redirections applied to the whole command
	 * @param value the type-specific part
	 */
	public BashCommand(CommandType type, Set<CommandFlag> flags, int line, List<Redirect> redirects, CommandValue value) {
		this.type = Objects.requireNonNull(type, "type");
		this.flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
		this.line = line;
		this.redirects = Collections.unmodifiableList(redirects);
		this.value = Objects.requireNonNull(value, "value");
	}

	public CommandType getType() {
		return type;
	}

	public Set<CommandFlag> getFlags() {
		return flags;
	}

	public int getLine() {
		return line;
	}

	public List<Redirect> getRedirects() {
		return redirects;
	}

	public CommandValue getValue() {
		return value;
	}
}
