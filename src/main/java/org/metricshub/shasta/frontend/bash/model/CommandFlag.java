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

import java.util.Set;

/**
 * Flags of a command ({@code CMD_*} in bash's {@code command.h}).
 */
public enum CommandFlag implements BitFlags.Bit {
	CMD_WANT_SUBSHELL(1 << 0),
	CMD_FORCE_SUBSHELL(1 << 1),
	CMD_INVERT_RETURN(1 << 2),
	CMD_IGNORE_RETURN(1 << 3),
	CMD_NO_FUNCTIONS(1 << 4),
	CMD_INHIBIT_EXPANSION(1 << 5),
	CMD_NO_FORK(1 << 6),
	CMD_TIME_PIPELINE(1 << 7),
	CMD_TIME_POSIX(1 << 8),
	CMD_AMPERSAND(1 << 9),
	CMD_STDIN_REDIRECTED(1 << 10),
	CMD_COMMAND_BUILTIN(1 << 11),
	CMD_COPROC_SHELL(1 << 12),
	CMD_LASTPIPE(1 << 13),
	CMD_STD_PATH(1 << 14),
	CMD_TRY_OPTIMIZING(1 << 15);

	private final int bit;

	CommandFlag(int bit) {
		this.bit = bit;
	}

	@Override
	public int getBit() {
		return bit;
	}

	public static Set<CommandFlag> fromBits(int bits) {
		return BitFlags.fromBits(CommandFlag.class, bits);
	}
}
