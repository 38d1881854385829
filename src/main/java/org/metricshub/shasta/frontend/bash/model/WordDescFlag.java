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
 * Flags of a {@link WordDesc} ({@code W_*} in bash's {@code command.h}).
 */
public enum WordDescFlag implements BitFlags.Bit {
	W_HASDOLLAR(1 << 0),
	W_QUOTED(1 << 1),
	W_ASSIGNMENT(1 << 2),
	W_SPLITSPACE(1 << 3),
	W_NOSPLIT(1 << 4),
	W_NOGLOB(1 << 5),
	W_NOSPLIT2(1 << 6),
	W_TILDEEXP(1 << 7),
	W_DOLLARAT(1 << 8),
	W_ARRAYREF(1 << 9),
	W_NOCOMSUB(1 << 10),
	W_ASSIGNRHS(1 << 11),
	W_NOTILDE(1 << 12),
	W_NOASSNTILDE(1 << 13),
	W_EXPANDRHS(1 << 14),
	W_COMPASSIGN(1 << 15),
	W_ASSNBLTIN(1 << 16),
	W_ASSIGNARG(1 << 17),
	W_HASQUOTEDNULL(1 << 18),
	W_DQUOTE(1 << 19),
	W_NOPROCSUB(1 << 20),
	W_SAWQUOTEDNULL(1 << 21),
	W_ASSIGNASSOC(1 << 22),
	W_ASSIGNARRAY(1 << 23),
	W_ARRAYIND(1 << 24),
	W_ASSNGLOBAL(1 << 25),
	W_NOBRACE(1 << 26),
	W_COMPLETE(1 << 27),
	W_CHKLOCAL(1 << 28),
	W_FORCELOCAL(1 << 29);

	private final int bit;

	WordDescFlag(int bit) {
		this.bit = bit;
	}

	@Override
	public int getBit() {
		return bit;
	}

	public static Set<WordDescFlag> fromBits(int bits) {
		return BitFlags.fromBits(WordDescFlag.class, bits);
	}
}
