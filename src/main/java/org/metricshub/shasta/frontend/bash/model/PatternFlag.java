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
 * How a case clause ends: {@code ;&} falls through, {@code ;;&} tests the
 * next pattern.
 */
public enum PatternFlag implements BitFlags.Bit {
	CASEPAT_FALLTHROUGH(1 << 0),
	CASEPAT_TESTNEXT(1 << 1);

	private final int bit;

	PatternFlag(int bit) {
		this.bit = bit;
	}

	@Override
	public int getBit() {
		return bit;
	}

	public static Set<PatternFlag> fromBits(int bits) {
		return BitFlags.fromBits(PatternFlag.class, bits);
	}
}
