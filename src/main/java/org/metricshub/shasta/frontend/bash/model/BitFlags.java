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

import java.util.EnumSet;
import java.util.Set;

/**
 * Decoding of bash's bit-mask fields into enum sets.
 */
final class BitFlags {

	/**
	 * A flag with its bit in the mask.
	 */
	interface Bit {
		int getBit();
	}

	private BitFlags() {}

	static <E extends Enum<E> & Bit> Set<E> fromBits(Class<E> type, int bits) {
		EnumSet<E> flags = EnumSet.noneOf(type);
		for (E flag : type.getEnumConstants()) {
			if ((bits & flag.getBit()) != 0) {
				flags.add(flag);
			}
		}
		return flags;
	}
}
