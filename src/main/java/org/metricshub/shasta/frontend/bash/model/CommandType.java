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

/**
 * Type of a {@link BashCommand}, numbered like bash's {@code enum command_type}.
 */
public enum CommandType {
	CM_FOR(0),
	CM_CASE(1),
	CM_WHILE(2),
	CM_IF(3),
	CM_SIMPLE(4),
	CM_SELECT(5),
	CM_CONNECTION(6),
	CM_FUNCTION_DEF(7),
	CM_UNTIL(8),
	CM_GROUP(9),
	CM_ARITH(10),
	CM_COND(11),
	CM_ARITH_FOR(12),
	CM_SUBSHELL(13),
	CM_COPROC(14);

	private final int value;

	CommandType(int value) {
		this.value = value;
	}

	public int getValue() {
		return value;
	}

	/**
	 * @param value a {@code command_type} value
	 * @return the matching type
	 * @throws IllegalArgumentException when the value is unknown
	 */
	public static CommandType fromValue(int value) {
		for (CommandType type : values()) {
			if (type.value == value) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown command type " + value);
	}
}
