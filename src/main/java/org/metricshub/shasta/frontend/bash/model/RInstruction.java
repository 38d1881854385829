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
 * Redirection instructions ({@code enum r_instruction}).
 */
public enum RInstruction {
	/** {@code >foo} */
	R_OUTPUT_DIRECTION(0),
	/** {@code <foo} */
	R_INPUT_DIRECTION(1),
	/** never built by bash's parser */
	R_INPUTA_DIRECTION(2),
	/** {@code >>foo} */
	R_APPENDING_TO(3),
	/** {@code <<foo} */
	R_READING_UNTIL(4),
	/** {@code <<<foo} */
	R_READING_STRING(5),
	/** {@code 1<&2} */
	R_DUPLICATING_INPUT(6),
	/** {@code 1>&2} */
	R_DUPLICATING_OUTPUT(7),
	/** {@code <<-foo} */
	R_DEBLANK_READING_UNTIL(8),
	/** {@code <&-} */
	R_CLOSE_THIS(9),
	/** {@code &>foo} */
	R_ERR_AND_OUT(10),
	/** {@code <>foo} */
	R_INPUT_OUTPUT(11),
	/** {@code >|foo} */
	R_OUTPUT_FORCE(12),
	/** {@code 1<&$foo} */
	R_DUPLICATING_INPUT_WORD(13),
	/** {@code 1>&$foo} */
	R_DUPLICATING_OUTPUT_WORD(14),
	/** {@code 1<&2-} */
	R_MOVE_INPUT(15),
	/** {@code 1>&2-} */
	R_MOVE_OUTPUT(16),
	/** {@code 1<&$foo-} */
	R_MOVE_INPUT_WORD(17),
	/** {@code 1>&$foo-} */
	R_MOVE_OUTPUT_WORD(18),
	/** {@code &>>foo} */
	R_APPEND_ERR_AND_OUT(19);

	private final int value;

	RInstruction(int value) {
		this.value = value;
	}

	public int getValue() {
		return value;
	}

	public static RInstruction fromValue(int value) {
		for (RInstruction instruction : values()) {
			if (instruction.value == value) {
				return instruction;
			}
		}
		throw new IllegalArgumentException("Unknown redirection instruction " + value);
	}
}
