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
import java.util.Objects;
import java.util.Set;

/**
 * One node of a {@code [[ ]]} expression. Only {@link CommandFlag#CMD_INVERT_RETURN}
 * is meaningful among its flags.
 */
public final class CondCom implements CommandValue {

	private final Set<CommandFlag> flags;
	private final int line;
	private final CondType type;
	private final WordDesc op;
	private final CondCom left;
	private final CondCom right;

	/**
	 * @param flags node flags
	 * @param line source line
	 * @param type node type
	 * @param op the operator, or the operand of a {@link CondType#COND_TERM}
	 * @param left left or only operand, may be {@code null}
	 * @param right right operand, may be {@code null}
	 */
	public CondCom(Set<CommandFlag> flags, int line, CondType type, WordDesc op, CondCom left, CondCom right) {
		this.flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
		this.line = line;
		this.type = Objects.requireNonNull(type, "type");
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public Set<CommandFlag> getFlags() {
		return flags;
	}

	public int getLine() {
		return line;
	}

	public CondType getType() {
		return type;
	}

	public WordDesc getOp() {
		return op;
	}

	public CondCom getLeft() {
		return left;
	}

	public CondCom getRight() {
		return right;
	}
}
