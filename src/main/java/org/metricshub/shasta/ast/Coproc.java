package org.metricshub.shasta.ast;

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

import java.util.Objects;

/**
 * bash's {@code coproc NAME body}. The name is only printed for compound
 * bodies: bash does not accept it in front of a simple command.
 */
public final class Coproc extends Command {

	private final Word name;
	private final Command body;

	public Coproc(Word name, Command body) {
		this.name = Objects.requireNonNull(name, "name");
		this.body = Objects.requireNonNull(body, "body");
	}

	public Word getName() {
		return name;
	}

	public Command getBody() {
		return body;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitCoproc(this);
	}
}
