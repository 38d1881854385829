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
 * A redirection attached to a command. Every redirection has a file
 * descriptor it applies to.
 */
public abstract class RedirectionNode extends AstNode {

	private final FdTarget fd;

	RedirectionNode(FdTarget fd) {
		this.fd = Objects.requireNonNull(fd, "fd");
	}

	/**
	 * @return the descriptor this redirection applies to
	 */
	public FdTarget getFd() {
		return fd;
	}

	/**
	 * @param visitor the visitor to dispatch to
	 * @param <R> result type
	 * @return the visitor's result for this variant
	 */
	public abstract <R> R accept(RedirectionVisitor<R> visitor);
}
