package org.metricshub.shasta;

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
 * Thrown when a redirection's descriptor or target is neither a fixed
 * descriptor nor a named one, or when its operand is missing.
 */
public class InvalidRedirectionTargetException extends ShastaException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param lineno line of the offending redirection, or {@code -1}
	 * @param nodeKind the redirection instruction
	 * @param detail what is wrong with the target
	 */
	public InvalidRedirectionTargetException(int lineno, String nodeKind, String detail) {
		super(lineno, nodeKind, "Invalid redirection target for " + nodeKind + ": " + detail);
	}
}
