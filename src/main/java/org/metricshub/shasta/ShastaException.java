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
 * A translation failure. It carries the kind of the front-end node that could
 * not be translated and, when the front end recorded it, its line.
 */
public class ShastaException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	private final String nodeKind;

	/**
	 * Constructor for ShastaException.
	 *
	 * @param lineno line of the offending node, or {@code -1}
	 * @param nodeKind kind of the offending front-end node
	 * @param msg description of the failure
	 */
	public ShastaException(int lineno, String nodeKind, String msg) {
		super(lineno < 0 ? msg : msg + " (line " + lineno + ")");
		this.lineNumber = lineno;
		this.nodeKind = nodeKind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the kind of the offending front-end node
	 */
	public String getNodeKind() {
		return nodeKind;
	}
}
