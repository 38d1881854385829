package org.metricshub.shasta.util;

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
 * A simple container for the parameters of the printer and of the shfmt
 * front end runner. These values have defaults, which may be changed
 * programmatically.
 */
public class ShastaSettings {

	/**
	 * Seed of the markers generated for heredocs that carry no explicit
	 * delimiter. When a line of the body equals the marker, the last
	 * character is repeated until it no longer does.
	 */
	private String heredocMarker = "EOF";

	/**
	 * Executable invoked to turn a script into shfmt's typed JSON;
	 * <code>shfmt</code> by default, which means it is looked up in the PATH.
	 */
	private String shfmtExecutable = "shfmt";

	/**
	 * How long the shfmt process may run before it is killed.
	 */
	private long shfmtTimeoutSeconds = 30;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("heredocMarker = ").append(getHeredocMarker()).append(newLine);
		desc.append("shfmtExecutable = ").append(getShfmtExecutable()).append(newLine);
		desc.append("shfmtTimeoutSeconds = ").append(getShfmtTimeoutSeconds()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the seed of generated heredoc markers
	 */
	public String getHeredocMarker() {
		return heredocMarker;
	}

	/**
	 * @param heredocMarker the seed of generated heredoc markers, must not be
	 *        empty nor contain quotes, blanks or newlines
	 */
	public void setHeredocMarker(String heredocMarker) {
		if (heredocMarker == null || !heredocMarker.matches("[A-Za-z0-9_]+")) {
			throw new IllegalArgumentException("Invalid heredoc marker: " + heredocMarker);
		}
		this.heredocMarker = heredocMarker;
	}

	/**
	 * @return the shfmt executable
	 */
	public String getShfmtExecutable() {
		return shfmtExecutable;
	}

	/**
	 * @param shfmtExecutable the shfmt executable (path or name looked up in PATH)
	 */
	public void setShfmtExecutable(String shfmtExecutable) {
		this.shfmtExecutable = shfmtExecutable;
	}

	/**
	 * @return how long shfmt may run, in seconds
	 */
	public long getShfmtTimeoutSeconds() {
		return shfmtTimeoutSeconds;
	}

	/**
	 * @param shfmtTimeoutSeconds how long shfmt may run, in seconds
	 */
	public void setShfmtTimeoutSeconds(long shfmtTimeoutSeconds) {
		this.shfmtTimeoutSeconds = shfmtTimeoutSeconds;
	}
}
