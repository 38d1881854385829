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

import java.util.Objects;

/**
 * Two commands joined by a connector. The second command is missing after a
 * trailing {@code &}.
 */
public final class Connection implements CommandValue {

	private final BashCommand first;
	private final BashCommand second;
	private final ConnectionType connector;

	public Connection(BashCommand first, BashCommand second, ConnectionType connector) {
		this.first = Objects.requireNonNull(first, "first");
		this.second = second;
		this.connector = Objects.requireNonNull(connector, "connector");
	}

	public BashCommand getFirst() {
		return first;
	}

	/**
	 * @return the second command, or {@code null}
	 */
	public BashCommand getSecond() {
		return second;
	}

	public ConnectionType getConnector() {
		return connector;
	}
}
