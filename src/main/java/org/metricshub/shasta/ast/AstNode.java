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

import com.fasterxml.jackson.databind.JsonNode;
import org.metricshub.shasta.backend.JsonSerializer;
import org.metricshub.shasta.backend.ShellPrinter;

/**
 * Root of the canonical syntax tree.
 * <p>
 * Nodes are immutable: they are built once by a front-end adapter and never
 * changed afterwards. Every node belongs to exactly one parent.
 */
public abstract class AstNode {

	/** Line value of nodes whose front end did not record one. */
	public static final int NO_LINE = -1;

	AstNode() {}

	/**
	 * Structural serialization, as nested {@code [tag, payload]} arrays.
	 *
	 * @return the JSON tree of this node
	 */
	public JsonNode json() {
		return new JsonSerializer().toJson(this);
	}

	/**
	 * Renders this node back to shell syntax, with default settings.
	 *
	 * @return shell source text
	 */
	public String pretty() {
		return new ShellPrinter().print(this);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + ": " + pretty();
	}
}
