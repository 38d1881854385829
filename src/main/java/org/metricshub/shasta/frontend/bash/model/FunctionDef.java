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
 * A function definition.
 */
public final class FunctionDef implements CommandValue {

	private final int line;
	private final WordDesc name;
	private final BashCommand command;
	private final String sourceFile;

	public FunctionDef(int line, WordDesc name, BashCommand command, String sourceFile) {
		this.line = line;
		this.name = name;
		this.command = command;
		this.sourceFile = sourceFile;
	}

	public int getLine() {
		return line;
	}

	public WordDesc getName() {
		return name;
	}

	public BashCommand getCommand() {
		return command;
	}

	public String getSourceFile() {
		return sourceFile;
	}
}
