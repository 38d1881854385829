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
import java.util.List;

/**
 * {@code for (( init; test; step )); do action; done}
 */
public final class ArithForCom implements CommandValue {

	private final int line;
	private final List<WordDesc> init;
	private final List<WordDesc> test;
	private final List<WordDesc> step;
	private final BashCommand action;

	public ArithForCom(int line, List<WordDesc> init, List<WordDesc> test, List<WordDesc> step, BashCommand action) {
		this.line = line;
		this.init = Collections.unmodifiableList(init);
		this.test = Collections.unmodifiableList(test);
		this.step = Collections.unmodifiableList(step);
		this.action = action;
	}

	public int getLine() {
		return line;
	}

	public List<WordDesc> getInit() {
		return init;
	}

	public List<WordDesc> getTest() {
		return test;
	}

	public List<WordDesc> getStep() {
		return step;
	}

	public BashCommand getAction() {
		return action;
	}
}
