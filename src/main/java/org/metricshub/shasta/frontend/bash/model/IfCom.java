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
 * {@code if test; then trueCase; else falseCase; fi}. An {@code elif} is an
 * {@link IfCom} in the false case.
 */
public final class IfCom implements CommandValue {

	private final BashCommand test;
	private final BashCommand trueCase;
	private final BashCommand falseCase;

	public IfCom(BashCommand test, BashCommand trueCase, BashCommand falseCase) {
		this.test = test;
		this.trueCase = trueCase;
		this.falseCase = falseCase;
	}

	public BashCommand getTest() {
		return test;
	}

	public BashCommand getTrueCase() {
		return trueCase;
	}

	/**
	 * @return the else branch, or {@code null}
	 */
	public BashCommand getFalseCase() {
		return falseCase;
	}
}
