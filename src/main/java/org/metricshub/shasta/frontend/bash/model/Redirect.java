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
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One redirection ({@code REDIRECT}).
 * <p>
 * For here-documents, the redirectee holds the body and
 * {@link #getHereDocEof()} the delimiter as it was written, quotes included.
 */
public final class Redirect {

	private final Redirectee redirector;
	private final Set<RedirectFlag> rflags;
	private final RInstruction instruction;
	private final Redirectee redirectee;
	private final String hereDocEof;

	public Redirect(Redirectee redirector, Set<RedirectFlag> rflags, RInstruction instruction, Redirectee redirectee, String hereDocEof) {
		this.redirector = redirector;
		this.rflags = rflags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(rflags));
		this.instruction = Objects.requireNonNull(instruction, "instruction");
		this.redirectee = redirectee;
		this.hereDocEof = hereDocEof;
	}

	public Redirectee getRedirector() {
		return redirector;
	}

	public Set<RedirectFlag> getRflags() {
		return rflags;
	}

	public RInstruction getInstruction() {
		return instruction;
	}

	public Redirectee getRedirectee() {
		return redirectee;
	}

	public String getHereDocEof() {
		return hereDocEof;
	}
}
