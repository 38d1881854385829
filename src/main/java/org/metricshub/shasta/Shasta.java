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

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.backend.JsonSerializer;
import org.metricshub.shasta.backend.ShellPrinter;
import org.metricshub.shasta.frontend.bash.BashAdapter;
import org.metricshub.shasta.frontend.bash.model.BashCommand;
import org.metricshub.shasta.frontend.dash.DashAdapter;
import org.metricshub.shasta.frontend.shfmt.ShfmtAdapter;
import org.metricshub.shasta.util.ShastaSettings;

/**
 * Entry point: canonicalize the output of one of the supported parsers, then
 * print the canonical tree as shell text or serialize it as JSON.
 *
 * <pre>
 * Shasta shasta = new Shasta();
 * List&lt;Command&gt; script = shasta.fromDash(libdashJson);
 * String text = shasta.pretty(script);
 * </pre>
 */
public class Shasta {

	private final ShastaSettings settings;
	private final DashAdapter dash = new DashAdapter();
	private final BashAdapter bash = new BashAdapter();
	private final ShfmtAdapter shfmt = new ShfmtAdapter();
	private final JsonSerializer serializer = new JsonSerializer();

	/**
	 * Creates a converter with the default settings.
	 */
	public Shasta() {
		this(new ShastaSettings());
	}

	/**
	 * Creates a converter with the given settings. Later changes to the
	 * settings are seen by this converter.
	 *
	 * @param settings the settings to use
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Shasta(ShastaSettings settings) {
		this.settings = settings;
	}

	/**
	 * @return the settings used by this converter, not a copy
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ShastaSettings getSettings() {
		return settings;
	}

	/**
	 * @param script libdash's JSON rendering of a script: one entry per
	 *        top-level command
	 * @return the canonical commands
	 */
	public List<Command> fromDash(JsonNode script) {
		return dash.toCommands(script);
	}

	/**
	 * @param script commands read by libbash
	 * @return the canonical commands
	 */
	public List<Command> fromBash(List<BashCommand> script) {
		return bash.toCommands(script);
	}

	/**
	 * @param tree shfmt's typed JSON
	 * @param source the script's bytes, or {@code null} when not at hand
	 * @return the canonical commands
	 */
	public List<Command> fromShfmt(JsonNode tree, byte[] source) {
		return shfmt.toCommands(tree, source);
	}

	/**
	 * @param node any node
	 * @return its shell text
	 */
	public String pretty(AstNode node) {
		return new ShellPrinter(settings).print(node);
	}

	/**
	 * @param script top-level commands
	 * @return the script text, one command per line
	 */
	public String pretty(List<? extends Command> script) {
		return new ShellPrinter(settings).print(script);
	}

	/**
	 * @param node any node
	 * @return its {@code [tag, payload]} JSON tree
	 */
	public JsonNode json(AstNode node) {
		return serializer.toJson(node);
	}

	/**
	 * @param script top-level commands
	 * @return a JSON array with one entry per command
	 */
	public JsonNode json(List<? extends Command> script) {
		return serializer.toJson(script);
	}
}
