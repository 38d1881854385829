package org.metricshub.shasta.frontend.shfmt;

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

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.util.ShastaLogger;
import org.metricshub.shasta.util.ShastaSettings;
import org.slf4j.Logger;

/**
 * Runs {@code shfmt -tojson} over a script and canonicalizes the result.
 * <p>
 * The script is fed to shfmt on its standard input; its bytes are also handed
 * to the {@link ShfmtAdapter} for the constructs shfmt leaves as text.
 */
public class ShfmtParser {

	private static final Logger LOG = ShastaLogger.getLogger(ShfmtParser.class);

	private final ShastaSettings settings;
	/** Deeply nested scripts give deeply nested trees. */
	private final ObjectMapper mapper = new ObjectMapper(JsonFactory.builder()
			.streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
			.build());
	private final ShfmtAdapter adapter = new ShfmtAdapter();

	/**
	 * Creates a parser running {@code shfmt} from the {@code PATH} with the
	 * default timeout.
	 */
	public ShfmtParser() {
		this(new ShastaSettings());
	}

	/**
	 * @param settings where the shfmt executable and its timeout come from
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public ShfmtParser(ShastaSettings settings) {
		this.settings = settings;
	}

	/**
	 * @param script path of the script
	 * @return the canonical commands of the script
	 * @throws IOException when the script cannot be read, or shfmt fails
	 */
	public List<Command> parse(Path script) throws IOException {
		return parse(Files.readAllBytes(script), script.toString());
	}

	/**
	 * @param source the script's bytes
	 * @param filename name shfmt reports in its diagnostics
	 * @return the canonical commands of the script
	 * @throws IOException when shfmt cannot be run or rejects the script
	 */
	public List<Command> parse(byte[] source, String filename) throws IOException {
		JsonNode tree = mapper.readTree(run(source, filename));
		return adapter.toCommands(tree, source);
	}

	/**
	 * The process never outlives this call.
	 *
	 * @return shfmt's standard output
	 */
	private byte[] run(byte[] source, String filename) throws IOException {
		List<String> command = Arrays.asList(settings.getShfmtExecutable(), "-tojson", "-filename", filename);
		LOG.debug("Running {}", command);
		Process p = new ProcessBuilder(command).start();
		Feed input = new Feed(p.getOutputStream(), source);
		Pump output = new Pump(p.getInputStream());
		Pump error = new Pump(p.getErrorStream());
		input.start();
		output.start();
		error.start();
		try {
			if (!p.waitFor(settings.getShfmtTimeoutSeconds(), TimeUnit.SECONDS)) {
				throw new IOException("shfmt did not complete within " + settings.getShfmtTimeoutSeconds() + " seconds");
			}
			input.join();
			output.join();
			error.join();
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while waiting for shfmt", ie);
		} finally {
			if (p.isAlive()) {
				p.destroyForcibly();
			}
		}
		// a failed write is only reported when shfmt itself succeeded
		int exitCode = p.exitValue();
		if (exitCode != 0) {
			String message = new String(error.bytes(), StandardCharsets.UTF_8).trim();
			LOG.warn("shfmt exited with code {} on {}: {}", exitCode, filename, message);
			throw new IOException("shfmt failed on " + filename + " with exit code " + exitCode + ": " + message);
		}
		if (input.failure != null) {
			throw new IOException("Could not send " + filename + " to shfmt", input.failure);
		}
		if (output.failure != null) {
			throw output.failure;
		}
		return output.bytes();
	}

	/**
	 * Writes the script to the standard input of the child process, then
	 * closes it.
	 */
	private static final class Feed extends Thread {

		private final OutputStream out;
		private final byte[] bytes;
		private volatile IOException failure;

		Feed(OutputStream out, byte[] bytes) {
			this.out = out;
			this.bytes = bytes;
			setDaemon(true);
		}

		@Override
		public void run() {
			try (OutputStream stream = out) {
				stream.write(bytes);
			} catch (IOException e) {
				failure = e;
			}
		}
	}

	/**
	 * Drains a stream of the child process.
	 */
	private static final class Pump extends Thread {

		private final InputStream in;
		private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		private volatile IOException failure;

		Pump(InputStream in) {
			this.in = in;
			setDaemon(true);
		}

		@Override
		public void run() {
			byte[] chunk = new byte[8192];
			try (InputStream stream = in) {
				int n;
				while ((n = stream.read(chunk)) >= 0) {
					synchronized (buffer) {
						buffer.write(chunk, 0, n);
					}
				}
			} catch (IOException e) {
				failure = e;
			}
		}

		byte[] bytes() {
			synchronized (buffer) {
				return buffer.toByteArray();
			}
		}
	}
}
