package org.metricshub.shasta.frontend.shfmt;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.resource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.Assume;
import org.junit.Test;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.backend.ShellPrinter;
import org.metricshub.shasta.util.ShastaSettings;

public class ShfmtParserTest {

	private static final boolean IS_WINDOWS = System.getProperty("os.name").contains("Windows");

	/**
	 * Writes a shell script standing in for shfmt.
	 */
	private static ShastaSettings fakeShfmt(String body) throws IOException {
		Path executable = Files.createTempFile("shfmt-", ".sh");
		Files.write(executable, ("#!/bin/sh\n" + body).getBytes(StandardCharsets.UTF_8));
		assertTrue(executable.toFile().setExecutable(true));
		executable.toFile().deleteOnExit();
		ShastaSettings settings = new ShastaSettings();
		settings.setShfmtExecutable(executable.toString());
		return settings;
	}

	@Test
	public void testMissingExecutable() {
		ShastaSettings settings = new ShastaSettings();
		settings.setShfmtExecutable("/nonexistent/shfmt-" + System.nanoTime());
		ShfmtParser parser = new ShfmtParser(settings);
		try {
			parser.parse("echo hi\n".getBytes(StandardCharsets.UTF_8), "script.sh");
			fail("A missing shfmt executable went unnoticed");
		} catch (IOException e) {
			assertNotNull(e.getMessage());
		}
	}

	@Test
	public void testParse() throws IOException {
		Assume.assumeFalse(IS_WINDOWS);
		Path tree = Files.createTempFile("shfmt-", ".json");
		tree.toFile().deleteOnExit();
		Files.write(tree, resource("/shfmt/script.json"));
		ShastaSettings settings = fakeShfmt("cat > /dev/null\ncat '" + tree + "'\n");

		List<Command> commands = new ShfmtParser(settings).parse(resource("/shfmt/script.sh"), "script.sh");
		assertEquals(3, commands.size());
		assertEquals(1, ((Simple) commands.get(0)).getLine());
		assertEquals("x=1 echo \"${x}\" ${y:-d} ${z/a/b} > out 2>&1", new ShellPrinter().print(commands.get(0)));
	}

	@Test
	public void testParseFile() throws IOException {
		Assume.assumeFalse(IS_WINDOWS);
		Path script = Files.createTempFile("script-", ".sh");
		script.toFile().deleteOnExit();
		Files.write(script, "a\n".getBytes(StandardCharsets.UTF_8));
		ShastaSettings settings = fakeShfmt("cat > /dev/null\n"
				+ "echo '{\"Type\":\"File\",\"Stmts\":[{\"Position\":{\"Line\":1},"
				+ "\"Cmd\":{\"Type\":\"CallExpr\",\"Args\":[{\"Parts\":[{\"Type\":\"Lit\",\"Value\":\"a\"}]}]}}]}'\n");

		List<Command> commands = new ShfmtParser(settings).parse(script);
		assertEquals("a", new ShellPrinter().print(commands));
	}

	@Test
	public void testFailureCarriesDiagnostic() throws IOException {
		Assume.assumeFalse(IS_WINDOWS);
		ShastaSettings settings = fakeShfmt("cat > /dev/null\necho 'script.sh:1:1: reached EOF' >&2\nexit 1\n");
		try {
			new ShfmtParser(settings).parse("if\n".getBytes(StandardCharsets.UTF_8), "script.sh");
			fail("A failing shfmt went unnoticed");
		} catch (IOException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("reached EOF"));
			assertTrue(e.getMessage(), e.getMessage().contains("exit code 1"));
		}
	}

	@Test
	public void testEarlyExitKeepsDiagnostic() throws IOException {
		Assume.assumeFalse(IS_WINDOWS);
		ShastaSettings settings = fakeShfmt("echo 'unsupported option' >&2\nexit 2\n");
		byte[] large = new byte[1 << 20];
		Arrays.fill(large, (byte) '#');
		try {
			new ShfmtParser(settings).parse(large, "large.sh");
			fail("A failing shfmt went unnoticed");
		} catch (IOException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("unsupported option"));
		}
	}

	@Test
	public void testTimeout() throws IOException {
		Assume.assumeFalse(IS_WINDOWS);
		ShastaSettings settings = fakeShfmt("exec sleep 30\n");
		settings.setShfmtTimeoutSeconds(1);
		byte[] large = new byte[1 << 20];
		long start = System.nanoTime();
		try {
			new ShfmtParser(settings).parse(large, "large.sh");
			fail("A hanging shfmt went unnoticed");
		} catch (IOException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("did not complete within 1 seconds"));
		}
		assertTrue(System.nanoTime() - start < 20_000_000_000L);
	}
}
