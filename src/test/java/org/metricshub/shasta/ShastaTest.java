package org.metricshub.shasta;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.cmd;
import static org.metricshub.shasta.ShastaTestSupport.json;
import static org.metricshub.shasta.ShastaTestSupport.jsonResource;
import static org.metricshub.shasta.ShastaTestSupport.redirected;
import static org.metricshub.shasta.ShastaTestSupport.resource;
import static org.metricshub.shasta.ShastaTestSupport.w;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.Test;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.FdTarget;
import org.metricshub.shasta.ast.HeredocRedir;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.util.ShastaSettings;

public class ShastaTest {

	private static Simple heredoc(String body) {
		return redirected(cmd("cat"), new HeredocRedir(HeredocRedir.Kind.XHERE, FdTarget.fixed(0), w(body), false, null));
	}

	@Test
	public void testGeneratedMarkers() {
		Shasta shasta = new Shasta();
		assertEquals("cat <<EOFF\nEOF\nEOFF\n", shasta.pretty(heredoc("EOF\n")));

		shasta.getSettings().setHeredocMarker("END");
		assertEquals("cat <<END\nx\nEND\n", shasta.pretty(heredoc("x")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidMarker() {
		new ShastaSettings().setHeredocMarker("'EOF'");
	}

	@Test
	public void testSettingsDescription() {
		ShastaSettings settings = new ShastaSettings();
		settings.setShfmtExecutable("/opt/shfmt");
		String description = settings.toDescriptionString();
		assertTrue(description.contains("heredocMarker = EOF"));
		assertTrue(description.contains("shfmtExecutable = /opt/shfmt"));
		assertTrue(description.contains("shfmtTimeoutSeconds = 30"));
	}

	@Test
	public void testDashToJsonAndBack() {
		Shasta shasta = new Shasta();
		JsonNode script = json("[[\"Command\",[1,[],[[[\"C\",108],[\"C\",115]]],[]]]]");
		List<Command> commands = shasta.fromDash(script);
		assertEquals("ls", shasta.pretty(commands));
		assertEquals(script, shasta.json(commands));
		assertEquals(script.get(0), shasta.json(commands.get(0)));
	}

	@Test
	public void testShfmt() {
		Shasta shasta = new Shasta();
		List<Command> commands = shasta.fromShfmt(jsonResource("/shfmt/script.json"), resource("/shfmt/script.sh"));
		assertTrue(shasta.pretty(commands).startsWith("x=1 echo \"${x}\""));
	}
}
