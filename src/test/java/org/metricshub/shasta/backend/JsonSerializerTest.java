package org.metricshub.shasta.backend;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.cmd;
import static org.metricshub.shasta.ShastaTestSupport.redirected;
import static org.metricshub.shasta.ShastaTestSupport.w;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Case;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Cond;
import org.metricshub.shasta.ast.DupRedir;
import org.metricshub.shasta.ast.FdTarget;
import org.metricshub.shasta.ast.HeredocRedir;
import org.metricshub.shasta.ast.Pipe;
import org.metricshub.shasta.ast.RedirectionNode;
import org.metricshub.shasta.ast.Semi;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.SingleArgRedir;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.TildeUser;
import org.metricshub.shasta.ast.VarExpand;
import org.metricshub.shasta.ast.Word;

public class JsonSerializerTest {

	private final JsonSerializer serializer = new JsonSerializer();

	@Test
	public void testSimpleCommand() {
		Simple command = new Simple(3, Collections.singletonList(new AssignNode("A", w("b"))),
				Collections.singletonList(w("x")), Collections.<RedirectionNode>emptyList());
		assertEquals("[\"Command\",[3,[[\"A\",[[\"C\",98]]]],[[[\"C\",120]]],[]]]", serializer.toJsonString(command));
	}

	@Test
	public void testMissingLineIsNull() {
		assertEquals("[\"Command\",[null,[],[],[]]]", serializer.toJsonString(Simple.empty()));
	}

	@Test
	public void testCharacters() {
		Word word = Word.of(
				new TildeUser(null),
				new TildeUser("bob"),
				new VarExpand(VarExpand.Format.TRIM_R_MAX, false, "p", w("*")));
		JsonNode json = serializer.toJson(new Simple(-1,
				Collections.<AssignNode>emptyList(), Collections.singletonList(word), Collections.<RedirectionNode>emptyList()));
		JsonNode chars = json.get(1).get(2).get(0);
		assertEquals("[\"T\",\"None\"]", chars.get(0).toString());
		assertEquals("[\"T\",[\"Some\",\"bob\"]]", chars.get(1).toString());
		assertEquals("[\"V\",[\"TrimRMax\",false,\"p\",[[\"C\",42]]]]", chars.get(2).toString());
	}

	@Test
	public void testRedirections() {
		Simple command = redirected(cmd("a"),
				new DupRedir(DupRedir.Kind.TO_FD, FdTarget.named(w("fd")), FdTarget.fixed(1), true),
				new HeredocRedir(HeredocRedir.Kind.XHERE, FdTarget.fixed(0), w("x"), false, null),
				new SingleArgRedir(SingleArgRedir.Kind.CLOSE_THIS, FdTarget.fixed(4)));
		JsonNode redirections = serializer.toJson(command).get(1).get(3);
		assertEquals("[\"Dup\",[\"ToFD\",[\"var\",[[\"C\",102],[\"C\",100]]],[[\"C\",49]],true]]", redirections.get(0).toString());
		assertEquals("[\"Heredoc\",[\"XHere\",0,[[\"C\",120]],null]]", redirections.get(1).toString());
		assertEquals("[\"SingleArg\",[\"CloseThis\",4]]", redirections.get(2).toString());
	}

	@Test
	public void testCompoundCommands() {
		Pipe pipe = new Pipe(true, Arrays.asList(cmd("a"), cmd("b")));
		JsonNode json = serializer.toJson(pipe);
		assertEquals("Pipe", json.get(0).asText());
		assertTrue(json.get(1).get(0).asBoolean());
		assertEquals(2, json.get(1).get(1).size());

		Background background = new Background(-1, cmd("a"), Collections.<RedirectionNode>emptyList(), cmd("b"));
		assertEquals(4, serializer.toJson(background).get(1).size());
		Background plain = new Background(-1, cmd("a"), Collections.<RedirectionNode>emptyList());
		assertEquals(3, serializer.toJson(plain).get(1).size());

		Subshell subshell = new Subshell(7, cmd("a"), Collections.<RedirectionNode>emptyList());
		assertEquals(7, serializer.toJson(subshell).get(1).get(0).asInt());
	}

	@Test
	public void testCaseClauses() {
		Case choice = new Case(2, w("x"), Arrays.asList(
				new Case.Clause(Collections.singletonList(w("a")), cmd("one"), true),
				new Case.Clause(Collections.singletonList(w("b")), null, false)));
		JsonNode clauses = serializer.toJson(choice).get(1).get(2);
		assertTrue(clauses.get(0).get("fallthrough").asBoolean());
		assertEquals("Command", clauses.get(0).get("cbody").get(0).asText());
		assertTrue(clauses.get(1).get("cbody").isNull());
		assertFalse(clauses.get(1).has("fallthrough"));
	}

	@Test
	public void testCond() {
		Cond cond = new Cond(5, Cond.Kind.UNARY, w("-n"), Cond.term(w("s")), null, true);
		JsonNode payload = serializer.toJson(cond).get(1);
		assertEquals(5, payload.get(0).asInt());
		assertEquals(3, payload.get(1).asInt());
		assertEquals("Cond", payload.get(3).get(0).asText());
		assertTrue(payload.get(4).isNull());
		assertTrue(payload.get(5).asBoolean());
	}

	@Test
	public void testScript() {
		JsonNode json = serializer.toJson(Arrays.asList(cmd("a"), cmd("b")));
		assertTrue(json.isArray());
		assertEquals(2, json.size());
	}

	@Test
	public void testDeepTree() {
		List<Command> statements = new ArrayList<>();
		for (int i = 0; i < 50_000; i++) {
			statements.add(cmd("x"));
		}
		JsonNode json = serializer.toJson(Semi.sequence(statements));
		int depth = 0;
		while ("Semi".equals(json.get(0).asText())) {
			json = json.get(1).get(1);
			depth++;
		}
		assertEquals(49_999, depth);
	}
}
