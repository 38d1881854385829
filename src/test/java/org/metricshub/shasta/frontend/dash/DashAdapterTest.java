package org.metricshub.shasta.frontend.dash;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.cmd;
import static org.metricshub.shasta.ShastaTestSupport.json;
import static org.metricshub.shasta.ShastaTestSupport.redirected;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.Test;
import org.metricshub.shasta.InvalidRedirectionTargetException;
import org.metricshub.shasta.ShastaException;
import org.metricshub.shasta.UnsupportedConstructException;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.DupRedir;
import org.metricshub.shasta.ast.FdTarget;
import org.metricshub.shasta.ast.HeredocRedir;
import org.metricshub.shasta.ast.Pipe;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.SingleArgRedir;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.backend.JsonSerializer;
import org.metricshub.shasta.backend.ShellPrinter;

public class DashAdapterTest {

	private final DashAdapter adapter = new DashAdapter();
	private final ShellPrinter printer = new ShellPrinter();

	/** libdash's rendering of a word of plain characters. */
	private static String word(String text) {
		StringBuilder json = new StringBuilder("[");
		for (int i = 0; i < text.length(); i++) {
			json.append(i == 0 ? "" : ",").append("[\"C\",").append((int) text.charAt(i)).append(']');
		}
		return json.append(']').toString();
	}

	private static String command(String... words) {
		StringBuilder args = new StringBuilder("[");
		for (int i = 0; i < words.length; i++) {
			args.append(i == 0 ? "" : ",").append(word(words[i]));
		}
		return "[\"Command\",[1,[]," + args.append(']') + ",[]]]";
	}

	private Command translate(String json) {
		return adapter.toCommand(json(json));
	}

	@Test
	public void testSimpleCommand() {
		Simple simple = (Simple) translate(command("echo", "hi"));
		assertEquals(1, simple.getLine());
		assertEquals("echo hi", printer.print(simple));
	}

	@Test
	public void testAssignmentPromotion() {
		Simple simple = (Simple) translate(command("FOO=bar", "X=1", "env", "a=b"));
		assertEquals(2, simple.getAssignments().size());
		assertEquals("FOO", simple.getAssignments().get(0).getName());
		assertEquals("bar", simple.getAssignments().get(0).getValue().plainText());
		assertEquals(2, simple.getArguments().size());
		assertEquals("FOO=bar X=1 env a=b", printer.print(simple));
	}

	@Test
	public void testPipeFlattening() {
		String nested = "[\"Pipe\",[false,[" + command("a") + ",[\"Pipe\",[false,[" + command("b") + "," + command("c") + "]]]]]]";
		Pipe pipe = (Pipe) translate(nested);
		assertEquals(3, pipe.getItems().size());
		assertEquals("a | b | c", printer.print(pipe));
	}

	@Test
	public void testBackgroundPipeAndTextualBoolean() {
		Pipe pipe = (Pipe) translate("[\"Pipe\",[\"True\",[" + command("a") + "," + command("b") + "]]]");
		assertTrue(pipe.isBackground());
		assertEquals("a | b &", printer.print(pipe));
	}

	@Test
	public void testConnectivesAndSequences() {
		String json = "[\"Semi\",[[\"And\",[" + command("a") + ",[\"Not\"," + command("b") + "]]]," + command("c") + "]]";
		assertEquals("{ a; } && { ! { b; }; }\nc", printer.print(translate(json)));
	}

	@Test
	public void testCompoundCommands() {
		String function = "[\"Defun\",[2,\"f\",[\"Group\"," + command("a") + "]]]";
		assertEquals("f () {\na\n}", printer.print(translate(function)));

		String loop = "[\"For\",[3,[" + word("1") + "," + word("2") + "]," + command("a") + ",\"i\"]]";
		assertEquals("for i in 1 2; do\na\ndone", printer.print(translate(loop)));

		String choice = "[\"Case\",[4," + word("x") + ",[{\"cpattern\":[" + word("a") + "],\"cbody\":" + command("b")
				+ "},{\"cpattern\":[" + word("*") + "],\"cbody\":null}]]]";
		assertEquals("case x in a) b;; *) ;; esac", printer.print(translate(choice)));

		String conditional = "[\"If\",[" + command("t") + "," + command("a") + "," + command("b") + "]]";
		assertEquals("if t; then a; else b; fi", printer.print(translate(conditional)));
	}

	@Test
	public void testCharacters() {
		String chars = "[[\"E\",42],[\"T\",\"None\"],[\"T\",[\"Some\",\"bob\"]],[\"A\"," + word("1+1") + "],"
				+ "[\"V\",[\"Minus\",\"true\",\"x\"," + word("d") + "]],[\"Q\",[[\"C\",36],[\"C\",120]]],[\"B\"," + command("date") + "]]";
		String json = "[\"Command\",[null,[],[" + word("echo") + "," + chars + "],[]]]";
		assertEquals("echo \\*~~bob$((1+1))${x:-d}\"\\$x\"$(date)", printer.print(translate(json)));
	}

	@Test
	public void testRedirections() {
		String redirections = "[[\"File\",[\"To\",1," + word("out") + "]],"
				+ "[\"Dup\",[\"ToFD\",2," + word("1") + "]],"
				+ "[\"Dup\",[\"FromFD\",0," + word("-") + "]],"
				+ "[\"Heredoc\",[\"Here\",0," + word("x\n") + ",\"END\"]],"
				+ "[\"File\",[\"Append\",[\"var\"," + word("fd") + "]," + word("log") + "]]]";
		Simple simple = (Simple) translate("[\"Command\",[null,[],[" + word("cat") + "]," + redirections + "]]");
		DupRedir dup = (DupRedir) simple.getRedirections().get(1);
		assertTrue(dup.getTarget().isFixed());
		assertFalse(((DupRedir) simple.getRedirections().get(2)).getTarget().isFixed());
		assertEquals("END", ((HeredocRedir) simple.getRedirections().get(3)).getDelimiter());
		assertEquals("cat > out 2>&1 <&- <<'END' {fd}>> log\nx\nEND\n", printer.print(simple));
	}

	@Test
	public void testDupTarget() {
		assertEquals(12, ((FdTarget.Fixed) DashAdapter.dupTarget(Word.literal("12"))).getFd());
		assertFalse(DashAdapter.dupTarget(Word.literal("1234567890")).isFixed());
		assertFalse(DashAdapter.dupTarget(Word.EMPTY).isFixed());
	}

	@Test
	public void testUnsupportedTag() {
		try {
			translate("[\"Arith\",[1,[]]]");
			fail("A bash-only command was accepted");
		} catch (UnsupportedConstructException e) {
			assertEquals("Arith", e.getNodeKind());
		}
	}

	@Test(expected = UnsupportedConstructException.class)
	public void testReadingStringIsBashOnly() {
		translate("[\"Command\",[null,[],[" + word("cat") + "],[[\"File\",[\"ReadingString\",0," + word("x") + "]]]]]");
	}

	@Test(expected = InvalidRedirectionTargetException.class)
	public void testInvalidDescriptor() {
		translate("[\"Command\",[null,[],[" + word("cat") + "],[[\"File\",[\"To\",\"bogus\"," + word("out") + "]]]]]");
	}

	@Test
	public void testClosedDescriptor() {
		Simple simple = (Simple) translate("[\"Command\",[null,[],[" + word("cat") + "],[[\"SingleArg\",[\"CloseThis\",3]]]]]");
		SingleArgRedir close = (SingleArgRedir) simple.getRedirections().get(0);
		assertEquals(SingleArgRedir.Kind.CLOSE_THIS, close.getKind());
		assertEquals(3, ((FdTarget.Fixed) close.getFd()).getFd());
		assertEquals("cat 3>&-", printer.print(simple));
	}

	@Test
	public void testClosedDescriptorIsReadBack() {
		Simple original = redirected(cmd("cat"), new SingleArgRedir(SingleArgRedir.Kind.CLOSE_THIS, FdTarget.fixed(3)));
		JsonNode serialized = new JsonSerializer().toJson(original);
		Command readBack = adapter.toCommand(serialized);
		assertEquals(printer.print(original), printer.print(readBack));
		assertEquals(serialized, new JsonSerializer().toJson(readBack));
	}

	@Test(expected = UnsupportedConstructException.class)
	public void testBothOutputsRedirectionIsRejected() {
		translate("[\"Command\",[null,[],[" + word("cat") + "],[[\"SingleArg\",[\"ErrAndOut\",[\"var\"," + word("log") + "]]]]]]");
	}

	@Test(expected = UnsupportedConstructException.class)
	public void testUnknownCharacter() {
		translate("[\"Command\",[null,[],[[[\"Z\",1]]],[]]]");
	}

	@Test(expected = ShastaException.class)
	public void testMalformedTree() {
		translate("[\"Command\",[null,[]]]");
	}

	@Test(expected = ShastaException.class)
	public void testScriptMustBeAnArray() {
		adapter.toCommands(json("{\"Command\":1}"));
	}

	@Test
	public void testSerializedTreeIsReadBack() {
		String script = "[" + "[\"Background\",[null," + command("sleep", "1") + ",[]]],"
				+ "[\"While\",[[\"Not\"," + command("false") + "]," + command("a") + "]],"
				+ "[\"Subshell\",[5,[\"Or\",[" + command("a") + "," + command("b") + "]],[[\"File\",[\"From\",0," + word("in") + "]]]]],"
				+ "[\"Redir\",[null,[\"Group\"," + command("a") + "],[[\"Dup\",[\"ToFD\",2," + word("1") + ",true]]]]]"
				+ "]";
		List<Command> commands = adapter.toCommands(json(script));
		String printed = printer.print(commands);
		assertEquals("sleep 1 &\nuntil false; do a; done\n( { a; } || { b; } ) < in\n{ a; } 2>&1-", printed);

		JsonNode serialized = new JsonSerializer().toJson(commands);
		List<Command> readBack = adapter.toCommands(serialized);
		assertEquals(printed, printer.print(readBack));
		assertEquals(serialized, new JsonSerializer().toJson(readBack));
	}
}
