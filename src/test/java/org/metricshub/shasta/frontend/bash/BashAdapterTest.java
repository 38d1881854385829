package org.metricshub.shasta.frontend.bash;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.metricshub.shasta.InvalidRedirectionTargetException;
import org.metricshub.shasta.ShastaException;
import org.metricshub.shasta.UnsupportedConstructException;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Defun;
import org.metricshub.shasta.ast.Literal;
import org.metricshub.shasta.ast.Pipe;
import org.metricshub.shasta.ast.Semi;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.While;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.backend.ShellPrinter;
import org.metricshub.shasta.frontend.bash.model.BashCommand;
import org.metricshub.shasta.frontend.bash.model.CaseCom;
import org.metricshub.shasta.frontend.bash.model.CommandFlag;
import org.metricshub.shasta.frontend.bash.model.CommandType;
import org.metricshub.shasta.frontend.bash.model.CommandValue;
import org.metricshub.shasta.frontend.bash.model.CondCom;
import org.metricshub.shasta.frontend.bash.model.CondType;
import org.metricshub.shasta.frontend.bash.model.Connection;
import org.metricshub.shasta.frontend.bash.model.ConnectionType;
import org.metricshub.shasta.frontend.bash.model.FunctionDef;
import org.metricshub.shasta.frontend.bash.model.GroupCom;
import org.metricshub.shasta.frontend.bash.model.Pattern;
import org.metricshub.shasta.frontend.bash.model.PatternFlag;
import org.metricshub.shasta.frontend.bash.model.RInstruction;
import org.metricshub.shasta.frontend.bash.model.Redirect;
import org.metricshub.shasta.frontend.bash.model.RedirectFlag;
import org.metricshub.shasta.frontend.bash.model.Redirectee;
import org.metricshub.shasta.frontend.bash.model.SimpleCom;
import org.metricshub.shasta.frontend.bash.model.WhileCom;
import org.metricshub.shasta.frontend.bash.model.WordDesc;
import org.metricshub.shasta.frontend.bash.model.WordDescFlag;

public class BashAdapterTest {

	private final BashAdapter adapter = new BashAdapter();
	private final ShellPrinter printer = new ShellPrinter();

	private static BashCommand command(CommandType type, CommandValue value, CommandFlag... flags) {
		return command(type, value, Collections.<Redirect>emptyList(), flags);
	}

	private static BashCommand command(CommandType type, CommandValue value, List<Redirect> redirects, CommandFlag... flags) {
		Set<CommandFlag> set = EnumSet.noneOf(CommandFlag.class);
		Collections.addAll(set, flags);
		return new BashCommand(type, set, 1, redirects, value);
	}

	private static BashCommand simple(String... words) {
		return simple(Collections.<Redirect>emptyList(), words);
	}

	private static BashCommand simple(List<Redirect> redirects, String... words) {
		List<WordDesc> descs = new ArrayList<>();
		for (String word : words) {
			descs.add(WordDesc.of(word));
		}
		return command(CommandType.CM_SIMPLE, new SimpleCom(1, descs, redirects));
	}

	private static BashCommand connect(BashCommand first, BashCommand second, ConnectionType type) {
		return command(CommandType.CM_CONNECTION, new Connection(first, second, type));
	}

	private static Redirect redirect(int fd, RInstruction instruction, String target) {
		return new Redirect(Redirectee.dest(fd), EnumSet.noneOf(RedirectFlag.class), instruction,
				target == null ? null : Redirectee.filename(WordDesc.of(target)), null);
	}

	private String print(BashCommand command) {
		return printer.print(adapter.toCommand(command));
	}

	@Test
	public void testLeadingAssignmentsArePromoted() {
		List<WordDesc> words = Arrays.asList(
				WordDesc.of("A=1", WordDescFlag.W_ASSIGNMENT),
				WordDesc.of("env"),
				WordDesc.of("B=2", WordDescFlag.W_ASSIGNMENT));
		Simple simple = (Simple) adapter.toCommand(command(CommandType.CM_SIMPLE, new SimpleCom(3, words, Collections.<Redirect>emptyList())));
		assertEquals(1, simple.getAssignments().size());
		assertEquals("A", simple.getAssignments().get(0).getName());
		assertEquals(2, simple.getArguments().size());
		assertEquals(3, simple.getLine());
		assertEquals("A=1 env B=2", printer.print(simple));
	}

	@Test
	public void testDeclarationArgumentsStayWords() {
		List<WordDesc> words = Collections.singletonList(WordDesc.of("x=1", WordDescFlag.W_ASSIGNMENT, WordDescFlag.W_ASSIGNARG));
		Simple simple = (Simple) adapter.toCommand(command(CommandType.CM_SIMPLE, new SimpleCom(1, words, Collections.<Redirect>emptyList())));
		assertTrue(simple.getAssignments().isEmpty());
		assertEquals(1, simple.getArguments().size());
	}

	@Test
	public void testWordsAreVerbatim() {
		assertEquals("echo $HOME \"$x\"", print(simple("echo", "$HOME", "\"$x\"")));
	}

	@Test
	public void testUndecodableBytesAreKept() {
		WordDesc word = new WordDesc(new byte[] { 'a', (byte) 0xff }, EnumSet.noneOf(WordDescFlag.class));
		Simple simple = (Simple) adapter.toCommand(command(CommandType.CM_SIMPLE,
				new SimpleCom(1, Collections.singletonList(word), Collections.<Redirect>emptyList())));
		Word printed = simple.getArguments().get(0);
		assertEquals(2, printed.size());
		Literal raw = (Literal) printed.get(1);
		assertEquals(0xff, raw.getCodePoint());
		assertTrue(raw.isVerbatim());
	}

	@Test
	public void testMissingLine() {
		BashCommand command = new BashCommand(CommandType.CM_SIMPLE, EnumSet.noneOf(CommandFlag.class), 0,
				Collections.<Redirect>emptyList(), new SimpleCom(0, Collections.singletonList(WordDesc.of("a")), Collections.<Redirect>emptyList()));
		assertEquals(AstNode.NO_LINE, ((Simple) adapter.toCommand(command)).getLine());
	}

	@Test
	public void testFlags() {
		BashCommand inverted = command(CommandType.CM_SIMPLE, new SimpleCom(1, Collections.singletonList(WordDesc.of("a")),
				Collections.<Redirect>emptyList()), CommandFlag.CMD_INVERT_RETURN);
		assertEquals("! a", print(inverted));

		BashCommand timed = command(CommandType.CM_SIMPLE, new SimpleCom(1, Collections.singletonList(WordDesc.of("a")),
				Collections.<Redirect>emptyList()), CommandFlag.CMD_INVERT_RETURN, CommandFlag.CMD_TIME_PIPELINE, CommandFlag.CMD_TIME_POSIX);
		assertEquals("time -p ! a", print(timed));

		BashCommand connective = command(CommandType.CM_CONNECTION,
				new Connection(simple("a"), simple("b"), ConnectionType.AND_AND), CommandFlag.CMD_INVERT_RETURN);
		assertEquals("! { a && b; }", print(connective));
	}

	@Test
	public void testConnections() {
		assertEquals("a && b || c", print(connect(connect(simple("a"), simple("b"), ConnectionType.AND_AND), simple("c"), ConnectionType.OR_OR)));
		assertEquals("{ a; } && { b || c; }", print(connect(simple("a"), connect(simple("b"), simple("c"), ConnectionType.OR_OR), ConnectionType.AND_AND)));

		Pipe pipe = (Pipe) adapter.toCommand(connect(simple("a"), connect(simple("b"), simple("c"), ConnectionType.PIPE), ConnectionType.PIPE));
		assertEquals(3, pipe.getItems().size());

		assertEquals("a\nb", print(connect(simple("a"), simple("b"), ConnectionType.SEMICOLON)));
		assertEquals("a", print(connect(simple("a"), null, ConnectionType.NEWLINE)));
	}

	@Test
	public void testAsynchronousLists() {
		Background background = (Background) adapter.toCommand(connect(simple("a"), simple("b"), ConnectionType.AMPERSAND));
		assertNotNull(background.getTail());
		assertEquals("a & b", printer.print(background));
		assertEquals("a &", print(connect(simple("a"), null, ConnectionType.AMPERSAND)));

		BashCommand redirected = command(CommandType.CM_CONNECTION, new Connection(simple("a"), null, ConnectionType.AMPERSAND),
				Collections.singletonList(redirect(1, RInstruction.R_OUTPUT_DIRECTION, "log")));
		assertEquals("a > log &", print(redirected));
	}

	@Test
	public void testSemicolonsInsideFunctions() {
		BashCommand body = command(CommandType.CM_GROUP, new GroupCom(connect(simple("a"), simple("b"), ConnectionType.SEMICOLON)));
		Defun function = (Defun) adapter.toCommand(command(CommandType.CM_FUNCTION_DEF, new FunctionDef(2, WordDesc.of("f"), body, "script.sh")));
		assertTrue(function.isBashStyle());
		assertTrue(((Semi) function.getBody()).isExplicitSemicolon());
		assertEquals("function f () {\na ; b\n}", printer.print(function));
	}

	@Test
	public void testUntil() {
		While loop = (While) adapter.toCommand(command(CommandType.CM_UNTIL, new WhileCom(simple("t"), simple("a"))));
		assertEquals("until t; do a; done", printer.print(loop));
	}

	@Test
	public void testRedirections() {
		Redirect heredoc = new Redirect(Redirectee.dest(0), EnumSet.noneOf(RedirectFlag.class), RInstruction.R_READING_UNTIL,
				Redirectee.filename(WordDesc.of("hi $x\n")), "'EOF'");
		Redirect variable = new Redirect(Redirectee.filename(WordDesc.of("fd")), EnumSet.of(RedirectFlag.REDIR_VARASSIGN),
				RInstruction.R_OUTPUT_DIRECTION, Redirectee.filename(WordDesc.of("x")), null);
		List<Redirect> redirects = Arrays.asList(
				redirect(1, RInstruction.R_OUTPUT_DIRECTION, "out"),
				new Redirect(Redirectee.dest(2), EnumSet.noneOf(RedirectFlag.class), RInstruction.R_DUPLICATING_OUTPUT, Redirectee.dest(1), null),
				new Redirect(Redirectee.dest(3), EnumSet.noneOf(RedirectFlag.class), RInstruction.R_CLOSE_THIS, null, null),
				redirect(1, RInstruction.R_ERR_AND_OUT, "log"),
				variable,
				heredoc);
		assertEquals("cat > out 2>&1 3>&- &> log {fd}> x <<'EOF'\nhi $x\nEOF\n", print(simple(redirects, "cat")));
	}

	@Test
	public void testCompoundRedirections() {
		BashCommand group = command(CommandType.CM_GROUP, new GroupCom(connect(simple("a"), simple("b"), ConnectionType.AND_AND)),
				Collections.singletonList(redirect(1, RInstruction.R_APPENDING_TO, "log")));
		assertEquals("{ a && b; } >> log", print(group));
	}

	@Test(expected = InvalidRedirectionTargetException.class)
	public void testMissingOperand() {
		print(simple(Collections.singletonList(redirect(1, RInstruction.R_OUTPUT_DIRECTION, null)), "a"));
	}

	@Test(expected = InvalidRedirectionTargetException.class)
	public void testMissingDescriptor() {
		Redirect redirect = new Redirect(null, EnumSet.noneOf(RedirectFlag.class), RInstruction.R_INPUT_DIRECTION,
				Redirectee.filename(WordDesc.of("in")), null);
		print(simple(Collections.singletonList(redirect), "a"));
	}

	@Test
	public void testConditionals() {
		CondCom a = new CondCom(EnumSet.noneOf(CommandFlag.class), 1, CondType.COND_TERM, WordDesc.of("a"), null, null);
		CondCom b = new CondCom(EnumSet.noneOf(CommandFlag.class), 1, CondType.COND_TERM, WordDesc.of("b"), null, null);
		CondCom equal = new CondCom(EnumSet.of(CommandFlag.CMD_INVERT_RETURN), 1, CondType.COND_BINARY, WordDesc.of("=="), a, b);
		assertEquals("[[ ! a == b ]]", print(command(CommandType.CM_COND, equal)));

		CondCom incomplete = new CondCom(EnumSet.noneOf(CommandFlag.class), 4, CondType.COND_BINARY, WordDesc.of("=="), a, null);
		try {
			print(command(CommandType.CM_COND, incomplete));
			fail("An incomplete conditional was accepted");
		} catch (ShastaException e) {
			assertEquals(4, e.getLineNumber());
		}
	}

	@Test
	public void testCase() {
		List<Pattern> clauses = Arrays.asList(
				new Pattern(Arrays.asList(WordDesc.of("a"), WordDesc.of("b")), simple("one"), EnumSet.of(PatternFlag.CASEPAT_FALLTHROUGH)),
				new Pattern(Collections.singletonList(WordDesc.of("*")), null, EnumSet.noneOf(PatternFlag.class)));
		assertEquals("case $x in a|b) one;& *) ;; esac", print(command(CommandType.CM_CASE, new CaseCom(1, WordDesc.of("$x"), clauses))));
	}

	@Test
	public void testTestNextIsUnsupported() {
		List<Pattern> clauses = Collections.singletonList(
				new Pattern(Collections.singletonList(WordDesc.of("a")), simple("one"), EnumSet.of(PatternFlag.CASEPAT_TESTNEXT)));
		try {
			print(command(CommandType.CM_CASE, new CaseCom(6, WordDesc.of("x"), clauses)));
			fail(";;& was accepted");
		} catch (UnsupportedConstructException e) {
			assertEquals(";;&", e.getNodeKind());
			assertEquals(6, e.getLineNumber());
		}
	}

	@Test
	public void testScript() {
		List<Command> commands = adapter.toCommands(Arrays.asList(simple("a"), simple("b")));
		assertEquals("a\nb", printer.print(commands));
	}
}
