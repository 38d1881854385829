package org.metricshub.shasta.backend;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.cmd;
import static org.metricshub.shasta.ShastaTestSupport.printTest;
import static org.metricshub.shasta.ShastaTestSupport.redirected;
import static org.metricshub.shasta.ShastaTestSupport.to;
import static org.metricshub.shasta.ShastaTestSupport.w;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.Arith;
import org.metricshub.shasta.ast.ArithFor;
import org.metricshub.shasta.ast.ArithSub;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Case;
import org.metricshub.shasta.ast.CmdSub;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Cond;
import org.metricshub.shasta.ast.Coproc;
import org.metricshub.shasta.ast.Defun;
import org.metricshub.shasta.ast.DupRedir;
import org.metricshub.shasta.ast.Escaped;
import org.metricshub.shasta.ast.FdTarget;
import org.metricshub.shasta.ast.FileRedir;
import org.metricshub.shasta.ast.For;
import org.metricshub.shasta.ast.Group;
import org.metricshub.shasta.ast.HeredocRedir;
import org.metricshub.shasta.ast.If;
import org.metricshub.shasta.ast.Literal;
import org.metricshub.shasta.ast.Not;
import org.metricshub.shasta.ast.Or;
import org.metricshub.shasta.ast.Pipe;
import org.metricshub.shasta.ast.Quoted;
import org.metricshub.shasta.ast.Redir;
import org.metricshub.shasta.ast.RedirectionNode;
import org.metricshub.shasta.ast.Select;
import org.metricshub.shasta.ast.Semi;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.SingleArgRedir;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.Time;
import org.metricshub.shasta.ast.VarExpand;
import org.metricshub.shasta.ast.While;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.util.ShastaSettings;

public class ShellPrinterTest {

	private final ShellPrinter printer = new ShellPrinter();

	private static HeredocRedir heredoc(String body, String delimiter) {
		return new HeredocRedir(HeredocRedir.Kind.XHERE, FdTarget.fixed(0), w(body), false, delimiter);
	}

	private static Word var(String name) {
		return Word.of(new VarExpand(VarExpand.Format.NORMAL, false, name, Word.EMPTY));
	}

	@Test
	public void testSimpleCommand() {
		Simple echo = new Simple(-1, Collections.<AssignNode>emptyList(),
				Arrays.asList(w("echo"), Word.of(new Literal('a'), new Escaped(' '), new Literal('b'))),
				Collections.<RedirectionNode>emptyList());
		printTest("escaped blank").command(echo).expect("echo a\\ b").roundTrip().runTest();
	}

	@Test
	public void testAssignments() {
		Simple env = new Simple(-1, Collections.singletonList(new AssignNode("FOO", w("bar"))),
				Collections.singletonList(w("env")), Collections.<RedirectionNode>emptyList());
		printTest("assignment").command(env).expect("FOO=bar env").roundTrip().runTest();
	}

	@Test
	public void testEmptyCommand() {
		assertEquals("", printer.print(Simple.empty()));
	}

	@Test
	public void testPipeline() {
		printTest("pipeline")
				.command(new Pipe(false, Arrays.asList(cmd("ls"), cmd("wc", "-l"))))
				.expect("ls | wc -l")
				.roundTrip()
				.runTest();
	}

	@Test
	public void testConnectivesBraceOperands() {
		printTest("braced operands").command(new And(cmd("a"), cmd("b"))).expect("{ a; } && { b; }").roundTrip().runTest();
		printTest("braced or").command(new Or(cmd("a"), cmd("b"))).expect("{ a; } || { b; }").roundTrip().runTest();
	}

	@Test
	public void testConnectivesWithoutBraces() {
		Command chain = new Or(new And(cmd("a"), cmd("b"), true), cmd("c"), true);
		assertEquals("a && b || c", printer.print(chain));
	}

	@Test
	public void testSequences() {
		assertEquals("a\nb", printer.print(new Semi(cmd("a"), cmd("b"))));
		assertEquals("a ; b", printer.print(new Semi(cmd("a"), cmd("b"), true)));
	}

	@Test
	public void testListInOperandPositionIsBraced() {
		Command and = new And(new Semi(cmd("a"), cmd("b"), true), cmd("c"), true);
		assertEquals("{ a ; b; } && c", printer.print(and));
	}

	@Test
	public void testBackground() {
		Background sleep = new Background(-1, cmd("sleep", "1"), Collections.<RedirectionNode>emptyList());
		printTest("background").command(sleep).expect("sleep 1 &").roundTrip().runTest();
		assertEquals("{ sleep 1 & } && b", printer.print(new And(sleep, cmd("b"), true)));
		// no semicolon may follow the ampersand
		assertEquals("sleep 1 & b", printer.print(new Semi(sleep, cmd("b"), true)));
	}

	@Test
	public void testBackgroundTail() {
		Background sleep = new Background(-1, cmd("sleep", "1"), Collections.<RedirectionNode>emptyList(), cmd("echo", "done"));
		printTest("background with tail").command(sleep).expect("sleep 1 & echo done").roundTrip().runTest();
	}

	@Test
	public void testBackgroundPipeline() {
		Pipe pipe = new Pipe(true, Arrays.asList(cmd("a"), cmd("b")));
		assertEquals("a | b &", printer.print(pipe));
		assertEquals("{ a | b & } || c", printer.print(new Or(pipe, cmd("c"), true)));
	}

	@Test
	public void testNot() {
		printTest("negation").command(new Not(cmd("a"))).expect("! { a; }").roundTrip().runTest();
		assertEquals("! a", printer.print(new Not(cmd("a"), true)));
	}

	@Test
	public void testSubshell() {
		Subshell subshell = new Subshell(-1, new Semi(cmd("cd", "/tmp"), cmd("ls")), Collections.singletonList(to("out")));
		printTest("subshell").command(subshell).expect("( cd /tmp\nls ) > out").roundTrip().runTest();
	}

	@Test
	public void testRedirectedCompoundIsGrouped() {
		Redir redir = new Redir(-1, new And(cmd("a"), cmd("b"), true), Collections.singletonList(to("out")));
		assertEquals("{ a && b; } > out", printer.print(redir));
		Redir loop = new Redir(-1, new While(cmd("true"), cmd("a")), Collections.singletonList(to("out")));
		assertEquals("while true; do a; done > out", printer.print(loop));
	}

	@Test
	public void testIf() {
		printTest("if").command(new If(cmd("true"), cmd("a"), null)).expect("if true; then a; fi").roundTrip().runTest();
		If chain = new If(cmd("c1"), cmd("a"), new If(cmd("c2"), cmd("b"), cmd("c")));
		printTest("elif").command(chain).expect("if c1; then a; elif c2; then b; else c; fi").roundTrip().runTest();
	}

	@Test
	public void testWhileAndUntil() {
		printTest("while").command(new While(cmd("true"), cmd("a"))).expect("while true; do a; done").roundTrip().runTest();
		printTest("until").command(new While(new Not(cmd("false")), cmd("a"))).expect("until false; do a; done").roundTrip().runTest();
	}

	@Test
	public void testCase() {
		Case choice = new Case(-1, w("x"), Arrays.asList(
				new Case.Clause(Arrays.asList(w("a"), w("b")), cmd("one"), false),
				new Case.Clause(Collections.singletonList(w("c")), cmd("two"), true),
				new Case.Clause(Collections.singletonList(w("*")), null, false)));
		printTest("case").command(choice).expect("case x in a|b) one;; c) two;& *) ;; esac").roundTrip().runTest();
	}

	@Test
	public void testCasePatternNamedEsac() {
		Case choice = new Case(-1, w("x"), Collections.singletonList(
				new Case.Clause(Collections.singletonList(w("esac")), cmd("a"), false)));
		assertEquals("case x in (esac) a;; esac", printer.print(choice));
	}

	@Test
	public void testFunctions() {
		printTest("posix function").command(new Defun(-1, w("f"), new Group(cmd("a")), false)).expect("f () {\na\n}").roundTrip().runTest();
		assertEquals("function f () {\na\n}", printer.print(new Defun(-1, w("f"), cmd("a"), true)));
	}

	@Test
	public void testLoops() {
		For loop = new For(-1, w("i"), Arrays.asList(w("1"), w("2")),
				new Simple(-1, Collections.<AssignNode>emptyList(), Arrays.asList(w("echo"), var("i")), Collections.<RedirectionNode>emptyList()));
		printTest("for").command(loop).expect("for i in 1 2; do\necho ${i}\ndone").roundTrip().runTest();
		Select select = new Select(-1, w("i"), Collections.singletonList(w("x")), cmd("a"));
		assertEquals("select i in x; do\na\ndone", printer.print(select));
		ArithFor arithFor = new ArithFor(-1, Collections.singletonList(w("i=0")), Collections.singletonList(w("i<3")),
				Collections.singletonList(w("i++")), cmd("a"));
		assertEquals("for ((i=0; i<3; i++)); do a; done", printer.print(arithFor));
	}

	@Test
	public void testExpansions() {
		Word word = Word.of(
				new Quoted(w("a b")),
				new VarExpand(VarExpand.Format.MINUS, true, "x", w("d")),
				new VarExpand(VarExpand.Format.LENGTH, false, "y", Word.EMPTY),
				new ArithSub(w("1+2")),
				new CmdSub(cmd("date")));
		assertEquals("\"a b\"${x:-d}${#y}$((1+2))$(date)", printer.print(word, QuoteMode.UNQUOTED));
	}

	@Test
	public void testCommandSubstitutionOfSubshell() {
		Word word = Word.of(new CmdSub(new Subshell(-1, cmd("a"), Collections.<RedirectionNode>emptyList())));
		assertEquals("$( ( a ) )", printer.print(word, QuoteMode.UNQUOTED));
	}

	@Test
	public void testDollarBeforeText() {
		Simple echo = cmd("echo", "$HOME");
		assertEquals("echo \\$HOME", printer.print(echo));
		assertEquals("echo $", printer.print(cmd("echo", "$")));
	}

	@Test
	public void testRedirections() {
		Simple command = redirected(cmd("a"),
				to("out"),
				new FileRedir(FileRedir.Kind.TO, FdTarget.fixed(2), w("err")),
				new FileRedir(FileRedir.Kind.APPEND, FdTarget.fixed(1), w("log")),
				new FileRedir(FileRedir.Kind.FROM, FdTarget.fixed(0), w("in")),
				new DupRedir(DupRedir.Kind.TO_FD, FdTarget.fixed(2), FdTarget.fixed(1)),
				new DupRedir(DupRedir.Kind.FROM_FD, FdTarget.fixed(0), FdTarget.fixed(3), true));
		printTest("redirections").command(command).expect("a > out 2> err >> log < in 2>&1 <&3-").roundTrip().runTest();
	}

	@Test
	public void testBashRedirections() {
		Simple command = redirected(cmd("a"),
				new FileRedir(FileRedir.Kind.TO, FdTarget.named(w("fd")), w("out")),
				new SingleArgRedir(SingleArgRedir.Kind.CLOSE_THIS, FdTarget.fixed(1)),
				new SingleArgRedir(SingleArgRedir.Kind.ERR_AND_OUT, FdTarget.named(w("all"))),
				new FileRedir(FileRedir.Kind.READING_STRING, FdTarget.fixed(0), w("text")));
		assertEquals("a {fd}> out 1>&- &> all <<< text", printer.print(command));
	}

	@Test
	public void testHeredoc() {
		Simple cat = redirected(cmd("cat"), heredoc("hello\n", null));
		assertEquals("cat <<EOF\nhello\nEOF\n", printer.print(Collections.singletonList(cat)));
	}

	@Test
	public void testHeredocBodyAfterWholeLine() {
		Pipe pipe = new Pipe(false, Arrays.asList(redirected(cmd("cat"), heredoc("x\n", null)), cmd("wc")));
		printTest("heredoc in a pipeline")
				.command(pipe)
				.command(cmd("echo", "next"))
				.expect("cat <<EOF | wc\nx\nEOF\necho next")
				.roundTrip()
				.runTest();
	}

	@Test
	public void testTwoHeredocsOnOneLine() {
		Simple cat = redirected(cmd("cat"), heredoc("a\n", "A"), heredoc("b\n", "B"));
		String printed = printTest("two heredocs")
				.command(cat)
				.expect("cat <<A <<B\nb\nB\na\nA\n")
				.roundTrip()
				.runTest();
		assertTrue(printed.startsWith("cat <<A <<B\n"));
	}

	@Test
	public void testLiteralHeredoc() {
		HeredocRedir literal = new HeredocRedir(HeredocRedir.Kind.HERE, FdTarget.fixed(0), w("$HOME `x`\n"), false, "END");
		assertEquals("cat <<'END'\n$HOME `x`\nEND\n", printer.print(Collections.singletonList(redirected(cmd("cat"), literal))));
	}

	@Test
	public void testHeredocOptions() {
		HeredocRedir stripped = new HeredocRedir(HeredocRedir.Kind.XHERE, FdTarget.fixed(3), w("\tx\n"), true, null);
		assertEquals("cat 3<<-EOF\n\tx\nEOF\n", printer.print(Collections.singletonList(redirected(cmd("cat"), stripped))));
		HeredocRedir empty = new HeredocRedir(HeredocRedir.Kind.XHERE, FdTarget.fixed(0), Word.EMPTY, false, null);
		assertEquals("cat <<EOF\nEOF\n", printer.print(Collections.singletonList(redirected(cmd("cat"), empty))));
	}

	@Test
	public void testHeredocInsideFunctionIsFlushedBeforeBrace() {
		Defun f = new Defun(-1, w("f"), redirected(cmd("cat"), heredoc("x\n", null)), false);
		assertEquals("f () {\ncat <<EOF\nx\nEOF\n}", printer.print(f));
	}

	@Test
	public void testFreshMarker() {
		assertEquals("EOF", printer.freshMarker("a\n", false));
		assertEquals("EOFF", printer.freshMarker("EOF\n", false));
		assertEquals("EOFFF", printer.freshMarker("EOF\nEOFF\n", false));
		assertEquals("EOF", printer.freshMarker("\tEOF\n", false));
		assertEquals("EOFF", printer.freshMarker("\tEOF\n", true));
	}

	@Test
	public void testConfiguredMarker() {
		ShastaSettings settings = new ShastaSettings();
		settings.setHeredocMarker("END");
		Simple cat = redirected(cmd("cat"), heredoc("x\n", null));
		assertEquals("cat <<END\nx\nEND\n", new ShellPrinter(settings).print(Collections.singletonList(cat)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidMarker() {
		new ShastaSettings().setHeredocMarker("E OF");
	}

	@Test
	public void testBashCommands() {
		Cond cond = new Cond(-1, Cond.Kind.BINARY, w("=="), Cond.term(w("a")), Cond.term(w("b")), false);
		assertEquals("[[ a == b ]]", printer.print(cond));
		assertEquals("[[ ! a == b ]]", printer.print(cond.negated()));
		Cond unary = new Cond(-1, Cond.Kind.UNARY, w("-f"), Cond.term(w("x")), null, false);
		Cond both = new Cond(-1, Cond.Kind.AND, null, unary, new Cond(-1, Cond.Kind.EXPR, null, cond, null, false), false);
		assertEquals("[[ -f x && ( a == b ) ]]", printer.print(both));
		assertEquals("((x++))", printer.print(new Arith(-1, Collections.singletonList(w("x++")))));
		assertEquals("time -p a | b", printer.print(new Time(true, new Pipe(false, Arrays.asList(cmd("a"), cmd("b"))))));
		assertEquals("time { a && b; }", printer.print(new Time(false, new And(cmd("a"), cmd("b"), true))));
		assertEquals("coproc C { a; }", printer.print(new Coproc(w("C"), new Group(cmd("a")))));
		assertEquals("coproc a", printer.print(new Coproc(Word.EMPTY, cmd("a"))));
	}

	@Test
	public void testDeepSequence() {
		List<Command> statements = new ArrayList<>();
		for (int i = 0; i < 20_000; i++) {
			statements.add(cmd("echo", Integer.toString(i)));
		}
		String printed = printer.print(Semi.sequence(statements));
		String[] lines = printed.split("\n");
		assertEquals(20_000, lines.length);
		assertEquals("echo 0", lines[0]);
		assertEquals("echo 19999", lines[19_999]);
	}

	@Test
	public void testDeepNesting() {
		int depth = 10_000;
		Command nested = cmd("a");
		for (int i = 0; i < depth; i++) {
			nested = new Subshell(-1, nested, Collections.<RedirectionNode>emptyList());
		}
		String printed = printer.print(nested);
		assertTrue(printed.startsWith("( ( ( "));
		assertTrue(printed.endsWith(" ) ) )"));
		assertEquals(depth * 4 + 1, printed.length());

		Command chain = cmd("a");
		for (int i = 0; i < depth; i++) {
			chain = new And(chain, cmd("a"), true);
		}
		assertEquals(depth * 5 + 1, printer.print(chain).length());
	}

	@Test
	public void testPrintCharacterAndAssignment() {
		assertEquals("\\*", printer.print(new Escaped('*')));
		assertEquals("X=1", printer.print(new AssignNode("X", w("1"))));
		assertEquals("2>&1", printer.print(new DupRedir(DupRedir.Kind.TO_FD, FdTarget.fixed(2), FdTarget.fixed(1))));
	}
}
