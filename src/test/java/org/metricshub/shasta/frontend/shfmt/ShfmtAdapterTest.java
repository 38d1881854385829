package org.metricshub.shasta.frontend.shfmt;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.json;
import static org.metricshub.shasta.ShastaTestSupport.jsonResource;
import static org.metricshub.shasta.ShastaTestSupport.resource;

import java.util.List;
import org.junit.Test;
import org.metricshub.shasta.InvalidRedirectionTargetException;
import org.metricshub.shasta.UnsupportedConstructException;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Defun;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.backend.ShellPrinter;

public class ShfmtAdapterTest {

	private static final String SCRIPT = "x=1 echo \"${x}\" ${y:-d} ${z/a/b} > out 2>&1\n"
			+ "a && b 2>&1 | c\n"
			+ "for i in \"${@}\"; do\nlet \"i += 1\"\ndone";

	private final ShfmtAdapter adapter = new ShfmtAdapter();
	private final ShellPrinter printer = new ShellPrinter();

	private static String quote(String text) {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + "\"";
	}

	private static String lit(String value) {
		return "{\"Type\":\"Lit\",\"Value\":" + quote(value) + "}";
	}

	private static String w(String value) {
		return "{\"Parts\":[" + lit(value) + "]}";
	}

	/** A word in a position where shfmt records its type. */
	private static String typed(String value) {
		return "{\"Type\":\"Word\",\"Parts\":[" + lit(value) + "]}";
	}

	private static String call(String... args) {
		StringBuilder json = new StringBuilder("{\"Type\":\"CallExpr\",\"Args\":[");
		for (int i = 0; i < args.length; i++) {
			json.append(i == 0 ? "" : ",").append(w(args[i]));
		}
		return json.append("]}").toString();
	}

	private static String stmt(String command) {
		return "{\"Cmd\":" + command + "}";
	}

	private static String redirected(String redirection) {
		return "{\"Cmd\":" + call("cat") + ",\"Redirs\":[" + redirection + "]}";
	}

	private String print(String json) {
		return printer.print(adapter.toCommand(json(json), null));
	}

	@Test
	public void testScriptWithSource() {
		List<Command> commands = adapter.toCommands(jsonResource("/shfmt/script.json"), resource("/shfmt/script.sh"));
		assertEquals(3, commands.size());
		assertEquals(1, ((Simple) commands.get(0)).getLine());
		assertEquals(SCRIPT, printer.print(commands));
	}

	@Test
	public void testScriptWithoutSource() {
		assertEquals(SCRIPT, printer.print(adapter.toCommands(jsonResource("/shfmt/script.json"), null)));
	}

	@Test
	public void testConditionals() {
		String json = "{\"Type\":\"IfClause\",\"Cond\":[" + stmt(call("a")) + "],\"Then\":[" + stmt(call("b")) + "],"
				+ "\"Else\":{\"Cond\":[" + stmt(call("c")) + "],\"Then\":[" + stmt(call("d")) + "],"
				+ "\"Else\":{\"Then\":[" + stmt(call("e")) + "]}}}";
		assertEquals("if a; then b; elif c; then d; else e; fi", print(json));
	}

	@Test
	public void testLoops() {
		String until = "{\"Type\":\"WhileClause\",\"Until\":true,\"Cond\":[" + stmt(call("t")) + "],\"Do\":[" + stmt(call("a")) + "]}";
		assertEquals("until t; do a; done", print(until));

		String select = "{\"Type\":\"ForClause\",\"Select\":true,\"Loop\":{\"Type\":\"WordIter\",\"Name\":{\"Value\":\"x\"},"
				+ "\"InPos\":{\"Line\":1},\"Items\":[" + w("a") + "," + w("b") + "]},\"Do\":[" + stmt(call("c")) + "]}";
		assertEquals("select x in a b; do\nc\ndone", print(select));

		String cStyle = "{\"Type\":\"ForClause\",\"Loop\":{\"Type\":\"CStyleLoop\","
				+ "\"Init\":{\"Type\":\"BinaryArithm\",\"Op\":74,\"X\":" + typed("i") + ",\"Y\":" + typed("0") + "},"
				+ "\"Cond\":{\"Type\":\"BinaryArithm\",\"Op\":56,\"X\":" + typed("i") + ",\"Y\":" + typed("3") + "},"
				+ "\"Post\":{\"Type\":\"UnaryArithm\",\"Op\":36,\"Post\":true,\"X\":" + typed("i") + "}},"
				+ "\"Do\":[" + stmt(call("a")) + "]}";
		assertEquals("for ((i = 0; i < 3; i++)); do a; done", print(cStyle));
	}

	@Test
	public void testArithmeticOperatorsDoNotMerge() {
		String json = "{\"Type\":\"ArithmCmd\",\"X\":{\"Type\":\"UnaryArithm\",\"Op\":70,"
				+ "\"X\":{\"Type\":\"UnaryArithm\",\"Op\":70,\"X\":" + typed("x") + "}}}";
		assertEquals("((- -x))", print(json));
	}

	@Test
	public void testCase() {
		String json = "{\"Type\":\"CaseClause\",\"Word\":" + w("x") + ",\"Items\":["
				+ "{\"Op\":33,\"Patterns\":[" + w("a") + "," + w("b") + "],\"Stmts\":[" + stmt(call("one")) + "]},"
				+ "{\"Op\":34,\"Patterns\":[" + w("c") + "],\"Stmts\":[" + stmt(call("two")) + "]},"
				+ "{\"Op\":33,\"Patterns\":[" + w("*") + "],\"Stmts\":[]}]}";
		assertEquals("case x in a|b) one;; c) two;& *) ;; esac", print(json));
	}

	@Test
	public void testCaseResumeIsUnsupported() {
		String json = "{\"Type\":\"CaseClause\",\"Word\":" + w("x") + ",\"Items\":["
				+ "{\"Op\":35,\"OpPos\":{\"Line\":4},\"Patterns\":[" + w("a") + "],\"Stmts\":[]}]}";
		try {
			print(json);
			fail(";;& was accepted");
		} catch (UnsupportedConstructException e) {
			assertEquals(";;&", e.getNodeKind());
			assertEquals(4, e.getLineNumber());
		}
	}

	@Test
	public void testTestClause() {
		String variable = "{\"Type\":\"Word\",\"Parts\":[{\"Type\":\"ParamExp\",\"Short\":true,\"Param\":" + lit("a") + "}]}";
		String json = "{\"Type\":\"TestClause\",\"Left\":{\"Line\":2},\"X\":{\"Type\":\"BinaryTest\",\"Op\":122,"
				+ "\"X\":{\"Type\":\"UnaryTest\",\"Op\":112,\"X\":{\"Type\":\"UnaryTest\",\"Op\":108,\"X\":" + variable + "}},"
				+ "\"Y\":{\"Type\":\"BinaryTest\",\"Op\":125,\"X\":" + typed("b") + ",\"Y\":" + typed("c") + "}}}";
		assertEquals("[[ ! -n ${a} && b == c ]]", print(json));

		String paren = "{\"Type\":\"TestClause\",\"X\":{\"Type\":\"ParenTest\",\"X\":" + typed("a") + "}}";
		assertEquals("[[ ( a ) ]]", print(paren));
	}

	@Test
	public void testFunctions() {
		String json = "{\"Type\":\"FuncDecl\",\"RsrvWord\":true,\"Position\":{\"Line\":7},\"Name\":{\"Value\":\"f\"},"
				+ "\"Body\":{\"Cmd\":{\"Type\":\"Block\",\"Stmts\":[" + stmt(call("a")) + "," + stmt(call("b")) + "]}}}";
		Defun function = (Defun) adapter.toCommand(json(json), null);
		assertEquals(7, function.getLine());
		assertEquals("function f () {\na\nb\n}", printer.print(function));
	}

	@Test
	public void testStatementFlags() {
		assertEquals("! a &", print("{\"Cmd\":" + call("a") + ",\"Negated\":true,\"Background\":true}"));
		assertEquals("", print("{\"Negated\":false}"));
	}

	@Test
	public void testCompoundCommands() {
		assertEquals("( a )", print("{\"Type\":\"Subshell\",\"Stmts\":[" + stmt(call("a")) + "]}"));
		assertEquals("time -p a", print("{\"Type\":\"TimeClause\",\"PosixFormat\":true,\"Stmt\":" + stmt(call("a")) + "}"));
		assertEquals("coproc cat", print("{\"Type\":\"CoprocClause\",\"Name\":" + w("worker") + ",\"Stmt\":" + stmt(call("cat")) + "}"));
		String pipeAll = "{\"Type\":\"BinaryCmd\",\"Op\":13,\"X\":" + stmt(call("a")) + ",\"Y\":" + stmt(call("b")) + "}";
		assertEquals("a 2>&1 | b", print(pipeAll));
	}

	@Test
	public void testAssignments() {
		String declaration = "{\"Type\":\"DeclClause\",\"Variant\":{\"Value\":\"local\"},\"Args\":["
				+ "{\"Naked\":true,\"Name\":{\"Value\":\"a\"}},{\"Name\":{\"Value\":\"b\"},\"Value\":" + w("1") + "}]}";
		assertEquals("local a b=1", print(declaration));

		String array = "{\"Type\":\"CallExpr\",\"Assigns\":[{\"Name\":{\"Value\":\"arr\"},\"Array\":{\"Elems\":["
				+ "{\"Value\":" + w("x") + "},{\"Index\":" + typed("1") + ",\"Value\":" + w("y") + "}]}}]}";
		assertEquals("arr=(x [1]=y)", print(array));

		String append = "{\"Type\":\"CallExpr\",\"Assigns\":[{\"Name\":{\"Value\":\"a\"},\"Append\":true,"
				+ "\"Index\":" + typed("2") + ",\"Value\":" + w("v") + "}],\"Args\":[" + w("env") + "]}";
		Simple simple = (Simple) adapter.toCommand(json(append), null);
		assertEquals("a[2]+", simple.getAssignments().get(0).getName());
		assertEquals("a[2]+=v env", printer.print(simple));
	}

	@Test
	public void testWordParts() {
		String parts = "{\"Type\":\"CallExpr\",\"Args\":["
				+ "{\"Parts\":[{\"Type\":\"SglQuoted\",\"Dollar\":true,\"Value\":\"a b\"}]},"
				+ "{\"Parts\":[{\"Type\":\"DblQuoted\",\"Dollar\":true,\"Parts\":[" + lit("x") + "]}]},"
				+ "{\"Parts\":[{\"Type\":\"ArithmExp\",\"X\":{\"Type\":\"BinaryArithm\",\"Op\":68,\"X\":" + typed("1") + ",\"Y\":" + typed("2") + "}}]},"
				+ "{\"Parts\":[{\"Type\":\"CmdSubst\",\"Stmts\":[" + stmt("{\"Type\":\"Subshell\",\"Stmts\":[" + stmt(call("a")) + "]}") + "]}]},"
				+ "{\"Parts\":[{\"Type\":\"BraceExp\",\"Elems\":[" + w("a") + "," + w("b") + "]}]},"
				+ "{\"Parts\":[{\"Type\":\"BraceExp\",\"Sequence\":true,\"Elems\":[" + w("1") + "," + w("3") + "]}]},"
				+ "{\"Parts\":[{\"Type\":\"ExtGlob\",\"Op\":123,\"Pattern\":{\"Value\":\"x\"}}]},"
				+ "{\"Parts\":[{\"Type\":\"ProcSubst\",\"Op\":66,\"Stmts\":[" + stmt(call("a")) + "]}]},"
				+ "{\"Parts\":[{\"Type\":\"ParamExp\",\"Names\":38,\"Param\":" + lit("x") + "}]},"
				+ "{\"Parts\":[{\"Type\":\"ParamExp\",\"Length\":true,\"Param\":" + lit("x") + "}]}"
				+ "]}";
		assertEquals("$'a b' $\"x\" $((1 + 2)) $( ( a ) ) {a,b} {1..3} *(x) <(a) ${!x*} ${#x}", print(parts));
	}

	@Test(expected = UnsupportedConstructException.class)
	public void testNestedParameterIsUnsupported() {
		print("{\"Type\":\"CallExpr\",\"Args\":[{\"Parts\":[{\"Type\":\"ParamExp\",\"NestedParam\":{\"Type\":\"ParamExp\"}}]}]}");
	}

	@Test
	public void testRedirections() {
		assertEquals("cat <<'EOF'\nhello $x\nEOF\n", print(redirected(
				"{\"Op\":64,\"Word\":{\"Parts\":[{\"Type\":\"SglQuoted\",\"Value\":\"EOF\"}]},\"Hdoc\":" + w("hello $x\n") + "}")));
		assertEquals("cat <<-END\n\tx\nEND\n", print(redirected(
				"{\"Op\":65,\"Word\":" + w("END") + ",\"Hdoc\":" + w("\tx\n") + "}")));
		assertEquals("cat 3>&-", print(redirected("{\"Op\":59,\"N\":{\"Value\":\"3\"},\"Word\":" + w("-") + "}")));
		assertEquals("cat <&5-", print(redirected("{\"Op\":58,\"Word\":" + w("5-") + "}")));
		assertEquals("cat {fd}> x", print(redirected("{\"Op\":54,\"N\":{\"Value\":\"{fd}\"},\"Word\":" + w("x") + "}")));
		assertEquals("cat &>> log", print(redirected("{\"Op\":70,\"Word\":" + w("log") + "}")));
		assertEquals("cat <<< x", print(redirected("{\"Op\":66,\"Word\":" + w("x") + "}")));
	}

	@Test(expected = InvalidRedirectionTargetException.class)
	public void testMissingOperand() {
		print(redirected("{\"Op\":54}"));
	}

	@Test(expected = UnsupportedConstructException.class)
	public void testUnknownCommand() {
		print("{\"Type\":\"TestDecl\"}");
	}
}
