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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.metricshub.shasta.InvalidRedirectionTargetException;
import org.metricshub.shasta.UnsupportedConstructException;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.ArgChar;
import org.metricshub.shasta.ast.Arith;
import org.metricshub.shasta.ast.ArithFor;
import org.metricshub.shasta.ast.ArithSub;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Case;
import org.metricshub.shasta.ast.CmdSub;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Cond;
import org.metricshub.shasta.ast.Coproc;
import org.metricshub.shasta.ast.Defun;
import org.metricshub.shasta.ast.DupRedir;
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
import org.metricshub.shasta.backend.QuoteMode;
import org.metricshub.shasta.backend.ShellPrinter;
import org.metricshub.shasta.frontend.Canonicalization;
import org.metricshub.shasta.util.ShastaLogger;
import org.metricshub.shasta.util.WorkList;
import org.metricshub.shasta.util.WorkList.Deferred;
import org.slf4j.Logger;

/**
 * Canonicalization of shfmt's typed JSON syntax trees ({@code shfmt -tojson}).
 * <p>
 * shfmt does not decompose extended globs, brace expansions and process
 * substitutions, nor the less common parameter expansions: their text is
 * sliced out of the script with the byte offsets shfmt reports, or rebuilt
 * from the tree when the script is not at hand. The script's bytes are only
 * read during the translation; the canonical tree does not refer to them.
 * <p>
 * Literal text is raw source text and is kept verbatim.
 */
public class ShfmtAdapter {

	private static final Logger LOG = ShastaLogger.getLogger(ShfmtAdapter.class);

	private static final int AND_STMT = 10;
	private static final int OR_STMT = 11;
	private static final int PIPE = 12;
	private static final int PIPE_ALL = 13;

	private static final int CASE_BREAK = 33;
	private static final int CASE_FALLTHROUGH = 34;

	private static final int UN_TEST_NOT = 112;
	private static final int UN_TEST_PAREN = 113;
	private static final int BIN_TEST_AND = 122;
	private static final int BIN_TEST_OR = 123;

	private static final int NAMES_PREFIX = 38;

	/** Arithmetic operator tokens. */
	private static final Map<Integer, String> ARITH_OPS = new HashMap<>();

	/** Unary test operators of {@code [[ ]]}. */
	private static final Map<Integer, String> UN_TEST_OPS = new HashMap<>();

	/** Binary test operators of {@code [[ ]]}. */
	private static final Map<Integer, String> BIN_TEST_OPS = new HashMap<>();

	/** Parameter expansion operators. */
	private static final Map<Integer, String> PAR_EXP_OPS = new HashMap<>();

	/** Extended glob operators. */
	private static final Map<Integer, String> GLOB_OPS = new HashMap<>();

	/** Process substitution operators. */
	private static final Map<Integer, String> PROC_SUBST_OPS = new HashMap<>();

	static {
		String[] arith = {
				"68", "+", "70", "-", "38", "*", "85", "/", "76", "%", "39", "**", "40", "==", "54", ">", "56", "<",
				"41", "!=", "42", "<=", "43", ">=", "9", "&", "12", "|", "80", "^", "55", ">>", "61", "<<", "10", "&&",
				"11", "||", "81", "^^", "82", ",", "72", "?", "87", ":", "74", "=", "44", "+=", "45", "-=", "46", "*=",
				"47", "/=", "48", "%=", "49", "&=", "50", "|=", "51", "^=", "52", "<<=", "53", ">>=", "34", "!",
				"35", "~", "36", "++", "37", "--" };
		fill(ARITH_OPS, arith);
		String[] unary = {
				"88", "-e", "89", "-f", "90", "-d", "91", "-c", "92", "-b", "93", "-p", "94", "-S", "95", "-L",
				"96", "-k", "97", "-g", "98", "-u", "99", "-G", "100", "-O", "101", "-N", "102", "-r", "103", "-w",
				"104", "-x", "105", "-s", "106", "-t", "107", "-z", "108", "-n", "109", "-o", "110", "-v", "111", "-R" };
		fill(UN_TEST_OPS, unary);
		String[] binary = {
				"112", "=~", "113", "-nt", "114", "-ot", "115", "-ef", "116", "-eq", "117", "-ne", "118", "-le",
				"119", "-ge", "120", "-lt", "121", "-gt", "124", "=", "125", "==", "126", "!=", "127", "<", "128", ">" };
		fill(BIN_TEST_OPS, binary);
		String[] parameter = {
				"68", "+", "69", ":+", "70", "-", "71", ":-", "72", "?", "73", ":?", "74", "=", "75", ":=",
				"76", "%", "77", "%%", "78", "#", "79", "##", "80", "^", "81", "^^", "82", ",", "83", ",,", "84", "@" };
		fill(PAR_EXP_OPS, parameter);
		fill(GLOB_OPS, new String[] { "122", "?(", "123", "*(", "124", "+(", "125", "@(", "126", "!(" });
		fill(PROC_SUBST_OPS, new String[] { "66", "<(", "67", "=(", "68", ">(" });
	}

	private static void fill(Map<Integer, String> table, String[] pairs) {
		for (int i = 0; i < pairs.length; i += 2) {
			table.put(Integer.valueOf(pairs[i]), pairs[i + 1]);
		}
	}

	/**
	 * @param root a {@code File} node, an array of statements or one statement
	 * @param source the bytes of the script shfmt parsed, or {@code null}
	 * @return the canonical commands, one per top-level statement
	 * @throws UnsupportedConstructException when a node has no canonical
	 *         counterpart
	 */
	public List<Command> toCommands(JsonNode root, byte[] source) {
		JsonNode statements;
		if ("File".equals(type(root))) {
			statements = root.path("Stmts");
		} else if (root.isArray()) {
			statements = root;
		} else {
			return Collections.singletonList(toCommand(root, source));
		}
		LOG.debug("Translating {} shfmt statements", statements.size());
		Translation translation = new Translation(source);
		List<Command> result = translation.work.run(() -> {
			List<Deferred<Command>> commands = new ArrayList<>(statements.size());
			for (JsonNode statement : statements) {
				commands.add(translation.statement(statement));
			}
			return () -> Deferred.all(commands);
		});
		LOG.debug("Translated {} shfmt statements", result.size());
		return result;
	}

	/**
	 * @param node a statement or a command node
	 * @param source the bytes of the script shfmt parsed, or {@code null}
	 * @return the canonical command
	 */
	public Command toCommand(JsonNode node, byte[] source) {
		Translation translation = new Translation(source);
		return translation.work.run(() -> isStatement(node) ? translation.statementTask(node) : translation.command(node));
	}

	private static boolean present(JsonNode node) {
		return node != null && !node.isMissingNode() && !node.isNull();
	}

	private static String type(JsonNode node) {
		return node.path("Type").asText("");
	}

	private static boolean isStatement(JsonNode node) {
		return "Stmt".equals(type(node)) || node.has("Cmd") || node.has("Redirs") || node.has("Negated") || node.has("Background");
	}

	private static int line(JsonNode position) {
		int line = position.path("Line").asInt(0);
		return line > 0 ? line : AstNode.NO_LINE;
	}

	private static String literal(JsonNode lit) {
		return lit.path("Value").asText("");
	}

	private static Not not(Command body) {
		return new Not(body, !Canonicalization.isConnective(body));
	}

	/**
	 * Whether two operator characters would lex as one token when printed
	 * next to each other ({@code - -x} is not {@code --x}).
	 */
	private static boolean collides(int before, int after) {
		return before == after && (before == '+' || before == '-');
	}

	private static int first(Word word) {
		if (!word.isEmpty() && word.get(0) instanceof Literal) {
			return ((Literal) word.get(0)).getCodePoint();
		}
		return -1;
	}

	private static Word verbatim(Object... pieces) {
		Word result = Word.EMPTY;
		for (Object piece : pieces) {
			result = result.concat(piece instanceof Word ? (Word) piece : Word.verbatim(String.valueOf(piece)));
		}
		return result;
	}

	/**
	 * State of one translation: the work list and the script's bytes.
	 */
	private static final class Translation {

		private final WorkList work = new WorkList();
		private final byte[] source;

		Translation(byte[] source) {
			this.source = source;
		}

		/**
		 * The text of a node, cut out of the script.
		 *
		 * @return verbatim literals, or {@code null} without a script or offsets
		 */
		Word slice(JsonNode node) {
			if (source == null) {
				return null;
			}
			JsonNode start = node.path("Pos").path("Offset");
			JsonNode end = node.path("End").path("Offset");
			if (!start.isInt() || !end.isInt()) {
				return null;
			}
			int from = start.intValue();
			int to = end.intValue();
			if (from < 0 || from > to || to > source.length) {
				return null;
			}
			return Canonicalization.verbatim(source, from, to);
		}

		Deferred<Command> statement(JsonNode statement) {
			return work.submit(() -> statementTask(statement));
		}

		Supplier<Command> statementTask(JsonNode statement) {
			JsonNode cmd = statement.path("Cmd");
			Deferred<Command> command = present(cmd) ? work.submit(() -> command(cmd)) : Deferred.<Command>of(Simple.empty());
			Deferred<List<RedirectionNode>> redirections = redirections(statement.path("Redirs"));
			boolean negated = statement.path("Negated").asBoolean(false);
			boolean background = statement.path("Background").asBoolean(false);
			return () -> {
				Command result = Canonicalization.withRedirections(AstNode.NO_LINE, command.get(), redirections.get());
				if (negated) {
					result = not(result);
				}
				if (background) {
					result = new Background(AstNode.NO_LINE, result, Collections.<RedirectionNode>emptyList());
				}
				return result;
			};
		}

		/**
		 * A statement list is a chain of {@link Semi}, an empty one the empty
		 * command.
		 */
		Deferred<Command> statements(JsonNode statements) {
			if (!statements.isArray() || statements.size() == 0) {
				return Deferred.<Command>of(Simple.empty());
			}
			return work.submit(() -> {
				List<Deferred<Command>> commands = new ArrayList<>(statements.size());
				for (JsonNode statement : statements) {
					commands.add(statement(statement));
				}
				return () -> Semi.sequence(Deferred.all(commands));
			});
		}

		Supplier<Command> command(JsonNode node) {
			String type = type(node);
			switch (type) {
			case "CallExpr":
				return call(node);
			case "BinaryCmd":
				return binary(node);
			case "IfClause":
				return ifClause(node);
			case "WhileClause": {
				Deferred<Command> test = statements(node.path("Cond"));
				Deferred<Command> body = statements(node.path("Do"));
				boolean until = node.path("Until").asBoolean(false);
				return () -> new While(until ? not(test.get()) : test.get(), body.get());
			}
			case "ForClause":
				return forClause(node);
			case "CaseClause":
				return caseClause(node);
			case "Subshell": {
				int line = line(node.path("Lparen"));
				Deferred<Command> body = statements(node.path("Stmts"));
				return () -> new Subshell(line, body.get(), Collections.<RedirectionNode>emptyList());
			}
			case "Block": {
				Deferred<Command> body = statements(node.path("Stmts"));
				return () -> new Group(body.get());
			}
			case "FuncDecl": {
				int line = line(node.path("Position"));
				Word name = Word.verbatim(literal(node.path("Name")));
				Deferred<Command> body = statement(node.path("Body"));
				boolean bashStyle = node.path("RsrvWord").asBoolean(false);
				return () -> new Defun(line, name, body.get(), bashStyle);
			}
			case "ArithmCmd": {
				int line = line(node.path("Left"));
				Deferred<List<Word>> body = arithmeticList(node.path("X"));
				return () -> new Arith(line, body.get());
			}
			case "TimeClause": {
				JsonNode stmt = node.path("Stmt");
				Deferred<Command> body = present(stmt) ? statement(stmt) : Deferred.<Command>of(Simple.empty());
				boolean posix = node.path("PosixFormat").asBoolean(false);
				return () -> new Time(posix, body.get());
			}
			case "CoprocClause": {
				Deferred<Word> name = word(node.path("Name"));
				Deferred<Command> body = statement(node.path("Stmt"));
				return () -> new Coproc(name.get(), body.get());
			}
			case "DeclClause":
				return declaration(node);
			case "LetClause":
				return let(node);
			case "TestClause": {
				int line = line(node.path("Left"));
				Deferred<Cond> test = test(node.path("X"));
				return () -> {
					Cond root = test.get();
					return new Cond(line, root.getKind(), root.getOp(), root.getLeft(), root.getRight(), root.isNegate());
				};
			}
			default:
				throw new UnsupportedConstructException(line(node.path("Pos")), type.isEmpty() ? "untyped node" : type);
			}
		}

		private Supplier<Command> call(JsonNode node) {
			int line = line(node.path("Pos"));
			List<Deferred<AssignNode>> assignments = new ArrayList<>();
			List<Deferred<Word>> naked = new ArrayList<>();
			for (JsonNode assign : node.path("Assigns")) {
				if (assign.path("Naked").asBoolean(false)) {
					naked.add(assignmentWord(assign));
				} else {
					assignments.add(assignment(assign));
				}
			}
			Deferred<List<Word>> arguments = words(node.path("Args"));
			return () -> {
				List<AssignNode> assigns = new ArrayList<>(assignments.size());
				for (Deferred<AssignNode> assignment : assignments) {
					assigns.add(assignment.get());
				}
				List<Word> args = new ArrayList<>(Deferred.all(naked));
				args.addAll(arguments.get());
				return new Simple(line, assigns, args, Collections.<RedirectionNode>emptyList());
			};
		}

		/**
		 * {@code name=value}, {@code name+=value}, {@code name[index]=value}
		 * and {@code name=(elements)}.
		 */
		private Deferred<AssignNode> assignment(JsonNode assign) {
			String name = literal(assign.path("Name"));
			boolean append = assign.path("Append").asBoolean(false);
			JsonNode indexNode = assign.path("Index");
			Deferred<Word> index = present(indexNode) ? arithmetic(indexNode) : null;
			Deferred<Word> value = present(assign.path("Array")) ? array(assign.path("Array")) : word(assign.path("Value"));
			return work.submit(() -> () -> {
				String target = name;
				if (index != null) {
					target += "[" + new ShellPrinter().print(index.get(), QuoteMode.UNQUOTED) + "]";
				}
				if (append) {
					target += "+";
				}
				return new AssignNode(target, value.get());
			});
		}

		/**
		 * An assignment as one word, for the arguments of {@code declare} and
		 * its siblings.
		 */
		private Deferred<Word> assignmentWord(JsonNode assign) {
			String name = literal(assign.path("Name"));
			if (assign.path("Naked").asBoolean(false)) {
				if (!name.isEmpty()) {
					return Deferred.of(Word.verbatim(name));
				}
				return word(assign.path("Value"));
			}
			Deferred<AssignNode> assignment = assignment(assign);
			return work.submit(() -> () -> verbatim(assignment.get().getName(), "=", assignment.get().getValue()));
		}

		private Deferred<Word> array(JsonNode array) {
			return work.submit(() -> {
				List<Deferred<Word>> elements = new ArrayList<>();
				for (JsonNode element : array.path("Elems")) {
					JsonNode index = element.path("Index");
					Deferred<Word> value = word(element.path("Value"));
					if (present(index)) {
						Deferred<Word> i = arithmetic(index);
						elements.add(work.submit(() -> () -> verbatim("[", i.get(), "]=", value.get())));
					} else {
						elements.add(value);
					}
				}
				return () -> {
					Word result = Word.verbatim("(");
					for (int i = 0; i < elements.size(); i++) {
						result = result.concat(verbatim(i == 0 ? "" : " ", elements.get(i).get()));
					}
					return result.concat(Word.verbatim(")"));
				};
			});
		}

		private Supplier<Command> declaration(JsonNode node) {
			int line = line(node.path("Pos"));
			Word variant = Word.verbatim(literal(node.path("Variant")));
			List<Deferred<Word>> arguments = new ArrayList<>();
			for (JsonNode assign : node.path("Args")) {
				arguments.add(assignmentWord(assign));
			}
			return () -> {
				List<Word> words = new ArrayList<>();
				words.add(variant);
				words.addAll(Deferred.all(arguments));
				return new Simple(line, Collections.<AssignNode>emptyList(), words, Collections.<RedirectionNode>emptyList());
			};
		}

		/**
		 * Each expression is quoted, so that it stays one word whatever
		 * operators it holds.
		 */
		private Supplier<Command> let(JsonNode node) {
			int line = line(node.path("Let"));
			List<Deferred<Word>> expressions = new ArrayList<>();
			for (JsonNode expression : node.path("Exprs")) {
				expressions.add(arithmetic(expression));
			}
			return () -> {
				List<Word> words = new ArrayList<>();
				words.add(Word.verbatim("let"));
				for (Deferred<Word> expression : expressions) {
					words.add(Word.of(new Quoted(expression.get())));
				}
				return new Simple(line, Collections.<AssignNode>emptyList(), words, Collections.<RedirectionNode>emptyList());
			};
		}

		private Supplier<Command> binary(JsonNode node) {
			int op = node.path("Op").asInt();
			Deferred<Command> left = statement(node.path("X"));
			Deferred<Command> right = statement(node.path("Y"));
			switch (op) {
			case AND_STMT:
				return () -> new And(left.get(), right.get(), true);
			case OR_STMT:
				return () -> new Or(left.get(), right.get(), true);
			case PIPE:
				return () -> Canonicalization.pipe(left.get(), right.get());
			case PIPE_ALL:
				return () -> Canonicalization.pipe(stderrToStdout(left.get()), right.get());
			default:
				throw new UnsupportedConstructException(line(node.path("OpPos")), "binary command operator " + op);
			}
		}

		/**
		 * {@code a |& b} is {@code a 2>&1 | b}.
		 */
		private Command stderrToStdout(Command stage) {
			List<RedirectionNode> duplicate = Collections.<RedirectionNode>singletonList(
					new DupRedir(DupRedir.Kind.TO_FD, FdTarget.fixed(2), FdTarget.fixed(1)));
			if (stage instanceof Pipe && !((Pipe) stage).isBackground()) {
				List<Command> items = new ArrayList<>(((Pipe) stage).getItems());
				int last = items.size() - 1;
				items.set(last, Canonicalization.withRedirections(AstNode.NO_LINE, items.get(last), duplicate));
				return new Pipe(false, items);
			}
			return Canonicalization.withRedirections(AstNode.NO_LINE, stage, duplicate);
		}

		private Supplier<Command> ifClause(JsonNode node) {
			Deferred<Command> condition = statements(node.path("Cond"));
			Deferred<Command> thenBranch = statements(node.path("Then"));
			JsonNode elseNode = node.path("Else");
			Deferred<Command> elseBranch;
			if (!present(elseNode)) {
				elseBranch = Deferred.of(null);
			} else if (elseNode.path("Cond").size() > 0) {
				elseBranch = work.submit(() -> ifClause(elseNode));
			} else {
				elseBranch = statements(elseNode.path("Then"));
			}
			return () -> new If(condition.get(), thenBranch.get(), elseBranch.get());
		}

		private Supplier<Command> forClause(JsonNode node) {
			int line = line(node.path("ForPos"));
			JsonNode loop = node.path("Loop");
			Deferred<Command> body = statements(node.path("Do"));
			switch (type(loop)) {
			case "WordIter": {
				Word variable = Word.verbatim(literal(loop.path("Name")));
				Deferred<List<Word>> items = words(loop.path("Items"));
				// without "in", the loop runs over the positional parameters
				boolean implicit = loop.path("Items").size() == 0 && line(loop.path("InPos")) == AstNode.NO_LINE;
				boolean select = node.path("Select").asBoolean(false);
				return () -> {
					List<Word> list = implicit
							? Collections.singletonList(Word.of(new Quoted(Word.of(new VarExpand(VarExpand.Format.NORMAL, false, "@", Word.EMPTY)))))
							: items.get();
					return select ? new Select(line, variable, list, body.get()) : new For(line, variable, list, body.get());
				};
			}
			case "CStyleLoop": {
				Deferred<List<Word>> init = arithmeticList(loop.path("Init"));
				Deferred<List<Word>> condition = arithmeticList(loop.path("Cond"));
				Deferred<List<Word>> step = arithmeticList(loop.path("Post"));
				return () -> new ArithFor(line, init.get(), condition.get(), step.get(), body.get());
			}
			default:
				throw new UnsupportedConstructException(line, "ForClause loop " + type(loop));
			}
		}

		private Supplier<Command> caseClause(JsonNode node) {
			int line = line(node.path("Case"));
			Deferred<Word> subject = word(node.path("Word"));
			List<Deferred<List<Word>>> patterns = new ArrayList<>();
			List<Deferred<Command>> bodies = new ArrayList<>();
			List<Boolean> fallthroughs = new ArrayList<>();
			for (JsonNode item : node.path("Items")) {
				int op = item.path("Op").asInt(CASE_BREAK);
				if (op != CASE_BREAK && op != CASE_FALLTHROUGH) {
					throw new UnsupportedConstructException(line(item.path("OpPos")), op == 35 ? ";;&" : ";|");
				}
				patterns.add(words(item.path("Patterns")));
				JsonNode stmts = item.path("Stmts");
				bodies.add(stmts.size() == 0 ? Deferred.<Command>of(null) : statements(stmts));
				fallthroughs.add(op == CASE_FALLTHROUGH);
			}
			return () -> {
				List<Case.Clause> clauses = new ArrayList<>(patterns.size());
				for (int i = 0; i < patterns.size(); i++) {
					clauses.add(new Case.Clause(patterns.get(i).get(), bodies.get(i).get(), fallthroughs.get(i)));
				}
				return new Case(line, subject.get(), clauses);
			};
		}

		private Deferred<Cond> test(JsonNode expression) {
			return work.submit(() -> {
				String type = type(expression);
				switch (type) {
				case "Word": {
					Deferred<Word> word = word(expression);
					return () -> Cond.term(word.get());
				}
				case "ParenTest": {
					Deferred<Cond> inner = test(expression.path("X"));
					return () -> new Cond(AstNode.NO_LINE, Cond.Kind.EXPR, null, inner.get(), null, false);
				}
				case "UnaryTest": {
					int op = expression.path("Op").asInt();
					Deferred<Cond> inner = test(expression.path("X"));
					if (op == UN_TEST_NOT) {
						return () -> inner.get().negated();
					}
					if (op == UN_TEST_PAREN) {
						return () -> new Cond(AstNode.NO_LINE, Cond.Kind.EXPR, null, inner.get(), null, false);
					}
					String operator = UN_TEST_OPS.get(op);
					if (operator == null) {
						throw new UnsupportedConstructException("unary test operator " + op);
					}
					return () -> new Cond(AstNode.NO_LINE, Cond.Kind.UNARY, Word.verbatim(operator), inner.get(), null, false);
				}
				case "BinaryTest": {
					int op = expression.path("Op").asInt();
					Deferred<Cond> left = test(expression.path("X"));
					Deferred<Cond> right = test(expression.path("Y"));
					if (op == BIN_TEST_AND) {
						return () -> new Cond(AstNode.NO_LINE, Cond.Kind.AND, null, left.get(), right.get(), false);
					}
					if (op == BIN_TEST_OR) {
						return () -> new Cond(AstNode.NO_LINE, Cond.Kind.OR, null, left.get(), right.get(), false);
					}
					String operator = BIN_TEST_OPS.get(op);
					if (operator == null) {
						throw new UnsupportedConstructException("binary test operator " + op);
					}
					return () -> new Cond(AstNode.NO_LINE, Cond.Kind.BINARY, Word.verbatim(operator), left.get(), right.get(), false);
				}
				default:
					throw new UnsupportedConstructException("test expression " + type);
				}
			});
		}

		Deferred<List<Word>> words(JsonNode nodes) {
			return work.submit(() -> {
				List<Deferred<Word>> items = new ArrayList<>(nodes.size());
				for (JsonNode node : nodes) {
					items.add(word(node));
				}
				return () -> Deferred.all(items);
			});
		}

		Deferred<Word> word(JsonNode node) {
			if (!present(node)) {
				return Deferred.of(Word.EMPTY);
			}
			return parts(node.path("Parts"));
		}

		private Deferred<Word> parts(JsonNode parts) {
			return work.submit(() -> {
				List<Deferred<Word>> items = new ArrayList<>(parts.size());
				for (JsonNode part : parts) {
					items.add(work.submit(() -> part(part)));
				}
				return () -> {
					List<ArgChar> chars = new ArrayList<>();
					for (Deferred<Word> item : items) {
						chars.addAll(item.get().getChars());
					}
					return Word.of(chars);
				};
			});
		}

		private Supplier<Word> part(JsonNode part) {
			String type = type(part);
			switch (type) {
			case "Lit": {
				Word text = Word.verbatim(literal(part));
				return () -> text;
			}
			case "SglQuoted": {
				Word text = verbatim(part.path("Dollar").asBoolean(false) ? "$'" : "'", literal(part), "'");
				return () -> text;
			}
			case "DblQuoted": {
				boolean dollar = part.path("Dollar").asBoolean(false);
				Deferred<Word> inner = parts(part.path("Parts"));
				return () -> verbatim(dollar ? "$" : "", Word.of(new Quoted(inner.get())));
			}
			case "ParamExp":
				return parameter(part);
			case "CmdSubst": {
				Deferred<Command> body = statements(part.path("Stmts"));
				return () -> Word.of(new CmdSub(body.get()));
			}
			case "ArithmExp": {
				Deferred<Word> expression = arithmetic(part.path("X"));
				return () -> Word.of(new ArithSub(expression.get()));
			}
			case "ExtGlob": {
				Word text = slice(part);
				if (text == null) {
					text = verbatim(GLOB_OPS.getOrDefault(part.path("Op").asInt(), "?("), literal(part.path("Pattern")), ")");
				}
				Word glob = text;
				return () -> glob;
			}
			case "BraceExp": {
				Word text = slice(part);
				if (text != null) {
					return () -> text;
				}
				Deferred<List<Word>> elements = words(part.path("Elems"));
				String separator = part.path("Sequence").asBoolean(false) ? ".." : ",";
				return () -> {
					Word result = Word.verbatim("{");
					List<Word> items = elements.get();
					for (int i = 0; i < items.size(); i++) {
						result = result.concat(verbatim(i == 0 ? "" : separator, items.get(i)));
					}
					return result.concat(Word.verbatim("}"));
				};
			}
			case "ProcSubst": {
				Word text = slice(part);
				if (text != null) {
					return () -> text;
				}
				String op = PROC_SUBST_OPS.getOrDefault(part.path("Op").asInt(), "<(");
				Deferred<Command> body = statements(part.path("Stmts"));
				return () -> verbatim(op, new ShellPrinter().print(Collections.singletonList(body.get())), ")");
			}
			default:
				throw new UnsupportedConstructException("word part " + type);
			}
		}

		/**
		 * {@code $name}, {@code ${#name}} and the operators libdash also knows
		 * become a {@link VarExpand}; anything else is kept as text.
		 */
		private Supplier<Word> parameter(JsonNode node) {
			String name = literal(node.path("Param"));
			JsonNode exp = node.path("Exp");
			boolean length = node.path("Length").asBoolean(false);
			boolean plain = !present(node.path("NestedParam"))
					&& !present(node.path("Flags"))
					&& !node.path("Excl").asBoolean(false)
					&& !present(node.path("Index"))
					&& !present(node.path("Slice"))
					&& !present(node.path("Repl"))
					&& node.path("Names").asInt(0) == 0
					&& !name.isEmpty();
			if (plain && !present(exp)) {
				VarExpand expansion = new VarExpand(length ? VarExpand.Format.LENGTH : VarExpand.Format.NORMAL, false, name, Word.EMPTY);
				return () -> Word.of(expansion);
			}
			int op = exp.path("Op").asInt(-1);
			VarExpand.Format format = plain && !length ? format(op) : null;
			if (format != null) {
				boolean nullSemantics = op >= 68 && op <= 75 && op % 2 == 1;
				Deferred<Word> argument = word(exp.path("Word"));
				return () -> Word.of(new VarExpand(format, nullSemantics, name, argument.get()));
			}
			Word text = slice(node);
			if (text != null) {
				return () -> text;
			}
			return rebuildParameter(node, name);
		}

		private VarExpand.Format format(int op) {
			switch (op) {
			case 68:
			case 69:
				return VarExpand.Format.PLUS;
			case 70:
			case 71:
				return VarExpand.Format.MINUS;
			case 72:
			case 73:
				return VarExpand.Format.QUESTION;
			case 74:
			case 75:
				return VarExpand.Format.ASSIGN;
			case 76:
				return VarExpand.Format.TRIM_R;
			case 77:
				return VarExpand.Format.TRIM_R_MAX;
			case 78:
				return VarExpand.Format.TRIM_L;
			case 79:
				return VarExpand.Format.TRIM_L_MAX;
			default:
				return null;
			}
		}

		private Supplier<Word> rebuildParameter(JsonNode node, String name) {
			if (present(node.path("NestedParam"))) {
				throw new UnsupportedConstructException(line(node.path("Dollar")), "nested parameter expansion");
			}
			if (node.path("Short").asBoolean(false)) {
				return () -> Word.verbatim("$" + name);
			}
			int names = node.path("Names").asInt(0);
			if (names != 0) {
				String suffix = names == NAMES_PREFIX ? "*" : "@";
				return () -> Word.verbatim("${!" + name + suffix + "}");
			}
			JsonNode indexNode = node.path("Index");
			Deferred<Word> index = present(indexNode) ? arithmetic(indexNode) : Deferred.<Word>of(null);
			JsonNode slice = node.path("Slice");
			Deferred<Word> offset = present(slice) ? arithmetic(slice.path("Offset")) : Deferred.<Word>of(null);
			Deferred<Word> sliceLength = present(slice.path("Length")) ? arithmetic(slice.path("Length")) : Deferred.<Word>of(null);
			JsonNode replace = node.path("Repl");
			Deferred<Word> original = present(replace) ? word(replace.path("Orig")) : Deferred.<Word>of(null);
			Deferred<Word> with = present(replace) ? word(replace.path("With")) : Deferred.<Word>of(null);
			JsonNode exp = node.path("Exp");
			String operator = present(exp) ? PAR_EXP_OPS.get(exp.path("Op").asInt()) : null;
			if (present(exp) && operator == null) {
				throw new UnsupportedConstructException("parameter expansion operator " + exp.path("Op").asInt());
			}
			Deferred<Word> argument = present(exp) ? word(exp.path("Word")) : Deferred.<Word>of(null);
			String prefix = (node.path("Excl").asBoolean(false) ? "!" : "")
					+ (node.path("Length").asBoolean(false) ? "#" : "")
					+ (present(node.path("Flags")) ? "(" + literal(node.path("Flags")) + ")" : "");
			return () -> {
				Word result = verbatim("${", prefix, name);
				if (index.get() != null) {
					result = verbatim(result, "[", index.get(), "]");
				}
				if (offset.get() != null) {
					result = verbatim(result, ":", offset.get());
					if (sliceLength.get() != null) {
						result = verbatim(result, ":", sliceLength.get());
					}
				}
				if (original.get() != null) {
					result = verbatim(result, "/", original.get(), "/", with.get());
				}
				if (argument.get() != null) {
					result = verbatim(result, operator, argument.get());
				}
				return result.concat(Word.verbatim("}"));
			};
		}

		/**
		 * An arithmetic expression as one word, operators spaced out.
		 */
		Deferred<Word> arithmetic(JsonNode expression) {
			return work.submit(() -> {
				String type = type(expression);
				switch (type) {
				case "Word":
					return word(expression)::get;
				case "ParenArithm": {
					Deferred<Word> inner = arithmetic(expression.path("X"));
					return () -> verbatim("(", inner.get(), ")");
				}
				case "UnaryArithm": {
					String op = arithmeticOperator(expression);
					Deferred<Word> inner = arithmetic(expression.path("X"));
					if (expression.path("Post").asBoolean(false)) {
						return () -> verbatim(inner.get(), op);
					}
					return () -> {
						boolean space = collides(op.charAt(op.length() - 1), first(inner.get()));
						return verbatim(op, space ? " " : "", inner.get());
					};
				}
				case "BinaryArithm": {
					String op = arithmeticOperator(expression);
					Deferred<Word> left = arithmetic(expression.path("X"));
					Deferred<Word> right = arithmetic(expression.path("Y"));
					// the comma operator reads better unspaced on its left
					String before = ",".equals(op) ? "" : " ";
					return () -> verbatim(left.get(), before, op, " ", right.get());
				}
				default:
					throw new UnsupportedConstructException("arithmetic expression " + type);
				}
			});
		}

		private Deferred<List<Word>> arithmeticList(JsonNode expression) {
			if (!present(expression)) {
				return Deferred.of(Collections.<Word>emptyList());
			}
			Deferred<Word> word = arithmetic(expression);
			return work.submit(() -> () -> Collections.singletonList(word.get()));
		}

		private String arithmeticOperator(JsonNode expression) {
			int op = expression.path("Op").asInt();
			String operator = ARITH_OPS.get(op);
			if (operator == null) {
				throw new UnsupportedConstructException("arithmetic operator " + op);
			}
			return operator;
		}

		Deferred<List<RedirectionNode>> redirections(JsonNode nodes) {
			if (!nodes.isArray() || nodes.size() == 0) {
				return Deferred.of(Collections.<RedirectionNode>emptyList());
			}
			return work.submit(() -> {
				List<Deferred<RedirectionNode>> items = new ArrayList<>(nodes.size());
				for (JsonNode node : nodes) {
					items.add(work.submit(() -> redirection(node)));
				}
				return () -> Deferred.all(items);
			});
		}

		private Supplier<RedirectionNode> redirection(JsonNode node) {
			int op = node.path("Op").asInt(-1);
			JsonNode target = node.path("Word");
			switch (op) {
			case 54:
				return file(node, FileRedir.Kind.TO);
			case 55:
			case 62:
			case 63:
				return file(node, FileRedir.Kind.APPEND);
			case 56:
				return file(node, FileRedir.Kind.FROM);
			case 57:
				return file(node, FileRedir.Kind.FROM_TO);
			case 60:
			case 61:
				return file(node, FileRedir.Kind.CLOBBER);
			case 66:
				return file(node, FileRedir.Kind.READING_STRING);
			case 58:
			case 59:
				return duplication(node, op == 58 ? DupRedir.Kind.FROM_FD : DupRedir.Kind.TO_FD);
			case 64:
			case 65:
				return heredoc(node, op == 65);
			case 67:
			case 68:
			case 69:
			case 70:
			case 71:
			case 72: {
				SingleArgRedir.Kind kind = op <= 69 ? SingleArgRedir.Kind.ERR_AND_OUT : SingleArgRedir.Kind.APPEND_ERR_AND_OUT;
				Deferred<Word> file = requiredWord(target, node, kind.getJsonName());
				return () -> new SingleArgRedir(kind, FdTarget.named(file.get()));
			}
			default:
				throw new UnsupportedConstructException(line(node.path("OpPos")), "redirection operator " + op);
			}
		}

		private Deferred<Word> requiredWord(JsonNode word, JsonNode redirection, String kind) {
			if (!present(word)) {
				throw new InvalidRedirectionTargetException(line(redirection.path("OpPos")), kind, "missing file operand");
			}
			return word(word);
		}

		private Supplier<RedirectionNode> file(JsonNode node, FileRedir.Kind kind) {
			FdTarget fd = fd(node, kind.getDefaultFd());
			Deferred<Word> target = requiredWord(node.path("Word"), node, kind.getJsonName());
			return () -> new FileRedir(kind, fd, target.get());
		}

		private Supplier<RedirectionNode> duplication(JsonNode node, DupRedir.Kind kind) {
			FdTarget fd = fd(node, kind == DupRedir.Kind.FROM_FD ? 0 : 1);
			Deferred<Word> target = requiredWord(node.path("Word"), node, kind.getJsonName());
			return () -> {
				Word word = target.get();
				String text = word.plainText();
				if ("-".equals(text)) {
					return new SingleArgRedir(SingleArgRedir.Kind.CLOSE_THIS, fd);
				}
				if (text != null && text.matches("[0-9]{1,9}-?")) {
					boolean move = text.endsWith("-");
					int number = Integer.parseInt(move ? text.substring(0, text.length() - 1) : text);
					return new DupRedir(kind, fd, FdTarget.fixed(number), move);
				}
				return new DupRedir(kind, fd, FdTarget.named(word), false);
			};
		}

		private Supplier<RedirectionNode> heredoc(JsonNode node, boolean stripLeadingTabs) {
			FdTarget fd = fd(node, 0);
			JsonNode delimiterWord = node.path("Word");
			if (!present(delimiterWord)) {
				throw new InvalidRedirectionTargetException(line(node.path("OpPos")), "Heredoc", "missing delimiter");
			}
			StringBuilder delimiter = new StringBuilder();
			boolean quoted = false;
			for (JsonNode part : delimiterWord.path("Parts")) {
				switch (type(part)) {
				case "Lit": {
					String text = literal(part);
					quoted |= text.indexOf('\\') >= 0;
					delimiter.append(text.replaceAll("\\\\(.)", "$1"));
					break;
				}
				case "SglQuoted":
					quoted = true;
					delimiter.append(literal(part));
					break;
				case "DblQuoted":
					quoted = true;
					for (JsonNode inner : part.path("Parts")) {
						delimiter.append(literal(inner));
					}
					break;
				default:
					throw new UnsupportedConstructException(line(node.path("OpPos")), "heredoc delimiter " + type(part));
				}
			}
			HeredocRedir.Kind kind = quoted ? HeredocRedir.Kind.HERE : HeredocRedir.Kind.XHERE;
			Deferred<Word> body = word(node.path("Hdoc"));
			return () -> new HeredocRedir(kind, fd, body.get(), stripLeadingTabs, delimiter.toString());
		}

		/**
		 * The redirected descriptor: a number, a {@code {name}}, or the
		 * operator's default.
		 */
		private FdTarget fd(JsonNode redirection, int defaultFd) {
			JsonNode n = redirection.path("N");
			if (!present(n)) {
				return FdTarget.fixed(defaultFd);
			}
			String text = literal(n);
			if (text.startsWith("{") && text.endsWith("}")) {
				text = text.substring(1, text.length() - 1);
			}
			if (text.matches("[0-9]{1,9}")) {
				return FdTarget.fixed(Integer.parseInt(text));
			}
			if (text.isEmpty()) {
				throw new InvalidRedirectionTargetException(line(n.path("ValuePos")), "N", "empty descriptor");
			}
			return FdTarget.named(Word.verbatim(text));
		}
	}
}
