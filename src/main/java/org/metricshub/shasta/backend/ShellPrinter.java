package org.metricshub.shasta.backend;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.ArgChar;
import org.metricshub.shasta.ast.ArgCharVisitor;
import org.metricshub.shasta.ast.Arith;
import org.metricshub.shasta.ast.ArithFor;
import org.metricshub.shasta.ast.ArithSub;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Case;
import org.metricshub.shasta.ast.CmdSub;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.CommandVisitor;
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
import org.metricshub.shasta.ast.RedirectionVisitor;
import org.metricshub.shasta.ast.Select;
import org.metricshub.shasta.ast.Semi;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.SingleArgRedir;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.TildeUser;
import org.metricshub.shasta.ast.Time;
import org.metricshub.shasta.ast.VarExpand;
import org.metricshub.shasta.ast.While;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.util.ShastaSettings;
import org.metricshub.shasta.util.WorkList;
import org.metricshub.shasta.util.WorkList.Deferred;

/**
 * Renders canonical trees back to shell source.
 * <p>
 * The printer is total: every tree that can be built prints. Commands are
 * printed in one of two positions:
 * <ul>
 * <li><em>list</em> position, where a sequence may span several lines (top
 * level, bodies of compound commands)
 * <li><em>operand</em> position, inside a pipeline, a connective or a
 * redirection, where a sequence or an asynchronous list must be grouped in
 * braces
 * </ul>
 * Here-document headers are printed in place; their bodies are held back
 * until the end of the logical line that carries the headers (see
 * {@link Rendered}).
 * <p>
 * The tree is walked through a {@link WorkList}, so the depth of the tree is
 * not limited by the Java stack. A printer holds no state between calls and
 * may be shared.
 */
public class ShellPrinter {

	private final ShastaSettings settings;

	/**
	 * Creates a printer with the default settings.
	 */
	public ShellPrinter() {
		this(new ShastaSettings());
	}

	/**
	 * @param settings printing parameters
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Settings are shared with the caller, who may change them between prints")
	public ShellPrinter(ShastaSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	/**
	 * @param node a command, a character, a redirection or an assignment
	 * @return the node's shell text; a command is printed in list position
	 */
	public String print(AstNode node) {
		Walk walk = new Walk();
		return walk.work.run(() -> walk.node(node));
	}

	/**
	 * Prints a whole script, one top-level command after the other.
	 *
	 * @param script the top-level commands
	 * @return the script's text
	 */
	public String print(List<? extends Command> script) {
		Walk walk = new Walk();
		return walk.work.run(() -> {
			List<Deferred<Rendered>> statements = new ArrayList<>(script.size());
			for (Command command : script) {
				statements.add(walk.command(command, true));
			}
			return () -> Rendered.lines(Deferred.all(statements)).complete();
		});
	}

	/**
	 * @param word a word
	 * @param mode context the word is printed in
	 * @return the word's text
	 */
	public String print(Word word, QuoteMode mode) {
		Walk walk = new Walk();
		return walk.work.run(() -> walk.wordAssembly(word, mode));
	}

	/**
	 * Delimiter of a here-document without an explicit one: the configured
	 * seed, with its last character repeated until no line of the body equals
	 * it.
	 *
	 * @param body the printed body
	 * @param stripTabs whether leading tabs of the body lines are ignored by
	 *        the shell when it looks for the delimiter
	 * @return the delimiter
	 */
	String freshMarker(String body, boolean stripTabs) {
		List<String> lines = new ArrayList<>(Arrays.asList(body.split("\n", -1)));
		if (stripTabs) {
			lines.replaceAll(line -> line.replaceFirst("^\t+", ""));
		}
		String marker = settings.getHeredocMarker();
		while (lines.contains(marker)) {
			marker += marker.charAt(marker.length() - 1);
		}
		return marker;
	}

	/**
	 * State of one call to the printer.
	 */
	private final class Walk {

		private final WorkList work = new WorkList();
		private final CommandPrinter inList = new CommandPrinter(true);
		private final CommandPrinter asOperand = new CommandPrinter(false);
		private final RedirectionPrinter redirectionPrinter = new RedirectionPrinter();

		Supplier<String> node(AstNode node) {
			if (node instanceof Command) {
				Deferred<Rendered> command = command((Command) node, true);
				return () -> command.get().complete();
			}
			if (node instanceof ArgChar) {
				return wordAssembly(Word.of((ArgChar) node), QuoteMode.UNQUOTED);
			}
			if (node instanceof RedirectionNode) {
				Deferred<Rendered> redirection = redirection((RedirectionNode) node);
				return () -> redirection.get().complete();
			}
			AssignNode assignment = (AssignNode) node;
			Deferred<String> value = word(assignment.getValue(), QuoteMode.UNQUOTED);
			return () -> assignment.getName() + "=" + value.get();
		}

		Deferred<Rendered> command(Command command, boolean list) {
			CommandPrinter printer = list ? inList : asOperand;
			return work.submit(() -> command.accept(printer));
		}

		List<Deferred<Rendered>> commands(List<? extends Command> commands, boolean list) {
			List<Deferred<Rendered>> result = new ArrayList<>(commands.size());
			for (Command command : commands) {
				result.add(command(command, list));
			}
			return result;
		}

		Deferred<String> word(Word word, QuoteMode mode) {
			return work.submit(() -> wordAssembly(word, mode));
		}

		List<Deferred<String>> words(List<Word> words) {
			List<Deferred<String>> result = new ArrayList<>(words.size());
			for (Word word : words) {
				result.add(word(word, QuoteMode.UNQUOTED));
			}
			return result;
		}

		Supplier<String> wordAssembly(Word word, QuoteMode mode) {
			CharPrinter printer = new CharPrinter(mode);
			List<Deferred<String>> parts = new ArrayList<>(word.size());
			for (int i = 0; i < word.size(); i++) {
				printer.followed = i + 1 < word.size();
				parts.add(word.get(i).accept(printer));
			}
			return () -> String.join("", Deferred.all(parts));
		}

		Deferred<Rendered> redirection(RedirectionNode redirection) {
			return work.submit(() -> redirection.accept(redirectionPrinter));
		}

		List<Deferred<Rendered>> redirections(List<RedirectionNode> redirections) {
			List<Deferred<Rendered>> result = new ArrayList<>(redirections.size());
			for (RedirectionNode redirection : redirections) {
				result.add(redirection(redirection));
			}
			return result;
		}

		/**
		 * @param fd the descriptor
		 * @param defaultFd the descriptor the operator implies, not printed;
		 *        {@code -1} to always print the descriptor
		 * @return the descriptor prefix of a redirection operator
		 */
		Deferred<String> fd(FdTarget fd, int defaultFd) {
			if (fd.isFixed()) {
				int number = ((FdTarget.Fixed) fd).getFd();
				return Deferred.of(number == defaultFd ? "" : Integer.toString(number));
			}
			Word name = ((FdTarget.Named) fd).getWord();
			return work.submit(() -> {
				Deferred<String> text = word(name, QuoteMode.UNQUOTED);
				return () -> "{" + text.get() + "}";
			});
		}

		private String joined(List<Deferred<String>> parts, String separator) {
			return String.join(separator, Deferred.all(parts));
		}

		/**
		 * Prints the characters of a word.
		 */
		private final class CharPrinter implements ArgCharVisitor<Deferred<String>> {

			private final QuoteMode mode;
			private boolean followed;

			CharPrinter(QuoteMode mode) {
				this.mode = mode;
			}

			@Override
			public Deferred<String> visitLiteral(Literal c) {
				return Deferred.of(Escaping.literal(c, followed, mode));
			}

			@Override
			public Deferred<String> visitEscaped(Escaped c) {
				return Deferred.of(Escaping.escaped(c.getCodePoint(), mode));
			}

			@Override
			public Deferred<String> visitTildeUser(TildeUser c) {
				return Deferred.of(c.getUser() == null ? "~" : "~" + c.getUser());
			}

			@Override
			public Deferred<String> visitArithSub(ArithSub c) {
				return work.submit(() -> {
					Deferred<String> expression = word(c.getExpression(), mode);
					return () -> "$((" + expression.get() + "))";
				});
			}

			@Override
			public Deferred<String> visitVarExpand(VarExpand c) {
				if (c.getFormat() == VarExpand.Format.LENGTH) {
					return Deferred.of("${#" + c.getName() + "}");
				}
				return work.submit(() -> {
					Deferred<String> argument = word(c.getArgument(), mode);
					return () -> "${" + c.getName() + (c.isNullSemantics() ? ":" : "") + c.getFormat().getOperator() + argument.get() + "}";
				});
			}

			@Override
			public Deferred<String> visitQuoted(Quoted c) {
				return work.submit(() -> {
					Deferred<String> inner = word(c.getInner(), QuoteMode.QUOTED);
					return () -> "\"" + inner.get() + "\"";
				});
			}

			@Override
			public Deferred<String> visitCmdSub(CmdSub c) {
				return work.submit(() -> {
					Deferred<Rendered> body = command(c.getBody(), true);
					return () -> {
						String text = body.get().complete();
						if (text.startsWith("(")) {
							text = " " + text + (text.endsWith("\n") ? "" : " ");
						}
						return "$(" + text + ")";
					};
				});
			}
		}

		/**
		 * Prints redirections. Here-documents leave their body pending.
		 */
		private final class RedirectionPrinter implements RedirectionVisitor<Supplier<Rendered>> {

			@Override
			public Supplier<Rendered> visitFile(FileRedir r) {
				Deferred<String> fd = fd(r.getFd(), r.getKind().getDefaultFd());
				Deferred<String> target = word(r.getTarget(), QuoteMode.UNQUOTED);
				return () -> Rendered.text(fd.get() + r.getKind().getOperator() + " " + target.get());
			}

			@Override
			public Supplier<Rendered> visitDup(DupRedir r) {
				Deferred<String> fd = fd(r.getFd(), r.getKind().getDefaultFd());
				FdTarget target = r.getTarget();
				Deferred<String> targetText = target.isFixed()
						? Deferred.of(Integer.toString(((FdTarget.Fixed) target).getFd()))
						: word(((FdTarget.Named) target).getWord(), QuoteMode.UNQUOTED);
				return () -> Rendered.text(fd.get() + r.getKind().getOperator() + targetText.get() + (r.isMove() ? "-" : ""));
			}

			@Override
			public Supplier<Rendered> visitHeredoc(HeredocRedir r) {
				boolean literal = r.getKind() == HeredocRedir.Kind.HERE;
				Deferred<String> fd = fd(r.getFd(), 0);
				Deferred<String> body = word(r.getBody(), literal ? QuoteMode.LITERAL_HEREDOC : QuoteMode.HEREDOC);
				return () -> {
					String text = body.get();
					if (!text.isEmpty() && !text.endsWith("\n")) {
						text += "\n";
					}
					String marker = r.getDelimiter() != null ? r.getDelimiter() : freshMarker(text, r.isStripLeadingTabs());
					String header = fd.get() + "<<" + (r.isStripLeadingTabs() ? "-" : "") + (literal ? "'" + marker + "'" : marker);
					return Rendered.heredoc(header, text + marker + "\n");
				};
			}

			@Override
			public Supplier<Rendered> visitSingleArg(SingleArgRedir r) {
				switch (r.getKind()) {
				case ERR_AND_OUT:
				case APPEND_ERR_AND_OUT:
					String operator = r.getKind() == SingleArgRedir.Kind.ERR_AND_OUT ? "&> " : "&>> ";
					Deferred<String> target = word(((FdTarget.Named) r.getFd()).getWord(), QuoteMode.UNQUOTED);
					return () -> Rendered.text(operator + target.get());
				case CLOSE_THIS:
				default:
					Deferred<String> fd = fd(r.getFd(), -1);
					return () -> Rendered.text(fd.get() + ">&-");
				}
			}
		}

		/**
		 * Prints commands in one position. Each visit submits the children of
		 * the command and returns the step assembling its text.
		 */
		private final class CommandPrinter implements CommandVisitor<Supplier<Rendered>> {

			private final boolean list;

			CommandPrinter(boolean list) {
				this.list = list;
			}

			/**
			 * A list-ending command used as an operand is printed in list
			 * position and grouped.
			 */
			private Supplier<Rendered> grouped(Command node) {
				Deferred<Rendered> inner = command(node, true);
				return () -> inner.get().braced();
			}

			@Override
			public Supplier<Rendered> visitPipe(Pipe node) {
				if (node.isBackground() && !list) {
					return grouped(node);
				}
				List<Deferred<Rendered>> items = commands(node.getItems(), false);
				return () -> {
					Rendered result = Rendered.EMPTY;
					for (int i = 0; i < items.size(); i++) {
						result = i == 0 ? items.get(i).get() : result.append(" | ").append(items.get(i).get());
					}
					return node.isBackground() ? result.background() : result;
				};
			}

			@Override
			public Supplier<Rendered> visitSimple(Simple node) {
				List<Deferred<String>> values = new ArrayList<>(node.getAssignments().size());
				for (AssignNode assignment : node.getAssignments()) {
					values.add(word(assignment.getValue(), QuoteMode.UNQUOTED));
				}
				List<Deferred<String>> arguments = words(node.getArguments());
				List<Deferred<Rendered>> redirections = redirections(node.getRedirections());
				return () -> {
					List<String> parts = new ArrayList<>();
					for (int i = 0; i < values.size(); i++) {
						parts.add(node.getAssignments().get(i).getName() + "=" + values.get(i).get());
					}
					parts.addAll(Deferred.all(arguments));
					return Rendered.text(String.join(" ", parts)).space(Rendered.spaced(Deferred.all(redirections)));
				};
			}

			@Override
			public Supplier<Rendered> visitSubshell(Subshell node) {
				Deferred<Rendered> body = command(node.getBody(), true);
				List<Deferred<Rendered>> redirections = redirections(node.getRedirections());
				return () -> body.get().prepend("( ").append(" )").space(Rendered.spaced(Deferred.all(redirections)));
			}

			@Override
			public Supplier<Rendered> visitAnd(And node) {
				return connective(node.getLeft(), " && ", node.getRight(), node.isNoBraces());
			}

			@Override
			public Supplier<Rendered> visitOr(Or node) {
				return connective(node.getLeft(), " || ", node.getRight(), node.isNoBraces());
			}

			private Supplier<Rendered> connective(Command left, String operator, Command right, boolean noBraces) {
				Deferred<Rendered> l = command(left, false);
				Deferred<Rendered> r = command(right, false);
				if (noBraces) {
					return () -> l.get().append(operator).append(r.get());
				}
				return () -> l.get().braced().append(operator).append(r.get().braced());
			}

			@Override
			public Supplier<Rendered> visitSemi(Semi node) {
				if (!list) {
					return grouped(node);
				}
				if (node.isExplicitSemicolon()) {
					Deferred<Rendered> l = command(node.getLeft(), true);
					Deferred<Rendered> r = command(node.getRight(), true);
					return () -> {
						Rendered left = l.get();
						return left.append(left.endsWithAmpersand() ? " " : " ; ").append(r.get());
					};
				}
				// implicit sequences print one statement per line, flattened without recursion
				List<Deferred<Rendered>> statements = new ArrayList<>();
				Deque<Command> todo = new ArrayDeque<>();
				todo.push(node);
				while (!todo.isEmpty()) {
					Command current = todo.pop();
					if (current instanceof Semi && !((Semi) current).isExplicitSemicolon()) {
						todo.push(((Semi) current).getRight());
						todo.push(((Semi) current).getLeft());
					} else {
						statements.add(command(current, true));
					}
				}
				return () -> Rendered.lines(Deferred.all(statements));
			}

			@Override
			public Supplier<Rendered> visitNot(Not node) {
				Deferred<Rendered> body = command(node.getBody(), false);
				if (node.isNoBraces()) {
					return () -> body.get().prepend("! ");
				}
				return () -> body.get().braced().prepend("! ");
			}

			@Override
			public Supplier<Rendered> visitRedir(Redir node) {
				Deferred<Rendered> inner = command(node.getNode(), false);
				boolean group = needsGroup(node.getNode());
				List<Deferred<Rendered>> redirections = redirections(node.getRedirections());
				return () -> {
					Rendered result = group ? inner.get().braced() : inner.get();
					return result.space(Rendered.spaced(Deferred.all(redirections)));
				};
			}

			/**
			 * @return whether a redirection written after the command would
			 *         only apply to its last part
			 */
			private boolean needsGroup(Command node) {
				return node instanceof And
						|| node instanceof Or
						|| node instanceof Not
						|| node instanceof Time
						|| node instanceof Coproc
						|| node instanceof Pipe && !((Pipe) node).isBackground();
			}

			@Override
			public Supplier<Rendered> visitBackground(Background node) {
				if (!list) {
					return grouped(node);
				}
				Deferred<Rendered> inner = command(node.getNode(), false);
				boolean group = !node.getRedirections().isEmpty() && needsGroup(node.getNode());
				List<Deferred<Rendered>> redirections = redirections(node.getRedirections());
				Deferred<Rendered> tail = node.getTail() == null ? null : command(node.getTail(), true);
				return () -> {
					Rendered result = group ? inner.get().braced() : inner.get();
					result = result.space(Rendered.spaced(Deferred.all(redirections))).background();
					return tail == null ? result : result.space(tail.get());
				};
			}

			@Override
			public Supplier<Rendered> visitDefun(Defun node) {
				Deferred<String> name = word(node.getName(), QuoteMode.UNQUOTED);
				Command bodyNode = node.getBody() instanceof Group ? ((Group) node.getBody()).getBody() : node.getBody();
				Deferred<Rendered> body = command(bodyNode, true);
				return () -> Rendered.text((node.isBashStyle() ? "function " : "") + name.get() + " () {\n" + body.get().flushed() + "\n}");
			}

			@Override
			public Supplier<Rendered> visitFor(For node) {
				return loop("for ", node.getVariable(), node.getItems(), node.getBody());
			}

			@Override
			public Supplier<Rendered> visitSelect(Select node) {
				return loop("select ", node.getVariable(), node.getItems(), node.getBody());
			}

			private Supplier<Rendered> loop(String keyword, Word variable, List<Word> items, Command bodyNode) {
				Deferred<String> name = word(variable, QuoteMode.UNQUOTED);
				List<Deferred<String>> values = words(items);
				Deferred<Rendered> body = command(bodyNode, true);
				return () -> Rendered.text(keyword + name.get() + " in " + joined(values, " ") + "; do\n" + body.get().flushed() + "\ndone");
			}

			@Override
			public Supplier<Rendered> visitWhile(While node) {
				String keyword = "while ";
				Command testNode = node.getTest();
				if (testNode instanceof Not) {
					keyword = "until ";
					testNode = ((Not) testNode).getBody();
				}
				String loopKeyword = keyword;
				Deferred<Rendered> test = command(testNode, true);
				Deferred<Rendered> body = command(node.getBody(), true);
				return () -> test.get().prepend(loopKeyword).terminate("do ").append(body.get().terminate("done"));
			}

			@Override
			public Supplier<Rendered> visitIf(If node) {
				Deferred<Rendered> condition = command(node.getCondition(), true);
				Deferred<Rendered> thenBranch = command(node.getThenBranch(), true);
				Command elseNode = node.getElseBranch();
				boolean noElse = elseNode == null || elseNode instanceof Simple && ((Simple) elseNode).isEmpty();
				Deferred<Rendered> elseBranch = noElse ? null : command(elseNode, true);
				return () -> {
					Rendered result = condition.get().prepend("if ").terminate("then ").append(thenBranch.get());
					if (noElse) {
						return result.terminate("fi");
					}
					if (elseNode instanceof If) {
						return result.terminate("el").append(elseBranch.get());
					}
					return result.terminate("else ").append(elseBranch.get().terminate("fi"));
				};
			}

			@Override
			public Supplier<Rendered> visitCase(Case node) {
				Deferred<String> subject = word(node.getSubject(), QuoteMode.UNQUOTED);
				List<List<Deferred<String>>> patterns = new ArrayList<>();
				List<Deferred<Rendered>> bodies = new ArrayList<>();
				for (Case.Clause clause : node.getClauses()) {
					patterns.add(words(clause.getPatterns()));
					bodies.add(clause.getBody() == null ? Deferred.of(Rendered.EMPTY) : command(clause.getBody(), true));
				}
				return () -> {
					Rendered result = Rendered.text("case " + subject.get() + " in ");
					for (int i = 0; i < patterns.size(); i++) {
						Case.Clause clause = node.getClauses().get(i);
						boolean esac = "esac".equals(clause.getPatterns().get(0).plainText());
						result = result.append((esac ? "(" : "") + joined(patterns.get(i), "|") + ") ")
								.append(bodies.get(i).get())
								.append(clause.isFallthrough() ? ";& " : ";; ");
					}
					return result.append("esac");
				};
			}

			@Override
			public Supplier<Rendered> visitGroup(Group node) {
				Deferred<Rendered> body = command(node.getBody(), true);
				return () -> body.get().braced();
			}

			@Override
			public Supplier<Rendered> visitArith(Arith node) {
				List<Deferred<String>> body = words(node.getBody());
				return () -> Rendered.text("((" + joined(body, " ") + "))");
			}

			@Override
			public Supplier<Rendered> visitCond(Cond node) {
				Deferred<String> expression = condition(node);
				return () -> Rendered.text("[[ " + expression.get() + " ]]");
			}

			private Deferred<String> condition(Cond node) {
				return work.submit(() -> {
					Deferred<String> op = node.getOp() == null ? Deferred.of("") : word(node.getOp(), QuoteMode.UNQUOTED);
					Deferred<String> left = node.getLeft() == null ? Deferred.of("") : condition(node.getLeft());
					Deferred<String> right = node.getRight() == null ? Deferred.of("") : condition(node.getRight());
					return () -> {
						String prefix = node.isNegate() ? "! " : "";
						switch (node.getKind()) {
						case AND:
							return prefix + left.get() + " && " + right.get();
						case OR:
							return prefix + left.get() + " || " + right.get();
						case UNARY:
							return prefix + op.get() + " " + left.get();
						case BINARY:
							return prefix + left.get() + " " + op.get() + " " + right.get();
						case TERM:
							return prefix + op.get();
						case EXPR:
						default:
							return prefix + "( " + left.get() + " )";
						}
					};
				});
			}

			@Override
			public Supplier<Rendered> visitArithFor(ArithFor node) {
				List<Deferred<String>> init = words(node.getInit());
				List<Deferred<String>> condition = words(node.getCondition());
				List<Deferred<String>> step = words(node.getStep());
				Deferred<Rendered> body = command(node.getBody(), true);
				return () -> Rendered.text("for ((" + joined(init, " ") + "; " + joined(condition, " ") + "; " + joined(step, " ") + ")); do ")
						.append(body.get().terminate("done"));
			}

			@Override
			public Supplier<Rendered> visitCoproc(Coproc node) {
				Deferred<String> name = word(node.getName(), QuoteMode.UNQUOTED);
				Deferred<Rendered> body = command(node.getBody(), false);
				boolean named = !(node.getBody() instanceof Simple) && !node.getName().isEmpty();
				return () -> body.get().prepend(named ? "coproc " + name.get() + " " : "coproc ");
			}

			@Override
			public Supplier<Rendered> visitTime(Time node) {
				Deferred<Rendered> body = command(node.getBody(), false);
				boolean group = node.getBody() instanceof And || node.getBody() instanceof Or;
				String prefix = node.isPosixFormat() ? "time -p " : "time ";
				return () -> (group ? body.get().braced() : body.get()).prepend(prefix);
			}
		}
	}
}
