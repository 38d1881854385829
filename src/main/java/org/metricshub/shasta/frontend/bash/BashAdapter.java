package org.metricshub.shasta.frontend.bash;

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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.metricshub.shasta.InvalidRedirectionTargetException;
import org.metricshub.shasta.ShastaException;
import org.metricshub.shasta.UnsupportedConstructException;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.Arith;
import org.metricshub.shasta.ast.ArithFor;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Case;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Cond;
import org.metricshub.shasta.ast.Coproc;
import org.metricshub.shasta.ast.Defun;
import org.metricshub.shasta.ast.DupRedir;
import org.metricshub.shasta.ast.FdTarget;
import org.metricshub.shasta.ast.FileRedir;
import org.metricshub.shasta.ast.For;
import org.metricshub.shasta.ast.HeredocRedir;
import org.metricshub.shasta.ast.If;
import org.metricshub.shasta.ast.Not;
import org.metricshub.shasta.ast.Or;
import org.metricshub.shasta.ast.Redir;
import org.metricshub.shasta.ast.RedirectionNode;
import org.metricshub.shasta.ast.Select;
import org.metricshub.shasta.ast.Semi;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.SingleArgRedir;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.Time;
import org.metricshub.shasta.ast.While;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.frontend.Canonicalization;
import org.metricshub.shasta.frontend.bash.model.ArithCom;
import org.metricshub.shasta.frontend.bash.model.ArithForCom;
import org.metricshub.shasta.frontend.bash.model.BashCommand;
import org.metricshub.shasta.frontend.bash.model.CaseCom;
import org.metricshub.shasta.frontend.bash.model.CommandFlag;
import org.metricshub.shasta.frontend.bash.model.CommandValue;
import org.metricshub.shasta.frontend.bash.model.CondCom;
import org.metricshub.shasta.frontend.bash.model.Connection;
import org.metricshub.shasta.frontend.bash.model.ConnectionType;
import org.metricshub.shasta.frontend.bash.model.CoprocCom;
import org.metricshub.shasta.frontend.bash.model.ForCom;
import org.metricshub.shasta.frontend.bash.model.FunctionDef;
import org.metricshub.shasta.frontend.bash.model.GroupCom;
import org.metricshub.shasta.frontend.bash.model.IfCom;
import org.metricshub.shasta.frontend.bash.model.Pattern;
import org.metricshub.shasta.frontend.bash.model.PatternFlag;
import org.metricshub.shasta.frontend.bash.model.Redirect;
import org.metricshub.shasta.frontend.bash.model.RedirectFlag;
import org.metricshub.shasta.frontend.bash.model.Redirectee;
import org.metricshub.shasta.frontend.bash.model.SelectCom;
import org.metricshub.shasta.frontend.bash.model.SimpleCom;
import org.metricshub.shasta.frontend.bash.model.SubshellCom;
import org.metricshub.shasta.frontend.bash.model.WhileCom;
import org.metricshub.shasta.frontend.bash.model.WordDesc;
import org.metricshub.shasta.frontend.bash.model.WordDescFlag;
import org.metricshub.shasta.util.ShastaLogger;
import org.metricshub.shasta.util.WorkList;
import org.metricshub.shasta.util.WorkList.Deferred;
import org.slf4j.Logger;

/**
 * Canonicalization of the commands built by bash's own parser.
 * <p>
 * bash keeps words as raw source text, so every literal produced here is
 * verbatim.
 * <p>
 * Assignments: the words flagged {@link WordDescFlag#W_ASSIGNMENT} that lead
 * a simple command are promoted, whatever their text. bash flags every word
 * shaped like an assignment, {@code echo a=b} included, and only the leading
 * ones assign.
 */
public class BashAdapter {

	private static final Logger LOG = ShastaLogger.getLogger(BashAdapter.class);

	/**
	 * @param command one command of bash's parser
	 * @return the canonical command
	 * @throws UnsupportedConstructException when a construct has no canonical
	 *         counterpart
	 * @throws InvalidRedirectionTargetException when a redirection misses its
	 *         descriptor or its operand
	 */
	public Command toCommand(BashCommand command) {
		Translation translation = new Translation();
		return translation.work.run(() -> translation.command(command, false));
	}

	/**
	 * @param commands top-level commands of bash's parser
	 * @return the canonical commands, in order
	 */
	public List<Command> toCommands(List<BashCommand> commands) {
		LOG.debug("Translating {} bash commands", commands.size());
		Translation translation = new Translation();
		List<Command> result = translation.work.run(() -> {
			List<Deferred<Command>> items = new ArrayList<>(commands.size());
			for (BashCommand command : commands) {
				items.add(translation.submit(command, false));
			}
			return () -> Deferred.all(items);
		});
		LOG.debug("Translated {} bash commands", result.size());
		return result;
	}

	private static Word word(WordDesc word) {
		return word == null ? Word.EMPTY : Canonicalization.verbatim(word.getWord());
	}

	private static List<Word> words(List<WordDesc> words) {
		List<Word> result = new ArrayList<>(words.size());
		for (WordDesc word : words) {
			result.add(word(word));
		}
		return result;
	}

	/**
	 * bash numbers lines from 1 and leaves 0 where it records none.
	 */
	private static int line(int line) {
		return line > 0 ? line : AstNode.NO_LINE;
	}

	private static <T extends CommandValue> T value(BashCommand command, Class<T> type) {
		CommandValue value = command.getValue();
		if (!type.isInstance(value)) {
			throw new ShastaException(line(command.getLine()), command.getType().name(),
					"Expected a " + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
		}
		return type.cast(value);
	}

	private static AssignNode assignment(WordDesc word) {
		byte[] bytes = word.getWord();
		int equals = 0;
		while (equals < bytes.length && bytes[equals] != '=') {
			equals++;
		}
		if (equals == 0 || equals == bytes.length) {
			return null;
		}
		String name = new String(bytes, 0, equals, StandardCharsets.UTF_8);
		return new AssignNode(name, Canonicalization.verbatim(Arrays.copyOfRange(bytes, equals + 1, bytes.length)));
	}

	private static Simple simple(SimpleCom simple, List<Redirect> redirects) {
		List<AssignNode> assignments = new ArrayList<>();
		List<Word> arguments = new ArrayList<>();
		for (WordDesc word : simple.getWords()) {
			Set<WordDescFlag> flags = word.getFlags();
			AssignNode assignment = null;
			if (arguments.isEmpty() && flags.contains(WordDescFlag.W_ASSIGNMENT) && !flags.contains(WordDescFlag.W_ASSIGNARG)) {
				assignment = assignment(word);
			}
			if (assignment != null) {
				assignments.add(assignment);
			} else {
				arguments.add(word(word));
			}
		}
		List<RedirectionNode> redirections = redirections(simple.getRedirects());
		redirections.addAll(redirections(redirects));
		return new Simple(line(simple.getLine()), assignments, arguments, redirections);
	}

	static List<RedirectionNode> redirections(List<Redirect> redirects) {
		List<RedirectionNode> result = new ArrayList<>(redirects.size());
		for (Redirect redirect : redirects) {
			result.add(redirection(redirect));
		}
		return result;
	}

	static RedirectionNode redirection(Redirect redirect) {
		switch (redirect.getInstruction()) {
		case R_OUTPUT_DIRECTION:
			return file(FileRedir.Kind.TO, redirect);
		case R_INPUT_DIRECTION:
			return file(FileRedir.Kind.FROM, redirect);
		case R_APPENDING_TO:
			return file(FileRedir.Kind.APPEND, redirect);
		case R_READING_STRING:
			return file(FileRedir.Kind.READING_STRING, redirect);
		case R_INPUT_OUTPUT:
			return file(FileRedir.Kind.FROM_TO, redirect);
		case R_OUTPUT_FORCE:
			return file(FileRedir.Kind.CLOBBER, redirect);
		case R_READING_UNTIL:
			return heredoc(redirect, false);
		case R_DEBLANK_READING_UNTIL:
			return heredoc(redirect, true);
		case R_DUPLICATING_INPUT:
			return new DupRedir(DupRedir.Kind.FROM_FD, fd(redirect), targetFd(redirect), false);
		case R_DUPLICATING_OUTPUT:
			return new DupRedir(DupRedir.Kind.TO_FD, fd(redirect), targetFd(redirect), false);
		case R_MOVE_INPUT:
			return new DupRedir(DupRedir.Kind.FROM_FD, fd(redirect), targetFd(redirect), true);
		case R_MOVE_OUTPUT:
			return new DupRedir(DupRedir.Kind.TO_FD, fd(redirect), targetFd(redirect), true);
		case R_DUPLICATING_INPUT_WORD:
			return new DupRedir(DupRedir.Kind.FROM_FD, fd(redirect), FdTarget.named(target(redirect)), false);
		case R_DUPLICATING_OUTPUT_WORD:
			return new DupRedir(DupRedir.Kind.TO_FD, fd(redirect), FdTarget.named(target(redirect)), false);
		case R_MOVE_INPUT_WORD:
			return new DupRedir(DupRedir.Kind.FROM_FD, fd(redirect), FdTarget.named(target(redirect)), true);
		case R_MOVE_OUTPUT_WORD:
			return new DupRedir(DupRedir.Kind.TO_FD, fd(redirect), FdTarget.named(target(redirect)), true);
		case R_CLOSE_THIS:
			return new SingleArgRedir(SingleArgRedir.Kind.CLOSE_THIS, fd(redirect));
		case R_ERR_AND_OUT:
			return new SingleArgRedir(SingleArgRedir.Kind.ERR_AND_OUT, FdTarget.named(target(redirect)));
		case R_APPEND_ERR_AND_OUT:
			return new SingleArgRedir(SingleArgRedir.Kind.APPEND_ERR_AND_OUT, FdTarget.named(target(redirect)));
		case R_INPUTA_DIRECTION:
		default:
			throw new UnsupportedConstructException(redirect.getInstruction().name());
		}
	}

	private static FileRedir file(FileRedir.Kind kind, Redirect redirect) {
		return new FileRedir(kind, fd(redirect), target(redirect));
	}

	private static HeredocRedir heredoc(Redirect redirect, boolean stripLeadingTabs) {
		Redirectee document = redirect.getRedirectee();
		Word body = document == null ? Word.EMPTY : word(document.getFilename());
		String eof = redirect.getHereDocEof();
		boolean quoted = eof != null && (eof.indexOf('\'') >= 0 || eof.indexOf('"') >= 0 || eof.indexOf('\\') >= 0);
		String delimiter = quoted ? eof.replaceAll("\\\\(.)|['\"]", "$1") : eof;
		return new HeredocRedir(quoted ? HeredocRedir.Kind.HERE : HeredocRedir.Kind.XHERE, fd(redirect), body, stripLeadingTabs, delimiter);
	}

	/**
	 * The redirected descriptor: a number, or a {@code {var}} name.
	 */
	private static FdTarget fd(Redirect redirect) {
		Redirectee redirector = redirect.getRedirector();
		if (redirect.getRflags().contains(RedirectFlag.REDIR_VARASSIGN)) {
			if (redirector == null || redirector.getFilename() == null) {
				throw new InvalidRedirectionTargetException(AstNode.NO_LINE, redirect.getInstruction().name(), "missing descriptor variable");
			}
			return FdTarget.named(word(redirector.getFilename()));
		}
		if (redirector == null || redirector.getDest() == null) {
			throw new InvalidRedirectionTargetException(AstNode.NO_LINE, redirect.getInstruction().name(), "missing descriptor");
		}
		return FdTarget.fixed(redirector.getDest());
	}

	private static FdTarget targetFd(Redirect redirect) {
		Redirectee redirectee = redirect.getRedirectee();
		if (redirectee == null || redirectee.getDest() == null) {
			throw new InvalidRedirectionTargetException(AstNode.NO_LINE, redirect.getInstruction().name(), "missing target descriptor");
		}
		return FdTarget.fixed(redirectee.getDest());
	}

	private static Word target(Redirect redirect) {
		Redirectee redirectee = redirect.getRedirectee();
		if (redirectee == null || redirectee.getFilename() == null) {
			throw new InvalidRedirectionTargetException(AstNode.NO_LINE, redirect.getInstruction().name(), "missing file operand");
		}
		return word(redirectee.getFilename());
	}

	/**
	 * State of one translation.
	 * <p>
	 * Whether a command sits inside a function body is a parameter of its
	 * task, so it is scoped to the function's subtree.
	 */
	private static final class Translation {

		private final WorkList work = new WorkList();

		Deferred<Command> submit(BashCommand command, boolean insideFunction) {
			return work.submit(() -> command(command, insideFunction));
		}

		Deferred<Command> optional(BashCommand command, boolean insideFunction) {
			return command == null ? Deferred.<Command>of(null) : submit(command, insideFunction);
		}

		Supplier<Command> command(BashCommand command, boolean insideFunction) {
			List<Redirect> redirects = command.getRedirects();
			Supplier<Command> node;
			switch (command.getType()) {
			case CM_SIMPLE: {
				SimpleCom simple = value(command, SimpleCom.class);
				return flags(command, () -> simple(simple, redirects));
			}
			case CM_CONNECTION: {
				Connection connection = value(command, Connection.class);
				if (connection.getConnector() == ConnectionType.AMPERSAND) {
					Deferred<Command> left = submit(connection.getFirst(), insideFunction);
					Deferred<Command> tail = optional(connection.getSecond(), insideFunction);
					return flags(command, () -> new Background(AstNode.NO_LINE, left.get(), redirections(redirects), tail.get()));
				}
				node = connection(connection, insideFunction);
				break;
			}
			case CM_SUBSHELL: {
				SubshellCom subshell = value(command, SubshellCom.class);
				Deferred<Command> body = submit(subshell.getCommand(), insideFunction);
				return flags(command, () -> new Subshell(line(subshell.getLine()), body.get(), redirections(redirects)));
			}
			case CM_GROUP: {
				// the braces are printed back wherever the grouping matters
				Deferred<Command> body = submit(value(command, GroupCom.class).getCommand(), insideFunction);
				node = body::get;
				break;
			}
			case CM_FOR: {
				ForCom loop = value(command, ForCom.class);
				Deferred<Command> body = submit(loop.getAction(), insideFunction);
				node = () -> new For(line(loop.getLine()), word(loop.getName()), words(loop.getMapList()), body.get());
				break;
			}
			case CM_SELECT: {
				SelectCom loop = value(command, SelectCom.class);
				Deferred<Command> body = submit(loop.getAction(), insideFunction);
				node = () -> new Select(line(loop.getLine()), word(loop.getName()), words(loop.getMapList()), body.get());
				break;
			}
			case CM_CASE:
				node = caseCommand(value(command, CaseCom.class), insideFunction);
				break;
			case CM_WHILE: {
				WhileCom loop = value(command, WhileCom.class);
				Deferred<Command> test = submit(loop.getTest(), insideFunction);
				Deferred<Command> body = submit(loop.getAction(), insideFunction);
				node = () -> new While(test.get(), body.get());
				break;
			}
			case CM_UNTIL: {
				WhileCom loop = value(command, WhileCom.class);
				Deferred<Command> test = submit(loop.getTest(), insideFunction);
				Deferred<Command> body = submit(loop.getAction(), insideFunction);
				node = () -> new While(not(test.get()), body.get());
				break;
			}
			case CM_IF: {
				IfCom conditional = value(command, IfCom.class);
				Deferred<Command> test = submit(conditional.getTest(), insideFunction);
				Deferred<Command> thenBranch = submit(conditional.getTrueCase(), insideFunction);
				Deferred<Command> elseBranch = optional(conditional.getFalseCase(), insideFunction);
				node = () -> new If(test.get(), thenBranch.get(), elseBranch.get());
				break;
			}
			case CM_FUNCTION_DEF: {
				FunctionDef function = value(command, FunctionDef.class);
				Deferred<Command> body = submit(function.getCommand(), true);
				node = () -> new Defun(line(function.getLine()), word(function.getName()), body.get(), true);
				break;
			}
			case CM_ARITH: {
				ArithCom arith = value(command, ArithCom.class);
				node = () -> new Arith(line(arith.getLine()), words(arith.getExp()));
				break;
			}
			case CM_ARITH_FOR: {
				ArithForCom loop = value(command, ArithForCom.class);
				Deferred<Command> body = submit(loop.getAction(), insideFunction);
				node = () -> new ArithFor(line(loop.getLine()), words(loop.getInit()), words(loop.getTest()), words(loop.getStep()), body.get());
				break;
			}
			case CM_COND: {
				Deferred<Cond> cond = cond(value(command, CondCom.class));
				node = cond::get;
				break;
			}
			case CM_COPROC: {
				CoprocCom coproc = value(command, CoprocCom.class);
				Deferred<Command> body = submit(coproc.getCommand(), insideFunction);
				node = () -> new Coproc(coproc.getName() == null ? Word.EMPTY : Word.verbatim(coproc.getName()), body.get());
				break;
			}
			default:
				throw new UnsupportedConstructException(line(command.getLine()), command.getType().name());
			}
			Supplier<Command> built = node;
			return flags(command, () -> {
				Command inner = built.get();
				return redirects.isEmpty() ? inner : new Redir(AstNode.NO_LINE, inner, redirections(redirects));
			});
		}

		private Supplier<Command> connection(Connection connection, boolean insideFunction) {
			Deferred<Command> first = submit(connection.getFirst(), insideFunction);
			Deferred<Command> second = optional(connection.getSecond(), insideFunction);
			switch (connection.getConnector()) {
			case SEMICOLON:
				return () -> second.get() == null ? first.get() : new Semi(first.get(), second.get(), insideFunction);
			case NEWLINE:
				return () -> second.get() == null ? first.get() : new Semi(first.get(), second.get(), false);
			case PIPE:
				return () -> second.get() == null
						? Canonicalization.pipe(Collections.singletonList(first.get()))
						: Canonicalization.pipe(first.get(), second.get());
			case AND_AND:
				return () -> new And(first.get(), required(second.get(), "&&"), !Canonicalization.isConnective(second.get()));
			case OR_OR:
				return () -> new Or(first.get(), required(second.get(), "||"), !Canonicalization.isConnective(second.get()));
			default:
				throw new UnsupportedConstructException(connection.getConnector().name());
			}
		}

		private Supplier<Command> caseCommand(CaseCom caseCom, boolean insideFunction) {
			List<Deferred<Command>> bodies = new ArrayList<>();
			for (Pattern pattern : caseCom.getClauses()) {
				if (pattern.getFlags().contains(PatternFlag.CASEPAT_TESTNEXT)) {
					throw new UnsupportedConstructException(line(caseCom.getLine()), ";;&");
				}
				bodies.add(optional(pattern.getAction(), insideFunction));
			}
			return () -> {
				List<Case.Clause> clauses = new ArrayList<>(bodies.size());
				for (int i = 0; i < bodies.size(); i++) {
					Pattern pattern = caseCom.getClauses().get(i);
					clauses.add(new Case.Clause(words(pattern.getPatterns()), bodies.get(i).get(),
							pattern.getFlags().contains(PatternFlag.CASEPAT_FALLTHROUGH)));
				}
				return new Case(line(caseCom.getLine()), word(caseCom.getWord()), clauses);
			};
		}

		private Deferred<Cond> cond(CondCom cond) {
			return work.submit(() -> {
				Deferred<Cond> left = cond.getLeft() == null ? Deferred.<Cond>of(null) : cond(cond.getLeft());
				Deferred<Cond> right = cond.getRight() == null ? Deferred.<Cond>of(null) : cond(cond.getRight());
				Cond.Kind kind = Cond.Kind.fromCode(cond.getType().getValue());
				return () -> {
					boolean complete;
					switch (kind) {
					case TERM:
						complete = cond.getOp() != null;
						break;
					case UNARY:
						complete = cond.getOp() != null && left.get() != null;
						break;
					case BINARY:
						complete = cond.getOp() != null && left.get() != null && right.get() != null;
						break;
					case AND:
					case OR:
						complete = left.get() != null && right.get() != null;
						break;
					default:
						complete = left.get() != null;
						break;
					}
					if (!complete) {
						throw new ShastaException(line(cond.getLine()), cond.getType().name(), "Incomplete conditional expression");
					}
					return new Cond(line(cond.getLine()), kind, cond.getOp() == null ? null : word(cond.getOp()),
							left.get(), right.get(), cond.getFlags().contains(CommandFlag.CMD_INVERT_RETURN));
				};
			});
		}

		/**
		 * Applies the {@code !} and {@code time} flags of a command.
		 */
		private Supplier<Command> flags(BashCommand command, Supplier<Command> node) {
			Set<CommandFlag> flags = command.getFlags();
			return () -> {
				Command result = node.get();
				if (flags.contains(CommandFlag.CMD_INVERT_RETURN)) {
					result = not(result);
				}
				if (flags.contains(CommandFlag.CMD_TIME_PIPELINE)) {
					result = new Time(flags.contains(CommandFlag.CMD_TIME_POSIX), result);
				}
				return result;
			};
		}
	}

	private static Not not(Command body) {
		return new Not(body, !Canonicalization.isConnective(body));
	}

	private static Command required(Command command, String connector) {
		if (command == null) {
			throw new UnsupportedConstructException(connector + " without a right operand");
		}
		return command;
	}
}
