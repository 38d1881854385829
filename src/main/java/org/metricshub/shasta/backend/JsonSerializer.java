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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
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
import org.metricshub.shasta.util.WorkList;
import org.metricshub.shasta.util.WorkList.Deferred;

/**
 * Structural serialization of canonical trees, as nested
 * {@code [tag, payload]} arrays shaped like libdash's JSON output, so that the
 * POSIX front end reads back what this serializer writes.
 * <p>
 * A word is an array of characters, a missing line number is {@code null}
 * and a file descriptor is either a number or {@code ["var", word]}.
 */
public class JsonSerializer {

	private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

	private static final ObjectMapper MAPPER = new ObjectMapper();

	/**
	 * @param node any node
	 * @return its JSON tree
	 */
	public JsonNode toJson(AstNode node) {
		Walk walk = new Walk();
		return walk.work.run(() -> walk.node(node));
	}

	/**
	 * @param script top-level commands
	 * @return an array with the JSON tree of each command
	 */
	public ArrayNode toJson(List<? extends Command> script) {
		Walk walk = new Walk();
		return walk.work.run(() -> {
			List<Deferred<JsonNode>> commands = new ArrayList<>(script.size());
			for (Command command : script) {
				commands.add(walk.command(command));
			}
			return () -> array(Deferred.all(commands));
		});
	}

	/**
	 * @param node any node
	 * @return its JSON text
	 */
	public String toJsonString(AstNode node) {
		try {
			return MAPPER.writeValueAsString(toJson(node));
		} catch (JsonProcessingException e) {
			// a tree of plain JSON nodes always serializes
			throw new IllegalStateException(e);
		}
	}

	private static ArrayNode tagged(String tag, JsonNode payload) {
		ArrayNode result = FACTORY.arrayNode(2);
		result.add(tag);
		result.add(payload);
		return result;
	}

	private static ArrayNode array(List<? extends JsonNode> elements) {
		ArrayNode result = FACTORY.arrayNode(elements.size());
		result.addAll(elements);
		return result;
	}

	private static ArrayNode array(JsonNode... elements) {
		ArrayNode result = FACTORY.arrayNode(elements.length);
		for (JsonNode element : elements) {
			result.add(element == null ? FACTORY.nullNode() : element);
		}
		return result;
	}

	private static JsonNode line(int line) {
		return line == AstNode.NO_LINE ? FACTORY.nullNode() : FACTORY.numberNode(line);
	}

	/**
	 * State of one serialization.
	 */
	private static final class Walk {

		private final WorkList work = new WorkList();
		private final CommandSerializer commandSerializer = new CommandSerializer();
		private final CharSerializer charSerializer = new CharSerializer();
		private final RedirectionSerializer redirectionSerializer = new RedirectionSerializer();

		Supplier<JsonNode> node(AstNode node) {
			if (node instanceof Command) {
				return ((Command) node).accept(commandSerializer);
			}
			if (node instanceof ArgChar) {
				return ((ArgChar) node).accept(charSerializer);
			}
			if (node instanceof RedirectionNode) {
				return ((RedirectionNode) node).accept(redirectionSerializer);
			}
			Deferred<JsonNode> assignment = assignment((AssignNode) node);
			return assignment::get;
		}

		Deferred<JsonNode> command(Command command) {
			return work.submit(() -> command.accept(commandSerializer));
		}

		Deferred<JsonNode> optionalCommand(Command command) {
			return command == null ? Deferred.<JsonNode>of(FACTORY.nullNode()) : command(command);
		}

		Deferred<JsonNode> commands(List<? extends Command> commands) {
			return work.submit(() -> {
				List<Deferred<JsonNode>> items = new ArrayList<>(commands.size());
				for (Command command : commands) {
					items.add(command(command));
				}
				return () -> array(Deferred.all(items));
			});
		}

		Deferred<JsonNode> word(Word word) {
			return work.submit(() -> {
				List<Deferred<JsonNode>> chars = new ArrayList<>(word.size());
				for (ArgChar c : word) {
					chars.add(work.submit(() -> c.accept(charSerializer)));
				}
				return () -> array(Deferred.all(chars));
			});
		}

		Deferred<JsonNode> words(List<Word> words) {
			return work.submit(() -> {
				List<Deferred<JsonNode>> items = new ArrayList<>(words.size());
				for (Word word : words) {
					items.add(word(word));
				}
				return () -> array(Deferred.all(items));
			});
		}

		Deferred<JsonNode> assignment(AssignNode assignment) {
			return work.submit(() -> {
				Deferred<JsonNode> value = word(assignment.getValue());
				return () -> array(FACTORY.textNode(assignment.getName()), value.get());
			});
		}

		Deferred<JsonNode> redirections(List<RedirectionNode> redirections) {
			return work.submit(() -> {
				List<Deferred<JsonNode>> items = new ArrayList<>(redirections.size());
				for (RedirectionNode redirection : redirections) {
					items.add(work.submit(() -> redirection.accept(redirectionSerializer)));
				}
				return () -> array(Deferred.all(items));
			});
		}

		Deferred<JsonNode> fd(FdTarget fd) {
			if (fd.isFixed()) {
				return Deferred.<JsonNode>of(FACTORY.numberNode(((FdTarget.Fixed) fd).getFd()));
			}
			Deferred<JsonNode> name = word(((FdTarget.Named) fd).getWord());
			return work.submit(() -> () -> array(FACTORY.textNode("var"), name.get()));
		}

		private final class CharSerializer implements ArgCharVisitor<Supplier<JsonNode>> {

			@Override
			public Supplier<JsonNode> visitLiteral(Literal c) {
				return () -> tagged("C", FACTORY.numberNode(c.getCodePoint()));
			}

			@Override
			public Supplier<JsonNode> visitEscaped(Escaped c) {
				return () -> tagged("E", FACTORY.numberNode(c.getCodePoint()));
			}

			@Override
			public Supplier<JsonNode> visitTildeUser(TildeUser c) {
				if (c.getUser() == null) {
					return () -> tagged("T", FACTORY.textNode("None"));
				}
				return () -> tagged("T", array(FACTORY.textNode("Some"), FACTORY.textNode(c.getUser())));
			}

			@Override
			public Supplier<JsonNode> visitArithSub(ArithSub c) {
				Deferred<JsonNode> expression = word(c.getExpression());
				return () -> tagged("A", expression.get());
			}

			@Override
			public Supplier<JsonNode> visitVarExpand(VarExpand c) {
				Deferred<JsonNode> argument = word(c.getArgument());
				return () -> tagged("V", array(
						FACTORY.textNode(c.getFormat().getJsonName()),
						FACTORY.booleanNode(c.isNullSemantics()),
						FACTORY.textNode(c.getName()),
						argument.get()));
			}

			@Override
			public Supplier<JsonNode> visitQuoted(Quoted c) {
				Deferred<JsonNode> inner = word(c.getInner());
				return () -> tagged("Q", inner.get());
			}

			@Override
			public Supplier<JsonNode> visitCmdSub(CmdSub c) {
				Deferred<JsonNode> body = command(c.getBody());
				return () -> tagged("B", body.get());
			}
		}

		private final class RedirectionSerializer implements RedirectionVisitor<Supplier<JsonNode>> {

			@Override
			public Supplier<JsonNode> visitFile(FileRedir r) {
				Deferred<JsonNode> fd = fd(r.getFd());
				Deferred<JsonNode> target = word(r.getTarget());
				return () -> tagged("File", array(FACTORY.textNode(r.getKind().getJsonName()), fd.get(), target.get()));
			}

			@Override
			public Supplier<JsonNode> visitDup(DupRedir r) {
				Deferred<JsonNode> fd = fd(r.getFd());
				// libdash holds the target as a word
				FdTarget target = r.getTarget();
				Deferred<JsonNode> targetWord = word(target.isFixed()
						? Word.literal(Integer.toString(((FdTarget.Fixed) target).getFd()))
						: ((FdTarget.Named) target).getWord());
				return () -> tagged("Dup", array(
						FACTORY.textNode(r.getKind().getJsonName()),
						fd.get(),
						targetWord.get(),
						FACTORY.booleanNode(r.isMove())));
			}

			@Override
			public Supplier<JsonNode> visitHeredoc(HeredocRedir r) {
				Deferred<JsonNode> fd = fd(r.getFd());
				Deferred<JsonNode> body = word(r.getBody());
				return () -> tagged("Heredoc", array(
						FACTORY.textNode(r.getKind().getJsonName()),
						fd.get(),
						body.get(),
						r.getDelimiter() == null ? FACTORY.nullNode() : FACTORY.textNode(r.getDelimiter())));
			}

			@Override
			public Supplier<JsonNode> visitSingleArg(SingleArgRedir r) {
				Deferred<JsonNode> fd = fd(r.getFd());
				return () -> tagged("SingleArg", array(FACTORY.textNode(r.getKind().getJsonName()), fd.get()));
			}
		}

		private final class CommandSerializer implements CommandVisitor<Supplier<JsonNode>> {

			@Override
			public Supplier<JsonNode> visitPipe(Pipe node) {
				Deferred<JsonNode> items = commands(node.getItems());
				return () -> tagged("Pipe", array(FACTORY.booleanNode(node.isBackground()), items.get()));
			}

			@Override
			public Supplier<JsonNode> visitSimple(Simple node) {
				List<Deferred<JsonNode>> assignments = new ArrayList<>();
				for (AssignNode assignment : node.getAssignments()) {
					assignments.add(assignment(assignment));
				}
				Deferred<JsonNode> arguments = words(node.getArguments());
				Deferred<JsonNode> redirections = redirections(node.getRedirections());
				return () -> tagged("Command", array(
						line(node.getLine()),
						array(Deferred.all(assignments)),
						arguments.get(),
						redirections.get()));
			}

			@Override
			public Supplier<JsonNode> visitSubshell(Subshell node) {
				Deferred<JsonNode> body = command(node.getBody());
				Deferred<JsonNode> redirections = redirections(node.getRedirections());
				return () -> tagged("Subshell", array(line(node.getLine()), body.get(), redirections.get()));
			}

			@Override
			public Supplier<JsonNode> visitAnd(And node) {
				return binary("And", node.getLeft(), node.getRight());
			}

			@Override
			public Supplier<JsonNode> visitOr(Or node) {
				return binary("Or", node.getLeft(), node.getRight());
			}

			@Override
			public Supplier<JsonNode> visitSemi(Semi node) {
				return binary("Semi", node.getLeft(), node.getRight());
			}

			private Supplier<JsonNode> binary(String tag, Command left, Command right) {
				Deferred<JsonNode> l = command(left);
				Deferred<JsonNode> r = command(right);
				return () -> tagged(tag, array(l.get(), r.get()));
			}

			@Override
			public Supplier<JsonNode> visitNot(Not node) {
				Deferred<JsonNode> body = command(node.getBody());
				return () -> tagged("Not", body.get());
			}

			@Override
			public Supplier<JsonNode> visitRedir(Redir node) {
				Deferred<JsonNode> inner = command(node.getNode());
				Deferred<JsonNode> redirections = redirections(node.getRedirections());
				return () -> tagged("Redir", array(line(node.getLine()), inner.get(), redirections.get()));
			}

			@Override
			public Supplier<JsonNode> visitBackground(Background node) {
				Deferred<JsonNode> inner = command(node.getNode());
				Deferred<JsonNode> redirections = redirections(node.getRedirections());
				Deferred<JsonNode> tail = node.getTail() == null ? null : command(node.getTail());
				return () -> {
					ArrayNode payload = array(line(node.getLine()), inner.get(), redirections.get());
					if (tail != null) {
						payload.add(tail.get());
					}
					return tagged("Background", payload);
				};
			}

			@Override
			public Supplier<JsonNode> visitDefun(Defun node) {
				Deferred<JsonNode> name = word(node.getName());
				Deferred<JsonNode> body = command(node.getBody());
				return () -> tagged("Defun", array(line(node.getLine()), name.get(), body.get()));
			}

			@Override
			public Supplier<JsonNode> visitFor(For node) {
				Deferred<JsonNode> items = words(node.getItems());
				Deferred<JsonNode> body = command(node.getBody());
				Deferred<JsonNode> variable = word(node.getVariable());
				return () -> tagged("For", array(line(node.getLine()), items.get(), body.get(), variable.get()));
			}

			@Override
			public Supplier<JsonNode> visitWhile(While node) {
				return binary("While", node.getTest(), node.getBody());
			}

			@Override
			public Supplier<JsonNode> visitIf(If node) {
				Deferred<JsonNode> condition = command(node.getCondition());
				Deferred<JsonNode> thenBranch = command(node.getThenBranch());
				Deferred<JsonNode> elseBranch = optionalCommand(node.getElseBranch());
				return () -> tagged("If", array(condition.get(), thenBranch.get(), elseBranch.get()));
			}

			@Override
			public Supplier<JsonNode> visitCase(Case node) {
				Deferred<JsonNode> subject = word(node.getSubject());
				List<Deferred<JsonNode>> patterns = new ArrayList<>();
				List<Deferred<JsonNode>> bodies = new ArrayList<>();
				for (Case.Clause clause : node.getClauses()) {
					patterns.add(words(clause.getPatterns()));
					bodies.add(optionalCommand(clause.getBody()));
				}
				return () -> {
					ArrayNode clauses = FACTORY.arrayNode();
					for (int i = 0; i < patterns.size(); i++) {
						ObjectNode clause = clauses.addObject();
						clause.set("cpattern", patterns.get(i).get());
						clause.set("cbody", bodies.get(i).get());
						if (node.getClauses().get(i).isFallthrough()) {
							clause.put("fallthrough", true);
						}
					}
					return tagged("Case", array(line(node.getLine()), subject.get(), clauses));
				};
			}

			@Override
			public Supplier<JsonNode> visitGroup(Group node) {
				Deferred<JsonNode> body = command(node.getBody());
				return () -> tagged("Group", body.get());
			}

			@Override
			public Supplier<JsonNode> visitSelect(Select node) {
				Deferred<JsonNode> variable = word(node.getVariable());
				Deferred<JsonNode> body = command(node.getBody());
				Deferred<JsonNode> items = words(node.getItems());
				return () -> tagged("Select", array(line(node.getLine()), variable.get(), body.get(), items.get()));
			}

			@Override
			public Supplier<JsonNode> visitArith(Arith node) {
				Deferred<JsonNode> body = words(node.getBody());
				return () -> tagged("Arith", array(line(node.getLine()), body.get()));
			}

			@Override
			public Supplier<JsonNode> visitCond(Cond node) {
				Deferred<JsonNode> op = node.getOp() == null ? Deferred.<JsonNode>of(FACTORY.nullNode()) : word(node.getOp());
				Deferred<JsonNode> left = optionalCommand(node.getLeft());
				Deferred<JsonNode> right = optionalCommand(node.getRight());
				return () -> tagged("Cond", array(
						line(node.getLine()),
						FACTORY.numberNode(node.getKind().getCode()),
						op.get(),
						left.get(),
						right.get(),
						FACTORY.booleanNode(node.isNegate())));
			}

			@Override
			public Supplier<JsonNode> visitArithFor(ArithFor node) {
				Deferred<JsonNode> init = words(node.getInit());
				Deferred<JsonNode> condition = words(node.getCondition());
				Deferred<JsonNode> step = words(node.getStep());
				Deferred<JsonNode> body = command(node.getBody());
				return () -> tagged("ArithFor", array(line(node.getLine()), init.get(), condition.get(), step.get(), body.get()));
			}

			@Override
			public Supplier<JsonNode> visitCoproc(Coproc node) {
				Deferred<JsonNode> name = word(node.getName());
				Deferred<JsonNode> body = command(node.getBody());
				return () -> tagged("Coproc", array(name.get(), body.get()));
			}

			@Override
			public Supplier<JsonNode> visitTime(Time node) {
				Deferred<JsonNode> body = command(node.getBody());
				return () -> tagged("Time", array(FACTORY.booleanNode(node.isPosixFormat()), body.get()));
			}
		}
	}
}
