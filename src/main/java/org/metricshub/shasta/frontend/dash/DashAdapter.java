package org.metricshub.shasta.frontend.dash;

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
import java.util.List;
import java.util.function.Supplier;
import org.metricshub.shasta.InvalidRedirectionTargetException;
import org.metricshub.shasta.ShastaException;
import org.metricshub.shasta.UnsupportedConstructException;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.ArgChar;
import org.metricshub.shasta.ast.ArithSub;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Background;
import org.metricshub.shasta.ast.Case;
import org.metricshub.shasta.ast.CmdSub;
import org.metricshub.shasta.ast.Command;
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
import org.metricshub.shasta.ast.Semi;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.SingleArgRedir;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.TildeUser;
import org.metricshub.shasta.ast.VarExpand;
import org.metricshub.shasta.ast.While;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.frontend.Canonicalization;
import org.metricshub.shasta.util.ShastaLogger;
import org.metricshub.shasta.util.WorkList;
import org.metricshub.shasta.util.WorkList.Deferred;
import org.slf4j.Logger;

/**
 * Canonicalization of the trees of the POSIX front end, libdash, delivered in
 * its JSON shape: every node is a {@code [tag, payload]} array.
 * <p>
 * libdash already tells assignments from arguments; words of the argument
 * list that still look like {@code NAME=value} are promoted only while they
 * lead the list, as a POSIX shell would read them. The trees written by
 * {@link org.metricshub.shasta.backend.JsonSerializer} are read back as well,
 * as long as they only hold POSIX constructs.
 * <p>
 * An adapter holds no state: each call translates with a work list of its
 * own, so one instance may be shared between threads.
 */
public class DashAdapter {

	private static final Logger LOG = ShastaLogger.getLogger(DashAdapter.class);

	/**
	 * @param node one command, as a {@code [tag, payload]} array
	 * @return the canonical command
	 * @throws UnsupportedConstructException when a tag has no canonical
	 *         counterpart
	 * @throws ShastaException when the tree is malformed
	 */
	public Command toCommand(JsonNode node) {
		Translation translation = new Translation();
		return translation.work.run(() -> translation.command(node));
	}

	/**
	 * @param script an array of top-level commands
	 * @return the canonical commands, in order
	 */
	public List<Command> toCommands(JsonNode script) {
		if (script == null || !script.isArray()) {
			throw new ShastaException(AstNode.NO_LINE, "script", "Expected an array of commands");
		}
		LOG.debug("Translating {} libdash commands", script.size());
		Translation translation = new Translation();
		List<Command> result = translation.work.run(() -> {
			List<Deferred<Command>> commands = new ArrayList<>(script.size());
			for (JsonNode node : script) {
				commands.add(translation.submitCommand(node));
			}
			return () -> Deferred.all(commands);
		});
		LOG.debug("Translated {} libdash commands", result.size());
		return result;
	}

	private static JsonNode payload(JsonNode node, String what) {
		if (node == null || !node.isArray() || node.size() != 2 || !node.get(0).isTextual()) {
			throw new ShastaException(AstNode.NO_LINE, what, "Expected a [tag, payload] array, got " + node);
		}
		return node.get(1);
	}

	private static JsonNode element(JsonNode payload, int index, String tag) {
		if (payload == null || !payload.isArray() || payload.size() <= index) {
			throw new ShastaException(AstNode.NO_LINE, tag, "Malformed " + tag + " payload: " + payload);
		}
		return payload.get(index);
	}

	private static JsonNode optionalElement(JsonNode payload, int index) {
		JsonNode value = payload.size() > index ? payload.get(index) : null;
		return value == null || value.isNull() ? null : value;
	}

	private static int line(JsonNode value) {
		return value == null || !value.isInt() ? AstNode.NO_LINE : value.intValue();
	}

	private static boolean bool(JsonNode value, String tag) {
		if (value.isBoolean()) {
			return value.booleanValue();
		}
		// older libdash bindings print Python booleans as text
		if (value.isTextual() && ("true".equalsIgnoreCase(value.textValue()) || "false".equalsIgnoreCase(value.textValue()))) {
			return Boolean.parseBoolean(value.textValue());
		}
		throw new ShastaException(AstNode.NO_LINE, tag, "Expected a boolean, got " + value);
	}

	private static String text(JsonNode value, String tag) {
		if (!value.isTextual()) {
			throw new ShastaException(AstNode.NO_LINE, tag, "Expected a string, got " + value);
		}
		return value.textValue();
	}

	private static int integer(JsonNode value, String tag) {
		if (!value.isInt()) {
			throw new ShastaException(AstNode.NO_LINE, tag, "Expected an integer, got " + value);
		}
		return value.intValue();
	}

	/**
	 * State of one translation.
	 */
	private static final class Translation {

		private final WorkList work = new WorkList();

		Deferred<Command> submitCommand(JsonNode node) {
			return work.submit(() -> command(node));
		}

		Deferred<Command> optionalCommand(JsonNode node) {
			return node == null || node.isNull() ? Deferred.<Command>of(null) : submitCommand(node);
		}

		Supplier<Command> command(JsonNode node) {
			JsonNode payload = payload(node, "command");
			String tag = node.get(0).textValue();
			switch (tag) {
			case "Command":
				return simple(payload);
			case "Pipe": {
				boolean background = bool(element(payload, 0, tag), tag);
				JsonNode items = element(payload, 1, tag);
				if (!items.isArray() || items.size() == 0) {
					throw new ShastaException(AstNode.NO_LINE, tag, "A pipeline needs at least one stage");
				}
				Deferred<List<Command>> stages = commands(items);
				return () -> {
					Pipe pipe = Canonicalization.pipe(stages.get());
					return background ? new Pipe(true, pipe.getItems()) : pipe;
				};
			}
			case "Subshell": {
				int line = line(element(payload, 0, tag));
				Deferred<Command> body = submitCommand(element(payload, 1, tag));
				Deferred<List<RedirectionNode>> redirections = redirections(element(payload, 2, tag));
				return () -> new Subshell(line, body.get(), redirections.get());
			}
			case "And": {
				Deferred<Command> left = submitCommand(element(payload, 0, tag));
				Deferred<Command> right = submitCommand(element(payload, 1, tag));
				return () -> new And(left.get(), right.get());
			}
			case "Or": {
				Deferred<Command> left = submitCommand(element(payload, 0, tag));
				Deferred<Command> right = submitCommand(element(payload, 1, tag));
				return () -> new Or(left.get(), right.get());
			}
			case "Semi": {
				Deferred<Command> left = submitCommand(element(payload, 0, tag));
				Deferred<Command> right = submitCommand(element(payload, 1, tag));
				return () -> new Semi(left.get(), right.get());
			}
			case "Not": {
				Deferred<Command> body = submitCommand(payload);
				return () -> new Not(body.get());
			}
			case "Redir": {
				int line = line(element(payload, 0, tag));
				Deferred<Command> inner = submitCommand(element(payload, 1, tag));
				Deferred<List<RedirectionNode>> redirections = redirections(element(payload, 2, tag));
				return () -> new Redir(line, inner.get(), redirections.get());
			}
			case "Background": {
				int line = line(element(payload, 0, tag));
				Deferred<Command> inner = submitCommand(element(payload, 1, tag));
				Deferred<List<RedirectionNode>> redirections = redirections(element(payload, 2, tag));
				Deferred<Command> tail = optionalCommand(optionalElement(payload, 3));
				return () -> new Background(line, inner.get(), redirections.get(), tail.get());
			}
			case "Defun": {
				int line = line(element(payload, 0, tag));
				Deferred<Word> name = name(element(payload, 1, tag), tag);
				Deferred<Command> body = submitCommand(element(payload, 2, tag));
				return () -> new Defun(line, name.get(), body.get(), false);
			}
			case "For": {
				int line = line(element(payload, 0, tag));
				Deferred<List<Word>> items = words(element(payload, 1, tag));
				Deferred<Command> body = submitCommand(element(payload, 2, tag));
				Deferred<Word> variable = name(element(payload, 3, tag), tag);
				return () -> new For(line, variable.get(), items.get(), body.get());
			}
			case "While": {
				Deferred<Command> test = submitCommand(element(payload, 0, tag));
				Deferred<Command> body = submitCommand(element(payload, 1, tag));
				return () -> new While(test.get(), body.get());
			}
			case "If": {
				Deferred<Command> condition = submitCommand(element(payload, 0, tag));
				Deferred<Command> thenBranch = submitCommand(element(payload, 1, tag));
				Deferred<Command> elseBranch = optionalCommand(optionalElement(payload, 2));
				return () -> new If(condition.get(), thenBranch.get(), elseBranch.get());
			}
			case "Case":
				return caseCommand(payload);
			case "Group": {
				Deferred<Command> body = submitCommand(payload);
				return () -> new Group(body.get());
			}
			default:
				throw new UnsupportedConstructException(tag);
			}
		}

		private Supplier<Command> simple(JsonNode payload) {
			int line = line(element(payload, 0, "Command"));
			JsonNode assignmentNodes = element(payload, 1, "Command");
			List<String> names = new ArrayList<>();
			List<Deferred<Word>> values = new ArrayList<>();
			for (JsonNode assignment : assignmentNodes) {
				names.add(text(element(assignment, 0, "Command"), "Command"));
				values.add(word(element(assignment, 1, "Command")));
			}
			Deferred<List<Word>> arguments = words(element(payload, 2, "Command"));
			Deferred<List<RedirectionNode>> redirections = redirections(element(payload, 3, "Command"));
			return () -> {
				List<AssignNode> assignments = new ArrayList<>();
				for (int i = 0; i < names.size(); i++) {
					assignments.add(new AssignNode(names.get(i), values.get(i).get()));
				}
				List<Word> words = arguments.get();
				int first = 0;
				while (first < words.size()) {
					AssignNode promoted = Canonicalization.assignment(words.get(first));
					if (promoted == null) {
						break;
					}
					assignments.add(promoted);
					first++;
				}
				return new Simple(line, assignments, words.subList(first, words.size()), redirections.get());
			};
		}

		private Supplier<Command> caseCommand(JsonNode payload) {
			int line = line(element(payload, 0, "Case"));
			Deferred<Word> subject = word(element(payload, 1, "Case"));
			JsonNode clauseNodes = element(payload, 2, "Case");
			List<Deferred<List<Word>>> patterns = new ArrayList<>();
			List<Deferred<Command>> bodies = new ArrayList<>();
			List<Boolean> fallthroughs = new ArrayList<>();
			for (JsonNode clause : clauseNodes) {
				if (!clause.isObject() || !clause.has("cpattern")) {
					throw new ShastaException(line, "Case", "Malformed case clause: " + clause);
				}
				patterns.add(words(clause.get("cpattern")));
				bodies.add(optionalCommand(clause.get("cbody")));
				fallthroughs.add(clause.path("fallthrough").asBoolean(false));
			}
			return () -> {
				List<Case.Clause> clauses = new ArrayList<>(patterns.size());
				for (int i = 0; i < patterns.size(); i++) {
					clauses.add(new Case.Clause(patterns.get(i).get(), bodies.get(i).get(), fallthroughs.get(i)));
				}
				return new Case(line, subject.get(), clauses);
			};
		}

		/**
		 * libdash prints loop variables and function names as strings, the
		 * serializer as words.
		 */
		private Deferred<Word> name(JsonNode value, String tag) {
			if (value.isTextual()) {
				return Deferred.of(Word.literal(value.textValue()));
			}
			if (!value.isArray()) {
				throw new ShastaException(AstNode.NO_LINE, tag, "Expected a name, got " + value);
			}
			return word(value);
		}

		Deferred<List<Command>> commands(JsonNode nodes) {
			return work.submit(() -> {
				List<Deferred<Command>> items = new ArrayList<>(nodes.size());
				for (JsonNode node : nodes) {
					items.add(submitCommand(node));
				}
				return () -> Deferred.all(items);
			});
		}

		Deferred<List<Word>> words(JsonNode nodes) {
			if (!nodes.isArray()) {
				throw new ShastaException(AstNode.NO_LINE, "word", "Expected a list of words, got " + nodes);
			}
			return work.submit(() -> {
				List<Deferred<Word>> items = new ArrayList<>(nodes.size());
				for (JsonNode node : nodes) {
					items.add(word(node));
				}
				return () -> Deferred.all(items);
			});
		}

		Deferred<Word> word(JsonNode chars) {
			if (!chars.isArray()) {
				throw new ShastaException(AstNode.NO_LINE, "word", "Expected a list of characters, got " + chars);
			}
			return work.submit(() -> {
				List<Deferred<ArgChar>> items = new ArrayList<>(chars.size());
				for (JsonNode c : chars) {
					items.add(work.submit(() -> argChar(c)));
				}
				return () -> Word.of(Deferred.all(items));
			});
		}

		private Supplier<ArgChar> argChar(JsonNode node) {
			JsonNode payload = payload(node, "character");
			String tag = node.get(0).textValue();
			switch (tag) {
			case "C": {
				int codePoint = integer(payload, tag);
				return () -> new Literal(codePoint);
			}
			case "E": {
				int codePoint = integer(payload, tag);
				return () -> new Escaped(codePoint);
			}
			case "T": {
				String user = payload.isArray() ? text(element(payload, 1, tag), tag) : null;
				return () -> new TildeUser(user);
			}
			case "A": {
				Deferred<Word> expression = word(payload);
				return () -> new ArithSub(expression.get());
			}
			case "V": {
				String formatName = text(element(payload, 0, tag), tag);
				VarExpand.Format format = VarExpand.Format.fromJsonName(formatName);
				if (format == null) {
					throw new UnsupportedConstructException("V " + formatName);
				}
				boolean nullSemantics = bool(element(payload, 1, tag), tag);
				String name = text(element(payload, 2, tag), tag);
				Deferred<Word> argument = word(element(payload, 3, tag));
				return () -> new VarExpand(format, nullSemantics, name, argument.get());
			}
			case "Q": {
				Deferred<Word> inner = word(payload);
				return () -> new Quoted(inner.get());
			}
			case "B": {
				Deferred<Command> body = submitCommand(payload);
				return () -> new CmdSub(body.get());
			}
			default:
				throw new UnsupportedConstructException(tag);
			}
		}

		Deferred<List<RedirectionNode>> redirections(JsonNode nodes) {
			if (!nodes.isArray()) {
				throw new ShastaException(AstNode.NO_LINE, "redirection", "Expected a list of redirections, got " + nodes);
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
			JsonNode payload = payload(node, "redirection");
			String tag = node.get(0).textValue();
			String kindName = text(element(payload, 0, tag), tag);
			Deferred<FdTarget> fd = fd(element(payload, 1, tag), tag);
			switch (tag) {
			case "File": {
				FileRedir.Kind kind = FileRedir.Kind.fromJsonName(kindName);
				if (kind == null || kind == FileRedir.Kind.READING_STRING) {
					throw new UnsupportedConstructException(tag + " " + kindName);
				}
				Deferred<Word> target = word(element(payload, 2, tag));
				return () -> new FileRedir(kind, fd.get(), target.get());
			}
			case "Dup": {
				DupRedir.Kind kind = DupRedir.Kind.fromJsonName(kindName);
				if (kind == null) {
					throw new UnsupportedConstructException(tag + " " + kindName);
				}
				Deferred<Word> target = word(element(payload, 2, tag));
				JsonNode move = optionalElement(payload, 3);
				boolean isMove = move != null && bool(move, tag);
				return () -> new DupRedir(kind, fd.get(), dupTarget(target.get()), isMove);
			}
			case "Heredoc": {
				HeredocRedir.Kind kind = HeredocRedir.Kind.fromJsonName(kindName);
				if (kind == null) {
					throw new UnsupportedConstructException(tag + " " + kindName);
				}
				Deferred<Word> body = word(element(payload, 2, tag));
				JsonNode delimiter = optionalElement(payload, 3);
				String eof = delimiter == null ? null : text(delimiter, tag);
				// libdash does not record <<-, its bodies are already stripped
				return () -> new HeredocRedir(kind, fd.get(), body.get(), false, eof);
			}
			case "SingleArg": {
				// &> and &>> are bash only
				if (!SingleArgRedir.Kind.CLOSE_THIS.getJsonName().equals(kindName)) {
					throw new UnsupportedConstructException(tag + " " + kindName);
				}
				return () -> new SingleArgRedir(SingleArgRedir.Kind.CLOSE_THIS, fd.get());
			}
			default:
				throw new UnsupportedConstructException(tag);
			}
		}

		private Deferred<FdTarget> fd(JsonNode value, String tag) {
			if (value.isInt()) {
				return Deferred.of(FdTarget.fixed(value.intValue()));
			}
			if (value.isArray() && value.size() == 2 && "var".equals(value.get(0).asText())) {
				Deferred<Word> name = word(value.get(1));
				return work.submit(() -> () -> FdTarget.named(name.get()));
			}
			throw new InvalidRedirectionTargetException(AstNode.NO_LINE, tag, "expected a file descriptor, got " + value);
		}
	}

	/**
	 * A duplication target made of digits is a descriptor number, anything
	 * else ({@code $fd}, {@code -}) is kept as a word.
	 */
	static FdTarget dupTarget(Word target) {
		if (target.isEmpty() || target.size() > 9) {
			return FdTarget.named(target);
		}
		int fd = 0;
		for (ArgChar c : target) {
			if (!(c instanceof Literal)) {
				return FdTarget.named(target);
			}
			int codePoint = ((Literal) c).getCodePoint();
			if (codePoint < '0' || codePoint > '9') {
				return FdTarget.named(target);
			}
			fd = fd * 10 + codePoint - '0';
		}
		return FdTarget.fixed(fd);
	}
}
