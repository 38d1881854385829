package org.metricshub.shasta.frontend;

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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.ArgChar;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.AstNode;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Literal;
import org.metricshub.shasta.ast.Or;
import org.metricshub.shasta.ast.Pipe;
import org.metricshub.shasta.ast.Redir;
import org.metricshub.shasta.ast.RedirectionNode;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.Word;
import org.metricshub.shasta.util.ShastaLogger;
import org.slf4j.Logger;

/**
 * Rules shared by the front-end adapters.
 */
public final class Canonicalization {

	private static final Logger LOG = ShastaLogger.getLogger(Canonicalization.class);

	private Canonicalization() {}

	/**
	 * Decodes raw source text that is printed back as it is.
	 *
	 * @param bytes UTF-8 source text
	 * @return verbatim literals, one per code point and one per byte that is
	 *         not valid UTF-8
	 */
	public static Word verbatim(byte[] bytes) {
		return verbatim(bytes, 0, bytes.length);
	}

	/**
	 * @param bytes UTF-8 source text
	 * @param from offset of the first byte
	 * @param to offset after the last byte
	 * @return verbatim literals, one per code point and one per byte that is
	 *         not valid UTF-8
	 */
	public static Word verbatim(byte[] bytes, int from, int to) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		ByteBuffer in = ByteBuffer.wrap(bytes, from, to - from);
		CharBuffer out = CharBuffer.allocate(to - from + 1);
		List<ArgChar> chars = new ArrayList<>(to - from);
		while (true) {
			CoderResult result = decoder.decode(in, out, true);
			drain(out, chars);
			if (result.isError()) {
				for (int i = 0; i < result.length(); i++) {
					int b = in.get() & 0xff;
					LOG.warn("Undecodable byte 0x{} kept as a raw character", Integer.toHexString(b));
					chars.add(new Literal(b, true));
				}
			} else if (result.isUnderflow()) {
				break;
			}
		}
		decoder.flush(out);
		drain(out, chars);
		return Word.of(chars);
	}

	private static void drain(CharBuffer out, List<ArgChar> chars) {
		out.flip();
		out.toString().codePoints().forEach(cp -> chars.add(new Literal(cp, true)));
		out.clear();
	}

	/**
	 * Attaches redirections to a command: simple commands and subshells hold
	 * their own list, other commands are wrapped in a {@link Redir}.
	 *
	 * @param line line of the wrapper, {@link AstNode#NO_LINE} when unknown
	 * @param node the command
	 * @param redirections redirections to apply, possibly empty
	 * @return the command with its redirections
	 */
	public static Command withRedirections(int line, Command node, List<RedirectionNode> redirections) {
		if (redirections.isEmpty()) {
			return node;
		}
		if (node instanceof Simple) {
			Simple simple = (Simple) node;
			List<RedirectionNode> all = new ArrayList<>(simple.getRedirections());
			all.addAll(redirections);
			return new Simple(simple.getLine(), simple.getAssignments(), simple.getArguments(), all);
		}
		if (node instanceof Subshell) {
			Subshell subshell = (Subshell) node;
			List<RedirectionNode> all = new ArrayList<>(subshell.getRedirections());
			all.addAll(redirections);
			return new Subshell(subshell.getLine(), subshell.getBody(), all);
		}
		return new Redir(line, node, redirections);
	}

	/**
	 * Builds a pipeline out of two stages, merging the stages that are
	 * pipelines themselves, so that {@code a | b | c} is one pipeline of three
	 * stages whichever way the front end nests it.
	 *
	 * @param left left stage
	 * @param right right stage
	 * @return the flat pipeline
	 */
	public static Pipe pipe(Command left, Command right) {
		List<Command> items = new ArrayList<>();
		addStages(items, left);
		addStages(items, right);
		return new Pipe(false, items);
	}

	/**
	 * @param stages the stages, which may be pipelines themselves
	 * @return the flat pipeline
	 */
	public static Pipe pipe(List<? extends Command> stages) {
		List<Command> items = new ArrayList<>();
		for (Command stage : stages) {
			addStages(items, stage);
		}
		return new Pipe(false, items);
	}

	private static void addStages(List<Command> items, Command stage) {
		if (stage instanceof Pipe && !((Pipe) stage).isBackground()) {
			items.addAll(((Pipe) stage).getItems());
		} else {
			items.add(stage);
		}
	}

	/**
	 * A command whose operands are connectives must keep its braces.
	 *
	 * @param node the operand
	 * @return whether {@code node} is an {@link And} or an {@link Or}
	 */
	public static boolean isConnective(Command node) {
		return node instanceof And || node instanceof Or;
	}

	/**
	 * Splits a word of the form {@code NAME=value} into an assignment. Only
	 * plain literal characters may form the name.
	 *
	 * @param word the word
	 * @return the assignment, or {@code null} when the word does not start with
	 *         a valid name followed by {@code =}
	 */
	public static AssignNode assignment(Word word) {
		StringBuilder name = new StringBuilder();
		for (int i = 0; i < word.size(); i++) {
			ArgChar c = word.get(i);
			if (!(c instanceof Literal)) {
				return null;
			}
			int codePoint = ((Literal) c).getCodePoint();
			if (codePoint == '=') {
				if (!isName(name.toString())) {
					return null;
				}
				return new AssignNode(name.toString(), Word.of(word.getChars().subList(i + 1, word.size())));
			}
			name.appendCodePoint(codePoint);
		}
		return null;
	}

	/**
	 * @param text candidate variable name
	 * @return whether {@code text} is a valid shell variable name
	 */
	public static boolean isName(String text) {
		if (text.isEmpty() || !(Character.isLetter(text.charAt(0)) || text.charAt(0) == '_')) {
			return false;
		}
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (!(c < 128 && (Character.isLetterOrDigit(c) || c == '_'))) {
				return false;
			}
		}
		return text.charAt(0) < 128;
	}
}
