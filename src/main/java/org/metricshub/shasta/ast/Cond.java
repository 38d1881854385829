package org.metricshub.shasta.ast;

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

import java.util.Objects;

/**
 * bash's conditional expression, {@code [[ ... ]]}. A tree of {@link Cond}
 * nodes: only the root prints the brackets.
 */
public final class Cond extends Command {

	/**
	 * Shape of a conditional node, numbered like bash's {@code COND_*}
	 * constants.
	 */
	public enum Kind {
		AND(1),
		OR(2),
		UNARY(3),
		BINARY(4),
		TERM(5),
		EXPR(6);

		private final int code;

		Kind(int code) {
			this.code = code;
		}

		public int getCode() {
			return code;
		}

		/**
		 * @param code a {@code COND_*} value
		 * @return the matching kind, or {@code null}
		 */
		public static Kind fromCode(int code) {
			for (Kind kind : values()) {
				if (kind.code == code) {
					return kind;
				}
			}
			return null;
		}
	}

	private final int line;
	private final Kind kind;
	private final Word op;
	private final Cond left;
	private final Cond right;
	private final boolean negate;

	/**
	 * @param line source line
	 * @param kind node shape
	 * @param op the operator ({@code -f}, {@code ==}) or, for {@link Kind#TERM},
	 *        the operand word; {@code null} for the other kinds
	 * @param left left or only operand
	 * @param right right operand
	 * @param negate whether the node is prefixed with {@code !}
	 */
	public Cond(int line, Kind kind, Word op, Cond left, Cond right, boolean negate) {
		this.line = Nodes.line(line);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.op = op;
		this.left = left;
		this.right = right;
		this.negate = negate;
		switch (kind) {
		case TERM:
			Objects.requireNonNull(op, "op");
			break;
		case UNARY:
			Objects.requireNonNull(op, "op");
			Objects.requireNonNull(left, "left");
			break;
		case BINARY:
			Objects.requireNonNull(op, "op");
			Objects.requireNonNull(left, "left");
			Objects.requireNonNull(right, "right");
			break;
		case AND:
		case OR:
			Objects.requireNonNull(left, "left");
			Objects.requireNonNull(right, "right");
			break;
		case EXPR:
		default:
			Objects.requireNonNull(left, "left");
			break;
		}
	}

	/**
	 * @param word the operand
	 * @return a {@link Kind#TERM} node
	 */
	public static Cond term(Word word) {
		return new Cond(NO_LINE, Kind.TERM, word, null, null, false);
	}

	/**
	 * @return the same node with its {@code !} prefix toggled
	 */
	public Cond negated() {
		return new Cond(line, kind, op, left, right, !negate);
	}

	public int getLine() {
		return line;
	}

	public Kind getKind() {
		return kind;
	}

	public Word getOp() {
		return op;
	}

	public Cond getLeft() {
		return left;
	}

	public Cond getRight() {
		return right;
	}

	public boolean isNegate() {
		return negate;
	}

	@Override
	public <R> R accept(CommandVisitor<R> visitor) {
		return visitor.visitCond(this);
	}
}
