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
 * Parameter expansion: {@code ${name}}, {@code ${name:-arg}},
 * {@code ${#name}}...
 */
public final class VarExpand extends ArgChar {

	/**
	 * The operator applied to the parameter, named as libdash names them.
	 */
	public enum Format {
		NORMAL("Normal", ""),
		MINUS("Minus", "-"),
		PLUS("Plus", "+"),
		QUESTION("Question", "?"),
		ASSIGN("Assign", "="),
		TRIM_R("TrimR", "%"),
		TRIM_R_MAX("TrimRMax", "%%"),
		TRIM_L("TrimL", "#"),
		TRIM_L_MAX("TrimLMax", "##"),
		LENGTH("Length", "#");

		private final String jsonName;
		private final String operator;

		Format(String jsonName, String operator) {
			this.jsonName = jsonName;
			this.operator = operator;
		}

		public String getJsonName() {
			return jsonName;
		}

		public String getOperator() {
			return operator;
		}

		/**
		 * @param name a libdash format name
		 * @return the matching format, or {@code null}
		 */
		public static Format fromJsonName(String name) {
			for (Format format : values()) {
				if (format.jsonName.equals(name)) {
					return format;
				}
			}
			return null;
		}
	}

	private final Format format;
	private final boolean nullSemantics;
	private final String name;
	private final Word argument;

	/**
	 * @param format the operator
	 * @param nullSemantics whether the operator also applies to set-but-empty
	 *        parameters (the {@code :} variants)
	 * @param name the parameter name
	 * @param argument the operator's word
	 */
	public VarExpand(Format format, boolean nullSemantics, String name, Word argument) {
		this.format = Objects.requireNonNull(format, "format");
		this.nullSemantics = nullSemantics;
		this.name = Objects.requireNonNull(name, "name");
		this.argument = Objects.requireNonNull(argument, "argument");
	}

	public Format getFormat() {
		return format;
	}

	public boolean isNullSemantics() {
		return nullSemantics;
	}

	public String getName() {
		return name;
	}

	public Word getArgument() {
		return argument;
	}

	@Override
	public <R> R accept(ArgCharVisitor<R> visitor) {
		return visitor.visitVarExpand(this);
	}
}
