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

/**
 * Exhaustive dispatch over the {@link Command} variants. Every consumer of
 * the tree implements all of the methods, so adding a variant breaks the
 * build of every consumer that does not handle it yet.
 *
 * @param <R> result type
 */
public interface CommandVisitor<R> {

	R visitPipe(Pipe node);

	R visitSimple(Simple node);

	R visitSubshell(Subshell node);

	R visitAnd(And node);

	R visitOr(Or node);

	R visitSemi(Semi node);

	R visitNot(Not node);

	R visitRedir(Redir node);

	R visitBackground(Background node);

	R visitDefun(Defun node);

	R visitFor(For node);

	R visitWhile(While node);

	R visitIf(If node);

	R visitCase(Case node);

	R visitGroup(Group node);

	R visitSelect(Select node);

	R visitArith(Arith node);

	R visitCond(Cond node);

	R visitArithFor(ArithFor node);

	R visitCoproc(Coproc node);

	R visitTime(Time node);
}
