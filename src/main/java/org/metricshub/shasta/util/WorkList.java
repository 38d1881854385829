package org.metricshub.shasta.util;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Explicit-stack driver for the tree walks of the adapters, the printer and
 * the JSON serializer.
 * <p>
 * A {@link Task} is expanded once: while expanding, it may {@link #submit(Task)}
 * child tasks and it returns the assembly step that builds its own result out
 * of the results of those children. The work list runs every child (and,
 * transitively, everything they submit) before calling the assembly step, so
 * the tree is processed bottom-up without the Java call stack growing with the
 * depth of the tree.
 * <p>
 * A work list is not thread-safe. Use one instance per top-level walk.
 */
public final class WorkList {

	/**
	 * One unit of work.
	 *
	 * @param <T> type of the value the task produces
	 */
	@FunctionalInterface
	public interface Task<T> {

		/**
		 * Submits the child tasks this task depends on.
		 *
		 * @return the step assembling the result once all children completed
		 */
		Supplier<T> expand();
	}

	/**
	 * A value that becomes available once its task has been assembled.
	 *
	 * @param <T> type of the value
	 */
	public static final class Deferred<T> {

		private T value;
		private boolean done;

		private Deferred() {}

		/**
		 * @param value an already known value
		 * @param <T> type of the value
		 * @return a completed {@link Deferred}
		 */
		public static <T> Deferred<T> of(T value) {
			Deferred<T> deferred = new Deferred<>();
			deferred.complete(value);
			return deferred;
		}

		private void complete(T result) {
			value = result;
			done = true;
		}

		/**
		 * @return the value
		 * @throws IllegalStateException when read before its task completed
		 */
		public T get() {
			if (!done) {
				throw new IllegalStateException("Deferred value read before its task completed");
			}
			return value;
		}

		/**
		 * @param deferreds completed values
		 * @param <T> type of the values
		 * @return the values, in order
		 */
		public static <T> List<T> all(List<Deferred<T>> deferreds) {
			List<T> values = new ArrayList<>(deferreds.size());
			for (Deferred<T> deferred : deferreds) {
				values.add(deferred.get());
			}
			return Collections.unmodifiableList(values);
		}
	}

	private final Deque<Runnable> stack = new ArrayDeque<>();

	/** Children submitted by the task currently expanding; null outside an expansion. */
	private List<Runnable> scheduled;

	/**
	 * Schedules a child task of the task currently being expanded.
	 *
	 * @param task the child task
	 * @param <T> type of the value the task produces
	 * @return the child's result, available to the parent's assembly step
	 * @throws IllegalStateException when called outside of a task expansion
	 */
	public <T> Deferred<T> submit(Task<T> task) {
		if (scheduled == null) {
			throw new IllegalStateException("Tasks can only be submitted while another task expands");
		}
		Deferred<T> result = new Deferred<>();
		scheduled.add(() -> expand(task, result));
		return result;
	}

	private <T> void expand(Task<T> task, Deferred<T> result) {
		List<Runnable> children = new ArrayList<>();
		scheduled = children;
		Supplier<T> assembly;
		try {
			assembly = task.expand();
		} finally {
			scheduled = null;
		}
		stack.push(() -> result.complete(assembly.get()));
		for (int i = children.size() - 1; i >= 0; i--) {
			stack.push(children.get(i));
		}
	}

	/**
	 * Runs a root task and everything it submits.
	 *
	 * @param root the root task
	 * @param <T> type of the value the root produces
	 * @return the root's value
	 */
	public <T> T run(Task<T> root) {
		if (!stack.isEmpty() || scheduled != null) {
			throw new IllegalStateException("WorkList is already running");
		}
		Deferred<T> result = new Deferred<>();
		stack.push(() -> expand(root, result));
		try {
			while (!stack.isEmpty()) {
				stack.pop().run();
			}
		} finally {
			stack.clear();
			scheduled = null;
		}
		return result.get();
	}
}
