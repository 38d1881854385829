package org.metricshub.shasta.util;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.shasta.util.WorkList.Deferred;

public class WorkListTest {

	/** Sum of the values of a right-leaning chain, built bottom-up. */
	private static WorkList.Task<Long> chain(WorkList work, int depth) {
		return () -> {
			if (depth == 0) {
				return () -> 0L;
			}
			Deferred<Long> rest = work.submit(chain(work, depth - 1));
			return () -> rest.get() + depth;
		};
	}

	@Test
	public void testDeepChainDoesNotOverflow() {
		WorkList work = new WorkList();
		int depth = 200_000;
		long sum = work.run(chain(work, depth));
		assertEquals((long) depth * (depth + 1) / 2, sum);
	}

	@Test
	public void testChildrenCompleteInSubmissionOrder() {
		WorkList work = new WorkList();
		List<String> order = new ArrayList<>();
		String result = work.run(() -> {
			Deferred<String> a = work.submit(() -> {
				order.add("expand a");
				return () -> {
					order.add("assemble a");
					return "a";
				};
			});
			Deferred<String> b = work.submit(() -> {
				order.add("expand b");
				return () -> {
					order.add("assemble b");
					return "b";
				};
			});
			return () -> a.get() + b.get();
		});
		assertEquals("ab", result);
		assertEquals(List.of("expand a", "assemble a", "expand b", "assemble b"), order);
	}

	@Test
	public void testLaterSiblingSeesEarlierResult() {
		WorkList work = new WorkList();
		String result = work.run(() -> {
			Deferred<String> first = work.submit(() -> () -> "x");
			Deferred<String> second = work.submit(() -> () -> first.get() + "y");
			return second::get;
		});
		assertEquals("xy", result);
	}

	@Test(expected = IllegalStateException.class)
	public void testSubmitOutsideExpansion() {
		new WorkList().submit(() -> () -> "orphan");
	}

	@Test
	public void testReadingPendingValueFails() {
		WorkList work = new WorkList();
		try {
			work.run(() -> {
				Deferred<String> child = work.submit(() -> () -> "late");
				child.get();
				return () -> "unreachable";
			});
			fail("A deferred value was read before its task ran");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("before its task completed"));
		}
	}

	@Test
	public void testWorkListIsReusableAfterFailure() {
		WorkList work = new WorkList();
		try {
			work.run(() -> {
				throw new IllegalArgumentException("boom");
			});
			fail("The task failure was not propagated");
		} catch (IllegalArgumentException e) {
			assertEquals("boom", e.getMessage());
		}
		assertEquals("ok", work.run(() -> () -> "ok"));
	}

	@Test
	public void testAllKeepsOrder() {
		List<Deferred<Integer>> values = List.of(Deferred.of(3), Deferred.of(1), Deferred.of(2));
		assertEquals(List.of(3, 1, 2), Deferred.all(values));
	}
}
