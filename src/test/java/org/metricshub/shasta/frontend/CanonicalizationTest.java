package org.metricshub.shasta.frontend;

import static org.junit.Assert.*;
import static org.metricshub.shasta.ShastaTestSupport.cmd;
import static org.metricshub.shasta.ShastaTestSupport.to;
import static org.metricshub.shasta.ShastaTestSupport.w;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.shasta.ast.And;
import org.metricshub.shasta.ast.AssignNode;
import org.metricshub.shasta.ast.Command;
import org.metricshub.shasta.ast.Literal;
import org.metricshub.shasta.ast.Or;
import org.metricshub.shasta.ast.Pipe;
import org.metricshub.shasta.ast.Quoted;
import org.metricshub.shasta.ast.Redir;
import org.metricshub.shasta.ast.RedirectionNode;
import org.metricshub.shasta.ast.Simple;
import org.metricshub.shasta.ast.Subshell;
import org.metricshub.shasta.ast.While;
import org.metricshub.shasta.ast.Word;

public class CanonicalizationTest {

	@Test
	public void testVerbatimDecodesUtf8() {
		Word word = Canonicalization.verbatim("é\"$x".getBytes(StandardCharsets.UTF_8));
		assertEquals(4, word.size());
		assertEquals('é', ((Literal) word.get(0)).getCodePoint());
		assertTrue(((Literal) word.get(2)).isVerbatim());
		assertEquals("é\"$x", word.plainText());
	}

	@Test
	public void testVerbatimKeepsInvalidBytes() {
		byte[] bytes = { 'a', (byte) 0xff, 'b', (byte) 0xc3 };
		Word word = Canonicalization.verbatim(bytes);
		assertEquals(4, word.size());
		assertEquals('a', ((Literal) word.get(0)).getCodePoint());
		assertEquals(0xff, ((Literal) word.get(1)).getCodePoint());
		assertEquals('b', ((Literal) word.get(2)).getCodePoint());
		// truncated sequence at the end
		assertEquals(0xc3, ((Literal) word.get(3)).getCodePoint());
	}

	@Test
	public void testVerbatimSlice() {
		byte[] bytes = "echo {a,b}".getBytes(StandardCharsets.UTF_8);
		assertEquals("{a,b}", Canonicalization.verbatim(bytes, 5, 10).plainText());
		assertTrue(Canonicalization.verbatim(bytes, 3, 3).isEmpty());
	}

	@Test
	public void testRedirectionsMergeIntoSimpleAndSubshell() {
		Command simple = Canonicalization.withRedirections(-1, cmd("a"), Collections.<RedirectionNode>singletonList(to("out")));
		assertTrue(simple instanceof Simple);
		assertEquals(1, ((Simple) simple).getRedirections().size());

		Subshell subshell = new Subshell(-1, cmd("a"), Collections.singletonList(to("first")));
		Command merged = Canonicalization.withRedirections(-1, subshell, Collections.<RedirectionNode>singletonList(to("second")));
		assertEquals(2, ((Subshell) merged).getRedirections().size());

		Command loop = Canonicalization.withRedirections(4, new While(cmd("a"), cmd("b")), Collections.<RedirectionNode>singletonList(to("out")));
		assertTrue(loop instanceof Redir);
		assertEquals(4, ((Redir) loop).getLine());

		Command untouched = cmd("a");
		assertSame(untouched, Canonicalization.withRedirections(-1, untouched, Collections.<RedirectionNode>emptyList()));
	}

	@Test
	public void testPipeFlattening() {
		Pipe left = new Pipe(false, Arrays.asList(cmd("a"), cmd("b")));
		Pipe pipe = Canonicalization.pipe(left, cmd("c"));
		assertEquals(3, pipe.getItems().size());
		assertFalse(pipe.isBackground());

		Pipe background = new Pipe(true, Arrays.asList(cmd("a"), cmd("b")));
		assertEquals(2, Canonicalization.pipe(background, cmd("c")).getItems().size());

		Pipe nested = Canonicalization.pipe(Arrays.asList(cmd("a"), Canonicalization.pipe(cmd("b"), cmd("c")), cmd("d")));
		assertEquals(4, nested.getItems().size());
	}

	@Test
	public void testConnective() {
		assertTrue(Canonicalization.isConnective(new And(cmd("a"), cmd("b"))));
		assertTrue(Canonicalization.isConnective(new Or(cmd("a"), cmd("b"))));
		assertFalse(Canonicalization.isConnective(cmd("a")));
	}

	@Test
	public void testAssignment() {
		AssignNode assignment = Canonicalization.assignment(w("FOO=bar=baz"));
		assertEquals("FOO", assignment.getName());
		assertEquals("bar=baz", assignment.getValue().plainText());
		assertTrue(Canonicalization.assignment(w("_x1=")).getValue().isEmpty());
		assertNull(Canonicalization.assignment(w("=x")));
		assertNull(Canonicalization.assignment(w("1a=x")));
		assertNull(Canonicalization.assignment(w("a-b=x")));
		assertNull(Canonicalization.assignment(w("plain")));
		assertNull(Canonicalization.assignment(Word.of(new Quoted(w("A"))).concat(w("=x"))));
	}

	@Test
	public void testName() {
		assertTrue(Canonicalization.isName("PATH"));
		assertTrue(Canonicalization.isName("_"));
		assertFalse(Canonicalization.isName(""));
		assertFalse(Canonicalization.isName("9lives"));
		assertFalse(Canonicalization.isName("été"));
	}
}
