package org.metricshub.shasta.ast;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;

public class WordTest {

	@Test
	public void testEmptyWordsAreShared() {
		assertSame(Word.EMPTY, Word.literal(""));
		assertSame(Word.EMPTY, Word.of());
		assertTrue(Word.EMPTY.isEmpty());
	}

	@Test
	public void testCodePoints() {
		Word word = Word.literal("a😀");
		assertEquals(2, word.size());
		assertEquals(0x1F600, ((Literal) word.get(1)).getCodePoint());
		assertFalse(((Literal) word.get(0)).isVerbatim());
		assertTrue(((Literal) Word.verbatim("$").get(0)).isVerbatim());
	}

	@Test
	public void testConcat() {
		Word word = Word.literal("ab").concat(Word.of(new Escaped('*')));
		assertEquals("ab*", word.plainText());
		assertSame(word, word.concat(Word.EMPTY));
	}

	@Test
	public void testPlainText() {
		assertNull(Word.of(new Literal('a'), new Quoted(Word.literal("b"))).plainText());
		assertEquals("", Word.EMPTY.plainText());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testCharactersAreImmutable() {
		Word.literal("a").getChars().add(new Literal('b'));
	}

	@Test(expected = NullPointerException.class)
	public void testNullCharacter() {
		Word.of(Arrays.<ArgChar>asList(new Literal('a'), null));
	}
}
