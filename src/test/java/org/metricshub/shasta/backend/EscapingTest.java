package org.metricshub.shasta.backend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.shasta.ast.Literal;

public class EscapingTest {

	@Test
	public void testEscapedOutsideQuotes() {
		assertEquals("\\*", Escaping.escaped('*', QuoteMode.UNQUOTED));
		assertEquals("\\ ", Escaping.escaped(' ', QuoteMode.UNQUOTED));
		assertEquals("\\$", Escaping.escaped('$', QuoteMode.UNQUOTED));
		assertEquals("\\\\", Escaping.escaped('\\', QuoteMode.UNQUOTED));
		assertEquals("a", Escaping.escaped('a', QuoteMode.UNQUOTED));
	}

	@Test
	public void testEscapedInsideQuotes() {
		// glob and blank characters are inert between double quotes
		assertEquals("*", Escaping.escaped('*', QuoteMode.QUOTED));
		assertEquals(" ", Escaping.escaped(' ', QuoteMode.QUOTED));
		assertEquals("\\\"", Escaping.escaped('"', QuoteMode.QUOTED));
		assertEquals("\\$", Escaping.escaped('$', QuoteMode.QUOTED));
		assertEquals("\\`", Escaping.escaped('`', QuoteMode.HEREDOC));
	}

	@Test
	public void testEscapedInLiteralHeredoc() {
		assertEquals("$", Escaping.escaped('$', QuoteMode.LITERAL_HEREDOC));
		assertEquals("\\", Escaping.escaped('\\', QuoteMode.LITERAL_HEREDOC));
	}

	@Test
	public void testDollarFollowedByText() {
		Literal dollar = new Literal('$');
		assertEquals("\\$", Escaping.literal(dollar, true, QuoteMode.UNQUOTED));
		assertEquals("$", Escaping.literal(dollar, false, QuoteMode.UNQUOTED));
		assertEquals("\\$", Escaping.literal(dollar, true, QuoteMode.QUOTED));
		assertEquals("$", Escaping.literal(dollar, true, QuoteMode.LITERAL_HEREDOC));
	}

	@Test
	public void testQuoteInsideQuotes() {
		Literal quote = new Literal('"');
		assertEquals("\\\"", Escaping.literal(quote, false, QuoteMode.QUOTED));
		assertEquals("\"", Escaping.literal(quote, false, QuoteMode.UNQUOTED));
	}

	@Test
	public void testVerbatimIsNeverChanged() {
		assertEquals("$", Escaping.literal(new Literal('$', true), true, QuoteMode.UNQUOTED));
		assertEquals("\"", Escaping.literal(new Literal('"', true), false, QuoteMode.QUOTED));
	}

	@Test
	public void testSupplementaryCodePoint() {
		int emoji = 0x1F600;
		assertEquals(new String(Character.toChars(emoji)), Escaping.literal(new Literal(emoji), false, QuoteMode.UNQUOTED));
		assertEquals(new String(Character.toChars(emoji)), Escaping.escaped(emoji, QuoteMode.UNQUOTED));
	}
}
