package org.metricshub.cleanworld.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class TokenListingTest {

	@Test
	public void testFormat() {
		List<Token> tokens = Arrays.asList(new Token(1, TokenKind.PROGRAM, "program"), new Token(12, TokenKind.STR, "\"a b\""));
		String listing = TokenListing.format(tokens);
		assertEquals("  1   20  PROGRAM program\n 12   39  STR     \"a b\"\n", listing);
	}

	@Test
	public void testParseBack() {
		List<Token> tokens = ScriptLexer.tokenize("program p begin\nfunc main() begin\nprint(\"hello world\");\nend\nend");
		assertEquals(tokens, TokenListing.parse(TokenListing.format(tokens)));
	}

	@Test
	public void testKindNameWins() {
		List<Token> tokens = TokenListing.parse("3 1 ID x\n\n4 0 INT 7\n5 999 ERROR @\nincomplete row\n");
		assertEquals(Arrays.asList(new Token(3, TokenKind.ID, "x"), new Token(4, TokenKind.INT, "7")), tokens);
	}

	@Test
	public void testBadRows() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TokenListing.parse("x 1 ID a"));
		assertTrue(e.getMessage().contains("row 1"));
		assertThrows(IllegalArgumentException.class, () -> TokenListing.parse("1 1 FOO a"));
	}
}
