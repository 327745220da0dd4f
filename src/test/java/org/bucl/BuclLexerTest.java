/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.bucl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.bucl.BuclLexer.Line;
import org.bucl.BuclLexer.Token;
import org.bucl.BuclLexer.TokenType;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Tokenisation of single lines and whole scripts
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class BuclLexerTest {
	@Test
	public void _01_TokenTypes () {
		Line line = BuclLexer.tokeniseLine (1, "{x} foo \"a b\" {y} 42");

		assertEquals (0, line.indent);
		assertEquals (5, line.tokens.size ());
		assertToken (line.tokens.get (0), TokenType.VARIABLE, "x");
		assertToken (line.tokens.get (1), TokenType.BARE, "foo");
		assertToken (line.tokens.get (2), TokenType.QUOTED, "a b");
		assertToken (line.tokens.get (3), TokenType.VARIABLE, "y");
		assertToken (line.tokens.get (4), TokenType.BARE, "42");
	}

	@Test
	public void _02_Indent () {
		assertEquals (4, BuclLexer.tokeniseLine (1, "    echo").indent);
		assertEquals (2, BuclLexer.tokeniseLine (1, "\t\techo").indent);
		assertEquals (3, BuclLexer.tokeniseLine (1, " \t echo").indent);
	}

	@Test
	public void _03_BlankAndComments () {
		assertNull (BuclLexer.tokeniseLine (1, ""));
		assertNull (BuclLexer.tokeniseLine (1, "   \t "));
		assertNull (BuclLexer.tokeniseLine (1, "# a comment"));
		assertNull (BuclLexer.tokeniseLine (1, "    # indented comment"));

		// A # later in the line is an ordinary character
		Line line = BuclLexer.tokeniseLine (1, "echo #hash");
		assertToken (line.tokens.get (1), TokenType.BARE, "#hash");
	}

	@Test
	public void _04_Escapes () {
		Line line = BuclLexer.tokeniseLine (1, "echo \"a\\\"b\\n\\t\\\\\\q\"");
		assertToken (line.tokens.get (1), TokenType.QUOTED, "a\"b\n\t\\\\q");
	}

	@Test
	public void _05_Unterminated () {
		// A string runs to the end of the line
		Line line = BuclLexer.tokeniseLine (1, "echo \"open ended");
		assertToken (line.tokens.get (1), TokenType.QUOTED, "open ended");

		// An unclosed variable becomes bare text
		line = BuclLexer.tokeniseLine (1, "echo {open");
		assertToken (line.tokens.get (1), TokenType.BARE, "{open");
	}

	@Test
	public void _06_NestedVariable () {
		Line line = BuclLexer.tokeniseLine (1, "echo {parts/{i}}");
		assertToken (line.tokens.get (1), TokenType.VARIABLE, "parts/{i}");
	}

	@Test
	public void _07_LineNumbers () {
		List<Line> lines = BuclLexer.tokenise ("# header\r\n\r\necho \"a\"\r\n  echo \"b\"\n");

		assertEquals (2, lines.size ());
		assertEquals (3, lines.get (0).lineNumber);
		assertEquals (4, lines.get (1).lineNumber);
		assertEquals (2, lines.get (1).indent);
		assertToken (lines.get (1).tokens.get (1), TokenType.QUOTED, "b");
	}

	@Test
	public void _08_UnicodeSpaces () {
		// No-break and ideographic spaces separate tokens too
		Line line = BuclLexer.tokeniseLine (1, "echo\u00A0a\u3000b");

		assertEquals (3, line.tokens.size ());
		assertToken (line.tokens.get (2), TokenType.BARE, "b");
	}

	@Test
	public void _09_WhiteSpaceProperty () {
		// Next line separates, the information separators do not
		Line line = BuclLexer.tokeniseLine (1, "echo\u0085a\u001Fb\u2028c");

		assertEquals (3, line.tokens.size ());
		assertToken (line.tokens.get (1), TokenType.BARE, "a\u001Fb");
		assertToken (line.tokens.get (2), TokenType.BARE, "c");

		for (char c = '\u001C'; c <= '\u001F'; ++c)
			assertFalse (BuclLexer.isSpace (c));
		for (char c : new char[] {'\t', '\n', '\u000B', '\f', '\r', ' ', '\u0085', '\u00A0', '\u1680', '\u2000', '\u200A', '\u202F', '\u205F', '\u3000'})
			assertTrue (BuclLexer.isSpace (c));
		assertFalse (BuclLexer.isSpace ('\u200B'));
		assertFalse (BuclLexer.isSpace ('\u180E'));
	}

	private static void assertToken (Token token, TokenType type, String value) {
		assertEquals (type, token.type);
		assertEquals (value, token.value);
	}
}
