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

import static org.bucl.Bucl.logV;

import java.util.ArrayList;
import java.util.List;

/**
 * Step 1: Tokenisation
 * <p>Turns each source line into its indent width and a flat list of tokens. Blank lines and comment lines
 * (starting with # once trimmed) produce nothing. The lexer never fails on its own, an unterminated variable
 * reference simply becomes bare text and an unterminated string runs to the end of the line.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclLexer {
	private static final String LOG_TAG = BuclLexer.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Token types the lexer produces */
	public static enum TokenType {
		VARIABLE, // {name}, may contain nested {references}
		QUOTED,   // "text", escapes already resolved
		BARE      // anything else up to whitespace
	}

	/** Holds a token, the lowest unit of a line */
	public static final class Token {
		public final TokenType type;
		public final String value;

		Token (TokenType type, String value) {
			this.type = type;
			this.value = value;
		}

		@Override
		public String toString () {
			return type + "(" + value + ")";
		}
	}

	/** A tokenised non-empty, non-comment line */
	public static final class Line {
		public final int lineNumber;
		public final int indent;
		public final List<Token> tokens;

		Line (int lineNumber, int indent, List<Token> tokens) {
			this.lineNumber = lineNumber;
			this.indent = indent;
			this.tokens = tokens;
		}
	}

	private BuclLexer () {
	}

	/**
	 * Tokenises a whole script
	 *
	 * @param source Script text, lines separated by \n (a trailing \r on a line is ignored)
	 * @return Every line carrying tokens, in source order
	 */
	public static List<Line> tokenise (String source) {
		List<Line> lines = new ArrayList<Line> ();
		String[] rawLines = source.split ("\n", -1);

		for (int i = 0, j = rawLines.length; i < j; ++i) {
			String raw = rawLines[i];
			if (raw.endsWith ("\r"))
				raw = raw.substring (0, raw.length () - 1);

			Line line = tokeniseLine (i + 1, raw);
			if (line != null)
				lines.add (line);
		}

		if (DEBUG)
			logV (LOG_TAG, "Tokenised " + lines.size () + " lines from " + rawLines.length + " raw lines");

		return lines;
	}

	/**
	 * Tokenises a single line
	 *
	 * @param lineNumber The 1-based line number, kept for error reporting
	 * @param raw The raw line without its line terminator
	 * @return The tokenised line, or null for blank and comment lines
	 */
	public static Line tokeniseLine (int lineNumber, String raw) {
		// Indent is measured on the raw text before trimming
		int indent = 0;
		while (indent < raw.length () && (raw.charAt (indent) == ' ' || raw.charAt (indent) == '\t'))
			++indent;

		String content = trim (raw);
		if (content.isEmpty () || content.startsWith ("#"))
			return null;

		List<Token> tokens = new ArrayList<Token> ();
		int i = 0, j = content.length ();

		while (i < j) {
			char c = content.charAt (i);

			if (isSpace (c)) {
				++i;
			} else if (c == '{') {
				StringBuilder name = new StringBuilder ();
				int depth = 1;
				boolean closed = false;

				for (++i; i < j; ++i) {
					c = content.charAt (i);
					if (c == '{') {
						++depth;
					} else if (c == '}' && --depth == 0) {
						closed = true;
						++i;
						break;
					}
					name.append (c);
				}

				if (closed) {
					tokens.add (new Token (TokenType.VARIABLE, name.toString ()));
				} else {
					tokens.add (new Token (TokenType.BARE, "{" + name));
				}
			} else if (c == '"') {
				StringBuilder text = new StringBuilder ();

				for (++i; i < j; ++i) {
					c = content.charAt (i);
					if (c == '"') {
						++i;
						break;
					} else if (c == '\\') {
						if (++i == j)
							break;

						c = content.charAt (i);
						if (c == '"') {
							text.append ('"');
						} else if (c == 'n') {
							text.append ('\n');
						} else if (c == 't') {
							text.append ('\t');
						} else if (c == '\\') {
							text.append ('\\');
						} else { // Unknown escapes are kept as written
							text.append ('\\').append (c);
						}
					} else {
						text.append (c);
					}
				}

				tokens.add (new Token (TokenType.QUOTED, text.toString ()));
			} else {
				int start = i;
				while (i < j && !isSpace (content.charAt (i)))
					++i;

				tokens.add (new Token (TokenType.BARE, content.substring (start, i)));
			}
		}

		if (tokens.isEmpty ())
			return null;

		return new Line (lineNumber, indent, tokens);
	}

	/**
	 * Whitespace test matching the Unicode White_Space property
	 * <p>U+001C to U+001F are not separators, U+0085 is.</p>
	 *
	 * @param c The character to test
	 * @return True if the character separates tokens
	 */
	static boolean isSpace (char c) {
		if (c >= '\t' && c <= '\r')
			return true;

		switch (c) {
			case ' ':
			case '\u0085':
			case '\u00A0':
			case '\u1680':
			case '\u2028':
			case '\u2029':
			case '\u202F':
			case '\u205F':
			case '\u3000':
				return true;
			default:
				return c >= '\u2000' && c <= '\u200A';
		}
	}

	private static String trim (String s) {
		int start = 0, end = s.length ();

		while (start < end && isSpace (s.charAt (start)))
			++start;
		while (end > start && isSpace (s.charAt (end - 1)))
			--end;

		return s.substring (start, end);
	}
}
