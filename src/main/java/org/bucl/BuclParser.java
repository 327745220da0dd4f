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

import org.bucl.BuclLexer.Line;
import org.bucl.BuclLexer.Token;
import org.bucl.BuclLexer.TokenType;

/**
 * Step 2: Parsing
 * <p>Builds the statement tree from tokenised lines. Indentation is the only nesting signal: a line indented
 * deeper than the statement before it opens that statement's block, and <code>elseif</code>/<code>else</code>
 * lines at the same indent as an <code>if</code>/<code>elseif</code> are chained to it as its continuation.</p>
 * <pre>
 * line  = ( '{' name '}' )? BARE param*
 * param = '{' name '}' | '"' text '"' | BARE
 * </pre>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclParser {
	private static final String LOG_TAG = BuclParser.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private final List<Line> lines;
	private int cursor = 0;

	private BuclParser (List<Line> lines) {
		this.lines = lines;
	}

	/**
	 * Parses a whole script into its top-level statements
	 *
	 * @param source The script text
	 * @return Top-level statements in source order
	 * @throws BuclException A ParseError on malformed indentation or line structure
	 */
	public static List<BuclStatement> parse (String source) throws BuclException {
		return parse (BuclLexer.tokenise (source));
	}

	/**
	 * Parses already tokenised lines
	 *
	 * @param lines Output of {@link BuclLexer#tokenise(String)}
	 * @return Top-level statements in source order
	 * @throws BuclException A ParseError on malformed indentation or line structure
	 */
	public static List<BuclStatement> parse (List<Line> lines) throws BuclException {
		BuclParser parser = new BuclParser (lines);
		List<BuclStatement> statements = parser.parseBlock (0);

		// The top-level block only stops early on an elseif/else nobody claimed
		if (parser.cursor < lines.size ()) {
			Line line = lines.get (parser.cursor);
			throw BuclException.parse (line.lineNumber, "'" + line.tokens.get (0).value + "' without a matching if");
		}

		if (DEBUG)
			logV (LOG_TAG, "Parsed " + statements.size () + " top-level statements");

		return statements;
	}

	/**
	 * Consumes consecutive statements at exactly the expected indent
	 * <p>Stops without consuming at the end of input, on a shallower line, or on an elseif/else line which
	 * belongs to the parent if/elseif.</p>
	 */
	private List<BuclStatement> parseBlock (int expectedIndent) throws BuclException {
		List<BuclStatement> statements = new ArrayList<BuclStatement> ();

		while (cursor < lines.size ()) {
			Line line = lines.get (cursor);

			if (line.indent < expectedIndent)
				break;

			// A block must be opened by its owning statement
			if (line.indent > expectedIndent)
				throw BuclException.parse (line.lineNumber, "unexpected indentation: expected " + expectedIndent + " spaces/tabs, got " + line.indent);

			if (isContinuation (line))
				break;

			statements.add (parseStatement (expectedIndent));
		}

		return statements;
	}

	private BuclStatement parseStatement (int currentIndent) throws BuclException {
		Line line = lines.get (cursor++);
		List<Token> tokens = line.tokens;

		String target = null;
		String function;
		int first;

		Token token = tokens.get (0);
		if (token.type == TokenType.VARIABLE) {
			if (tokens.size () < 2)
				throw BuclException.parse (line.lineNumber, "expected function name after '{" + token.value + "}'");

			if (tokens.get (1).type != TokenType.BARE)
				throw BuclException.parse (line.lineNumber, "expected function name after '{" + token.value + "}', got " + tokens.get (1));

			target = token.value;
			function = tokens.get (1).value;
			first = 2;
		} else if (token.type == TokenType.QUOTED) {
			throw BuclException.parse (line.lineNumber, "a line cannot start with a string literal: \"" + token.value + "\"");
		} else {
			function = token.value;
			first = 1;
		}

		List<BuclParameter> parameters = new ArrayList<BuclParameter> ();
		for (int i = first, j = tokens.size (); i < j; ++i) {
			token = tokens.get (i);
			parameters.add (new BuclParameter (token.type == TokenType.QUOTED ? BuclParameter.Type.QUOTED : (token.type == TokenType.VARIABLE ? BuclParameter.Type.VARIABLE : BuclParameter.Type.BARE), token.value));
		}

		// A deeper line straight after opens this statement's block, at whatever indent it has
		List<BuclStatement> block = null;
		if (cursor < lines.size () && lines.get (cursor).indent > currentIndent)
			block = parseBlock (lines.get (cursor).indent);

		// Only if/elseif take an elseif/else continuation, and only at the same indent
		BuclStatement continuation = null;
		if ((function.equals ("if") || function.equals ("elseif")) && cursor < lines.size () && isContinuation (lines.get (cursor)) && lines.get (cursor).indent == currentIndent)
			continuation = parseStatement (currentIndent);

		return new BuclStatement (line.lineNumber, target, function, parameters, block, continuation);
	}

	private static boolean isContinuation (Line line) {
		Token token = line.tokens.get (0);
		return token.type == TokenType.BARE && (token.value.equals ("elseif") || token.value.equals ("else"));
	}
}
