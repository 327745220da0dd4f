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

import static org.bucl.Bucl.logD;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

import org.bucl.Bucl.Extension;
import org.bucl.Bucl.FunctionMessage;
import org.bucl.Bucl.FunctionMessageResult;

/**
 * The internal extension for arithmetic, numeric comparison and random numbers
 * <p>Numbers are doubles. Results are printed in plain notation without a trailing fraction, so
 * <code>math "10/4"</code> is <code>2.5</code> and <code>math "3+3"</code> is <code>6</code>.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclMath implements Extension {
	private static final String LOG_TAG = BuclMath.class.getSimpleName ();
	private static final String[] FUNCTIONS = {
		"math",
		"cmp",
		"random"
	};

	/** Decimal or exponent notation, and the named special values */
	private static final Pattern NUMBER = Pattern.compile ("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
	private static final Pattern NUMBER_SPECIAL = Pattern.compile ("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

	private boolean DEBUG = false;

	public String[] functionRegister (int version, boolean debug) {
		DEBUG = DEBUG || debug;
		return FUNCTIONS;
	}

	public void functionReset () {
	}

	public FunctionMessage functionHandler (FunctionMessage message) {
		List<String> args = message.args;

		if (message.name.equals ("math")) {
			try {
				message.okay (numberFormat (new Expression (String.join ("", args)).evaluate ()));
			} catch (IllegalArgumentException e) {
				message.fail ("math: " + e.getMessage ());
			}
		} else if (message.name.equals ("cmp")) {
			if (args.size () < 2) {
				message.fail ("cmp: requires two arguments");
			} else {
				double a = numberOrZero (args.get (0));
				double b = numberOrZero (args.get (1));
				message.okay (a > b ? "1" : (a < b ? "-1" : "0"));
			}
		} else if (message.name.equals ("random")) {
			random (message);
		} else {
			message.result = FunctionMessageResult.IGNORED;
		}

		if (DEBUG)
			logD (LOG_TAG, message.name + " " + args + " -> " + message.result + " " + message.value);

		return message;
	}

	/**
	 * Inclusive random integer; named min and max win over positions
	 */
	private static void random (FunctionMessage message) {
		String minText = message.named.get ("min");
		String maxText = message.named.get ("max");
		List<String> args = message.args;
		long min = 0;
		long max = Long.MAX_VALUE;

		try {
			if (maxText != null) {
				if (minText != null)
					min = integerParse (minText);
				max = integerParse (maxText);
			} else if (args.size () == 1) {
				max = integerParse (args.get (0));
			} else if (args.size () > 1) {
				min = integerParse (args.get (0));
				max = integerParse (args.get (1));
			}
		} catch (IllegalArgumentException e) {
			message.fail (e.getMessage ());
			return;
		}

		if (min > max) {
			message.fail ("random: min (" + min + ") is greater than max (" + max + ")");
			return;
		}

		message.okay (String.valueOf (randomBetween (min, max)));
	}

	private static long integerParse (String text) {
		try {
			return Long.parseLong (text);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException ("random: '" + text + "' is not a valid integer", e);
		}
	}

	/**
	 * Random integer in [min, max], including ranges wider than Long.MAX_VALUE
	 */
	static long randomBetween (long min, long max) {
		ThreadLocalRandom random = ThreadLocalRandom.current ();

		if (max < Long.MAX_VALUE)
			return random.nextLong (min, max + 1);

		if (min > Long.MIN_VALUE)
			return random.nextLong (min - 1, max) + 1;

		return random.nextLong ();
	}

	/**
	 * Parses a number the way conditions and arithmetic read them
	 *
	 * @param text Text without surrounding whitespace
	 * @return The number, or null when the text is not one
	 */
	static Double numberParse (String text) {
		if (NUMBER.matcher (text).matches ())
			return Double.valueOf (text);

		if (!NUMBER_SPECIAL.matcher (text).matches ())
			return null;

		String special = text.toLowerCase ();
		if (special.endsWith ("nan"))
			return Double.NaN;

		return (special.startsWith ("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
	}

	private static double numberOrZero (String text) {
		Double number = numberParse (text);
		return (number == null ? 0 : number);
	}

	/**
	 * Formats a number in plain notation, integral values without a fraction
	 *
	 * @param number The number
	 * @return e.g. <code>6</code>, <code>2.5</code>, <code>0.30000000000000004</code>, <code>inf</code>
	 */
	static String numberFormat (double number) {
		if (Double.isNaN (number))
			return "NaN";

		if (Double.isInfinite (number))
			return (number > 0 ? "inf" : "-inf");

		if (number == Math.rint (number) && Math.abs (number) < 1e15)
			return String.valueOf ((long) number);

		return new BigDecimal (Double.toString (number)).stripTrailingZeros ().toPlainString ();
	}

	/**
	 * Recursive descent over <code>+ - * / %</code>, unary signs, parentheses and decimal literals
	 * <pre>
	 * sum     = product ( ('+' | '-') product )*
	 * product = unary ( ('*' | '/' | '%') unary )*
	 * unary   = '-' primary | '+'? primary
	 * primary = '(' sum ')' | [0-9.]+
	 * </pre>
	 */
	static final class Expression {
		private final String text;
		private int position = 0;

		Expression (String text) {
			this.text = text;
		}

		/**
		 * @return The value of the whole expression
		 * @throws IllegalArgumentException The reason the expression is malformed
		 */
		double evaluate () {
			double value = sum ();

			whitespaceSkip ();
			if (position < text.length ())
				throw new IllegalArgumentException ("unexpected character '" + characterAt (position) + "'");

			return value;
		}

		private double sum () {
			double left = product ();

			while (true) {
				whitespaceSkip ();
				if (peek ('+')) {
					++position;
					left += product ();
				} else if (peek ('-')) {
					++position;
					left -= product ();
				} else {
					return left;
				}
			}
		}

		private double product () {
			double left = unary ();

			while (true) {
				whitespaceSkip ();
				if (peek ('*')) {
					++position;
					left *= unary ();
				} else if (peek ('/')) {
					++position;
					double right = unary ();
					if (right == 0)
						throw new IllegalArgumentException ("division by zero");
					left /= right;
				} else if (peek ('%')) {
					++position;
					double right = unary ();
					if (right == 0)
						throw new IllegalArgumentException ("modulo by zero");
					left %= right;
				} else {
					return left;
				}
			}
		}

		private double unary () {
			whitespaceSkip ();

			if (peek ('-')) {
				++position;
				return -primary ();
			}

			if (peek ('+'))
				++position;

			return primary ();
		}

		private double primary () {
			whitespaceSkip ();

			if (peek ('(')) {
				++position;
				double value = sum ();

				whitespaceSkip ();
				if (!peek (')'))
					throw new IllegalArgumentException ("expected ')', got " + (position < text.length () ? "'" + characterAt (position) + "'" : "end of expression"));

				++position;
				return value;
			}

			int start = position;
			while (position < text.length () && ((text.charAt (position) >= '0' && text.charAt (position) <= '9') || text.charAt (position) == '.'))
				++position;

			if (start == position)
				throw new IllegalArgumentException ("expected number, got " + (position < text.length () ? "'" + characterAt (position) + "'" : "end of expression"));

			String literal = text.substring (start, position);
			if (!NUMBER.matcher (literal).matches ())
				throw new IllegalArgumentException ("invalid number literal '" + literal + "'");

			return Double.parseDouble (literal);
		}

		private boolean peek (char c) {
			return position < text.length () && text.charAt (position) == c;
		}

		private void whitespaceSkip () {
			while (position < text.length () && BuclLexer.isSpace (text.charAt (position)))
				++position;
		}

		private String characterAt (int index) {
			return new String (Character.toChars (text.codePointAt (index)));
		}
	}
}
