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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Arithmetic, numeric comparison and random numbers
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class BuclMathTest {
	@Test
	public void _01_Expressions () {
		assertEquals (14, evaluate ("2+3*4"), 0);
		assertEquals (20, evaluate ("(2+3)*4"), 0);
		assertEquals (-2, evaluate ("-3+1"), 0);
		assertEquals (1, evaluate ("7 % 3"), 0);
		assertEquals (3.5, evaluate ("7/2"), 0);
		assertEquals (6, evaluate (" + 6 "), 0);
		assertEquals (0.5, evaluate (".5"), 0);
	}

	@Test
	public void _02_ExpressionErrors () {
		assertExpressionError ("1/0", "division by zero");
		assertExpressionError ("5%(2-2)", "modulo by zero");
		assertExpressionError ("2*(3", "expected ')', got end of expression");
		assertExpressionError ("(1 2)", "expected ')', got '2'");
		assertExpressionError ("2+", "expected number, got end of expression");
		assertExpressionError ("2+a", "expected number, got 'a'");
		assertExpressionError ("1.2.3", "invalid number literal '1.2.3'");
		assertExpressionError ("3 4", "unexpected character '4'");
	}

	@Test
	public void _03_NumberFormat () {
		assertEquals ("6", BuclMath.numberFormat (6.0));
		assertEquals ("-3", BuclMath.numberFormat (-3.0));
		assertEquals ("2.5", BuclMath.numberFormat (2.5));
		assertEquals ("0.30000000000000004", BuclMath.numberFormat (0.1 + 0.2));
		assertEquals ("100000000000000000000", BuclMath.numberFormat (1e20));
		assertEquals ("0.0001", BuclMath.numberFormat (1e-4));
		assertEquals ("NaN", BuclMath.numberFormat (Double.NaN));
		assertEquals ("inf", BuclMath.numberFormat (Double.POSITIVE_INFINITY));
		assertEquals ("-inf", BuclMath.numberFormat (Double.NEGATIVE_INFINITY));
	}

	@Test
	public void _04_NumberParse () {
		assertEquals (42.0, BuclMath.numberParse ("42"), 0);
		assertEquals (-0.5, BuclMath.numberParse ("-.5"), 0);
		assertEquals (1500.0, BuclMath.numberParse ("1.5e3"), 0);
		assertEquals (Double.POSITIVE_INFINITY, BuclMath.numberParse ("Infinity"), 0);
		assertTrue (BuclMath.numberParse ("NaN").isNaN ());
		assertNull (BuclMath.numberParse (""));
		assertNull (BuclMath.numberParse ("12abc"));
		assertNull (BuclMath.numberParse (" 1"));
		assertNull (BuclMath.numberParse ("0x10"));
	}

	@Test
	public void _05_MathStatement () {
		// Arguments are joined before evaluating
		Bucl bucl = run ("{a} = \"4\"\n{x} math {a} \"*\" \"(1+1)\"\n{y} math \"10/4\"");

		assertEquals ("8", bucl.variableGet ("x"));
		assertEquals ("2.5", bucl.variableGet ("y"));

		assertFailure ("{x} math \"1/0\"", "Runtime error: math: division by zero");
		assertFailure ("{x} math", "Runtime error: math: expected number, got end of expression");
	}

	@Test
	public void _06_Cmp () {
		Bucl bucl = run ("{a} cmp 2 10\n{b} cmp \"10\" \"2\"\n{c} cmp \"1.0\" 1\n{d} cmp \"abc\" 1");

		assertEquals ("-1", bucl.variableGet ("a"));
		assertEquals ("1", bucl.variableGet ("b"));
		assertEquals ("0", bucl.variableGet ("c"));
		assertEquals ("-1", bucl.variableGet ("d"));

		assertFailure ("{x} cmp 1", "Runtime error: cmp: requires two arguments");
	}

	@Test
	public void _07_Random () {
		Bucl bucl = run ("{a} random 5 5\n{b} random 0\n{lim/min} = \"7\"\n{lim/max} = \"7\"\n{c} random {lim}\n{d} random \"-3\" \"-1\"");

		assertEquals ("5", bucl.variableGet ("a"));
		assertEquals ("0", bucl.variableGet ("b"));
		assertEquals ("7", bucl.variableGet ("c"));

		long d = Long.parseLong (bucl.variableGet ("d"));
		assertTrue (d >= -3 && d <= -1);

		assertFailure ("{x} random 3 1", "Runtime error: random: min (3) is greater than max (1)");
		assertFailure ("{x} random \"ten\"", "Runtime error: random: 'ten' is not a valid integer");
	}

	@Test
	public void _08_RandomBetween () {
		for (int i = 0; i < 100; ++i) {
			long n = BuclMath.randomBetween (-2, 2);
			assertTrue (n >= -2 && n <= 2);
		}

		assertEquals (Long.MAX_VALUE, BuclMath.randomBetween (Long.MAX_VALUE, Long.MAX_VALUE));
		assertTrue (BuclMath.randomBetween (1, Long.MAX_VALUE) >= 1);

		// The full range must not overflow
		BuclMath.randomBetween (Long.MIN_VALUE, Long.MAX_VALUE);
	}

	private static double evaluate (String expression) {
		return new BuclMath.Expression (expression).evaluate ();
	}

	private static void assertExpressionError (String expression, String reason) {
		try {
			evaluate (expression);
			fail ("Expected an error for: " + expression);
		} catch (IllegalArgumentException e) {
			assertEquals (reason, e.getMessage ());
		}
	}

	private static Bucl run (String source) {
		Bucl bucl = new Bucl ();

		assertEquals (true, bucl.script (source));
		assertEquals (bucl.stderr, true, bucl.run ());

		return bucl;
	}

	private static void assertFailure (String source, String stderr) {
		Bucl bucl = new Bucl ();

		assertEquals (true, bucl.script (source));
		assertEquals (false, bucl.run ());
		assertEquals (stderr, bucl.stderr);
	}
}
