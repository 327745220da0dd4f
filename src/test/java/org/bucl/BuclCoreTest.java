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
import static org.junit.Assert.assertTrue;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Assignment, output, conditions, loops and variable access
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class BuclCoreTest {
	@Test
	public void _01_Conditions () {
		assertTrue (BuclCore.conditionEvaluate ("a", "=", "a"));
		assertFalse (BuclCore.conditionEvaluate ("1", "=", "1.0"));
		assertTrue (BuclCore.conditionEvaluate ("1", "!=", "1.0"));

		// Numbers order numerically, anything else by code point
		assertTrue (BuclCore.conditionEvaluate ("9", "<", "10"));
		assertTrue (BuclCore.conditionEvaluate ("abc", ">", "10"));
		assertTrue (BuclCore.conditionEvaluate ("1.5", "<=", "1.5"));
		assertTrue (BuclCore.conditionEvaluate ("-2", "<", "1e1"));
		assertTrue (BuclCore.conditionEvaluate ("inf", ">", "99999"));
		assertTrue (BuclCore.conditionEvaluate ("b", ">=", "abc"));

		// Unknown operators never hold
		assertFalse (BuclCore.conditionEvaluate ("a", "==", "a"));
		assertFalse (BuclCore.conditionEvaluate ("a", "<>", "b"));
	}

	@Test
	public void _02_TextCompare () {
		assertEquals (0, BuclCore.textCompare ("abc", "abc"));
		assertEquals (-1, BuclCore.textCompare ("ab", "abc"));
		assertEquals (1, BuclCore.textCompare ("abc", "ab"));

		// A supplementary character sorts above every BMP character
		assertEquals (1, BuclCore.textCompare ("\uD83D\uDE00", "\uFFFD"));
	}

	@Test
	public void _03_IfChain () {
		assertOutput ("if \"a\" = \"b\"\n\techo \"if\"\nelseif \"a\" = \"a\"\n\techo \"elseif\"\nelse\n\techo \"else\"", "elseif");
		assertOutput ("if \"a\" = \"b\"\n\techo \"if\"\nelse\n\techo \"else\"", "else");
		assertOutput ("if \"a\" = \"a\"\n\techo \"if\"\nelse\n\techo \"else\"", "if");

		// The wrong number of arguments is simply false
		assertOutput ("if \"a\"\n\techo \"if\"\nelse\n\techo \"else\"", "else");
	}

	@Test
	public void _04_Assign () {
		Bucl bucl = run ("{one} = \"a\"\n{many} = \"a\" \"b\" \"c\"\n{none} =");

		assertEquals ("a", bucl.variableGet ("one"));
		assertEquals ("1", bucl.variableGet ("one/count"));
		assertEquals ("abc", bucl.variableGet ("many"));
		assertEquals ("3", bucl.variableGet ("many/count"));
		assertEquals ("3", bucl.variableGet ("many/length"));
		assertEquals ("b", bucl.variableGet ("many/1"));
		assertEquals ("", bucl.variableGet ("none"));
	}

	@Test
	public void _05_Each () {
		Bucl bucl = run ("{item} each \"a\" \"bc\"\n\techo \"{item/index}:{item/value}\"\neach \"z\"\n\techo \"{e/value}\"");

		assertEquals ("0:a\n1:bc\nz", bucl.stdout);
		assertEquals ("2", bucl.variableGet ("item"));
		assertEquals ("2", bucl.variableGet ("item/count"));
		assertEquals ("3", bucl.variableGet ("item/length"));
		assertEquals ("bc", bucl.variableGet ("item/1"));
	}

	@Test
	public void _06_Repeat () {
		Bucl bucl = run ("repeat 3\n\techo \"{r/index}\"\n{n} repeat 0\n\techo \"never\"");

		assertEquals ("1\n2\n3", bucl.stdout);
		assertEquals ("0", bucl.variableGet ("n/count"));

		assertFailure ("repeat", "Runtime error: repeat: missing count argument");
		assertFailure ("repeat \"-1\"", "Runtime error: repeat: '-1' is not a valid count");
		assertFailure ("repeat \"lots\"", "Runtime error: repeat: 'lots' is not a valid count");
	}

	@Test
	public void _07_GetSetVar () {
		Bucl bucl = run ("{name} = \"dyn\"\nsetvar \"{name}/x\" \"value\"\n{v} getvar \"dyn/x\"\n{w} getvar \"unset\"");

		assertEquals ("value", bucl.variableGet ("v"));
		assertEquals ("", bucl.variableGet ("w"));

		assertFailure ("getvar", "Runtime error: getvar: requires a variable name");
		assertFailure ("setvar \"a\"", "Runtime error: setvar: requires a variable name and a value");
	}

	@Test
	public void _08_CountLength () {
		Bucl bucl = run ("{list} = \"ab\" \"cde\"\n{c} count {list}\n{l} length {list}\n{z} count");

		assertEquals ("2", bucl.variableGet ("c"));
		assertEquals ("5", bucl.variableGet ("l"));
		assertEquals ("0", bucl.variableGet ("z"));
	}

	@Test
	public void _09_Echo () {
		assertOutput ("echo\necho \"a\" b {missing} \"c\"", "\na b  c");
	}

	@Test
	public void _10_Sleep () {
		run ("sleep 0\nsleep \"0.001\"");

		assertFailure ("sleep", "Runtime error: sleep: expected a number of seconds");
		assertFailure ("sleep \"soon\"", "Runtime error: sleep: 'soon' is not a valid number of seconds");
		assertFailure ("sleep \"nan\"", "Runtime error: sleep: 'nan' is not a valid number of seconds");
		assertFailure ("sleep \"-1.5\"", "Runtime error: sleep: duration must not be negative, got -1.5");
	}

	private static Bucl run (String source) {
		Bucl bucl = new Bucl ();

		assertEquals (true, bucl.script (source));
		assertEquals (bucl.stderr, true, bucl.run ());

		return bucl;
	}

	private static void assertOutput (String source, String stdout) {
		assertEquals (stdout, run (source).stdout);
	}

	private static void assertFailure (String source, String stderr) {
		Bucl bucl = new Bucl ();

		assertEquals (true, bucl.script (source));
		assertEquals (false, bucl.run ());
		assertEquals (stderr, bucl.stderr);
	}
}
