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
import static org.bucl.Bucl.logV;

import java.util.List;

import org.bucl.Bucl.Extension;
import org.bucl.Bucl.FunctionMessage;
import org.bucl.Bucl.FunctionMessageResult;

/**
 * The internal extension for assignment, output, control flow and variable access
 * <pre>
 * {t} = "a" "b"            concatenation; with several arguments also t/count and t/N
 * echo "a" "b"             one output line, arguments joined by a space
 * if {x} = "y"             also != &lt; &gt; &lt;= &gt;=, then elseif/else
 * {e} each "a" "b"         e/index (from 0) and e/value per item
 * {r} repeat 3             r/index (from 1) per iteration
 * {v} getvar "name"        setvar "name" "value"
 * {n} count ...            {n} length ...
 * sleep 0.5
 * </pre>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclCore implements Extension {
	private static final String LOG_TAG = BuclCore.class.getSimpleName ();
	private static final String[] FUNCTIONS = {
		"=",
		"echo",
		"if",
		"elseif",
		"else",
		"each",
		"repeat",
		"getvar",
		"setvar",
		"count",
		"length",
		"sleep"
	};

	private static final String EACH_PREFIX = "e";
	private static final String REPEAT_PREFIX = "r";

	private boolean DEBUG = false;

	/**
	 * Register the function names
	 */
	public String[] functionRegister (int version, boolean debug) {
		// Only turn debugging on not off
		DEBUG = DEBUG || debug;

		if (DEBUG)
			logD (LOG_TAG, "Registering this extension with BUCL v" + version);

		return FUNCTIONS;
	}

	/**
	 * Nothing is kept between calls
	 */
	public void functionReset () {
	}

	/**
	 * Handle core function messages, unknown names are ignored
	 */
	public FunctionMessage functionHandler (FunctionMessage message) throws BuclException {
		if (DEBUG)
			logV (LOG_TAG, " IN functionHandler(name=" + message.name + ", target=" + message.target + ", args=" + message.args + ")");

		BuclEvaluator evaluator = message.evaluator;
		List<String> args = message.args;

		if (message.name.equals ("=")) {
			assign (message);
		} else if (message.name.equals ("echo")) {
			evaluator.emit (String.join (" ", args));
			message.okay (null);
		} else if (message.name.equals ("if") || message.name.equals ("elseif")) {
			if (args.size () == 3 && conditionEvaluate (args.get (0), args.get (1), args.get (2))) {
				if (message.block != null)
					evaluator.evaluateStatements (message.block);
			} else if (message.continuation != null) {
				evaluator.evaluateStatement (message.continuation);
			}
			message.okay (null);
		} else if (message.name.equals ("else")) {
			if (message.block != null)
				evaluator.evaluateStatements (message.block);
			message.okay (null);
		} else if (message.name.equals ("each")) {
			each (message);
		} else if (message.name.equals ("repeat")) {
			repeat (message);
		} else if (message.name.equals ("getvar")) {
			if (args.isEmpty ()) {
				message.fail ("getvar: requires a variable name");
			} else {
				message.okay (evaluator.variables ().resolve (args.get (0)));
			}
		} else if (message.name.equals ("setvar")) {
			if (args.size () < 2) {
				message.fail ("setvar: requires a variable name and a value");
			} else {
				evaluator.variables ().set (args.get (0), args.get (1));
				message.okay (null);
			}
		} else if (message.name.equals ("count")) {
			message.okay (String.valueOf (args.size ()));
		} else if (message.name.equals ("length")) {
			message.okay (String.valueOf (lengthOf (args)));
		} else if (message.name.equals ("sleep")) {
			sleep (message);
		} else { // Ignore anything not understood
			message.result = FunctionMessageResult.IGNORED;
		}

		if (DEBUG)
			logD (LOG_TAG, "OUT functionHandler(result=" + message.result + ", value=" + message.value + ")");

		// Return the original recycled message
		return message;
	}

	/**
	 * Stores the concatenated arguments; several arguments are also kept as elements
	 */
	private static void assign (FunctionMessage message) {
		List<String> args = message.args;
		String value = String.join ("", args);

		if (message.target == null || args.size () < 2) {
			message.okay (message.target == null ? null : value);
			return;
		}

		BuclVariables variables = message.evaluator.variables ();
		variables.set (message.target, value);
		variables.put (message.target + "/" + BuclValue.COUNT, String.valueOf (args.size ()));
		for (int i = 0, j = args.size (); i < j; ++i)
			variables.put (message.target + "/" + i, args.get (i));

		message.okay (null);
	}

	/**
	 * Stores every item under the prefix, then runs the block once per item
	 */
	private static void each (FunctionMessage message) throws BuclException {
		String prefix = (message.target == null ? EACH_PREFIX : message.target);
		BuclVariables variables = message.evaluator.variables ();
		List<String> args = message.args;
		String count = String.valueOf (args.size ());

		variables.set (prefix, count);
		variables.put (prefix + "/" + BuclValue.COUNT, count);
		variables.put (prefix + "/" + BuclValue.LENGTH, String.valueOf (lengthOf (args)));
		for (int i = 0, j = args.size (); i < j; ++i)
			variables.put (prefix + "/" + i, args.get (i));

		if (message.block != null) {
			for (int i = 0, j = args.size (); i < j; ++i) {
				variables.put (prefix + "/index", String.valueOf (i));
				variables.put (prefix + "/value", args.get (i));
				message.evaluator.evaluateStatements (message.block);
			}
		}

		// Already stored, including at the target
		message.okay (null);
	}

	/**
	 * Runs the block a number of times, given as a named count or the first argument
	 */
	private static void repeat (FunctionMessage message) throws BuclException {
		String prefix = (message.target == null ? REPEAT_PREFIX : message.target);
		String countText = message.arg (BuclValue.COUNT, 0);

		if (countText == null) {
			message.fail ("repeat: missing count argument");
			return;
		}

		if (!BuclVariables.isNumeric (countText)) {
			message.fail ("repeat: '" + countText + "' is not a valid count");
			return;
		}

		long count = BuclVariables.countParse (countText);
		BuclVariables variables = message.evaluator.variables ();

		variables.set (prefix, String.valueOf (count));
		variables.put (prefix + "/" + BuclValue.COUNT, String.valueOf (count));

		if (message.block != null) {
			for (long i = 1; i <= count; ++i) {
				variables.put (prefix + "/index", String.valueOf (i));
				message.evaluator.evaluateStatements (message.block);
			}
		}

		message.okay (null);
	}

	/**
	 * Pauses for a decimal number of seconds
	 */
	private static void sleep (FunctionMessage message) throws BuclException {
		String secondsText = message.arg (0);

		if (secondsText == null) {
			message.fail ("sleep: expected a number of seconds");
			return;
		}

		Double seconds = BuclMath.numberParse (secondsText);
		if (seconds == null || seconds.isNaN () || seconds.isInfinite ()) {
			message.fail ("sleep: '" + secondsText + "' is not a valid number of seconds");
			return;
		}

		if (seconds < 0) {
			message.fail ("sleep: duration must not be negative, got " + BuclMath.numberFormat (seconds));
			return;
		}

		long nanos = (long) (seconds * 1e9);
		try {
			Thread.sleep (nanos / 1000000L, (int) (nanos % 1000000L));
		} catch (InterruptedException e) {
			Thread.currentThread ().interrupt ();
			throw BuclException.runtime ("sleep: interrupted");
		}

		message.okay (null);
	}

	/**
	 * Evaluates <code>lhs op rhs</code>
	 * <p>Equality compares text. Ordering compares numbers when both sides are numbers and text (by code
	 * point) otherwise. Unknown operators are false.</p>
	 *
	 * @param lhs Left operand
	 * @param operator One of = != &lt; &gt; &lt;= &gt;=
	 * @param rhs Right operand
	 * @return Whether the condition holds
	 */
	static boolean conditionEvaluate (String lhs, String operator, String rhs) {
		if (operator.equals ("="))
			return lhs.equals (rhs);

		if (operator.equals ("!="))
			return !lhs.equals (rhs);

		if (!operator.equals ("<") && !operator.equals (">") && !operator.equals ("<=") && !operator.equals (">="))
			return false;

		Double l = BuclMath.numberParse (lhs);
		Double r = BuclMath.numberParse (rhs);

		if (l != null && r != null) {
			double a = l;
			double b = r;

			if (operator.equals ("<"))
				return a < b;
			if (operator.equals (">"))
				return a > b;
			if (operator.equals ("<="))
				return a <= b;
			return a >= b;
		}

		int c = textCompare (lhs, rhs);

		if (operator.equals ("<"))
			return c < 0;
		if (operator.equals (">"))
			return c > 0;
		if (operator.equals ("<="))
			return c <= 0;
		return c >= 0;
	}

	/**
	 * Compares text by code point rather than by UTF-16 unit
	 */
	static int textCompare (String a, String b) {
		int i = 0;
		int j = 0;

		while (i < a.length () && j < b.length ()) {
			int ca = a.codePointAt (i);
			int cb = b.codePointAt (j);

			if (ca != cb)
				return (ca < cb ? -1 : 1);

			i += Character.charCount (ca);
			j += Character.charCount (cb);
		}

		if (i < a.length ())
			return 1;

		return (j < b.length () ? -1 : 0);
	}

	/**
	 * Total code points across all arguments
	 */
	static long lengthOf (List<String> args) {
		long length = 0;

		for (String arg : args)
			length += arg.codePointCount (0, arg.length ());

		return length;
	}
}
