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

import java.util.List;

import org.bucl.Bucl.Extension;
import org.bucl.Bucl.FunctionMessage;
import org.bucl.Bucl.FunctionMessageResult;

/**
 * The internal extension for character level string access; positions count code points
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclText implements Extension {
	private static final String LOG_TAG = BuclText.class.getSimpleName ();
	private static final String[] FUNCTIONS = {
		"substr",
		"strpos"
	};

	private boolean DEBUG = false;

	public String[] functionRegister (int version, boolean debug) {
		DEBUG = DEBUG || debug;
		return FUNCTIONS;
	}

	public void functionReset () {
	}

	public FunctionMessage functionHandler (FunctionMessage message) {
		List<String> args = message.args;

		if (message.name.equals ("substr")) {
			if (args.size () < 3) {
				message.fail ("substr: requires start, length, and string arguments");
			} else if (!BuclVariables.isNumeric (args.get (0))) {
				message.fail ("substr: '" + args.get (0) + "' is not a valid start index");
			} else if (!BuclVariables.isNumeric (args.get (1))) {
				message.fail ("substr: '" + args.get (1) + "' is not a valid length");
			} else {
				message.okay (substring (args.get (2), BuclVariables.countParse (args.get (0)), BuclVariables.countParse (args.get (1))));
			}
		} else if (message.name.equals ("strpos")) {
			if (args.size () < 2) {
				message.fail ("strpos: requires text and needle arguments");
			} else {
				message.okay (String.valueOf (position (args.get (0), args.get (1))));
			}
		} else {
			message.result = FunctionMessageResult.IGNORED;
		}

		if (DEBUG)
			logD (LOG_TAG, message.name + " " + args + " -> " + message.value);

		return message;
	}

	/**
	 * Cuts by code point, start and length are clamped to the text
	 */
	static String substring (String text, long start, long length) {
		int points = text.codePointCount (0, text.length ());
		long from = Math.min (start, points);
		long to = Math.min (from + Math.min (length, points), points);

		return text.substring (text.offsetByCodePoints (0, (int) from), text.offsetByCodePoints (0, (int) to));
	}

	/**
	 * Finds the first occurrence of needle
	 *
	 * @return Code point index, or -1 when not found
	 */
	static int position (String text, String needle) {
		int index = text.indexOf (needle);
		return (index < 0 ? -1 : text.codePointCount (0, index));
	}
}
