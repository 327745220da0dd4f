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

import java.io.IOException;

/**
 * The single failure type of the BUCL engine, every error aborts the whole evaluation
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclException extends Exception {
	private static final long serialVersionUID = 1L;

	/** The kinds of failure the engine can report */
	public static enum Kind {
		PARSE,
		RUNTIME,
		UNKNOWN_FUNCTION,
		IO
	}

	/** What went wrong */
	public final Kind kind;

	/** Source line of a parse error, or 0 when unknown */
	public final int lineNumber;

	/** The bare reason without the kind prefix */
	public final String reason;

	private BuclException (Kind kind, int lineNumber, String reason, Throwable cause) {
		super (render (kind, lineNumber, reason), cause);
		this.kind = kind;
		this.lineNumber = lineNumber;
		this.reason = reason;
	}

	/**
	 * Malformed source
	 *
	 * @param lineNumber The 1-based source line, or 0 if not known
	 * @param reason What is wrong with the line
	 * @return A new parse error
	 */
	public static BuclException parse (int lineNumber, String reason) {
		return new BuclException (Kind.PARSE, lineNumber, reason, null);
	}

	/**
	 * Failure while executing a statement
	 *
	 * @param reason What went wrong
	 * @return A new runtime error
	 */
	public static BuclException runtime (String reason) {
		return new BuclException (Kind.RUNTIME, 0, reason, null);
	}

	/**
	 * Neither a built-in nor a function script matches
	 *
	 * @param name The function name that was called
	 * @return A new unknown function error
	 */
	public static BuclException unknownFunction (String name) {
		return new BuclException (Kind.UNKNOWN_FUNCTION, 0, name, null);
	}

	/**
	 * Wraps a storage failure
	 *
	 * @param e The underlying exception
	 * @return A new IO error
	 */
	public static BuclException io (IOException e) {
		return new BuclException (Kind.IO, 0, e.getMessage () == null ? e.toString () : e.getMessage (), e);
	}

	private static String render (Kind kind, int lineNumber, String reason) {
		switch (kind) {
			case PARSE:
				return "Parse error: " + (lineNumber > 0 ? "line " + lineNumber + ": " : "") + reason;
			case UNKNOWN_FUNCTION:
				return "Unknown function: '" + reason + "'";
			case IO:
				return "IO error: " + reason;
			default:
				return "Runtime error: " + reason;
		}
	}
}
