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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Step 3: Evaluation
 * <p>One evaluator exists per scope: the engine creates one for each top-level run and every call of a
 * function script gets a fresh child evaluator with its own empty {@link BuclVariables}. Nothing is shared
 * between scopes except what the calling convention copies explicitly:</p>
 * <pre>
 * In:  argc, 0..N-1, args (+ args/count, args/length, args/N), named arguments, target
 * Out: return   -&gt; caller target
 *      return/x -&gt; caller target/x (after the primary value, so count/length can be overridden)
 *      output lines, appended to the caller in order
 * </pre>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclEvaluator {
	private static final String LOG_TAG = BuclEvaluator.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Names the calling convention owns, never derived as argument names */
	public static final List<String> RESERVED_NAMES = Collections.unmodifiableList (Arrays.asList (
		"argc",
		"args",
		"target",
		"return",
		BuclValue.COUNT,
		BuclValue.LENGTH
	));

	private final Bucl engine;
	private final BuclVariables variables;
	private final ArrayList<String> output = new ArrayList<String> ();
	private final int depth;

	/** An evaluated argument, with the name derived from the variable it came from (or null) */
	public static final class ResolvedArgument {
		public final String name;
		public final String value;

		ResolvedArgument (String name, String value) {
			this.name = name;
			this.value = value;
		}

		@Override
		public String toString () {
			return (name == null ? "" : name + ":") + "\"" + value + "\"";
		}
	}

	BuclEvaluator (Bucl engine, BuclVariables variables, int depth) {
		this.engine = engine;
		this.variables = variables;
		this.depth = depth;
	}

	/**
	 * Gets the variable store of this scope
	 */
	public BuclVariables variables () {
		return variables;
	}

	/**
	 * Gets the lines emitted in this scope so far, including those of finished child calls
	 */
	public List<String> output () {
		return Collections.unmodifiableList (output);
	}

	/**
	 * Appends a line to the output and passes it to the host listener straight away
	 *
	 * @param line The text to emit
	 */
	public void emit (String line) {
		output.add (line);
		engine.outputNotify (line);
	}

	/**
	 * Evaluates statements in order, stopping at the first failure
	 *
	 * @param statements A block or a whole script
	 * @throws BuclException Any failure of any statement
	 */
	public void evaluateStatements (List<BuclStatement> statements) throws BuclException {
		for (int i = 0, j = statements.size (); i < j; ++i)
			evaluateStatement (statements.get (i));
	}

	/**
	 * Evaluates one statement: resolve arguments and target, dispatch, store the result
	 *
	 * @param statement The statement to run
	 * @throws BuclException Any failure of the statement or anything it calls
	 */
	public void evaluateStatement (BuclStatement statement) throws BuclException {
		if (DEBUG)
			logV (LOG_TAG, "[" + depth + "] line " + statement.lineNumber + ": " + statement);

		List<ResolvedArgument> resolved = resolveArguments (statement.parameters);
		duplicatesCheck (resolved);

		List<String> values = new ArrayList<String> (resolved.size ());
		Map<String, String> named = new HashMap<String, String> ();
		for (ResolvedArgument argument : resolved) {
			values.add (argument.value);
			if (argument.name != null)
				named.put (argument.name, argument.value);
		}

		String target = statement.target;
		if (target != null && target.indexOf ('{') > -1)
			target = variables.interpolate (target);

		// Built-ins first; when every extension ignores the name it may still be a function script
		Bucl.FunctionMessage message = engine.extensionCall (new Bucl.FunctionMessage (this, statement.function, target, values, named, statement.block, statement.continuation));
		if (message != null) {
			if (target != null && message.value != null)
				variables.set (target, message.value);

			return;
		}

		String value = functionCall (statement.function, target, resolved);
		if (target != null && value != null)
			variables.set (target, value);
	}

	/**
	 * Evaluates parameters into call arguments
	 * <p>A quoted parameter is interpolated and a bare one is taken literally, neither carries a name. A
	 * variable parameter naming a root with named fields expands into one named argument per field (sorted by
	 * name); failing that a root holding more than one element expands into one unnamed argument per element;
	 * anything else is a single argument named after the last path segment of the variable.</p>
	 *
	 * @param parameters Parameters of a statement
	 * @return The arguments in call order
	 */
	public List<ResolvedArgument> resolveArguments (List<BuclParameter> parameters) {
		List<ResolvedArgument> resolved = new ArrayList<ResolvedArgument> ();

		for (BuclParameter parameter : parameters) {
			if (parameter.type == BuclParameter.Type.QUOTED) {
				resolved.add (new ResolvedArgument (null, variables.interpolate (parameter.text)));
			} else if (parameter.type == BuclParameter.Type.BARE) {
				resolved.add (new ResolvedArgument (null, parameter.text));
			} else {
				String name = (parameter.text.indexOf ('{') > -1 ? variables.interpolate (parameter.text) : parameter.text);

				if (name.indexOf ('/') == -1) {
					// Struct expansion
					Map<String, String> record = variables.record (name);
					if (!record.isEmpty ()) {
						for (Map.Entry<String, String> field : record.entrySet ())
							resolved.add (new ResolvedArgument (field.getKey (), field.getValue ()));

						continue;
					}

					// Array expansion
					long count = variables.count (name);
					if (count > 1) {
						for (long i = 0; i < count; ++i) {
							String element = variables.get (name + "/" + i);
							resolved.add (new ResolvedArgument (null, element == null ? "" : element));
						}

						continue;
					}
				}

				resolved.add (new ResolvedArgument (nameDerive (name), variables.resolve (name)));
			}
		}

		return resolved;
	}

	/**
	 * Derives the argument name of a variable: its last path segment unless numeric or reserved
	 *
	 * @param variable Variable name with nested references already resolved
	 * @return The derived name, or null when there is none
	 */
	public static String nameDerive (String variable) {
		String name = variable.substring (variable.lastIndexOf ('/') + 1);

		if (name.isEmpty () || BuclVariables.isNumeric (name) || RESERVED_NAMES.contains (name))
			return null;

		return name;
	}

	/**
	 * Fails when two arguments derive the same name
	 *
	 * @param resolved Arguments of one call
	 * @throws BuclException A RuntimeError naming both argument positions
	 */
	static void duplicatesCheck (List<ResolvedArgument> resolved) throws BuclException {
		HashMap<String, Integer> seen = new HashMap<String, Integer> ();

		for (int i = 0, j = resolved.size (); i < j; ++i) {
			String name = resolved.get (i).name;
			if (name == null)
				continue;

			Integer previous = seen.put (name, i);
			if (previous != null)
				throw BuclException.runtime ("duplicate named parameter '" + name + "' (args " + previous + " and " + i + ")");
		}
	}

	/**
	 * Calls a function script in an isolated child scope
	 *
	 * @param name Function name
	 * @param target Resolved caller target, or null
	 * @param resolved Arguments of the call
	 * @return The value to store at the target, or null when there is none or it was stored already
	 * @throws BuclException UnknownFunction if no script has the name, or any failure inside it
	 */
	private String functionCall (String name, String target, List<ResolvedArgument> resolved) throws BuclException {
		List<BuclStatement> statements = engine.functionStatements (name);
		if (statements == null)
			throw BuclException.unknownFunction (name);

		if (depth >= engine.depthLimitGet ())
			throw BuclException.runtime ("call depth limit of " + engine.depthLimitGet () + " exceeded calling '" + name + "'");

		if (DEBUG)
			logD (LOG_TAG, "Calling function script " + name + " with " + resolved);

		BuclEvaluator child = new BuclEvaluator (engine, new BuclVariables (), depth + 1);
		BuclVariables scope = child.variables;

		// Injected with put so none of these get count/length metadata of their own
		int argc = resolved.size ();
		StringBuilder args = new StringBuilder ();
		long argsLength = 0;

		scope.put ("argc", String.valueOf (argc));
		for (int i = 0; i < argc; ++i) {
			String value = resolved.get (i).value;
			scope.put (String.valueOf (i), value);
			scope.put ("args/" + i, value);
			args.append (value);
			argsLength += value.codePointCount (0, value.length ());
		}
		scope.put ("args", args.toString ());
		scope.put ("args/" + BuclValue.COUNT, String.valueOf (argc));
		scope.put ("args/" + BuclValue.LENGTH, String.valueOf (argsLength));

		for (ResolvedArgument argument : resolved) {
			if (argument.name != null)
				scope.put (argument.name, argument.value);
		}

		if (target != null)
			scope.put ("target", target);

		try {
			child.evaluateStatements (statements);
		} finally {
			// Output produced before a failure is kept
			output.addAll (child.output);
		}

		BuclValue returned = scope.value ("return");
		String value = (returned == null ? null : returned.text ());

		if (target == null)
			return value;

		if (value != null)
			variables.set (target, value);

		if (returned != null) {
			LinkedHashMap<String, String> subPaths = new LinkedHashMap<String, String> (returned.subPaths ());
			for (Map.Entry<String, String> subPath : subPaths.entrySet ())
				variables.put (target + "/" + subPath.getKey (), subPath.getValue ());
		}

		return null;
	}
}
