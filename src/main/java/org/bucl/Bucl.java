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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * BUCL for Java
 * <p>Host facade of the engine. A script is loaded with {@link #script(String)} and executed with
 * {@link #run()}; output lines and the failure (if any) are then available in {@link #stdout} and
 * {@link #stderr}. Built-in operations are extensions registered by name, function scripts are looked up
 * through the {@link Library} providers in order: in-memory, filesystem, standard library.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class Bucl {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = Bucl.class.getSimpleName ();
	private static final boolean DEBUG = false;
	private static final String CATCH_ALL = "*";

	// Script defaults
	private static final int depthLimitDefault = 200;

	private int depthLimit = depthLimitDefault;

	// Engine internals
	private List<BuclStatement> statements = null;
	private BuclVariables variables = new BuclVariables ();
	private HashMap<String, ArrayList<Extension>> extensions = null;
	private HashMap<String, List<BuclStatement>> functionCache = new HashMap<String, List<BuclStatement>> ();
	private final BuclLibraryMemory libraryMemory = new BuclLibraryMemory ();
	private final BuclLibraryFiles libraryFiles = new BuclLibraryFiles ();
	private final ArrayList<Library> libraryExtras = new ArrayList<Library> ();
	private final Library libraryStandard = BuclLibraryMemory.standard ();
	private ArrayList<String> output = new ArrayList<String> ();
	private BuclException failure = null;
	private OutputListener outputListener = null;

	/** Execution normal output, every emitted line joined with a newline */
	public String stdout = "";

	/** Execution error output, the rendered failure of the last {@link #script(String)} or {@link #run()} */
	public String stderr = "";

	/** Result status of message used in {@link FunctionMessage} */
	public static enum FunctionMessageResult {
		IGNORED,
		HANDLED_OKAY,
		HANDLED_FAIL
	}

	/** The message passed between the dispatcher and an {@link Extension} for one call */
	public static final class FunctionMessage {
		/** The function name as written in the script */
		public final String name;

		/** The scope the call happens in, for variables, output and running blocks */
		public final BuclEvaluator evaluator;

		/** The resolved target variable name, or null when the line has none */
		public final String target;

		/** The evaluated arguments in call order */
		public final List<String> args;

		/** The derived argument names of this call mapped to their values */
		public final Map<String, String> named;

		/** The indented block under the statement, or null */
		public final List<BuclStatement> block;

		/** The elseif/else chained to an if/elseif, or null */
		public final BuclStatement continuation;

		/** The result of the message after processing, use IGNORED to continue processing or return a result */
		public FunctionMessageResult result;

		/** On HANDLED_OKAY the value for the target (null stores nothing), on HANDLED_FAIL the error message */
		public String value;

		FunctionMessage (BuclEvaluator evaluator, String name, String target, List<String> args, Map<String, String> named, List<BuclStatement> block, BuclStatement continuation) {
			this.evaluator = evaluator;
			this.name = name;
			this.target = target;
			this.args = Collections.unmodifiableList (args);
			this.named = Collections.unmodifiableMap (named);
			this.block = block;
			this.continuation = continuation;
		}

		/**
		 * Gets an argument by position
		 *
		 * @param index Position of the argument
		 * @return The argument, or null when there are not that many
		 */
		public String arg (int index) {
			return (index < args.size () ? args.get (index) : null);
		}

		/**
		 * Gets an argument by derived name, falling back to a position
		 *
		 * @param name The derived argument name
		 * @param index The position used when no argument has the name
		 * @return The argument, or null when there is neither
		 */
		public String arg (String name, int index) {
			return (named.containsKey (name) ? named.get (name) : arg (index));
		}

		/**
		 * Marks the message as handled
		 *
		 * @param value The value for the target, or null for none
		 * @return This message
		 */
		public FunctionMessage okay (String value) {
			this.value = value;
			this.result = FunctionMessageResult.HANDLED_OKAY;
			return this;
		}

		/**
		 * Marks the message as failed
		 *
		 * @param reason The error message
		 * @return This message
		 */
		public FunctionMessage fail (String reason) {
			this.value = reason;
			this.result = FunctionMessageResult.HANDLED_FAIL;
			return this;
		}
	}

	/**
	 * The BUCL interface to register and use extensions
	 */
	public interface Extension {
		/**
		 * Extension registration, used to claim function names (or decline to register)
		 *
		 * @param version BUCL engine version number which is sent to the extension
		 * @param debug A flag as to whether the BUCL engine is in debug mode
		 * @return The function names handled, an empty name for every function, or null to decline
		 */
		String[] functionRegister (int version, boolean debug);

		/**
		 * Extension reset, used when {@link #reset()} is called to clear extension state
		 */
		void functionReset ();

		/**
		 * Extension messaging, the mechanism used to carry out a call from the script
		 *
		 * @param message A FunctionMessage object passed between the extension and BUCL engine
		 * @return A FunctionMessage object (usually the same one) containing any result
		 * @throws BuclException A failure raised by code the extension runs, such as its block
		 */
		FunctionMessage functionHandler (FunctionMessage message) throws BuclException;
	}

	/**
	 * The source of function scripts
	 */
	public interface Library {
		/**
		 * Looks up the source of a function script
		 *
		 * @param name The function name
		 * @return The script source, or null when this library has no such function
		 * @throws IOException The script exists but could not be read
		 */
		String librarySource (String name) throws IOException;
	}

	/**
	 * Receives output lines as soon as they are emitted
	 */
	public interface OutputListener {
		/**
		 * @param line One emitted line, without a newline
		 */
		void outputLine (String line);
	}

	/**
	 * Constructor, prepare extensions
	 */
	public Bucl () {
		if (DEBUG)
			logD (LOG_TAG, "Instantiating BUCL");

		extensionRemoveAll ();
	}

	/**
	 * Gets the maximum nesting of function script calls
	 *
	 * @return Number of nested calls
	 */
	public int depthLimitGet () {
		return depthLimit;
	}

	/**
	 * Sets the maximum nesting of function script calls
	 *
	 * @param depthLimit Number of nested calls, negative for the default
	 */
	public void depthLimitSet (int depthLimit) {
		this.depthLimit = (depthLimit < 0 ? depthLimitDefault : depthLimit);

		if (DEBUG)
			logD (LOG_TAG, "Set depth limit=" + this.depthLimit);
	}

	/**
	 * Resets instance between executions of the same script
	 */
	public void reset () {
		stdout = stderr = ""; // Reset stdout and stderr to empty
		output = new ArrayList<String> ();
		failure = null;
		functionCache = new HashMap<String, List<BuclStatement>> ();
		variableRemoveAll (); // Remove all variables

		// Call {@link Extension#functionReset()} on all extensions, once each
		ArrayList<Extension> seen = new ArrayList<Extension> ();
		for (Map.Entry<String, ArrayList<Extension>> entry : extensions.entrySet ()) {
			ArrayList<Extension> registered = entry.getValue ();
			for (int i = 0, j = registered.size (); i < j; ++i) {
				if (!seen.contains (registered.get (i))) {
					seen.add (registered.get (i));
					registered.get (i).functionReset ();
				}
			}
		}

		if (DEBUG)
			logD (LOG_TAG, "BUCL engine reset");
	}

	/**
	 * Returns whether a variable is set
	 *
	 * @param key Name of variable (sans braces), with or without sub-path
	 * @return True if the variable is set, or false if not
	 */
	public boolean variableHas (String key) {
		return variables.has (key);
	}

	/**
	 * Gets a variable
	 *
	 * @param key Name of variable (sans braces), with or without sub-path
	 * @return Variable content or null if variable is not set
	 */
	public String variableGet (String key) {
		return variables.get (key);
	}

	/**
	 * Sets a variable, a root name also gets its count and length
	 *
	 * @param key Name of variable (sans braces), with or without sub-path
	 * @param value Content of variable
	 */
	public void variableSet (String key, String value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + key + "=" + value);

		variables.set (key, value);
	}

	/**
	 * Sets a variable
	 *
	 * @param key Name of variable (sans braces), with or without sub-path
	 * @param value Content of variable
	 */
	public void variableSet (String key, long value) {
		variableSet (key, String.valueOf (value));
	}

	/**
	 * Sets an array variable: the elements, count and length
	 *
	 * @param key Root name of variable
	 * @param values The elements in order
	 */
	public void variableSet (String key, List<String> values) {
		StringBuilder sb = new StringBuilder ();
		long length = 0;

		for (int i = 0, j = values.size (); i < j; ++i) {
			String value = values.get (i);
			variables.put (key + "/" + i, value);
			sb.append (value);
			length += value.codePointCount (0, value.length ());
		}

		variables.put (key, sb.toString ());
		variables.put (key + "/" + BuclValue.COUNT, String.valueOf (values.size ()));
		variables.put (key + "/" + BuclValue.LENGTH, String.valueOf (length));
	}

	/**
	 * Unset a variable
	 *
	 * @param key Name of variable (sans braces), a root name takes its sub-paths with it
	 */
	public void variableRemove (String key) {
		if (DEBUG)
			logV (LOG_TAG, "Removing variable: " + key);

		variables.remove (key);
	}

	/**
	 * Unsets all variables
	 */
	public void variableRemoveAll () {
		if (DEBUG)
			logV (LOG_TAG, "Removing all variables");

		variables.clear ();
	}

	/**
	 * Gets everything stored under a root name as a tagged value
	 *
	 * @param key Root name of variable
	 * @return A copy of the value, or null if nothing is stored
	 */
	public BuclValue valueGet (String key) {
		return variables.value (key);
	}

	/**
	 * Retrieves the complete variables store
	 */
	public BuclVariables variableStoreGet () {
		return variables;
	}

	/**
	 * Requests the addition of an extension to BUCL, automatically initiates the registration process
	 * <p>If the extension is an anonymous closure it cannot be removed with {@link #extensionRemove(Extension)}
	 * and instead you will need to use {@link #extensionRemoveAll()}.</p>
	 *
	 * @param extension A Bucl.Extension instance
	 * @return True if the extension was successfully registered, or false if not
	 */
	public boolean extensionAdd (Extension extension) {
		if (DEBUG)
			logD (LOG_TAG, "Adding extension: " + (extension.getClass ().isAnonymousClass () ? "[anonymous closure]" : extension.getClass ().getSimpleName ()));

		// Check if the extension is already added (if it is a named class)
		if (!extension.getClass ().isAnonymousClass ()) {
			for (Map.Entry<String, ArrayList<Extension>> entry : extensions.entrySet ()) {
				ArrayList<Extension> registered = entry.getValue ();
				for (int i = 0, j = registered.size (); i < j; ++i) {
					if (registered.get (i).getClass () == extension.getClass ()) {
						if (DEBUG)
							logD (LOG_TAG, "Extension is already added so skipping");

						return false;
					}
				}
			}
		}

		// Get the registered function names
		String[] names = extension.functionRegister (VERSION_MAJOR, DEBUG);

		if (names == null || names.length == 0) { // Null means the extension declined to be added
			if (DEBUG)
				logD (LOG_TAG, "Extension chose not to be added");

			return false;
		}

		for (String name : names) {
			if (name.isEmpty ()) // An empty name means the extension is catchall
				name = CATCH_ALL;

			if (!extensions.containsKey (name))
				extensions.put (name, new ArrayList<Extension> ());

			if (!extensions.get (name).contains (extension))
				extensions.get (name).add (extension);
		}

		if (DEBUG)
			logD (LOG_TAG, "Extension added for functions: " + String.join (", ", names));

		return true;
	}

	/**
	 * Removes an extension from BUCL
	 * <p>If the extension to be removed was added as an anonymous closure it cannot be removed with this method,
	 * call {@link #extensionRemoveAll()} instead. Anonymous closures lack the class name Java uses to compare.</p>
	 *
	 * @param extension Bucl.Extension instance
	 * @return True if the extension was found and removed, or false if not
	 */
	public boolean extensionRemove (Extension extension) {
		if (DEBUG)
			logD (LOG_TAG, "Removing extension: " + (extension.getClass ().isAnonymousClass () ? "[anonymous closure] has no reference to the original object" : extension.getClass ().getSimpleName ()));

		if (extension.getClass ().isAnonymousClass ()) {
			stderr = "Anonymous closure extensions cannot be removed";
			return false;
		}

		boolean removed = false;

		String[] names = extensions.keySet ().toArray (new String[0]);
		for (String name : names) {
			ArrayList<Extension> registered = extensions.get (name);
			for (int i = registered.size () - 1; i > -1; --i) {
				if (registered.get (i).getClass () == extension.getClass ()) {
					registered.remove (i);
					removed = true;
				}
			}

			// If that was the last extension for a name, remove the name also
			if (registered.size () == 0)
				extensions.remove (name);
		}

		if (DEBUG)
			logD (LOG_TAG, "Extension was " + (removed ? "" : "NOT ") + "removed");

		return removed;
	}

	/**
	 * Removes all extensions from BUCL (re-adds the internal extensions afterwards)
	 */
	public void extensionRemoveAll () {
		if (DEBUG)
			logD (LOG_TAG, "Removing all extensions");

		extensions = new HashMap<String, ArrayList<Extension>> ();
		extensionAdd (new BuclCore ());
		extensionAdd (new BuclText ());
		extensionAdd (new BuclMath ());
	}

	/**
	 * Adds a function script held in memory, found before any on disk
	 *
	 * @param name The function name scripts call it by
	 * @param source The script source
	 */
	public void functionAdd (String name, String source) {
		if (DEBUG)
			logD (LOG_TAG, "Adding function script: " + name);

		libraryMemory.functionAdd (name, source);
		functionCache = new HashMap<String, List<BuclStatement>> ();
	}

	/**
	 * Removes every function script added with {@link #functionAdd(String, String)} or {@link #libraryAdd(Library)}
	 */
	public void functionRemoveAll () {
		libraryMemory.functionRemoveAll ();
		libraryExtras.clear ();
		functionCache = new HashMap<String, List<BuclStatement>> ();
	}

	/**
	 * Sets the directory whose <code>functions</code> directory is searched for function scripts
	 *
	 * @param baseDir The directory, or null to search only the working directory
	 */
	public void baseDirSet (File baseDir) {
		if (DEBUG)
			logD (LOG_TAG, "Set base directory=" + baseDir);

		libraryFiles.baseDirSet (baseDir);
		functionCache = new HashMap<String, List<BuclStatement>> ();
	}

	/**
	 * Adds a function script provider, searched after the filesystem and before the standard library
	 *
	 * @param library The provider
	 */
	public void libraryAdd (Library library) {
		libraryExtras.add (library);
		functionCache = new HashMap<String, List<BuclStatement>> ();
	}

	/**
	 * Sets the receiver of output lines as they are emitted
	 *
	 * @param outputListener The listener, or null for none
	 */
	public void outputListenerSet (OutputListener outputListener) {
		this.outputListener = outputListener;
	}

	/**
	 * Gets the output lines of the last run
	 */
	public List<String> outputGet () {
		return Collections.unmodifiableList (output);
	}

	/**
	 * Gets the failure of the last {@link #script(String)} or {@link #run()}
	 *
	 * @return The typed failure, or null if it succeeded
	 */
	public BuclException failureGet () {
		return failure;
	}

	/**
	 * Loads and parses a BUCL script from a string, but does not execute it (see {@link #run()})
	 * <p>Loading a script resets the engine, so set any variables for the script afterwards.</p>
	 *
	 * @param source A (hopefully) valid BUCL script
	 * @return True if the script is ready for execution, or false if it is invalid (stderr will contain the error reason)
	 */
	public boolean script (String source) {
		if (DEBUG)
			logD (LOG_TAG, source == null ? "No input script passed" : "Input script was passed");

		// Reset engine back to defaults
		reset ();
		statements = null;

		if (source == null)
			return error (BuclException.runtime ("No script given"));

		// Remove any UTF BOM
		if (source.startsWith ("\uFEFF"))
			source = source.substring (1);

		// UNIX-ify any line endings
		source = source.replace ("\r\n", "\n").replace ("\r", "\n");

		if (DEBUG)
			logV (LOG_TAG, "\n" + source);

		try {
			statements = BuclParser.parse (source);
			return true;
		} catch (BuclException e) {
			return error (e);
		}
	}

	/**
	 * Runs the script which was last loaded via {@link #script(String)}
	 * <p>Be mindful that variables are NOT reset on successive calls, so a script can be run repeatedly against
	 * the state it left behind. Use {@link #reset()} to clear variables. Output emitted before a failure is kept.</p>
	 *
	 * @return True if executed successfully, or false if there was an error (stderr will contain the error reason)
	 */
	public boolean run () {
		stdout = stderr = "";
		failure = null;
		output = new ArrayList<String> ();

		if (statements == null)
			return error (BuclException.runtime ("No script loaded"));

		BuclEvaluator evaluator = new BuclEvaluator (this, variables, 0);

		try {
			evaluator.evaluateStatements (statements);
			return true;
		} catch (BuclException e) {
			return error (e);
		} catch (RuntimeException e) {
			if (DEBUG)
				e.printStackTrace ();

			return error (BuclException.runtime ("Executor crash: " + e.toString ()));
		} catch (StackOverflowError e) {
			return error (BuclException.runtime ("Executor crash: " + e.toString ()));
		} finally {
			output = new ArrayList<String> (evaluator.output ());
			stdout = String.join ("\n", output);
		}
	}

	/**
	 * Records a failure in stderr
	 *
	 * @param e The failure
	 * @return False (used as a placeholder for returns in other methods)
	 */
	private boolean error (BuclException e) {
		if (DEBUG)
			logD (LOG_TAG, "Failure: " + e.getMessage ());

		failure = e;
		stderr = e.getMessage ();
		return false;
	}

	/**
	 * Passes an emitted line to the host listener
	 */
	void outputNotify (String line) {
		if (outputListener != null)
			outputListener.outputLine (line);
	}

	/**
	 * Calls the extensions registered for a function, then the catch-all extensions
	 *
	 * @param message The call to carry out
	 * @return The handled message, or null when every extension ignored it
	 * @throws BuclException HANDLED_FAIL or a broken extension, or anything the extension raised
	 */
	FunctionMessage extensionCall (FunctionMessage message) throws BuclException {
		if (DEBUG)
			logV (LOG_TAG, "Calling extensions for function: " + message.name);

		ArrayList<Extension> candidates = new ArrayList<Extension> ();
		if (extensions.containsKey (message.name))
			candidates.addAll (extensions.get (message.name));
		if (extensions.containsKey (CATCH_ALL))
			candidates.addAll (extensions.get (CATCH_ALL));

		// Loop through all extensions sharing the message
		for (int i = 0, j = candidates.size (); i < j; ++i) {
			message.result = null;

			FunctionMessage response = candidates.get (i).functionHandler (message);

			if (response == null)
				throw BuclException.runtime ("Extension is broken (no message returned)");

			if (DEBUG)
				logV (LOG_TAG, "[" + (i + 1) + "/" + j + "] " + "result=" + (response.result == null ? "NULL" : response.result.toString ()) + ", value=" + response.value);

			if (response.result == FunctionMessageResult.IGNORED) { // This extension skipped it, post to the next
				continue;
			} else if (response.result == FunctionMessageResult.HANDLED_OKAY) { // The value contains any result
				return response;
			} else if (response.result == FunctionMessageResult.HANDLED_FAIL) { // The value contains the error message
				throw BuclException.runtime (response.value != null && !response.value.isEmpty () ? response.value : "Extension is broken (no error message given)");
			} else {
				throw BuclException.runtime ("Extension is broken (invalid result value)");
			}
		}

		if (DEBUG)
			logD (LOG_TAG, "No extension handles " + message.name);

		return null;
	}

	/**
	 * Finds and parses a function script, caching the parsed statements
	 *
	 * @param name The function name
	 * @return The statements, or null if no library has the function
	 * @throws BuclException The script could not be read or parsed
	 */
	List<BuclStatement> functionStatements (String name) throws BuclException {
		if (functionCache.containsKey (name))
			return functionCache.get (name);

		ArrayList<Library> libraries = new ArrayList<Library> ();
		libraries.add (libraryMemory);
		libraries.add (libraryFiles);
		libraries.addAll (libraryExtras);
		libraries.add (libraryStandard);

		for (Library library : libraries) {
			String source;
			try {
				source = library.librarySource (name);
			} catch (IOException e) {
				throw BuclException.io (e);
			}

			if (source != null) {
				if (source.startsWith ("\uFEFF"))
					source = source.substring (1);

				List<BuclStatement> parsed = BuclParser.parse (source.replace ("\r\n", "\n").replace ("\r", "\n"));

				if (DEBUG)
					logD (LOG_TAG, "Loaded function script " + name + " from " + library.getClass ().getSimpleName ());

				functionCache.put (name, parsed);
				return parsed;
			}
		}

		return null;
	}

	/**
	 * Reads a stream to the end as UTF-8 text
	 *
	 * @param inputStream The stream to read, closed afterwards
	 * @return String containing the stream contents
	 * @throws IOException The stream could not be read
	 */
	static String streamRead (InputStream inputStream) throws IOException {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();

		try {
			byte buf[] = new byte[1024];
			int len;

			while ((len = inputStream.read (buf)) != -1)
				outputStream.write (buf, 0, len);
		} finally {
			inputStream.close ();
		}

		return new String (outputStream.toByteArray (), StandardCharsets.UTF_8);
	}

	/**
	 * Implementation specific logging for Verbose messages
	 *
	 * @param msg The message to log
	 */
	protected static void logV (String tag, String msg) {
		System.out.println ("V: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}

	/**
	 * Implementation specific logging for Debug messages
	 *
	 * @param msg The message to log
	 */
	protected static void logD (String tag, String msg) {
		System.out.println ("D: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}
}
