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

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.bucl.Bucl.Extension;
import org.bucl.Bucl.FunctionMessage;
import org.bucl.Bucl.FunctionMessageResult;

/**
 * This extension provides local filesystem access; it is considered DANGEROUS.
 * <p>
 * <b>WARNING:</b> If you execute BUCL with this extension in a security context higher than that of the user
 * then they can use it to gain privilege escalation. For example, running the BUCL engine as root (which is
 * also something you should NEVER do) lets a non-root user modify /etc/passwd because filesystem operations
 * will have the access level of whomever owns the running process (root).
 * </p>
 * <pre>
 * {text} readfile "in.txt"              or a named {path}
 * {ok} writefile "out.txt" "a" "b"      or a named {path} and {content}; the value is the content written
 * </pre>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclFile implements Extension {
	private static final String LOG_TAG = BuclFile.class.getSimpleName ();
	private static final String[] FUNCTIONS = {
		"readfile",
		"writefile"
	};

	private boolean DEBUG = false;

	/**
	 * Register the function names
	 */
	public String[] functionRegister (int version, boolean debug) {
		// Only turn debugging on not off
		DEBUG = DEBUG || debug;

		// This is a version 1 extension only
		if (version != 1) {
			if (DEBUG)
				logD (LOG_TAG, "Refusing to register this extension; BUCL v" + version + " is too high");

			return null;
		}

		if (DEBUG)
			logD (LOG_TAG, "Registering this extension with BUCL v" + version + " (debugging " + (debug ? "enabled" : "disabled") + ")");

		return FUNCTIONS;
	}

	/**
	 * No files are held open between calls
	 */
	public void functionReset () {
	}

	/**
	 * Handle file operation messages, by default this extension skips unknown requests
	 */
	public FunctionMessage functionHandler (FunctionMessage message) throws BuclException {
		if (DEBUG)
			logV (LOG_TAG, " IN functionHandler(name=" + message.name + ", args=" + message.args + ")");

		List<String> args = message.args;
		String path = message.arg ("path", 0);

		if (message.name.equals ("readfile")) {
			if (path == null) {
				message.fail ("readfile: missing path argument");
			} else {
				message.okay (fileRead (new File (path)));
			}
		} else if (message.name.equals ("writefile")) {
			if (path == null) {
				message.fail ("writefile: requires a path and content");
			} else {
				String content;
				if (message.named.containsKey ("content")) {
					content = message.named.get ("content");
				} else {
					content = (args.size () > 1 ? String.join ("", args.subList (1, args.size ())) : "");
				}

				fileWrite (new File (path), content);
				message.okay (content);
			}
		} else { // Ignore anything not understood
			message.result = FunctionMessageResult.IGNORED;
		}

		if (DEBUG)
			logD (LOG_TAG, "OUT functionHandler(result=" + message.result + ")");

		// Return the original recycled message
		return message;
	}

	/**
	 * Reads a file from disk and returns it as a string
	 *
	 * @param file The file to read
	 * @return String containing the file contents
	 * @throws BuclException An IO error if the file cannot be read
	 */
	private static String fileRead (File file) throws BuclException {
		try {
			return Bucl.streamRead (new FileInputStream (file));
		} catch (IOException e) {
			throw BuclException.io (e);
		}
	}

	/**
	 * Writes a string to a file on disk, replacing any previous content
	 *
	 * @param file The file to write
	 * @param content The text to write as UTF-8
	 * @throws BuclException An IO error if the file cannot be written
	 */
	private static void fileWrite (File file, String content) throws BuclException {
		try {
			OutputStream outputStream = new FileOutputStream (file, false);
			try {
				outputStream.write (content.getBytes (StandardCharsets.UTF_8));
				outputStream.flush ();
			} finally {
				outputStream.close ();
			}
		} catch (IOException e) {
			throw BuclException.io (e);
		}
	}
}
