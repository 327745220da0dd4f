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

import java.util.HashMap;

/**
 * This extension is used by BuclTest.java to test both that the extension loading/registering mechanism works and that
 * function calls can be resolved to successful message handling calls.
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclTestExtension implements Bucl.Extension {
	private static final String LOG_TAG = BuclTestExtension.class.getSimpleName ();
	private static final String[] FUNCTIONS = {
		"test",
		"testget",
		"testset",
		"testcounter",
		"testduplicate",
		"testimmutable"
	};

	private boolean DEBUG = false; // Will automatically be set to true if the calling BUCL instance is in debug
	private HashMap<String, String> backingStore; // An in-memory storage pool for our testing

	/**
	 * Constructor, add some test values to the backing store
	 */
	public BuclTestExtension () {
		functionReset ();
	}

	/**
	 * Return the function names, or null if the extension declines to be registered
	 *
	 * @param version The version of the calling BUCL class
	 * @param debug Whether the calling BUCL class is in debug mode and the extension should be so also
	 * @return The names that when called will get the BUCL processor to call-back this extension
	 */
	public String[] functionRegister (int version, boolean debug) {
		// Only turn debugging on not off
		if (debug)
			DEBUG = true;

		if (version != 1) {
			if (DEBUG)
				logD (LOG_TAG, "Refusing to register this extension; BUCL v" + version + " is too high");

			return null;
		}

		return FUNCTIONS;
	}

	/**
	 * Resets the backing store
	 */
	public void functionReset () {
		if (DEBUG)
			logD (LOG_TAG, "Resetting backing store");

		backingStore = new HashMap<String, String> ();
		backingStore.put ("instantiated", String.valueOf (System.currentTimeMillis ()));
		backingStore.put ("foo", "bar");
	}

	/**
	 * The messaging mechanism that extensions use to carry out calls
	 *
	 * @param message A message object containing all the details of the statement
	 * @return A message object (usually the same one) with flags to specify whether the message was successful or skipped
	 */
	public Bucl.FunctionMessage functionHandler (Bucl.FunctionMessage message) {
		if (DEBUG)
			logD (LOG_TAG, " IN functionHandler(name=" + message.name + ", args=" + message.args + ")");

		if (message.name.equals ("test")) { // Unit testing test, answer this
			message.okay ("Pass");
		} else if (message.name.equals ("testget")) {
			String value = backingStore.get (message.arg ("key", 0) == null ? "" : message.arg ("key", 0));
			message.okay (value == null ? "" : value);
		} else if (message.name.equals ("testset")) {
			if (message.args.size () != 2) {
				message.fail (LOG_TAG + " testset requires a key and a value");
			} else {
				backingStore.put (message.args.get (0), message.args.get (1));
				message.okay (null);
			}
		} else if (message.name.equals ("testcounter")) { // Survives runs, not resets
			String counter = String.valueOf (Integer.parseInt (backingStore.containsKey ("counter") ? backingStore.get ("counter") : "0") + 1);
			backingStore.put ("counter", counter);
			message.okay (counter);
		} else if (message.name.equals ("testduplicate")) { // Unit testing test, all answer this
			message.okay ((message.value == null ? "" : message.value) + "ALPHA ");
		} else if (message.name.equals ("testimmutable")) {
			message.fail ("testimmutable is immutable");
		} else {
			message.result = Bucl.FunctionMessageResult.IGNORED;
		}

		if (DEBUG)
			logD (LOG_TAG, "OUT functionHandler(result=" + message.result + ", value=" + message.value + ")");

		// Returning the original recycled message
		return message;
	}
}
