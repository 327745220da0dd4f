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

import static org.bucl.Bucl.logV;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;

import org.bucl.Bucl.Library;

/**
 * Function scripts on disk: <code>&lt;baseDir&gt;/functions/NAME.bucl</code>, then
 * <code>functions/NAME.bucl</code> relative to the working directory
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclLibraryFiles implements Library {
	private static final String LOG_TAG = BuclLibraryFiles.class.getSimpleName ();
	private static final boolean DEBUG = false;
	private static final String FUNCTIONS_DIRECTORY = "functions";
	private static final String EXTENSION = ".bucl";

	private File baseDir = null;

	public BuclLibraryFiles () {
	}

	public BuclLibraryFiles (File baseDir) {
		this.baseDir = baseDir;
	}

	public void baseDirSet (File baseDir) {
		this.baseDir = baseDir;
	}

	public File baseDirGet () {
		return baseDir;
	}

	public String librarySource (String name) throws IOException {
		if (!isPlainName (name))
			return null;

		File[] candidates = {
			(baseDir == null ? null : new File (new File (baseDir, FUNCTIONS_DIRECTORY), name + EXTENSION)),
			new File (FUNCTIONS_DIRECTORY, name + EXTENSION)
		};

		for (File candidate : candidates) {
			if (candidate != null && candidate.isFile ()) {
				if (DEBUG)
					logV (LOG_TAG, "Found " + name + " at " + candidate.getPath ());

				return Bucl.streamRead (new FileInputStream (candidate));
			}
		}

		return null;
	}

	/**
	 * Whether a function name can be used as a file name without leaving the functions directory
	 */
	static boolean isPlainName (String name) {
		return !name.isEmpty () && name.indexOf ('/') == -1 && name.indexOf ('\\') == -1 && !name.equals (".") && !name.equals ("..") && name.indexOf ('\0') == -1;
	}
}
