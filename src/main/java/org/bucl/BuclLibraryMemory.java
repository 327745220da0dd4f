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
import java.io.InputStream;
import java.util.HashMap;

import org.bucl.Bucl.Library;

/**
 * Function scripts held in memory, optionally backed by class-path resources
 * <p>The standard library (<code>reverse</code>, <code>explode</code>, <code>implode</code>,
 * <code>maxlength</code>, <code>slice</code>) is an instance backed by <code>org/bucl/functions/</code>.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class BuclLibraryMemory implements Library {
	private static final String STANDARD_RESOURCES = "org/bucl/functions/";

	private final HashMap<String, String> sources = new HashMap<String, String> ();
	private final String resourcePrefix;

	/**
	 * An empty library filled with {@link #functionAdd(String, String)}
	 */
	public BuclLibraryMemory () {
		this (null);
	}

	/**
	 * @param resourcePrefix Class-path directory (ending with a slash) searched for <code>name.bucl</code>, or null
	 */
	public BuclLibraryMemory (String resourcePrefix) {
		this.resourcePrefix = resourcePrefix;
	}

	/**
	 * The library of function scripts shipped with the engine
	 */
	public static BuclLibraryMemory standard () {
		return new BuclLibraryMemory (STANDARD_RESOURCES);
	}

	public void functionAdd (String name, String source) {
		sources.put (name, source);
	}

	public void functionRemoveAll () {
		sources.clear ();
	}

	public String librarySource (String name) throws IOException {
		if (sources.containsKey (name))
			return sources.get (name);

		if (resourcePrefix == null || !BuclLibraryFiles.isPlainName (name))
			return null;

		InputStream inputStream = BuclLibraryMemory.class.getClassLoader ().getResourceAsStream (resourcePrefix + name + ".bucl");
		if (inputStream == null)
			return null;

		String source = Bucl.streamRead (inputStream);
		sources.put (name, source);
		return source;
	}
}
