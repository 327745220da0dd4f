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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Where function scripts come from
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class BuclLibraryTest {
	@Test
	public void _01_Memory () throws IOException {
		BuclLibraryMemory library = new BuclLibraryMemory ();

		assertNull (library.librarySource ("reverse"));

		library.functionAdd ("reverse", "{return} = \"mine\"");
		assertEquals ("{return} = \"mine\"", library.librarySource ("reverse"));

		library.functionRemoveAll ();
		assertNull (library.librarySource ("reverse"));
	}

	@Test
	public void _02_Standard () throws IOException {
		BuclLibraryMemory library = BuclLibraryMemory.standard ();

		for (String name : new String[] {"reverse", "explode", "implode", "maxlength", "slice"})
			assertTrue (name, library.librarySource (name) != null);

		assertNull (library.librarySource ("nosuchfunction"));
		assertNull (library.librarySource ("../functions/reverse"));
	}

	@Test
	public void _03_PlainNames () {
		assertTrue (BuclLibraryFiles.isPlainName ("greet"));
		assertTrue (BuclLibraryFiles.isPlainName ("my.func"));
		assertFalse (BuclLibraryFiles.isPlainName (""));
		assertFalse (BuclLibraryFiles.isPlainName ("."));
		assertFalse (BuclLibraryFiles.isPlainName (".."));
		assertFalse (BuclLibraryFiles.isPlainName ("a/b"));
		assertFalse (BuclLibraryFiles.isPlainName ("a\\b"));
		assertFalse (BuclLibraryFiles.isPlainName ("a\0b"));
	}

	@Test
	public void _04_Files () throws IOException {
		File baseDir = BuclTest.createTmpDirectory ();
		File functionsDir = new File (baseDir, "functions");
		assertTrue (functionsDir.mkdir ());
		functionsDir.deleteOnExit ();
		BuclTest.writeFile (new File (functionsDir, "hello.bucl"), "echo \"hello\"\n");

		BuclLibraryFiles library = new BuclLibraryFiles ();
		assertNull (library.librarySource ("hello"));

		library.baseDirSet (baseDir);
		assertEquals (baseDir, library.baseDirGet ());
		assertEquals ("echo \"hello\"\n", library.librarySource ("hello"));
		assertNull (library.librarySource ("../functions/hello"));
	}

	@Test
	public void _05_ParsedOnceAndCached () {
		final int[] loads = {0};
		Bucl bucl = new Bucl ();

		bucl.libraryAdd (new Bucl.Library () {
			public String librarySource (String name) {
				if (!name.equals ("counted"))
					return null;

				++loads[0];
				return "echo \"called\"";
			}
		});

		assertEquals (true, bucl.script ("counted\ncounted"));
		assertEquals (true, bucl.run ());
		assertEquals ("called\ncalled", bucl.stdout);
		assertEquals (1, loads[0]);

		// A broken function script is reported when it is called
		bucl.functionAdd ("broken", "\"not a statement\"");
		assertEquals (true, bucl.script ("echo \"a\"\nbroken"));
		assertEquals (false, bucl.run ());
		assertEquals ("a", bucl.stdout);
		assertEquals ("Parse error: line 1: a line cannot start with a string literal: \"not a statement\"", bucl.stderr);
	}

	@Test
	public void _06_LibraryFailure () {
		Bucl bucl = new Bucl ();

		bucl.libraryAdd (new Bucl.Library () {
			public String librarySource (String name) throws IOException {
				throw new IOException ("disk on fire");
			}
		});

		assertEquals (true, bucl.script ("anything"));
		assertEquals (false, bucl.run ());
		assertEquals ("IO error: disk on fire", bucl.stderr);
	}
}
