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

package org.bucl.example;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.bucl.Bucl;
import org.bucl.BuclFile;

/**
 * BUCL for Java
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		System.exit (run (args));
	}

	/**
	 * Runs the command line without exiting
	 *
	 * @param args The command line options
	 * @return The return code for the invoking shell
	 */
	public static int run (String[] args) {
		/** The return code sent to the invoking shell */
		int returnCode = -1;

		/** The BUCL script to run (loaded from disk, standard input or internal example) */
		String sourceData = null;

		/** The directory searched for functions/NAME.bucl */
		File baseDir = null;

		// Process command line flags
		List <String> params = Arrays.asList (args);
		boolean paramVersion = params.contains ("--v");
		boolean paramHelp = params.contains ("--help");
		boolean paramExample = params.contains ("--hello");

		if (args.length > 1 || paramVersion || paramHelp) { // Called with wrong arguments, version or help
			// Show version
			System.out.println ("BUCL for Java (v " + Bucl.VERSION_MAJOR + "." + Bucl.VERSION_MINOR + ")\n");

			// Show usage information
			if (paramHelp || args.length > 1) {
				System.out.println ("Usage:  java -jar bucl.jar [sourcefile]");
				System.out.println ("        (to execute a BUCL script, read from standard input if no file is given)");
				System.out.println ("Alternatively set run configuration arguments in your IDE");
				System.out.println ("");
				System.out.println ("Options:");
				System.out.println ("    --help     Show this help");
				System.out.println ("       --v     Show version information");
				System.out.println ("   --hello     Run internal example script");
			}

			returnCode = 2;
		} else if (paramExample) { // Called to execute the internal example BUCL script
			/* The example used:
			 *
			 *  {answer} math "2+2"
			 *  echo "Hello world! 2+2={answer}"
			 */
			sourceData = "{answer} math \"2+2\"" + "\n" + "echo \"Hello world! 2+2={answer}\"";
		} else if (args.length == 0) { // Called to execute a BUCL script piped in
			try {
				sourceData = readStream (System.in);
			} catch (IOException e) {
				System.err.println ("Standard input unknown error: " + e.getMessage ());
				returnCode = 4;
			}
		} else { // Called to execute a BUCL script from disk
			File sourceFile = new File (args[0]);

			// Attempt to read the file from disk
			if (!sourceFile.exists ()) {
				System.err.println ("File does not exist: " + args[0]);
				returnCode = 3;
			} else if (!sourceFile.canRead ()) {
				System.err.println ("File read permission denied: " + args[0]);
				returnCode = 13;
			} else {
				try {
					sourceData = readStream (new FileInputStream (sourceFile));
					baseDir = sourceFile.getAbsoluteFile ().getParentFile ();
				} catch (IOException e) {
					System.err.println ("File unknown error: " + args[0] + " (" + e.getMessage () + ")");
					returnCode = 4;
				}
			}
		}

		// If a BUCL script is in this variable, execute it
		if (sourceData != null) {
			boolean success;

			// Create a new instance
			Bucl bucl = new Bucl ();

			// Scripts run from the command line may use the filesystem
			bucl.extensionAdd (new BuclFile ());
			bucl.baseDirSet (baseDir);

			// Write each line of output as soon as it is produced
			bucl.outputListenerSet (new Bucl.OutputListener () {
				public void outputLine (String line) {
					System.out.println (line);
				}
			});

			// Give the script to the instance
			success = bucl.script (sourceData);
			if (success) {
				// Run the script
				success = bucl.run ();

				/* The output of the script is now also available in bucl.stdout
				 * and bucl.stderr, and the engine still holds the variables the
				 * script left behind. For example:  bucl.variableGet ("answer") == 4
				 */
			}

			// Set the return code for the shell (0=success)
			returnCode = (success ? 0 : 1);

			// Write the standard error if there is any
			if (!bucl.stderr.isEmpty ())
				System.err.println (bucl.stderr);
		}

		return returnCode;
	}

	/**
	 * Reads a stream to the end and returns it as a string
	 *
	 * @param inputStream The stream to read, closed afterwards
	 * @return String containing the stream contents
	 * @throws IOException If the stream cannot be read
	 */
	private static String readStream (InputStream inputStream) throws IOException {
		ByteArrayOutputStream outputStream = new ByteArrayOutputStream ();

		try {
			byte buf[] = new byte[1024];
			int len;

			while ((len = inputStream.read (buf)) != -1)
				outputStream.write (buf, 0, len);
		} finally {
			if (inputStream != System.in)
				inputStream.close ();
		}

		return new String (outputStream.toByteArray (), StandardCharsets.UTF_8);
	}
}
