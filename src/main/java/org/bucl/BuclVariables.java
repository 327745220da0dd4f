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

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The variable store of one scope, plus name resolution and string interpolation
 * <p>Scripts address everything with slash paths over plain strings. Keys are split at the first slash into
 * a root name and a suffix and stored in the {@link BuclValue} of that root. Writing a root name through
 * {@link #set(String, String)} always rewrites <code>name/count</code> (to 1) and <code>name/length</code>;
 * anything with a slash, and anything written with {@link #put(String, String)}, is stored exactly as given.</p>
 * <p>Resolving <code>name/N</code> with a numeric N falls back to the Nth character of <code>name</code> when
 * its count is 1, and to an empty string otherwise; every other miss is an empty string.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclVariables {
	private static final String LOG_TAG = BuclVariables.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Interpolation passes over a reference name before it is looked up as written */
	static final int RESOLVE_PASSES = 64;

	private static final BigInteger UNSIGNED_MAX = BigInteger.ONE.shiftLeft (64).subtract (BigInteger.ONE);

	private HashMap<String, BuclValue> values = new HashMap<String, BuclValue> ();

	/**
	 * Stores a value, maintaining count and length metadata for root names
	 *
	 * @param name Variable name, with or without sub-path
	 * @param value Content of variable
	 */
	public void set (String name, String value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + name + "=" + value);

		if (name.indexOf ('/') == -1) {
			BuclValue root = root (name, true);
			root.put (BuclValue.LENGTH, String.valueOf (value.codePointCount (0, value.length ())));
			root.put (BuclValue.COUNT, "1");
			root.textSet (value);
		} else {
			put (name, value);
		}
	}

	/**
	 * Stores a value exactly as given, without touching metadata
	 *
	 * @param name Variable name, with or without sub-path
	 * @param value Content of variable
	 */
	public void put (String name, String value) {
		int slash = name.indexOf ('/');

		if (slash == -1) {
			root (name, true).textSet (value);
		} else {
			root (name.substring (0, slash), true).put (name.substring (slash + 1), value);
		}
	}

	/**
	 * Gets a stored value without any fallback
	 *
	 * @param name Exact variable name
	 * @return The stored value, or null if not set
	 */
	public String get (String name) {
		int slash = name.indexOf ('/');
		BuclValue root = root (slash == -1 ? name : name.substring (0, slash), false);

		if (root == null)
			return null;

		return (slash == -1 ? root.text () : root.get (name.substring (slash + 1)));
	}

	/**
	 * Whether a value is stored under the exact name
	 */
	public boolean has (String name) {
		return get (name) != null;
	}

	/**
	 * Unsets a variable; a root name takes its metadata and sub-paths with it
	 *
	 * @param name Variable name, with or without sub-path
	 */
	public void remove (String name) {
		int slash = name.indexOf ('/');

		if (slash == -1) {
			values.remove (name);
		} else {
			BuclValue root = root (name.substring (0, slash), false);
			if (root != null) {
				root.remove (name.substring (slash + 1));
				if (root.isEmpty ())
					values.remove (name.substring (0, slash));
			}
		}
	}

	/**
	 * Unsets all variables
	 */
	public void clear () {
		values = new HashMap<String, BuclValue> ();
	}

	/**
	 * Gets a copy of everything stored under a root name
	 *
	 * @param name Root variable name
	 * @return A detached copy, or null if nothing is stored under the name
	 */
	public BuclValue value (String name) {
		BuclValue root = values.get (name);
		return (root == null ? null : new BuclValue (root));
	}

	/**
	 * Gets every root name currently holding something
	 */
	public Set<String> roots () {
		return Collections.unmodifiableSet (values.keySet ());
	}

	/**
	 * Flattens the store back into slash-path keys
	 *
	 * @return Sorted map of every stored key and its value
	 */
	public Map<String, String> flatten () {
		TreeMap<String, String> flat = new TreeMap<String, String> ();

		for (Map.Entry<String, BuclValue> entry : values.entrySet ()) {
			BuclValue root = entry.getValue ();
			if (root.text () != null)
				flat.put (entry.getKey (), root.text ());

			for (Map.Entry<String, String> subPath : root.subPaths ().entrySet ())
				flat.put (entry.getKey () + "/" + subPath.getKey (), subPath.getValue ());
		}

		return flat;
	}

	/**
	 * Gets the element count of a root name
	 *
	 * @param name Root variable name
	 * @return The parsed <code>name/count</code>, or 0 when unset or not a number
	 */
	public long count (String name) {
		return countParse (get (name + "/" + BuclValue.COUNT));
	}

	/**
	 * Gets the named fields of a root name, the candidates for struct expansion
	 *
	 * @param name Root variable name
	 * @return Field name to value sorted by name, empty when there are none
	 */
	public Map<String, String> record (String name) {
		BuclValue root = values.get (name);
		return (root == null ? new TreeMap<String, String> () : root.record ());
	}

	/**
	 * Resolves a variable reference
	 * <pre>
	 * 1. A name containing { is interpolated until it stops changing (at most RESOLVE_PASSES times)
	 * 2. The stored value, if any
	 * 3. For name/N with numeric N and name/count == 1, the Nth character of name
	 * 4. Otherwise an empty string
	 * </pre>
	 *
	 * @param name Variable name as written between the braces
	 * @return The resolved value, never null
	 */
	public String resolve (String name) {
		for (int pass = 0; name.indexOf ('{') > -1; ++pass) {
			String interpolated = interpolate (name);
			if (interpolated.equals (name) || pass == RESOLVE_PASSES) {
				if (DEBUG)
					logV (LOG_TAG, "Reference does not settle: " + name);

				break;
			}

			name = interpolated;
		}

		String value = get (name);
		if (value != null)
			return value;

		int slash = name.indexOf ('/');
		if (slash > -1) {
			String parent = name.substring (0, slash);
			String index = name.substring (slash + 1);

			if (isNumeric (index) && count (parent) == 1) {
				String text = get (parent);
				long i = countParse (index);

				if (text != null && i < text.codePointCount (0, text.length ())) {
					int offset = text.offsetByCodePoints (0, (int) i);
					return new String (Character.toChars (text.codePointAt (offset)));
				}
			}
		}

		return "";
	}

	/**
	 * Expands every <code>{reference}</code> in a template
	 * <p>References may nest, <code>{parts/{i}}</code> resolves <code>i</code> first. A root name holding more
	 * than one element renders as its elements joined by single spaces. An unclosed brace is kept as text.</p>
	 *
	 * @param template Text possibly containing references
	 * @return The expanded text
	 */
	public String interpolate (String template) {
		StringBuilder sb = new StringBuilder (template.length ());

		for (int i = 0, j = template.length (); i < j; ++i) {
			char c = template.charAt (i);

			if (c != '{') {
				sb.append (c);
				continue;
			}

			StringBuilder name = new StringBuilder ();
			boolean closed = false;
			int depth = 1;

			for (++i; i < j; ++i) {
				c = template.charAt (i);
				if (c == '{') {
					++depth;
				} else if (c == '}' && --depth == 0) {
					closed = true;
					break;
				}
				name.append (c);
			}

			if (closed) {
				sb.append (resolveForString (name.toString ()));
			} else {
				sb.append ('{').append (name);
			}
		}

		return sb.toString ();
	}

	/**
	 * Resolves a reference found inside a quoted string, joining multi-element roots
	 */
	private String resolveForString (String name) {
		String resolvedName = (name.indexOf ('{') > -1 ? interpolate (name) : name);

		if (resolvedName.indexOf ('/') == -1) {
			long n = count (resolvedName);

			if (n > 1) {
				StringBuilder sb = new StringBuilder ();
				for (long i = 0; i < n; ++i) {
					if (i > 0)
						sb.append (' ');

					String element = get (resolvedName + "/" + i);
					if (element != null)
						sb.append (element);
				}

				return sb.toString ();
			}
		}

		return resolve (resolvedName);
	}

	private BuclValue root (String name, boolean create) {
		BuclValue root = values.get (name);

		if (root == null && create) {
			root = new BuclValue ();
			values.put (name, root);
		}

		return root;
	}

	/**
	 * Whether text is an unsigned integer (an optional leading + and decimal digits within 64 bits)
	 *
	 * @param text The text to test
	 * @return True for numeric text
	 */
	static boolean isNumeric (String text) {
		String digits = (text.startsWith ("+") ? text.substring (1) : text);

		if (digits.isEmpty ())
			return false;

		for (int i = 0, j = digits.length (); i < j; ++i) {
			char c = digits.charAt (i);
			if (c < '0' || c > '9')
				return false;
		}

		return new BigInteger (digits).compareTo (UNSIGNED_MAX) <= 0;
	}

	/**
	 * Parses a count or index
	 *
	 * @param text Numeric text, or null
	 * @return The number (capped at Long.MAX_VALUE), or 0 for null and anything not numeric
	 */
	static long countParse (String text) {
		if (text == null || !isNumeric (text))
			return 0;

		BigInteger n = new BigInteger (text.startsWith ("+") ? text.substring (1) : text);
		return (n.bitLength () < 64 ? n.longValue () : Long.MAX_VALUE);
	}
}
