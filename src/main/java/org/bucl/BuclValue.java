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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything stored under one root variable name
 * <p>Scripts only ever see slash-path strings (<code>name</code>, <code>name/count</code>,
 * <code>name/0</code>, <code>name/host</code>), {@link BuclVariables} maps those paths onto the slots of
 * this class. The kind is derived from what is stored rather than declared:</p>
 * <pre>
 * RECORD  at least one named field (not numeric, not count/length, no further slash)
 * ARRAY   otherwise, count is an integer above 1
 * SCALAR  anything else
 * </pre>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclValue {
	public static final String COUNT = "count";
	public static final String LENGTH = "length";

	/** Value kinds, see class description */
	public static enum Kind {
		SCALAR,
		ARRAY,
		RECORD
	}

	private String text = null;
	private String count = null;
	private String length = null;
	private final TreeMap<Integer, String> items = new TreeMap<Integer, String> ();
	private final TreeMap<String, String> fields = new TreeMap<String, String> ();

	BuclValue () {
	}

	/** Copy constructor, values are handed to hosts as copies */
	BuclValue (BuclValue other) {
		text = other.text;
		count = other.count;
		length = other.length;
		items.putAll (other.items);
		fields.putAll (other.fields);
	}

	/**
	 * Gets the kind of value
	 *
	 * @return RECORD, ARRAY or SCALAR
	 */
	public Kind kind () {
		if (!record ().isEmpty ())
			return Kind.RECORD;

		if (BuclVariables.countParse (count) > 1)
			return Kind.ARRAY;

		return Kind.SCALAR;
	}

	/**
	 * Gets the root text
	 *
	 * @return The value stored under the bare root name, or null if never set
	 */
	public String text () {
		return text;
	}

	/**
	 * Gets the array elements, index 0 to count-1 with missing slots as empty strings
	 *
	 * @return The elements of an ARRAY, or a single element holding the text otherwise
	 */
	public List<String> elements () {
		List<String> elements = new ArrayList<String> ();
		long n = BuclVariables.countParse (count);

		if (n > 1) {
			for (int i = 0; i < n; ++i)
				elements.add (items.containsKey (i) ? items.get (i) : "");
		} else {
			elements.add (text == null ? "" : text);
		}

		return elements;
	}

	/**
	 * Gets the named fields used for struct expansion, sorted by name
	 *
	 * @return Field name to value, empty unless this is a RECORD
	 */
	public Map<String, String> record () {
		TreeMap<String, String> record = new TreeMap<String, String> ();

		for (Map.Entry<String, String> field : fields.entrySet ()) {
			String suffix = field.getKey ();
			if (suffix.indexOf ('/') == -1 && !BuclVariables.isNumeric (suffix))
				record.put (suffix, field.getValue ());
		}

		return Collections.unmodifiableMap (record);
	}

	/**
	 * Gets every stored sub-path, metadata included, in a stable order
	 *
	 * @return Suffix (the path after the root name and slash) to value
	 */
	public Map<String, String> subPaths () {
		TreeMap<String, String> subPaths = new TreeMap<String, String> ();

		if (count != null)
			subPaths.put (COUNT, count);
		if (length != null)
			subPaths.put (LENGTH, length);
		for (Map.Entry<Integer, String> item : items.entrySet ())
			subPaths.put (String.valueOf (item.getKey ()), item.getValue ());
		subPaths.putAll (fields);

		return subPaths;
	}

	/**
	 * Whether nothing at all is stored
	 *
	 * @return True when the root text, metadata and every sub-path are unset
	 */
	public boolean isEmpty () {
		return text == null && count == null && length == null && items.isEmpty () && fields.isEmpty ();
	}

	void textSet (String text) {
		this.text = text;
	}

	/**
	 * Reads a sub-path slot
	 *
	 * @param suffix Path after the root name and slash
	 * @return The stored string, or null when the slot is empty
	 */
	String get (String suffix) {
		if (suffix.equals (COUNT))
			return count;
		if (suffix.equals (LENGTH))
			return length;

		int index = indexCanonical (suffix);
		if (index > -1)
			return items.get (index);

		return fields.get (suffix);
	}

	void put (String suffix, String value) {
		if (suffix.equals (COUNT)) {
			count = value;
		} else if (suffix.equals (LENGTH)) {
			length = value;
		} else {
			int index = indexCanonical (suffix);
			if (index > -1) {
				items.put (index, value);
			} else {
				fields.put (suffix, value);
			}
		}
	}

	void remove (String suffix) {
		if (suffix.equals (COUNT)) {
			count = null;
		} else if (suffix.equals (LENGTH)) {
			length = null;
		} else {
			int index = indexCanonical (suffix);
			if (index > -1) {
				items.remove (index);
			} else {
				fields.remove (suffix);
			}
		}
	}

	/**
	 * Array slots are keyed by plain decimal indexes; "07" or "+7" stay distinct named paths
	 *
	 * @return The index, or -1 if the suffix is not a canonical index
	 */
	private static int indexCanonical (String suffix) {
		int n = suffix.length ();
		if (n == 0 || n > 9 || (n > 1 && suffix.charAt (0) == '0'))
			return -1;

		for (int i = 0; i < n; ++i) {
			char c = suffix.charAt (i);
			if (c < '0' || c > '9')
				return -1;
		}

		return Integer.parseInt (suffix);
	}

	@Override
	public String toString () {
		return kind () + "(" + text + ", " + subPaths () + ")";
	}
}
