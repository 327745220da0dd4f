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

/**
 * One parameter of a statement, evaluated only when the statement runs
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclParameter {
	/** Parameter types */
	public static enum Type {
		QUOTED,   // "template {with} references", interpolated at evaluation time
		VARIABLE, // {name}, may itself contain {references}
		BARE      // literal word or number
	}

	public final Type type;
	public final String text;

	public BuclParameter (Type type, String text) {
		this.type = type;
		this.text = text;
	}

	@Override
	public boolean equals (Object o) {
		if (!(o instanceof BuclParameter))
			return false;

		BuclParameter other = (BuclParameter) o;
		return type == other.type && text.equals (other.text);
	}

	@Override
	public int hashCode () {
		return type.hashCode () * 31 + text.hashCode ();
	}

	@Override
	public String toString () {
		return type + "(" + text + ")";
	}
}
