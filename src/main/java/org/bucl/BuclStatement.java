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

import java.util.Collections;
import java.util.List;

/**
 * A parsed statement: <code>{target} function param1 param2 ...</code>
 * <p>A statement exclusively owns the indented block under it and, for <code>if</code> and
 * <code>elseif</code>, the <code>elseif</code>/<code>else</code> statement chained after it. Statements
 * are immutable so parsed trees can be cached and shared between evaluations.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public final class BuclStatement {
	/** Source line the statement started on */
	public final int lineNumber;

	/** Result variable name, or null when the line has none */
	public final String target;

	/** The built-in or function script to call */
	public final String function;

	public final List<BuclParameter> parameters;

	/** Indented block owned by this statement, or null */
	public final List<BuclStatement> block;

	/** The elseif/else taken when an if/elseif condition is false, or null */
	public final BuclStatement continuation;

	BuclStatement (int lineNumber, String target, String function, List<BuclParameter> parameters, List<BuclStatement> block, BuclStatement continuation) {
		this.lineNumber = lineNumber;
		this.target = target;
		this.function = function;
		this.parameters = Collections.unmodifiableList (parameters);
		this.block = (block == null ? null : Collections.unmodifiableList (block));
		this.continuation = continuation;
	}

	@Override
	public String toString () {
		return (target == null ? "" : "{" + target + "} ") + function + " " + parameters + (block == null ? "" : " [" + block.size () + " in block]") + (continuation == null ? "" : " -> " + continuation.function);
	}
}
