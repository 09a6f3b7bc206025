/**
Licensed to the Apache Software Foundation (ASF) under one
or more contributor license agreements.  See the NOTICE file
distributed with this work for additional information
regarding copyright ownership.  The ASF licenses this file
to you under the Apache License, Version 2.0 (the
"License"); you may not use this file except in compliance
with the License.  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing,
software distributed under the License is distributed on an
"AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
KIND, either express or implied.  See the License for the
specific language governing permissions and limitations
under the License.
 */
package com.heliosapm.metronome.finder.views;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>Title: DerivativePaths</p>
 * <p>Description: Helpers for the time derivative sibling of a metric path. Metronome returns the derivative
 * of every series it is asked for, which the catalog lists as the base path with a <b><code>_dt</code></b> suffix.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.views.DerivativePaths</code></p>
 */

public class DerivativePaths {
	/** The derivative path suffix */
	public static final String SUFFIX = "_dt";

	/**
	 * Returns a new list with the derivative sibling inserted after each path
	 * @param paths The base paths
	 * @return the paths and their derivatives
	 */
	public static List<String> withDerivatives(final List<String> paths) {
		final List<String> out = new ArrayList<String>(paths.size() * 2);
		for(String path: paths) {
			out.add(path);
			out.add(path + SUFFIX);
		}
		return out;
	}

	/**
	 * Determines if the passed path names a derivative series
	 * @param path The path to test
	 * @return true if the path ends with {@link #SUFFIX}
	 */
	public static boolean isDerivative(final String path) {
		return path.endsWith(SUFFIX);
	}

	/**
	 * Returns the base path of the passed path
	 * @param path The path
	 * @return the path with any {@link #SUFFIX} removed
	 */
	public static String basePath(final String path) {
		return isDerivative(path) ? path.substring(0, path.length() - SUFFIX.length()) : path;
	}

	private DerivativePaths() {}
}
