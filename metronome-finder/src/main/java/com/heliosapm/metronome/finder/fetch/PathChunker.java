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
package com.heliosapm.metronome.finder.fetch;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>Title: PathChunker</p>
 * <p>Description: Splits a path list into consecutive chunks whose comma joined length fits in a request url.
 * Each path costs its UTF-8 length plus one for the separator. A path longer than the budget on its own gets a chunk of its own.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.PathChunker</code></p>
 */

public class PathChunker {

	/**
	 * Greedily chunks the passed paths, preserving order
	 * @param paths The paths to chunk
	 * @param budget The maximum cost of one chunk
	 * @return the chunks, never empty lists
	 */
	public static List<List<String>> chunk(final List<String> paths, final int budget) {
		if(budget < 1) throw new IllegalArgumentException("The passed budget was less than 1: " + budget);
		final List<List<String>> chunks = new ArrayList<List<String>>();
		List<String> current = new ArrayList<String>();
		int length = 0;
		for(String path: paths) {
			final int cost = cost(path);
			if(!current.isEmpty() && length + cost > budget) {
				chunks.add(current);
				current = new ArrayList<String>();
				length = 0;
			}
			current.add(path);
			length += cost;
		}
		if(!current.isEmpty()) chunks.add(current);
		return chunks;
	}

	/**
	 * Returns the url cost of one path
	 * @param path The path
	 * @return the UTF-8 length plus one
	 */
	public static int cost(final String path) {
		return path.getBytes(UTF_8).length + 1;
	}

	private PathChunker() {}
}
