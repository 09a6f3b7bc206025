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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.base.Strings;
import com.heliosapm.metronome.finder.BaseTest;

/**
 * <p>Title: PathChunkerTest</p>
 * <p>Description: Tests splitting path lists to fit the request url budget</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.PathChunkerTest</code></p>
 */

public class PathChunkerTest extends BaseTest {

	/**
	 * Tests greedy filling of chunks
	 */
	@Test
	public void testGreedy() {
		final List<List<String>> chunks = PathChunker.chunk(Arrays.asList("aaaa", "bbbb", "cccc"), 10);
		assertEquals(Arrays.asList(Arrays.asList("aaaa", "bbbb"), Arrays.asList("cccc")), chunks);
	}

	/**
	 * Tests that a path over the budget gets its own chunk and no chunk is empty
	 */
	@Test
	public void testOversized() {
		final String big = Strings.repeat("x", 20);
		final List<List<String>> chunks = PathChunker.chunk(Arrays.asList(big, "a", "b"), 10);
		assertEquals(Arrays.asList(Arrays.asList(big), Arrays.asList("a", "b")), chunks);
	}

	/**
	 * Tests that the cost is the UTF-8 length plus the separator
	 */
	@Test
	public void testUtf8Cost() {
		assertEquals(2, PathChunker.cost("a"));
		assertEquals(3, PathChunker.cost("é"));
		assertEquals(2, PathChunker.chunk(Arrays.asList("éé", "éé"), 9).size());
		assertEquals(1, PathChunker.chunk(Arrays.asList("ee", "ee"), 9).size());
	}

	/**
	 * Tests the budget and concatenation identity over a realistic path list
	 */
	@Test
	public void testBudgetAndIdentity() {
		final List<String> paths = new ArrayList<String>();
		for(int i = 0; i < 500; i++) {
			paths.add("pdns.server-" + i + ".example.com.recursor.answers" + (i % 7));
		}
		final List<List<String>> chunks = PathChunker.chunk(paths, 1748);
		assertTrue(chunks.size() > 1);
		final List<String> joined = new ArrayList<String>();
		for(List<String> chunk: chunks) {
			assertFalse(chunk.isEmpty());
			int cost = 0;
			for(String path: chunk) {
				cost += PathChunker.cost(path);
			}
			assertTrue("Chunk cost " + cost, cost <= 1748);
			joined.addAll(chunk);
		}
		assertEquals(paths, joined);
	}

	/**
	 * Tests that no paths yields no chunks
	 */
	@Test
	public void testEmpty() {
		assertTrue(PathChunker.chunk(Collections.<String>emptyList(), 1748).isEmpty());
	}

	/**
	 * Tests that a budget under 1 is rejected
	 */
	@Test(expected=IllegalArgumentException.class)
	public void testInvalidBudget() {
		PathChunker.chunk(Arrays.asList("a"), 0);
	}
}
