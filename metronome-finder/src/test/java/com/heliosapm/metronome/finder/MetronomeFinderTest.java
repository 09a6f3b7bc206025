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
package com.heliosapm.metronome.finder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.heliosapm.metronome.finder.fetch.FetchResult;
import com.heliosapm.metronome.finder.match.InvalidPatternException;
import com.heliosapm.metronome.finder.node.LeafNode;
import com.heliosapm.metronome.finder.node.Node;
import com.heliosapm.metronome.finder.node.ReadResult;
import com.heliosapm.metronome.finder.node.TimeBounds;
import com.heliosapm.metronome.instrumentation.EmptyRequestListener;

/**
 * <p>Title: MetronomeFinderTest</p>
 * <p>Description: Tests finding nodes and reading them through the finder</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.MetronomeFinderTest</code></p>
 */

public class MetronomeFinderTest extends BaseTest {
	protected final StubMetronomeClient client = new StubMetronomeClient();
	protected final MutableClock clock = new MutableClock(1470000000000L);
	protected MetronomeFinder finder = null;

	@Before
	public void createFinder() {
		finder = new MetronomeFinder(testConfig(), client, EmptyRequestListener.INSTANCE, clock);
	}

	@After
	public void closeFinder() {
		if(finder!=null) finder.close();
	}

	protected static List<String> describe(final Stream<Node> nodes) {
		return nodes.map(n -> (n.isLeaf() ? "L " : "B ") + n.getPath()).collect(Collectors.toList());
	}

	/**
	 * Tests that a literal pattern is a membership test
	 */
	@Test
	public void testLiteralFind() {
		client.metrics("pdns.x.auth.q", "a.b.c");
		final List<Node> nodes = finder.find("pdns.x.auth.q").collect(Collectors.toList());
		assertEquals(1, nodes.size());
		assertTrue(nodes.get(0) instanceof LeafNode);
		assertEquals("q", nodes.get(0).getName());
		assertEquals(Arrays.asList("L a.b.c_dt"), describe(finder.find("a.b.c_dt")));
		assertTrue(describe(finder.find("a.b")).isEmpty());
		assertTrue(describe(finder.find("nope")).isEmpty());
	}

	/**
	 * Tests that each branch is returned once, in catalog order
	 */
	@Test
	public void testGlobDedupe() {
		client.metrics("a.b.c", "a.b.d", "a.e");
		assertEquals(Arrays.asList("B a.b", "L a.e", "L a.e_dt"), describe(finder.find("a.*")));
		assertEquals(Arrays.asList("L a.b.c", "L a.b.d"), describe(finder.find("a.b.{c,d}")));
		assertEquals(Arrays.asList("B a"), describe(finder.find("*")));
	}

	/**
	 * Tests the PowerDNS layout, with the aliases found under their own prefix
	 */
	@Test
	public void testPdnsScenario() {
		client.metrics("pdns.x.auth.queries", "other.metric");
		assertEquals(Arrays.asList("L pdns.x.auth.queries", "L pdns.x.auth.queries_dt"), describe(finder.find("pdns.*.auth.*")));
		assertEquals(Arrays.asList("B _pdns_view.auth.x"), describe(finder.find("_pdns_view.auth.*")));
		assertEquals(Arrays.asList("L _pdns_view.auth.x.auth.queries", "L _pdns_view.auth.x.auth.queries_dt"),
				describe(finder.find("_pdns_view.auth.*.auth.*")));
		assertEquals(Arrays.asList("B pdns", "B _pdns_view", "B other"), describe(finder.find("*")));
		for(String pattern: Arrays.asList("pdns.*.auth.*", "_pdns_view.auth.*", "_pdns_view.auth.*.auth.*")) {
			assertFalse(describe(finder.find(pattern)).toString().contains("other"));
		}
	}

	/**
	 * Tests that an invalid pattern fails before the catalog is loaded
	 */
	@Test
	public void testInvalidPatternBeforeIO() {
		try {
			finder.find("a.{b,c");
		} catch (InvalidPatternException ex) {
			assertEquals(0, client.getMetricsCalls());
			return;
		}
		throw new AssertionError("Expected InvalidPatternException");
	}

	/**
	 * Tests that the catalog is read when the stream is consumed
	 */
	@Test
	public void testLazyFind() {
		client.metrics("a.b");
		final Stream<Node> nodes = finder.find("a.*");
		assertEquals(0, client.getMetricsCalls());
		assertEquals(2L, nodes.count());
		assertEquals(1, client.getMetricsCalls());
	}

	/**
	 * Tests reading a leaf through its reader
	 */
	@Test
	public void testReader() {
		client.metrics("pdns.x.auth.queries");
		final LeafNode leaf = (LeafNode)finder.find("_pdns_view.auth.x.auth.queries").findFirst().get();
		final ReadResult rr = leaf.getReader().fetch(10000, 17200);
		assertEquals(720, rr.getValues().size());
		assertEquals(10000D, rr.getValues().get(0), 0D);
		assertEquals(Arrays.asList("pdns.x.auth.queries"), client.getRetrieveCalls().get(0).paths);
		final TimeBounds bounds = leaf.getReader().getIntervals();
		assertEquals(0L, bounds.getStart());
		assertEquals(1470000000L, bounds.getEnd());
	}

	/**
	 * Tests a multi node fetch followed by the moving average follow up of one node
	 */
	@Test
	public void testFetchNodesThenFollowUp() {
		client.metrics("a.b", "a.c");
		final List<LeafNode> leaves = new ArrayList<LeafNode>();
		finder.find("a.{b,c}").forEach(n -> leaves.add((LeafNode)n));
		final FetchResult fr = finder.fetchNodes(leaves, 10000, 17200);
		assertEquals(2, fr.getData().size());
		final ReadResult followUp = leaves.get(1).getReader().fetch(9500, 10000);
		assertEquals(50, followUp.getValues().size());
		assertEquals(1, client.getRetrieveCalls().size());
		assertEquals(1L, finder.getWindowCache().getHitCount());
	}

	/**
	 * Tests that closing the finder closes the client
	 */
	@Test
	public void testClose() {
		finder.close();
		assertTrue(client.isClosed());
		finder = null;
	}
}
