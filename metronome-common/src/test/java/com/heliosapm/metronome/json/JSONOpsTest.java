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
package com.heliosapm.metronome.json;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.heliosapm.metronome.BaseTest;
import com.heliosapm.metronome.client.RetrieveResult;
import com.heliosapm.metronome.client.Series;

/**
 * <p>Title: JSONOpsTest</p>
 * <p>Description: Tests the JSONP unwrapping and repair</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.json.JSONOpsTest</code></p>
 */

public class JSONOpsTest extends BaseTest {

	/**
	 * Tests parsing the bare key list form
	 */
	@Test
	public void testBareKeyListRetrieve() {
		final RetrieveResult rr = JSONOps.loadJsonp("_( raw: {\"a\":[[1,2]]}, derivative: {} );", RetrieveResult.class);
		assertEquals(1, rr.raw().size());
		final Series a = rr.raw().get("a");
		assertEquals(1, a.size());
		assertEquals(1L, a.timestamps()[0]);
		assertEquals(2D, a.values().get(0), 0D);
		assertTrue(rr.derivative().isEmpty());
	}

	/**
	 * Tests parsing the object form with null values
	 */
	@Test
	public void testObjectRetrieveWithNulls() {
		final String jsonp = "_({ raw: {\"pdns.a.auth.q\":[[10,1.5],[20,null]]}, derivative: {\"pdns.a.auth.q\":[[10,0],[20,0.1]]} });";
		final RetrieveResult rr = JSONOps.loadJsonp(jsonp, RetrieveResult.class);
		final Series raw = rr.raw().get("pdns.a.auth.q");
		assertEquals(2, raw.size());
		assertEquals(20L, raw.timestamps()[1]);
		assertNull(raw.values().get(1));
		assertEquals(Arrays.asList(0D, 0.1D), rr.derivative().get("pdns.a.auth.q").values());
	}

	/**
	 * Tests the repair of the unquoted keys
	 */
	@Test
	public void testRepair() {
		assertEquals("{ \"raw\":{}, \"derivative\":{} }", JSONOps.repairJsonp("_({ raw: {}, derivative: {} });"));
		assertEquals("{\"metrics\":[\"a\"]}", JSONOps.repairJsonp("_({\"metrics\":[\"a\"]});"));
	}

	/**
	 * Tests reading the catalog response as a tree
	 */
	@Test
	public void testCatalogShape() {
		final JsonNode node = JSONOps.loadJsonp("_({\"metrics\":[\"pdns.a.auth.q\",\"pdns.b.recursor.q\"]});");
		assertTrue(node.get("metrics").isArray());
		assertEquals(2, node.get("metrics").size());
		assertEquals("pdns.b.recursor.q", node.get("metrics").get(1).asText());
	}

	/**
	 * Tests that unparseable text is reported with the raw text attached
	 */
	@Test
	public void testInvalidRetainsRawText() {
		final String jsonp = "_({ raw: {\"a\": [[1,2]] );";
		try {
			JSONOps.loadJsonp(jsonp, RetrieveResult.class);
			fail("Expected BackendProtocolException");
		} catch (BackendProtocolException bex) {
			assertEquals(jsonp, bex.getRawText());
		}
	}

	/**
	 * Tests that a response too short to unwrap is rejected
	 */
	@Test(expected=BackendProtocolException.class)
	public void testTooShort() {
		JSONOps.loadJsonp("_(");
	}

	/**
	 * Tests that a malformed data point is rejected
	 */
	@Test(expected=BackendProtocolException.class)
	public void testMalformedDataPoint() {
		JSONOps.loadJsonp("_({ raw: {\"a\":[[1]]}, derivative: {} });", RetrieveResult.class);
	}
}
