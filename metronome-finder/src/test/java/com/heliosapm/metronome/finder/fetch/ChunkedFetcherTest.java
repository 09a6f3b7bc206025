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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Test;

import com.heliosapm.metronome.finder.BaseTest;
import com.heliosapm.metronome.finder.StubMetronomeClient;
import com.heliosapm.metronome.finder.StubMetronomeClient.RetrieveCall;
import com.heliosapm.metronome.finder.cache.WindowCache;
import com.heliosapm.metronome.finder.views.PdnsViewMapper;
import com.heliosapm.metronome.instrumentation.EmptyRequestListener;
import com.heliosapm.metronome.instrumentation.MetricsRequestListener;
import com.heliosapm.metronome.instrumentation.RequestListener;
import com.heliosapm.metronome.instrumentation.RequestType;
import com.heliosapm.metronome.json.BackendProtocolException;

/**
 * <p>Title: ChunkedFetcherTest</p>
 * <p>Description: Tests chunked, parallel fetching against the stub client</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.ChunkedFetcherTest</code></p>
 */

public class ChunkedFetcherTest extends BaseTest {
	protected final StubMetronomeClient client = new StubMetronomeClient();
	protected final ExecutorService pool = Executors.newFixedThreadPool(4);

	@After
	public void stopPool() {
		pool.shutdownNow();
	}

	protected ChunkedFetcher fetcher(final WindowCache cache, final RequestListener listener, final int budget) {
		return new ChunkedFetcher(client, PdnsViewMapper.INSTANCE, pool, cache, listener, 720, 100, budget, 5000);
	}

	protected ChunkedFetcher fetcher() {
		return fetcher(new WindowCache(), EmptyRequestListener.INSTANCE, 1748);
	}

	protected static List<Double> timestamps(final long from, final long to, final long step) {
		final List<Double> values = new ArrayList<Double>();
		for(long ts = from; ts < to; ts += step) {
			values.add((double)ts);
		}
		return values;
	}

	/**
	 * Tests the extended request and the trimmed result
	 */
	@Test
	public void testExtendedRangeTrimmed() {
		final FetchResult fr = fetcher().fetch(Arrays.asList("a.b", "a.c"), 10000, 17200);
		assertEquals(new TimeWindow(10000, 17200, 10, 720), fr.getWindow());
		assertFalse(fr.isFromCache());
		assertFalse(fr.hasWarnings());
		assertEquals(timestamps(10000, 17200, 10), fr.getData().get("a.b"));
		assertEquals(720, fr.getData().get("a.c").size());
		final RetrieveCall call = client.getRetrieveCalls().get(0);
		assertEquals(9000L, call.begin);
		assertEquals(17200L, call.end);
		assertEquals(820, call.points);
		assertEquals(Arrays.asList("a.b", "a.c"), call.paths);
	}

	/**
	 * Tests that a moving average follow up is served from the last fetch, identical to a direct fetch
	 */
	@Test
	public void testCacheHitIdentity() {
		final WindowCache cache = new WindowCache();
		final ChunkedFetcher fetcher = fetcher(cache, EmptyRequestListener.INSTANCE, 1748);
		fetcher.fetch(Arrays.asList("a.b", "a.c"), 10000, 17200);
		assertEquals(1, client.getRetrieveCalls().size());
		final FetchResult cached = fetcher.fetch(Collections.singletonList("a.b"), 9000, 10000);
		assertTrue(cached.isFromCache());
		assertEquals(1, client.getRetrieveCalls().size());
		final FetchResult direct = fetcher().fetch(Collections.singletonList("a.b"), 9000, 10000);
		assertFalse(direct.isFromCache());
		assertEquals(direct.getData().get("a.b"), cached.getData().get("a.b"));
		assertEquals(direct.getWindow(), cached.getWindow());
		assertEquals(timestamps(9000, 10000, 10), cached.getData().get("a.b"));
	}

	/**
	 * Tests that a follow up shorter than the cached step is fetched with its own window
	 */
	@Test
	public void testFollowUpShorterThanStepFetched() {
		final WindowCache cache = new WindowCache();
		final ChunkedFetcher fetcher = fetcher(cache, EmptyRequestListener.INSTANCE, 1748);
		fetcher.fetch(Arrays.asList("a.b", "a.c"), 100000, 186400);
		assertEquals(120L, cache.getEntry().getWindow().getStep());
		final FetchResult fr = fetcher.fetch(Collections.singletonList("a.b"), 99940, 100000);
		assertFalse(fr.isFromCache());
		assertEquals(2, client.getRetrieveCalls().size());
		assertEquals(new TimeWindow(99940, 100000, 10, 6), fr.getWindow());
		assertEquals(timestamps(99940, 100000, 10), fr.getData().get("a.b"));
	}

	/**
	 * Tests that a range one second past the last start misses and is fetched and recorded
	 */
	@Test
	public void testCacheMissRecords() {
		final WindowCache cache = new WindowCache();
		final ChunkedFetcher fetcher = fetcher(cache, EmptyRequestListener.INSTANCE, 1748);
		fetcher.fetch(Arrays.asList("a.b", "a.c"), 10000, 17200);
		final FetchResult fr = fetcher.fetch(Collections.singletonList("a.b"), 9000, 10001);
		assertFalse(fr.isFromCache());
		assertEquals(2, client.getRetrieveCalls().size());
		assertEquals(9000L, cache.getEntry().getWindow().getStart());
		assertEquals(10001L, cache.getEntry().getWindow().getEnd());
	}

	/**
	 * Tests derivative extraction and alias restoration
	 */
	@Test
	public void testDerivativesAndAliases() {
		final List<String> requested = Arrays.asList("_pdns_view.auth.x.auth.q", "pdns.x.auth.q_dt", "other.m_dt");
		final FetchResult fr = fetcher().fetch(requested, 10000, 17200);
		assertEquals(Arrays.asList("pdns.x.auth.q", "other.m"), client.getRetrieveCalls().get(0).paths);
		assertEquals(requested, new ArrayList<String>(fr.getData().paths()));
		assertEquals(10000D, fr.getData().get("_pdns_view.auth.x.auth.q").get(0), 0D);
		assertEquals(-10000D, fr.getData().get("pdns.x.auth.q_dt").get(0), 0D);
		assertEquals(-10000D, fr.getData().get("other.m_dt").get(0), 0D);
	}

	/**
	 * Tests that paths the backend does not know get empty series
	 */
	@Test
	public void testMissingPath() {
		client.missing("gone.path");
		final FetchResult fr = fetcher().fetch(Arrays.asList("a.b", "gone.path", "gone.path_dt"), 10000, 17200);
		assertTrue(fr.getData().contains("gone.path"));
		assertTrue(fr.getData().get("gone.path").isEmpty());
		assertTrue(fr.getData().get("gone.path_dt").isEmpty());
		assertEquals(720, fr.getData().get("a.b").size());
		assertFalse(fr.hasWarnings());
	}

	/**
	 * Tests that paths over the budget are split into several requests and merged
	 */
	@Test
	public void testChunking() {
		final List<String> paths = new ArrayList<String>();
		for(int i = 0; i < 20; i++) {
			paths.add("m.path" + i);
		}
		final FetchResult fr = fetcher(new WindowCache(), EmptyRequestListener.INSTANCE, 30).fetch(paths, 10000, 17200);
		assertTrue(client.getRetrieveCalls().size() > 1);
		int requested = 0;
		for(RetrieveCall call: client.getRetrieveCalls()) {
			requested += call.paths.size();
		}
		assertEquals(20, requested);
		assertEquals(paths, new ArrayList<String>(fr.getData().paths()));
		for(String path: paths) {
			assertEquals(720, fr.getData().get(path).size());
		}
	}

	/**
	 * Tests that a failed chunk leaves its paths empty, is reported and does not affect the other chunks
	 */
	@Test
	public void testChunkFailure() {
		client.failing("bad.path");
		final MetricsRequestListener listener = new MetricsRequestListener();
		final FetchResult fr = fetcher(new WindowCache(), listener, 10).fetch(Arrays.asList("ok.a", "bad.path", "ok.b"), 10000, 17200);
		assertEquals(720, fr.getData().get("ok.a").size());
		assertEquals(720, fr.getData().get("ok.b").size());
		assertTrue(fr.getData().get("bad.path").isEmpty());
		assertEquals(1, fr.getWarnings().size());
		assertEquals(Arrays.asList("bad.path"), fr.getWarnings().get(0).getPaths());
		assertEquals(1L, listener.getErrors(RequestType.CHUNK_RETRIEVE).getCount());
		assertEquals(2L, listener.getTimer(RequestType.CHUNK_RETRIEVE).getCount());
		assertEquals(1L, listener.getTimer(RequestType.FETCH).getCount());
	}

	/**
	 * Tests that a slow chunk times out alone
	 */
	@Test
	public void testChunkTimeout() {
		client.slow(3000, "slow.path");
		final long startMs = System.currentTimeMillis();
		final FetchResult fr = fetcher(new WindowCache(), EmptyRequestListener.INSTANCE, 10)
				.fetch(Arrays.asList("ok.a", "slow.path"), 10000, 17200, 500);
		assertTrue(System.currentTimeMillis() - startMs < 2500);
		assertEquals(720, fr.getData().get("ok.a").size());
		assertTrue(fr.getData().get("slow.path").isEmpty());
		assertEquals(1, fr.getWarnings().size());
		assertEquals(Arrays.asList("slow.path"), fr.getWarnings().get(0).getPaths());
	}

	/**
	 * Tests that an unparseable response fails the fetch
	 */
	@Test(expected=BackendProtocolException.class)
	public void testProtocolErrorPropagates() {
		client.garbled("bad.path");
		fetcher(new WindowCache(), EmptyRequestListener.INSTANCE, 10).fetch(Arrays.asList("ok.a", "bad.path"), 10000, 17200);
	}

	/**
	 * Tests that a single path fetch that misses the cache is recorded
	 */
	@Test
	public void testSinglePathRecorded() {
		final WindowCache cache = new WindowCache();
		fetcher(cache, EmptyRequestListener.INSTANCE, 1748).fetch(Collections.singletonList("a.b"), 10000, 17200);
		assertNotNull(cache.getEntry());
		assertEquals(820, cache.getEntry().getData().get("a.b").size());
	}

	/**
	 * Tests that a very short window fetches a single point
	 */
	@Test
	public void testShortWindow() {
		final FetchResult fr = fetcher().fetch(Arrays.asList("a.b", "a.c"), 10000, 10005);
		assertEquals(new TimeWindow(10000, 10005, 5, 1), fr.getWindow());
		assertEquals(101, client.getRetrieveCalls().get(0).points);
		assertEquals(Arrays.asList(10000D), fr.getData().get("a.b"));
	}

	/**
	 * Tests that an empty request makes no backend call
	 */
	@Test
	public void testNoPaths() {
		final FetchResult fr = fetcher().fetch(Collections.<String>emptyList(), 10000, 17200);
		assertEquals(0, fr.getData().size());
		assertTrue(client.getRetrieveCalls().isEmpty());
	}

	/**
	 * Tests the fetch summary
	 */
	@Test
	public void testSummarize() {
		assertEquals("a,b", ChunkedFetcher.summarize(Arrays.asList("a", "b")));
		assertEquals("a,b,c...+2", ChunkedFetcher.summarize(Arrays.asList("a", "b", "c", "d", "e")));
	}
}
