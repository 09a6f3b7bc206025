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
package com.heliosapm.metronome.instrumentation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.codahale.metrics.MetricRegistry;
import com.heliosapm.metronome.BaseTest;

/**
 * <p>Title: MetricsRequestListenerTest</p>
 * <p>Description: Tests the metric recording request listener</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.instrumentation.MetricsRequestListenerTest</code></p>
 */

public class MetricsRequestListenerTest extends BaseTest {

	/**
	 * Tests that completions and errors land in the per type metrics
	 */
	@Test
	public void testRecording() {
		final MetricRegistry registry = new MetricRegistry();
		final MetricsRequestListener listener = new MetricsRequestListener(registry);
		listener.onRequestStart(RequestType.FETCH, "a,b");
		assertEquals(1L, listener.getInflight(RequestType.FETCH).getCount());
		listener.onRequestComplete(RequestType.FETCH, "a,b", TimeUnit.MILLISECONDS.toNanos(5));
		listener.onRequestStart(RequestType.CHUNK_RETRIEVE, "a");
		listener.onRequestError(RequestType.CHUNK_RETRIEVE, "a", new RuntimeException("boom"));
		assertEquals(0L, listener.getInflight(RequestType.FETCH).getCount());
		assertEquals(1L, listener.getTimer(RequestType.FETCH).getCount());
		assertEquals(0L, listener.getTimer(RequestType.CHUNK_RETRIEVE).getCount());
		assertEquals(1L, listener.getErrors(RequestType.CHUNK_RETRIEVE).getCount());
		assertEquals(0L, listener.getInflight(RequestType.CHUNK_RETRIEVE).getCount());
		assertTrue(registry.getTimers().containsKey("metronome.fetch.time"));
		assertTrue(registry.getMeters().containsKey("metronome.catalog.refresh.errors"));
	}
}
