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
package com.heliosapm.metronome.finder.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.heliosapm.metronome.finder.fetch.SeriesData;
import com.heliosapm.metronome.finder.fetch.TimeWindow;

/**
 * <p>Title: WindowCache</p>
 * <p>Description: Holds the extended range data of the last network fetch so that the single path fetches
 * issued right after it for a moving average, which end where that fetch started, are served without a request.</p>
 * <p>The entry is replaced wholesale on every network fetch, last writer wins.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.cache.WindowCache</code></p>
 */

public class WindowCache {
	private static final Logger log = LogManager.getLogger(WindowCache.class);

	protected final AtomicReference<WindowCacheEntry> last = new AtomicReference<WindowCacheEntry>();
	protected final AtomicLong hits = new AtomicLong();
	protected final AtomicLong misses = new AtomicLong();

	/**
	 * Serves the passed range of one path from the last fetch if that fetch started at <b><code>end</code></b>
	 * and its extended range reaches back to <b><code>start</code></b>. A range shorter than the cached step, or a cached
	 * series shorter than the additional points, is a miss.
	 * @param path The requested path
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @return the cached series, or empty on a miss
	 */
	public Optional<CachedSeries> tryServe(final String path, final long start, final long end) {
		final WindowCacheEntry entry = last.get();
		if(entry==null || end!=entry.window.getStart() || start < entry.extendedStart || !entry.data.contains(path)) {
			misses.incrementAndGet();
			return Optional.empty();
		}
		final long step = entry.window.getStep();
		final int points = (int)((end - start) / step);
		final List<Double> ext = entry.data.get(path);
		// the served slice must hold exactly one sample per point, ending at the cached window start
		if(points < 1 || ext.size() < entry.additionalPoints) {
			misses.incrementAndGet();
			log.debug("Cannot serve [{},{}> of {} from cache: points={}, cached samples={}", start, end, path, points, ext.size());
			return Optional.empty();
		}
		final int to = entry.additionalPoints;
		final int from = to - points;
		final List<Double> values = Collections.unmodifiableList(new ArrayList<Double>(ext.subList(from, to)));
		hits.incrementAndGet();
		log.debug("Served [{},{}> of {} from cached [{}~{},{}> ({} points)", start, end, path,
				entry.extendedStart, entry.window.getStart(), entry.window.getEnd(), points);
		return Optional.of(new CachedSeries(new TimeWindow(start, end, step, points), values));
	}

	/**
	 * Replaces the cached entry
	 * @param window The window the caller asked for
	 * @param additionalPoints The number of extra samples fetched ahead of the window
	 * @param extendedStart The start of the extended range
	 * @param data The untrimmed series keyed by requested path
	 */
	public void record(final TimeWindow window, final int additionalPoints, final long extendedStart, final SeriesData data) {
		if(window==null) throw new IllegalArgumentException("The passed window was null");
		if(data==null) throw new IllegalArgumentException("The passed data was null");
		last.set(new WindowCacheEntry(window, additionalPoints, extendedStart, data));
	}

	/**
	 * Returns the current entry
	 * @return the current entry, or null if nothing has been recorded
	 */
	public WindowCacheEntry getEntry() {
		return last.get();
	}

	public long getHitCount() {
		return hits.get();
	}

	public long getMissCount() {
		return misses.get();
	}

	/**
	 * Discards the current entry
	 */
	public void clear() {
		last.set(null);
	}
}
