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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * <p>Title: FetchResult</p>
 * <p>Description: The outcome of one fetch: the time window, the series keyed by requested path
 * and the failures of any chunks whose series are empty as a result.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.FetchResult</code></p>
 */

public class FetchResult {
	private final TimeWindow window;
	private final SeriesData data;
	private final List<ChunkFetchException> warnings;
	private final boolean fromCache;

	/**
	 * Creates a new FetchResult
	 * @param window The time window
	 * @param data The series keyed by requested path
	 * @param warnings The chunk failures
	 * @param fromCache true if served from the window cache
	 */
	public FetchResult(final TimeWindow window, final SeriesData data, final List<ChunkFetchException> warnings, final boolean fromCache) {
		this.window = window;
		this.data = data;
		this.warnings = warnings==null ? Collections.<ChunkFetchException>emptyList() : ImmutableList.copyOf(warnings);
		this.fromCache = fromCache;
	}

	public TimeWindow getWindow() {
		return window;
	}

	public SeriesData getData() {
		return data;
	}

	public List<ChunkFetchException> getWarnings() {
		return warnings;
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}

	public boolean isFromCache() {
		return fromCache;
	}

	@Override
	public String toString() {
		return "FetchResult [window=" + window + ", paths=" + data.size() + ", warnings=" + warnings.size() + ", fromCache=" + fromCache + "]";
	}
}
