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

import com.heliosapm.metronome.finder.fetch.SeriesData;
import com.heliosapm.metronome.finder.fetch.TimeWindow;

/**
 * <p>Title: WindowCacheEntry</p>
 * <p>Description: The extended range data of the last network fetch</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.cache.WindowCacheEntry</code></p>
 */

public class WindowCacheEntry {
	/** The window the caller asked for */
	final TimeWindow window;
	/** The number of extra samples fetched ahead of the window */
	final int additionalPoints;
	/** The start of the extended range */
	final long extendedStart;
	/** The untrimmed series keyed by requested path */
	final SeriesData data;

	WindowCacheEntry(final TimeWindow window, final int additionalPoints, final long extendedStart, final SeriesData data) {
		this.window = window;
		this.additionalPoints = additionalPoints;
		this.extendedStart = extendedStart;
		this.data = data;
	}

	public TimeWindow getWindow() {
		return window;
	}

	public int getAdditionalPoints() {
		return additionalPoints;
	}

	public long getExtendedStart() {
		return extendedStart;
	}

	public SeriesData getData() {
		return data;
	}

	@Override
	public String toString() {
		return "WindowCacheEntry [window=" + window + ", extendedStart=" + extendedStart + ", paths=" + data.size() + "]";
	}
}
