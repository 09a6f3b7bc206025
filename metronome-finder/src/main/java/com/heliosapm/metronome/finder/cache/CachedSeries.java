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

import java.util.List;

import com.heliosapm.metronome.finder.fetch.TimeWindow;

/**
 * <p>Title: CachedSeries</p>
 * <p>Description: One series served from the window cache</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.cache.CachedSeries</code></p>
 */

public class CachedSeries {
	private final TimeWindow window;
	private final List<Double> values;

	CachedSeries(final TimeWindow window, final List<Double> values) {
		this.window = window;
		this.values = values;
	}

	public TimeWindow getWindow() {
		return window;
	}

	public List<Double> getValues() {
		return values;
	}
}
