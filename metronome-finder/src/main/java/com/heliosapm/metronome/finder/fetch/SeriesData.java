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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <p>Title: SeriesData</p>
 * <p>Description: Immutable, ordered sample lists keyed by metric path. A null sample means Metronome had no value.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.SeriesData</code></p>
 */

public class SeriesData {
	/** Empty series data */
	public static final SeriesData EMPTY = new SeriesData(Collections.<String, List<Double>>emptyMap());

	private final Map<String, List<Double>> series;

	private SeriesData(final Map<String, List<Double>> series) {
		this.series = series;
	}

	/**
	 * Creates a new SeriesData, copying the passed map and lists
	 * @param series The sample lists keyed by path
	 * @return the series data
	 */
	public static SeriesData of(final Map<String, List<Double>> series) {
		final Map<String, List<Double>> copy = new LinkedHashMap<String, List<Double>>(series.size());
		for(Map.Entry<String, List<Double>> entry: series.entrySet()) {
			copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<Double>(entry.getValue())));
		}
		return new SeriesData(Collections.unmodifiableMap(copy));
	}

	/**
	 * Returns the samples for the passed path
	 * @param path The metric path
	 * @return the samples, or an empty list if there are none
	 */
	public List<Double> get(final String path) {
		final List<Double> values = series.get(path);
		return values==null ? Collections.<Double>emptyList() : values;
	}

	public boolean contains(final String path) {
		return series.containsKey(path);
	}

	public Set<String> paths() {
		return series.keySet();
	}

	public Map<String, List<Double>> asMap() {
		return series;
	}

	public int size() {
		return series.size();
	}

	/**
	 * Returns a copy with the first <b><code>count</code></b> samples of every series dropped
	 * @param count The number of leading samples to drop
	 * @return the trimmed series data
	 */
	public SeriesData dropLeading(final int count) {
		final Map<String, List<Double>> trimmed = new LinkedHashMap<String, List<Double>>(series.size());
		for(Map.Entry<String, List<Double>> entry: series.entrySet()) {
			final List<Double> values = entry.getValue();
			trimmed.put(entry.getKey(), values.subList(Math.min(count, values.size()), values.size()));
		}
		return of(trimmed);
	}

	@Override
	public String toString() {
		return "SeriesData " + series;
	}
}
