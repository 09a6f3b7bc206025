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
package com.heliosapm.metronome.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>Title: Series</p>
 * <p>Description: One series of <b><code>[timestamp, value]</code></b> pairs as returned by Metronome for one metric path.
 * Values may be null where the backend had no data for the slot.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.Series</code></p>
 */

public class Series {
	/** The timestamps in seconds */
	protected final long[] timestamps;
	/** The values, in timestamp order */
	protected final List<Double> values;

	/** An empty series */
	public static final Series EMPTY = new Series(new long[0], Collections.<Double>emptyList());

	/**
	 * Creates a new Series
	 * @param timestamps The timestamps in seconds
	 * @param values The values, one per timestamp
	 */
	public Series(final long[] timestamps, final List<Double> values) {
		if(timestamps==null) throw new IllegalArgumentException("The passed timestamps were null");
		if(values==null) throw new IllegalArgumentException("The passed values were null");
		if(timestamps.length!=values.size()) throw new IllegalArgumentException("Timestamp count [" + timestamps.length + "] does not match value count [" + values.size() + "]");
		this.timestamps = timestamps.clone();
		this.values = Collections.unmodifiableList(new ArrayList<Double>(values));
	}

	/**
	 * Returns a copy of the timestamps
	 * @return the timestamps in seconds
	 */
	public long[] timestamps() {
		return timestamps.clone();
	}

	/**
	 * Returns the values with the timestamps stripped
	 * @return an unmodifiable list of values, possibly containing nulls
	 */
	public List<Double> values() {
		return values;
	}

	/**
	 * Returns the number of data points
	 * @return the number of data points
	 */
	public int size() {
		return timestamps.length;
	}

	/**
	 * {@inheritDoc}
	 * @see java.lang.Object#toString()
	 */
	@Override
	public String toString() {
		return "Series [size=" + timestamps.length + "]";
	}
}
