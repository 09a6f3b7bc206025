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

import java.util.Collections;

import com.heliosapm.metronome.finder.fetch.FetchResult;
import com.heliosapm.metronome.finder.node.ReadResult;
import com.heliosapm.metronome.finder.node.Reader;
import com.heliosapm.metronome.finder.node.TimeBounds;

/**
 * <p>Title: MetronomeReader</p>
 * <p>Description: {@link Reader} fetching one path through its finder</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.MetronomeReader</code></p>
 */

public class MetronomeReader implements Reader {
	protected final String path;
	protected final MetronomeFinder finder;

	/**
	 * Creates a new MetronomeReader
	 * @param path The metric path
	 * @param finder The finder to fetch through
	 */
	public MetronomeReader(final String path, final MetronomeFinder finder) {
		this.path = path;
		this.finder = finder;
	}

	@Override
	public ReadResult fetch(final long start, final long end) {
		final FetchResult fr = finder.fetch(Collections.singletonList(path), start, end);
		return new ReadResult(fr.getWindow(), fr.getData().get(path));
	}

	@Override
	public TimeBounds getIntervals() {
		return finder.getTimeBounds(path);
	}

	public String getPath() {
		return path;
	}

	@Override
	public String toString() {
		return "MetronomeReader [" + path + "]";
	}
}
