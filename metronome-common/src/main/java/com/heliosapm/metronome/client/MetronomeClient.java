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

import java.io.Closeable;
import java.util.List;

import com.heliosapm.metronome.json.BackendProtocolException;

/**
 * <p>Title: MetronomeClient</p>
 * <p>Description: Defines the calls made against the Metronome HTTP service</p>
 * <p>Both calls throw a {@link MetronomeRequestException} when the request cannot be completed or returns a non 200 status,
 * and a {@link BackendProtocolException} when the response body cannot be repaired and parsed.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.MetronomeClient</code></p>
 */

public interface MetronomeClient extends Closeable {

	/**
	 * Retrieves the list of all known metric paths (<b><code>do=get-metrics</code></b>)
	 * @return the list of raw metric paths
	 */
	public List<String> getMetrics();

	/**
	 * Retrieves the raw and derivative series for the passed base paths (<b><code>do=retrieve</code></b>)
	 * @param basePaths The de-duplicated metric paths, with no derivative suffix
	 * @param begin The start time in seconds
	 * @param end The end time in seconds
	 * @param points The number of data points to request
	 * @param timeoutMs The request timeout in ms.
	 * @return the retrieve result
	 */
	public RetrieveResult retrieve(List<String> basePaths, long begin, long end, int points, long timeoutMs);

	/**
	 * Closes this client, releasing any held resources
	 * @see java.io.Closeable#close()
	 */
	@Override
	public void close();
}
