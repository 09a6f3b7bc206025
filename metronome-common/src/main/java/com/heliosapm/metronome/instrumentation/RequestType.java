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

/**
 * <p>Title: RequestType</p>
 * <p>Description: Enumerates the instrumented request kinds</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.instrumentation.RequestType</code></p>
 */

public enum RequestType {
	/** A reload of the metric catalog */
	CATALOG_REFRESH("catalog.refresh"),
	/** One complete, possibly chunked, fetch */
	FETCH("fetch"),
	/** One chunk of a fetch sent to Metronome */
	CHUNK_RETRIEVE("chunk.retrieve");

	private RequestType(final String metricName) {
		this.metricName = metricName;
	}

	/** The metric name segment for this type */
	public final String metricName;
}
