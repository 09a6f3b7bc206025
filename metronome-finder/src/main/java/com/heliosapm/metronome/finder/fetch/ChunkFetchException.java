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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * <p>Title: ChunkFetchException</p>
 * <p>Description: Describes the failure of one request chunk of a fetch. Returned as a warning with the
 * fetch results, the chunk's paths having empty series.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.ChunkFetchException</code></p>
 */

public class ChunkFetchException extends RuntimeException {

	/**  */
	private static final long serialVersionUID = 3372100584422135930L;

	/** The paths of the failed chunk */
	private final ImmutableList<String> paths;

	/**
	 * Creates a new ChunkFetchException
	 * @param message The exception message
	 * @param paths The paths of the failed chunk
	 * @param cause The underlying cause
	 */
	public ChunkFetchException(final String message, final List<String> paths, final Throwable cause) {
		super(message, cause);
		this.paths = ImmutableList.copyOf(paths);
	}

	/**
	 * Returns the paths of the failed chunk
	 * @return the paths of the failed chunk
	 */
	public ImmutableList<String> getPaths() {
		return paths;
	}
}
