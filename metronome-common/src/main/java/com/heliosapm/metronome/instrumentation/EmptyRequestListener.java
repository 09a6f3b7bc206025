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
 * <p>Title: EmptyRequestListener</p>
 * <p>Description: An empty {@link RequestListener} useful for extending, and the default when no instrumentation is wanted</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.instrumentation.EmptyRequestListener</code></p>
 */

public class EmptyRequestListener implements RequestListener {
	/** Shareable instance */
	public static final EmptyRequestListener INSTANCE = new EmptyRequestListener();

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.instrumentation.RequestListener#onRequestStart(com.heliosapm.metronome.instrumentation.RequestType, java.lang.String)
	 */
	@Override
	public void onRequestStart(final RequestType type, final String description) {
		/* No Op */
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.instrumentation.RequestListener#onRequestComplete(com.heliosapm.metronome.instrumentation.RequestType, java.lang.String, long)
	 */
	@Override
	public void onRequestComplete(final RequestType type, final String description, final long elapsedNanos) {
		/* No Op */
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.instrumentation.RequestListener#onRequestError(com.heliosapm.metronome.instrumentation.RequestType, java.lang.String, java.lang.Throwable)
	 */
	@Override
	public void onRequestError(final RequestType type, final String description, final Throwable cause) {
		/* No Op */
	}

}
