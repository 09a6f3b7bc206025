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
 * <p>Title: RequestListener</p>
 * <p>Description: Defines a listener notified of the start, completion and failure of requests made by the finder</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.instrumentation.RequestListener</code></p>
 */

public interface RequestListener {
	/**
	 * Called when a request starts
	 * @param type The request type
	 * @param description A short description of the request
	 */
	public void onRequestStart(RequestType type, String description);

	/**
	 * Called when a request completes
	 * @param type The request type
	 * @param description A short description of the request
	 * @param elapsedNanos The elapsed time of the request in nanos
	 */
	public void onRequestComplete(RequestType type, String description, long elapsedNanos);

	/**
	 * Called when a request fails
	 * @param type The request type
	 * @param description A short description of the request
	 * @param cause The failure cause
	 */
	public void onRequestError(RequestType type, String description, Throwable cause);
}
