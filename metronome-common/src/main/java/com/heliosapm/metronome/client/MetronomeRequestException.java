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

/**
 * <p>Title: MetronomeRequestException</p>
 * <p>Description: Runtime exception thrown when a request to Metronome fails in transport, times out
 * or returns a non 200 response.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.MetronomeRequestException</code></p>
 */

public class MetronomeRequestException extends RuntimeException {

	/**  */
	private static final long serialVersionUID = 4512389517734002165L;

	/** The status code used when no http response was received */
	public static final int NO_STATUS = -1;

	/** The http status code of the response, or {@link #NO_STATUS} */
	private final int statusCode;

	/**
	 * Creates a new MetronomeRequestException for a non 200 response
	 * @param message The exception message
	 * @param statusCode The http status code of the response
	 */
	public MetronomeRequestException(final String message, final int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	/**
	 * Creates a new MetronomeRequestException for a transport failure
	 * @param message The exception message
	 * @param cause The underlying exception cause
	 */
	public MetronomeRequestException(final String message, final Throwable cause) {
		super(message, cause);
		this.statusCode = NO_STATUS;
	}

	/**
	 * Returns the http status code of the failed response
	 * @return the http status code, or {@link #NO_STATUS} if no response was received
	 */
	public int getStatusCode() {
		return statusCode;
	}

}
