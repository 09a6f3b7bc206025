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
package com.heliosapm.metronome.json;

/**
 * <p>Title: BackendProtocolException</p>
 * <p>Description: Runtime exception thrown when a Metronome response cannot be unwrapped, repaired or parsed.
 * The offending response text is retained for diagnostics.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.json.BackendProtocolException</code></p>
 */

public class BackendProtocolException extends RuntimeException {

	/**  */
	private static final long serialVersionUID = -2361853127660128347L;

	/** The raw response text that failed to parse */
	private final String rawText;

	/**
	 * Creates a new BackendProtocolException
	 * @param message The exception message
	 * @param rawText The raw response text that failed to parse
	 */
	public BackendProtocolException(final String message, final String rawText) {
		super(message);
		this.rawText = rawText;
	}

	/**
	 * Creates a new BackendProtocolException
	 * @param message The exception message
	 * @param rawText The raw response text that failed to parse
	 * @param cause The underlying exception cause
	 */
	public BackendProtocolException(final String message, final String rawText, final Throwable cause) {
		super(message, cause);
		this.rawText = rawText;
	}

	/**
	 * Returns the raw response text that failed to parse
	 * @return the raw response text, possibly null
	 */
	public String getRawText() {
		return rawText;
	}

}
