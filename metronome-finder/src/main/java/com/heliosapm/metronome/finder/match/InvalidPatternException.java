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
package com.heliosapm.metronome.finder.match;

/**
 * <p>Title: InvalidPatternException</p>
 * <p>Description: Thrown when a query pattern cannot be compiled</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.match.InvalidPatternException</code></p>
 */

public class InvalidPatternException extends IllegalArgumentException {

	/**  */
	private static final long serialVersionUID = -2236170385591093857L;

	/** The rejected pattern */
	private final String pattern;

	/**
	 * Creates a new InvalidPatternException
	 * @param message The exception message
	 * @param pattern The rejected pattern
	 */
	public InvalidPatternException(final String message, final String pattern) {
		super(message + ": [" + pattern + "]");
		this.pattern = pattern;
	}

	/**
	 * Creates a new InvalidPatternException
	 * @param message The exception message
	 * @param pattern The rejected pattern
	 * @param cause The underlying cause
	 */
	public InvalidPatternException(final String message, final String pattern, final Throwable cause) {
		super(message + ": [" + pattern + "]", cause);
		this.pattern = pattern;
	}

	/**
	 * Returns the rejected pattern
	 * @return the rejected pattern
	 */
	public String getPattern() {
		return pattern;
	}
}
