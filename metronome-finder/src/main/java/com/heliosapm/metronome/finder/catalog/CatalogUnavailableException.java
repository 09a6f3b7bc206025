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
package com.heliosapm.metronome.finder.catalog;

/**
 * <p>Title: CatalogUnavailableException</p>
 * <p>Description: Thrown when the metric catalog cannot be loaded and there is no previous catalog to serve</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.catalog.CatalogUnavailableException</code></p>
 */

public class CatalogUnavailableException extends RuntimeException {

	/**  */
	private static final long serialVersionUID = -5034457812391128874L;

	/**
	 * Creates a new CatalogUnavailableException
	 */
	public CatalogUnavailableException() {
		super();
	}

	/**
	 * Creates a new CatalogUnavailableException
	 * @param message The exception message
	 */
	public CatalogUnavailableException(final String message) {
		super(message);
	}

	/**
	 * Creates a new CatalogUnavailableException
	 * @param cause The underlying cause
	 */
	public CatalogUnavailableException(final Throwable cause) {
		super(cause);
	}

	/**
	 * Creates a new CatalogUnavailableException
	 * @param message The exception message
	 * @param cause The underlying cause
	 */
	public CatalogUnavailableException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
