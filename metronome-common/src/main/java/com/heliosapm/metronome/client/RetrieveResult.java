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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * <p>Title: RetrieveResult</p>
 * <p>Description: Represents the results of one <b><code>do=retrieve</code></b> call to Metronome.
 * Metronome always returns both the raw series and the time derivative series of every requested path.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.RetrieveResult</code></p>
 */
@JsonDeserialize(using=RetrieveResultDeserializer.class)

public class RetrieveResult {
	/** The raw series keyed by metric path */
	protected final Map<String, Series> raw;
	/** The derivative series keyed by metric path */
	protected final Map<String, Series> derivative;

	/** An empty result */
	public static final RetrieveResult EMPTY = new RetrieveResult(Collections.<String, Series>emptyMap(), Collections.<String, Series>emptyMap());

	/**
	 * Creates a new RetrieveResult
	 * @param raw The raw series keyed by metric path
	 * @param derivative The derivative series keyed by metric path
	 */
	public RetrieveResult(final Map<String, Series> raw, final Map<String, Series> derivative) {
		if(raw==null) throw new IllegalArgumentException("The passed raw section was null");
		if(derivative==null) throw new IllegalArgumentException("The passed derivative section was null");
		this.raw = Collections.unmodifiableMap(new LinkedHashMap<String, Series>(raw));
		this.derivative = Collections.unmodifiableMap(new LinkedHashMap<String, Series>(derivative));
	}

	/**
	 * Returns the raw series
	 * @return the raw series keyed by metric path
	 */
	public Map<String, Series> raw() {
		return raw;
	}

	/**
	 * Returns the derivative series
	 * @return the derivative series keyed by metric path
	 */
	public Map<String, Series> derivative() {
		return derivative;
	}

	/**
	 * {@inheritDoc}
	 * @see java.lang.Object#toString()
	 */
	@Override
	public String toString() {
		return "RetrieveResult [raw=" + raw.keySet() + ", derivative=" + derivative.keySet() + "]";
	}
}
