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
package com.heliosapm.metronome.finder.views;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

/**
 * <p>Title: ViewMapping</p>
 * <p>Description: The result of mapping requested paths to backend paths. Holds the backend paths to query
 * and the renames needed to key the results back to the requested paths.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.views.ViewMapping</code></p>
 */

public class ViewMapping {
	/** The de-duplicated backend paths in request order */
	private final ImmutableList<String> backendPaths;
	/** Backend path to the aliases it was requested through */
	private final ImmutableListMultimap<String, String> renames;
	/** The backend paths that were also requested by their own name */
	private final ImmutableSet<String> direct;

	ViewMapping(final ImmutableList<String> backendPaths, final ImmutableListMultimap<String, String> renames, final ImmutableSet<String> direct) {
		this.backendPaths = backendPaths;
		this.renames = renames;
		this.direct = direct;
	}

	public ImmutableList<String> getBackendPaths() {
		return backendPaths;
	}

	public ImmutableListMultimap<String, String> getRenames() {
		return renames;
	}

	/**
	 * Re-keys backend keyed data to the requested paths. A backend path requested both directly
	 * and through aliases is emitted under every requested key. Backend keys not in this mapping are dropped.
	 * @param data The backend keyed data
	 * @return the data keyed by requested path
	 */
	public <T> Map<String, T> restore(final Map<String, T> data) {
		final Map<String, T> out = new LinkedHashMap<String, T>(data.size() + renames.size());
		for(Map.Entry<String, T> entry: data.entrySet()) {
			final String key = entry.getKey();
			if(direct.contains(key)) out.put(key, entry.getValue());
			final List<String> aliases = renames.get(key);
			for(String alias: aliases) {
				out.put(alias, entry.getValue());
			}
		}
		return out;
	}

	/**
	 * Returns the backend paths requested by their own name
	 * @return the directly requested paths
	 */
	public Set<String> getDirect() {
		return direct;
	}

	@Override
	public String toString() {
		return "ViewMapping [backendPaths=" + backendPaths + ", renames=" + renames + "]";
	}
}
