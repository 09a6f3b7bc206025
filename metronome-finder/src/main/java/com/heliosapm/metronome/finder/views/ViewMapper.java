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

import java.util.List;

/**
 * <p>Title: ViewMapper</p>
 * <p>Description: Defines a stateless mapping between backend metric paths and synthesized view aliases</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.views.ViewMapper</code></p>
 */

public interface ViewMapper {
	/**
	 * Returns the passed paths with each alias inserted immediately after the path it was derived from
	 * @param raw The backend paths
	 * @return the backend paths and their aliases
	 */
	public List<String> expand(List<String> raw);

	/**
	 * Maps the passed requested paths, which may include aliases, back to backend paths
	 * @param requested The requested paths
	 * @return the mapping
	 * @throws MalformedViewPathException if an alias cannot be mapped
	 */
	public ViewMapping unmap(List<String> requested);

	/**
	 * Determines if the passed path is an alias
	 * @param path The path to test
	 * @return true if the path is an alias
	 */
	public boolean isView(String path);
}
