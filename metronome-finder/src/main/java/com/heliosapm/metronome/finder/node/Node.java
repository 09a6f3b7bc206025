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
package com.heliosapm.metronome.finder.node;

/**
 * <p>Title: Node</p>
 * <p>Description: A metric tree node found by a query</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.node.Node</code></p>
 */

public abstract class Node {
	/** The full dotted path */
	protected final String path;
	/** The last segment of the path */
	protected final String name;

	/**
	 * Creates a new Node
	 * @param path The full dotted path
	 */
	protected Node(final String path) {
		if(path==null || path.isEmpty()) throw new IllegalArgumentException("The passed path was null or empty");
		this.path = path;
		this.name = path.substring(path.lastIndexOf('.') + 1);
	}

	public String getPath() {
		return path;
	}

	public String getName() {
		return name;
	}

	/**
	 * Indicates if this node has data
	 * @return true for a leaf, false for a branch
	 */
	public abstract boolean isLeaf();

	@Override
	public int hashCode() {
		return 31 * path.hashCode() + (isLeaf() ? 1 : 0);
	}

	@Override
	public boolean equals(final Object obj) {
		if(this==obj) return true;
		if(obj==null || obj.getClass()!=getClass()) return false;
		return path.equals(((Node)obj).path);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " [" + path + "]";
	}
}
