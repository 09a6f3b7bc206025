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
 * <p>Title: LeafNode</p>
 * <p>Description: A node with data, read through its {@link Reader}</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.node.LeafNode</code></p>
 */

public class LeafNode extends Node {
	protected final Reader reader;

	/**
	 * Creates a new LeafNode
	 * @param path The full dotted path
	 * @param reader The reader of this node's data
	 */
	public LeafNode(final String path, final Reader reader) {
		super(path);
		if(reader==null) throw new IllegalArgumentException("The passed reader was null");
		this.reader = reader;
	}

	public Reader getReader() {
		return reader;
	}

	@Override
	public boolean isLeaf() {
		return true;
	}
}
