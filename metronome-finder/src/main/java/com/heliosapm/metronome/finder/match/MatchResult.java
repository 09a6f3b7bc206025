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
 * <p>Title: MatchResult</p>
 * <p>Description: The classification of one candidate path against a compiled pattern</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.match.MatchResult</code></p>
 */

public class MatchResult {

	/**
	 * <p>Title: MatchType</p>
	 * <p>Description: Enumerates the match outcomes</p>
	 */
	public static enum MatchType {
		/** The candidate did not match */
		NONE,
		/** The candidate matched the whole pattern */
		LEAF,
		/** A prefix of the candidate matched the whole pattern */
		BRANCH;
	}

	/** The shared no-match result */
	public static final MatchResult NO_MATCH = new MatchResult(MatchType.NONE, null);

	private final MatchType type;
	private final String path;

	private MatchResult(final MatchType type, final String path) {
		this.type = type;
		this.path = path;
	}

	/**
	 * Creates a leaf match
	 * @param path The matched path
	 * @return the match result
	 */
	public static MatchResult leaf(final String path) {
		return new MatchResult(MatchType.LEAF, path);
	}

	/**
	 * Creates a branch match
	 * @param path The matched prefix, with the remainder stripped
	 * @return the match result
	 */
	public static MatchResult branch(final String path) {
		return new MatchResult(MatchType.BRANCH, path);
	}

	public MatchType getType() {
		return type;
	}

	/**
	 * Returns the matched path
	 * @return the matched path, or null for {@link MatchType#NONE}
	 */
	public String getPath() {
		return path;
	}

	public boolean isMatch() {
		return type!=MatchType.NONE;
	}

	public boolean isLeaf() {
		return type==MatchType.LEAF;
	}

	public boolean isBranch() {
		return type==MatchType.BRANCH;
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + (path==null ? 0 : path.hashCode());
	}

	@Override
	public boolean equals(final Object obj) {
		if(this==obj) return true;
		if(!(obj instanceof MatchResult)) return false;
		final MatchResult other = (MatchResult)obj;
		return type==other.type && (path==null ? other.path==null : path.equals(other.path));
	}

	@Override
	public String toString() {
		return type==MatchType.NONE ? "NONE" : type + "(" + path + ")";
	}
}
