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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <p>Title: PathMatcher</p>
 * <p>Description: A compiled metric path query pattern such as <b><code>pdns.*.{auth,recursor}.latency</code></b>.</p>
 * <p>A <b><code>*</code></b> matches any run of characters within one path segment and
 * <b><code>{a,b}</code></b> matches any one of the listed alternatives. Every other character is literal.
 * A candidate spanning the whole pattern is a leaf match. A candidate whose prefix spans the pattern
 * and is followed by further segments is a branch match on that prefix.</p>
 * <p>Instances are immutable and thread safe.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.match.PathMatcher</code></p>
 */

public class PathMatcher {
	/** The regex characters escaped when translating a pattern */
	public static final String ESCAPED_CHARS = ".$^+?()[]|\\";

	private static final String PATH_GROUP = "path";
	private static final String EXTRA_GROUP = "extra";

	/** The source pattern */
	private final String pattern;
	/** The compiled regex */
	private final Pattern regex;

	private PathMatcher(final String pattern, final Pattern regex) {
		this.pattern = pattern;
		this.regex = regex;
	}

	/**
	 * Compiles the passed query pattern
	 * @param pattern The query pattern
	 * @return the compiled matcher
	 * @throws InvalidPatternException if the pattern is empty or its braces are nested or unbalanced
	 */
	public static PathMatcher compile(final String pattern) {
		if(pattern==null || pattern.isEmpty()) throw new InvalidPatternException("Empty pattern", pattern);
		final StringBuilder b = new StringBuilder(pattern.length() * 2 + 32).append("(?<").append(PATH_GROUP).append('>');
		boolean inGroup = false;
		for(int i = 0; i < pattern.length(); i++) {
			final char c = pattern.charAt(i);
			switch(c) {
				case '{':
					if(inGroup) throw new InvalidPatternException("Nested brace at index " + i, pattern);
					inGroup = true;
					b.append('(');
					break;
				case '}':
					if(!inGroup) throw new InvalidPatternException("Unmatched closing brace at index " + i, pattern);
					inGroup = false;
					b.append(')');
					break;
				case ',':
					b.append(inGroup ? '|' : ',');
					break;
				case '*':
					b.append("[^.]*");
					break;
				default:
					if(ESCAPED_CHARS.indexOf(c)!=-1) b.append('\\');
					b.append(c);
			}
		}
		if(inGroup) throw new InvalidPatternException("Unclosed brace", pattern);
		b.append(")(?<").append(EXTRA_GROUP).append(">|\\..+)");
		return new PathMatcher(pattern, Pattern.compile(b.toString(), Pattern.DOTALL));
	}

	/**
	 * Determines if the passed pattern has no wildcards and can be tested by plain membership
	 * @param pattern The pattern to test
	 * @return true if the pattern contains no <b><code>*</code></b> and no <b><code>{</code></b>
	 */
	public static boolean isLiteral(final String pattern) {
		return pattern.indexOf('*')==-1 && pattern.indexOf('{')==-1;
	}

	/**
	 * Classifies the passed candidate path
	 * @param candidate The candidate metric path
	 * @return the match result
	 */
	public MatchResult match(final String candidate) {
		if(candidate==null) return MatchResult.NO_MATCH;
		final Matcher m = regex.matcher(candidate);
		if(!m.matches()) return MatchResult.NO_MATCH;
		final String path = m.group(PATH_GROUP);
		return m.group(EXTRA_GROUP).isEmpty() ? MatchResult.leaf(path) : MatchResult.branch(path);
	}

	/**
	 * Returns the source pattern
	 * @return the source pattern
	 */
	public String getPattern() {
		return pattern;
	}

	/**
	 * Returns the compiled regex
	 * @return the compiled regex
	 */
	public String getRegex() {
		return regex.pattern();
	}

	@Override
	public String toString() {
		return "PathMatcher [" + pattern + "]";
	}
}
