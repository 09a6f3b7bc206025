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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

/**
 * <p>Title: PdnsViewMapper</p>
 * <p>Description: {@link ViewMapper} for PowerDNS metrics. Regroups <b><code>pdns.&lt;server&gt;.&lt;type&gt;.&lt;metric&gt;</code></b>
 * under the server type so all recursors or all authoritative servers can be selected with one wildcard:</p>
 * <pre>
 *   pdns.foo.auth.*           -> _pdns_view.auth.foo.auth.*
 *   pdns.foo.recursor.*       -> _pdns_view.recursor.foo.recursor.*
 *   pdns.a.example.com.auth.* -> _pdns_view.auth.a--example--com.auth.*
 * </pre>
 * <p>A server name that itself contains <b><code>--</code></b> does not survive the round trip.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.views.PdnsViewMapper</code></p>
 */

public class PdnsViewMapper implements ViewMapper {
	/** Shareable instance */
	public static final PdnsViewMapper INSTANCE = new PdnsViewMapper();

	/** The alias prefix */
	public static final String VIEW_PREFIX = "_pdns_view.";
	/** The backend path prefix */
	public static final String PDNS_PREFIX = "pdns.";

	/** Matches the backend paths that get an alias */
	public static final Pattern PDNS_PATH = Pattern.compile("^pdns\\.(?<name>.+)\\.(?<type>auth|recursor)\\.(?<extra>.+?)$");

	private static final String NAME_DOT = ".";
	private static final String NAME_DASH = "--";
	private static final Splitter DOT_SPLITTER = Splitter.on('.');
	private static final Joiner DOT_JOINER = Joiner.on('.');

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.finder.views.ViewMapper#expand(java.util.List)
	 */
	@Override
	public List<String> expand(final List<String> raw) {
		final List<String> out = new ArrayList<String>(raw.size() * 2);
		for(String path: raw) {
			out.add(path);
			final Matcher m = PDNS_PATH.matcher(path);
			if(m.matches()) {
				final String type = m.group("type");
				out.add(new StringBuilder(path.length() + 32)
					.append(VIEW_PREFIX).append(type).append('.')
					.append(m.group("name").replace(NAME_DOT, NAME_DASH)).append('.')
					.append(type).append('.')
					.append(m.group("extra"))
					.toString());
			}
		}
		return out;
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.finder.views.ViewMapper#unmap(java.util.List)
	 */
	@Override
	public ViewMapping unmap(final List<String> requested) {
		final Set<String> backend = new LinkedHashSet<String>();
		final ImmutableListMultimap.Builder<String, String> renames = ImmutableListMultimap.builder();
		final ImmutableSet.Builder<String> direct = ImmutableSet.builder();
		for(String path: requested) {
			if(isView(path)) {
				final String real = unmapAlias(path);
				backend.add(real);
				renames.put(real, path);
			} else {
				backend.add(path);
				direct.add(path);
			}
		}
		return new ViewMapping(ImmutableList.copyOf(backend), renames.build(), direct.build());
	}

	/**
	 * Maps one alias back to its backend path
	 * @param alias The alias
	 * @return the backend path
	 * @throws MalformedViewPathException if the alias has fewer than five segments or an unknown server type
	 */
	public String unmapAlias(final String alias) {
		final List<String> p = DOT_SPLITTER.splitToList(alias);
		if(p.size() < 5) throw new MalformedViewPathException("View path has fewer than 5 segments: [" + alias + "]");
		final String type = p.get(1);
		if(!"auth".equals(type) && !"recursor".equals(type)) {
			throw new MalformedViewPathException("View path has unknown server type [" + type + "]: [" + alias + "]");
		}
		return PDNS_PREFIX + p.get(2).replace(NAME_DASH, NAME_DOT) + "." + type + "." + DOT_JOINER.join(p.subList(4, p.size()));
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.finder.views.ViewMapper#isView(java.lang.String)
	 */
	@Override
	public boolean isView(final String path) {
		return path.startsWith(VIEW_PREFIX);
	}
}
