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
package com.heliosapm.metronome.finder;

import java.io.Closeable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.heliosapm.metronome.client.AsyncMetronomeClient;
import com.heliosapm.metronome.client.MetronomeClient;
import com.heliosapm.metronome.config.MetronomeConfig;
import com.heliosapm.metronome.finder.cache.WindowCache;
import com.heliosapm.metronome.finder.catalog.MetricCatalog;
import com.heliosapm.metronome.finder.fetch.ChunkedFetcher;
import com.heliosapm.metronome.finder.fetch.FetchResult;
import com.heliosapm.metronome.finder.match.MatchResult;
import com.heliosapm.metronome.finder.match.PathMatcher;
import com.heliosapm.metronome.finder.node.BranchNode;
import com.heliosapm.metronome.finder.node.LeafNode;
import com.heliosapm.metronome.finder.node.Node;
import com.heliosapm.metronome.finder.node.TimeBounds;
import com.heliosapm.metronome.finder.views.PdnsViewMapper;
import com.heliosapm.metronome.finder.views.ViewMapper;
import com.heliosapm.metronome.instrumentation.EmptyRequestListener;
import com.heliosapm.metronome.instrumentation.RequestListener;

/**
 * <p>Title: MetronomeFinder</p>
 * <p>Description: Finds metric nodes matching query patterns such as <b><code>pdns.*.{auth,recursor}.latency</code></b>
 * and fetches their series from Metronome.</p>
 * <p>Each finder owns its metric catalog, its window cache and a fixed pool of fetch threads, all released by {@link #close()}.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.MetronomeFinder</code></p>
 */

public class MetronomeFinder implements Closeable {
	private static final Logger log = LogManager.getLogger(MetronomeFinder.class);

	protected final MetronomeConfig config;
	protected final MetronomeClient client;
	protected final Clock clock;
	protected final ViewMapper viewMapper = PdnsViewMapper.INSTANCE;
	protected final ExecutorService fetchPool;
	protected final MetricCatalog catalog;
	protected final WindowCache windowCache = new WindowCache();
	protected final ChunkedFetcher fetcher;

	/**
	 * Creates a new MetronomeFinder with an http client and no instrumentation
	 * @param config The finder configuration
	 */
	public MetronomeFinder(final MetronomeConfig config) {
		this(config, new AsyncMetronomeClient(config), EmptyRequestListener.INSTANCE, Clock.systemUTC());
	}

	/**
	 * Creates a new MetronomeFinder
	 * @param config The finder configuration
	 * @param client The Metronome client, closed with this finder
	 * @param listener The request listener
	 * @param clock The clock used for catalog expiry and time bounds
	 */
	public MetronomeFinder(final MetronomeConfig config, final MetronomeClient client, final RequestListener listener, final Clock clock) {
		if(config==null) throw new IllegalArgumentException("The passed config was null");
		if(client==null) throw new IllegalArgumentException("The passed client was null");
		if(clock==null) throw new IllegalArgumentException("The passed clock was null");
		this.config = config;
		this.client = client;
		this.clock = clock;
		fetchPool = Executors.newFixedThreadPool(config.getFetchThreads(), new ThreadFactoryBuilder()
				.setNameFormat("MetronomeFetch#%d")
				.setDaemon(true)
				.build());
		catalog = new MetricCatalog(client, viewMapper, listener, clock, config.getCacheExpirySecs());
		fetcher = new ChunkedFetcher(client, viewMapper, fetchPool, windowCache, listener,
				config.getMaxPoints(), config.getAdditionalPoints(), config.getPathBudget(), config.getFetchTimeoutMs());
		log.info("MetronomeFinder initialized: {}", config.getUrl());
	}

	/**
	 * Finds the nodes matching the passed pattern. The pattern is compiled immediately and the catalog
	 * is read when the returned stream is consumed. Each path is returned once, in catalog order.
	 * @param pattern The query pattern
	 * @return a stream of the matching nodes
	 * @throws com.heliosapm.metronome.finder.match.InvalidPatternException if the pattern is invalid
	 */
	public Stream<Node> find(final String pattern) {
		final PathMatcher matcher = PathMatcher.compile(pattern);
		if(PathMatcher.isLiteral(pattern)) {
			return Stream.of(pattern)
				.filter(p -> catalog.contains(p))
				.map(p -> (Node)leaf(p));
		}
		log.debug("find: {}", pattern);
		final Set<String> seen = new HashSet<String>();
		return Stream.of(matcher)
			.flatMap(m -> catalog.getPaths().stream())
			.map(matcher::match)
			.filter(MatchResult::isMatch)
			.filter(r -> seen.add(r.getPath()))
			.<Node>map(r -> r.isLeaf() ? leaf(r.getPath()) : new BranchNode(r.getPath()));
	}

	protected LeafNode leaf(final String path) {
		return new LeafNode(path, new MetronomeReader(path, this));
	}

	/**
	 * Fetches the passed paths with the configured timeout
	 * @param paths The requested paths
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @return the fetch result
	 */
	public FetchResult fetch(final List<String> paths, final long start, final long end) {
		return fetcher.fetch(paths, start, end);
	}

	/**
	 * Fetches the passed paths
	 * @param paths The requested paths
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @param timeoutMs The overall timeout in ms.
	 * @return the fetch result
	 */
	public FetchResult fetch(final List<String> paths, final long start, final long end, final long timeoutMs) {
		return fetcher.fetch(paths, start, end, timeoutMs);
	}

	/**
	 * Fetches the series of the passed leaf nodes in one fetch
	 * @param nodes The nodes to fetch
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @return the fetch result keyed by node path
	 */
	public FetchResult fetchNodes(final List<LeafNode> nodes, final long start, final long end) {
		final List<String> paths = new ArrayList<String>(nodes.size());
		for(LeafNode node: nodes) {
			paths.add(node.getPath());
		}
		return fetcher.fetch(paths, start, end);
	}

	/**
	 * Returns the time range data for the passed path may exist in. Metronome does not report this,
	 * so it is always from the epoch until now.
	 * @param path The metric path
	 * @return the time bounds
	 */
	public TimeBounds getTimeBounds(final String path) {
		return new TimeBounds(0L, TimeUnit.MILLISECONDS.toSeconds(clock.millis()));
	}

	public MetricCatalog getCatalog() {
		return catalog;
	}

	public WindowCache getWindowCache() {
		return windowCache;
	}

	public MetronomeConfig getConfig() {
		return config;
	}

	/**
	 * {@inheritDoc}
	 * @see java.io.Closeable#close()
	 */
	@Override
	public void close() {
		fetchPool.shutdownNow();
		client.close();
		log.info("MetronomeFinder closed: {}", config.getUrl());
	}
}
