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
package com.heliosapm.metronome.finder.fetch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Joiner;
import com.heliosapm.metronome.client.MetronomeClient;
import com.heliosapm.metronome.client.MetronomeRequestException;
import com.heliosapm.metronome.client.RetrieveResult;
import com.heliosapm.metronome.client.Series;
import com.heliosapm.metronome.finder.cache.CachedSeries;
import com.heliosapm.metronome.finder.cache.WindowCache;
import com.heliosapm.metronome.finder.views.DerivativePaths;
import com.heliosapm.metronome.finder.views.ViewMapper;
import com.heliosapm.metronome.finder.views.ViewMapping;
import com.heliosapm.metronome.instrumentation.RequestListener;
import com.heliosapm.metronome.instrumentation.RequestType;

/**
 * <p>Title: ChunkedFetcher</p>
 * <p>Description: Fetches the series of a set of requested paths, splitting the backend paths into chunks that fit
 * a request url and retrieving the chunks in parallel on a shared executor.</p>
 * <p>Every network fetch asks for <b><code>additionalPoints</code></b> extra samples ahead of the window and records the
 * untrimmed result in the {@link WindowCache}. A failed or timed out chunk leaves its paths empty and is reported
 * in {@link FetchResult#getWarnings()}. Any other failure of a chunk, such as an unparseable response, fails the fetch.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.ChunkedFetcher</code></p>
 */

public class ChunkedFetcher {
	private static final Logger log = LogManager.getLogger(ChunkedFetcher.class);

	/** The number of paths named in a fetch summary */
	public static final int SUMMARY_PATHS = 3;

	private static final Joiner COMMA_JOINER = Joiner.on(',');

	protected final MetronomeClient client;
	protected final ViewMapper viewMapper;
	protected final ExecutorService executor;
	protected final WindowCache windowCache;
	protected final RequestListener listener;
	protected final int maxPoints;
	protected final int additionalPoints;
	protected final int pathBudget;
	protected final long defaultTimeoutMs;

	/**
	 * Creates a new ChunkedFetcher
	 * @param client The Metronome client
	 * @param viewMapper The view mapper used to unmap requested aliases
	 * @param executor The executor chunks are retrieved on
	 * @param windowCache The last fetch cache
	 * @param listener The request listener
	 * @param maxPoints The maximum number of points per window
	 * @param additionalPoints The number of extra samples fetched ahead of each window
	 * @param pathBudget The maximum comma joined path length of one request
	 * @param defaultTimeoutMs The fetch timeout used when none is passed
	 */
	public ChunkedFetcher(final MetronomeClient client, final ViewMapper viewMapper, final ExecutorService executor, final WindowCache windowCache,
			final RequestListener listener, final int maxPoints, final int additionalPoints, final int pathBudget, final long defaultTimeoutMs) {
		if(client==null) throw new IllegalArgumentException("The passed client was null");
		if(viewMapper==null) throw new IllegalArgumentException("The passed view mapper was null");
		if(executor==null) throw new IllegalArgumentException("The passed executor was null");
		if(windowCache==null) throw new IllegalArgumentException("The passed window cache was null");
		if(listener==null) throw new IllegalArgumentException("The passed listener was null");
		if(additionalPoints < 0) throw new IllegalArgumentException("The passed additional points was negative: " + additionalPoints);
		this.client = client;
		this.viewMapper = viewMapper;
		this.executor = executor;
		this.windowCache = windowCache;
		this.listener = listener;
		this.maxPoints = maxPoints;
		this.additionalPoints = additionalPoints;
		this.pathBudget = pathBudget;
		this.defaultTimeoutMs = defaultTimeoutMs;
	}

	/**
	 * Fetches the passed paths with the default timeout
	 * @param paths The requested paths
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @return the fetch result
	 */
	public FetchResult fetch(final List<String> paths, final long start, final long end) {
		return fetch(paths, start, end, defaultTimeoutMs);
	}

	/**
	 * Fetches the passed paths
	 * @param paths The requested paths, which may include view aliases and derivative paths
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @param timeoutMs The overall timeout in ms.
	 * @return the fetch result with a series, possibly empty, for every requested path
	 */
	public FetchResult fetch(final List<String> paths, final long start, final long end, final long timeoutMs) {
		if(paths==null) throw new IllegalArgumentException("The passed paths were null");
		if(timeoutMs < 1) throw new IllegalArgumentException("The passed timeout was less than 1: " + timeoutMs);
		final TimeWindow window = TimeWindow.forRange(start, end, maxPoints);
		if(paths.isEmpty()) return new FetchResult(window, SeriesData.EMPTY, null, false);
		final String summary = summarize(paths) + " [" + start + "," + end + ">";
		log.info("fetch: {}", summary);
		final long startNanos = System.nanoTime();
		listener.onRequestStart(RequestType.FETCH, summary);
		try {
			final FetchResult result = paths.size()==1 ? fromCache(paths.get(0), start, end) : null;
			final FetchResult fr = result!=null ? result : fetchNetwork(paths, window, timeoutMs);
			listener.onRequestComplete(RequestType.FETCH, summary, System.nanoTime() - startNanos);
			return fr;
		} catch (RuntimeException ex) {
			listener.onRequestError(RequestType.FETCH, summary, ex);
			throw ex;
		}
	}

	protected FetchResult fromCache(final String path, final long start, final long end) {
		final Optional<CachedSeries> cached = windowCache.tryServe(path, start, end);
		if(!cached.isPresent()) return null;
		final Map<String, List<Double>> data = Collections.singletonMap(path, cached.get().getValues());
		return new FetchResult(cached.get().getWindow(), SeriesData.of(data), null, true);
	}

	protected FetchResult fetchNetwork(final List<String> paths, final TimeWindow window, final long timeoutMs) {
		final long step = window.getStep();
		final int extPoints = window.getPoints() + additionalPoints;
		final long extStart = window.getStart() - additionalPoints * step;
		final long end = window.getEnd();
		final ViewMapping mapping = viewMapper.unmap(paths);
		final List<List<String>> chunks = PathChunker.chunk(mapping.getBackendPaths(), pathBudget);
		final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
		final List<Future<Map<String, List<Double>>>> futures = new ArrayList<Future<Map<String, List<Double>>>>(chunks.size());
		for(final List<String> chunk: chunks) {
			futures.add(executor.submit(new Callable<Map<String, List<Double>>>() {
				@Override
				public Map<String, List<Double>> call() throws Exception {
					return retrieveChunk(chunk, extStart, end, extPoints, deadline);
				}
			}));
		}
		final Map<String, List<Double>> backendData = new LinkedHashMap<String, List<Double>>();
		final List<ChunkFetchException> warnings = new ArrayList<ChunkFetchException>();
		for(int i = 0; i < futures.size(); i++) {
			final Future<Map<String, List<Double>>> f = futures.get(i);
			final List<String> chunk = chunks.get(i);
			try {
				backendData.putAll(f.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
			} catch (TimeoutException tex) {
				f.cancel(true);
				log.warn("Chunk of {} paths timed out after {} ms.", chunk.size(), timeoutMs);
				warnings.add(new ChunkFetchException("Chunk timed out after " + timeoutMs + " ms.", chunk, tex));
			} catch (ExecutionException eex) {
				final Throwable cause = eex.getCause();
				if(cause instanceof MetronomeRequestException) {
					log.warn("Chunk of {} paths failed: {}", chunk.size(), cause.getMessage());
					warnings.add(new ChunkFetchException("Chunk failed: " + cause.getMessage(), chunk, cause));
				} else {
					cancelAll(futures);
					if(cause instanceof RuntimeException) throw (RuntimeException)cause;
					if(cause instanceof Error) throw (Error)cause;
					throw new IllegalStateException("Chunk retrieval failed", cause);
				}
			} catch (InterruptedException iex) {
				cancelAll(futures);
				Thread.currentThread().interrupt();
				throw new MetronomeRequestException("Interrupted while waiting on fetch", iex);
			}
		}
		final Map<String, List<Double>> restored = mapping.restore(backendData);
		final Map<String, List<Double>> ordered = new LinkedHashMap<String, List<Double>>(paths.size());
		for(String path: paths) {
			final List<Double> values = restored.get(path);
			ordered.put(path, values==null ? Collections.<Double>emptyList() : values);
		}
		final SeriesData extData = SeriesData.of(ordered);
		windowCache.record(window, additionalPoints, extStart, extData);
		return new FetchResult(window, extData.dropLeading(additionalPoints), warnings, false);
	}

	/**
	 * Retrieves one chunk and extracts the requested raw and derivative series
	 * @param chunk The backend paths of the chunk, possibly with derivative suffixes
	 * @param extStart The start of the extended range
	 * @param end The end time
	 * @param extPoints The number of points of the extended range
	 * @param deadline The fetch deadline in nanos
	 * @return the samples keyed by chunk path
	 */
	protected Map<String, List<Double>> retrieveChunk(final List<String> chunk, final long extStart, final long end, final int extPoints, final long deadline) {
		final Set<String> basePaths = new LinkedHashSet<String>(chunk.size());
		for(String path: chunk) {
			basePaths.add(DerivativePaths.basePath(path));
		}
		final String desc = summarize(new ArrayList<String>(basePaths));
		final long remainingMs = Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
		log.debug("retrieve {} [n={} begin={} end={} points={}]", desc, basePaths.size(), extStart, end, extPoints);
		final long startNanos = System.nanoTime();
		listener.onRequestStart(RequestType.CHUNK_RETRIEVE, desc);
		final RetrieveResult rr;
		try {
			rr = client.retrieve(new ArrayList<String>(basePaths), extStart, end, extPoints, remainingMs);
		} catch (RuntimeException ex) {
			listener.onRequestError(RequestType.CHUNK_RETRIEVE, desc, ex);
			throw ex;
		}
		listener.onRequestComplete(RequestType.CHUNK_RETRIEVE, desc, System.nanoTime() - startNanos);
		final Map<String, List<Double>> data = new LinkedHashMap<String, List<Double>>(chunk.size());
		for(String path: chunk) {
			final Series series = DerivativePaths.isDerivative(path)
					? rr.derivative().get(DerivativePaths.basePath(path))
					: rr.raw().get(path);
			if(series!=null) data.put(path, series.values());
		}
		return data;
	}

	private static void cancelAll(final List<? extends Future<?>> futures) {
		for(Future<?> f: futures) {
			f.cancel(true);
		}
	}

	/**
	 * Summarizes a path list for logging as the first few paths and the count of the rest
	 * @param paths The paths
	 * @return the summary
	 */
	public static String summarize(final List<String> paths) {
		if(paths.size() <= SUMMARY_PATHS) return COMMA_JOINER.join(paths);
		return COMMA_JOINER.join(paths.subList(0, SUMMARY_PATHS)) + "...+" + (paths.size() - SUMMARY_PATHS);
	}

	public WindowCache getWindowCache() {
		return windowCache;
	}

	public int getAdditionalPoints() {
		return additionalPoints;
	}
}
