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
package com.heliosapm.metronome.finder.catalog;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableSet;
import com.heliosapm.metronome.client.MetronomeClient;
import com.heliosapm.metronome.client.MetronomeRequestException;
import com.heliosapm.metronome.finder.views.DerivativePaths;
import com.heliosapm.metronome.finder.views.ViewMapper;
import com.heliosapm.metronome.instrumentation.RequestListener;
import com.heliosapm.metronome.instrumentation.RequestType;
import com.heliosapm.metronome.json.BackendProtocolException;

/**
 * <p>Title: MetricCatalog</p>
 * <p>Description: The expiring cache of every known metric path, including the view aliases and the derivative
 * siblings of each backend path.</p>
 * <p>Reads of an unexpired catalog do not lock. Once expired, one caller reloads it from Metronome
 * while any concurrent callers wait on that same reload. If a reload fails the previous catalog is served
 * unchanged, and the next caller tries again. With no previous catalog a {@link CatalogUnavailableException} is thrown.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.catalog.MetricCatalog</code></p>
 */

public class MetricCatalog {
	private static final Logger log = LogManager.getLogger(MetricCatalog.class);

	private static final String REFRESH_DESC = "get-metrics";

	protected final MetronomeClient client;
	protected final ViewMapper viewMapper;
	protected final RequestListener listener;
	protected final Clock clock;
	protected final long expiryMs;

	/** The current catalog, null until the first load */
	protected volatile Snapshot snapshot = null;
	/** The reload in progress, guarded by {@link #lock} */
	protected CompletableFuture<Snapshot> inflight = null;
	protected final Object lock = new Object();

	protected final AtomicLong refreshCount = new AtomicLong();
	protected final AtomicLong refreshFailureCount = new AtomicLong();

	/**
	 * <p>Title: Snapshot</p>
	 * <p>Description: One loaded catalog and the time it was loaded</p>
	 */
	protected static class Snapshot {
		final ImmutableSet<String> paths;
		final long loadedAt;

		Snapshot(final ImmutableSet<String> paths, final long loadedAt) {
			this.paths = paths;
			this.loadedAt = loadedAt;
		}
	}

	/**
	 * Creates a new MetricCatalog
	 * @param client The Metronome client
	 * @param viewMapper The view mapper used to add aliases
	 * @param listener The request listener notified of reloads
	 * @param clock The clock used to expire the catalog
	 * @param expirySecs The catalog expiry in seconds
	 */
	public MetricCatalog(final MetronomeClient client, final ViewMapper viewMapper, final RequestListener listener, final Clock clock, final long expirySecs) {
		if(client==null) throw new IllegalArgumentException("The passed client was null");
		if(viewMapper==null) throw new IllegalArgumentException("The passed view mapper was null");
		if(listener==null) throw new IllegalArgumentException("The passed listener was null");
		if(clock==null) throw new IllegalArgumentException("The passed clock was null");
		if(expirySecs < 0) throw new IllegalArgumentException("The passed expiry was negative: " + expirySecs);
		this.client = client;
		this.viewMapper = viewMapper;
		this.listener = listener;
		this.clock = clock;
		this.expiryMs = TimeUnit.SECONDS.toMillis(expirySecs);
	}

	/**
	 * Returns every known metric path in catalog order, reloading first if the catalog has expired
	 * @return the metric paths
	 * @throws CatalogUnavailableException if the catalog could not be loaded and there is no previous catalog
	 */
	public ImmutableSet<String> getPaths() {
		final Snapshot s = snapshot;
		if(s!=null && isFresh(s)) return s.paths;
		return refresh().paths;
	}

	/**
	 * Determines if the passed path is in the catalog
	 * @param path The path to test
	 * @return true if the path is known
	 */
	public boolean contains(final String path) {
		return getPaths().contains(path);
	}

	protected boolean isFresh(final Snapshot s) {
		return clock.millis() < s.loadedAt + expiryMs;
	}

	protected Snapshot refresh() {
		final CompletableFuture<Snapshot> f;
		boolean owner = false;
		synchronized(lock) {
			final Snapshot s = snapshot;
			if(s!=null && isFresh(s)) return s;
			if(inflight==null) {
				inflight = new CompletableFuture<Snapshot>();
				owner = true;
			}
			f = inflight;
		}
		if(owner) {
			try {
				load(f);
			} finally {
				synchronized(lock) {
					inflight = null;
				}
			}
		}
		try {
			return f.join();
		} catch (CompletionException cex) {
			if(cex.getCause() instanceof CatalogUnavailableException) throw (CatalogUnavailableException)cex.getCause();
			throw new CatalogUnavailableException("Catalog reload failed", cex.getCause());
		}
	}

	/**
	 * Loads the catalog from Metronome and completes the passed future with the outcome
	 * @param f The future waited on by concurrent callers
	 */
	protected void load(final CompletableFuture<Snapshot> f) {
		final long startNanos = System.nanoTime();
		listener.onRequestStart(RequestType.CATALOG_REFRESH, REFRESH_DESC);
		try {
			final List<String> raw = client.getMetrics();
			final ImmutableSet<String> paths = ImmutableSet.copyOf(DerivativePaths.withDerivatives(viewMapper.expand(raw)));
			final Snapshot loaded = new Snapshot(paths, clock.millis());
			snapshot = loaded;
			refreshCount.incrementAndGet();
			listener.onRequestComplete(RequestType.CATALOG_REFRESH, REFRESH_DESC, System.nanoTime() - startNanos);
			log.info("Loaded {} metric paths ({} catalog entries)", raw.size(), paths.size());
			f.complete(loaded);
		} catch (MetronomeRequestException | BackendProtocolException ex) {
			refreshFailureCount.incrementAndGet();
			listener.onRequestError(RequestType.CATALOG_REFRESH, REFRESH_DESC, ex);
			final Snapshot stale = snapshot;
			if(stale!=null) {
				log.warn("Catalog reload failed, serving {} stale paths: {}", stale.paths.size(), ex.toString());
				f.complete(stale);
			} else {
				log.error("Catalog reload failed and no catalog is loaded", ex);
				f.completeExceptionally(new CatalogUnavailableException("Metric catalog unavailable", ex));
			}
		} catch (RuntimeException rex) {
			refreshFailureCount.incrementAndGet();
			listener.onRequestError(RequestType.CATALOG_REFRESH, REFRESH_DESC, rex);
			f.completeExceptionally(rex);
			throw rex;
		}
	}

	/**
	 * Returns the number of successful reloads
	 * @return the number of successful reloads
	 */
	public long getRefreshCount() {
		return refreshCount.get();
	}

	/**
	 * Returns the number of failed reloads
	 * @return the number of failed reloads
	 */
	public long getRefreshFailureCount() {
		return refreshFailureCount.get();
	}

	/**
	 * Returns the time the current catalog was loaded
	 * @return the load time in ms, or -1 if no catalog is loaded
	 */
	public long getLoadedAt() {
		final Snapshot s = snapshot;
		return s==null ? -1L : s.loadedAt;
	}

	/**
	 * Returns the catalog expiry in ms.
	 * @return the catalog expiry in ms.
	 */
	public long getExpiryMs() {
		return expiryMs;
	}
}
