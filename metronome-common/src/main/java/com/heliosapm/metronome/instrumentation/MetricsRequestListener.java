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
package com.heliosapm.metronome.instrumentation;

import java.util.EnumMap;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * <p>Title: MetricsRequestListener</p>
 * <p>Description: {@link RequestListener} that records a timer, an error meter and an in-flight counter
 * per {@link RequestType} in a metric registry, named <b><code>metronome.&lt;type&gt;.(time|errors|inflight)</code></b>.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.instrumentation.MetricsRequestListener</code></p>
 */

public class MetricsRequestListener implements RequestListener {
	private static final Logger log = LogManager.getLogger(MetricsRequestListener.class);

	/** The metric name prefix */
	public static final String PREFIX = "metronome";

	protected final MetricRegistry registry;
	protected final EnumMap<RequestType, Timer> timers = new EnumMap<RequestType, Timer>(RequestType.class);
	protected final EnumMap<RequestType, Meter> errors = new EnumMap<RequestType, Meter>(RequestType.class);
	protected final EnumMap<RequestType, Counter> inflight = new EnumMap<RequestType, Counter>(RequestType.class);

	/**
	 * Creates a new MetricsRequestListener
	 * @param registry The registry to register the metrics in
	 */
	public MetricsRequestListener(final MetricRegistry registry) {
		if(registry==null) throw new IllegalArgumentException("The passed registry was null");
		this.registry = registry;
		for(RequestType type: RequestType.values()) {
			timers.put(type, registry.timer(MetricRegistry.name(PREFIX, type.metricName, "time")));
			errors.put(type, registry.meter(MetricRegistry.name(PREFIX, type.metricName, "errors")));
			inflight.put(type, registry.counter(MetricRegistry.name(PREFIX, type.metricName, "inflight")));
		}
	}

	/**
	 * Creates a new MetricsRequestListener with its own registry
	 */
	public MetricsRequestListener() {
		this(new MetricRegistry());
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.instrumentation.RequestListener#onRequestStart(com.heliosapm.metronome.instrumentation.RequestType, java.lang.String)
	 */
	@Override
	public void onRequestStart(final RequestType type, final String description) {
		inflight.get(type).inc();
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.instrumentation.RequestListener#onRequestComplete(com.heliosapm.metronome.instrumentation.RequestType, java.lang.String, long)
	 */
	@Override
	public void onRequestComplete(final RequestType type, final String description, final long elapsedNanos) {
		inflight.get(type).dec();
		timers.get(type).update(elapsedNanos, TimeUnit.NANOSECONDS);
		if(log.isDebugEnabled()) {
			log.debug("{} [{}] completed in {} ms.", type, description, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
		}
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.instrumentation.RequestListener#onRequestError(com.heliosapm.metronome.instrumentation.RequestType, java.lang.String, java.lang.Throwable)
	 */
	@Override
	public void onRequestError(final RequestType type, final String description, final Throwable cause) {
		inflight.get(type).dec();
		errors.get(type).mark();
		log.debug("{} [{}] failed: {}", type, description, String.valueOf(cause));
	}

	/**
	 * Returns the timer for the passed request type
	 * @param type The request type
	 * @return the timer
	 */
	public Timer getTimer(final RequestType type) {
		return timers.get(type);
	}

	/**
	 * Returns the error meter for the passed request type
	 * @param type The request type
	 * @return the error meter
	 */
	public Meter getErrors(final RequestType type) {
		return errors.get(type);
	}

	/**
	 * Returns the in-flight counter for the passed request type
	 * @param type The request type
	 * @return the in-flight counter
	 */
	public Counter getInflight(final RequestType type) {
		return inflight.get(type);
	}

	/**
	 * Returns the registry the metrics are registered in
	 * @return the metric registry
	 */
	public MetricRegistry getRegistry() {
		return registry;
	}
}
