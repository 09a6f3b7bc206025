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
package com.heliosapm.metronome.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * <p>Title: MetronomeConfig</p>
 * <p>Description: The immutable finder configuration. Each value is resolved through
 * {@link ConfigurationHelper} so system properties and environment variables override the loaded properties.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.config.MetronomeConfig</code></p>
 */

public class MetronomeConfig {
	private static final Logger log = LogManager.getLogger(MetronomeConfig.class);

	/** The default classpath resource the config is loaded from */
	public static final String DEFAULT_RESOURCE = "metronome.properties";

	/** The conf property name for the Metronome base url */
	public static final String CONF_URL = "metronome.url";

	/** The conf property name for the metric catalog expiry in seconds */
	public static final String CONF_CACHE_EXPIRY = "metronome.metrics.cache.expiry";
	/** The default metric catalog expiry in seconds */
	public static final long DEFAULT_CACHE_EXPIRY = 300;

	/** The conf property name for the number of fetch threads */
	public static final String CONF_FETCH_THREADS = "metronome.fetch.threads";
	/** The default number of fetch threads */
	public static final int DEFAULT_FETCH_THREADS = 4;

	/** The conf property name for the overall fetch timeout in ms. */
	public static final String CONF_FETCH_TIMEOUT = "metronome.fetch.timeout";
	/** The default overall fetch timeout in ms. */
	public static final long DEFAULT_FETCH_TIMEOUT = 30000;

	/** The conf property name for the http connect timeout in ms. */
	public static final String CONF_CONNECT_TIMEOUT = "metronome.connect.timeout";
	/** The default http connect timeout in ms. */
	public static final int DEFAULT_CONNECT_TIMEOUT = 5000;

	/** The conf property name for the maximum number of points requested per window */
	public static final String CONF_MAX_POINTS = "metronome.points.max";
	/** The default maximum number of points requested per window */
	public static final int DEFAULT_MAX_POINTS = 720;

	/** The conf property name for the number of extra leading points fetched for the window cache */
	public static final String CONF_ADDITIONAL_POINTS = "metronome.points.additional";
	/** The default number of extra leading points */
	public static final int DEFAULT_ADDITIONAL_POINTS = 100;

	/** The conf property name for the maximum request url length */
	public static final String CONF_URL_MAX_LENGTH = "metronome.url.max.length";
	/** The default maximum request url length */
	public static final int DEFAULT_URL_MAX_LENGTH = 2048;

	/** The conf property name for the url length reserved for the non-path query parameters */
	public static final String CONF_URL_RESERVE = "metronome.url.reserve";
	/** The default url length reserve */
	public static final int DEFAULT_URL_RESERVE = 300;

	private final String url;
	private final long cacheExpirySecs;
	private final int fetchThreads;
	private final long fetchTimeoutMs;
	private final int connectTimeoutMs;
	private final int maxPoints;
	private final int additionalPoints;
	private final int urlMaxLength;
	private final int urlReserve;

	private MetronomeConfig(final Properties p) {
		url = ConfigurationHelper.getSystemThenEnvProperty(CONF_URL, null, p);
		if(url==null) throw new IllegalArgumentException("No Metronome url configured. Set [" + CONF_URL + "]");
		cacheExpirySecs = positive(CONF_CACHE_EXPIRY, ConfigurationHelper.getLongSystemThenEnvProperty(CONF_CACHE_EXPIRY, DEFAULT_CACHE_EXPIRY, p));
		fetchThreads = (int)positive(CONF_FETCH_THREADS, ConfigurationHelper.getIntSystemThenEnvProperty(CONF_FETCH_THREADS, DEFAULT_FETCH_THREADS, p));
		fetchTimeoutMs = positive(CONF_FETCH_TIMEOUT, ConfigurationHelper.getLongSystemThenEnvProperty(CONF_FETCH_TIMEOUT, DEFAULT_FETCH_TIMEOUT, p));
		connectTimeoutMs = (int)positive(CONF_CONNECT_TIMEOUT, ConfigurationHelper.getIntSystemThenEnvProperty(CONF_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, p));
		maxPoints = (int)positive(CONF_MAX_POINTS, ConfigurationHelper.getIntSystemThenEnvProperty(CONF_MAX_POINTS, DEFAULT_MAX_POINTS, p));
		additionalPoints = ConfigurationHelper.getIntSystemThenEnvProperty(CONF_ADDITIONAL_POINTS, DEFAULT_ADDITIONAL_POINTS, p);
		if(additionalPoints < 0) throw new IllegalArgumentException("[" + CONF_ADDITIONAL_POINTS + "] must not be negative: " + additionalPoints);
		urlMaxLength = (int)positive(CONF_URL_MAX_LENGTH, ConfigurationHelper.getIntSystemThenEnvProperty(CONF_URL_MAX_LENGTH, DEFAULT_URL_MAX_LENGTH, p));
		urlReserve = ConfigurationHelper.getIntSystemThenEnvProperty(CONF_URL_RESERVE, DEFAULT_URL_RESERVE, p);
		if(urlReserve < 0 || urlReserve >= urlMaxLength) {
			throw new IllegalArgumentException("[" + CONF_URL_RESERVE + "] must be in [0, " + urlMaxLength + "): " + urlReserve);
		}
	}

	private static long positive(final String name, final long value) {
		if(value < 1) throw new IllegalArgumentException("[" + name + "] must be positive: " + value);
		return value;
	}

	/**
	 * Builds a config from the passed properties
	 * @param properties The properties to read, may be null
	 * @return the config
	 */
	public static MetronomeConfig from(final Properties properties) {
		return new MetronomeConfig(properties==null ? new Properties() : properties);
	}

	/**
	 * Builds a config from the named classpath resource. A missing resource is treated as empty.
	 * @param resource The classpath resource name
	 * @return the config
	 */
	public static MetronomeConfig load(final String resource) {
		final Properties p = new Properties();
		final InputStream is = MetronomeConfig.class.getClassLoader().getResourceAsStream(resource);
		if(is==null) {
			log.info("No config resource [{}] found, using system properties and environment", resource);
		} else {
			try {
				p.load(is);
				log.info("Loaded config resource [{}]", resource);
			} catch (IOException iex) {
				throw new IllegalArgumentException("Failed to read config resource [" + resource + "]", iex);
			} finally {
				try { is.close(); } catch (Exception x) {/* No Op */}
			}
		}
		return from(p);
	}

	/**
	 * Builds a config from {@link #DEFAULT_RESOURCE}
	 * @return the config
	 */
	public static MetronomeConfig load() {
		return load(DEFAULT_RESOURCE);
	}

	/**
	 * Returns the Metronome base url
	 * @return the Metronome base url
	 */
	public String getUrl() {
		return url;
	}

	/**
	 * Returns the metric catalog expiry in seconds
	 * @return the metric catalog expiry in seconds
	 */
	public long getCacheExpirySecs() {
		return cacheExpirySecs;
	}

	/**
	 * Returns the number of fetch threads
	 * @return the number of fetch threads
	 */
	public int getFetchThreads() {
		return fetchThreads;
	}

	/**
	 * Returns the overall fetch timeout in ms.
	 * @return the overall fetch timeout in ms.
	 */
	public long getFetchTimeoutMs() {
		return fetchTimeoutMs;
	}

	/**
	 * Returns the http connect timeout in ms.
	 * @return the http connect timeout in ms.
	 */
	public int getConnectTimeoutMs() {
		return connectTimeoutMs;
	}

	/**
	 * Returns the maximum number of points requested per window
	 * @return the maximum number of points
	 */
	public int getMaxPoints() {
		return maxPoints;
	}

	/**
	 * Returns the number of extra leading points fetched
	 * @return the number of extra leading points
	 */
	public int getAdditionalPoints() {
		return additionalPoints;
	}

	/**
	 * Returns the maximum request url length
	 * @return the maximum request url length
	 */
	public int getUrlMaxLength() {
		return urlMaxLength;
	}

	/**
	 * Returns the url length reserved for the non-path query parameters
	 * @return the url length reserve
	 */
	public int getUrlReserve() {
		return urlReserve;
	}

	/**
	 * Returns the budget available to the comma joined path list of one request
	 * @return the path budget
	 */
	public int getPathBudget() {
		return urlMaxLength - urlReserve;
	}

	/**
	 * {@inheritDoc}
	 * @see java.lang.Object#toString()
	 */
	@Override
	public String toString() {
		return "MetronomeConfig [url=" + url + ", cacheExpirySecs=" + cacheExpirySecs + ", fetchThreads=" + fetchThreads
				+ ", fetchTimeoutMs=" + fetchTimeoutMs + ", connectTimeoutMs=" + connectTimeoutMs + ", maxPoints=" + maxPoints
				+ ", additionalPoints=" + additionalPoints + ", urlMaxLength=" + urlMaxLength + ", urlReserve=" + urlReserve + "]";
	}
}
