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
package com.heliosapm.metronome.client;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.BoundRequestBuilder;
import org.asynchttpclient.DefaultAsyncHttpClientConfig;
import org.asynchttpclient.Dsl;
import org.asynchttpclient.Response;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.heliosapm.metronome.config.MetronomeConfig;
import com.heliosapm.metronome.json.BackendProtocolException;
import com.heliosapm.metronome.json.JSONOps;

/**
 * <p>Title: AsyncMetronomeClient</p>
 * <p>Description: {@link MetronomeClient} implemented on a shared async http client.
 * Callers block on the returned future for at most the passed timeout.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.AsyncMetronomeClient</code></p>
 */

public class AsyncMetronomeClient implements MetronomeClient {
	private static final Logger log = LogManager.getLogger(AsyncMetronomeClient.class);

	/** The query parameter naming the Metronome operation */
	public static final String OP_PARAM = "do";
	/** The metric list operation */
	public static final String OP_GET_METRICS = "get-metrics";
	/** The data retrieval operation */
	public static final String OP_RETRIEVE = "retrieve";

	private static final Joiner COMMA_JOINER = Joiner.on(',');
	private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {};

	/** The http client */
	protected final AsyncHttpClient cli;
	/** The Metronome base url */
	protected final String metronomeUrl;
	/** The default request timeout in ms. */
	protected final long requestTimeoutMs;

	/**
	 * Creates a new AsyncMetronomeClient
	 * @param metronomeUrl The Metronome base url
	 * @param connectTimeoutMs The connect timeout in ms.
	 * @param requestTimeoutMs The default request timeout in ms.
	 */
	public AsyncMetronomeClient(final String metronomeUrl, final int connectTimeoutMs, final long requestTimeoutMs) {
		if(metronomeUrl==null || metronomeUrl.trim().isEmpty()) throw new IllegalArgumentException("The passed metronome url was null or empty");
		this.metronomeUrl = metronomeUrl.trim();
		this.requestTimeoutMs = requestTimeoutMs;
		cli = Dsl.asyncHttpClient(new DefaultAsyncHttpClientConfig.Builder()
				.setConnectTimeout(connectTimeoutMs)
				.setRequestTimeout((int)requestTimeoutMs)
				.setThreadPoolName("MetronomeClient"));
		log.info("Created MetronomeClient for [{}]", this.metronomeUrl);
	}

	/**
	 * Creates a new AsyncMetronomeClient from the passed config
	 * @param config The metronome config
	 */
	public AsyncMetronomeClient(final MetronomeConfig config) {
		this(config.getUrl(), config.getConnectTimeoutMs(), config.getFetchTimeoutMs());
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.client.MetronomeClient#getMetrics()
	 */
	@Override
	public List<String> getMetrics() {
		final BoundRequestBuilder req = cli.prepareGet(metronomeUrl)
			.addQueryParam(OP_PARAM, OP_GET_METRICS)
			.addQueryParam("callback", JSONOps.JSONP_CALLBACK);
		final String body = execute(req, OP_GET_METRICS, requestTimeoutMs);
		final JsonNode node = JSONOps.loadJsonp(body);
		final JsonNode metrics = node.get("metrics");
		if(metrics==null || !metrics.isArray()) {
			throw new BackendProtocolException("The get-metrics response had no metrics array", body);
		}
		final List<String> paths = JSONOps.parseToObject(metrics, STRING_LIST);
		log.debug("get-metrics returned {} paths", paths.size());
		return paths;
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.client.MetronomeClient#retrieve(java.util.List, long, long, int, long)
	 */
	@Override
	public RetrieveResult retrieve(final List<String> basePaths, final long begin, final long end, final int points, final long timeoutMs) {
		if(basePaths==null || basePaths.isEmpty()) return RetrieveResult.EMPTY;
		final BoundRequestBuilder req = cli.prepareGet(metronomeUrl)
			.addQueryParam(OP_PARAM, OP_RETRIEVE)
			.addQueryParam("name", COMMA_JOINER.join(basePaths))
			.addQueryParam("begin", Long.toString(begin))
			.addQueryParam("end", Long.toString(end))
			.addQueryParam("datapoints", Integer.toString(points))
			.addQueryParam("callback", JSONOps.JSONP_CALLBACK)
			.setRequestTimeout((int)timeoutMs);
		final String body = execute(req, OP_RETRIEVE, timeoutMs);
		return JSONOps.loadJsonp(body, RetrieveResult.class);
	}

	/**
	 * Executes the passed request and returns the body of a 200 response
	 * @param req The request to execute
	 * @param op The operation name for logging
	 * @param timeoutMs The maximum time to wait in ms.
	 * @return the response body
	 */
	protected String execute(final BoundRequestBuilder req, final String op, final long timeoutMs) {
		final Future<Response> f = req.execute();
		final Response resp;
		try {
			resp = f.get(timeoutMs, TimeUnit.MILLISECONDS);
		} catch (InterruptedException iex) {
			f.cancel(true);
			Thread.currentThread().interrupt();
			throw new MetronomeRequestException("Interrupted while waiting on [" + op + "]", iex);
		} catch (TimeoutException tex) {
			f.cancel(true);
			throw new MetronomeRequestException("Timed out after " + timeoutMs + " ms. waiting on [" + op + "]", tex);
		} catch (ExecutionException eex) {
			log.warn("Metronome request [{}] failed: {}", op, eex.getCause().toString());
			throw new MetronomeRequestException("Metronome request [" + op + "] failed", eex.getCause());
		}
		if(resp.getStatusCode()!=200) {
			log.warn("Metronome request [{}] returned status {}", op, resp.getStatusCode());
			throw new MetronomeRequestException("Metronome request [" + op + "] returned status " + resp.getStatusCode(), resp.getStatusCode());
		}
		return resp.getResponseBody(UTF_8);
	}

	/**
	 * Returns the Metronome base url
	 * @return the Metronome base url
	 */
	public String getMetronomeUrl() {
		return metronomeUrl;
	}

	/**
	 * {@inheritDoc}
	 * @see com.heliosapm.metronome.client.MetronomeClient#close()
	 */
	@Override
	public void close() {
		try {
			cli.close();
			log.info("MetronomeClient for [{}] closed", metronomeUrl);
		} catch (Exception ex) {
			log.warn("Failed to close MetronomeClient for [{}]", metronomeUrl, ex);
		}
	}

}
