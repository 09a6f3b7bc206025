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
package com.heliosapm.metronome.json;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * <p>Title: JSONOps</p>
 * <p>Description: Centralized common JSON operations, including the unwrapping and repair of the
 * JSONP responses returned by Metronome.</p>
 * <p>Metronome always answers with a JSONP envelope (<b><code>_(</code></b> ... <b><code>);</code></b>)
 * around a body that is not valid JSON, since the <b><code>raw</code></b> and <b><code>derivative</code></b>
 * keys are not quoted. e.g. <b><code>_({ raw: {"a":[[1,2]]}, derivative: {} });</code></b></p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.json.JSONOps</code></p>
 */

public class JSONOps {
	/** Static class logger */
	private static final Logger log = LogManager.getLogger(JSONOps.class);

	/** The JSONP prefix length, <b><code>_(</code></b> */
	public static final int JSONP_PREFIX_LENGTH = 2;
	/** The JSONP suffix length, <b><code>);</code></b> */
	public static final int JSONP_SUFFIX_LENGTH = 2;
	/** The JSONP callback name we request */
	public static final String JSONP_CALLBACK = "_";

	/** The broken unquoted derivative key */
	private static final String BROKEN_DERIVATIVE_KEY = " derivative: ";
	/** The repaired derivative key */
	private static final String FIXED_DERIVATIVE_KEY = " \"derivative\":";
	/** The broken unquoted raw key */
	private static final String BROKEN_RAW_KEY = " raw: ";
	/** The repaired raw key */
	private static final String FIXED_RAW_KEY = " \"raw\":";

	private static final ObjectMapper jsonMapper = new ObjectMapper();
	static {
		jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
	}

	/**
	 * Strips the JSONP envelope from the passed response text and repairs the unquoted keys
	 * @param jsonp The raw JSONP response text
	 * @return the repaired JSON text
	 */
	public static String repairJsonp(final String jsonp) {
		if(jsonp==null) throw new BackendProtocolException("The JSONP response was null", null);
		if(jsonp.length() < JSONP_PREFIX_LENGTH + JSONP_SUFFIX_LENGTH) {
			log.error("Invalid JSONP:\n{}", jsonp);
			throw new BackendProtocolException("The JSONP response was too short to unwrap: [" + jsonp + "]", jsonp);
		}
		final String inner = jsonp.substring(JSONP_PREFIX_LENGTH, jsonp.length() - JSONP_SUFFIX_LENGTH)
				.replace(BROKEN_DERIVATIVE_KEY, FIXED_DERIVATIVE_KEY)
				.replace(BROKEN_RAW_KEY, FIXED_RAW_KEY)
				.trim();
		// the key list form "_( raw: {..}, derivative: {..} );" carries no object braces
		if(inner.isEmpty() || (inner.charAt(0)!='{' && inner.charAt(0)!='[')) {
			return "{" + inner + "}";
		}
		return inner;
	}

	/**
	 * Unwraps, repairs and parses the passed JSONP response text into a json node
	 * @param jsonp The raw JSONP response text
	 * @return the parsed json node
	 */
	public static JsonNode loadJsonp(final String jsonp) {
		final String json = repairJsonp(jsonp);
		try {
			return jsonMapper.readTree(json);
		} catch (Exception ex) {
			log.error("Invalid JSONP:\n{}", jsonp);
			throw new BackendProtocolException("Failed to parse repaired JSONP response", jsonp, ex);
		}
	}

	/**
	 * Unwraps, repairs and parses the passed JSONP response text into an instance of the passed type
	 * @param jsonp The raw JSONP response text
	 * @param pojo The type to parse to
	 * @return the parsed object
	 */
	public static <T> T loadJsonp(final String jsonp, final Class<T> pojo) {
		if(pojo==null) throw new IllegalArgumentException("The passed type was null");
		final String json = repairJsonp(jsonp);
		try {
			return jsonMapper.readValue(json, pojo);
		} catch (Exception ex) {
			log.error("Invalid JSONP:\n{}", jsonp);
			throw new BackendProtocolException("Failed to parse repaired JSONP response to [" + pojo.getName() + "]", jsonp, ex);
		}
	}

	/**
	 * Deserializes a JSON node to a specific type
	 * @param json The node to deserialize
	 * @param type The type reference of the object used for deserialization
	 * @return An object of the referenced type
	 */
	public static <T> T parseToObject(final JsonNode json, final TypeReference<T> type) {
		if(json==null) throw new IllegalArgumentException("Incoming data was null");
		if(type==null) throw new IllegalArgumentException("Missing type reference");
		try {
			return jsonMapper.readValue(jsonMapper.treeAsTokens(json), type);
		} catch (Exception ex) {
			throw new BackendProtocolException("Failed to parse node to [" + type.getType() + "]", json.toString(), ex);
		}
	}

	private JSONOps() {}

}
