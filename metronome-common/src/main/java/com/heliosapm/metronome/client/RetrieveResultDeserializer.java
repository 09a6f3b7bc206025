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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * <p>Title: RetrieveResultDeserializer</p>
 * <p>Description: Jackson json deserializer for {@link RetrieveResult}s.
 * Expects <b><code>{"raw": {path: [[ts, value], ...]}, "derivative": {path: [[ts, value], ...]}}</code></b>.
 * A missing section is read as empty.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.client.RetrieveResultDeserializer</code></p>
 */

public class RetrieveResultDeserializer extends JsonDeserializer<RetrieveResult> {
	/** Shareable instance */
	public static final RetrieveResultDeserializer INSTANCE = new RetrieveResultDeserializer();

	/** The raw section key */
	public static final String RAW_KEY = "raw";
	/** The derivative section key */
	public static final String DERIVATIVE_KEY = "derivative";

	/**
	 * {@inheritDoc}
	 * @see com.fasterxml.jackson.databind.JsonDeserializer#deserialize(com.fasterxml.jackson.core.JsonParser, com.fasterxml.jackson.databind.DeserializationContext)
	 */
	@Override
	public RetrieveResult deserialize(final JsonParser p, final DeserializationContext ctxt) throws IOException, JsonProcessingException {
		final JsonNode node = p.getCodec().readTree(p);
		if(node==null || !node.isObject()) throw JsonMappingException.from(p, "Retrieve response is not an object");
		return new RetrieveResult(section(p, node.get(RAW_KEY)), section(p, node.get(DERIVATIVE_KEY)));
	}

	private static Map<String, Series> section(final JsonParser p, final JsonNode sectionNode) throws JsonMappingException {
		final Map<String, Series> map = new LinkedHashMap<String, Series>();
		if(sectionNode==null || sectionNode.isNull()) return map;
		if(!sectionNode.isObject()) throw JsonMappingException.from(p, "Series section is not an object: " + sectionNode);
		for(Iterator<Entry<String, JsonNode>> iter = sectionNode.fields(); iter.hasNext();) {
			final Entry<String, JsonNode> entry = iter.next();
			map.put(entry.getKey(), series(p, entry.getKey(), entry.getValue()));
		}
		return map;
	}

	private static Series series(final JsonParser p, final String path, final JsonNode dps) throws JsonMappingException {
		if(!dps.isArray()) throw JsonMappingException.from(p, "Series for [" + path + "] is not an array");
		final long[] timestamps = new long[dps.size()];
		final List<Double> values = new ArrayList<Double>(dps.size());
		int index = 0;
		for(JsonNode dp: dps) {
			if(!dp.isArray() || dp.size() < 2) throw JsonMappingException.from(p, "Invalid data point for [" + path + "]: " + dp);
			timestamps[index++] = dp.get(0).asLong();
			final JsonNode v = dp.get(1);
			values.add(v.isNull() ? null : Double.valueOf(v.asDouble()));
		}
		return new Series(timestamps, values);
	}

}
