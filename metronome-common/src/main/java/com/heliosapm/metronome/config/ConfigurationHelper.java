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

import java.util.Properties;

/**
 * <p>Title: ConfigurationHelper</p>
 * <p>Description: Static helpers to resolve a configuration value from, in order, the system properties,
 * the environment, the passed properties and finally the passed default.</p>
 * <p>The environment variable name is the property name upper cased with the dots replaced by underscores.
 * e.g. <b><code>metronome.fetch.threads</code></b> is looked up as <b><code>METRONOME_FETCH_THREADS</code></b>.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.config.ConfigurationHelper</code></p>
 */

public class ConfigurationHelper {

	/**
	 * Converts a property name to the equivalent environment variable name
	 * @param name The property name
	 * @return the environment variable name
	 */
	public static String envName(final String name) {
		return name.replace('.', '_').toUpperCase();
	}

	/**
	 * Resolves the named value from the system properties, environment, then the passed properties
	 * @param name The property name
	 * @param defaultValue The value returned if no value is found
	 * @param properties Optional properties searched after the environment
	 * @return the resolved value
	 */
	public static String getSystemThenEnvProperty(final String name, final String defaultValue, final Properties... properties) {
		if(name==null || name.trim().isEmpty()) throw new IllegalArgumentException("The passed property name was null or empty");
		String value = System.getProperty(name);
		if(value==null || value.trim().isEmpty()) {
			value = System.getenv(envName(name));
		}
		if((value==null || value.trim().isEmpty()) && properties!=null) {
			for(Properties p: properties) {
				if(p==null) continue;
				value = p.getProperty(name);
				if(value!=null && !value.trim().isEmpty()) break;
			}
		}
		if(value==null || value.trim().isEmpty()) return defaultValue;
		return value.trim();
	}

	/**
	 * Resolves the named int value from the system properties, environment, then the passed properties
	 * @param name The property name
	 * @param defaultValue The value returned if no value is found
	 * @param properties Optional properties searched after the environment
	 * @return the resolved value
	 */
	public static int getIntSystemThenEnvProperty(final String name, final int defaultValue, final Properties... properties) {
		final String value = getSystemThenEnvProperty(name, null, properties);
		if(value==null) return defaultValue;
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException nex) {
			throw new IllegalArgumentException("Invalid int value for [" + name + "]: [" + value + "]", nex);
		}
	}

	/**
	 * Resolves the named long value from the system properties, environment, then the passed properties
	 * @param name The property name
	 * @param defaultValue The value returned if no value is found
	 * @param properties Optional properties searched after the environment
	 * @return the resolved value
	 */
	public static long getLongSystemThenEnvProperty(final String name, final long defaultValue, final Properties... properties) {
		final String value = getSystemThenEnvProperty(name, null, properties);
		if(value==null) return defaultValue;
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException nex) {
			throw new IllegalArgumentException("Invalid long value for [" + name + "]: [" + value + "]", nex);
		}
	}

	private ConfigurationHelper() {}
}
