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
package com.heliosapm.metronome.finder.tool;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import com.heliosapm.metronome.config.MetronomeConfig;
import com.heliosapm.metronome.finder.MetronomeFinder;
import com.heliosapm.metronome.finder.fetch.ChunkFetchException;
import com.heliosapm.metronome.finder.fetch.FetchResult;
import com.heliosapm.metronome.finder.node.Node;

/**
 * <p>Title: QueryTool</p>
 * <p>Description: Command line tool that finds nodes or fetches series from Metronome</p>
 * <pre>
 *   QueryTool --url http://metronome:8000/ FIND 'pdns.*.auth.*'
 *   QueryTool --config metronome.properties --from 1470000000 FETCH pdns.a.auth.queries pdns.a.auth.queries_dt
 * </pre>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.tool.QueryTool</code></p>
 */

public class QueryTool {
	private static final Logger log = LogManager.getLogger(QueryTool.class);

	/** The default look back when no start time is given, in seconds */
	public static final long DEFAULT_LOOKBACK = 3600;

	/**
	 * <p>Title: Command</p>
	 * <p>Description: Enumerates the tool commands</p>
	 */
	public static enum Command {
		/** Finds the nodes matching each pattern */
		FIND,
		/** Fetches the series of the listed paths */
		FETCH;
	}

	@Option(name="--url", usage="The Metronome base url", metaVar="URL")
	protected String url = null;

	@Option(name="--config", usage="A properties file holding the finder configuration", metaVar="FILE")
	protected File config = null;

	@Option(name="--from", usage="The fetch start in epoch seconds, defaults to an hour before --until", metaVar="SECS")
	protected long from = -1L;

	@Option(name="--until", usage="The fetch end in epoch seconds, defaults to now", metaVar="SECS")
	protected long until = -1L;

	@Option(name="--timeout", usage="The fetch timeout in ms.", metaVar="MS")
	protected long timeout = -1L;

	@Argument(index=0, required=true, metaVar="COMMAND", usage="FIND or FETCH")
	protected Command command = null;

	@Argument(index=1, required=true, multiValued=true, metaVar="TARGET", usage="The patterns to find or the paths to fetch")
	protected List<String> targets = new ArrayList<String>();

	/**
	 * Parses the passed command line
	 * @param args The command line arguments
	 * @return the parsed tool
	 */
	public static QueryTool parse(final String...args) {
		final QueryTool tool = new QueryTool();
		final CmdLineParser parser = new CmdLineParser(tool);
		try {
			parser.parseArgument(args);
			return tool;
		} catch (CmdLineException e) {
			final StringBuilder b = new StringBuilder(e.getMessage()).append("\n");
			final StringWriter sw = new StringWriter();
			parser.printUsage(sw, null);
			sw.flush();
			b.append(sw.toString());
			throw new IllegalArgumentException(b.toString(), e);
		}
	}

	/**
	 * Builds the finder configuration from the config file, if any, and the url option, if any.
	 * With neither, the classpath <b><code>metronome.properties</code></b> is read.
	 * @return the finder configuration
	 */
	public MetronomeConfig buildConfig() {
		if(config==null && url==null) return MetronomeConfig.load();
		final Properties p = new Properties();
		if(config!=null) {
			InputStream is = null;
			try {
				is = new FileInputStream(config);
				p.load(is);
			} catch (IOException iex) {
				throw new IllegalArgumentException("Failed to read config file [" + config + "]", iex);
			} finally {
				if(is!=null) try { is.close(); } catch (Exception x) {/* No Op */}
			}
		}
		if(url!=null) p.setProperty(MetronomeConfig.CONF_URL, url);
		return MetronomeConfig.from(p);
	}

	/**
	 * Runs the parsed command
	 * @param finder The finder to query
	 * @param out The stream results are printed to
	 * @param nowSecs The current time in seconds
	 */
	public void run(final MetronomeFinder finder, final PrintStream out, final long nowSecs) {
		switch(command) {
			case FIND:
				for(String pattern: targets) {
					for(Iterator<Node> iter = finder.find(pattern).iterator(); iter.hasNext();) {
						final Node node = iter.next();
						out.println((node.isLeaf() ? "L " : "B ") + node.getPath());
					}
				}
				break;
			case FETCH:
				final long end = until < 0 ? nowSecs : until;
				final long start = from < 0 ? end - DEFAULT_LOOKBACK : from;
				final FetchResult fr = timeout > 0 ? finder.fetch(targets, start, end, timeout) : finder.fetch(targets, start, end);
				out.println("window: " + fr.getWindow() + (fr.isFromCache() ? " (cached)" : ""));
				for(String path: targets) {
					out.println(path + " " + fr.getData().get(path));
				}
				for(ChunkFetchException warning: fr.getWarnings()) {
					out.println("WARN " + warning.getMessage() + " " + warning.getPaths());
				}
				break;
			default:
				throw new IllegalStateException("Unknown command: " + command);
		}
	}

	public Command getCommand() {
		return command;
	}

	public List<String> getTargets() {
		return targets;
	}

	public long getFrom() {
		return from;
	}

	public long getUntil() {
		return until;
	}

	/**
	 * @param args The command line arguments
	 */
	public static void main(final String[] args) {
		final QueryTool tool;
		try {
			tool = parse(args);
		} catch (IllegalArgumentException ex) {
			System.err.println(ex.getMessage());
			System.exit(1);
			return;
		}
		final MetronomeConfig config = tool.buildConfig();
		log.info("QueryTool: {} {}", tool.command, tool.targets);
		final MetronomeFinder finder = new MetronomeFinder(config);
		try {
			tool.run(finder, System.out, System.currentTimeMillis() / 1000L);
		} finally {
			finder.close();
		}
	}
}
