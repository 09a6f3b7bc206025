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

/**
 * <p>Title: TimeWindow</p>
 * <p>Description: The time descriptor of a fetch, in epoch seconds. The window starts at <b><code>start</code></b>,
 * excludes <b><code>end</code></b> and holds <b><code>points</code></b> samples spaced <b><code>step</code></b> apart.</p>
 * @author Whitehead (nwhitehead AT heliosdev DOT org)
 * <p><code>com.heliosapm.metronome.finder.fetch.TimeWindow</code></p>
 */

public class TimeWindow {
	/** The target spacing of samples in seconds, before capping the number of points */
	public static final int MIN_STEP = 10;

	private final long start;
	private final long end;
	private final long step;
	private final int points;

	/**
	 * Creates a new TimeWindow
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @param step The sample spacing in seconds
	 * @param points The number of samples
	 */
	public TimeWindow(final long start, final long end, final long step, final int points) {
		if(step < 1) throw new IllegalArgumentException("The passed step was less than 1: " + step);
		if(points < 1) throw new IllegalArgumentException("The passed points was less than 1: " + points);
		this.start = start;
		this.end = end;
		this.step = step;
		this.points = points;
	}

	/**
	 * Computes the window for the passed range. Samples are spaced at least {@link #MIN_STEP} seconds apart
	 * unless that would leave less than one point, and never more than <b><code>maxPoints</code></b> are requested.
	 * @param start The start time in seconds
	 * @param end The end time in seconds
	 * @param maxPoints The maximum number of points
	 * @return the time window
	 */
	public static TimeWindow forRange(final long start, final long end, final int maxPoints) {
		if(end <= start) throw new IllegalArgumentException("The end [" + end + "] must be after the start [" + start + "]");
		if(maxPoints < 1) throw new IllegalArgumentException("The passed max points was less than 1: " + maxPoints);
		final long span = end - start;
		final int points = (int)Math.max(1L, Math.min(maxPoints, span / MIN_STEP));
		return new TimeWindow(start, end, span / points, points);
	}

	public long getStart() {
		return start;
	}

	public long getEnd() {
		return end;
	}

	public long getStep() {
		return step;
	}

	public int getPoints() {
		return points;
	}

	@Override
	public int hashCode() {
		int result = 31 + (int)(start ^ (start >>> 32));
		result = 31 * result + (int)(end ^ (end >>> 32));
		result = 31 * result + (int)(step ^ (step >>> 32));
		return 31 * result + points;
	}

	@Override
	public boolean equals(final Object obj) {
		if(this==obj) return true;
		if(!(obj instanceof TimeWindow)) return false;
		final TimeWindow other = (TimeWindow)obj;
		return start==other.start && end==other.end && step==other.step && points==other.points;
	}

	@Override
	public String toString() {
		return "TimeWindow [" + start + "," + end + "> step=" + step + ", points=" + points;
	}
}
