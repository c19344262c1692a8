/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.eventlog;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads wall-clock time for activity start and end records and turns a pair of
 * {@link Timestamp}s into the duration text shown in an end record.
 *
 * <p>The timer keeps no state between calls; the start {@link Timestamp} is held by the
 * caller. Two activities with the same name therefore never share a duration.</p>
 *
 * @since 1.0.0
 */
public final class ActivityTimer {

    private final Clock clock;

    public ActivityTimer() {
        this(Clock.systemDefaultZone());
    }

    public ActivityTimer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return the current time, to be passed back when the activity ends
     */
    public Timestamp markStart() {
        return now();
    }

    public Timestamp now() {
        return Timestamp.of(clock.instant());
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Formats the elapsed seconds between two timestamps with exactly six fractional
     * digits. A negative difference, from a clock that stepped backwards, is shown as zero.
     *
     * @param start when the activity started
     * @param end when the activity ended
     * @return the duration text, e.g. {@code 5.000000}
     */
    public static String computeDuration(Timestamp start, Timestamp end) {
        return formatSeconds(elapsedSeconds(start, end));
    }

    public static double elapsedSeconds(Timestamp start, Timestamp end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        return Math.max(0.0d, start.secondsUntil(end));
    }

    public static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.6f", seconds);
    }
}
