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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A wall-clock point in time returned by {@link EventLog#start} and {@link EventLog#event}.
 * The caller holds on to it and passes it back to {@link EventLog#end} to get a duration;
 * the event log itself never stores it.
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class Timestamp implements Comparable<Timestamp> {

    /** ISO-8601 local date-time with microsecond fraction, e.g. {@code 2024-05-01T10:15:30.123456}. */
    public static final DateTimeFormatter ISO_LOCAL_MICROS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Instant instant;

    private Timestamp(Instant instant) {
        this.instant = instant;
    }

    public static Timestamp of(Instant instant) {
        return new Timestamp(Objects.requireNonNull(instant, "instant"));
    }

    /**
     * @param epochSeconds fractional seconds since 1970-01-01T00:00:00Z
     * @return the matching timestamp, to the nearest nanosecond
     */
    public static Timestamp ofEpochSeconds(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * NANOS_PER_SECOND);
        return new Timestamp(Instant.ofEpochSecond(seconds, nanos));
    }

    public Instant toInstant() {
        return instant;
    }

    /**
     * @return fractional seconds since 1970-01-01T00:00:00Z
     */
    public double toEpochSeconds() {
        return instant.getEpochSecond() + instant.getNano() / (double) NANOS_PER_SECOND;
    }

    public Timestamp plusSeconds(double seconds) {
        long nanos = Math.round(seconds * NANOS_PER_SECOND);
        return new Timestamp(instant.plusNanos(nanos));
    }

    /**
     * Seconds from this timestamp to {@code later}; negative if {@code later} is earlier.
     */
    public double secondsUntil(Timestamp later) {
        Objects.requireNonNull(later, "later");
        long seconds = later.instant.getEpochSecond() - instant.getEpochSecond();
        long nanos = later.instant.getNano() - instant.getNano();
        return seconds + nanos / (double) NANOS_PER_SECOND;
    }

    /**
     * Renders this timestamp as ISO-8601 local time in the given zone.
     *
     * @param zone the zone whose local time is shown
     * @return the formatted timestamp, always with six fractional digits
     */
    public String toIsoString(ZoneId zone) {
        return LocalDateTime.ofInstant(instant, zone).format(ISO_LOCAL_MICROS);
    }

    @Override
    public int compareTo(Timestamp other) {
        return instant.compareTo(other.instant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Timestamp)) {
            return false;
        }
        return instant.equals(((Timestamp) o).instant);
    }

    @Override
    public int hashCode() {
        return instant.hashCode();
    }

    @Override
    public String toString() {
        return instant.toString();
    }
}
