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

import io.nosqlbench.eventlog.eventing.EventSink;
import io.nosqlbench.eventlog.format.MessageShape;
import io.nosqlbench.eventlog.format.MessageTemplate;
import io.nosqlbench.eventlog.format.MessageTemplates;
import io.nosqlbench.eventlog.format.Separators;
import io.nosqlbench.eventlog.format.TemplateMode;
import io.nosqlbench.eventlog.kvp.Attributes;
import io.nosqlbench.eventlog.kvp.KeyValueEncoder;
import io.nosqlbench.eventlog.sinks.LoggerEventSink;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Formats structured event and activity lines and hands them to an {@link EventSink}.
 *
 * <p>Three kinds of record are written:</p>
 * <ul>
 *   <li>{@link #event} - a single line, {@code name ; k=v,...}</li>
 *   <li>{@link #start} - the beginning of an activity, {@code name.begin ; k=v,...}</li>
 *   <li>{@link #end} - the end of an activity, {@code name.end (1.250000) ; k=v,...} when
 *       the start {@link Timestamp} is passed back, {@code name.end ; k=v,...} when it is not</li>
 * </ul>
 *
 * <p>In {@link TemplateMode#WITH_TIMESTAMP}, the default, every line starts with an
 * ISO-8601 local timestamp and a space.</p>
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Timing an Activity</h3>
 * <pre>{@code
 * EventLog events = EventLog.forLogger(LogManager.getLogger("app.ingest"));
 *
 * Timestamp t0 = events.start("ingest", Attributes.of("file", path.toString()));
 * long rows = ingest(path);
 * events.end("ingest", t0, Attributes.of("rows", rows));
 * // 2024-05-01T10:15:30.123456 ingest.begin ; file=/data/base.csv
 * // 2024-05-01T10:15:31.327974 ingest.end (1.204518) ; rows=1000000
 * }</pre>
 *
 * <h3>Single Events</h3>
 * <pre>{@code
 * events.event("configured", Attributes.of("method", "yaml"));
 * events.event("hello_count", Level.DEBUG, Attributes.of("num", i));
 * }</pre>
 *
 * <h3>Explicit Configuration</h3>
 * <pre>{@code
 * EventLog events = EventLog.builder(new LoggerEventSink("app"))
 *     .templateMode(TemplateMode.WITHOUT_TIMESTAMP) // layout already prints a time
 *     .defaultLevel(Level.DEBUG)
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>An EventLog is immutable and keeps no per-activity state, so one instance can be
 * shared freely. Activities that overlap, even under the same name, are paired only through
 * the {@link Timestamp} each caller holds. Line order across threads is whatever the sink
 * provides.</p>
 *
 * @see ActivityWrapper
 * @see EventSink
 * @since 1.0.0
 */
public final class EventLog {

    /** Level used when a call does not name one and the builder did not override it. */
    public static final Level DEFAULT_LEVEL = Level.INFO;

    /** Status code reported by an activity end when the caller does not give one. */
    public static final int STATUS_OK = 0;

    private final EventSink sink;
    private final MessageTemplates templates;
    private final KeyValueEncoder encoder;
    private final ActivityTimer timer;
    private final ZoneId zone;
    private final Level defaultLevel;

    private EventLog(Builder builder) {
        this.sink = builder.sink;
        this.templates = MessageTemplates.of(builder.templateMode, builder.separators);
        this.encoder = new KeyValueEncoder(builder.separators);
        this.timer = new ActivityTimer(builder.clock);
        this.zone = Objects.requireNonNullElse(builder.zone, builder.clock.getZone());
        this.defaultLevel = builder.defaultLevel;
    }

    public static Builder builder(EventSink sink) {
        return new Builder(sink);
    }

    /**
     * Creates an event log with default settings that writes through the given logger.
     */
    public static EventLog forLogger(Logger logger) {
        return builder(new LoggerEventSink(logger)).build();
    }

    public static EventLog forLogger(String loggerName) {
        return builder(new LoggerEventSink(loggerName)).build();
    }

    public Timestamp event(String name) {
        return event(name, null, Attributes.empty());
    }

    public Timestamp event(String name, Attributes attributes) {
        return event(name, null, attributes);
    }

    /**
     * Logs a single event line.
     *
     * @param name the event name
     * @param level the level, or null for the default level
     * @param attributes attributes for the key/value section, may be null
     * @return the time the event was logged
     */
    public Timestamp event(String name, Level level, Attributes attributes) {
        return emitAtNow(templates.templateFor(MessageShape.EVENT), name, level, attributes);
    }

    /**
     * Logs a single event line with a caller-supplied template instead of the standard
     * event template. The template may use {@code {func_name}}, {@code {kvp}} and
     * {@code {timestamp}}.
     *
     * @param name the event name
     * @param level the level, or null for the default level
     * @param format the template text, see {@link MessageTemplate}
     * @param attributes attributes for the key/value section, may be null
     * @return the time the event was logged
     * @throws IllegalArgumentException if the template cannot be parsed or uses a placeholder
     *                                  an event has no value for
     */
    public Timestamp event(String name, Level level, String format, Attributes attributes) {
        return emitAtNow(MessageTemplate.parse(format), name, level, attributes);
    }

    public Timestamp start(String name) {
        return start(name, null, Attributes.empty());
    }

    public Timestamp start(String name, Attributes attributes) {
        return start(name, null, attributes);
    }

    /**
     * Logs the beginning of an activity.
     *
     * @param name the activity name
     * @param level the level, or null for the default level
     * @param attributes attributes for the key/value section, may be null
     * @return the start time; pass it to {@link #end} to get a duration
     */
    public Timestamp start(String name, Level level, Attributes attributes) {
        return emitAtNow(templates.templateFor(MessageShape.ENTRY), name, level, attributes);
    }

    public void end(String name) {
        end(name, null, null, STATUS_OK, Attributes.empty());
    }

    public void end(String name, Timestamp start) {
        end(name, start, null, STATUS_OK, Attributes.empty());
    }

    public void end(String name, Timestamp start, Attributes attributes) {
        end(name, start, null, STATUS_OK, attributes);
    }

    public void end(String name, Timestamp start, Level level, Attributes attributes) {
        end(name, start, level, STATUS_OK, attributes);
    }

    /**
     * Logs the end of an activity. With a start time the line carries the elapsed seconds;
     * without one it is written in the no-duration form.
     *
     * @param name the activity name
     * @param start the value returned by {@link #start}, or null if timing was not tracked
     * @param level the level, or null for the default level
     * @param statusCode passed through to the {@code {status}} placeholder, 0 meaning success
     * @param attributes attributes for the key/value section, may be null
     */
    public void end(String name, Timestamp start, Level level, int statusCode, Attributes attributes) {
        Timestamp now = timer.now();
        Map<String, String> values = baseValues(name, now, attributes);
        values.put(MessageTemplate.STATUS, Integer.toString(statusCode));

        MessageShape shape;
        if (start != null) {
            values.put(MessageTemplate.DURATION, ActivityTimer.computeDuration(start, now));
            shape = MessageShape.EXIT;
        } else {
            shape = MessageShape.EXIT_NO_DURATION;
        }
        sink.emit(levelOrDefault(level), templates.templateFor(shape).render(values));
    }

    /**
     * Starts building an {@link ActivityWrapper} that brackets calls with start and end
     * records under the given name.
     */
    public ActivityWrapper.Builder wrap(String name) {
        return ActivityWrapper.builder(this, name);
    }

    public TemplateMode getTemplateMode() {
        return templates.getMode();
    }

    public Separators getSeparators() {
        return templates.getSeparators();
    }

    public Level getDefaultLevel() {
        return defaultLevel;
    }

    public ZoneId getZone() {
        return zone;
    }

    public EventSink getSink() {
        return sink;
    }

    private Timestamp emitAtNow(MessageTemplate template, String name, Level level, Attributes attributes) {
        Timestamp now = timer.now();
        String message = template.render(baseValues(name, now, attributes));
        sink.emit(levelOrDefault(level), message);
        return now;
    }

    private Map<String, String> baseValues(String name, Timestamp now, Attributes attributes) {
        Objects.requireNonNull(name, "name");
        Map<String, String> values = new HashMap<>();
        values.put(MessageTemplate.NAME, name);
        values.put(MessageTemplate.KVP, encoder.encode(attributes));
        values.put(MessageTemplate.TIMESTAMP, now.toIsoString(zone));
        return values;
    }

    private Level levelOrDefault(Level level) {
        return level != null ? level : defaultLevel;
    }

    /**
     * Builder for {@link EventLog}. Settings are fixed once {@link #build()} is called.
     */
    public static final class Builder {
        private final EventSink sink;
        private TemplateMode templateMode = TemplateMode.WITH_TIMESTAMP;
        private Separators separators = Separators.DEFAULT;
        private Clock clock = Clock.systemDefaultZone();
        private ZoneId zone;
        private Level defaultLevel = DEFAULT_LEVEL;

        private Builder(EventSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
        }

        public Builder templateMode(TemplateMode templateMode) {
            this.templateMode = Objects.requireNonNull(templateMode, "templateMode");
            return this;
        }

        public Builder includeTimestamp(boolean includeTimestamp) {
            return templateMode(TemplateMode.of(includeTimestamp));
        }

        public Builder separators(Separators separators) {
            this.separators = Objects.requireNonNull(separators, "separators");
            return this;
        }

        /**
         * Sets the time source. Its zone is also used to display timestamps unless
         * {@link #zone(ZoneId)} is set.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        public Builder defaultLevel(Level defaultLevel) {
            this.defaultLevel = Objects.requireNonNull(defaultLevel, "defaultLevel");
            return this;
        }

        public EventLog build() {
            return new EventLog(this);
        }
    }
}
