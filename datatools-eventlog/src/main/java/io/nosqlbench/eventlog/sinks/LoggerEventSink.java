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

package io.nosqlbench.eventlog.sinks;

import io.nosqlbench.eventlog.EventLog;
import io.nosqlbench.eventlog.eventing.EventSink;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * An {@link EventSink} that writes event lines through a Log4j 2 {@link Logger}. Level
 * filtering, appenders and layouts all come from the Log4j configuration; this sink only
 * hands over the level and the formatted line.
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Logger by Name</h3>
 * <pre>{@code
 * EventLog events = EventLog.builder(new LoggerEventSink("app.ingest")).build();
 * Timestamp t0 = events.start("load", Attributes.of("file", path.toString()));
 * loader.load(path);
 * events.end("load", t0);
 * // INFO app.ingest - 2024-05-01T10:15:30.123456 load.end (1.204518) ; file=/data/base.fvec
 * }</pre>
 *
 * <h3>Existing Logger</h3>
 * <pre>{@code
 * private static final Logger logger = LogManager.getLogger(Importer.class);
 * private final EventLog events = EventLog.forLogger(logger);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>This sink is thread-safe through Log4j 2, which handles concurrent access to loggers
 * and their appenders. Ordering across threads is whatever the appenders provide.</p>
 *
 * @see EventLog
 * @see EventSink
 * @since 1.0.0
 */
public class LoggerEventSink implements EventSink {

    private final Logger logger;

    public LoggerEventSink() {
        this(LogManager.getLogger(LoggerEventSink.class));
    }

    public LoggerEventSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public LoggerEventSink(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public Logger getLogger() {
        return logger;
    }

    @Override
    public void emit(Level level, String message) {
        Level effectiveLevel = Objects.requireNonNullElse(level, Level.INFO);
        if (logger.isEnabled(effectiveLevel)) {
            logger.log(effectiveLevel, message);
        }
    }
}
