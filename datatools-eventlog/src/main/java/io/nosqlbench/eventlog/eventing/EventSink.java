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

package io.nosqlbench.eventlog.eventing;

import io.nosqlbench.eventlog.EventLog;
import io.nosqlbench.eventlog.sinks.LoggerEventSink;
import io.nosqlbench.eventlog.sinks.NoopEventSink;
import org.apache.logging.log4j.Level;

/**
 * Receives fully formatted lines from an {@link EventLog}. The sink owns everything
 * that happens after formatting: level filtering, appenders, layouts and output.
 *
 * <p>{@link EventLog} calls {@link #emit(Level, String)} once per event, start or end,
 * on the caller's thread and in the caller's order. It does not synchronize; sinks used
 * from several threads must be thread-safe themselves.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link LoggerEventSink} - forwards to a Log4j 2 logger</li>
 *   <li>{@link NoopEventSink} - discards everything</li>
 * </ul>
 *
 * <h3>Custom Sink</h3>
 * <pre>{@code
 * List<String> lines = new CopyOnWriteArrayList<>();
 * EventSink collector = (level, message) -> lines.add(level + " " + message);
 * EventLog log = EventLog.builder(collector).build();
 * }</pre>
 *
 * @see EventLog
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Emits one formatted line.
     *
     * @param level the severity the line was logged at
     * @param message the formatted line
     */
    void emit(Level level, String message);
}
