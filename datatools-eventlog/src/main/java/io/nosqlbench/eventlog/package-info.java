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

/**
 * Structured, greppable event and activity logging on top of Log4j 2.
 *
 * <p>Lines carry an event name, an optional duration and a set of key/value attributes:</p>
 * <pre>
 * 2024-05-01T10:15:30.123456 ingest.begin ; file=/data/base.csv
 * 2024-05-01T10:15:30.200001 batch ; n=5000,ok=true
 * 2024-05-01T10:15:31.327974 ingest.end (1.204518) ; rows=1000000
 * </pre>
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.eventlog.EventLog} - formats event, start and end lines and
 *       hands them to an {@link io.nosqlbench.eventlog.eventing.EventSink}</li>
 *   <li>{@link io.nosqlbench.eventlog.Timestamp} - the handle returned by a start call and
 *       passed back to the matching end call</li>
 *   <li>{@link io.nosqlbench.eventlog.ActivityTimer} - reads the clock and formats durations</li>
 *   <li>{@link io.nosqlbench.eventlog.ActivityWrapper} - brackets a callable with start and end lines</li>
 * </ul>
 *
 * <h2>Supporting Packages</h2>
 * <ul>
 *   <li>{@code kvp} - attribute sets and their key/value encoding</li>
 *   <li>{@code format} - message templates, template mode and separators</li>
 *   <li>{@code eventing} and {@code sinks} - where formatted lines go</li>
 *   <li>{@code config} - configuring Log4j 2 from YAML, sectioned files or settings maps</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EventLog events = EventLog.forLogger("app");
 *
 * Timestamp t0 = events.start("main");
 * events.event("configured", Attributes.of("method", "yaml"));
 * events.end("main", t0);
 * }</pre>
 *
 * @since 1.0.0
 */
package io.nosqlbench.eventlog;
