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
 * Implementations of {@link io.nosqlbench.eventlog.eventing.EventSink}.
 *
 * <ul>
 *   <li>{@link LoggerEventSink} - routes event lines through Log4j 2</li>
 *   <li>{@link NoopEventSink} - discards event lines</li>
 * </ul>
 *
 * @see io.nosqlbench.eventlog.EventLog
 * @since 1.0.0
 */
package io.nosqlbench.eventlog.sinks;
