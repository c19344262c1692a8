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

import io.nosqlbench.eventlog.eventing.EventSink;
import org.apache.logging.log4j.Level;

/**
 * An {@link EventSink} that discards every line. Useful for switching event logging off
 * without touching call sites, and in tests that only care about return values.
 *
 * @since 1.0.0
 */
public class NoopEventSink implements EventSink {

    private static final NoopEventSink INSTANCE = new NoopEventSink();

    private NoopEventSink() {
    }

    public static NoopEventSink getInstance() {
        return INSTANCE;
    }

    @Override
    public void emit(Level level, String message) {
    }
}
