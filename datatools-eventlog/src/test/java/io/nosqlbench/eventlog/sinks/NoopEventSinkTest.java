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
import io.nosqlbench.eventlog.kvp.Attributes;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoopEventSinkTest {

    @Test
    void singleton() {
        assertSame(NoopEventSink.getInstance(), NoopEventSink.getInstance());
    }

    @Test
    void eventLogStillReportsTimes() {
        EventLog eventLog = EventLog.builder(NoopEventSink.getInstance()).build();
        assertNotNull(eventLog.start("quiet", Attributes.of("a", 1)));
        assertDoesNotThrow(() -> NoopEventSink.getInstance().emit(Level.FATAL, "ignored"));
    }
}
