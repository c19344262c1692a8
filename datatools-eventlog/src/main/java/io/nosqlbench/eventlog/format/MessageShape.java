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

package io.nosqlbench.eventlog.format;

/**
 * The four kinds of line the event log writes. Each shape selects one template from
 * {@link MessageTemplates}.
 *
 * @since 1.0.0
 */
public enum MessageShape {
    /** Start of an activity: {@code name.begin ; kvp}. */
    ENTRY,
    /** End of an activity with its elapsed time: {@code name.end (0.250000) ; kvp}. */
    EXIT,
    /** End of an activity whose start was not tracked: {@code name.end ; kvp}. */
    EXIT_NO_DURATION,
    /** A single, unbounded event: {@code name ; kvp}. */
    EVENT
}
