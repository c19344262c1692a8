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
 * Selects whether formatted lines carry their own timestamp. Use
 * {@link #WITHOUT_TIMESTAMP} when the logging layout already prints one.
 *
 * @since 1.0.0
 */
public enum TemplateMode {
    WITH_TIMESTAMP,
    WITHOUT_TIMESTAMP;

    public boolean includesTimestamp() {
        return this == WITH_TIMESTAMP;
    }

    public static TemplateMode of(boolean includeTimestamp) {
        return includeTimestamp ? WITH_TIMESTAMP : WITHOUT_TIMESTAMP;
    }
}
