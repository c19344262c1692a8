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

package io.nosqlbench.eventlog.config;

/// Thrown when a structured logging settings object is rejected, for example because a
/// handler names an unknown formatter or a level name is not recognized.
///
/// The message names the offending section and entry, e.g. `handlers.console.formatter`.
public class InvalidLoggingSettingsException extends IllegalArgumentException {

    /// The settings entry that was rejected, as a dotted path.
    private final String settingPath;

    public InvalidLoggingSettingsException(String settingPath, String message) {
        super(settingPath + ": " + message);
        this.settingPath = settingPath;
    }

    public String getSettingPath() {
        return settingPath;
    }
}
