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

import java.nio.file.Path;

/// Thrown when logging cannot be configured from a file. Every failure while reading,
/// parsing or applying a configuration file surfaces as this one exception type, naming the
/// file and carrying the original failure as its cause.
public class LoggingConfigException extends RuntimeException {

    /// The configuration file that could not be applied.
    private final Path path;

    /// Creates an exception for a failure with an underlying cause.
    /// @param path the configuration file
    /// @param detail what went wrong
    /// @param cause the original failure, may be null
    public LoggingConfigException(Path path, String detail, Throwable cause) {
        super("Error configuring logging from file \"" + path + "\": " + detail, cause);
        this.path = path;
    }

    /// Creates an exception whose detail is the cause's own message.
    /// @param path the configuration file
    /// @param cause the original failure
    public LoggingConfigException(Path path, Throwable cause) {
        this(path, String.valueOf(cause), cause);
    }

    public Path getPath() {
        return path;
    }
}
