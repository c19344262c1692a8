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
 * Configures Log4j 2 from a settings map, a YAML file or a sectioned flat file.
 *
 * <p>All three sources share one settings layout, documented on
 * {@link io.nosqlbench.eventlog.config.LoggingSettings}. Errors come in two kinds:
 * {@link io.nosqlbench.eventlog.config.InvalidLoggingSettingsException} for a rejected
 * settings map and {@link io.nosqlbench.eventlog.config.LoggingConfigException} for any
 * failure while configuring from a file.</p>
 *
 * @since 1.0.0
 */
package io.nosqlbench.eventlog.config;
