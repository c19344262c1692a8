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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configures Log4j 2 from a structured settings object or from a configuration file.
 *
 * <h2>Sources</h2>
 * <ul>
 *   <li><strong>Settings object:</strong> a nested {@code Map} as described in
 *       {@link LoggingSettings}. Rejected settings raise {@link InvalidLoggingSettingsException}.</li>
 *   <li><strong>File ending in {@code .yaml} or {@code .yml}:</strong> must parse as a YAML
 *       mapping.</li>
 *   <li><strong>Any other file:</strong> YAML is tried first; if the text does not parse
 *       as a YAML mapping, it is read in the sectioned format of
 *       {@link SectionedSettingsParser}.</li>
 * </ul>
 *
 * <p>For files, every failure, whether the file is unreadable, neither format parses, or
 * the settings are rejected, raises a {@link LoggingConfigException} that names the file
 * and carries the original failure.</p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * new LoggingConfigLoader().configure(Path.of("logging.yaml"));
 *
 * new LoggingConfigLoader().configure(Map.of(
 *     "version", 1,
 *     "formatters", Map.of("basic", Map.of("format", "%d [%p] %c: %m%n")),
 *     "handlers", Map.of("console", Map.of("class", "console", "formatter", "basic", "stream", "stdout")),
 *     "loggers", Map.of("hello", Map.of("handlers", List.of("console"), "level", "DEBUG"))));
 * }</pre>
 *
 * <p>Each call replaces the target context's whole configuration. Call it once during
 * startup, before event logging begins.</p>
 *
 * @see LoggingSettings
 * @since 1.0.0
 */
public final class LoggingConfigLoader {

    private static final Logger logger = LogManager.getLogger(LoggingConfigLoader.class);

    public static final String CONFIGURATION_NAME = "eventlog";

    private final LoggerContext context;

    /**
     * Creates a loader that configures the current Log4j 2 logger context.
     */
    public LoggingConfigLoader() {
        this((LoggerContext) LogManager.getContext(false));
    }

    public LoggingConfigLoader(LoggerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Applies a structured settings object.
     *
     * @param settings nested settings, see {@link LoggingSettings}
     * @throws InvalidLoggingSettingsException if the settings are rejected
     */
    public void configure(Map<?, ?> settings) {
        LoggingSettings validated = LoggingSettings.fromMap(settings);
        Configuration configuration = validated.toConfiguration(CONFIGURATION_NAME);
        context.setConfiguration(configuration);
        logger.debug("applied logging settings: {} handlers, {} loggers",
            validated.getHandlers().size(), validated.getLoggers().size());
    }

    public void configure(String path) {
        Objects.requireNonNull(path, "path");
        configure(Path.of(path));
    }

    /**
     * Reads, parses and applies a configuration file.
     *
     * @param path the configuration file
     * @throws LoggingConfigException if the file cannot be read, parsed or applied
     */
    public void configure(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            configure(parse(path, text));
            logger.debug("configured logging from {}", path);
        } catch (LoggingConfigException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new LoggingConfigException(path, e);
        }
    }

    public LoggerContext getContext() {
        return context;
    }

    /**
     * Parses configuration text into a settings map, choosing the format as described in
     * the class documentation.
     *
     * @param path the file the text came from, used for format selection and errors
     * @param text the file content
     * @return the nested settings
     * @throws LoggingConfigException if no applicable format parses the text
     */
    static Map<?, ?> parse(Path path, String text) {
        boolean yamlRequired = isYamlFile(path);

        Object document = null;
        YamlEngineException yamlFailure = null;
        try {
            Load load = new Load(LoadSettings.builder().setLabel(path.toString()).build());
            document = load.loadFromString(text);
        } catch (YamlEngineException e) {
            yamlFailure = e;
        }

        if (document instanceof Map) {
            return (Map<?, ?>) document;
        }
        if (yamlRequired) {
            if (yamlFailure != null) {
                throw new LoggingConfigException(path, "Cannot parse as YAML", yamlFailure);
            }
            throw new LoggingConfigException(path, "YAML document is not a mapping", null);
        }

        try {
            return SectionedSettingsParser.parse(text);
        } catch (IllegalArgumentException e) {
            if (yamlFailure != null) {
                e.addSuppressed(yamlFailure);
            }
            throw new LoggingConfigException(path, "Cannot parse as either YAML or sectioned format", e);
        }
    }

    static boolean isYamlFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
