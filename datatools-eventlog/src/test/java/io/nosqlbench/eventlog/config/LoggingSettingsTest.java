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

import io.nosqlbench.eventlog.config.LoggingSettings.HandlerType;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configuration;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class LoggingSettingsTest {

    private static Map<String, Object> consoleSettings() {
        Map<String, Object> settings = new HashMap<>();
        settings.put("version", 1);
        settings.put("formatters", Map.of("basic", Map.of("format", "%p %m%n")));
        settings.put("handlers", Map.of("console",
            Map.of("class", "console", "formatter", "basic", "stream", "ext://sys.stdout", "level", "WARNING")));
        settings.put("loggers", Map.of("hello", Map.of("level", "DEBUG", "handlers", List.of("console"), "propagate", "no")));
        settings.put("root", Map.of("level", "critical"));
        return settings;
    }

    @Test
    void validSettingsAreReadIntoSpecs() {
        LoggingSettings settings = LoggingSettings.fromMap(consoleSettings());

        assertEquals("%p %m%n", settings.getFormatters().get("basic"));
        LoggingSettings.HandlerSpec console = settings.getHandlers().get("console");
        assertEquals(HandlerType.CONSOLE, console.getType());
        assertEquals("basic", console.getFormatter());
        assertEquals(Level.WARN, console.getLevel());

        LoggingSettings.LoggerSpec hello = settings.getLoggers().get("hello");
        assertEquals("hello", hello.getName());
        assertEquals(Level.DEBUG, hello.getLevel());
        assertEquals(List.of("console"), hello.getHandlers());
        assertFalse(hello.isPropagate());

        assertEquals(Level.FATAL, settings.getRoot().getLevel());
    }

    @Test
    void emptySettingsAreValid() {
        LoggingSettings settings = LoggingSettings.fromMap(Map.of());
        assertThat(settings.getHandlers()).isEmpty();
        assertNull(settings.getRoot());
    }

    @Test
    void levelNamesFromOtherEcosystemsAreMapped() {
        assertEquals(Level.WARN, LoggingSettings.parseLevel("warning", "x"));
        assertEquals(Level.FATAL, LoggingSettings.parseLevel("CRITICAL", "x"));
        assertEquals(Level.ALL, LoggingSettings.parseLevel("NOTSET", "x"));
        assertEquals(Level.TRACE, LoggingSettings.parseLevel(" trace ", "x"));
    }

    @Test
    void fileHandlerNeedsFilename() {
        Map<String, Object> settings = Map.of("handlers", Map.of("out", Map.of("class", "file")));

        InvalidLoggingSettingsException e = assertThrows(InvalidLoggingSettingsException.class,
            () -> LoggingSettings.fromMap(settings));
        assertEquals("handlers.out.filename", e.getSettingPath());
    }

    @Test
    void fileHandlerSettings() {
        LoggingSettings settings = LoggingSettings.fromMap(Map.of("handlers",
            Map.of("out", Map.of("class", "logging.FileHandler", "filename", "events.log", "append", "off"))));

        LoggingSettings.HandlerSpec out = settings.getHandlers().get("out");
        assertEquals(HandlerType.FILE, out.getType());
        assertEquals("events.log", out.getFilename());
        assertNull(out.getFormatter());
    }

    @Test
    void rejectsInvalidSettings() {
        assertInvalid(Map.of("filters", Map.of()), "filters");
        assertInvalid(Map.of("version", 2), "version");
        assertInvalid(Map.of("formatters", "basic"), "formatters");
        assertInvalid(Map.of("handlers", Map.of("h", Map.of("stream", "stdout"))), "handlers.h.class");
        assertInvalid(Map.of("handlers", Map.of("h", Map.of("class", "socket"))), "handlers.h.class");
        assertInvalid(Map.of("handlers", Map.of("h", Map.of("class", "console", "formatter", "missing"))),
            "handlers.h.formatter");
        assertInvalid(Map.of("handlers", Map.of("h", Map.of("class", "console", "stream", "ext://sys.null"))),
            "handlers.h.stream");
        assertInvalid(Map.of("loggers", Map.of("a", Map.of("level", "LOUD"))), "loggers.a.level");
        assertInvalid(Map.of("loggers", Map.of("a", Map.of("handlers", "nope"))), "loggers.a.handlers");
        assertInvalid(Map.of("loggers", Map.of("a", Map.of("propagate", "maybe"))), "loggers.a.propagate");
        assertInvalid(Map.of("root", List.of("console")), "root");
    }

    @Test
    void nullSettingsAreRejected() {
        assertThatThrownBy(() -> LoggingSettings.fromMap(null))
            .isInstanceOf(InvalidLoggingSettingsException.class)
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buildsALog4jConfiguration() {
        Configuration configuration = LoggingSettings.fromMap(consoleSettings()).toConfiguration("settings-test");
        configuration.initialize();

        assertEquals("settings-test", configuration.getName());
        assertThat(configuration.getAppenders()).containsKey("console");
        assertEquals(Level.DEBUG, configuration.getLoggerConfig("hello").getLevel());
        assertFalse(configuration.getLoggerConfig("hello").isAdditive());
        assertEquals(Level.FATAL, configuration.getRootLogger().getLevel());
    }

    @Test
    void rootDefaultsToWarnWithoutHandlers() {
        Configuration configuration = LoggingSettings.fromMap(Map.of()).toConfiguration("empty");
        configuration.initialize();

        assertEquals(Level.WARN, configuration.getRootLogger().getLevel());
        assertThat(configuration.getRootLogger().getAppenders()).isEmpty();
    }

    private static void assertInvalid(Map<String, ?> settings, String expectedPath) {
        InvalidLoggingSettingsException e = assertThrows(InvalidLoggingSettingsException.class,
            () -> LoggingSettings.fromMap(settings));
        assertEquals(expectedPath, e.getSettingPath(), e.getMessage());
        assertThat(e.getMessage()).startsWith(expectedPath + ": ");
    }

    @Test
    void pythonFormatsBecomeLog4jPatterns() {
        assertEquals("%d [%p] %c: %m%n",
            LoggingSettings.toPattern("%(asctime)s [%(levelname)s] %(name)s: %(message)s", "x"));
        assertEquals("%p %t %F:%L %M - %m%n",
            LoggingSettings.toPattern("%(levelname)-8s %(threadName)s %(filename)s:%(lineno)d %(funcName)s - %(message)s", "x"));
        assertEquals("%d %m%n", LoggingSettings.toPattern("%d %m%n", "x"));
    }

    @Test
    void unsupportedPythonFieldIsRejected() {
        Map<String, Object> settings = Map.of("formatters", Map.of("f", Map.of("format", "%(process)d %(message)s")));

        InvalidLoggingSettingsException e = assertThrows(InvalidLoggingSettingsException.class,
            () -> LoggingSettings.fromMap(settings));
        assertEquals("formatters.f.format", e.getSettingPath());
        assertThat(e.getMessage()).contains("process");
    }

    @Test
    void shortPythonHandlerClassNames() {
        LoggingSettings settings = LoggingSettings.fromMap(Map.of("handlers", Map.of(
            "console", Map.of("class", "StreamHandler"),
            "out", Map.of("class", "FileHandler", "filename", "out.log"))));

        assertEquals(HandlerType.CONSOLE, settings.getHandlers().get("console").getType());
        assertEquals(HandlerType.FILE, settings.getHandlers().get("out").getType());
    }
}
