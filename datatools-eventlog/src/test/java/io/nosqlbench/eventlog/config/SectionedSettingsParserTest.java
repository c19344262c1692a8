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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionedSettingsParserTest {

    private static final String SAMPLE = String.join("\n",
        "# sample",
        "[formatter:basic]",
        "format = %d [%p] %c: %m%n",
        "",
        "[handler:console]",
        "class = console",
        "formatter = basic",
        "stream: stdout",
        "",
        "; loggers",
        "[logger:io.nosqlbench.ingest]",
        "level = DEBUG",
        "handlers = console",
        "propagate = false",
        "",
        "[root]",
        "level = INFO",
        "handlers = console",
        "");

    @Test
    void sectionsBecomeNestedSettings() {
        Map<String, Object> settings = SectionedSettingsParser.parse(SAMPLE);

        assertThat(settings).containsOnlyKeys("formatters", "handlers", "loggers", "root");
        assertThat(settings.get("formatters"))
            .isEqualTo(Map.of("basic", Map.of("format", "%d [%p] %c: %m%n")));
        assertThat(settings.get("handlers"))
            .isEqualTo(Map.of("console", Map.of("class", "console", "formatter", "basic", "stream", "stdout")));
        assertThat(settings.get("loggers"))
            .isEqualTo(Map.of("io.nosqlbench.ingest",
                Map.of("level", "DEBUG", "handlers", "console", "propagate", "false")));
        assertThat(settings.get("root")).isEqualTo(Map.of("level", "INFO", "handlers", "console"));
    }

    @Test
    void parsedSettingsAreAccepted() {
        LoggingSettings settings = LoggingSettings.fromMap(SectionedSettingsParser.parse(SAMPLE));

        assertThat(settings.getLoggers()).containsOnlyKeys("io.nosqlbench.ingest");
        assertThat(settings.getLoggers().get("io.nosqlbench.ingest").isPropagate()).isFalse();
        assertThat(settings.getRoot().getHandlers()).containsExactly("console");
    }

    @Test
    void windowsLineEndings() {
        Map<String, Object> settings = SectionedSettingsParser.parse("[root]\r\nlevel = WARNING\r\n");
        assertThat(settings.get("root")).isEqualTo(Map.of("level", "WARNING"));
    }

    @Test
    void entryOutsideSectionIsRejected() {
        assertThatThrownBy(() -> SectionedSettingsParser.parse("level = INFO\n[root]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line 1")
            .hasMessageContaining("outside of any section");
    }

    @Test
    void malformedLinesAreRejected() {
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[root]\nlevel INFO\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line 2");
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[root\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unterminated");
    }

    @Test
    void unknownAndRepeatedSectionsAreRejected() {
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[filter:x]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("filter");
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[filters]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown section");
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[filter_x]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown section");
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[handler:a]\n[handler:a]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate");
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[root]\n[root]\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate");
    }

    @Test
    void textWithoutSectionsIsRejected() {
        assertThatThrownBy(() -> SectionedSettingsParser.parse("# only a comment\n\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("no sections found");
    }

    private static final String INDEXED = String.join("\n",
        "[loggers]",
        "keys = root,ingest",
        "",
        "[handlers]",
        "keys = console,audit",
        "",
        "[formatters]",
        "keys = basic",
        "",
        "[logger_root]",
        "level = WARNING",
        "handlers = console",
        "",
        "[logger_ingest]",
        "qualname = io.nosqlbench.ingest",
        "level = DEBUG",
        "handlers = console,audit",
        "propagate = 0",
        "",
        "[logger_unused]",
        "qualname = not.listed",
        "",
        "[handler_console]",
        "class = StreamHandler",
        "formatter = basic",
        "args = (sys.stdout,)",
        "",
        "[handler_audit]",
        "class = FileHandler",
        "args = ('audit.log', 'w')",
        "",
        "[formatter_basic]",
        "format = %(asctime)s [%(levelname)s] %(name)s: %(message)s",
        "");

    @Test
    void indexLayoutBecomesNestedSettings() {
        Map<String, Object> settings = SectionedSettingsParser.parse(INDEXED);

        assertThat(settings.get("root")).isEqualTo(Map.of("level", "WARNING", "handlers", "console"));
        assertThat(settings.get("loggers")).isEqualTo(Map.of("io.nosqlbench.ingest",
            Map.of("level", "DEBUG", "handlers", "console,audit", "propagate", "0")));
        assertThat(settings.get("handlers")).isEqualTo(Map.of(
            "console", Map.of("class", "StreamHandler", "formatter", "basic", "stream", "stdout"),
            "audit", Map.of("class", "FileHandler", "filename", "audit.log", "append", "false")));
        assertThat(settings.get("formatters")).isEqualTo(Map.of("basic",
            Map.of("format", "%(asctime)s [%(levelname)s] %(name)s: %(message)s")));
    }

    @Test
    void indexLayoutSettingsAreAccepted() {
        LoggingSettings settings = LoggingSettings.fromMap(SectionedSettingsParser.parse(INDEXED));

        assertThat(settings.getFormatters().get("basic")).isEqualTo("%d [%p] %c: %m%n");
        assertThat(settings.getHandlers().get("console").getType()).isEqualTo(LoggingSettings.HandlerType.CONSOLE);
        assertThat(settings.getHandlers().get("audit").getFilename()).isEqualTo("audit.log");
        assertThat(settings.getLoggers().get("io.nosqlbench.ingest").isPropagate()).isFalse();
        assertThat(settings.getRoot().getHandlers()).containsExactly("console");
    }

    @Test
    void indexMustNotListMissingSections() {
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[handlers]\nkeys = console\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line 1")
            .hasMessageContaining("[handler_console]");
    }

    @Test
    void bothLayoutsMayNotNameTheSameItem() {
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[root]\nlevel = INFO\n[logger_root]\nlevel = INFO\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate root");
        assertThatThrownBy(() -> SectionedSettingsParser.parse("[handler:a]\nclass = console\n[handler_a]\nclass = console\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate handlers entry 'a'");
    }

    @Test
    void loggerWithoutQualnameUsesSectionId() {
        Map<String, Object> settings = SectionedSettingsParser.parse("[logger_cache]\nlevel = INFO\n");
        assertThat(settings.get("loggers")).isEqualTo(Map.of("cache", Map.of("level", "INFO")));
    }
}
