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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses flat, sectioned logging configuration text into the same nested settings map
 * that a YAML configuration produces, so both go through {@link LoggingSettings}.
 *
 * <p>Two section layouts are accepted and may not name the same item twice.</p>
 *
 * <h2>Compact layout</h2>
 * <pre>
 * # comments start with '#' or ';'
 * [formatter:basic]
 * format = %d [%p] %c: %m%n
 *
 * [handler:console]
 * class = console
 * formatter = basic
 * stream = stdout
 *
 * [logger:io.nosqlbench.ingest]
 * level = DEBUG
 * handlers = console
 * propagate = false
 *
 * [root]
 * level = INFO
 * handlers = console
 * </pre>
 *
 * <h2>Index layout</h2>
 * <p>The layout read by Python's {@code logging.config.fileConfig}. Index sections list the
 * ids to read; sections not listed are skipped and a listed id without a section is an
 * error. Loggers take their name from {@code qualname}, and handler {@code args} are read
 * for a {@code sys.stdout}/{@code sys.stderr} stream or a file name and mode.</p>
 * <pre>
 * [loggers]
 * keys = root,ingest
 *
 * [handlers]
 * keys = console
 *
 * [formatters]
 * keys = basic
 *
 * [logger_root]
 * level = WARNING
 * handlers = console
 *
 * [logger_ingest]
 * qualname = io.nosqlbench.ingest
 * level = DEBUG
 * handlers = console
 * propagate = 0
 *
 * [handler_console]
 * class = StreamHandler
 * formatter = basic
 * args = (sys.stdout,)
 *
 * [formatter_basic]
 * format = %(asctime)s [%(levelname)s] %(name)s: %(message)s
 * </pre>
 *
 * <p>Keys and values are separated by {@code =} or {@code :}, whichever comes first, and
 * trimmed. A value holding a list, such as {@code handlers}, is a comma-separated string;
 * {@link LoggingSettings} splits it, and also translates Python-style formats.</p>
 *
 * @since 1.0.0
 */
public final class SectionedSettingsParser {

    private static final String KEYS = "keys";
    private static final Pattern QUOTED = Pattern.compile("'([^']*)'|\"([^\"]*)\"");

    private SectionedSettingsParser() {
    }

    /**
     * @param text the configuration text
     * @return nested settings with {@code formatters}, {@code handlers}, {@code loggers} and {@code root} sections
     * @throws IllegalArgumentException if a line is malformed, a section is unknown or repeated,
     *                                  an index lists a missing section, or the text has no sections
     */
    public static Map<String, Object> parse(String text) {
        Map<String, Section> sections = readSections(text);

        Map<String, List<String>> indexes = new LinkedHashMap<>();
        for (String group : List.of(LoggingSettings.LOGGERS, LoggingSettings.HANDLERS, LoggingSettings.FORMATTERS)) {
            Section index = sections.get(group);
            if (index != null) {
                indexes.put(group, splitKeys(index.entries.get(KEYS)));
            }
        }

        Map<String, Object> settings = new LinkedHashMap<>();
        for (Map.Entry<String, Section> entry : sections.entrySet()) {
            String header = entry.getKey();
            Section section = entry.getValue();
            if (indexes.containsKey(header)) {
                continue;
            }
            if (header.equals(LoggingSettings.ROOT)) {
                putRoot(settings, section.entries, section.lineNumber);
            } else if (header.indexOf(':') >= 0) {
                readCompact(settings, header, section);
            } else if (header.indexOf('_') > 0) {
                readIndexed(settings, header, section, indexes);
            } else {
                throw new IllegalArgumentException("line " + section.lineNumber + ": unknown section [" + header + "]");
            }
        }

        checkIndexes(sections, indexes);
        return settings;
    }

    private static Map<String, Section> readSections(String text) {
        Map<String, Section> sections = new LinkedHashMap<>();
        Section current = null;

        String[] lines = text.split("\\r?\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw new IllegalArgumentException("line " + lineNumber + ": unterminated section header: " + line);
                }
                String header = line.substring(1, line.length() - 1).strip();
                if (sections.containsKey(header)) {
                    throw new IllegalArgumentException("line " + lineNumber + ": duplicate section [" + header + "]");
                }
                current = new Section(lineNumber);
                sections.put(header, current);
                continue;
            }
            if (current == null) {
                throw new IllegalArgumentException("line " + lineNumber + ": entry outside of any section: " + line);
            }
            int split = firstSeparator(line);
            if (split <= 0) {
                throw new IllegalArgumentException("line " + lineNumber + ": expected 'key = value': " + line);
            }
            current.entries.put(line.substring(0, split).strip(), line.substring(split + 1).strip());
        }

        if (sections.isEmpty()) {
            throw new IllegalArgumentException("no sections found");
        }
        return sections;
    }

    private static void readCompact(Map<String, Object> settings, String header, Section section) {
        int colon = header.indexOf(':');
        if (colon == 0 || colon == header.length() - 1) {
            throw new IllegalArgumentException("line " + section.lineNumber + ": unknown section [" + header + "]");
        }
        String kind = header.substring(0, colon).strip();
        String id = header.substring(colon + 1).strip();
        String group;
        switch (kind) {
            case "formatter":
                group = LoggingSettings.FORMATTERS;
                break;
            case "handler":
                group = LoggingSettings.HANDLERS;
                break;
            case "logger":
                group = LoggingSettings.LOGGERS;
                break;
            default:
                throw new IllegalArgumentException("line " + section.lineNumber + ": unknown section kind '" + kind
                    + "', expected formatter, handler, logger or root");
        }
        putEntry(settings, group, id, section.entries, section.lineNumber);
    }

    private static void readIndexed(Map<String, Object> settings, String header, Section section,
                                    Map<String, List<String>> indexes) {
        int underscore = header.indexOf('_');
        String kind = header.substring(0, underscore);
        String id = header.substring(underscore + 1);
        String group;
        switch (kind) {
            case "formatter":
                group = LoggingSettings.FORMATTERS;
                break;
            case "handler":
                group = LoggingSettings.HANDLERS;
                break;
            case "logger":
                group = LoggingSettings.LOGGERS;
                break;
            default:
                throw new IllegalArgumentException("line " + section.lineNumber + ": unknown section [" + header + "]");
        }
        List<String> listed = indexes.get(group);
        if (listed != null && !listed.contains(id)) {
            return;
        }

        Map<String, String> entries = new LinkedHashMap<>(section.entries);
        if (group.equals(LoggingSettings.LOGGERS)) {
            String qualname = entries.remove("qualname");
            if (id.equals(LoggingSettings.ROOT)) {
                putRoot(settings, entries, section.lineNumber);
                return;
            }
            id = qualname == null || qualname.isEmpty() ? id : qualname;
        } else if (group.equals(LoggingSettings.HANDLERS)) {
            readHandlerArgs(entries);
        }
        putEntry(settings, group, id, entries, section.lineNumber);
    }

    /// Turns a Python handler `args` tuple into the stream or file keys.
    private static void readHandlerArgs(Map<String, String> entries) {
        String args = entries.remove("args");
        if (args == null) {
            return;
        }
        String className = entries.getOrDefault("class", "");
        if (className.endsWith("FileHandler")) {
            List<String> literals = new ArrayList<>();
            Matcher matcher = QUOTED.matcher(args);
            while (matcher.find()) {
                literals.add(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
            }
            if (!literals.isEmpty()) {
                entries.putIfAbsent("filename", literals.get(0));
            }
            if (literals.size() > 1) {
                entries.putIfAbsent("append", Boolean.toString(!literals.get(1).startsWith("w")));
            }
        } else if (args.contains("sys.stdout")) {
            entries.putIfAbsent("stream", "stdout");
        } else if (args.contains("sys.stderr")) {
            entries.putIfAbsent("stream", "stderr");
        }
    }

    @SuppressWarnings("unchecked")
    private static void putEntry(Map<String, Object> settings, String group, String id,
                                 Map<String, String> entries, int lineNumber) {
        Map<String, Object> byId = (Map<String, Object>) settings.computeIfAbsent(group, k -> new LinkedHashMap<String, Object>());
        if (byId.containsKey(id)) {
            throw new IllegalArgumentException("line " + lineNumber + ": duplicate " + group + " entry '" + id + "'");
        }
        byId.put(id, new LinkedHashMap<String, Object>(entries));
    }

    private static void putRoot(Map<String, Object> settings, Map<String, String> entries, int lineNumber) {
        if (settings.containsKey(LoggingSettings.ROOT)) {
            throw new IllegalArgumentException("line " + lineNumber + ": duplicate root logger section");
        }
        settings.put(LoggingSettings.ROOT, new LinkedHashMap<String, Object>(entries));
    }

    private static void checkIndexes(Map<String, Section> sections, Map<String, List<String>> indexes) {
        for (Map.Entry<String, List<String>> index : indexes.entrySet()) {
            String kind = index.getKey().substring(0, index.getKey().length() - 1);
            for (String id : index.getValue()) {
                String header = kind + "_" + id;
                if (!sections.containsKey(header)) {
                    throw new IllegalArgumentException("line " + sections.get(index.getKey()).lineNumber
                        + ": [" + index.getKey() + "] lists '" + id + "' but there is no [" + header + "] section");
                }
            }
        }
    }

    private static List<String> splitKeys(String keys) {
        List<String> ids = new ArrayList<>();
        if (keys == null) {
            return ids;
        }
        for (String part : keys.split(",")) {
            if (!part.isBlank()) {
                ids.add(part.strip());
            }
        }
        return ids;
    }

    private static int firstSeparator(String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals < 0) {
            return colon;
        }
        if (colon < 0) {
            return equals;
        }
        return Math.min(equals, colon);
    }

    private static final class Section {
        private final int lineNumber;
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Section(int lineNumber) {
            this.lineNumber = lineNumber;
        }
    }
}
