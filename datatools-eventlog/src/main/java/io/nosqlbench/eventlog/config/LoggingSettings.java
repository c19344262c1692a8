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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.AppenderRefComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilderFactory;
import org.apache.logging.log4j.core.config.builder.api.LoggerComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.RootLoggerComponentBuilder;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A validated, backend-neutral view of a structured logging settings object, and its
 * translation to a Log4j 2 configuration.
 *
 * <h2>Settings Layout</h2>
 * <pre>{@code
 * version: 1                      # optional, must be 1
 * formatters:
 *   basic:
 *     format: "%d [%p] %c: %m%n"  # Log4j PatternLayout pattern, or a Python %(name)s format
 * handlers:
 *   console:
 *     class: console              # console | stream | [logging.]StreamHandler | file | [logging.]FileHandler
 *     formatter: basic
 *     stream: stdout              # stdout | stderr | ext://sys.stdout | ext://sys.stderr
 *     level: DEBUG                # optional threshold for this handler
 *   audit:
 *     class: file
 *     filename: /var/log/app/audit.log
 *     append: true
 * loggers:
 *   io.nosqlbench.ingest:
 *     level: DEBUG
 *     handlers: [console]
 *     propagate: false
 * root:
 *   level: INFO
 *   handlers: [console, audit]
 * }</pre>
 *
 * <p>Level names are Log4j level names, plus {@code WARNING}, {@code CRITICAL} and
 * {@code NOTSET} as aliases of {@code WARN}, {@code FATAL} and {@code ALL}. A handler
 * list may also be given as one comma-separated string.</p>
 *
 * @see LoggingConfigLoader
 * @since 1.0.0
 */
public final class LoggingSettings {

    public static final String VERSION = "version";
    public static final String FORMATTERS = "formatters";
    public static final String HANDLERS = "handlers";
    public static final String LOGGERS = "loggers";
    public static final String ROOT = "root";
    public static final String DISABLE_EXISTING_LOGGERS = "disable_existing_loggers";

    public static final String DEFAULT_PATTERN = "%m%n";
    private static final Pattern PYTHON_FIELD = Pattern.compile("%\\((\\w+)\\)[-#0 +]*\\d*(?:\\.\\d+)?[sdfr]");
    private static final Map<String, String> PYTHON_FIELDS = Map.of(
        "asctime", "%d",
        "levelname", "%p",
        "name", "%c",
        "message", "%m",
        "threadName", "%t",
        "thread", "%T",
        "lineno", "%L",
        "funcName", "%M",
        "filename", "%F");

    private static final Set<String> TOP_LEVEL_KEYS =
        Set.of(VERSION, FORMATTERS, HANDLERS, LOGGERS, ROOT, DISABLE_EXISTING_LOGGERS);

    /** Where a handler writes. */
    public enum HandlerType {
        CONSOLE,
        FILE
    }

    private final Map<String, String> formatters;
    private final Map<String, HandlerSpec> handlers;
    private final Map<String, LoggerSpec> loggers;
    private final LoggerSpec root;

    private LoggingSettings(Map<String, String> formatters, Map<String, HandlerSpec> handlers,
                            Map<String, LoggerSpec> loggers, LoggerSpec root) {
        this.formatters = Collections.unmodifiableMap(formatters);
        this.handlers = Collections.unmodifiableMap(handlers);
        this.loggers = Collections.unmodifiableMap(loggers);
        this.root = root;
    }

    /**
     * Validates a settings object.
     *
     * @param settings nested settings as described in the class documentation
     * @return the validated settings
     * @throws InvalidLoggingSettingsException if any part of the settings is rejected
     */
    public static LoggingSettings fromMap(Map<?, ?> settings) {
        if (settings == null) {
            throw new InvalidLoggingSettingsException("settings", "must not be null");
        }
        for (Object key : settings.keySet()) {
            if (!(key instanceof String) || !TOP_LEVEL_KEYS.contains(key)) {
                throw new InvalidLoggingSettingsException(String.valueOf(key),
                    "unknown section, expected one of " + TOP_LEVEL_KEYS);
            }
        }

        Object version = settings.get(VERSION);
        if (version != null && !"1".equals(String.valueOf(version))) {
            throw new InvalidLoggingSettingsException(VERSION, "unsupported version " + version + ", expected 1");
        }

        Map<String, String> formatters = new LinkedHashMap<>();
        for (Map.Entry<String, Map<?, ?>> entry : sections(settings, FORMATTERS).entrySet()) {
            String path = FORMATTERS + "." + entry.getKey();
            Object format = entry.getValue().get("format");
            formatters.put(entry.getKey(),
                format == null ? DEFAULT_PATTERN : toPattern(requireString(format, path + ".format"), path + ".format"));
        }

        Map<String, HandlerSpec> handlers = new LinkedHashMap<>();
        for (Map.Entry<String, Map<?, ?>> entry : sections(settings, HANDLERS).entrySet()) {
            handlers.put(entry.getKey(), HandlerSpec.from(entry.getKey(), entry.getValue(), formatters));
        }

        Map<String, LoggerSpec> loggers = new LinkedHashMap<>();
        for (Map.Entry<String, Map<?, ?>> entry : sections(settings, LOGGERS).entrySet()) {
            String path = LOGGERS + "." + entry.getKey();
            loggers.put(entry.getKey(), LoggerSpec.from(path, entry.getValue(), handlers));
        }

        LoggerSpec root = null;
        Object rootSection = settings.get(ROOT);
        if (rootSection != null) {
            root = LoggerSpec.from(ROOT, requireMap(rootSection, ROOT), handlers);
        }

        return new LoggingSettings(formatters, handlers, loggers, root);
    }

    /**
     * Builds a Log4j 2 configuration from these settings. The configuration is not yet
     * started; {@link org.apache.logging.log4j.core.LoggerContext#setConfiguration} starts it.
     *
     * @param name the configuration name
     * @return the configuration
     */
    public BuiltConfiguration toConfiguration(String name) {
        ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
        builder.setConfigurationName(name);
        builder.setStatusLevel(Level.WARN);

        for (HandlerSpec handler : handlers.values()) {
            AppenderComponentBuilder appender;
            if (handler.type == HandlerType.FILE) {
                appender = builder.newAppender(handler.id, "File")
                    .addAttribute("fileName", handler.filename)
                    .addAttribute("append", handler.append);
            } else {
                appender = builder.newAppender(handler.id, "Console")
                    .addAttribute("target", handler.target);
            }
            String pattern = handler.formatter == null ? DEFAULT_PATTERN : formatters.get(handler.formatter);
            appender.add(builder.newLayout("PatternLayout").addAttribute("pattern", pattern));
            builder.add(appender);
        }

        for (LoggerSpec spec : loggers.values()) {
            LoggerComponentBuilder logger = spec.level == null
                ? builder.newLogger(spec.name)
                : builder.newLogger(spec.name, spec.level);
            for (String ref : spec.handlers) {
                logger.add(appenderRef(builder, ref));
            }
            logger.addAttribute("additivity", spec.propagate);
            builder.add(logger);
        }

        LoggerSpec rootSpec = root != null ? root : LoggerSpec.defaultRoot();
        RootLoggerComponentBuilder rootLogger = builder.newRootLogger(rootSpec.level == null ? Level.WARN : rootSpec.level);
        for (String ref : rootSpec.handlers) {
            rootLogger.add(appenderRef(builder, ref));
        }
        builder.add(rootLogger);

        return builder.build(false);
    }

    private AppenderRefComponentBuilder appenderRef(ConfigurationBuilder<BuiltConfiguration> builder, String ref) {
        AppenderRefComponentBuilder appenderRef = builder.newAppenderRef(ref);
        Level threshold = handlers.get(ref).level;
        if (threshold != null) {
            appenderRef.addAttribute("level", threshold);
        }
        return appenderRef;
    }

    public Map<String, String> getFormatters() {
        return formatters;
    }

    public Map<String, HandlerSpec> getHandlers() {
        return handlers;
    }

    public Map<String, LoggerSpec> getLoggers() {
        return loggers;
    }

    /**
     * @return the root logger settings, or null if the settings have no root section
     */
    public LoggerSpec getRoot() {
        return root;
    }

    /**
     * Parses a level name.
     *
     * @param value a level name, case-insensitive
     * @param path the settings entry, for error messages
     * @return the level
     * @throws InvalidLoggingSettingsException if the name is not a level
     */
    static Level parseLevel(Object value, String path) {
        String name = requireString(value, path).strip().toUpperCase(Locale.ROOT);
        switch (name) {
            case "WARNING":
                return Level.WARN;
            case "CRITICAL":
                return Level.FATAL;
            case "NOTSET":
                return Level.ALL;
            default:
                Level level = Level.getLevel(name);
                if (level == null) {
                    throw new InvalidLoggingSettingsException(path, "unknown level '" + value + "'");
                }
                return level;
        }
    }

    /**
     * Returns a Log4j pattern for a format. A format with Python {@code %(field)s} references
     * has them replaced by the matching pattern converters and gets a trailing line break;
     * any other format is already a Log4j pattern and is returned unchanged.
     */
    static String toPattern(String format, String path) {
        if (!format.contains("%(")) {
            return format;
        }
        Matcher matcher = PYTHON_FIELD.matcher(format);
        StringBuilder pattern = new StringBuilder();
        while (matcher.find()) {
            String converter = PYTHON_FIELDS.get(matcher.group(1));
            if (converter == null) {
                throw new InvalidLoggingSettingsException(path, "unsupported format field '" + matcher.group(1) + "'");
            }
            matcher.appendReplacement(pattern, Matcher.quoteReplacement(converter));
        }
        matcher.appendTail(pattern);
        return pattern.append("%n").toString();
    }

    private static Map<String, Map<?, ?>> sections(Map<?, ?> settings, String group) {
        Object value = settings.get(group);
        Map<String, Map<?, ?>> result = new LinkedHashMap<>();
        if (value == null) {
            return result;
        }
        for (Map.Entry<?, ?> entry : requireMap(value, group).entrySet()) {
            String id = String.valueOf(entry.getKey());
            Object section = entry.getValue();
            result.put(id, section == null ? Collections.emptyMap() : requireMap(section, group + "." + id));
        }
        return result;
    }

    private static Map<?, ?> requireMap(Object value, String path) {
        if (!(value instanceof Map)) {
            throw new InvalidLoggingSettingsException(path, "expected a mapping but found " + describe(value));
        }
        return (Map<?, ?>) value;
    }

    private static String requireString(Object value, String path) {
        if (!(value instanceof String)) {
            throw new InvalidLoggingSettingsException(path, "expected a string but found " + describe(value));
        }
        return (String) value;
    }

    private static boolean parseBoolean(Object value, String path) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = requireString(value, path).strip().toLowerCase(Locale.ROOT);
        switch (text) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return true;
            case "false":
            case "no":
            case "off":
            case "0":
                return false;
            default:
                throw new InvalidLoggingSettingsException(path, "expected a boolean but found '" + value + "'");
        }
    }

    private static List<String> parseNames(Object value, String path) {
        List<String> names = new ArrayList<>();
        if (value == null) {
            return names;
        }
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                names.add(requireString(item, path).strip());
            }
        } else {
            for (String part : requireString(value, path).split(",")) {
                if (!part.isBlank()) {
                    names.add(part.strip());
                }
            }
        }
        return names;
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    /**
     * One output destination, with its layout pattern reference and optional threshold.
     */
    public static final class HandlerSpec {
        private final String id;
        private final HandlerType type;
        private final String formatter;
        private final Level level;
        private final String target;
        private final String filename;
        private final boolean append;

        private HandlerSpec(String id, HandlerType type, String formatter, Level level, String target,
                            String filename, boolean append) {
            this.id = id;
            this.type = type;
            this.formatter = formatter;
            this.level = level;
            this.target = target;
            this.filename = filename;
            this.append = append;
        }

        static HandlerSpec from(String id, Map<?, ?> section, Map<String, String> formatters) {
            String path = HANDLERS + "." + id;

            Object typeName = section.get("class");
            if (typeName == null) {
                throw new InvalidLoggingSettingsException(path + ".class", "is required");
            }
            HandlerType type = parseType(requireString(typeName, path + ".class"), path + ".class");

            String formatter = null;
            if (section.get("formatter") != null) {
                formatter = requireString(section.get("formatter"), path + ".formatter");
                if (!formatters.containsKey(formatter)) {
                    throw new InvalidLoggingSettingsException(path + ".formatter",
                        "unknown formatter '" + formatter + "'");
                }
            }

            Level level = section.get("level") == null ? null : parseLevel(section.get("level"), path + ".level");

            String target = "SYSTEM_ERR";
            String filename = null;
            boolean append = true;
            if (type == HandlerType.CONSOLE) {
                if (section.get("stream") != null) {
                    target = parseTarget(requireString(section.get("stream"), path + ".stream"), path + ".stream");
                }
            } else {
                if (section.get("filename") == null) {
                    throw new InvalidLoggingSettingsException(path + ".filename", "is required for file handlers");
                }
                filename = requireString(section.get("filename"), path + ".filename");
                if (section.get("append") != null) {
                    append = parseBoolean(section.get("append"), path + ".append");
                }
            }
            return new HandlerSpec(id, type, formatter, level, target, filename, append);
        }

        private static HandlerType parseType(String name, String path) {
            switch (name.strip()) {
                case "console":
                case "stream":
                case "StreamHandler":
                case "logging.StreamHandler":
                    return HandlerType.CONSOLE;
                case "file":
                case "FileHandler":
                case "logging.FileHandler":
                    return HandlerType.FILE;
                default:
                    throw new InvalidLoggingSettingsException(path, "unknown handler class '" + name + "'");
            }
        }

        private static String parseTarget(String stream, String path) {
            switch (stream.strip()) {
                case "stdout":
                case "ext://sys.stdout":
                    return "SYSTEM_OUT";
                case "stderr":
                case "ext://sys.stderr":
                    return "SYSTEM_ERR";
                default:
                    throw new InvalidLoggingSettingsException(path, "unknown stream '" + stream + "'");
            }
        }

        public String getId() {
            return id;
        }

        public HandlerType getType() {
            return type;
        }

        public String getFormatter() {
            return formatter;
        }

        public Level getLevel() {
            return level;
        }

        public String getFilename() {
            return filename;
        }
    }

    /**
     * Level, handlers and propagation for one named logger, or for the root logger.
     */
    public static final class LoggerSpec {
        private final String name;
        private final Level level;
        private final List<String> handlers;
        private final boolean propagate;

        private LoggerSpec(String name, Level level, List<String> handlers, boolean propagate) {
            this.name = name;
            this.level = level;
            this.handlers = Collections.unmodifiableList(handlers);
            this.propagate = propagate;
        }

        static LoggerSpec defaultRoot() {
            return new LoggerSpec(ROOT, null, new ArrayList<>(), true);
        }

        static LoggerSpec from(String path, Map<?, ?> section, Map<String, HandlerSpec> handlers) {
            String name = path.startsWith(LOGGERS + ".") ? path.substring(LOGGERS.length() + 1) : path;
            Level level = section.get("level") == null ? null : parseLevel(section.get("level"), path + ".level");
            List<String> refs = parseNames(section.get(HANDLERS), path + "." + HANDLERS);
            for (String ref : refs) {
                if (!handlers.containsKey(ref)) {
                    throw new InvalidLoggingSettingsException(path + "." + HANDLERS, "unknown handler '" + ref + "'");
                }
            }
            boolean propagate = section.get("propagate") == null || parseBoolean(section.get("propagate"), path + ".propagate");
            return new LoggerSpec(name, level, refs, propagate);
        }

        public String getName() {
            return name;
        }

        public Level getLevel() {
            return level;
        }

        public List<String> getHandlers() {
            return handlers;
        }

        public boolean isPropagate() {
            return propagate;
        }
    }
}
