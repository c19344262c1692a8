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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed message template with named placeholders, for example
 * {@code "{timestamp} {func_name}.end ({dur}) ; {kvp}"}.
 *
 * <h2>Placeholders</h2>
 * <ul>
 *   <li>{@value #NAME} - the event or activity name</li>
 *   <li>{@value #KVP} - the encoded attribute section</li>
 *   <li>{@value #DURATION} - elapsed seconds, only for activity ends with a start</li>
 *   <li>{@value #TIMESTAMP} - ISO-8601 time the line was formatted</li>
 *   <li>{@value #STATUS} - status code of an activity end</li>
 * </ul>
 *
 * <p>A doubled brace stands for a literal brace. Templates are parsed once, at
 * construction; an unknown placeholder or a stray brace is rejected there rather than
 * when a line is logged.</p>
 *
 * @since 1.0.0
 */
public final class MessageTemplate {

    public static final String NAME = "func_name";
    public static final String KVP = "kvp";
    public static final String DURATION = "dur";
    public static final String TIMESTAMP = "timestamp";
    public static final String STATUS = "status";

    private static final Set<String> KNOWN_PLACEHOLDERS = Set.of(NAME, KVP, DURATION, TIMESTAMP, STATUS);

    private final String pattern;
    private final List<Segment> segments;
    private final Set<String> placeholders;

    private MessageTemplate(String pattern, List<Segment> segments, Set<String> placeholders) {
        this.pattern = pattern;
        this.segments = segments;
        this.placeholders = placeholders;
    }

    /**
     * Parses a template.
     *
     * @param pattern the template text
     * @return the parsed template
     * @throws IllegalArgumentException if the pattern names an unknown placeholder or has unbalanced braces
     */
    public static MessageTemplate parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        List<Segment> segments = new ArrayList<>();
        Set<String> placeholders = new LinkedHashSet<>();
        StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '{') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = pattern.indexOf('}', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '{' at index " + i + " in template: " + pattern);
                }
                String name = pattern.substring(i + 1, close);
                if (!KNOWN_PLACEHOLDERS.contains(name)) {
                    throw new IllegalArgumentException(
                        "Unknown placeholder {" + name + "} in template: " + pattern
                            + ", known placeholders are " + KNOWN_PLACEHOLDERS);
                }
                if (literal.length() > 0) {
                    segments.add(Segment.literal(literal.toString()));
                    literal.setLength(0);
                }
                segments.add(Segment.placeholder(name));
                placeholders.add(name);
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("Single '}' at index " + i + " in template: " + pattern);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            segments.add(Segment.literal(literal.toString()));
        }
        return new MessageTemplate(pattern,
            Collections.unmodifiableList(segments),
            Collections.unmodifiableSet(placeholders));
    }

    /**
     * Fills in the placeholders. Values for placeholders the template does not use are ignored.
     *
     * @param values placeholder values by name
     * @return the rendered line
     * @throws IllegalArgumentException if the template uses a placeholder with no value
     */
    public String render(Map<String, String> values) {
        StringBuilder sb = new StringBuilder(pattern.length() + 64);
        for (Segment segment : segments) {
            if (segment.placeholder) {
                String value = values.get(segment.text);
                if (value == null) {
                    throw new IllegalArgumentException(
                        "No value for placeholder {" + segment.text + "} in template: " + pattern);
                }
                sb.append(value);
            } else {
                sb.append(segment.text);
            }
        }
        return sb.toString();
    }

    public boolean uses(String placeholder) {
        return placeholders.contains(placeholder);
    }

    public Set<String> getPlaceholders() {
        return placeholders;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageTemplate)) {
            return false;
        }
        return pattern.equals(((MessageTemplate) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }

    private static final class Segment {
        private final String text;
        private final boolean placeholder;

        private Segment(String text, boolean placeholder) {
            this.text = text;
            this.placeholder = placeholder;
        }

        static Segment literal(String text) {
            return new Segment(text, false);
        }

        static Segment placeholder(String name) {
            return new Segment(name, true);
        }
    }
}
