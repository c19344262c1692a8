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

package io.nosqlbench.eventlog.kvp;

import io.nosqlbench.eventlog.format.Separators;

import java.util.Map;
import java.util.Objects;

/**
 * Serializes an {@link Attributes} set into the key/value section of a log line.
 *
 * <p>Rendering rules:</p>
 * <ul>
 *   <li>Each attribute becomes {@code name=value}; pairs are joined with the pair separator.</li>
 *   <li>A string value that contains the pair separator has a backslash inserted before
 *       every comma: {@code a,b} encodes as {@code a\,b}.</li>
 *   <li>An empty string encodes as the two characters {@code ''}, so an empty value can be
 *       told apart from a missing attribute.</li>
 *   <li>Every other value encodes via {@link AttributeValue#render()}.</li>
 * </ul>
 *
 * <p>An empty set encodes to the empty string. Names are written as given.</p>
 *
 * <p>The escape always targets commas, even when {@link Separators} uses a different pair
 * separator. Output for values holding a non-default separator is not guaranteed to
 * split back cleanly.</p>
 *
 * <p>This class is immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class KeyValueEncoder {

    public static final String EMPTY_STRING_VALUE = "''";

    private static final KeyValueEncoder DEFAULT = new KeyValueEncoder(Separators.DEFAULT);

    private final Separators separators;

    public KeyValueEncoder(Separators separators) {
        this.separators = Objects.requireNonNull(separators, "separators");
    }

    public static KeyValueEncoder getDefault() {
        return DEFAULT;
    }

    public Separators getSeparators() {
        return separators;
    }

    /**
     * Encodes the attributes as a single fragment.
     *
     * @param attributes the attributes, may be null
     * @return the encoded fragment, or an empty string when there is nothing to encode
     */
    public String encode(Attributes attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, AttributeValue> entry : attributes) {
            if (sb.length() > 0) {
                sb.append(separators.getPair());
            }
            sb.append(entry.getKey())
                .append(separators.getKeyValue())
                .append(encodeValue(entry.getValue()));
        }
        return sb.toString();
    }

    /**
     * Encodes one value according to the rules in the class documentation.
     *
     * @param value the value to encode
     * @return the encoded value
     */
    public String encodeValue(AttributeValue value) {
        if (value == null) {
            return AttributeValue.ofNull().render();
        }
        if (!value.isString()) {
            return value.render();
        }
        String text = value.asString();
        if (text.contains(separators.getPair())) {
            // the escaped character is always a comma, whatever the pair separator is
            return text.replace(",", "\\,");
        }
        if (text.isEmpty()) {
            return EMPTY_STRING_VALUE;
        }
        return text;
    }
}
