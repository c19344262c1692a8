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

import java.util.Objects;

/**
 * The three separators used to lay out a log line:
 * <pre>
 *   name.begin ; k1=v1,k2=v2
 *             ^^^  ^     ^
 *          section kv   pair
 * </pre>
 *
 * <p>Only {@link #DEFAULT} is fully specified. Escaping in
 * {@link io.nosqlbench.eventlog.kvp.KeyValueEncoder} always escapes a literal comma, so
 * a custom pair separator changes when escaping happens but not which character gets
 * escaped.</p>
 *
 * @since 1.0.0
 */
public final class Separators {

    public static final String DEFAULT_SECTION = " ; ";
    public static final String DEFAULT_PAIR = ",";
    public static final String DEFAULT_KEY_VALUE = "=";

    public static final Separators DEFAULT = new Separators(DEFAULT_SECTION, DEFAULT_PAIR, DEFAULT_KEY_VALUE);

    private final String section;
    private final String pair;
    private final String keyValue;

    public Separators(String section, String pair, String keyValue) {
        this.section = requireNonEmpty(section, "section");
        this.pair = requireNonEmpty(pair, "pair");
        this.keyValue = requireNonEmpty(keyValue, "keyValue");
    }

    private static String requireNonEmpty(String value, String what) {
        Objects.requireNonNull(value, what);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(what + " separator must not be empty");
        }
        return value;
    }

    /** Between the templated prefix and the key/value section. */
    public String getSection() {
        return section;
    }

    /** Between one key=value pair and the next. */
    public String getPair() {
        return pair;
    }

    /** Between a key and its value. */
    public String getKeyValue() {
        return keyValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Separators)) {
            return false;
        }
        Separators that = (Separators) o;
        return section.equals(that.section) && pair.equals(that.pair) && keyValue.equals(that.keyValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(section, pair, keyValue);
    }

    @Override
    public String toString() {
        return "Separators{section='" + section + "', pair='" + pair + "', keyValue='" + keyValue + "'}";
    }
}
