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

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, insertion-ordered set of named attributes to attach to an event or
 * activity record. Names are unique within a set; putting a name twice keeps the last
 * value in the position of the first.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Attributes attrs = Attributes.builder()
 *     .put("file", "data.fvec")
 *     .put("n", 5)
 *     .put("ratio", 0.25)
 *     .put("cached", false)
 *     .build();
 *
 * Attributes one = Attributes.of("method", "dictConfig");
 * Attributes more = one.with("attempt", 2);
 * }</pre>
 *
 * <p>Attribute names are not escaped by {@link KeyValueEncoder}; callers supply names
 * that do not contain the configured separators.</p>
 *
 * @see AttributeValue
 * @see KeyValueEncoder
 * @since 1.0.0
 */
public final class Attributes implements Iterable<Map.Entry<String, AttributeValue>> {

    private static final Attributes EMPTY = new Attributes(Collections.emptyMap());

    private final Map<String, AttributeValue> entries;

    private Attributes(Map<String, AttributeValue> entries) {
        this.entries = entries;
    }

    public static Attributes empty() {
        return EMPTY;
    }

    public static Attributes of(String name, Object value) {
        return builder().put(name, value).build();
    }

    public static Attributes of(String name1, Object value1, String name2, Object value2) {
        return builder().put(name1, value1).put(name2, value2).build();
    }

    public static Attributes of(String name1, Object value1, String name2, Object value2,
                                String name3, Object value3) {
        return builder().put(name1, value1).put(name2, value2).put(name3, value3).build();
    }

    /**
     * Copies a map of plain Java values into an attribute set, converting each value with
     * {@link AttributeValue#of(Object)}. Iteration order of the map is preserved.
     *
     * @param values the values to copy
     * @return a new attribute set
     * @throws IllegalArgumentException if a value has an unsupported type
     */
    public static Attributes fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            builder.put(entry.getKey(), (Object) entry.getValue());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of this set with one attribute added or replaced.
     */
    public Attributes with(String name, Object value) {
        return toBuilder().put(name, value).build();
    }

    /**
     * Returns a copy of this set with all attributes of {@code other} added. Entries of
     * {@code other} replace entries of the same name.
     *
     * @param other the attributes to add
     * @return the merged set
     */
    public Attributes merge(Attributes other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Builder builder = toBuilder();
        for (Map.Entry<String, AttributeValue> entry : other) {
            builder.put(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(entries);
        return builder;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * @param name the attribute name
     * @return the value, or null if no attribute has that name
     */
    public AttributeValue get(String name) {
        return entries.get(name);
    }

    public Set<String> names() {
        return entries.keySet();
    }

    public Map<String, AttributeValue> asMap() {
        return entries;
    }

    @Override
    public Iterator<Map.Entry<String, AttributeValue>> iterator() {
        return entries.entrySet().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Attributes)) {
            return false;
        }
        return entries.equals(((Attributes) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Attributes" + entries;
    }

    /**
     * Mutable builder for {@link Attributes}. Not thread-safe.
     */
    public static final class Builder {
        private final Map<String, AttributeValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, AttributeValue value) {
            values.put(Objects.requireNonNull(name, "name"), Objects.requireNonNullElse(value, AttributeValue.ofNull()));
            return this;
        }

        public Builder put(String name, long value) {
            return put(name, AttributeValue.of(value));
        }

        public Builder put(String name, double value) {
            return put(name, AttributeValue.of(value));
        }

        public Builder put(String name, boolean value) {
            return put(name, AttributeValue.of(value));
        }

        public Builder put(String name, char value) {
            return put(name, AttributeValue.of(value));
        }

        public Builder put(String name, String value) {
            return put(name, AttributeValue.of(value));
        }

        /**
         * Adds a value of any supported type.
         *
         * @throws IllegalArgumentException if the value's type is not supported
         * @see AttributeValue#of(Object)
         */
        public Builder put(String name, Object value) {
            return put(name, AttributeValue.of(value));
        }

        public Builder putNull(String name) {
            return put(name, AttributeValue.ofNull());
        }

        public Attributes build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new Attributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
