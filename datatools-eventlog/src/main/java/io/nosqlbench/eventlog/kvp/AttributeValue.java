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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A single attribute value attached to an event or activity record. Values are one of
 * a fixed set of kinds so that encoding stays predictable regardless of what the caller
 * passes in.
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @see Attributes
 * @see KeyValueEncoder
 * @since 1.0.0
 */
public final class AttributeValue {

    /**
     * The kinds of value an attribute may hold.
     */
    public enum Kind {
        INTEGER,
        FLOAT,
        BOOLEAN,
        STRING,
        NULL
    }

    private static final AttributeValue NULL_VALUE = new AttributeValue(Kind.NULL, null);
    private static final AttributeValue TRUE_VALUE = new AttributeValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final AttributeValue FALSE_VALUE = new AttributeValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private AttributeValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static AttributeValue of(long value) {
        return new AttributeValue(Kind.INTEGER, value);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(Kind.FLOAT, value);
    }

    public static AttributeValue of(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    /**
     * Creates a one-character string value. Without this overload a {@code char} would
     * widen to {@code long} and encode as its code point.
     */
    public static AttributeValue of(char value) {
        return new AttributeValue(Kind.STRING, String.valueOf(value));
    }

    /**
     * Creates a string value, or the null value when {@code value} is null.
     *
     * @param value the string content
     * @return a STRING value, or the NULL value
     */
    public static AttributeValue of(String value) {
        return value == null ? NULL_VALUE : new AttributeValue(Kind.STRING, value);
    }

    public static AttributeValue ofNull() {
        return NULL_VALUE;
    }

    /**
     * Converts an arbitrary object into an attribute value. Integral numbers become
     * {@link Kind#INTEGER}, other numbers become {@link Kind#FLOAT}, char sequences
     * and characters become {@link Kind#STRING}.
     *
     * @param value the object to convert, may be null
     * @return the matching attribute value
     * @throws IllegalArgumentException if the object's type has no attribute kind, or an
     *                                  integral value does not fit in a {@code long}
     */
    public static AttributeValue of(Object value) {
        if (value == null) {
            return NULL_VALUE;
        }
        if (value instanceof AttributeValue) {
            return (AttributeValue) value;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return of(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            try {
                return of(((BigInteger) value).longValueExact());
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Integer attribute value " + value + " is outside the long range", e);
            }
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return of(((Boolean) value).booleanValue());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return of(value.toString());
        }
        throw new IllegalArgumentException(
            "Unsupported attribute value type " + value.getClass().getName()
                + ", expected an integer, float, boolean, string or null");
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Returns the string content of a STRING value.
     *
     * @return the string content
     * @throws IllegalStateException if this value is not a string
     */
    public String asString() {
        if (kind != Kind.STRING) {
            throw new IllegalStateException("Attribute value of kind " + kind + " is not a string");
        }
        return (String) value;
    }

    /**
     * @return the boxed value, or null for the NULL kind
     */
    public Object getValue() {
        return value;
    }

    /**
     * Renders this value the way Java would print it, without any escaping. Strings are
     * returned as-is, the NULL kind renders as {@code null}.
     *
     * @return the natural string form of the value
     */
    public String render() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeValue)) {
            return false;
        }
        AttributeValue that = (AttributeValue) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
