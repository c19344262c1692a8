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
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeyValueEncoderTest {

    private final KeyValueEncoder encoder = KeyValueEncoder.getDefault();

    @Test
    void emptySetEncodesToEmptyString() {
        assertEquals("", encoder.encode(Attributes.empty()));
        assertEquals("", encoder.encode(null));
    }

    @Test
    void pairsJoinedInInsertionOrder() {
        Attributes attrs = Attributes.builder()
            .put("file", "base.fvec")
            .put("n", 5)
            .put("ratio", 0.25)
            .put("cached", false)
            .putNull("owner")
            .build();

        assertEquals("file=base.fvec,n=5,ratio=0.25,cached=false,owner=null", encoder.encode(attrs));
    }

    @Test
    void commasInStringValuesAreEscaped() {
        assertEquals("dims=a\\,b\\,c", encoder.encode(Attributes.of("dims", "a,b,c")));
    }

    @Test
    void emptyStringRendersAsTwoQuotes() {
        assertEquals("note=''", encoder.encode(Attributes.of("note", "")));
        assertNotEquals(encoder.encodeValue(AttributeValue.of("")), encoder.encodeValue(AttributeValue.of("''x")));
    }

    @Test
    void emptyStringIsDistinctFromMissingAttribute() {
        String withEmpty = encoder.encode(Attributes.of("a", 1, "note", ""));
        String without = encoder.encode(Attributes.of("a", 1));
        assertEquals("a=1,note=''", withEmpty);
        assertEquals("a=1", without);
    }

    @Test
    void nonStringValuesUseNaturalRendering() {
        assertEquals("-3", encoder.encodeValue(AttributeValue.of(-3)));
        assertEquals("1.5", encoder.encodeValue(AttributeValue.of(1.5)));
        assertEquals("true", encoder.encodeValue(AttributeValue.of(true)));
        assertEquals("null", encoder.encodeValue(AttributeValue.ofNull()));
    }

    @Test
    void namesAreNotEscaped() {
        assertEquals("a b=x", encoder.encode(Attributes.of("a b", "x")));
    }

    @Test
    void splittingRecoversPairsWhenNoValueHoldsAComma() {
        Attributes attrs = Attributes.builder()
            .put("host", "db-01")
            .put("port", 9042)
            .put("ok", true)
            .put("path", "/var/lib/data")
            .build();

        String encoded = encoder.encode(attrs);

        Map<String, String> recovered = new HashMap<>();
        for (String pair : encoded.split(",")) {
            String[] kv = pair.split("=", 2);
            recovered.put(kv[0], kv[1]);
        }
        Map<String, String> expected = new HashMap<>();
        for (Map.Entry<String, AttributeValue> entry : attrs) {
            expected.put(entry.getKey(), entry.getValue().render());
        }
        assertEquals(expected, recovered);
    }

    @Test
    void customSeparatorsShapeTheFragment() {
        KeyValueEncoder custom = new KeyValueEncoder(new Separators(" | ", ";", ":"));
        assertEquals("a:1;b:two", custom.encode(Attributes.of("a", 1, "b", "two")));
    }

    @Test
    void customPairSeparatorStillEscapesCommas() {
        KeyValueEncoder custom = new KeyValueEncoder(new Separators(" | ", ";", ":"));
        // escaping triggers on the pair separator but always escapes commas
        assertEquals("x\\,y;z", custom.encodeValue(AttributeValue.of("x,y;z")));
        assertEquals("x,y", custom.encodeValue(AttributeValue.of("x,y")));
    }
}
