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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MessageTemplatesTest {

    private static final Map<String, String> VALUES = Map.of(
        MessageTemplate.NAME, "job",
        MessageTemplate.KVP, "k1=v1,k2=v2",
        MessageTemplate.DURATION, "0.250000",
        MessageTemplate.TIMESTAMP, "2024-05-01T10:15:30.123456",
        MessageTemplate.STATUS, "0");

    @Test
    void plainTemplatesMatchWireFormat() {
        MessageTemplates templates = MessageTemplates.of(TemplateMode.WITHOUT_TIMESTAMP);

        assertThat(render(templates, MessageShape.ENTRY)).isEqualTo("job.begin ; k1=v1,k2=v2");
        assertThat(render(templates, MessageShape.EXIT)).isEqualTo("job.end (0.250000) ; k1=v1,k2=v2");
        assertThat(render(templates, MessageShape.EXIT_NO_DURATION)).isEqualTo("job.end ; k1=v1,k2=v2");
        assertThat(render(templates, MessageShape.EVENT)).isEqualTo("job ; k1=v1,k2=v2");
    }

    @Test
    void everyTimestampedTemplateStartsWithTheTimestamp() {
        MessageTemplates templates = MessageTemplates.of(TemplateMode.WITH_TIMESTAMP);

        for (MessageShape shape : MessageShape.values()) {
            assertThat(render(templates, shape))
                .as("shape %s", shape)
                .startsWith("2024-05-01T10:15:30.123456 job");
        }
        assertThat(render(templates, MessageShape.EXIT))
            .isEqualTo("2024-05-01T10:15:30.123456 job.end (0.250000) ; k1=v1,k2=v2");
    }

    @Test
    void onlyExitUsesDuration() {
        MessageTemplates templates = MessageTemplates.of(TemplateMode.WITH_TIMESTAMP);

        assertThat(templates.templateFor(MessageShape.EXIT).uses(MessageTemplate.DURATION)).isTrue();
        assertThat(templates.templateFor(MessageShape.EXIT_NO_DURATION).uses(MessageTemplate.DURATION)).isFalse();
        assertThat(templates.templateFor(MessageShape.ENTRY).uses(MessageTemplate.DURATION)).isFalse();
        assertThat(templates.templateFor(MessageShape.EVENT).uses(MessageTemplate.DURATION)).isFalse();
    }

    @Test
    void defaultSetsAreShared() {
        assertThat(MessageTemplates.of(TemplateMode.WITHOUT_TIMESTAMP))
            .isSameAs(MessageTemplates.of(TemplateMode.WITHOUT_TIMESTAMP, Separators.DEFAULT));
    }

    @Test
    void sectionSeparatorIsTakenLiterally() {
        MessageTemplates templates = MessageTemplates.of(TemplateMode.WITHOUT_TIMESTAMP,
            new Separators(" {} ", ",", "="));

        assertThat(render(templates, MessageShape.EVENT)).isEqualTo("job {} k1=v1,k2=v2");
    }

    private static String render(MessageTemplates templates, MessageShape shape) {
        return templates.templateFor(shape).render(VALUES);
    }
}
