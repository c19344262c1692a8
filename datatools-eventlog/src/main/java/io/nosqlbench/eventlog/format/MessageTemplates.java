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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The fixed template set for one {@link TemplateMode} and one set of {@link Separators}.
 *
 * <p>With the default separators the templates are:</p>
 * <table>
 *   <caption>Templates by shape</caption>
 *   <tr><th>Shape</th><th>WITHOUT_TIMESTAMP</th></tr>
 *   <tr><td>ENTRY</td><td>{@code {func_name}.begin ; {kvp}}</td></tr>
 *   <tr><td>EXIT</td><td>{@code {func_name}.end ({dur}) ; {kvp}}</td></tr>
 *   <tr><td>EXIT_NO_DURATION</td><td>{@code {func_name}.end ; {kvp}}</td></tr>
 *   <tr><td>EVENT</td><td>{@code {func_name} ; {kvp}}</td></tr>
 * </table>
 *
 * <p>In {@link TemplateMode#WITH_TIMESTAMP} every template is prefixed with
 * {@code {timestamp} }, so every line starts with its timestamp and a space.</p>
 *
 * @since 1.0.0
 */
public final class MessageTemplates {

    private static final MessageTemplates WITH_TIMESTAMP_DEFAULT =
        new MessageTemplates(TemplateMode.WITH_TIMESTAMP, Separators.DEFAULT);
    private static final MessageTemplates WITHOUT_TIMESTAMP_DEFAULT =
        new MessageTemplates(TemplateMode.WITHOUT_TIMESTAMP, Separators.DEFAULT);

    private final TemplateMode mode;
    private final Separators separators;
    private final Map<MessageShape, MessageTemplate> templates;

    private MessageTemplates(TemplateMode mode, Separators separators) {
        this.mode = mode;
        this.separators = separators;

        String prefix = mode.includesTimestamp() ? "{" + MessageTemplate.TIMESTAMP + "} " : "";
        String name = "{" + MessageTemplate.NAME + "}";
        String kvpSection = literal(separators.getSection()) + "{" + MessageTemplate.KVP + "}";

        Map<MessageShape, MessageTemplate> byShape = new EnumMap<>(MessageShape.class);
        byShape.put(MessageShape.ENTRY,
            MessageTemplate.parse(prefix + name + ".begin" + kvpSection));
        byShape.put(MessageShape.EXIT,
            MessageTemplate.parse(prefix + name + ".end ({" + MessageTemplate.DURATION + "})" + kvpSection));
        byShape.put(MessageShape.EXIT_NO_DURATION,
            MessageTemplate.parse(prefix + name + ".end" + kvpSection));
        byShape.put(MessageShape.EVENT,
            MessageTemplate.parse(prefix + name + kvpSection));
        this.templates = Collections.unmodifiableMap(byShape);
    }

    private static String literal(String text) {
        return text.replace("{", "{{").replace("}", "}}");
    }

    public static MessageTemplates of(TemplateMode mode) {
        return of(mode, Separators.DEFAULT);
    }

    public static MessageTemplates of(TemplateMode mode, Separators separators) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(separators, "separators");
        if (separators.equals(Separators.DEFAULT)) {
            return mode.includesTimestamp() ? WITH_TIMESTAMP_DEFAULT : WITHOUT_TIMESTAMP_DEFAULT;
        }
        return new MessageTemplates(mode, separators);
    }

    public MessageTemplate templateFor(MessageShape shape) {
        return templates.get(Objects.requireNonNull(shape, "shape"));
    }

    public TemplateMode getMode() {
        return mode;
    }

    public Separators getSeparators() {
        return separators;
    }
}
