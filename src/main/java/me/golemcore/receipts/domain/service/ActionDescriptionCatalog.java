package me.golemcore.receipts.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.receipts.domain.model.ActionType;
import me.golemcore.receipts.domain.model.ToolActionDescriptor;
import me.golemcore.receipts.security.SensitiveDataRedactor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Lookup table from {@link ActionType} to the endpoint and outcome texts
 * describing an action. Every tag has an entry; construction fails otherwise.
 */
public class ActionDescriptionCatalog {

    /**
     * @param method
     *            HTTP-style verb of the endpoint text
     * @param outcome
     *            produces the expected-outcome text from a descriptor view whose
     *            parameters are already redacted
     */
    public record ActionDescription(String method, Function<ToolActionDescriptor, String> outcome) {
    }

    private final SensitiveDataRedactor redactor;
    private final Map<ActionType, ActionDescription> descriptions;

    public ActionDescriptionCatalog(SensitiveDataRedactor redactor) {
        this.redactor = redactor;
        Map<ActionType, ActionDescription> table = new EnumMap<>(ActionType.class);
        table.put(ActionType.CREATE, new ActionDescription("POST",
                d -> "Create " + subject(d) + " in " + d.toolName()));
        table.put(ActionType.READ, new ActionDescription("GET",
                d -> "Retrieve " + subject(d) + " from " + d.toolName()));
        table.put(ActionType.UPDATE, new ActionDescription("PATCH",
                d -> "Update " + subject(d) + " in " + d.toolName()));
        table.put(ActionType.DELETE, new ActionDescription("DELETE",
                d -> "Delete " + subject(d) + " from " + d.toolName()));
        table.put(ActionType.SEND, new ActionDescription("POST",
                d -> "Send " + subject(d) + " via " + d.toolName() + recipient(d)));
        table.put(ActionType.SEARCH, new ActionDescription("GET",
                d -> "Search " + d.toolName() + " for " + subject(d)));
        table.put(ActionType.PAYMENT, new ActionDescription("POST",
                d -> "Process " + subject(d) + " through " + d.toolName()));
        table.put(ActionType.OTHER, new ActionDescription("POST",
                d -> "Execute " + d.actionType() + " on " + d.toolName()));

        for (ActionType type : ActionType.values()) {
            if (!table.containsKey(type)) {
                throw new IllegalStateException("No description for action type " + type);
            }
        }
        this.descriptions = Collections.unmodifiableMap(table);
    }

    public ActionDescription describe(ActionType type) {
        return descriptions.get(type);
    }

    /**
     * Endpoint text, e.g. {@code PATCH /hubspot/update_lead}.
     */
    public String endpoint(ToolActionDescriptor descriptor) {
        ActionDescription description = describe(ActionType.resolve(descriptor.actionType()));
        return description.method() + " /" + descriptor.toolName() + "/" + descriptor.actionType();
    }

    public String expectedOutcome(ToolActionDescriptor descriptor) {
        ToolActionDescriptor redacted = descriptor.toBuilder()
                .parameters(redactor.redactParameters(descriptor.parameters()))
                .build();
        return describe(ActionType.resolve(descriptor.actionType())).outcome().apply(redacted);
    }

    /**
     * Returns the descriptor with a generated expected outcome when the caller
     * supplied none.
     */
    public ToolActionDescriptor complete(ToolActionDescriptor descriptor) {
        if (descriptor.expectedOutcome() != null && !descriptor.expectedOutcome().isBlank()) {
            return descriptor;
        }
        return descriptor.toBuilder().expectedOutcome(expectedOutcome(descriptor)).build();
    }

    private static String subject(ToolActionDescriptor descriptor) {
        return descriptor.actionType().toLowerCase(Locale.ROOT).replace('_', ' ').trim();
    }

    private static String recipient(ToolActionDescriptor descriptor) {
        Object to = descriptor.parameters().get("to");
        return to != null ? " to " + to : "";
    }
}
