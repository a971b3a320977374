package me.golemcore.receipts.domain.model;

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

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one tool invocation made by an agent. Immutable once built.
 *
 * @param toolName
 *            tool identity, e.g. "hubspot"
 * @param actionType
 *            free-form action, e.g. "update_lead"
 * @param parameters
 *            invocation arguments; never copied into receipts
 * @param userIntent
 *            what the user asked for
 * @param expectedOutcome
 *            human-readable expected result
 * @param businessContext
 *            business framing of the action
 * @param toolCategory
 *            tool family
 * @param riskLevel
 *            risk level in [1, 10]
 * @param complianceRequirements
 *            compliance regime identifiers, e.g. "GDPR", "SOX"
 * @param dataClassification
 *            sensitivity tier of the touched data
 */
@Builder(toBuilder = true)
public record ToolActionDescriptor(
        String toolName,
        String actionType,
        Map<String, Object> parameters,
        String userIntent,
        String expectedOutcome,
        BusinessContext businessContext,
        ToolCategory toolCategory,
        int riskLevel,
        List<String> complianceRequirements,
        DataClassification dataClassification
) {
    public static final int MIN_RISK_LEVEL = 1;
    public static final int MAX_RISK_LEVEL = 10;

    public ToolActionDescriptor {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(actionType, "actionType must not be null");
        Objects.requireNonNull(businessContext, "businessContext must not be null");
        if (riskLevel < MIN_RISK_LEVEL || riskLevel > MAX_RISK_LEVEL) {
            throw new IllegalArgumentException("riskLevel must be within [1,10]: " + riskLevel);
        }
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
        complianceRequirements = complianceRequirements != null ? List.copyOf(complianceRequirements) : List.of();
        toolCategory = toolCategory != null ? toolCategory : ToolCategory.OTHER;
        dataClassification = dataClassification != null ? dataClassification : DataClassification.INTERNAL;
    }
}
