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

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable audit record of one governed tool invocation. Field names are the
 * persisted JSON layout consumed by export tooling and must stay stable.
 */
@Builder
public record Receipt(
        String receiptId,
        String agentId,
        String toolName,
        String actionType,
        Instant timestamp,
        ToolCategory toolCategory,
        int riskLevel,
        List<String> complianceRequirements,
        DataClassification dataClassification,
        ComplianceStatus complianceStatus,
        ExecutionMetadata executionMetadata,
        List<String> relatedReceipts,
        BusinessImpact businessImpact
) {
    public Receipt {
        Objects.requireNonNull(receiptId, "receiptId must not be null");
        Objects.requireNonNull(executionMetadata, "executionMetadata must not be null");
        complianceRequirements = complianceRequirements != null ? List.copyOf(complianceRequirements) : List.of();
        relatedReceipts = relatedReceipts != null ? List.copyOf(relatedReceipts) : List.of();
    }
}
