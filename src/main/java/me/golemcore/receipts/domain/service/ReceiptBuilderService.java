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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.model.BusinessImpact;
import me.golemcore.receipts.domain.model.ComplianceStatus;
import me.golemcore.receipts.domain.model.ErrorDetail;
import me.golemcore.receipts.domain.model.ExecutionMetadata;
import me.golemcore.receipts.domain.model.PerformanceMetrics;
import me.golemcore.receipts.domain.model.Receipt;
import me.golemcore.receipts.domain.model.ToolActionDescriptor;
import me.golemcore.receipts.security.SensitiveDataRedactor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Builds and persists the audit receipt of one tool invocation.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li>fill in the expected outcome from the {@link ActionDescriptionCatalog}
 * when the caller supplies none</li>
 * <li>synthesize execution metadata when the caller supplies none, redact it
 * otherwise</li>
 * <li>classify compliance</li>
 * <li>estimate business impact</li>
 * <li>resolve related receipts through the {@link RelatedReceiptStrategy}</li>
 * <li>persist through {@link ReceiptStore} and fire {@code receipt-created}</li>
 * </ol>
 */
@Slf4j
public class ReceiptBuilderService {

    public static final String CLASSIFICATION_ENGINE = "classification-engine";

    private static final String LOG_PREFIX = "[Receipts]";
    private static final String RECEIPT_ID_PREFIX = "rcpt_";
    private static final String EXECUTION_ID_PREFIX = "exec_";

    private final ActionClassifier classifier;
    private final BusinessImpactEstimator impactEstimator;
    private final ActionDescriptionCatalog descriptionCatalog;
    private final ReceiptStore receiptStore;
    private final RelatedReceiptStrategy relatedReceiptStrategy;
    private final PayloadSizeEstimator payloadSizeEstimator;
    private final ExtensionPointRegistry registry;
    private final SensitiveDataRedactor redactor;
    private final Duration defaultExecutionDuration;
    private final Clock clock;

    @SuppressWarnings("java:S107") // explicit wiring, see ReceiptsContext
    public ReceiptBuilderService(ActionClassifier classifier,
            BusinessImpactEstimator impactEstimator,
            ActionDescriptionCatalog descriptionCatalog,
            ReceiptStore receiptStore,
            RelatedReceiptStrategy relatedReceiptStrategy,
            PayloadSizeEstimator payloadSizeEstimator,
            ExtensionPointRegistry registry,
            SensitiveDataRedactor redactor,
            Duration defaultExecutionDuration,
            Clock clock) {
        this.classifier = classifier;
        this.impactEstimator = impactEstimator;
        this.descriptionCatalog = descriptionCatalog;
        this.receiptStore = receiptStore;
        this.relatedReceiptStrategy = relatedReceiptStrategy != null ? relatedReceiptStrategy
                : new NoRelatedReceiptStrategy();
        this.payloadSizeEstimator = payloadSizeEstimator;
        this.registry = registry;
        this.redactor = redactor;
        this.defaultExecutionDuration = defaultExecutionDuration;
        this.clock = clock;
        ReceiptExtensionPoints.registerAll(registry);
    }

    public CompletableFuture<Receipt> build(String agentId, ToolActionDescriptor descriptor,
            Object executionResult) {
        return build(agentId, descriptor, executionResult, null);
    }

    /**
     * Builds, persists and announces a receipt.
     *
     * @param executionMetadata
     *            may be {@code null}; metadata is then synthesized with the
     *            configured default duration
     * @return future of the stored receipt; fails with
     *         {@link PersistenceException} when the receipt could not be stored
     */
    public CompletableFuture<Receipt> build(String agentId, ToolActionDescriptor descriptor,
            Object executionResult, ExecutionMetadata executionMetadata) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Instant now = Instant.now(clock);
        ToolActionDescriptor described = descriptionCatalog.complete(descriptor);

        ExecutionMetadata execution = executionMetadata != null
                ? redactMetadata(executionMetadata)
                : synthesizeMetadata(descriptor, executionResult, now);
        ComplianceStatus compliance = classifier.classify(descriptor);
        BusinessImpact impact = impactEstimator.estimate(descriptor);

        return resolveRelatedReceipts(agentId, descriptor)
                .thenCompose(related -> receiptStore.save(Receipt.builder()
                        .receiptId(RECEIPT_ID_PREFIX + UUID.randomUUID())
                        .agentId(agentId)
                        .toolName(descriptor.toolName())
                        .actionType(descriptor.actionType())
                        .timestamp(now)
                        .toolCategory(descriptor.toolCategory())
                        .riskLevel(descriptor.riskLevel())
                        .complianceRequirements(descriptor.complianceRequirements())
                        .dataClassification(descriptor.dataClassification())
                        .complianceStatus(compliance)
                        .executionMetadata(execution)
                        .relatedReceipts(related)
                        .businessImpact(impact)
                        .build()))
                .thenApply(receipt -> {
                    announce(receipt, described);
                    log.info("{} Receipt {} for agent {}: {} -> {} (risk {})", LOG_PREFIX, receipt.receiptId(),
                            agentId, descriptionCatalog.endpoint(described),
                            redactor.redact(described.expectedOutcome()), receipt.riskLevel());
                    return receipt;
                });
    }

    private ExecutionMetadata synthesizeMetadata(ToolActionDescriptor descriptor, Object executionResult,
            Instant now) {
        return ExecutionMetadata.builder()
                .executionId(EXECUTION_ID_PREFIX + UUID.randomUUID())
                .startTime(now.minus(defaultExecutionDuration))
                .endTime(now)
                .resourcesUsed(List.of(descriptor.toolName(), CLASSIFICATION_ENGINE))
                .performance(new PerformanceMetrics(
                        defaultExecutionDuration.toMillis(),
                        1,
                        payloadSizeEstimator.estimateBytes(executionResult)))
                .build();
    }

    private ExecutionMetadata redactMetadata(ExecutionMetadata metadata) {
        ErrorDetail error = metadata.error();
        return metadata.toBuilder()
                .executionId(redactor.redact(metadata.executionId()))
                .resourcesUsed(metadata.resourcesUsed().stream().map(redactor::redact).toList())
                .error(error != null
                        ? new ErrorDetail(redactor.redact(error.code()), redactor.redact(error.message()),
                                redactor.redact(error.recoveryHint()))
                        : null)
                .build();
    }

    private CompletableFuture<List<String>> resolveRelatedReceipts(String agentId, ToolActionDescriptor descriptor) {
        CompletableFuture<List<String>> lookup;
        try {
            lookup = relatedReceiptStrategy.findRelatedReceipts(agentId, descriptor);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        if (lookup == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return lookup
                .thenApply(related -> related != null ? related : List.<String>of())
                .exceptionally(error -> {
                    log.warn("{} Related receipt lookup failed for agent {}: {}",
                            LOG_PREFIX, agentId, redactor.describe(error));
                    return List.of();
                });
    }

    private void announce(Receipt receipt, ToolActionDescriptor descriptor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ReceiptExtensionPoints.PARAM_RECEIPT, receipt);
        payload.put(ReceiptExtensionPoints.PARAM_AGENT_ID, receipt.agentId());
        payload.put(ReceiptExtensionPoints.PARAM_DESCRIPTOR, descriptor.toBuilder()
                .parameters(redactor.redactParameters(descriptor.parameters()))
                .build());
        registry.invoke(ReceiptExtensionPoints.RECEIPT_CREATED, payload);
    }
}
