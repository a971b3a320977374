package me.golemcore.receipts;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.model.ComplianceStatus;
import me.golemcore.receipts.domain.model.ExecutionMetadata;
import me.golemcore.receipts.domain.model.Receipt;
import me.golemcore.receipts.domain.model.ToolActionDescriptor;
import me.golemcore.receipts.domain.service.ActionClassifier;
import me.golemcore.receipts.domain.service.ActionDescriptionCatalog;
import me.golemcore.receipts.domain.service.BusinessImpactEstimator;
import me.golemcore.receipts.domain.service.JacksonPayloadSizeEstimator;
import me.golemcore.receipts.domain.service.ReceiptBuilderService;
import me.golemcore.receipts.domain.service.ReceiptStore;
import me.golemcore.receipts.domain.service.RelatedReceiptStrategy;
import me.golemcore.receipts.domain.storage.MediatedStorageService;
import me.golemcore.receipts.infrastructure.config.ReceiptsProperties;
import me.golemcore.receipts.port.outbound.KeyValueStoragePort;
import me.golemcore.receipts.security.SensitiveDataRedactor;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Explicitly wired set of receipt pipeline components. One context per
 * storage backend; nothing here is a process-wide singleton, so tests can
 * build as many independent contexts as they need.
 */
public record ReceiptsContext(
        ReceiptsProperties properties,
        SensitiveDataRedactor redactor,
        ExtensionPointRegistry registry,
        MediatedStorageService storage,
        ActionClassifier classifier,
        ActionDescriptionCatalog descriptionCatalog,
        ReceiptStore receiptStore,
        ReceiptBuilderService receiptBuilder
) {

    /**
     * Wires every component around the given storage capability.
     *
     * @param relatedReceiptStrategy
     *            may be {@code null} to use the default (no linkage)
     */
    public static ReceiptsContext create(KeyValueStoragePort storagePort, ReceiptsProperties properties,
            Clock clock, ObjectMapper objectMapper, RelatedReceiptStrategy relatedReceiptStrategy) {
        SensitiveDataRedactor redactor = new SensitiveDataRedactor();
        ExtensionPointRegistry registry = new ExtensionPointRegistry(
                properties.getRegistry().getDuplicateSlotPolicy(), redactor);
        MediatedStorageService storage = new MediatedStorageService(storagePort, registry, redactor, clock);
        ActionClassifier classifier = new ActionClassifier();
        ActionDescriptionCatalog catalog = new ActionDescriptionCatalog(redactor);
        ReceiptStore receiptStore = new ReceiptStore(storage, objectMapper, redactor,
                properties.getStorage().getReceiptsNamespace());
        ReceiptBuilderService receiptBuilder = new ReceiptBuilderService(
                classifier,
                new BusinessImpactEstimator(properties.getBusinessImpact().getRevenueScaleFactor()),
                catalog,
                receiptStore,
                relatedReceiptStrategy,
                new JacksonPayloadSizeEstimator(objectMapper),
                registry,
                redactor,
                Duration.ofMillis(properties.getExecution().getDefaultDurationMs()),
                clock);
        return new ReceiptsContext(properties, redactor, registry, storage, classifier, catalog, receiptStore,
                receiptBuilder);
    }

    public ComplianceStatus classify(ToolActionDescriptor descriptor) {
        return classifier.classify(descriptor);
    }

    public CompletableFuture<Receipt> buildReceipt(String agentId, ToolActionDescriptor descriptor,
            Object executionResult, ExecutionMetadata executionMetadata) {
        return receiptBuilder.build(agentId, descriptor, executionResult, executionMetadata);
    }
}
