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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.domain.model.Receipt;
import me.golemcore.receipts.domain.model.StorageOptions;
import me.golemcore.receipts.domain.storage.MediatedStorageService;
import me.golemcore.receipts.domain.storage.StorageOperationException;
import me.golemcore.receipts.security.SensitiveDataRedactor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Persists receipts as JSON through the mediated storage, one key per receipt
 * identity in the receipts namespace.
 */
@Slf4j
public class ReceiptStore {

    private final MediatedStorageService storage;
    private final ObjectMapper objectMapper;
    private final SensitiveDataRedactor redactor;
    private final String namespace;

    public ReceiptStore(MediatedStorageService storage, ObjectMapper objectMapper, SensitiveDataRedactor redactor,
            String namespace) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.redactor = redactor;
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Writes the receipt atomically.
     *
     * @return future of the stored receipt; fails with
     *         {@link PersistenceException} carrying the receipt
     */
    public CompletableFuture<Receipt> save(Receipt receipt) {
        String json;
        try {
            json = objectMapper.writeValueAsString(receipt);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new PersistenceException(receipt,
                    "Failed to serialize receipt " + receipt.receiptId() + ": " + redactor.describe(e),
                    redactor.sanitize(e)));
        }

        return storage.set(namespace, receipt.receiptId(), json, StorageOptions.atomicWrite())
                .handle((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        throw new PersistenceException(receipt,
                                "Failed to persist receipt " + receipt.receiptId() + ": " + redactor.redact(
                                        cause.getMessage()),
                                cause instanceof StorageOperationException ? cause : redactor.sanitize(cause));
                    }
                    log.debug("[Receipts] Stored receipt {}", receipt.receiptId());
                    return receipt;
                });
    }

    public CompletableFuture<Optional<Receipt>> find(String receiptId) {
        return storage.get(namespace, receiptId).thenApply(json -> {
            if (json == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(objectMapper.readValue(json, Receipt.class));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored receipt is not readable: " + receiptId,
                        redactor.sanitize(e));
            }
        });
    }

    public CompletableFuture<List<String>> listReceiptIds() {
        return storage.keys(namespace);
    }
}
