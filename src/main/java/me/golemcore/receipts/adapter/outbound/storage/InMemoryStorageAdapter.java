package me.golemcore.receipts.adapter.outbound.storage;

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
import me.golemcore.receipts.domain.model.StorageOptions;
import me.golemcore.receipts.port.outbound.KeyValueStoragePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local implementation of {@link KeyValueStoragePort}. Write options
 * are accepted and ignored.
 */
@Slf4j
public class InMemoryStorageAdapter implements KeyValueStoragePort {

    public static final String PROVIDER_ID = "memory";

    private final Map<String, Map<String, String>> namespaces = new ConcurrentHashMap<>();

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<String> get(String namespace, String key) {
        Map<String, String> values = namespaces.get(namespace);
        return CompletableFuture.completedFuture(values != null ? values.get(key) : null);
    }

    @Override
    public CompletableFuture<Void> set(String namespace, String key, String value, StorageOptions options) {
        if (value == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Null value for " + namespace + "/" + key));
        }
        namespaces.computeIfAbsent(namespace, ns -> new ConcurrentHashMap<>()).put(key, value);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> delete(String namespace, String key) {
        Map<String, String> values = namespaces.get(namespace);
        if (values != null) {
            values.remove(key);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Integer> size(String namespace) {
        Map<String, String> values = namespaces.get(namespace);
        return CompletableFuture.completedFuture(values != null ? values.size() : 0);
    }

    @Override
    public CompletableFuture<List<String>> keys(String namespace) {
        Map<String, String> values = namespaces.get(namespace);
        return CompletableFuture.completedFuture(values != null ? List.copyOf(values.keySet()) : List.of());
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return CompletableFuture.completedFuture(true);
    }
}
