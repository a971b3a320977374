package me.golemcore.receipts.domain.storage;

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
import me.golemcore.receipts.domain.extension.InvocationOutcome;
import me.golemcore.receipts.domain.model.StorageEvent;
import me.golemcore.receipts.domain.model.StorageEventType;
import me.golemcore.receipts.domain.model.StorageOperation;
import me.golemcore.receipts.domain.model.StorageOptions;
import me.golemcore.receipts.port.outbound.KeyValueStoragePort;
import me.golemcore.receipts.security.SensitiveDataRedactor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Storage façade that fires extension points around every operation of the
 * underlying {@link KeyValueStoragePort}.
 *
 * <p>
 * For each operation:
 * <ol>
 * <li>the {@code before-*} slot runs to completion</li>
 * <li>the storage call runs to completion</li>
 * <li>on success the {@code after-*} slot runs; on failure the
 * {@code on-error} slot runs and the returned future fails with
 * {@link StorageOperationException}</li>
 * <li>set, delete and failures are published as {@link StorageEvent}s to the
 * registered listeners</li>
 * </ol>
 *
 * <p>
 * The façade holds no state of its own: no caching, no locking. Concurrent
 * writes to one key are resolved by the storage port.
 */
@Slf4j
public class MediatedStorageService {

    private static final String LOG_PREFIX = "[Storage]";

    private final KeyValueStoragePort storage;
    private final ExtensionPointRegistry registry;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;
    private final List<StorageEventListener> listeners = new CopyOnWriteArrayList<>();

    public MediatedStorageService(KeyValueStoragePort storage, ExtensionPointRegistry registry,
            SensitiveDataRedactor redactor, Clock clock) {
        this.storage = storage;
        this.registry = registry;
        this.redactor = redactor;
        this.clock = clock;
        StorageExtensionPoints.registerAll(registry);
    }

    /**
     * Reads a value.
     *
     * @return future of the value, or of {@code null} when the key is absent
     */
    public CompletableFuture<String> get(String namespace, String key) {
        StorageOperation operation = StorageOperation.GET;
        fireHook(StorageExtensionPoints.beforeSlot(operation), payload(namespace, key));

        return call(() -> storage.get(namespace, key))
                .handle((value, error) -> {
                    if (error != null) {
                        throw fail(operation, namespace, key, error);
                    }
                    Map<String, Object> afterPayload = payload(namespace, key);
                    afterPayload.put(StorageExtensionPoints.PARAM_VALUE, value);
                    fireHook(StorageExtensionPoints.afterSlot(operation), afterPayload);
                    return value;
                });
    }

    public CompletableFuture<Void> set(String namespace, String key, String value) {
        return set(namespace, key, value, StorageOptions.defaults());
    }

    /**
     * Writes a value, overwriting any previous one.
     */
    public CompletableFuture<Void> set(String namespace, String key, String value, StorageOptions options) {
        StorageOperation operation = StorageOperation.SET;
        Map<String, Object> hookPayload = payload(namespace, key);
        hookPayload.put(StorageExtensionPoints.PARAM_VALUE, value);
        fireHook(StorageExtensionPoints.beforeSlot(operation), hookPayload);

        return call(() -> storage.set(namespace, key, value, options))
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw fail(operation, namespace, key, error);
                    }
                    fireHook(StorageExtensionPoints.afterSlot(operation), hookPayload);
                    publish(event(StorageEventType.SET, operation, namespace, key)
                            .value(value)
                            .build());
                    return null;
                });
    }

    /**
     * Deletes a value. Deleting an absent key succeeds.
     */
    public CompletableFuture<Void> delete(String namespace, String key) {
        StorageOperation operation = StorageOperation.DELETE;
        fireHook(StorageExtensionPoints.beforeSlot(operation), payload(namespace, key));

        return call(() -> storage.delete(namespace, key))
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw fail(operation, namespace, key, error);
                    }
                    fireHook(StorageExtensionPoints.afterSlot(operation), payload(namespace, key));
                    publish(event(StorageEventType.DELETE, operation, namespace, key).build());
                    return null;
                });
    }

    public CompletableFuture<Integer> size(String namespace) {
        return call(() -> storage.size(namespace));
    }

    public CompletableFuture<List<String>> keys(String namespace) {
        return call(() -> storage.keys(namespace));
    }

    /**
     * Health of the underlying store. A failing check reports {@code false}.
     */
    public CompletableFuture<Boolean> healthCheck() {
        return call(storage::healthCheck)
                .exceptionally(error -> {
                    log.warn("{} Health check failed: {}", LOG_PREFIX, redactor.describe(error));
                    return false;
                });
    }

    public String providerId() {
        return storage.providerId();
    }

    public void addListener(StorageEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(StorageEventListener listener) {
        listeners.remove(listener);
    }

    private <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Storage returned no result"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private StorageOperationException fail(StorageOperation operation, String namespace, String key,
            Throwable error) {
        Throwable cause = unwrap(error);
        String reason = redactor.describe(cause);
        log.error("{} {} failed for {}/{}: {}", LOG_PREFIX, operation.label(), namespace, key, reason);

        StorageOperationException failure = new StorageOperationException(operation, namespace, key, reason,
                redactor.sanitize(cause));
        Map<String, Object> errorPayload = payload(namespace, key);
        errorPayload.put(StorageExtensionPoints.PARAM_OPERATION, operation.label());
        errorPayload.put(StorageExtensionPoints.PARAM_ERROR, failure);
        fireHook(StorageExtensionPoints.ON_ERROR, errorPayload);

        publish(event(StorageEventType.ERROR, operation, namespace, key)
                .errorMessage(reason)
                .build());
        return failure;
    }

    private void fireHook(String slotName, Map<String, Object> hookPayload) {
        InvocationOutcome outcome = registry.invoke(slotName, hookPayload);
        if (outcome.hasFailures()) {
            log.debug("{} Slot '{}' finished with {} handler failure(s)",
                    LOG_PREFIX, slotName, outcome.failureCount());
        }
    }

    private void publish(StorageEvent event) {
        for (StorageEventListener listener : listeners) {
            try {
                listener.onStorageEvent(event);
            } catch (Exception e) { // NOSONAR - listeners are best-effort observers
                log.warn("{} Listener {} failed on {} event: {}", LOG_PREFIX,
                        listener.getClass().getSimpleName(), event.type(), redactor.describe(e));
            }
        }
    }

    private StorageEvent.StorageEventBuilder event(StorageEventType type, StorageOperation operation,
            String namespace, String key) {
        return StorageEvent.builder()
                .type(type)
                .operation(operation)
                .namespace(namespace)
                .key(key)
                .timestamp(Instant.now(clock))
                .providerId(storage.providerId());
    }

    private static Map<String, Object> payload(String namespace, String key) {
        Map<String, Object> hookPayload = new LinkedHashMap<>();
        hookPayload.put(StorageExtensionPoints.PARAM_NAMESPACE, namespace);
        hookPayload.put(StorageExtensionPoints.PARAM_KEY, key);
        return hookPayload;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }
}
