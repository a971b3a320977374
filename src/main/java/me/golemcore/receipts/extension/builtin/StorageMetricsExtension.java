package me.golemcore.receipts.extension.builtin;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.model.StorageOperation;
import me.golemcore.receipts.domain.storage.StorageExtensionPoints;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts storage operations by observing the storage extension points.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageMetricsExtension {

    public static final String EXTENSION_ID = "storage-metrics";

    private final ExtensionPointRegistry registry;

    private final Map<StorageOperation, AtomicLong> started = counters();
    private final Map<StorageOperation, AtomicLong> completed = counters();
    private final Map<StorageOperation, AtomicLong> failed = counters();

    /**
     * Counter values of one operation.
     */
    public record OperationMetrics(long started, long completed, long failed) {
    }

    @PostConstruct
    public void register() {
        for (StorageOperation operation : StorageOperation.values()) {
            registry.registerHandler(StorageExtensionPoints.beforeSlot(operation), EXTENSION_ID,
                    payload -> started.get(operation).incrementAndGet());
            registry.registerHandler(StorageExtensionPoints.afterSlot(operation), EXTENSION_ID,
                    payload -> completed.get(operation).incrementAndGet());
        }
        registry.registerHandler(StorageExtensionPoints.ON_ERROR, EXTENSION_ID, payload -> {
            Object operation = payload.get(StorageExtensionPoints.PARAM_OPERATION);
            StorageOperation failedOperation = StorageOperation.valueOf(
                    String.valueOf(operation).toUpperCase(Locale.ROOT));
            failed.get(failedOperation).incrementAndGet();
        });
        log.info("[Metrics] Storage metrics collector registered");
    }

    public OperationMetrics snapshot(StorageOperation operation) {
        return new OperationMetrics(
                started.get(operation).get(),
                completed.get(operation).get(),
                failed.get(operation).get());
    }

    public Map<StorageOperation, OperationMetrics> snapshot() {
        Map<StorageOperation, OperationMetrics> result = new EnumMap<>(StorageOperation.class);
        for (StorageOperation operation : StorageOperation.values()) {
            result.put(operation, snapshot(operation));
        }
        return result;
    }

    private static Map<StorageOperation, AtomicLong> counters() {
        Map<StorageOperation, AtomicLong> map = new EnumMap<>(StorageOperation.class);
        for (StorageOperation operation : StorageOperation.values()) {
            map.put(operation, new AtomicLong());
        }
        return map;
    }
}
