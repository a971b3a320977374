package me.golemcore.receipts.port.outbound;

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

import me.golemcore.receipts.domain.model.StorageOptions;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the authoritative key-value store. Values are text (JSON) grouped
 * by namespace (e.g. "receipts").
 *
 * <p>
 * Implementations own durability and any caching; callers never cache writes.
 * Concurrent writes to the same key are last-write-wins.
 */
public interface KeyValueStoragePort {

    /**
     * Identity of this provider, reported on storage events.
     */
    String providerId();

    /**
     * Read a value.
     *
     * @return the value, or {@code null} if the key is absent
     */
    CompletableFuture<String> get(String namespace, String key);

    /**
     * Write a value, overwriting any previous one.
     */
    CompletableFuture<Void> set(String namespace, String key, String value, StorageOptions options);

    /**
     * Delete a value. Deleting an absent key succeeds.
     */
    CompletableFuture<Void> delete(String namespace, String key);

    /**
     * Number of keys in a namespace.
     */
    CompletableFuture<Integer> size(String namespace);

    /**
     * Keys of a namespace in no particular order.
     */
    CompletableFuture<List<String>> keys(String namespace);

    /**
     * Whether the store can currently serve requests.
     */
    CompletableFuture<Boolean> healthCheck();
}
