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

/**
 * Transient notification about a completed or failed storage operation. Never
 * persisted.
 *
 * @param type
 *            event variant
 * @param namespace
 *            storage namespace
 * @param key
 *            key within the namespace
 * @param value
 *            written value for {@link StorageEventType#SET}, otherwise null
 * @param timestamp
 *            when the operation finished
 * @param providerId
 *            identity of the storage provider that served the operation
 * @param operation
 *            failed operation for {@link StorageEventType#ERROR}, otherwise the
 *            completed one
 * @param errorMessage
 *            redacted failure message for {@link StorageEventType#ERROR}
 */
@Builder
public record StorageEvent(
        StorageEventType type,
        String namespace,
        String key,
        String value,
        Instant timestamp,
        String providerId,
        StorageOperation operation,
        String errorMessage
) {
}
