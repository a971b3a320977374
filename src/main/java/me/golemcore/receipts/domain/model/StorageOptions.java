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

/**
 * Write options for a storage {@code set}.
 *
 * @param atomic
 *            write through a temporary file and rename
 * @param backup
 *            keep the previous value next to the new one
 */
public record StorageOptions(boolean atomic, boolean backup) {

    public static StorageOptions defaults() {
        return new StorageOptions(false, false);
    }

    public static StorageOptions atomicWrite() {
        return new StorageOptions(true, false);
    }
}
