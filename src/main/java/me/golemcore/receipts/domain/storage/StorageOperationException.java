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

import me.golemcore.receipts.domain.model.StorageOperation;
import me.golemcore.receipts.security.RedactedException;

/**
 * A storage operation failed after the on-error hook ran. The message carries
 * namespace, key, operation and the redacted underlying message; the cause is
 * the redacted copy of the storage failure.
 */
public class StorageOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final StorageOperation operation;
    private final String namespace;
    private final String key;

    public StorageOperationException(StorageOperation operation, String namespace, String key, String reason,
            RedactedException cause) {
        super("Storage " + operation.label() + " failed for " + namespace + "/" + key + ": " + reason, cause);
        this.operation = operation;
        this.namespace = namespace;
        this.key = key;
    }

    public StorageOperation getOperation() {
        return operation;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getKey() {
        return key;
    }
}
