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

import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.extension.ExtensionPointSlot;
import me.golemcore.receipts.domain.model.StorageOperation;

import java.util.List;

/**
 * Slots fired by {@link MediatedStorageService} around every storage
 * operation.
 */
public final class StorageExtensionPoints {

    public static final String BEFORE_GET = "before-get";
    public static final String AFTER_GET = "after-get";
    public static final String BEFORE_SET = "before-set";
    public static final String AFTER_SET = "after-set";
    public static final String BEFORE_DELETE = "before-delete";
    public static final String AFTER_DELETE = "after-delete";
    public static final String ON_ERROR = "on-error";

    public static final String PARAM_NAMESPACE = "namespace";
    public static final String PARAM_KEY = "key";
    public static final String PARAM_VALUE = "value";
    public static final String PARAM_OPERATION = "operation";
    public static final String PARAM_ERROR = "error";

    public static final List<ExtensionPointSlot> SLOTS = List.of(
            new ExtensionPointSlot(BEFORE_GET, "Before a value is read",
                    List.of(PARAM_NAMESPACE, PARAM_KEY)),
            new ExtensionPointSlot(AFTER_GET, "After a value is read",
                    List.of(PARAM_NAMESPACE, PARAM_KEY, PARAM_VALUE)),
            new ExtensionPointSlot(BEFORE_SET, "Before a value is written",
                    List.of(PARAM_NAMESPACE, PARAM_KEY, PARAM_VALUE)),
            new ExtensionPointSlot(AFTER_SET, "After a value is written",
                    List.of(PARAM_NAMESPACE, PARAM_KEY, PARAM_VALUE)),
            new ExtensionPointSlot(BEFORE_DELETE, "Before a value is deleted",
                    List.of(PARAM_NAMESPACE, PARAM_KEY)),
            new ExtensionPointSlot(AFTER_DELETE, "After a value is deleted",
                    List.of(PARAM_NAMESPACE, PARAM_KEY)),
            new ExtensionPointSlot(ON_ERROR, "A storage operation failed",
                    List.of(PARAM_NAMESPACE, PARAM_KEY, PARAM_OPERATION, PARAM_ERROR)));

    private StorageExtensionPoints() {
    }

    /**
     * Registers the storage slots that are not registered yet.
     */
    public static void registerAll(ExtensionPointRegistry registry) {
        for (ExtensionPointSlot slot : SLOTS) {
            if (!registry.hasSlot(slot.name())) {
                registry.registerSlot(slot);
            }
        }
    }

    public static String beforeSlot(StorageOperation operation) {
        return switch (operation) {
        case GET -> BEFORE_GET;
        case SET -> BEFORE_SET;
        case DELETE -> BEFORE_DELETE;
        };
    }

    public static String afterSlot(StorageOperation operation) {
        return switch (operation) {
        case GET -> AFTER_GET;
        case SET -> AFTER_SET;
        case DELETE -> AFTER_DELETE;
        };
    }
}
