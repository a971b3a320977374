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

import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.extension.ExtensionPointSlot;

import java.util.List;

/**
 * Slots fired by the receipt pipeline.
 */
public final class ReceiptExtensionPoints {

    public static final String RECEIPT_CREATED = "receipt-created";

    public static final String PARAM_RECEIPT = "receipt";
    public static final String PARAM_AGENT_ID = "agentId";
    public static final String PARAM_DESCRIPTOR = "descriptor";

    public static final ExtensionPointSlot RECEIPT_CREATED_SLOT = new ExtensionPointSlot(RECEIPT_CREATED,
            "A receipt was persisted", List.of(PARAM_RECEIPT, PARAM_AGENT_ID, PARAM_DESCRIPTOR));

    private ReceiptExtensionPoints() {
    }

    public static void registerAll(ExtensionPointRegistry registry) {
        if (!registry.hasSlot(RECEIPT_CREATED)) {
            registry.registerSlot(RECEIPT_CREATED_SLOT);
        }
    }
}
