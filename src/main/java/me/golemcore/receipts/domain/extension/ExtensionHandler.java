package me.golemcore.receipts.domain.extension;

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

import java.util.Map;

/**
 * Callback bound to an extension point slot.
 *
 * <p>
 * Handlers run on the invoking thread and must be bounded in cost: nothing
 * cancels a handler once it has started.
 */
@FunctionalInterface
public interface ExtensionHandler {

    /**
     * @param payload
     *            slot payload keyed by the slot's declared parameter names
     */
    void handle(Map<String, Object> payload) throws Exception; // NOSONAR - handlers may fail arbitrarily
}
