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

import java.util.List;

/**
 * Estimated business effect of a tool action.
 *
 * @param customerAffected
 *            whether customers are affected
 * @param revenueImpact
 *            monetary estimate, never negative
 * @param dataModified
 *            whether the action created, updated or deleted data
 * @param systemsAffected
 *            identities of the touched systems
 */
public record BusinessImpact(
        boolean customerAffected,
        double revenueImpact,
        boolean dataModified,
        List<String> systemsAffected
) {
    public BusinessImpact {
        systemsAffected = systemsAffected != null ? List.copyOf(systemsAffected) : List.of();
    }
}
