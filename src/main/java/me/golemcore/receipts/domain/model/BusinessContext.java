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

import java.util.List;

/**
 * Business framing of a tool action supplied by the caller.
 *
 * @param department
 *            owning department, e.g. "sales"
 * @param useCase
 *            free-form use case label
 * @param customerImpact
 *            expected impact on customers; {@code null} means unknown
 * @param dataClassification
 *            sensitivity of the business data involved
 * @param regulatoryScope
 *            regulatory scopes the business unit operates under
 * @param businessValue
 *            normalized value score in [0, 1]
 */
@Builder
public record BusinessContext(
        String department,
        String useCase,
        CustomerImpact customerImpact,
        DataClassification dataClassification,
        List<String> regulatoryScope,
        double businessValue
) {
    public BusinessContext {
        if (Double.isNaN(businessValue) || businessValue < 0.0 || businessValue > 1.0) {
            throw new IllegalArgumentException("businessValue must be within [0,1]: " + businessValue);
        }
        regulatoryScope = regulatoryScope != null ? List.copyOf(regulatoryScope) : List.of();
    }
}
