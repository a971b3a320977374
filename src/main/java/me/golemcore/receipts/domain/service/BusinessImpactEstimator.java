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

import me.golemcore.receipts.domain.model.BusinessContext;
import me.golemcore.receipts.domain.model.BusinessImpact;
import me.golemcore.receipts.domain.model.CustomerImpact;
import me.golemcore.receipts.domain.model.ToolActionDescriptor;

import java.util.List;
import java.util.Locale;

/**
 * Estimates the business impact of a tool action from its business context.
 *
 * <ul>
 * <li>customers are affected unless the impact is explicitly {@code LOW}</li>
 * <li>revenue impact is {@code businessValue * revenueScaleFactor}</li>
 * <li>data is modified when the action type contains create, update or
 * delete (case-insensitive substring)</li>
 * </ul>
 */
public class BusinessImpactEstimator {

    private static final List<String> MODIFYING_KEYWORDS = List.of("create", "update", "delete");

    private final double revenueScaleFactor;

    public BusinessImpactEstimator(double revenueScaleFactor) {
        if (Double.isNaN(revenueScaleFactor) || revenueScaleFactor < 0) {
            throw new IllegalArgumentException("revenueScaleFactor must be non-negative: " + revenueScaleFactor);
        }
        this.revenueScaleFactor = revenueScaleFactor;
    }

    public BusinessImpact estimate(ToolActionDescriptor descriptor) {
        BusinessContext context = descriptor.businessContext();
        return new BusinessImpact(
                context.customerImpact() != CustomerImpact.LOW,
                context.businessValue() * revenueScaleFactor,
                isDataModifying(descriptor.actionType()),
                List.of(descriptor.toolName()));
    }

    static boolean isDataModifying(String actionType) {
        String normalized = actionType.toLowerCase(Locale.ROOT);
        return MODIFYING_KEYWORDS.stream().anyMatch(normalized::contains);
    }
}
