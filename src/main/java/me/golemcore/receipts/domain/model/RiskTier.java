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
 * Coarse bucket over the 1-10 risk level carried by a tool action.
 */
public enum RiskTier {

    LOW(1, 3), MEDIUM(4, 6), HIGH(7, 8), CRITICAL(9, 10);

    private final int minLevel;
    private final int maxLevel;

    RiskTier(int minLevel, int maxLevel) {
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    public static RiskTier fromLevel(int riskLevel) {
        for (RiskTier tier : values()) {
            if (riskLevel >= tier.minLevel && riskLevel <= tier.maxLevel) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Risk level out of range [1,10]: " + riskLevel);
    }
}
