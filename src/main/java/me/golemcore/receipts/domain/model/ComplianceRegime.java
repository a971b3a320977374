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

import java.util.Optional;

/**
 * Compliance regimes with a dedicated flag on {@link ComplianceStatus}.
 * Identifiers are matched case-sensitively.
 */
public enum ComplianceRegime {

    /**
     * Data privacy.
     */
    GDPR("GDPR"),

    /**
     * Health data.
     */
    HIPAA("HIPAA"),

    /**
     * Financial controls (Sarbanes-Oxley section 404).
     */
    SOX("SOX"),

    /**
     * Payment card data.
     */
    PCI_DSS("PCI-DSS");

    private final String identifier;

    ComplianceRegime(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    public static Optional<ComplianceRegime> fromIdentifier(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        for (ComplianceRegime regime : values()) {
            if (regime.identifier.equals(identifier)) {
                return Optional.of(regime);
            }
        }
        return Optional.empty();
    }
}
