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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-regime compliance flags derived from an action's compliance
 * requirements. Regime identifiers without a dedicated flag are kept verbatim
 * in {@code additionalRegimes}, in the order they were declared.
 */
@Builder
public record ComplianceStatus(
        boolean gdprCompliant,
        boolean hipaaCompliant,
        boolean sox404Compliant,
        boolean pciDssCompliant,
        Map<String, Boolean> additionalRegimes
) {
    public ComplianceStatus {
        additionalRegimes = additionalRegimes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(additionalRegimes))
                : Map.of();
    }

    public boolean isTracked(ComplianceRegime regime) {
        return switch (regime) {
        case GDPR -> gdprCompliant;
        case HIPAA -> hipaaCompliant;
        case SOX -> sox404Compliant;
        case PCI_DSS -> pciDssCompliant;
        };
    }
}
