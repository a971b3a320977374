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

import me.golemcore.receipts.domain.model.ActionClassification;
import me.golemcore.receipts.domain.model.ActionType;
import me.golemcore.receipts.domain.model.ComplianceRegime;
import me.golemcore.receipts.domain.model.ComplianceStatus;
import me.golemcore.receipts.domain.model.RiskTier;
import me.golemcore.receipts.domain.model.ToolActionDescriptor;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps tool action descriptors to compliance flags, risk tier and data tier.
 *
 * <p>
 * Pure and total: no storage or network access, the same descriptor always
 * yields an equal result.
 */
public class ActionClassifier {

    /**
     * Derives compliance flags from {@code complianceRequirements}. Each
     * well-known regime flag is set iff its identifier is present (exact,
     * case-sensitive match); any other identifier is kept verbatim in
     * {@link ComplianceStatus#additionalRegimes()}.
     */
    public ComplianceStatus classify(ToolActionDescriptor descriptor) {
        Set<ComplianceRegime> matched = EnumSet.noneOf(ComplianceRegime.class);
        Map<String, Boolean> additional = new LinkedHashMap<>();

        for (String requirement : descriptor.complianceRequirements()) {
            Optional<ComplianceRegime> regime = ComplianceRegime.fromIdentifier(requirement);
            if (regime.isPresent()) {
                matched.add(regime.get());
            } else {
                additional.put(requirement, true);
            }
        }

        return ComplianceStatus.builder()
                .gdprCompliant(matched.contains(ComplianceRegime.GDPR))
                .hipaaCompliant(matched.contains(ComplianceRegime.HIPAA))
                .sox404Compliant(matched.contains(ComplianceRegime.SOX))
                .pciDssCompliant(matched.contains(ComplianceRegime.PCI_DSS))
                .additionalRegimes(additional)
                .build();
    }

    public ActionClassification classifyAction(ToolActionDescriptor descriptor) {
        return new ActionClassification(
                descriptor.toolCategory(),
                ActionType.resolve(descriptor.actionType()),
                descriptor.riskLevel(),
                RiskTier.fromLevel(descriptor.riskLevel()),
                classify(descriptor),
                descriptor.dataClassification());
    }
}
