package me.golemcore.receipts.infrastructure.config;

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

import lombok.Data;
import me.golemcore.receipts.domain.extension.DuplicateSlotPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the receipt pipeline, bound from
 * application.properties under the {@code receipts.*} prefix:
 * <ul>
 * <li>{@link RegistryProperties} - extension point registry behavior</li>
 * <li>{@link BusinessImpactProperties} - business impact estimation</li>
 * <li>{@link ExecutionProperties} - synthesized execution metadata</li>
 * <li>{@link StorageProperties} - storage backend selection</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "receipts")
@Data
public class ReceiptsProperties {

    private RegistryProperties registry = new RegistryProperties();
    private BusinessImpactProperties businessImpact = new BusinessImpactProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class RegistryProperties {
        private DuplicateSlotPolicy duplicateSlotPolicy = DuplicateSlotPolicy.REJECT;
    }

    @Data
    public static class BusinessImpactProperties {
        /**
         * Multiplier turning the 0-1 business value into a revenue estimate.
         */
        private double revenueScaleFactor = 1000.0;
    }

    @Data
    public static class ExecutionProperties {
        /**
         * Duration assumed for executions reported without metadata.
         */
        private long defaultDurationMs = 1000;
    }

    @Data
    public static class StorageProperties {
        private String type = "local";
        private String receiptsNamespace = "receipts";
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/receipts";
    }
}
