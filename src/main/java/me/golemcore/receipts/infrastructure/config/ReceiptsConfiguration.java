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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.ReceiptsContext;
import me.golemcore.receipts.adapter.outbound.storage.InMemoryStorageAdapter;
import me.golemcore.receipts.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.service.ActionClassifier;
import me.golemcore.receipts.domain.service.ReceiptBuilderService;
import me.golemcore.receipts.domain.service.RelatedReceiptStrategy;
import me.golemcore.receipts.domain.storage.MediatedStorageService;
import me.golemcore.receipts.port.outbound.KeyValueStoragePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring wiring of the receipt pipeline.
 *
 * <p>
 * The pipeline itself is assembled by {@link ReceiptsContext#create}; this
 * configuration picks the storage backend from
 * {@code receipts.storage.type} ({@code local} or {@code memory}) and exposes
 * the context's components as beans. A {@link RelatedReceiptStrategy} bean, if
 * present, replaces the default linkage.
 */
@Configuration
@Slf4j
public class ReceiptsConfiguration {

    private static final String STORAGE_MEMORY = "memory";
    private static final String STORAGE_LOCAL = "local";

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public KeyValueStoragePort keyValueStoragePort(ReceiptsProperties properties) {
        String type = properties.getStorage().getType();
        if (STORAGE_MEMORY.equalsIgnoreCase(type)) {
            log.info("[Storage] Using in-memory storage");
            return new InMemoryStorageAdapter();
        }
        if (!STORAGE_LOCAL.equalsIgnoreCase(type)) {
            throw new IllegalStateException("Unsupported receipts.storage.type: " + type);
        }
        return new LocalStorageAdapter(properties);
    }

    @Bean
    public ReceiptsContext receiptsContext(KeyValueStoragePort storagePort, ReceiptsProperties properties,
            Clock clock, ObjectMapper objectMapper, ObjectProvider<RelatedReceiptStrategy> relatedReceiptStrategy) {
        ReceiptsContext context = ReceiptsContext.create(storagePort, properties, clock, objectMapper,
                relatedReceiptStrategy.getIfAvailable());
        log.info("[Receipts] Pipeline ready: storage={}, slots={}, revenue scale={}",
                storagePort.providerId(), context.registry().getSlots().size(),
                properties.getBusinessImpact().getRevenueScaleFactor());
        return context;
    }

    @Bean
    public ExtensionPointRegistry extensionPointRegistry(ReceiptsContext context) {
        return context.registry();
    }

    @Bean
    public MediatedStorageService mediatedStorageService(ReceiptsContext context) {
        return context.storage();
    }

    @Bean
    public ActionClassifier actionClassifier(ReceiptsContext context) {
        return context.classifier();
    }

    @Bean
    public ReceiptBuilderService receiptBuilderService(ReceiptsContext context) {
        return context.receiptBuilder();
    }
}
