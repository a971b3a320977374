package me.golemcore.receipts.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.receipts.adapter.outbound.storage.InMemoryStorageAdapter;
import me.golemcore.receipts.domain.extension.DuplicateSlotPolicy;
import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.model.BusinessImpact;
import me.golemcore.receipts.domain.model.ComplianceStatus;
import me.golemcore.receipts.domain.model.DataClassification;
import me.golemcore.receipts.domain.model.ExecutionMetadata;
import me.golemcore.receipts.domain.model.PerformanceMetrics;
import me.golemcore.receipts.domain.model.Receipt;
import me.golemcore.receipts.domain.model.ToolCategory;
import me.golemcore.receipts.domain.storage.MediatedStorageService;
import me.golemcore.receipts.domain.storage.StorageExtensionPoints;
import me.golemcore.receipts.security.SensitiveDataRedactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ReceiptStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ObjectMapper objectMapper;
    private InMemoryStorageAdapter port;
    private ExtensionPointRegistry registry;
    private ReceiptStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        port = new InMemoryStorageAdapter();
        registry = new ExtensionPointRegistry(DuplicateSlotPolicy.REJECT, new SensitiveDataRedactor());
        MediatedStorageService storage = new MediatedStorageService(port, registry, new SensitiveDataRedactor(),
                Clock.systemUTC());
        store = new ReceiptStore(storage, objectMapper, new SensitiveDataRedactor(), "receipts");
    }

    private static Receipt receipt(String id) {
        return Receipt.builder()
                .receiptId(id)
                .agentId("agent-1")
                .toolName("stripe")
                .actionType("create_refund")
                .timestamp(NOW)
                .toolCategory(ToolCategory.PAYMENT)
                .riskLevel(8)
                .complianceRequirements(List.of("PCI-DSS", "CCPA"))
                .dataClassification(DataClassification.RESTRICTED)
                .complianceStatus(ComplianceStatus.builder()
                        .pciDssCompliant(true)
                        .additionalRegimes(Map.of("CCPA", true))
                        .build())
                .executionMetadata(ExecutionMetadata.builder()
                        .executionId("exec_1")
                        .startTime(NOW.minusSeconds(1))
                        .endTime(NOW)
                        .resourcesUsed(List.of("stripe"))
                        .performance(new PerformanceMetrics(1000, 1, 42))
                        .build())
                .relatedReceipts(List.of())
                .businessImpact(new BusinessImpact(true, 900.0, true, List.of("stripe")))
                .build();
    }

    @Test
    void savesAndFindsReceipt() throws ExecutionException, InterruptedException {
        Receipt receipt = receipt("rcpt_1");

        store.save(receipt).get();

        assertEquals(Optional.of(receipt), store.find("rcpt_1").get());
    }

    @Test
    void findReturnsEmptyForUnknownReceipt() throws ExecutionException, InterruptedException {
        assertTrue(store.find("rcpt_missing").get().isEmpty());
    }

    @Test
    void writesStableFieldNames() throws Exception {
        store.save(receipt("rcpt_2")).get();

        ObjectNode json = (ObjectNode) objectMapper.readTree(port.get("receipts", "rcpt_2").get());

        Set<String> fields = new HashSet<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertEquals(Set.of("receiptId", "agentId", "toolName", "actionType", "timestamp", "toolCategory",
                "riskLevel", "complianceRequirements", "dataClassification", "complianceStatus",
                "executionMetadata", "relatedReceipts", "businessImpact"), fields);
        assertTrue(json.get("complianceStatus").get("pciDssCompliant").asBoolean());
        assertTrue(json.get("complianceStatus").get("additionalRegimes").get("CCPA").asBoolean());
        assertEquals(900.0, json.get("businessImpact").get("revenueImpact").asDouble(), 1e-9);
        assertEquals("2026-03-01T10:00:00Z", json.get("timestamp").asText());
    }

    @Test
    void savingFiresStorageHooks() throws ExecutionException, InterruptedException {
        List<Object> keys = new ArrayList<>();
        registry.registerHandler(StorageExtensionPoints.AFTER_SET, "audit",
                payload -> keys.add(payload.get(StorageExtensionPoints.PARAM_KEY)));

        store.save(receipt("rcpt_3")).get();

        assertEquals(List.of("rcpt_3"), keys);
    }

    @Test
    void listsReceiptIds() throws ExecutionException, InterruptedException {
        store.save(receipt("rcpt_a")).get();
        store.save(receipt("rcpt_b")).get();

        assertEquals(List.of("rcpt_a", "rcpt_b"), store.listReceiptIds().get().stream().sorted().toList());
    }

    @Test
    void unreadableReceiptFails() {
        port.set("receipts", "rcpt_bad", "not json", null).join();

        ExecutionException ex = assertThrows(ExecutionException.class, () -> store.find("rcpt_bad").get());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }
}
