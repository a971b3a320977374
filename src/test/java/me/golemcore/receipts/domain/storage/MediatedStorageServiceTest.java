package me.golemcore.receipts.domain.storage;

import me.golemcore.receipts.adapter.outbound.storage.InMemoryStorageAdapter;
import me.golemcore.receipts.domain.extension.DuplicateSlotPolicy;
import me.golemcore.receipts.domain.extension.ExtensionPointRegistry;
import me.golemcore.receipts.domain.model.StorageEvent;
import me.golemcore.receipts.domain.model.StorageEventType;
import me.golemcore.receipts.domain.model.StorageOperation;
import me.golemcore.receipts.domain.model.StorageOptions;
import me.golemcore.receipts.port.outbound.KeyValueStoragePort;
import me.golemcore.receipts.security.RedactedException;
import me.golemcore.receipts.security.SensitiveDataRedactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MediatedStorageServiceTest {

    private static final String NAMESPACE = "receipts";
    private static final String KEY = "rcpt_1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ExtensionPointRegistry registry;
    private MediatedStorageService storage;
    private List<String> trace;
    private List<StorageEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ExtensionPointRegistry(DuplicateSlotPolicy.REJECT, new SensitiveDataRedactor());
        storage = newService(new InMemoryStorageAdapter());
        trace = new ArrayList<>();
        events = new ArrayList<>();
        storage.addListener(events::add);
        for (String slot : List.of(StorageExtensionPoints.BEFORE_GET, StorageExtensionPoints.AFTER_GET,
                StorageExtensionPoints.BEFORE_SET, StorageExtensionPoints.AFTER_SET,
                StorageExtensionPoints.BEFORE_DELETE, StorageExtensionPoints.AFTER_DELETE,
                StorageExtensionPoints.ON_ERROR)) {
            registry.registerHandler(slot, "tracer", payload -> trace.add(slot));
        }
    }

    private MediatedStorageService newService(KeyValueStoragePort port) {
        return new MediatedStorageService(port, registry, new SensitiveDataRedactor(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ===== Round trips =====

    @Test
    void getReturnsValueAfterSet() throws ExecutionException, InterruptedException {
        storage.set(NAMESPACE, KEY, "{\"a\":1}").get();

        assertEquals("{\"a\":1}", storage.get(NAMESPACE, KEY).get());
    }

    @Test
    void getReturnsNullAfterDelete() throws ExecutionException, InterruptedException {
        storage.set(NAMESPACE, KEY, "v").get();
        storage.delete(NAMESPACE, KEY).get();

        assertNull(storage.get(NAMESPACE, KEY).get());
    }

    @Test
    void deleteOfAbsentKeySucceeds() {
        assertDoesNotThrow(() -> storage.delete(NAMESPACE, "missing").get());
        assertEquals(List.of(StorageExtensionPoints.BEFORE_DELETE, StorageExtensionPoints.AFTER_DELETE), trace);
    }

    @Test
    void setOverwrites() throws ExecutionException, InterruptedException {
        storage.set(NAMESPACE, KEY, "first").get();
        storage.set(NAMESPACE, KEY, "second").get();

        assertEquals("second", storage.get(NAMESPACE, KEY).get());
        assertEquals(1, storage.size(NAMESPACE).get());
    }

    // ===== Hook ordering =====

    @Test
    void firesBeforeAndAfterHooksAroundGet() throws ExecutionException, InterruptedException {
        storage.get(NAMESPACE, KEY).get();

        assertEquals(List.of(StorageExtensionPoints.BEFORE_GET, StorageExtensionPoints.AFTER_GET), trace);
    }

    @Test
    void beforeHookCompletesBeforeStorageCall() throws ExecutionException, InterruptedException {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.set(anyString(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            trace.add("storage");
            return CompletableFuture.completedFuture(null);
        });
        MediatedStorageService mediated = newService(port);

        mediated.set(NAMESPACE, KEY, "v").get();

        assertEquals(List.of(StorageExtensionPoints.BEFORE_SET, "storage", StorageExtensionPoints.AFTER_SET),
                trace);
    }

    @Test
    void afterGetPayloadCarriesValue() throws ExecutionException, InterruptedException {
        List<Object> values = new ArrayList<>();
        registry.registerHandler(StorageExtensionPoints.AFTER_GET, "reader",
                payload -> values.add(payload.get(StorageExtensionPoints.PARAM_VALUE)));
        storage.set(NAMESPACE, KEY, "v").get();

        storage.get(NAMESPACE, KEY).get();

        assertEquals(List.of("v"), values);
    }

    @Test
    void failingHookDoesNotAbortOperation() throws ExecutionException, InterruptedException {
        registry.registerHandler(StorageExtensionPoints.BEFORE_SET, "broken", payload -> {
            throw new IllegalStateException("hook failure");
        });

        storage.set(NAMESPACE, KEY, "v").get();

        assertEquals("v", storage.get(NAMESPACE, KEY).get());
        assertEquals(1, registry.getStatistics(StorageExtensionPoints.BEFORE_SET).handlerFailures());
    }

    // ===== Errors =====

    @Test
    void storageFailureFiresOnErrorAndPropagates() {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.get(NAMESPACE, KEY)).thenReturn(CompletableFuture.failedFuture(new IOException("disk gone")));
        MediatedStorageService mediated = newService(port);
        List<Map<String, Object>> errorPayloads = new ArrayList<>();
        registry.registerHandler(StorageExtensionPoints.ON_ERROR, "collector", errorPayloads::add);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> mediated.get(NAMESPACE, KEY).get());

        StorageOperationException failure = assertInstanceOf(StorageOperationException.class, ex.getCause());
        assertEquals(StorageOperation.GET, failure.getOperation());
        assertEquals(NAMESPACE, failure.getNamespace());
        assertEquals(KEY, failure.getKey());
        assertTrue(failure.getMessage().contains("disk gone"));
        assertEquals(List.of(StorageExtensionPoints.BEFORE_GET, StorageExtensionPoints.ON_ERROR), trace);
        assertEquals("get", errorPayloads.get(0).get(StorageExtensionPoints.PARAM_OPERATION));
    }

    @Test
    void synchronousStorageFailureIsReportedThroughFuture() {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.delete(NAMESPACE, KEY)).thenThrow(new IllegalStateException("offline"));
        MediatedStorageService mediated = newService(port);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> mediated.delete(NAMESPACE, KEY).get());

        assertInstanceOf(StorageOperationException.class, ex.getCause());
        assertEquals(List.of(StorageExtensionPoints.BEFORE_DELETE, StorageExtensionPoints.ON_ERROR), trace);
    }

    @Test
    void errorMessagesAreRedacted() {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.set(anyString(), anyString(), anyString(), any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("denied for api_key=sk-live-12345678")));
        MediatedStorageService mediated = newService(port);
        mediated.addListener(events::add);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> mediated.set(NAMESPACE, KEY, "v", StorageOptions.atomicWrite()).get());

        assertFalse(ex.getCause().getMessage().contains("sk-live-12345678"));
        assertFalse(events.get(0).errorMessage().contains("sk-live-12345678"));
    }

    @Test
    void storageFailureChainCarriesNoCredentials() {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.get(NAMESPACE, KEY)).thenReturn(
                CompletableFuture.failedFuture(new IOException("connect failed password=hunter2")));
        MediatedStorageService mediated = newService(port);
        List<Object> hookErrors = new ArrayList<>();
        registry.registerHandler(StorageExtensionPoints.ON_ERROR, "collector",
                payload -> hookErrors.add(payload.get(StorageExtensionPoints.PARAM_ERROR)));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> mediated.get(NAMESPACE, KEY).get());

        assertNoSecretInChain(ex, "hunter2");
        assertNoSecretInChain((Throwable) hookErrors.get(0), "hunter2");
        RedactedException cause = assertInstanceOf(RedactedException.class, ex.getCause().getCause());
        assertEquals(IOException.class.getName(), cause.getOriginalType());
        assertTrue(cause.getMessage().contains("password=[REDACTED]"));
    }

    private static void assertNoSecretInChain(Throwable error, String secret) {
        for (Throwable cursor = error; cursor != null; cursor = cursor.getCause()) {
            assertFalse(String.valueOf(cursor).contains(secret), String.valueOf(cursor));
        }
    }

    // ===== Events =====

    @Test
    void publishesSetAndDeleteEvents() throws ExecutionException, InterruptedException {
        storage.set(NAMESPACE, KEY, "v").get();
        storage.get(NAMESPACE, KEY).get();
        storage.delete(NAMESPACE, KEY).get();

        assertEquals(2, events.size());
        StorageEvent set = events.get(0);
        assertEquals(StorageEventType.SET, set.type());
        assertEquals("v", set.value());
        assertEquals(NOW, set.timestamp());
        assertEquals(InMemoryStorageAdapter.PROVIDER_ID, set.providerId());
        assertEquals(StorageEventType.DELETE, events.get(1).type());
        assertNull(events.get(1).value());
    }

    @Test
    void publishesErrorEvent() {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.get(NAMESPACE, KEY)).thenReturn(CompletableFuture.failedFuture(new IOException("io")));
        MediatedStorageService mediated = newService(port);
        List<StorageEvent> captured = new ArrayList<>();
        mediated.addListener(captured::add);

        assertThrows(ExecutionException.class, () -> mediated.get(NAMESPACE, KEY).get());

        assertEquals(1, captured.size());
        assertEquals(StorageEventType.ERROR, captured.get(0).type());
        assertEquals(StorageOperation.GET, captured.get(0).operation());
        assertEquals("mock", captured.get(0).providerId());
    }

    @Test
    void failingListenerIsIsolated() throws ExecutionException, InterruptedException {
        List<StorageEvent> late = new ArrayList<>();
        storage.addListener(event -> {
            throw new IllegalStateException("listener failure");
        });
        storage.addListener(late::add);

        assertDoesNotThrow(() -> storage.set(NAMESPACE, KEY, "v").get());

        assertEquals(1, late.size());
        assertEquals("v", storage.get(NAMESPACE, KEY).get());
    }

    @Test
    void removedListenerStopsReceivingEvents() throws ExecutionException, InterruptedException {
        List<StorageEvent> captured = new ArrayList<>();
        StorageEventListener listener = captured::add;
        storage.addListener(listener);
        storage.removeListener(listener);

        storage.set(NAMESPACE, KEY, "v").get();

        assertTrue(captured.isEmpty());
    }

    // ===== Passthroughs =====

    @Test
    void healthCheckReportsFalseOnFailure() throws ExecutionException, InterruptedException {
        KeyValueStoragePort port = mock(KeyValueStoragePort.class);
        when(port.providerId()).thenReturn("mock");
        when(port.healthCheck()).thenReturn(CompletableFuture.failedFuture(new IOException("down")));

        assertFalse(newService(port).healthCheck().get());
        assertTrue(storage.healthCheck().get());
    }

    @Test
    void registersStorageSlotsOnce() {
        assertDoesNotThrow(() -> newService(new InMemoryStorageAdapter()));
        assertEquals(StorageExtensionPoints.SLOTS.size(), registry.getSlots().size());
    }
}
