package me.golemcore.receipts.adapter.outbound.storage;

import me.golemcore.receipts.domain.model.StorageOptions;
import me.golemcore.receipts.infrastructure.config.ReceiptsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String NAMESPACE = "receipts";
    private static final String CONTENT_DEFAULT = "{\"value\":1}";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ReceiptsProperties properties = new ReceiptsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesReceiptsNamespace() {
        assertTrue(Files.isDirectory(tempDir.resolve(NAMESPACE)));
    }

    @Test
    void setAndGet() throws ExecutionException, InterruptedException {
        storageAdapter.set(NAMESPACE, "rcpt_1", CONTENT_DEFAULT, StorageOptions.defaults()).get();

        assertEquals(CONTENT_DEFAULT, storageAdapter.get(NAMESPACE, "rcpt_1").get());
        assertTrue(Files.exists(tempDir.resolve(NAMESPACE).resolve("rcpt_1.json")));
    }

    @Test
    void getReturnsNullForMissingKey() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.get(NAMESPACE, "missing").get());
    }

    @Test
    void atomicWriteLeavesNoTempFile() throws Exception {
        storageAdapter.set(NAMESPACE, "rcpt_2", "first", StorageOptions.atomicWrite()).get();
        storageAdapter.set(NAMESPACE, "rcpt_2", "second", StorageOptions.atomicWrite()).get();

        assertEquals("second", storageAdapter.get(NAMESPACE, "rcpt_2").get());
        assertFalse(Files.exists(tempDir.resolve(NAMESPACE).resolve("rcpt_2.json.tmp")));
    }

    @Test
    void backupKeepsPreviousValue() throws Exception {
        storageAdapter.set(NAMESPACE, "config", "v1", StorageOptions.defaults()).get();
        storageAdapter.set(NAMESPACE, "config", "v2", new StorageOptions(true, true)).get();

        Path backup = tempDir.resolve(NAMESPACE).resolve("config.json.bak");
        assertEquals("v1", Files.readString(backup, StandardCharsets.UTF_8));
        assertEquals("v2", storageAdapter.get(NAMESPACE, "config").get());
    }

    @Test
    void deleteRemovesValue() throws ExecutionException, InterruptedException {
        storageAdapter.set(NAMESPACE, "gone", CONTENT_DEFAULT, null).get();

        storageAdapter.delete(NAMESPACE, "gone").get();

        assertNull(storageAdapter.get(NAMESPACE, "gone").get());
    }

    @Test
    void deleteMissingKeySucceeds() {
        assertDoesNotThrow(() -> storageAdapter.delete(NAMESPACE, "never-written").get());
    }

    @Test
    void keysAndSizeIgnoreBackups() throws ExecutionException, InterruptedException {
        storageAdapter.set(NAMESPACE, "a", "1", StorageOptions.defaults()).get();
        storageAdapter.set(NAMESPACE, "b", "1", StorageOptions.defaults()).get();
        storageAdapter.set(NAMESPACE, "b", "2", new StorageOptions(false, true)).get();

        List<String> keys = storageAdapter.keys(NAMESPACE).get();

        assertEquals(List.of("a", "b"), keys.stream().sorted().toList());
        assertEquals(2, storageAdapter.size(NAMESPACE).get());
    }

    @Test
    void keysOfUnknownNamespaceIsEmpty() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.keys("nothing-here").get().isEmpty());
        assertEquals(0, storageAdapter.size("nothing-here").get());
    }

    @Test
    void nullValueIsRejected() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.set(NAMESPACE, "k", null, StorageOptions.defaults()).get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void pathTraversalIsBlocked() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.get(NAMESPACE, "../../etc/passwd").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());

        ExecutionException nsEx = assertThrows(ExecutionException.class,
                () -> storageAdapter.keys("..").get());
        assertInstanceOf(IllegalArgumentException.class, nsEx.getCause());
    }

    @Test
    void healthCheckReportsWritableBase() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.healthCheck().get());
        assertEquals(LocalStorageAdapter.PROVIDER_ID, storageAdapter.providerId());
    }

    @Test
    void worksWithoutContainerInitialization() throws ExecutionException, InterruptedException {
        ReceiptsProperties properties = new ReceiptsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("standalone").toString());
        LocalStorageAdapter standalone = new LocalStorageAdapter(properties);

        standalone.set(NAMESPACE, "rcpt_1", CONTENT_DEFAULT, StorageOptions.atomicWrite()).get();

        assertEquals(CONTENT_DEFAULT, standalone.get(NAMESPACE, "rcpt_1").get());
        assertEquals(List.of("rcpt_1"), standalone.keys(NAMESPACE).get());
    }
}
