package me.golemcore.receipts.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.domain.model.StorageOptions;
import me.golemcore.receipts.infrastructure.config.ReceiptsProperties;
import me.golemcore.receipts.port.outbound.KeyValueStoragePort;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link KeyValueStoragePort}.
 *
 * <p>
 * Every namespace is a directory under the base path and every key a
 * {@code <key>.json} file inside it. Atomic writes go through a {@code .tmp}
 * file that is fsynced and renamed over the target; backups keep the previous
 * value as {@code .bak}.
 *
 * <p>
 * Base path configured via {@code receipts.storage.local.base-path}, defaults
 * to {@code ${user.home}/.golemcore/receipts}.
 */
@Slf4j
public class LocalStorageAdapter implements KeyValueStoragePort {

    public static final String PROVIDER_ID = "local";

    private static final String VALUE_EXTENSION = ".json";
    private static final String TEMP_EXTENSION = ".tmp";
    private static final String BACKUP_EXTENSION = ".bak";

    private final ReceiptsProperties properties;
    private final Path basePath;

    public LocalStorageAdapter(ReceiptsProperties properties) {
        this.properties = properties;
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    /**
     * Creates the base and receipts directories. Called by Spring; outside a
     * container the adapter also works without it, since writes create missing
     * namespace directories.
     */
    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(basePath);
            Files.createDirectories(basePath.resolve(properties.getStorage().getReceiptsNamespace()));
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory", e);
        }
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<String> get(String namespace, String key) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(namespace, key);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read value: " + namespace + "/" + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> set(String namespace, String key, String value, StorageOptions options) {
        StorageOptions effective = options != null ? options : StorageOptions.defaults();
        return CompletableFuture.runAsync(() -> {
            if (value == null) {
                throw new IllegalArgumentException("Null value for " + namespace + "/" + key);
            }
            Path filePath = resolvePath(namespace, key);
            if (effective.atomic()) {
                writeAtomic(filePath, value, effective.backup());
            } else {
                writePlain(filePath, value, effective.backup());
            }
        });
    }

    @Override
    public CompletableFuture<Void> delete(String namespace, String key) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(namespace, key));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to delete value: " + namespace + "/" + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> size(String namespace) {
        return keys(namespace).thenApply(List::size);
    }

    @Override
    public CompletableFuture<List<String>> keys(String namespace) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolveNamespace(namespace);
            if (!Files.isDirectory(dirPath)) {
                return List.of();
            }
            try (Stream<Path> paths = Files.walk(dirPath)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> dirPath.relativize(p).toString())
                        .filter(name -> name.endsWith(VALUE_EXTENSION))
                        .map(name -> name.substring(0, name.length() - VALUE_EXTENSION.length()))
                        .toList();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to list namespace: " + namespace, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return CompletableFuture.supplyAsync(() -> Files.isDirectory(basePath) && Files.isWritable(basePath));
    }

    private void writePlain(Path targetPath, String value, boolean backup) {
        try {
            createParent(targetPath);
            if (backup && Files.exists(targetPath)) {
                Files.copy(targetPath, sibling(targetPath, BACKUP_EXTENSION), StandardCopyOption.REPLACE_EXISTING);
            }
            Files.writeString(targetPath, value, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write value: " + targetPath.getFileName(), e);
        }
    }

    private void writeAtomic(Path targetPath, String value, boolean backup) {
        Path tempPath = sibling(targetPath, TEMP_EXTENSION);
        Path backupPath = sibling(targetPath, BACKUP_EXTENSION);

        try {
            createParent(targetPath);

            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            if (backup && Files.exists(targetPath)) {
                Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Storage] Created backup: {}", backupPath);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }

            log.debug("[Storage] Atomic write completed: {}", targetPath);

        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw new IllegalStateException("Atomic write failed: " + targetPath.getFileName(), e);
        }
    }

    private static void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static Path sibling(Path path, String extension) {
        return path.resolveSibling(path.getFileName() + extension);
    }

    private Path resolveNamespace(String namespace) {
        Path resolved = basePath.resolve(namespace).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + namespace);
        }
        return resolved;
    }

    private Path resolvePath(String namespace, String key) {
        Path namespacePath = resolveNamespace(namespace);
        Path resolved = namespacePath.resolve(key + VALUE_EXTENSION).normalize();
        if (!resolved.startsWith(namespacePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + namespace + "/" + key);
        }
        return resolved;
    }
}
