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

package me.golemcore.reports.adapter.outbound.storage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.domain.model.StoredObject;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.ReportStorageException;
import me.golemcore.reports.port.outbound.ReportStoragePort;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link ReportStoragePort}.
 *
 * <p>
 * Keys resolve under {@code reports.local-folder} ({@code ${user.home}} is
 * expanded). Locators are absolute filesystem paths and the HTML artifact
 * links its siblings by file name, so a report folder can be opened in a
 * browser straight from disk. Nothing is sent over the network.
 *
 * @see me.golemcore.reports.port.outbound.ReportStoragePort
 */
@Slf4j
public class LocalReportStorageAdapter implements ReportStoragePort {

    private final Path basePath;

    public LocalReportStorageAdapter(ReportsProperties properties) {
        String folder = properties.getLocalFolder().trim();
        this.basePath = Paths.get(folder.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(basePath);
            log.info("[Storage] Local report folder: {}", basePath);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create report folder " + basePath, e);
        }
    }

    public Path getBasePath() {
        return basePath;
    }

    @Override
    public ReportMode mode() {
        return ReportMode.LOCAL;
    }

    @Override
    public CompletableFuture<String> persist(String key, byte[] content, String contentType) {
        return CompletableFuture.supplyAsync(() -> {
            Path targetPath = resolvePath(key);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(tempPath, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Wrote {} ({} bytes)", key, content.length);
                return targetPath.toString();
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new ReportStorageException("Failed to write file: " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<byte[]> fetch(String key) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(key);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readAllBytes(filePath);
            } catch (IOException e) {
                throw new ReportStorageException("Failed to read file: " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<StoredObject>> list(String prefix, int fetchCeiling) {
        return CompletableFuture.supplyAsync(() -> {
            Path start = prefix != null && !prefix.isEmpty() ? resolvePath(prefix) : basePath;
            if (!Files.isDirectory(start)) {
                return Collections.emptyList();
            }
            try (Stream<Path> paths = Files.walk(start)) {
                Stream<StoredObject> objects = paths
                        .filter(Files::isRegularFile)
                        .map(this::toStoredObject)
                        .sorted(Comparator.comparing(StoredObject::key));
                if (fetchCeiling > 0) {
                    objects = objects.limit(fetchCeiling);
                }
                return objects.toList();
            } catch (IOException | UncheckedIOException e) {
                throw new ReportStorageException("Failed to list files: " + prefix, e);
            }
        });
    }

    @Override
    public String locate(String key) {
        return resolvePath(key).toString();
    }

    @Override
    public String linkFromArtifact(String key, String locator) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    private StoredObject toStoredObject(Path path) {
        String key = basePath.relativize(path).toString().replace('\\', '/');
        try {
            return new StoredObject(key, Files.getLastModifiedTime(path).toInstant());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path resolvePath(String key) {
        Path resolved = basePath.resolve(key).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + key);
        }
        return resolved;
    }
}
