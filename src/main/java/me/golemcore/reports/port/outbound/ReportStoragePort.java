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

package me.golemcore.reports.port.outbound;

import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.domain.model.StoredObject;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the report backing store. Keys are store-relative and laid out as
 * {@code {agentName}/{date}_{time}/{filename}}. Implementations are selected
 * once per process (local filesystem or object store).
 */
public interface ReportStoragePort {

    /**
     * Backend this adapter implements.
     */
    ReportMode mode();

    /**
     * Store bytes under a key.
     *
     * @param key
     *            store-relative key
     * @param content
     *            bytes to write
     * @param contentType
     *            MIME type recorded with the object where supported
     * @return access locator (filesystem path or time-limited URL)
     */
    CompletableFuture<String> persist(String key, byte[] content, String contentType);

    /**
     * Read an object. Completes with {@code null} when the key does not exist.
     */
    CompletableFuture<byte[]> fetch(String key);

    /**
     * List objects under a prefix.
     *
     * @param prefix
     *            key prefix, empty for the whole store
     * @param fetchCeiling
     *            maximum number of objects to list; {@code <= 0} means
     *            unbounded
     */
    CompletableFuture<List<StoredObject>> list(String prefix, int fetchCeiling);

    /**
     * Issue a locator for an existing key without rewriting it.
     */
    String locate(String key);

    /**
     * How the HTML artifact should reference a sibling file of the same
     * report folder.
     */
    String linkFromArtifact(String key, String locator);
}
