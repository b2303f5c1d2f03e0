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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.domain.model.StoredObject;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.ReportStorageException;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * S3-compatible object store implementation of {@link ReportStoragePort}.
 *
 * <p>
 * Every stored object is reachable through a presigned GET URL valid for
 * {@code reports.s3.url-expiration}; the HTML artifact links its siblings by
 * those URLs. Listing follows {@code ListObjectsV2} continuation tokens until
 * the store is exhausted or the fetch ceiling is reached.
 */
@Slf4j
public class S3ReportStorageAdapter implements ReportStoragePort, AutoCloseable {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucket;
    private final Duration urlExpiration;
    private final int pageSize;

    public S3ReportStorageAdapter(S3Client s3Client, S3Presigner s3Presigner, ReportsProperties properties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucket = properties.getS3().getBucket();
        this.urlExpiration = properties.getS3().getUrlExpiration();
        this.pageSize = Math.max(1, properties.getS3().getPageSize());
    }

    @Override
    public ReportMode mode() {
        return ReportMode.REMOTE;
    }

    @Override
    public CompletableFuture<String> persist(String key, byte[] content, String contentType) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                s3Client.putObject(
                        PutObjectRequest.builder()
                                .bucket(bucket)
                                .key(key)
                                .contentLength((long) content.length)
                                .contentType(contentType)
                                .build(),
                        RequestBody.fromBytes(content));
                log.debug("[S3] Uploaded s3://{}/{} ({} bytes)", bucket, key, content.length);
                return locate(key);
            } catch (SdkException e) {
                throw new ReportStorageException("Failed to upload to S3: " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<byte[]> fetch(String key) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return s3Client.getObjectAsBytes(
                        GetObjectRequest.builder()
                                .bucket(bucket)
                                .key(key)
                                .build())
                        .asByteArray();
            } catch (NoSuchKeyException e) {
                return null;
            } catch (SdkException e) {
                throw new ReportStorageException("Failed to retrieve from S3: " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<StoredObject>> list(String prefix, int fetchCeiling) {
        return CompletableFuture.supplyAsync(() -> {
            List<StoredObject> objects = new ArrayList<>();
            String continuationToken = null;
            int pages = 0;
            try {
                do {
                    int maxKeys = pageSize;
                    if (fetchCeiling > 0) {
                        maxKeys = Math.min(pageSize, fetchCeiling - objects.size());
                    }
                    ListObjectsV2Request.Builder listBuilder = ListObjectsV2Request.builder()
                            .bucket(bucket)
                            .maxKeys(maxKeys);
                    if (prefix != null && !prefix.isEmpty()) {
                        listBuilder.prefix(prefix);
                    }
                    if (continuationToken != null && !continuationToken.isBlank()) {
                        listBuilder.continuationToken(continuationToken);
                    }
                    ListObjectsV2Response response = s3Client.listObjectsV2(listBuilder.build());
                    pages++;
                    for (S3Object object : response.contents()) {
                        objects.add(new StoredObject(object.key(), object.lastModified()));
                    }
                    continuationToken = Boolean.TRUE.equals(response.isTruncated())
                            ? response.nextContinuationToken()
                            : null;
                } while (continuationToken != null && (fetchCeiling <= 0 || objects.size() < fetchCeiling));
            } catch (SdkException e) {
                throw new ReportStorageException("Failed to list S3 objects under: " + prefix, e);
            }
            if (fetchCeiling > 0 && objects.size() > fetchCeiling) {
                objects = new ArrayList<>(objects.subList(0, fetchCeiling));
            }
            log.debug("[S3] Listed {} object(s) under '{}' in {} page(s)", objects.size(), prefix, pages);
            return objects;
        });
    }

    @Override
    public String locate(String key) {
        try {
            return s3Presigner.presignGetObject(
                    GetObjectPresignRequest.builder()
                            .signatureDuration(urlExpiration)
                            .getObjectRequest(
                                    GetObjectRequest.builder()
                                            .bucket(bucket)
                                            .key(key)
                                            .build())
                            .build())
                    .url()
                    .toString();
        } catch (SdkException e) {
            throw new ReportStorageException("Failed to generate signed URL for: " + key, e);
        }
    }

    @Override
    public String linkFromArtifact(String key, String locator) {
        return locator;
    }

    @Override
    public void close() {
        s3Presigner.close();
        s3Client.close();
    }
}
