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

package me.golemcore.reports.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.FoundReport;
import me.golemcore.reports.domain.model.ReportMetadata;
import me.golemcore.reports.domain.model.ReportQuery;
import me.golemcore.reports.domain.model.StoredObject;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.ReportStorageException;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Searches stored reports through their {@code metadata.json} records.
 *
 * <p>
 * There is no separate index: every search lists the store (optionally under
 * one agent's prefix), reads the metadata records and filters them in memory.
 * Listing is bounded by {@code reports.search.fetch-ceiling} unless the query
 * asks for ancient reports. Tag searches and tag lookups also lift the ceiling
 * when {@code reports.search.tag-lookup-unbounded} is set. Coordinate lookups
 * always honor the ceiling.
 *
 * <p>
 * Ordering:
 * <ul>
 * <li>tag searches read records newest-modified first and stop once the cap
 * is reached; equal modification times keep listing order</li>
 * <li>other searches return matches sorted by report timestamp, newest
 * first</li>
 * <li>point lookups stop at the first match, newest first</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportIndexService {

    public static final String METADATA_FILENAME = "metadata.json";

    private static final Comparator<StoredObject> NEWEST_MODIFIED_FIRST = Comparator
            .comparing(StoredObject::lastModified, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private static final Comparator<ReportMetadata> NEWEST_TIMESTAMP_FIRST = Comparator
            .comparing(ReportMetadata::getTimestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final ReportStoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ReportsProperties properties;

    public List<ReportMetadata> find(ReportQuery query) {
        validate(query);
        int maxResults = query.getMaxResults() != null
                ? query.getMaxResults()
                : properties.getSearch().getDefaultMaxResults();
        List<StoredObject> records = listMetadataRecords(query.getAgentName(), ceilingFor(query));

        if (query.isTagSearch()) {
            records.sort(NEWEST_MODIFIED_FIRST);
            List<ReportMetadata> results = new ArrayList<>();
            for (StoredObject record : records) {
                if (results.size() >= maxResults) {
                    break;
                }
                readMetadata(record.key())
                        .filter(query::matches)
                        .ifPresent(results::add);
            }
            log.debug("[Search] Tag {} matched {} report(s)", query.getTag(), results.size());
            return results;
        }

        List<ReportMetadata> matches = new ArrayList<>();
        for (StoredObject record : records) {
            readMetadata(record.key())
                    .filter(query::matches)
                    .ifPresent(matches::add);
        }
        matches.sort(NEWEST_TIMESTAMP_FIRST);
        log.debug("[Search] {} of {} record(s) matched", matches.size(), records.size());
        return matches.size() > maxResults ? new ArrayList<>(matches.subList(0, maxResults)) : matches;
    }

    public Optional<FoundReport> findByTag(String tag, boolean includeAncient) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag is required");
        }
        ReportQuery query = ReportQuery.builder()
                .tag(tag.trim().toUpperCase(Locale.ROOT))
                .includeAncient(includeAncient)
                .build();
        return findFirst(query);
    }

    public Optional<FoundReport> findAt(String agentName, String date, Integer hour, Integer minute,
            boolean includeAncient) {
        if (agentName == null || agentName.isBlank() || date == null || date.isBlank()
                || hour == null || minute == null) {
            throw new IllegalArgumentException("agentName, date, hour and minute are all required");
        }
        ReportQuery query = ReportQuery.builder()
                .agentName(agentName)
                .date(date)
                .hour(hour)
                .minute(minute)
                .includeAncient(includeAncient)
                .build();
        return findFirst(query);
    }

    /**
     * Issue a fresh locator for a stored report. Falls back to the locator
     * recorded at submission for records without an artifact key.
     */
    public String locate(ReportMetadata metadata) {
        if (metadata.getArtifactKey() != null && !metadata.getArtifactKey().isBlank()) {
            return storagePort.locate(metadata.getArtifactKey());
        }
        return metadata.getArtifactLocator();
    }

    private Optional<FoundReport> findFirst(ReportQuery query) {
        validate(query);
        List<StoredObject> records = listMetadataRecords(query.getAgentName(), ceilingFor(query));
        records.sort(NEWEST_MODIFIED_FIRST);
        for (StoredObject record : records) {
            Optional<ReportMetadata> match = readMetadata(record.key()).filter(query::matches);
            if (match.isPresent()) {
                return Optional.of(new FoundReport(match.get(), locate(match.get())));
            }
        }
        return Optional.empty();
    }

    private int ceilingFor(ReportQuery query) {
        if (query.isIncludeAncient()) {
            return 0;
        }
        if (query.isTagSearch() && properties.getSearch().isTagLookupUnbounded()) {
            return 0;
        }
        return properties.getSearch().getFetchCeiling();
    }

    private List<StoredObject> listMetadataRecords(String agentName, int ceiling) {
        String prefix = agentName == null || agentName.isBlank() ? "" : agentName + "/";
        List<StoredObject> listed;
        try {
            listed = storagePort.list(prefix, ceiling).join();
        } catch (CompletionException e) {
            throw unwrap(e, "Failed to list reports under '" + prefix + "'");
        }
        List<StoredObject> records = new ArrayList<>();
        for (StoredObject object : listed) {
            if (object.key().endsWith("/" + METADATA_FILENAME) || object.key().equals(METADATA_FILENAME)) {
                records.add(object);
            }
        }
        log.debug("[Search] Listed {} object(s) under '{}', {} metadata record(s)", listed.size(), prefix,
                records.size());
        return records;
    }

    private Optional<ReportMetadata> readMetadata(String key) {
        try {
            byte[] bytes = storagePort.fetch(key).join();
            if (bytes == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(bytes, ReportMetadata.class));
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable records are skipped
            log.warn("[Search] Skipping unreadable metadata record {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    static void validate(ReportQuery query) {
        if (query.getAgentName() != null && !query.getAgentName().isBlank()) {
            requireSafeSegment(query.getAgentName(), "agentName");
        }
        if (query.getDate() != null && !query.getDate().isBlank()) {
            try {
                LocalDate.parse(query.getDate());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("date must be YYYY-MM-DD: " + query.getDate(), e);
            }
        }
        if (query.getHour() != null && (query.getHour() < 0 || query.getHour() > 23)) {
            throw new IllegalArgumentException("hour must be between 0 and 23: " + query.getHour());
        }
        if (query.getMinute() != null && (query.getMinute() < 0 || query.getMinute() > 59)) {
            throw new IllegalArgumentException("minute must be between 0 and 59: " + query.getMinute());
        }
        if (query.getMaxResults() != null && query.getMaxResults() < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + query.getMaxResults());
        }
    }

    /**
     * Agent names become a storage path segment.
     */
    static void requireSafeSegment(String value, String field) {
        if (value.contains("/") || value.contains("\\") || value.contains("..") || value.isBlank()) {
            throw new IllegalArgumentException(field + " must be a single path segment: " + value);
        }
    }

    static RuntimeException unwrap(CompletionException e, String message) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof ReportStorageException storageException) {
            return storageException;
        }
        if (cause instanceof IllegalArgumentException illegalArgument) {
            return illegalArgument;
        }
        return new ReportStorageException(message, cause);
    }
}
