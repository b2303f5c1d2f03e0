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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.BudgetSelection;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.EmbeddedAttachment;
import me.golemcore.reports.domain.model.FoundReport;
import me.golemcore.reports.domain.model.Report;
import me.golemcore.reports.domain.model.ReportFile;
import me.golemcore.reports.domain.model.ReportMetadata;
import me.golemcore.reports.domain.model.ReportQuery;
import me.golemcore.reports.domain.model.SubmissionResult;
import me.golemcore.reports.domain.model.SubmitReportCommand;
import me.golemcore.reports.domain.service.CombinedTextAttachmentBuilder.TextSource;
import me.golemcore.reports.domain.service.ReportPageBuilder.PageAttachment;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.NotificationPort;
import me.golemcore.reports.port.outbound.ReportStorageException;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Entry point for submitting and retrieving reports.
 *
 * <p>
 * A submission runs these steps in order, each failure handled on its own:
 * <ol>
 * <li>validate input and resolve the body (errors reject the call, nothing
 * is written)</li>
 * <li>capture one timestamp and tag, derive the report folder</li>
 * <li>stat, budget and persist the caller's files (a failing file becomes a
 * warning)</li>
 * <li>write the combined text file when two or more text files were read</li>
 * <li>render and persist {@code index.html} and {@code metadata.json} (a
 * failure here fails the submission)</li>
 * <li>notify, when the active backend has a notifier (a failure becomes a
 * warning, stored content is kept)</li>
 * </ol>
 *
 * <p>
 * Storage layout: {@code {agent}/{yyyy-MM-dd}_{HH-mm-ss}/...} in the
 * configured time zone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    public static final String ARTIFACT_FILENAME = "index.html";

    static final DateTimeFormatter FOLDER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private static final String UNKNOWN_HOST = "unknown";

    private final ReportStoragePort storagePort;
    private final NotificationPort notificationPort;
    private final TagGenerator tagGenerator;
    private final ContentClassifier contentClassifier;
    private final AttachmentBudgeter attachmentBudgeter;
    private final CombinedTextAttachmentBuilder combinedTextBuilder;
    private final ReportPageBuilder pageBuilder;
    private final NotificationComposer notificationComposer;
    private final ReportIndexService indexService;
    private final ObjectMapper objectMapper;
    private final ReportsProperties properties;
    private final Clock clock;

    public SubmissionResult submit(SubmitReportCommand command) {
        validate(command);
        String body = resolveBody(command);

        ZoneId zone = zone();
        Instant timestamp = clock.instant();
        ZonedDateTime time = timestamp.atZone(zone);
        String tag = tagGenerator.generate();
        Report report = Report.builder()
                .agentName(command.getAgentName())
                .title(command.getTitle())
                .body(body)
                .files(new ArrayList<>(dedupe(command.getFiles())))
                .tag(tag)
                .timestamp(timestamp)
                .urgent(command.isUrgent())
                .folder(command.getAgentName() + "/" + FOLDER_TIME.format(time))
                .date(DATE.format(time))
                .hour(time.getHour())
                .minute(time.getMinute())
                .build();
        String hostLabel = hostLabel();
        List<String> warnings = new ArrayList<>();
        log.info("[Reports] Submitting report {} for {} ({} file(s), mode {})", tag, report.getAgentName(),
                report.getFiles().size(), storagePort.mode());

        List<ReportFile> files = statFiles(report.getFiles(), warnings);
        BudgetSelection selection = attachmentBudgeter.select(files,
                properties.getAttachments().getMaxEmbeddedCount(),
                properties.getAttachments().getMaxEmbeddedBytes());

        List<AttachmentRecord> records = new ArrayList<>();
        List<EmbeddedAttachment> embedded = new ArrayList<>();
        List<TextSource> textSources = new ArrayList<>();
        Set<String> usedNames = new HashSet<>(Set.of(ARTIFACT_FILENAME, ReportIndexService.METADATA_FILENAME,
                CombinedTextAttachmentBuilder.FILENAME));

        for (ReportFile file : selection.all()) {
            byte[] content;
            try {
                content = Files.readAllBytes(Path.of(file.getPath()));
            } catch (IOException | InvalidPathException e) {
                warn(warnings, "Could not read " + file.getPath() + ": " + e.getMessage());
                continue;
            }
            if (file.getRole() == ContentRole.TEXT) {
                textSources.add(new TextSource(file.getFilename(), file.getPath(),
                        new String(content, StandardCharsets.UTF_8)));
            }

            String storedName = uniqueName(file.getFilename(), usedNames);
            String locator;
            try {
                locator = storagePort.persist(report.getFolder() + "/" + storedName, content,
                        file.getContentType()).join();
            } catch (CompletionException | ReportStorageException e) {
                warn(warnings, "Could not store " + file.getFilename() + ": " + rootMessage(e));
                continue;
            }

            boolean embed = selection.isEmbedded(file);
            if (embed) {
                embedded.add(EmbeddedAttachment.builder()
                        .filename(storedName)
                        .contentType(file.getContentType())
                        .data(content)
                        .build());
            }
            records.add(AttachmentRecord.builder()
                    .filename(storedName)
                    .sizeBytes(content.length)
                    .role(file.getRole())
                    .contentType(file.getContentType())
                    .locator(locator)
                    .embedded(embed)
                    .build());
        }
        int attachmentCount = records.size();

        boolean combinedCreated = false;
        if (combinedTextBuilder.isApplicable(textSources)) {
            byte[] combined = combinedTextBuilder.build(textSources, timestamp).getBytes(StandardCharsets.UTF_8);
            try {
                String locator = storagePort.persist(report.getFolder() + "/" + CombinedTextAttachmentBuilder.FILENAME,
                        combined, "text/plain").join();
                records.add(AttachmentRecord.builder()
                        .filename(CombinedTextAttachmentBuilder.FILENAME)
                        .sizeBytes(combined.length)
                        .role(ContentRole.TEXT)
                        .contentType("text/plain")
                        .locator(locator)
                        .derived(true)
                        .build());
                combinedCreated = true;
                log.debug("[Reports] Combined {} text file(s) for report {}", textSources.size(), tag);
            } catch (CompletionException | ReportStorageException e) {
                warn(warnings, "Could not store combined text file: " + rootMessage(e));
            }
        }

        String artifactKey = report.getFolder() + "/" + ARTIFACT_FILENAME;
        List<PageAttachment> pageAttachments = new ArrayList<>();
        for (AttachmentRecord record : records) {
            String key = report.getFolder() + "/" + record.getFilename();
            pageAttachments.add(new PageAttachment(record.getFilename(),
                    storagePort.linkFromArtifact(key, record.getLocator()),
                    record.getRole() == ContentRole.IMAGE));
        }
        String page = pageBuilder.build(report, hostLabel, zone, pageAttachments);
        String artifactLocator = persistRequired(artifactKey, page.getBytes(StandardCharsets.UTF_8),
                "text/html", "report artifact");

        ReportMetadata metadata = ReportMetadata.builder()
                .tag(tag)
                .agentName(report.getAgentName())
                .title(report.getTitle())
                .timestamp(timestamp)
                .date(report.getDate())
                .hour(report.getHour())
                .minute(report.getMinute())
                .artifactLocator(artifactLocator)
                .hostLabel(hostLabel)
                .mode(storagePort.mode())
                .reportFolder(report.getFolder())
                .artifactKey(artifactKey)
                .build();
        persistRequired(report.getFolder() + "/" + ReportIndexService.METADATA_FILENAME, toJson(metadata),
                "application/json", "metadata record");

        boolean notified = false;
        if (notificationPort.isEnabled()) {
            notified = notify(report, hostLabel, zone, artifactLocator, records, embedded, warnings);
        }

        writeLatestLocator(artifactLocator, warnings);

        log.info("[Reports] Stored report {} at {} ({} attachment(s), {} embedded, notified={})", tag,
                artifactLocator, attachmentCount, embedded.size(), notified);
        return SubmissionResult.builder()
                .tag(tag)
                .locator(artifactLocator)
                .mode(storagePort.mode())
                .hostLabel(hostLabel)
                .attachmentCount(attachmentCount)
                .embeddedCount(embedded.size())
                .combinedTextCreated(combinedCreated)
                .notified(notified)
                .attachments(records)
                .warnings(warnings)
                .build();
    }

    public List<ReportMetadata> list(ReportQuery query) {
        return indexService.find(query);
    }

    /**
     * Point lookup by tag, or by agent and date/hour/minute. The two forms are
     * mutually exclusive.
     */
    public Optional<FoundReport> get(String tag, String agentName, String date, Integer hour, Integer minute,
            boolean includeAncient) {
        boolean byTag = tag != null && !tag.isBlank();
        boolean byCoordinates = (agentName != null && !agentName.isBlank()) || (date != null && !date.isBlank())
                || hour != null || minute != null;
        if (byTag && byCoordinates) {
            throw new IllegalArgumentException("Use either tag or agentName/date/hour/minute, not both");
        }
        if (byTag) {
            return indexService.findByTag(tag, includeAncient);
        }
        return indexService.findAt(agentName, date, hour, minute, includeAncient);
    }

    private boolean notify(Report report, String hostLabel, ZoneId zone, String artifactLocator,
            List<AttachmentRecord> records, List<EmbeddedAttachment> embedded, List<String> warnings) {
        try {
            NotificationComposer.Composition composition = notificationComposer.compose(report, hostLabel, zone,
                    artifactLocator, List.copyOf(records), embedded);
            records.addAll(composition.derivedFiles());
            notificationPort.send(composition.notification()).join();
            log.info("[Notify] Sent notification for report {}", report.getTag());
            return true;
        } catch (CompletionException | IllegalStateException e) {
            warn(warnings, "Notification failed: " + rootMessage(e));
            return false;
        }
    }

    private void writeLatestLocator(String locator, List<String> warnings) {
        String target = properties.getLatestLocatorFile();
        if (target == null || target.isBlank()) {
            return;
        }
        try {
            Path path = Path.of(target);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, locator + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            warn(warnings, "Could not write latest locator file " + target + ": " + e.getMessage());
        }
    }

    private String persistRequired(String key, byte[] content, String contentType, String what) {
        try {
            return storagePort.persist(key, content, contentType).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ReportStorageException("Failed to store " + what + " " + key + ": " + cause.getMessage(), cause);
        }
    }

    private byte[] toJson(ReportMetadata metadata) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata);
        } catch (JsonProcessingException e) {
            throw new ReportStorageException("Failed to serialize metadata for report " + metadata.getTag(), e);
        }
    }

    private List<ReportFile> statFiles(List<String> paths, List<String> warnings) {
        List<ReportFile> files = new ArrayList<>();
        for (String rawPath : paths) {
            try {
                Path path = Path.of(rawPath);
                if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
                    warn(warnings, "Skipping " + rawPath + ": not a readable file");
                    continue;
                }
                String filename = path.getFileName().toString();
                files.add(ReportFile.builder()
                        .path(rawPath)
                        .filename(filename)
                        .sizeBytes(Files.size(path))
                        .role(contentClassifier.classify(filename))
                        .contentType(contentClassifier.contentType(filename))
                        .build());
            } catch (IOException | InvalidPathException e) {
                warn(warnings, "Skipping " + rawPath + ": " + e.getMessage());
            }
        }
        return files;
    }

    private void validate(SubmitReportCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Report submission is required");
        }
        if (command.getAgentName() == null || command.getAgentName().isBlank()) {
            throw new IllegalArgumentException("agentName is required");
        }
        ReportIndexService.requireSafeSegment(command.getAgentName(), "agentName");
        if (command.getTitle() == null || command.getTitle().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        boolean hasBody = command.getBody() != null;
        boolean hasBodyFile = command.getBodyFilePath() != null && !command.getBodyFilePath().isBlank();
        if (hasBody == hasBodyFile) {
            throw new IllegalArgumentException("Exactly one of body or bodyFilePath must be provided");
        }
    }

    private String resolveBody(SubmitReportCommand command) {
        if (command.getBody() != null) {
            return command.getBody();
        }
        try {
            return Files.readString(Path.of(command.getBodyFilePath()), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            throw new IllegalArgumentException("Cannot read report body from " + command.getBodyFilePath()
                    + ": " + e.getMessage(), e);
        }
    }

    private ZoneId zone() {
        String zone = properties.getTimeZone();
        return zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone);
    }

    private String hostLabel() {
        String configured = properties.getHostLabel();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("[Reports] Host name unavailable: {}", e.getMessage());
            return UNKNOWN_HOST;
        }
    }

    private static List<String> dedupe(List<String> files) {
        if (files == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String file : files) {
            if (file != null && !file.isBlank()) {
                unique.add(file);
            }
        }
        return List.copyOf(unique);
    }

    // Two caller files with the same base name must not overwrite each other
    private static String uniqueName(String filename, Set<String> usedNames) {
        String candidate = filename;
        int suffix = 1;
        while (!usedNames.add(candidate)) {
            candidate = suffix + "_" + filename;
            suffix++;
        }
        return candidate;
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }

    private static void warn(List<String> warnings, String message) {
        log.warn("[Reports] {}", message);
        warnings.add(message);
    }
}
