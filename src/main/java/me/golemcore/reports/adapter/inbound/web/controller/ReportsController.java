package me.golemcore.reports.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.adapter.inbound.web.dto.AttachmentDto;
import me.golemcore.reports.adapter.inbound.web.dto.ReportDto;
import me.golemcore.reports.adapter.inbound.web.dto.SubmitReportRequest;
import me.golemcore.reports.adapter.inbound.web.dto.SubmitReportResponse;
import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.FoundReport;
import me.golemcore.reports.domain.model.ReportMetadata;
import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.domain.model.ReportQuery;
import me.golemcore.reports.domain.model.SubmissionResult;
import me.golemcore.reports.domain.model.SubmitReportCommand;
import me.golemcore.reports.domain.service.ReportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Report submission and lookup endpoints.
 *
 * <p>
 * Service calls touch the filesystem, the object store and SMTP, so they run
 * on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportsController {

    private final ReportService reportService;

    @PostMapping
    public Mono<ResponseEntity<SubmitReportResponse>> submit(@RequestBody SubmitReportRequest request) {
        return Mono.fromCallable(() -> {
            SubmitReportCommand command = SubmitReportCommand.builder()
                    .agentName(request.getAgentName())
                    .title(request.getTitle())
                    .body(request.getBody())
                    .bodyFilePath(request.getBodyFilePath())
                    .files(request.getFiles() != null ? request.getFiles() : new ArrayList<>())
                    .urgent(request.isUrgent())
                    .build();
            SubmissionResult result = reportService.submit(command);
            log.info("[API] Report {} submitted by {}", result.getTag(), request.getAgentName());
            return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<List<ReportDto>>> listReports(
            @RequestParam(required = false) String agentName,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) Integer hour,
            @RequestParam(required = false) Integer minute,
            @RequestParam(required = false) Integer maxResults,
            @RequestParam(defaultValue = "false") boolean includeAncient) {
        ReportQuery query = ReportQuery.builder()
                .agentName(agentName)
                .tag(tag)
                .date(date)
                .hour(hour)
                .minute(minute)
                .maxResults(maxResults)
                .includeAncient(includeAncient)
                .build();
        return Mono.fromCallable(() -> {
            List<ReportDto> dtos = reportService.list(query).stream()
                    .map(metadata -> toDto(metadata, metadata.getArtifactLocator()))
                    .toList();
            return ResponseEntity.ok(dtos);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/at")
    public Mono<ResponseEntity<ReportDto>> getReportAt(
            @RequestParam String agentName,
            @RequestParam String date,
            @RequestParam Integer hour,
            @RequestParam Integer minute,
            @RequestParam(defaultValue = "false") boolean includeAncient) {
        return Mono.fromCallable(() -> found(
                reportService.get(null, agentName, date, hour, minute, includeAncient),
                "No report by " + agentName + " at " + date + " " + hour + ":" + minute))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{tag}")
    public Mono<ResponseEntity<ReportDto>> getReport(
            @PathVariable String tag,
            @RequestParam(defaultValue = "false") boolean includeAncient) {
        return Mono.fromCallable(() -> found(
                reportService.get(tag, null, null, null, null, includeAncient),
                "Report not found: " + tag.toUpperCase(Locale.ROOT)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<ReportDto> found(Optional<FoundReport> report, String notFoundMessage) {
        if (report.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, notFoundMessage);
        }
        return ResponseEntity.ok(toDto(report.get().metadata(), report.get().locator()));
    }

    private ReportDto toDto(ReportMetadata metadata, String locator) {
        return ReportDto.builder()
                .tag(metadata.getTag())
                .agentName(metadata.getAgentName())
                .title(metadata.getTitle())
                .timestamp(metadata.getTimestamp() != null ? metadata.getTimestamp().toString() : null)
                .date(metadata.getDate())
                .hour(metadata.getHour())
                .minute(metadata.getMinute())
                .locator(locator)
                .hostLabel(metadata.getHostLabel())
                .mode(modeName(metadata.getMode()))
                .build();
    }

    private SubmitReportResponse toResponse(SubmissionResult result) {
        List<AttachmentDto> attachments = result.getAttachments().stream()
                .map(this::toAttachmentDto)
                .toList();
        return SubmitReportResponse.builder()
                .tag(result.getTag())
                .locator(result.getLocator())
                .mode(modeName(result.getMode()))
                .hostLabel(result.getHostLabel())
                .attachmentCount(result.getAttachmentCount())
                .embeddedCount(result.getEmbeddedCount())
                .combinedTextCreated(result.isCombinedTextCreated())
                .notified(result.isNotified())
                .attachments(attachments)
                .warnings(List.copyOf(result.getWarnings()))
                .build();
    }

    private AttachmentDto toAttachmentDto(AttachmentRecord record) {
        return AttachmentDto.builder()
                .filename(record.getFilename())
                .sizeBytes(record.getSizeBytes())
                .role(record.getRole() != null ? record.getRole().name().toLowerCase(Locale.ROOT) : null)
                .contentType(record.getContentType())
                .locator(record.getLocator())
                .embedded(record.isEmbedded())
                .derived(record.isDerived())
                .build();
    }

    private static String modeName(ReportMode mode) {
        return mode != null ? mode.name().toLowerCase(Locale.ROOT) : null;
    }
}
