package me.golemcore.reports.adapter.inbound.web.controller;

import me.golemcore.reports.adapter.inbound.web.dto.ReportDto;
import me.golemcore.reports.adapter.inbound.web.dto.SubmitReportRequest;
import me.golemcore.reports.adapter.inbound.web.dto.SubmitReportResponse;
import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.FoundReport;
import me.golemcore.reports.domain.model.ReportMetadata;
import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.domain.model.ReportQuery;
import me.golemcore.reports.domain.model.SubmissionResult;
import me.golemcore.reports.domain.model.SubmitReportCommand;
import me.golemcore.reports.domain.service.ReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportsControllerTest {

    private ReportService reportService;
    private ReportsController controller;

    @BeforeEach
    void setUp() {
        reportService = mock(ReportService.class);
        controller = new ReportsController(reportService);
    }

    @Test
    void submitShouldReturnCreatedWithResult() {
        SubmissionResult result = SubmissionResult.builder()
                .tag("AB12")
                .locator("/reports/trainer/2026-03-01_13-05-09/index.html")
                .mode(ReportMode.LOCAL)
                .hostLabel("gpu-01")
                .attachmentCount(1)
                .attachments(List.of(AttachmentRecord.builder()
                        .filename("plot.png").sizeBytes(3).role(ContentRole.IMAGE).embedded(true).build()))
                .warnings(List.of("Skipping /tmp/x: not a readable file"))
                .build();
        when(reportService.submit(any())).thenReturn(result);
        SubmitReportRequest request = SubmitReportRequest.builder()
                .agentName("trainer")
                .title("Nightly")
                .body("done")
                .files(List.of("/tmp/plot.png", "/tmp/x"))
                .urgent(true)
                .build();

        StepVerifier.create(controller.submit(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    SubmitReportResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("AB12", body.getTag());
                    assertEquals("local", body.getMode());
                    assertEquals(1, body.getAttachmentCount());
                    assertEquals("image", body.getAttachments().get(0).getRole());
                    assertTrue(body.getAttachments().get(0).isEmbedded());
                    assertEquals(1, body.getWarnings().size());
                })
                .verifyComplete();

        ArgumentCaptor<SubmitReportCommand> command = ArgumentCaptor.forClass(SubmitReportCommand.class);
        verify(reportService).submit(command.capture());
        assertEquals("trainer", command.getValue().getAgentName());
        assertEquals(2, command.getValue().getFiles().size());
        assertTrue(command.getValue().isUrgent());
    }

    @Test
    void submitShouldPropagateValidationErrors() {
        when(reportService.submit(any())).thenThrow(new IllegalArgumentException("title is required"));

        StepVerifier.create(controller.submit(SubmitReportRequest.builder().agentName("trainer").build()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void listShouldPassFiltersAndMapMetadata() {
        when(reportService.list(any())).thenReturn(List.of(metadata()));

        StepVerifier.create(controller.listReports("trainer", null, "2026-03-01", 13, null, 5, true))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<ReportDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.size());
                    assertEquals("AB12", body.get(0).getTag());
                    assertEquals("stored-locator", body.get(0).getLocator());
                    assertEquals("2026-03-01T13:05:09Z", body.get(0).getTimestamp());
                    assertEquals("remote", body.get(0).getMode());
                })
                .verifyComplete();

        ArgumentCaptor<ReportQuery> query = ArgumentCaptor.forClass(ReportQuery.class);
        verify(reportService).list(query.capture());
        assertEquals("trainer", query.getValue().getAgentName());
        assertNull(query.getValue().getTag());
        assertEquals(13, query.getValue().getHour());
        assertEquals(5, query.getValue().getMaxResults());
        assertTrue(query.getValue().isIncludeAncient());
    }

    @Test
    void getByTagShouldReturnFreshLocator() {
        when(reportService.get("ab12", null, null, null, null, false))
                .thenReturn(Optional.of(new FoundReport(metadata(), "fresh-locator")));

        StepVerifier.create(controller.getReport("ab12", false))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("fresh-locator", response.getBody().getLocator());
                })
                .verifyComplete();
    }

    @Test
    void getByTagShouldReturnNotFound() {
        when(reportService.get("ZZZZ", null, null, null, null, false)).thenReturn(Optional.empty());

        StepVerifier.create(controller.getReport("ZZZZ", false))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException ex = (ResponseStatusException) error;
                    assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
                    assertFalse(ex.getReason().isBlank());
                })
                .verify();
    }

    @Test
    void getAtShouldLookUpByCoordinates() {
        when(reportService.get(null, "trainer", "2026-03-01", 13, 5, true))
                .thenReturn(Optional.of(new FoundReport(metadata(), "fresh-locator")));

        StepVerifier.create(controller.getReportAt("trainer", "2026-03-01", 13, 5, true))
                .assertNext(response -> assertEquals("Nightly", response.getBody().getTitle()))
                .verifyComplete();
    }

    private static ReportMetadata metadata() {
        return ReportMetadata.builder()
                .tag("AB12")
                .agentName("trainer")
                .title("Nightly")
                .timestamp(Instant.parse("2026-03-01T13:05:09Z"))
                .date("2026-03-01")
                .hour(13)
                .minute(5)
                .artifactLocator("stored-locator")
                .hostLabel("gpu-01")
                .mode(ReportMode.REMOTE)
                .build();
    }
}
