package me.golemcore.reports.domain.service;

import me.golemcore.reports.domain.model.Report;
import me.golemcore.reports.domain.service.ReportPageBuilder.PageAttachment;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.LatexRenderPort;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ReportPageBuilderTest {

    private ReportPageBuilder pageBuilder;

    @BeforeEach
    void setUp() {
        MathRenderer mathRenderer = new MathRenderer(mock(LatexRenderPort.class), mock(ReportStoragePort.class),
                new ReportsProperties());
        pageBuilder = new ReportPageBuilder(mathRenderer);
    }

    @Test
    void shouldRenderHeaderWithTagAgentHostAndBothTimeFormats() {
        String html = pageBuilder.build(report("Body"), "build-host", ZoneId.of("UTC"), List.of());

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<title>trainer - Nightly &lt;run&gt;</title>"));
        assertTrue(html.contains("Report Tag: AB12"));
        assertTrue(html.contains("<strong>Host:</strong> build-host"));
        assertTrue(html.contains("03/01/2026, 01:05:09 PM UTC"));
        assertTrue(html.contains("03/01/2026, 13:05:09 UTC"));
        assertTrue(html.contains("MathJax-script"));
        assertFalse(html.contains("Attachments ("));
    }

    @Test
    void shouldListAttachmentsAndPreviewImages() {
        List<PageAttachment> attachments = List.of(
                new PageAttachment("plot.png", "plot.png", true),
                new PageAttachment("data.csv", "data.csv", false));

        String html = pageBuilder.build(report("see files"), "host", ZoneId.of("UTC"), attachments);

        assertTrue(html.contains("<h2>Attachments (2)</h2>"));
        assertTrue(html.contains("<img src=\"plot.png\" alt=\"plot.png\">"));
        assertTrue(html.contains("<a href=\"data.csv\" target=\"_blank\">View/Download</a>"));
        assertFalse(html.contains("<img src=\"data.csv\""));
    }

    private static Report report(String body) {
        return Report.builder()
                .agentName("trainer")
                .title("Nightly <run>")
                .body(body)
                .tag("AB12")
                .timestamp(Instant.parse("2026-03-01T13:05:09Z"))
                .build();
    }
}
