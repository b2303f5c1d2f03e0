package me.golemcore.reports.domain.service;

import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.EmbeddedAttachment;
import me.golemcore.reports.domain.model.RenderedBody;
import me.golemcore.reports.domain.model.Report;
import me.golemcore.reports.domain.model.ReportNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NotificationComposerTest {

    private MathRenderer mathRenderer;
    private NotificationComposer composer;

    @BeforeEach
    void setUp() {
        mathRenderer = mock(MathRenderer.class);
        composer = new NotificationComposer(mathRenderer);
    }

    @Test
    void shouldBuildSubjectWithAgentTitleAndTag() {
        assertEquals("[trainer] Loss curves - Tag: Q7ZK", NotificationComposer.subject(report(false)));
    }

    @Test
    void shouldComposeTextAndHtmlBodies() {
        Report report = report(true);
        AttachmentRecord mathImage = AttachmentRecord.builder()
                .filename("math_0.png").role(ContentRole.IMAGE).derived(true).build();
        when(mathRenderer.renderForNotification(report.getBody(), report.getFolder()))
                .thenReturn(new RenderedBody("<p>rendered</p>", List.of(mathImage)));
        List<AttachmentRecord> attachments = List.of(
                record("plot.png", ContentRole.IMAGE, "https://s3/plot.png"),
                record("log.txt", ContentRole.TEXT, "https://s3/log.txt"));
        List<EmbeddedAttachment> embedded = List.of(EmbeddedAttachment.builder()
                .filename("plot.png").contentType("image/png").data(new byte[] { 1 }).build());

        NotificationComposer.Composition composition = composer.compose(report, "gpu-01", ZoneId.of("UTC"),
                "https://s3/index.html", attachments, embedded);

        ReportNotification notification = composition.notification();
        assertTrue(notification.isUrgent());
        assertSame(embedded, notification.getAttachments());
        assertTrue(notification.getTextBody().startsWith("Report from trainer\nReport Tag: Q7ZK\nHostname: gpu-01\n"));
        assertTrue(notification.getTextBody().contains("Attachments (2):\n- plot.png\n- log.txt\n"));
        assertTrue(notification.getTextBody().endsWith("View full report:\nhttps://s3/index.html\n"));
        assertTrue(notification.getHtmlBody().contains("<p>rendered</p>"));
        assertTrue(notification.getHtmlBody().contains("<h3>Images (1)</h3>"));
        assertTrue(notification.getHtmlBody().contains("<h3>Other Attachments</h3>"));
        assertTrue(notification.getHtmlBody().contains("View Full Report in Browser"));
        assertEquals(List.of(mathImage), composition.derivedFiles());
    }

    private static AttachmentRecord record(String name, ContentRole role, String locator) {
        return AttachmentRecord.builder().filename(name).role(role).locator(locator).build();
    }

    private static Report report(boolean urgent) {
        return Report.builder()
                .agentName("trainer")
                .title("Loss curves")
                .body("loss $L$")
                .tag("Q7ZK")
                .timestamp(Instant.parse("2026-03-01T13:05:09Z"))
                .folder("trainer/2026-03-01_13-05-09")
                .urgent(urgent)
                .build();
    }
}
