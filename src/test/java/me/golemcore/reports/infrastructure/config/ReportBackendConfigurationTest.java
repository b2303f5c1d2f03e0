package me.golemcore.reports.infrastructure.config;

import me.golemcore.reports.adapter.outbound.mail.NoOpNotificationAdapter;
import me.golemcore.reports.adapter.outbound.mail.SmtpNotificationAdapter;
import me.golemcore.reports.adapter.outbound.storage.LocalReportStorageAdapter;
import me.golemcore.reports.adapter.outbound.storage.S3ReportStorageAdapter;
import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.port.outbound.NotificationPort;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportBackendConfigurationTest {

    @TempDir
    Path tempDir;

    @Test
    void localFolderSelectsFilesystemWithoutNotifier() {
        ReportsProperties properties = new ReportsProperties();
        properties.setLocalFolder(tempDir.toString());
        ReportBackendConfiguration configuration = new ReportBackendConfiguration(properties);

        ReportStoragePort storage = configuration.reportStoragePort();
        NotificationPort notifier = configuration.notificationPort();

        assertInstanceOf(LocalReportStorageAdapter.class, storage);
        assertInstanceOf(NoOpNotificationAdapter.class, notifier);
        assertFalse(notifier.isEnabled());
    }

    @Test
    void emailMarkerSelectsRemoteMode() {
        ReportsProperties properties = new ReportsProperties();
        properties.setLocalFolder("EMAIL");

        assertEquals(ReportMode.REMOTE, properties.resolveMode());
        properties.setLocalFolder("");
        assertEquals(ReportMode.REMOTE, properties.resolveMode());
        properties.setLocalFolder("/var/reports");
        assertEquals(ReportMode.LOCAL, properties.resolveMode());
    }

    @Test
    void remoteModeFailsFastWhenSettingsAreMissing() {
        ReportsProperties properties = new ReportsProperties();
        properties.getS3().setBucket("reports");
        ReportBackendConfiguration configuration = new ReportBackendConfiguration(properties);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                configuration::reportStoragePort);
        assertTrue(thrown.getMessage().contains("reports.s3.access-key-id"));
        assertTrue(thrown.getMessage().contains("reports.mail.host"));
        assertFalse(thrown.getMessage().contains("reports.s3.bucket"));
        assertThrows(IllegalStateException.class, configuration::notificationPort);
    }

    @Test
    void remoteModeBuildsS3AndSmtpAdapters() {
        ReportsProperties properties = new ReportsProperties();
        properties.getS3().setBucket("reports");
        properties.getS3().setAccessKeyId("AKIDEXAMPLE");
        properties.getS3().setSecretAccessKey("secret");
        properties.getS3().setEndpoint("http://localhost:9000");
        properties.getS3().setPathStyleAccess(true);
        properties.getMail().setHost("smtp.example.com");
        properties.getMail().setFrom("reports@example.com");
        properties.getMail().setTo("human@example.com");
        ReportBackendConfiguration configuration = new ReportBackendConfiguration(properties);

        ReportStoragePort storage = configuration.reportStoragePort();
        try {
            assertInstanceOf(S3ReportStorageAdapter.class, storage);
            assertEquals(ReportMode.REMOTE, storage.mode());
            String locator = storage.locate("agent/2026-01-01_00-00-00/index.html");
            assertTrue(locator.startsWith("http://localhost:9000/reports/agent/2026-01-01_00-00-00/index.html"));
            assertTrue(locator.contains("X-Amz-Signature"));
        } finally {
            ((S3ReportStorageAdapter) storage).close();
        }
        assertInstanceOf(SmtpNotificationAdapter.class, configuration.notificationPort());
    }
}
