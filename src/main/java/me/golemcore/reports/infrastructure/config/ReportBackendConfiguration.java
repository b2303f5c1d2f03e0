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

package me.golemcore.reports.infrastructure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.adapter.outbound.mail.NoOpNotificationAdapter;
import me.golemcore.reports.adapter.outbound.mail.SmtpNotificationAdapter;
import me.golemcore.reports.adapter.outbound.storage.LocalReportStorageAdapter;
import me.golemcore.reports.adapter.outbound.storage.S3ReportStorageAdapter;
import me.golemcore.reports.domain.model.ReportMode;
import me.golemcore.reports.port.outbound.NotificationPort;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.util.List;

/**
 * Chooses the storage and notification backends once per process.
 *
 * <p>
 * {@code reports.local-folder} set to a path selects the filesystem backend
 * with no notifier; remote credentials are not looked at. Empty or
 * {@code EMAIL} selects S3 + SMTP, and every remote setting must be present
 * or the application fails to start.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ReportBackendConfiguration {

    private final ReportsProperties properties;

    @Bean
    public ReportStoragePort reportStoragePort() {
        if (properties.resolveMode() == ReportMode.LOCAL) {
            return new LocalReportStorageAdapter(properties);
        }
        requireRemoteSettings(properties);
        ReportsProperties.S3Properties s3 = properties.getS3();
        log.info("[Storage] Remote report bucket: {} ({})", s3.getBucket(), s3.getRegion());
        return new S3ReportStorageAdapter(buildS3Client(s3), buildS3Presigner(s3), properties);
    }

    @Bean
    public NotificationPort notificationPort() {
        if (properties.resolveMode() == ReportMode.LOCAL) {
            return new NoOpNotificationAdapter();
        }
        requireRemoteSettings(properties);
        log.info("[Notify] Mail route: {} -> {} via {}:{}", properties.getMail().getFrom(),
                properties.getMail().getTo(), properties.getMail().getHost(), properties.getMail().getPort());
        return new SmtpNotificationAdapter(properties);
    }

    static void requireRemoteSettings(ReportsProperties properties) {
        List<String> missing = properties.missingRemoteSettings();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Remote report mode requires " + String.join(", ", missing)
                    + " (or set reports.local-folder for local mode)");
        }
    }

    static S3Client buildS3Client(ReportsProperties.S3Properties s3) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(credentials(s3))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(s3.isPathStyleAccess())
                        .build());
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint()));
        }
        return builder.build();
    }

    static S3Presigner buildS3Presigner(ReportsProperties.S3Properties s3) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(credentials(s3))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(s3.isPathStyleAccess())
                        .build());
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint()));
        }
        return builder.build();
    }

    private static StaticCredentialsProvider credentials(ReportsProperties.S3Properties s3) {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(s3.getAccessKeyId(),
                s3.getSecretAccessKey()));
    }
}
