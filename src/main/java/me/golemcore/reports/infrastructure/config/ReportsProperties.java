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

import lombok.Data;
import me.golemcore.reports.domain.model.ReportMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the report service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code reports.*} prefix:
 * <ul>
 * <li>{@code reports.local-folder} - selects the backend (path → local,
 * empty/{@code EMAIL} → remote)</li>
 * <li>{@link AttachmentProperties} - e-mail embedding budget</li>
 * <li>{@link SearchProperties} - listing ceilings and result caps</li>
 * <li>{@link S3Properties} - object store for remote mode</li>
 * <li>{@link MailProperties} - SMTP notification for remote mode</li>
 * <li>{@link MathProperties} - LaTeX image rendering service</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "reports")
@Data
public class ReportsProperties {

    public static final String EMAIL_MODE_MARKER = "EMAIL";

    private String localFolder = "";
    private String hostLabel = "";
    private String timeZone = "UTC";
    private String latestLocatorFile = "";
    private AttachmentProperties attachments = new AttachmentProperties();
    private SearchProperties search = new SearchProperties();
    private S3Properties s3 = new S3Properties();
    private MailProperties mail = new MailProperties();
    private MathProperties math = new MathProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Mode is decided from {@code local-folder} alone: any path other than the
     * {@code EMAIL} marker means local.
     */
    public ReportMode resolveMode() {
        if (localFolder == null || localFolder.isBlank() || EMAIL_MODE_MARKER.equals(localFolder.trim())) {
            return ReportMode.REMOTE;
        }
        return ReportMode.LOCAL;
    }

    /**
     * Names of settings required by remote mode that are missing.
     */
    public List<String> missingRemoteSettings() {
        List<String> missing = new ArrayList<>();
        if (isBlank(s3.getBucket())) {
            missing.add("reports.s3.bucket");
        }
        if (isBlank(s3.getAccessKeyId())) {
            missing.add("reports.s3.access-key-id");
        }
        if (isBlank(s3.getSecretAccessKey())) {
            missing.add("reports.s3.secret-access-key");
        }
        if (isBlank(mail.getHost())) {
            missing.add("reports.mail.host");
        }
        if (isBlank(mail.getFrom())) {
            missing.add("reports.mail.from");
        }
        if (isBlank(mail.getTo())) {
            missing.add("reports.mail.to");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Data
    public static class AttachmentProperties {
        private int maxEmbeddedCount = 5;
        private long maxEmbeddedBytes = 8L * 1024 * 1024;
    }

    @Data
    public static class SearchProperties {
        private int defaultMaxResults = 20;
        private int fetchCeiling = 600;
        private boolean tagLookupUnbounded = true;
    }

    @Data
    public static class S3Properties {
        private String bucket = "";
        private String region = "us-east-1";
        private String accessKeyId = "";
        private String secretAccessKey = "";
        private String endpoint = "";
        private boolean pathStyleAccess = false;
        private Duration urlExpiration = Duration.ofDays(7);
        private int pageSize = 1000;
    }

    @Data
    public static class MailProperties {
        private String host = "";
        private int port = 587;
        private String username = "";
        private String password = "";
        private String security = "starttls";
        private String from = "";
        private String to = "";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class MathProperties {
        private boolean remoteRenderEnabled = true;
        private String renderUrl = "https://latex.codecogs.com/png.image";
        private int dpi = 150;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
