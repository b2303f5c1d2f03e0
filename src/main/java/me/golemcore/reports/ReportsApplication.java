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

package me.golemcore.reports;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the report capture-and-retrieval service.
 *
 * <p>
 * Agents submit a titled markdown/LaTeX report plus attachment files. The
 * service stores the content, renders a browsable HTML artifact, optionally
 * notifies a human by e-mail and later finds the report again by its 4-letter
 * tag or by agent/time coordinates.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ReportsController (REST)
 * Domain Layer       → ReportService, ReportIndexService, AttachmentBudgeter, MathRenderer
 * Infrastructure     → Local/S3 storage, SMTP notification, LaTeX rendering adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code reports.*} prefix. Setting {@code reports.local-folder} to a path
 * selects the offline filesystem backend; leaving it empty (or {@code EMAIL})
 * selects S3 + e-mail.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReportsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportsApplication.class, args);
    }

}
