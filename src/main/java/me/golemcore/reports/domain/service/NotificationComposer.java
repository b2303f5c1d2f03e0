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

import lombok.RequiredArgsConstructor;
import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.EmbeddedAttachment;
import me.golemcore.reports.domain.model.RenderedBody;
import me.golemcore.reports.domain.model.Report;
import me.golemcore.reports.domain.model.ReportNotification;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static me.golemcore.reports.domain.service.ReportHtmlFormatter.escapeHtml;

/**
 * Composes the e-mail for a stored report: subject, plain-text body, HTML
 * body with math images and an image gallery, and the embedded attachments.
 */
@Component
@RequiredArgsConstructor
public class NotificationComposer {

    private final MathRenderer mathRenderer;

    /**
     * Composed message plus the files rendered while composing it.
     */
    public record Composition(ReportNotification notification, List<AttachmentRecord> derivedFiles) {
    }

    public static String subject(Report report) {
        return "[" + report.getAgentName() + "] " + report.getTitle() + " - Tag: " + report.getTag();
    }

    public Composition compose(Report report, String hostLabel, ZoneId zone, String artifactLocator,
            List<AttachmentRecord> attachments, List<EmbeddedAttachment> embedded) {
        RenderedBody body = mathRenderer.renderForNotification(report.getBody(), report.getFolder());
        ReportNotification notification = ReportNotification.builder()
                .subject(subject(report))
                .textBody(textBody(report, hostLabel, artifactLocator, attachments))
                .htmlBody(htmlBody(report, hostLabel, zone, artifactLocator, attachments, body.html()))
                .attachments(embedded)
                .urgent(report.isUrgent())
                .build();
        return new Composition(notification, body.derivedFiles());
    }

    private String textBody(Report report, String hostLabel, String artifactLocator,
            List<AttachmentRecord> attachments) {
        StringBuilder text = new StringBuilder();
        text.append("Report from ").append(report.getAgentName()).append('\n');
        text.append("Report Tag: ").append(report.getTag()).append('\n');
        text.append("Hostname: ").append(hostLabel).append("\n\n");
        text.append(report.getBody()).append("\n\n");
        if (!attachments.isEmpty()) {
            text.append("Attachments (").append(attachments.size()).append("):\n");
            for (AttachmentRecord attachment : attachments) {
                text.append("- ").append(attachment.getFilename()).append('\n');
            }
            text.append('\n');
        }
        text.append("View full report:\n").append(artifactLocator).append('\n');
        return text.toString();
    }

    private String htmlBody(Report report, String hostLabel, ZoneId zone, String artifactLocator,
            List<AttachmentRecord> attachments, String renderedBody) {
        ZonedDateTime time = report.getTimestamp().atZone(zone);
        StringBuilder html = new StringBuilder();
        html.append("<div style=\"font-family: Arial, sans-serif; max-width: 800px; margin: 0 auto;\">\n");
        html.append("  <h2 style=\"color: #333;\">Report from ").append(escapeHtml(report.getAgentName()))
                .append("</h2>\n");
        html.append("  <div style=\"color: #666; margin-bottom: 20px;\">\n");
        html.append("    <div style=\"font-size: 1.2em; font-weight: bold; color: #0066cc; background: #e3f2fd; ")
                .append("padding: 4px 8px; border-radius: 4px; display: inline-block; margin-bottom: 10px;\">")
                .append("Report Tag: ").append(escapeHtml(report.getTag())).append("</div><br>\n");
        html.append("    <strong>Title:</strong> ").append(escapeHtml(report.getTitle())).append("<br>\n");
        html.append("    <strong>Hostname:</strong> ").append(escapeHtml(hostLabel)).append("<br>\n");
        html.append("    <strong>Time (12-hour):</strong> ").append(ReportPageBuilder.TIME_12H.format(time))
                .append("<br>\n");
        html.append("    <strong>Time (24-hour):</strong> ").append(ReportPageBuilder.TIME_24H.format(time))
                .append('\n');
        html.append("  </div>\n");
        html.append("  <div style=\"background:#f5f5f5; padding:20px; border-radius:5px; margin-bottom:30px;\">\n");
        html.append("    <h3 style=\"margin-top:0;\">Report Content</h3>\n");
        html.append("    <div style=\"line-height: 1.6;\">").append(renderedBody).append("</div>\n");
        html.append("  </div>\n");

        List<AttachmentRecord> images = attachments.stream()
                .filter(a -> a.getRole() == ContentRole.IMAGE)
                .toList();
        if (!images.isEmpty()) {
            html.append("  <div style=\"margin-bottom:30px;\">\n");
            html.append("    <h3>Images (").append(images.size()).append(")</h3>\n");
            for (AttachmentRecord image : images) {
                String name = escapeHtml(image.getFilename());
                String url = escapeHtml(image.getLocator());
                html.append("    <div style=\"border: 1px solid #ddd; padding: 10px; border-radius: 5px; ")
                        .append("margin-bottom: 15px; background: white;\">\n");
                html.append("      <div style=\"font-weight: bold; margin-bottom: 10px;\">").append(name)
                        .append("</div>\n");
                html.append("      <img src=\"").append(url).append("\" style=\"max-width: 100%; height: auto;\" alt=\"")
                        .append(name).append("\">\n");
                html.append("      <div style=\"margin-top: 10px;\"><a href=\"").append(url)
                        .append("\" style=\"color: #0066cc;\">View full size</a></div>\n");
                html.append("    </div>\n");
            }
            html.append("  </div>\n");
        }

        List<AttachmentRecord> others = attachments.stream()
                .filter(a -> a.getRole() != ContentRole.IMAGE)
                .toList();
        if (!others.isEmpty()) {
            html.append("  <div style=\"margin-bottom:30px;\">\n");
            html.append("    <h3>Other Attachments</h3>\n");
            html.append("    <ul style=\"list-style: none; padding: 0;\">\n");
            for (AttachmentRecord other : others) {
                html.append("      <li style=\"margin-bottom: 10px;\"><a href=\"")
                        .append(escapeHtml(other.getLocator())).append("\" style=\"color: #0066cc;\">")
                        .append(escapeHtml(other.getFilename())).append("</a></li>\n");
            }
            html.append("    </ul>\n");
            html.append("  </div>\n");
        }

        html.append("  <div style=\"margin-top:30px; padding-top:20px; border-top: 1px solid #ddd;\">\n");
        html.append("    <a href=\"").append(escapeHtml(artifactLocator))
                .append("\" style=\"background:#0066cc; color:white; padding:10px 20px; text-decoration:none; ")
                .append("border-radius:5px; display:inline-block;\">View Full Report in Browser</a>\n");
        html.append("  </div>\n");
        html.append("</div>\n");
        return html.toString();
    }
}
