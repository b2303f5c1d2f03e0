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
import me.golemcore.reports.domain.model.Report;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static me.golemcore.reports.domain.service.ReportHtmlFormatter.escapeHtml;

/**
 * Builds the browsable {@code index.html} artifact of a report: metadata
 * header, rendered body with MathJax typesetting, and an attachment grid.
 */
@Component
@RequiredArgsConstructor
public class ReportPageBuilder {

    static final DateTimeFormatter TIME_12H = DateTimeFormatter
            .ofPattern("MM/dd/yyyy, hh:mm:ss a z", Locale.US);
    static final DateTimeFormatter TIME_24H = DateTimeFormatter
            .ofPattern("MM/dd/yyyy, HH:mm:ss z", Locale.US);

    private static final String STYLE = """
                body { font-family: Arial, sans-serif; max-width: 1200px; margin: 0 auto; padding: 20px; line-height: 1.6; }
                h1, h2, h3 { color: #333; }
                .metadata { color: #666; margin-bottom: 20px; padding: 10px; background: #f9f9f9; border-radius: 5px; }
                .metadata .tag { font-size: 1.2em; font-weight: bold; color: #0066cc; background: #e3f2fd; padding: 4px 8px; border-radius: 4px; display: inline-block; margin-bottom: 10px; }
                .content { background: #fff; padding: 30px; border-radius: 5px; margin-bottom: 30px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }
                pre { white-space: pre-wrap; word-wrap: break-word; background: #f5f5f5; padding: 15px; border-radius: 5px; overflow-x: auto; }
                code { background: #f5f5f5; padding: 2px 4px; border-radius: 3px; font-family: monospace; }
                table { border-collapse: collapse; width: 100%; margin: 15px 0; }
                th, td { border: 1px solid #ddd; padding: 8px; text-align: left; }
                th { background: #f5f5f5; font-weight: bold; }
                blockquote { border-left: 4px solid #ddd; margin: 1em 0; padding-left: 1em; color: #666; }
                .files { display: grid; grid-template-columns: repeat(auto-fill, minmax(300px, 1fr)); gap: 20px; }
                .file { border: 1px solid #ddd; padding: 15px; border-radius: 5px; background: white; }
                .file img { max-width: 100%; height: auto; margin-top: 10px; }
                .file a { color: #0066cc; text-decoration: none; }
                .file a:hover { text-decoration: underline; }
                .math-fallback { font-family: 'Times New Roman', serif; }
                mjx-container[display="true"] { margin: 1em 0; }
            """;

    private static final String MATHJAX = """
              <script>
                window.MathJax = {
                  tex: {
                    inlineMath: [['$', '$'], ['\\\\(', '\\\\)']],
                    displayMath: [['$$', '$$'], ['\\\\[', '\\\\]']],
                    processEscapes: true,
                    processEnvironments: true,
                    packages: {'[+]': ['ams', 'noerrors']}
                  },
                  options: {
                    skipHtmlTags: ['script', 'noscript', 'style', 'textarea', 'pre', 'code'],
                    processHtmlClass: 'content'
                  },
                  loader: {
                    load: ['[tex]/ams', '[tex]/noerrors']
                  }
                };
              </script>
              <script id="MathJax-script" async src="https://cdn.jsdelivr.net/npm/mathjax@3/es5/tex-mml-chtml.js"></script>
            """;

    private final MathRenderer mathRenderer;

    /**
     * A file listed in the attachment grid.
     *
     * @param href
     *            link as seen from the artifact (relative name or URL)
     */
    public record PageAttachment(String filename, String href, boolean image) {
    }

    public String build(Report report, String hostLabel, ZoneId zone, List<PageAttachment> attachments) {
        ZonedDateTime time = report.getTimestamp().atZone(zone);
        String title = escapeHtml(report.getTitle());
        String agent = escapeHtml(report.getAgentName());

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n");
        html.append("  <meta charset=\"UTF-8\">\n");
        html.append("  <title>").append(agent).append(" - ").append(title).append("</title>\n");
        html.append("  <style>\n").append(STYLE).append("  </style>\n");
        html.append("</head>\n<body>\n");
        html.append("  <h1>").append(title).append("</h1>\n");
        html.append("  <div class=\"metadata\">\n");
        html.append("    <div class=\"tag\">Report Tag: ").append(escapeHtml(report.getTag())).append("</div><br>\n");
        html.append("    <strong>Agent:</strong> ").append(agent).append("<br>\n");
        html.append("    <strong>Host:</strong> ").append(escapeHtml(hostLabel)).append("<br>\n");
        html.append("    <strong>Time (12-hour):</strong> ").append(TIME_12H.format(time)).append("<br>\n");
        html.append("    <strong>Time (24-hour):</strong> ").append(TIME_24H.format(time)).append('\n');
        html.append("  </div>\n");
        html.append("  <div class=\"content\">\n    <h2>Report Content</h2>\n");
        html.append(mathRenderer.renderForBrowser(report.getBody())).append('\n');
        html.append("  </div>\n");
        html.append(MATHJAX);

        if (!attachments.isEmpty()) {
            html.append("  <h2>Attachments (").append(attachments.size()).append(")</h2>\n");
            html.append("  <div class=\"files\">\n");
            for (PageAttachment attachment : attachments) {
                String name = escapeHtml(attachment.filename());
                String href = escapeHtml(attachment.href());
                html.append("    <div class=\"file\">\n");
                html.append("      <strong>").append(name).append("</strong><br>\n");
                html.append("      <a href=\"").append(href).append("\" target=\"_blank\">View/Download</a>\n");
                if (attachment.image()) {
                    html.append("      <br><img src=\"").append(href).append("\" alt=\"").append(name).append("\">\n");
                }
                html.append("    </div>\n");
            }
            html.append("  </div>\n");
        }
        html.append("</body>\n</html>\n");
        return html.toString();
    }
}
