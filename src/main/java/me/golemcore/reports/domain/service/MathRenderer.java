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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.MathSpan;
import me.golemcore.reports.domain.model.RenderedBody;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.LatexRenderPort;
import me.golemcore.reports.port.outbound.ReportStorageException;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Renders report bodies (Markdown with LaTeX math) for the two places a
 * report is read.
 *
 * <p>
 * The browsable artifact keeps the LaTeX source for MathJax and adds a
 * {@code <noscript>} Unicode fallback. The notification rendition replaces
 * each expression with a PNG produced by {@link LatexRenderPort} and stored
 * next to the report; any failure degrades that expression alone to Unicode.
 * Neither rendition throws because of math.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MathRenderer {

    static final String MATH_IMAGE_CONTENT_TYPE = "image/png";

    private static final String INLINE_FALLBACK_STYLE = "font-family: 'Times New Roman', serif; font-size: 1.1em;";
    private static final String DISPLAY_FALLBACK_STYLE = "text-align: center; margin: 15px 0; "
            + "font-family: 'Times New Roman', serif; font-size: 1.2em;";

    private final LatexRenderPort latexRenderPort;
    private final ReportStoragePort storagePort;
    private final ReportsProperties properties;

    /**
     * HTML for the browsable artifact. Performs no I/O.
     */
    public String renderForBrowser(String markdown) {
        return ReportHtmlFormatter.format(markdown, MathRenderer::browserSpan);
    }

    /**
     * HTML for the notification body. Math images are persisted under
     * {@code folder} as {@code math_<n>.png}.
     */
    public RenderedBody renderForNotification(String markdown, String folder) {
        List<AttachmentRecord> derived = new ArrayList<>();
        String html = ReportHtmlFormatter.format(markdown, span -> notificationSpan(span, folder, derived));
        return new RenderedBody(html, derived);
    }

    private static String browserSpan(MathSpan span) {
        String latex = ReportHtmlFormatter.escapeHtml(span.latex());
        String fallback = ReportHtmlFormatter.escapeHtml(LatexUnicodeTransliterator.transliterate(span.latex()));
        if (span.display()) {
            return "<div class=\"math-display\">$$" + latex + "$$</div>"
                    + "<noscript><div class=\"math-fallback\">" + fallback + "</div></noscript>";
        }
        return "<span class=\"math-inline\">$" + latex + "$</span>"
                + "<noscript><span class=\"math-fallback\">" + fallback + "</span></noscript>";
    }

    private String notificationSpan(MathSpan span, String folder, List<AttachmentRecord> derived) {
        if (!properties.getMath().isRemoteRenderEnabled() || !latexRenderPort.isAvailable()) {
            return fallbackSpan(span);
        }
        String filename = "math_" + span.index() + ".png";
        try {
            byte[] png = latexRenderPort.renderPng(span.latex(), span.display());
            String locator = storagePort.persist(folder + "/" + filename, png, MATH_IMAGE_CONTENT_TYPE).join();
            derived.add(AttachmentRecord.builder()
                    .filename(filename)
                    .sizeBytes(png.length)
                    .role(ContentRole.IMAGE)
                    .contentType(MATH_IMAGE_CONTENT_TYPE)
                    .locator(locator)
                    .derived(true)
                    .build());
            log.debug("[Math] Rendered {} to {}", span.display() ? "display math" : "inline math", filename);
            return imageSpan(span, locator);
        } catch (IOException | CompletionException | ReportStorageException | IllegalArgumentException e) {
            log.warn("[Math] Falling back to Unicode for expression {}: {}", span.index(), e.getMessage());
            return fallbackSpan(span);
        }
    }

    private static String imageSpan(MathSpan span, String locator) {
        String src = ReportHtmlFormatter.escapeHtml(locator);
        String alt = ReportHtmlFormatter.escapeHtml(span.latex());
        if (span.display()) {
            return "<div style=\"text-align: center; margin: 15px 0;\"><img src=\"" + src + "\" alt=\"" + alt
                    + "\" style=\"max-width: 100%; height: auto;\"></div>";
        }
        return "<img src=\"" + src + "\" alt=\"" + alt + "\" style=\"vertical-align: middle; height: 1.2em;\">";
    }

    private static String fallbackSpan(MathSpan span) {
        String text = ReportHtmlFormatter.escapeHtml(LatexUnicodeTransliterator.transliterate(span.latex()));
        if (span.display()) {
            return "<div style=\"" + DISPLAY_FALLBACK_STYLE + "\">" + text + "</div>";
        }
        return "<span style=\"" + INLINE_FALLBACK_STYLE + "\">" + text + "</span>";
    }
}
