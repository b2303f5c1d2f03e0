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

import me.golemcore.reports.domain.model.MathSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces LaTeX math spans with private-use placeholders so that markdown
 * conversion cannot mangle them, and restores them afterwards.
 */
public final class MathSpanExtractor {

    private MathSpanExtractor() {
    }

    // $$...$$ (may span lines, no dollar inside); \$ is a literal dollar
    private static final Pattern DISPLAY_PATTERN = Pattern.compile("(?<!\\\\)\\$\\$([^$]+)(?<!\\\\)\\$\\$");

    // $...$ on a single line
    private static final Pattern INLINE_PATTERN = Pattern.compile("(?<!\\\\)\\$([^$\\n]+)(?<!\\\\)\\$");

    static final String DISPLAY_PLACEHOLDER = "\uE000MD";
    static final String INLINE_PLACEHOLDER = "\uE000MI";

    /**
     * Text with placeholders plus the spans that were cut out.
     */
    public record Extraction(String text, List<MathSpan> spans) {
    }

    public static Extraction extract(String text) {
        List<MathSpan> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return new Extraction(text == null ? "" : text, spans);
        }
        String result = replace(text, DISPLAY_PATTERN, true, spans);
        result = replace(result, INLINE_PATTERN, false, spans);
        return new Extraction(result, spans);
    }

    public static String placeholder(MathSpan span) {
        String marker = span.display() ? DISPLAY_PLACEHOLDER : INLINE_PLACEHOLDER;
        return marker + span.index() + marker;
    }

    public static boolean isDisplayPlaceholder(String line) {
        return line.startsWith(DISPLAY_PLACEHOLDER) && line.endsWith(DISPLAY_PLACEHOLDER)
                && line.length() > DISPLAY_PLACEHOLDER.length() * 2;
    }

    /**
     * Substitute each placeholder with the renderer's output.
     */
    public static String restore(String text, List<MathSpan> spans, Function<MathSpan, String> renderer) {
        String result = text;
        for (MathSpan span : spans) {
            result = result.replace(placeholder(span), renderer.apply(span));
        }
        return result;
    }

    private static String replace(String text, Pattern pattern, boolean display, List<MathSpan> spans) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            MathSpan span = new MathSpan(spans.size(), m.group(1), display);
            spans.add(span);
            m.appendReplacement(sb, Matcher.quoteReplacement(placeholder(span)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
