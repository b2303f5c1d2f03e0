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
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts report Markdown to HTML.
 *
 * <p>
 * This formatter handles:
 * <ul>
 * <li>Fenced code blocks and inline code (content escaped, never formatted)
 * <li>LaTeX math spans, cut out before conversion and handed to a caller
 * supplied renderer
 * <li>Headers, bold, italic, strikethrough, links and images
 * <li>Block quotes, ordered and unordered lists, horizontal rules
 * <li>Tables, rendered as {@code <table>}
 * <li>Escaping raw HTML in the body to prevent injection
 * </ul>
 *
 * <p>
 * Output is a fragment meant to be placed inside a page or an e-mail body.
 */
public final class ReportHtmlFormatter {

    private ReportHtmlFormatter() {
    }

    // <br>, <br/>, <br /> inside table cells
    private static final Pattern BR_PATTERN = Pattern.compile(
            "<br\\s*/?>", Pattern.CASE_INSENSITIVE);

    // ```lang\ncode\n``` or ```code```
    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile(
            "```(?:\\w*\\n)?([\\s\\S]*?)```");

    // `inline code`
    private static final Pattern INLINE_CODE_PATTERN = Pattern.compile(
            "`([^`\n]+)`");

    // ![alt](url), one level of balanced parentheses allowed in url
    private static final Pattern IMAGE_PATTERN = Pattern.compile(
            "!\\[([^]]*)]\\(((?:[^()\\s]|\\([^()\\s]*\\))+)\\)");

    // [text](url)
    private static final Pattern LINK_PATTERN = Pattern.compile(
            "\\[([^]]+)]\\(((?:[^()\\s]|\\([^()\\s]*\\))+)\\)");

    // scheme prefix, e.g. "https:" or "javascript:"
    private static final Pattern SCHEME_PATTERN = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*):");

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https", "mailto");

    // **bold** or __bold__
    private static final Pattern BOLD_PATTERN = Pattern.compile(
            "\\*\\*(.+?)\\*\\*|__(.+?)__");

    // *italic* (not preceded/followed by word chars or *)
    private static final Pattern ITALIC_PATTERN = Pattern.compile(
            "(?<![\\w*])\\*([^*\n]+?)\\*(?![\\w*])");

    // _italic_ (not inside words like file_name_path)
    private static final Pattern ITALIC_UNDERSCORE_PATTERN = Pattern.compile(
            "(?<![\\w])_([^_\n]+?)_(?![\\w])");

    // ~~strikethrough~~
    private static final Pattern STRIKETHROUGH_PATTERN = Pattern.compile(
            "~~(.+?)~~");

    // # Header (1-6 levels)
    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "^(#{1,6})\\s+(.+)$");

    // ---, ***, ___ (three or more, optional spaces between)
    private static final Pattern RULE_PATTERN = Pattern.compile(
            "^ {0,3}([-*_])(?:\\s*\\1){2,}\\s*$");

    // > quote (matched after escaping)
    private static final Pattern QUOTE_PATTERN = Pattern.compile(
            "^\\s{0,3}&gt;\\s?(.*)$");

    // - item, * item, + item
    private static final Pattern UNORDERED_ITEM_PATTERN = Pattern.compile(
            "^\\s*[-*+]\\s+(.+)$");

    // 1. item, 1) item
    private static final Pattern ORDERED_ITEM_PATTERN = Pattern.compile(
            "^\\s*\\d+[.)]\\s+(.+)$");

    // Markdown table: header | separator | data rows
    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "(?m)^(\\|.+\\|)[ \\t]*\\n(\\|[-:| ]+\\|)[ \\t]*\\n((?:\\|.+\\|[ \\t]*\\n?)+)");

    private static final String CODE_BLOCK_PLACEHOLDER = "\uE000CB";
    private static final String INLINE_CODE_PLACEHOLDER = "\uE000IC";
    private static final String TABLE_PLACEHOLDER = "\uE000TB";

    /**
     * Convert Markdown without math support; math spans stay as literal text.
     */
    public static String format(String text) {
        return format(text, span -> escapeHtml(span.display()
                ? "$$" + span.latex() + "$$"
                : "$" + span.latex() + "$"));
    }

    /**
     * Convert Markdown to HTML, rendering each math span with
     * {@code mathRenderer}. The renderer output is inserted verbatim.
     */
    public static String format(String text, Function<MathSpan, String> mathRenderer) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n");

        // Extract code blocks to protect their content from formatting
        List<String> codeBlocks = new ArrayList<>();
        Matcher m = CODE_BLOCK_PATTERN.matcher(normalized);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            codeBlocks.add(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(
                    "\n" + CODE_BLOCK_PLACEHOLDER + (codeBlocks.size() - 1) + CODE_BLOCK_PLACEHOLDER + "\n"));
        }
        m.appendTail(sb);
        normalized = sb.toString();

        // Extract inline code
        List<String> inlineCodes = new ArrayList<>();
        m = INLINE_CODE_PATTERN.matcher(normalized);
        sb = new StringBuilder();
        while (m.find()) {
            inlineCodes.add(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(
                    INLINE_CODE_PLACEHOLDER + (inlineCodes.size() - 1) + INLINE_CODE_PLACEHOLDER));
        }
        m.appendTail(sb);
        normalized = sb.toString();

        // Math after code, so dollars inside code stay literal
        MathSpanExtractor.Extraction extraction = MathSpanExtractor.extract(normalized);
        normalized = extraction.text();

        // Extract and convert tables
        List<String> convertedTables = new ArrayList<>();
        m = TABLE_PATTERN.matcher(normalized);
        sb = new StringBuilder();
        while (m.find()) {
            List<String> headers = parseCells(m.group(1));
            String[] dataLines = m.group(3).split("\\n");
            List<List<String>> rows = new ArrayList<>();
            for (String line : dataLines) {
                if (!line.isBlank()) {
                    rows.add(parseCells(line));
                }
            }
            convertedTables.add(convertTable(headers, rows));
            m.appendReplacement(sb, Matcher.quoteReplacement(
                    TABLE_PLACEHOLDER + (convertedTables.size() - 1) + TABLE_PLACEHOLDER + "\n"));
        }
        m.appendTail(sb);
        normalized = sb.toString();

        String html = renderBlocks(escapeHtml(normalized));

        // Restore inline code (with HTML escaping)
        for (int i = 0; i < inlineCodes.size(); i++) {
            html = html.replace(
                    INLINE_CODE_PLACEHOLDER + i + INLINE_CODE_PLACEHOLDER,
                    "<code>" + escapeHtml(inlineCodes.get(i)) + "</code>");
        }

        // Restore code blocks (with HTML escaping)
        for (int i = 0; i < codeBlocks.size(); i++) {
            html = html.replace(
                    CODE_BLOCK_PLACEHOLDER + i + CODE_BLOCK_PLACEHOLDER,
                    "<pre><code>" + escapeHtml(codeBlocks.get(i)) + "</code></pre>");
        }

        // Restore tables (already fully formatted as HTML)
        for (int i = 0; i < convertedTables.size(); i++) {
            html = html.replace(
                    TABLE_PLACEHOLDER + i + TABLE_PLACEHOLDER,
                    convertedTables.get(i));
        }

        html = MathSpanExtractor.restore(html, extraction.spans(), mathRenderer);
        return html.strip();
    }

    public static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    // --- Block structure ---

    private static String renderBlocks(String text) {
        BlockWriter writer = new BlockWriter();
        for (String rawLine : text.split("\n", -1)) {
            String line = rawLine.stripTrailing();
            if (line.isBlank()) {
                writer.flushAll();
                continue;
            }
            if (isBlockPlaceholder(line.strip())) {
                writer.flushAll();
                writer.out.append(line.strip()).append('\n');
                continue;
            }
            if (RULE_PATTERN.matcher(line).matches()) {
                writer.flushAll();
                writer.out.append("<hr>\n");
                continue;
            }
            Matcher header = HEADER_PATTERN.matcher(line);
            if (header.matches()) {
                writer.flushAll();
                int level = header.group(1).length();
                writer.out.append("<h").append(level).append('>')
                        .append(formatInline(header.group(2)))
                        .append("</h").append(level).append(">\n");
                continue;
            }
            Matcher quote = QUOTE_PATTERN.matcher(line);
            if (quote.matches()) {
                writer.flushParagraph();
                writer.closeList();
                writer.quote.add(quote.group(1));
                continue;
            }
            Matcher unordered = UNORDERED_ITEM_PATTERN.matcher(line);
            if (unordered.matches()) {
                writer.addListItem("ul", unordered.group(1));
                continue;
            }
            Matcher ordered = ORDERED_ITEM_PATTERN.matcher(line);
            if (ordered.matches()) {
                writer.addListItem("ol", ordered.group(1));
                continue;
            }
            writer.flushQuote();
            writer.closeList();
            writer.paragraph.add(line.strip());
        }
        writer.flushAll();
        return writer.out.toString();
    }

    private static boolean isBlockPlaceholder(String line) {
        return isWholePlaceholder(line, CODE_BLOCK_PLACEHOLDER)
                || isWholePlaceholder(line, TABLE_PLACEHOLDER)
                || MathSpanExtractor.isDisplayPlaceholder(line);
    }

    private static boolean isWholePlaceholder(String line, String marker) {
        return line.startsWith(marker) && line.endsWith(marker)
                && line.length() > marker.length() * 2
                && line.substring(marker.length(), line.length() - marker.length()).chars()
                        .allMatch(Character::isDigit);
    }

    private static String formatInline(String text) {
        String result = IMAGE_PATTERN.matcher(text).replaceAll(mr -> Matcher.quoteReplacement(
                isSafeUrl(mr.group(2))
                        ? "<img src=\"" + mr.group(2) + "\" alt=\"" + mr.group(1) + "\">"
                        : mr.group(1)));
        result = BOLD_PATTERN.matcher(result).replaceAll(mr -> {
            String content = mr.group(1) != null ? mr.group(1) : mr.group(2);
            return Matcher.quoteReplacement("<strong>" + content + "</strong>");
        });
        result = ITALIC_PATTERN.matcher(result).replaceAll("<em>$1</em>");
        result = ITALIC_UNDERSCORE_PATTERN.matcher(result).replaceAll("<em>$1</em>");
        result = STRIKETHROUGH_PATTERN.matcher(result).replaceAll("<del>$1</del>");
        result = LINK_PATTERN.matcher(result).replaceAll(mr -> Matcher.quoteReplacement(
                isSafeUrl(mr.group(2))
                        ? "<a href=\"" + mr.group(2) + "\">" + mr.group(1) + "</a>"
                        : mr.group(1)));
        return result;
    }

    /**
     * Relative URLs and http, https and mailto links are kept. Anything else
     * is rendered as plain text.
     */
    static boolean isSafeUrl(String url) {
        Matcher scheme = SCHEME_PATTERN.matcher(url);
        if (!scheme.find()) {
            return true;
        }
        return ALLOWED_SCHEMES.contains(scheme.group(1).toLowerCase(Locale.ROOT));
    }

    private static final class BlockWriter {

        private final StringBuilder out = new StringBuilder();
        private final List<String> paragraph = new ArrayList<>();
        private final List<String> quote = new ArrayList<>();
        private String listTag;

        void addListItem(String tag, String content) {
            flushParagraph();
            flushQuote();
            if (!tag.equals(listTag)) {
                closeList();
                out.append('<').append(tag).append(">\n");
                listTag = tag;
            }
            out.append("<li>").append(formatInline(content)).append("</li>\n");
        }

        void flushParagraph() {
            if (paragraph.isEmpty()) {
                return;
            }
            out.append("<p>").append(formatInline(String.join("\n", paragraph))).append("</p>\n");
            paragraph.clear();
        }

        void flushQuote() {
            if (quote.isEmpty()) {
                return;
            }
            out.append("<blockquote><p>").append(formatInline(String.join("\n", quote)))
                    .append("</p></blockquote>\n");
            quote.clear();
        }

        void closeList() {
            if (listTag != null) {
                out.append("</").append(listTag).append(">\n");
                listTag = null;
            }
        }

        void flushAll() {
            flushParagraph();
            flushQuote();
            closeList();
        }
    }

    // --- Table conversion ---

    private static List<String> parseCells(String row) {
        String trimmed = row.trim();
        if (trimmed.startsWith("|"))
            trimmed = trimmed.substring(1);
        if (trimmed.endsWith("|"))
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        String[] parts = trimmed.split("\\|");
        List<String> cells = new ArrayList<>();
        for (String part : parts) {
            cells.add(part.trim());
        }
        return cells;
    }

    private static String convertTable(List<String> headers, List<List<String>> rows) {
        StringBuilder out = new StringBuilder("<table>\n<thead>\n<tr>");
        for (String header : headers) {
            out.append("<th>").append(formatCell(header)).append("</th>");
        }
        out.append("</tr>\n</thead>\n<tbody>\n");
        for (List<String> row : rows) {
            out.append("<tr>");
            for (int i = 0; i < headers.size(); i++) {
                String cell = i < row.size() ? row.get(i) : "";
                out.append("<td>").append(formatCell(cell)).append("</td>");
            }
            out.append("</tr>\n");
        }
        out.append("</tbody>\n</table>");
        return out.toString();
    }

    // Cells keep their <br> line breaks; everything else is escaped
    private static String formatCell(String cell) {
        String[] parts = BR_PATTERN.split(cell, -1);
        List<String> formatted = new ArrayList<>(parts.length);
        for (String part : parts) {
            formatted.add(formatInline(escapeHtml(part)));
        }
        return String.join("<br>", formatted);
    }
}
