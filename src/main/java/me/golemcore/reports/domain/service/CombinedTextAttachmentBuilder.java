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

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Concatenates the text attachments of a report into one plain-text file so a
 * reader can scan every source in a single download.
 */
@Component
public class CombinedTextAttachmentBuilder {

    public static final String FILENAME = "combined_text_attachments.txt";
    public static final int MIN_TEXT_FILES = 2;

    private static final String DELIMITER = "=".repeat(80);

    /**
     * One text attachment that was read successfully.
     */
    public record TextSource(String filename, String path, String content) {
    }

    public boolean isApplicable(List<TextSource> sources) {
        return sources.size() >= MIN_TEXT_FILES;
    }

    public String build(List<TextSource> sources, Instant generatedAt) {
        StringBuilder out = new StringBuilder();
        out.append("Combined Text Attachments\n").append(DELIMITER).append('\n');
        out.append("Total files: ").append(sources.size()).append('\n');
        out.append("Generated at: ").append(generatedAt).append('\n');
        out.append(DELIMITER).append("\n\n");

        for (TextSource source : sources) {
            out.append(DELIMITER).append('\n');
            out.append("FILE: ").append(source.filename()).append('\n');
            out.append("PATH: ").append(source.path()).append('\n');
            out.append(DELIMITER).append('\n');
            out.append(source.content());
            if (!source.content().endsWith("\n")) {
                out.append('\n');
            }
            out.append('\n');
        }

        out.append(DELIMITER).append('\n');
        out.append("END OF COMBINED ATTACHMENTS\n");
        out.append(DELIMITER).append('\n');
        return out.toString();
    }
}
