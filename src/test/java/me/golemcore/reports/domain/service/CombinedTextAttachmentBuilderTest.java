package me.golemcore.reports.domain.service;

import me.golemcore.reports.domain.service.CombinedTextAttachmentBuilder.TextSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CombinedTextAttachmentBuilderTest {

    private static final String LINE = "=".repeat(80);

    private final CombinedTextAttachmentBuilder builder = new CombinedTextAttachmentBuilder();

    @Test
    void shouldRequireAtLeastTwoTextFiles() {
        assertFalse(builder.isApplicable(List.of()));
        assertFalse(builder.isApplicable(List.of(new TextSource("a.txt", "/a.txt", "x"))));
        assertTrue(builder.isApplicable(List.of(
                new TextSource("a.txt", "/a.txt", "x"),
                new TextSource("b.csv", "/b.csv", "y"))));
    }

    @Test
    void shouldConcatenateWithHeadersAndDelimiters() {
        String combined = builder.build(List.of(
                new TextSource("a.txt", "/work/a.txt", "alpha\n"),
                new TextSource("b.csv", "/work/b.csv", "x,y")),
                Instant.parse("2026-03-01T12:00:00Z"));

        String expected = "Combined Text Attachments\n" + LINE + "\n"
                + "Total files: 2\n"
                + "Generated at: 2026-03-01T12:00:00Z\n"
                + LINE + "\n\n"
                + LINE + "\nFILE: a.txt\nPATH: /work/a.txt\n" + LINE + "\nalpha\n\n"
                + LINE + "\nFILE: b.csv\nPATH: /work/b.csv\n" + LINE + "\nx,y\n\n"
                + LINE + "\nEND OF COMBINED ATTACHMENTS\n" + LINE + "\n";
        assertEquals(expected, combined);
    }
}
