package me.golemcore.reports.domain.service;

import me.golemcore.reports.domain.model.MathSpan;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathSpanExtractorTest {

    @Test
    void shouldExtractDisplayBeforeInline() {
        MathSpanExtractor.Extraction extraction = MathSpanExtractor.extract("a $x$ and $$y^2$$ end");

        assertEquals(2, extraction.spans().size());
        MathSpan display = extraction.spans().get(0);
        MathSpan inline = extraction.spans().get(1);
        assertTrue(display.display());
        assertEquals("y^2", display.latex());
        assertFalse(inline.display());
        assertEquals("x", inline.latex());
        assertFalse(extraction.text().contains("$"));
    }

    @Test
    void shouldNotMatchInlineAcrossLines() {
        MathSpanExtractor.Extraction extraction = MathSpanExtractor.extract("costs $5\nand $10");

        assertTrue(extraction.spans().isEmpty());
        assertEquals("costs $5\nand $10", extraction.text());
    }

    @Test
    void shouldTreatEscapedDollarsAsLiterals() {
        MathSpanExtractor.Extraction extraction = MathSpanExtractor.extract("pay \\$5 and \\$6 or $x$");

        assertEquals(1, extraction.spans().size());
        assertEquals("x", extraction.spans().get(0).latex());
        assertTrue(extraction.text().startsWith("pay \\$5 and \\$6 or "));
    }

    @Test
    void shouldAllowDisplayMathAcrossLines() {
        MathSpanExtractor.Extraction extraction = MathSpanExtractor.extract("$$\na+b\n$$");

        assertEquals(1, extraction.spans().size());
        assertEquals("\na+b\n", extraction.spans().get(0).latex());
        assertTrue(MathSpanExtractor.isDisplayPlaceholder(extraction.text()));
    }

    @Test
    void shouldRestoreWithRenderer() {
        MathSpanExtractor.Extraction extraction = MathSpanExtractor.extract("$a$ then $b$");

        String restored = MathSpanExtractor.restore(extraction.text(), extraction.spans(),
                span -> "[" + span.latex() + "]");

        assertEquals("[a] then [b]", restored);
    }
}
