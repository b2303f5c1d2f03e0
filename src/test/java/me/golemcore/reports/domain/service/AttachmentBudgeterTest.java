package me.golemcore.reports.domain.service;

import me.golemcore.reports.domain.model.BudgetSelection;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.ReportFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttachmentBudgeterTest {

    private static final long MB = 1024L * 1024;

    private final AttachmentBudgeter budgeter = new AttachmentBudgeter();

    @Test
    void shouldEmbedSmallestImagesFirstWithinByteBudget() {
        ReportFile big = image("big.png", 6 * MB);
        ReportFile small = image("small.png", 1 * MB);
        ReportFile medium = image("medium.png", 3 * MB);

        BudgetSelection selection = budgeter.select(List.of(big, small, medium), 5, 8 * MB);

        assertEquals(List.of(small, medium), selection.embedded());
        assertFalse(selection.isEmbedded(big));
        assertEquals(List.of(small, medium, big), selection.all());
    }

    @Test
    void shouldRespectCountLimit() {
        List<ReportFile> files = List.of(
                image("1.png", 10), image("2.png", 20), image("3.png", 30),
                image("4.png", 40), image("5.png", 50), image("6.png", 60));

        BudgetSelection selection = budgeter.select(files, 5, 8 * MB);

        assertEquals(5, selection.embedded().size());
        assertFalse(selection.isEmbedded(files.get(5)));
    }

    @Test
    void shouldAllowExactlyFullBudget() {
        ReportFile first = image("a.png", 4 * MB);
        ReportFile second = image("b.png", 4 * MB);

        BudgetSelection selection = budgeter.select(List.of(first, second), 5, 8 * MB);

        assertEquals(2, selection.embedded().size());
    }

    @Test
    void shouldNeverEmbedNonImages() {
        ReportFile text = ReportFile.builder().filename("data.csv").sizeBytes(10).role(ContentRole.TEXT).build();
        ReportFile other = ReportFile.builder().filename("a.zip").sizeBytes(5).role(ContentRole.OTHER).build();

        BudgetSelection selection = budgeter.select(List.of(text, other), 5, 8 * MB);

        assertTrue(selection.embedded().isEmpty());
        assertEquals(2, selection.all().size());
    }

    @Test
    void shouldKeepInputOrderForEqualSizes() {
        ReportFile first = image("first.png", 100);
        ReportFile second = image("second.png", 100);

        BudgetSelection selection = budgeter.select(List.of(first, second), 1, 8 * MB);

        assertEquals(List.of(first), selection.embedded());
    }

    private static ReportFile image(String name, long size) {
        return ReportFile.builder()
                .path("/tmp/" + name)
                .filename(name)
                .sizeBytes(size)
                .role(ContentRole.IMAGE)
                .contentType("image/png")
                .build();
    }
}
