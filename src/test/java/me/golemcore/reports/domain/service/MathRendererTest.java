package me.golemcore.reports.domain.service;

import me.golemcore.reports.domain.model.AttachmentRecord;
import me.golemcore.reports.domain.model.RenderedBody;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.LatexRenderPort;
import me.golemcore.reports.port.outbound.ReportStorageException;
import me.golemcore.reports.port.outbound.ReportStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MathRendererTest {

    private static final byte[] PNG = new byte[] { (byte) 0x89, 'P', 'N', 'G' };
    private static final String FOLDER = "agent/2026-03-01_12-00-00";

    private LatexRenderPort latexRenderPort;
    private ReportStoragePort storagePort;
    private ReportsProperties properties;
    private MathRenderer renderer;

    @BeforeEach
    void setUp() {
        latexRenderPort = mock(LatexRenderPort.class);
        storagePort = mock(ReportStoragePort.class);
        properties = new ReportsProperties();
        when(latexRenderPort.isAvailable()).thenReturn(true);
        renderer = new MathRenderer(latexRenderPort, storagePort, properties);
    }

    @Test
    void browserRenditionShouldKeepLatexAndAddNoscriptFallback() {
        String html = renderer.renderForBrowser("energy $x^2$");

        assertTrue(html.contains("<span class=\"math-inline\">$x^2$</span>"));
        assertTrue(html.contains("<noscript><span class=\"math-fallback\">x²</span></noscript>"));
        verifyNoInteractions(latexRenderPort, storagePort);
    }

    @Test
    void browserRenditionShouldWrapDisplayMath() {
        String html = renderer.renderForBrowser("$$\\frac{a}{b}$$");

        assertTrue(html.contains("<div class=\"math-display\">$$\\frac{a}{b}$$</div>"));
        assertTrue(html.contains("<div class=\"math-fallback\">a/b</div>"));
    }

    @Test
    void notificationRenditionShouldPersistRenderedImages() throws IOException {
        when(latexRenderPort.renderPng("x^2", false)).thenReturn(PNG);
        when(storagePort.persist(eq(FOLDER + "/math_0.png"), eq(PNG), eq("image/png")))
                .thenReturn(CompletableFuture.completedFuture("https://bucket/math_0.png"));

        RenderedBody body = renderer.renderForNotification("value $x^2$", FOLDER);

        assertTrue(body.html().contains("<img src=\"https://bucket/math_0.png\" alt=\"x^2\""));
        assertEquals(1, body.derivedFiles().size());
        AttachmentRecord record = body.derivedFiles().get(0);
        assertEquals("math_0.png", record.getFilename());
        assertEquals(PNG.length, record.getSizeBytes());
        assertTrue(record.isDerived());
    }

    @Test
    void notificationRenditionShouldFallBackPerExpression() throws IOException {
        when(latexRenderPort.renderPng("a", false)).thenThrow(new IOException("HTTP 500"));
        when(latexRenderPort.renderPng("\\alpha", false)).thenReturn(PNG);
        when(storagePort.persist(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("https://bucket/math_1.png"));

        RenderedBody body = renderer.renderForNotification("$a$ and $\\alpha$", FOLDER);

        assertTrue(body.html().contains("<span style=\"font-family: 'Times New Roman', serif; font-size: 1.1em;\">a</span>"));
        assertTrue(body.html().contains("math_1.png"));
        assertEquals(1, body.derivedFiles().size());
    }

    @Test
    void notificationRenditionShouldFallBackWhenStorageFails() throws IOException {
        when(latexRenderPort.renderPng("y", true)).thenReturn(PNG);
        when(storagePort.persist(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new ReportStorageException("bucket gone")));

        RenderedBody body = renderer.renderForNotification("$$y$$", FOLDER);

        assertTrue(body.html().contains("text-align: center"));
        assertTrue(body.html().contains(">y</div>"));
        assertTrue(body.derivedFiles().isEmpty());
    }

    @Test
    void notificationRenditionShouldSkipRenderServiceWhenDisabled() throws IOException {
        properties.getMath().setRemoteRenderEnabled(false);

        RenderedBody body = renderer.renderForNotification("$\\pi$", FOLDER);

        assertTrue(body.html().contains(">π</span>"));
        assertFalse(body.html().contains("<img"));
        verify(latexRenderPort, never()).renderPng(anyString(), anyBoolean());
    }
}
