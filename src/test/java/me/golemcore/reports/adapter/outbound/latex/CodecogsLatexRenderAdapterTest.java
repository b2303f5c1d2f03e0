package me.golemcore.reports.adapter.outbound.latex;

import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.testsupport.http.OkHttpMockEngine;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CodecogsLatexRenderAdapterTest {

    private static final byte[] PNG = new byte[] { (byte) 0x89, 'P', 'N', 'G' };

    private OkHttpMockEngine engine;
    private ReportsProperties properties;
    private CodecogsLatexRenderAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new ReportsProperties();
        properties.getMath().setRenderUrl("https://latex.example.com/png.image");
        adapter = new CodecogsLatexRenderAdapter(properties, engine.client());
    }

    @Test
    void shouldReturnPngBytes() throws IOException {
        engine.enqueueBytes(200, PNG, "image/png");

        byte[] png = adapter.renderPng("x^2", false);

        assertArrayEquals(PNG, png);
        Request request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("latex.example.com", request.url().host());
    }

    @Test
    void shouldEncodeExpressionWithDpiAndBackground() {
        String url = adapter.buildUrl("a + b", false);

        assertEquals("https://latex.example.com/png.image?%5Cdpi%7B150%7D%5Cbg%7Bwhite%7Da%20%2B%20b", url);
    }

    @Test
    void shouldEnlargeDisplayMath() {
        String url = adapter.buildUrl("x", true);

        assertTrue(url.endsWith("%5Clarge%20x"));
    }

    @Test
    void shouldFailOnNonSuccessStatus() {
        engine.enqueueText(500, "boom");

        IOException thrown = assertThrows(IOException.class, () -> adapter.renderPng("x", false));
        assertTrue(thrown.getMessage().contains("HTTP 500"));
    }

    @Test
    void shouldFailOnEmptyBody() {
        engine.enqueueBytes(200, new byte[0], "image/png");

        assertThrows(IOException.class, () -> adapter.renderPng("x", false));
    }

    @Test
    void shouldPropagateTransportFailures() {
        engine.enqueueFailure(new SocketTimeoutException("timeout"));

        assertThrows(IOException.class, () -> adapter.renderPng("x", false));
    }

    @Test
    void shouldReportAvailabilityFromConfiguration() {
        assertTrue(adapter.isAvailable());

        properties.getMath().setRemoteRenderEnabled(false);

        assertFalse(adapter.isAvailable());
    }
}
