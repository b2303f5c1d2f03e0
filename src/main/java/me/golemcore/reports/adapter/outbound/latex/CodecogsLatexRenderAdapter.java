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

package me.golemcore.reports.adapter.outbound.latex;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.LatexRenderPort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Renders LaTeX through a codecogs-compatible HTTP endpoint
 * ({@code GET <render-url>?<url-encoded latex>} answering with a PNG).
 *
 * <p>
 * Each call is bounded by {@code reports.math.timeout} through OkHttp's call
 * timeout and is never retried.
 */
@Component
@Slf4j
public class CodecogsLatexRenderAdapter implements LatexRenderPort {

    private final ReportsProperties.MathProperties config;
    private final OkHttpClient httpClient;

    public CodecogsLatexRenderAdapter(ReportsProperties properties, OkHttpClient baseHttpClient) {
        this.config = properties.getMath();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(config.getTimeout())
                .readTimeout(config.getTimeout())
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return config.isRemoteRenderEnabled() && config.getRenderUrl() != null && !config.getRenderUrl().isBlank();
    }

    @Override
    public byte[] renderPng(String latex, boolean display) throws IOException {
        Request request = new Request.Builder()
                .url(buildUrl(latex, display))
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new IOException("LaTeX render failed: HTTP " + response.code());
            }
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            if (bytes.length == 0) {
                throw new IOException("LaTeX render returned an empty body");
            }
            log.debug("[Math] Rendered {} chars of LaTeX into {} bytes", latex.length(), bytes.length);
            return bytes;
        }
    }

    String buildUrl(String latex, boolean display) {
        String expression = "\\dpi{" + config.getDpi() + "}\\bg{white}" + (display ? "\\large " : "") + latex;
        return config.getRenderUrl() + "?" + URLEncoder.encode(expression, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
