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

package me.golemcore.reports.port.outbound;

import java.io.IOException;

/**
 * Port for turning a LaTeX expression into a raster image.
 */
public interface LatexRenderPort {

    boolean isAvailable();

    /**
     * Render an expression to PNG bytes. Blocks for at most the configured
     * per-expression timeout.
     *
     * @param latex
     *            expression without the surrounding dollar signs
     * @param display
     *            true for display math, false for inline
     * @throws IOException
     *             on network errors, non-2xx responses or empty bodies
     */
    byte[] renderPng(String latex, boolean display) throws IOException;
}
