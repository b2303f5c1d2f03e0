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

package me.golemcore.reports.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * A caller-supplied attachment after it was located on disk. The bytes are
 * read lazily by the service when the file is persisted.
 */
@Data
@Builder
public class ReportFile {

    private String path;
    private String filename;
    private long sizeBytes;
    private ContentRole role;
    private String contentType;
}
