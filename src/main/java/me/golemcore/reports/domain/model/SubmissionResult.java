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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a successful submission. Storage and notification outcomes are
 * reported separately; partial failures are listed in {@code warnings}.
 */
@Data
@Builder
public class SubmissionResult {

    private String tag;
    private String locator;
    private ReportMode mode;
    private String hostLabel;

    /**
     * Number of caller-supplied files that were persisted.
     */
    private int attachmentCount;
    private int embeddedCount;
    private boolean combinedTextCreated;
    private boolean notified;
    @Builder.Default
    private List<AttachmentRecord> attachments = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
