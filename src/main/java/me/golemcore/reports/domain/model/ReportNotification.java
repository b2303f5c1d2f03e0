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
 * Composed notification for one report: subject, plain-text and HTML
 * renditions, embedded images and the urgency flag.
 */
@Data
@Builder
public class ReportNotification {

    private String subject;
    private String textBody;
    private String htmlBody;
    @Builder.Default
    private List<EmbeddedAttachment> attachments = new ArrayList<>();
    private boolean urgent;

    public boolean requiresMixedMessage() {
        return urgent || (attachments != null && !attachments.isEmpty());
    }
}
