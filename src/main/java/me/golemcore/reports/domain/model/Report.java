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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A report owned by the service for the duration of one submission. The
 * timestamp is captured once and every derived field (folder, metadata,
 * artifact header) is computed from it.
 */
@Data
@Builder
public class Report {

    private String agentName;
    private String title;
    private String body;
    @Builder.Default
    private List<String> files = new ArrayList<>();
    private String tag;
    private Instant timestamp;
    private boolean urgent;
    private String folder;
    private String date;
    private int hour;
    private int minute;
}
