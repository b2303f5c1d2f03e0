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
 * Search criteria. Every non-null field is an exact-match filter.
 */
@Data
@Builder(toBuilder = true)
public class ReportQuery {

    private String agentName;
    private String tag;
    private String date;
    private Integer hour;
    private Integer minute;
    private Integer maxResults;
    private boolean includeAncient;

    public boolean isTagSearch() {
        return tag != null && !tag.isBlank();
    }

    public boolean matches(ReportMetadata metadata) {
        if (agentName != null && !agentName.isBlank() && !agentName.equals(metadata.getAgentName())) {
            return false;
        }
        if (isTagSearch() && !tag.trim().equalsIgnoreCase(metadata.getTag())) {
            return false;
        }
        if (date != null && !date.isBlank() && !date.equals(metadata.getDate())) {
            return false;
        }
        if (hour != null && hour != metadata.getHour()) {
            return false;
        }
        return minute == null || minute == metadata.getMinute();
    }
}
