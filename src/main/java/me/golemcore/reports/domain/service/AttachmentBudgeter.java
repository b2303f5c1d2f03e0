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

package me.golemcore.reports.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.BudgetSelection;
import me.golemcore.reports.domain.model.ContentRole;
import me.golemcore.reports.domain.model.ReportFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects which attachments are embedded in the notification e-mail.
 *
 * <p>
 * Files are ordered smallest first so that as many images as possible fit.
 * An image is embedded while fewer than {@code maxCount} files are embedded
 * and the running total stays within {@code maxTotalBytes}. Everything else
 * is still persisted and linked. Mail transports cap messages at about
 * 10 MiB after base64 (~33% inflation), which is why the default byte budget
 * is 8 MiB.
 */
@Component
@Slf4j
public class AttachmentBudgeter {

    public BudgetSelection select(List<ReportFile> files, int maxCount, long maxTotalBytes) {
        List<ReportFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparingLong(ReportFile::getSizeBytes));

        List<ReportFile> embedded = new ArrayList<>();
        long runningBytes = 0;
        for (ReportFile file : sorted) {
            if (file.getRole() != ContentRole.IMAGE) {
                continue;
            }
            if (embedded.size() < maxCount && runningBytes + file.getSizeBytes() <= maxTotalBytes) {
                embedded.add(file);
                runningBytes += file.getSizeBytes();
            } else {
                log.debug("[Budget] {} ({} bytes) linked only", file.getFilename(), file.getSizeBytes());
            }
        }
        return new BudgetSelection(embedded, sorted);
    }
}
