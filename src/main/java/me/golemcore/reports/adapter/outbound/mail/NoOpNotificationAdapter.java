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

package me.golemcore.reports.adapter.outbound.mail;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.ReportNotification;
import me.golemcore.reports.port.outbound.NotificationPort;

import java.util.concurrent.CompletableFuture;

/**
 * Notifier of the local backend: nothing leaves the machine.
 */
@Slf4j
public class NoOpNotificationAdapter implements NotificationPort {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public CompletableFuture<Void> send(ReportNotification notification) {
        log.debug("[Notify] Local mode, skipping notification: {}", notification.getSubject());
        return CompletableFuture.completedFuture(null);
    }
}
