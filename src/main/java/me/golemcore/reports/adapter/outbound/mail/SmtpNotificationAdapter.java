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

import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reports.domain.model.EmbeddedAttachment;
import me.golemcore.reports.domain.model.ReportNotification;
import me.golemcore.reports.infrastructure.config.ReportsProperties;
import me.golemcore.reports.port.outbound.NotificationPort;

import java.util.Date;
import java.util.concurrent.CompletableFuture;

/**
 * SMTP implementation of {@link NotificationPort} (Jakarta Mail).
 *
 * <p>
 * Message layout:
 * <ul>
 * <li>plain notification: {@code multipart/alternative} with a text and an
 * HTML part</li>
 * <li>with embedded images or when urgent: {@code multipart/mixed} holding
 * the alternative part followed by one base64 part per image</li>
 * </ul>
 * Urgent messages carry the priority headers understood by common mail
 * clients.
 */
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // jakarta.mail.internet.MimeMessage.setSentDate requires java.util.Date
public class SmtpNotificationAdapter implements NotificationPort {

    private static final String UTF_8 = "UTF-8";

    private final ReportsProperties.MailProperties config;

    public SmtpNotificationAdapter(ReportsProperties properties) {
        this.config = properties.getMail();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public CompletableFuture<Void> send(ReportNotification notification) {
        return CompletableFuture.runAsync(() -> {
            try {
                MimeMessage message = buildMessage(notification);
                deliver(message);
                log.info("[SMTP] Notification sent to: {}", config.getTo());
            } catch (MessagingException e) {
                throw new IllegalStateException("SMTP error: " + sanitizeError(e.getMessage()), e);
            }
        });
    }

    MimeMessage buildMessage(ReportNotification notification) throws MessagingException {
        Session session = MailSessionFactory.createSmtpSession(
                config.getHost(), config.getPort(),
                config.getUsername(), config.getPassword(),
                MailSecurity.fromString(config.getSecurity()),
                config.getConnectTimeout(), config.getReadTimeout());

        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(config.getFrom()));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(config.getTo()));
        message.setSubject(notification.getSubject(), UTF_8);
        message.setSentDate(new Date());

        if (notification.isUrgent()) {
            message.setHeader("X-Priority", "1");
            message.setHeader("X-MSMail-Priority", "High");
            message.setHeader("Priority", "urgent");
            message.setHeader("Importance", "high");
        }

        MimeMultipart alternative = new MimeMultipart("alternative");
        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(notification.getTextBody() != null ? notification.getTextBody() : "", UTF_8);
        alternative.addBodyPart(textPart);
        if (notification.getHtmlBody() != null && !notification.getHtmlBody().isBlank()) {
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setContent(notification.getHtmlBody(), "text/html; charset=UTF-8");
            alternative.addBodyPart(htmlPart);
        }

        if (notification.requiresMixedMessage()) {
            MimeMultipart mixed = new MimeMultipart("mixed");
            MimeBodyPart alternativeWrapper = new MimeBodyPart();
            alternativeWrapper.setContent(alternative);
            mixed.addBodyPart(alternativeWrapper);
            for (EmbeddedAttachment attachment : notification.getAttachments()) {
                mixed.addBodyPart(attachmentPart(attachment));
            }
            message.setContent(mixed);
        } else {
            message.setContent(alternative);
        }
        message.saveChanges();
        return message;
    }

    private MimeBodyPart attachmentPart(EmbeddedAttachment attachment) throws MessagingException {
        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(new ByteArrayDataSource(attachment.getData(),
                attachment.getContentType())));
        part.setFileName(attachment.getFilename());
        part.setDisposition(Part.ATTACHMENT);
        part.setHeader("Content-Transfer-Encoding", "base64");
        return part;
    }

    String sanitizeError(String message) {
        if (message == null) {
            return "Unknown error";
        }
        String sanitized = message;
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            sanitized = sanitized.replace(config.getUsername(), "***");
        }
        if (config.getPassword() != null && !config.getPassword().isBlank()) {
            sanitized = sanitized.replace(config.getPassword(), "***");
        }
        return sanitized;
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }
}
