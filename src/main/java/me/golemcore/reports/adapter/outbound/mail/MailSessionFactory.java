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

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;

import java.util.Properties;

/**
 * Creates Jakarta Mail SMTP sessions with the requested security settings
 * (SSL, STARTTLS, or plaintext).
 *
 * <p>
 * Not a Spring bean; used directly by {@link SmtpNotificationAdapter}.
 */
public final class MailSessionFactory {

    private static final String MAIL_PREFIX = "mail.";
    private static final String TRUE_VALUE = "true";

    private MailSessionFactory() {
    }

    /**
     * Creates a Jakarta Mail session configured for SMTP. Authentication is
     * enabled only when a username is given.
     *
     * @param host
     *            SMTP server hostname
     * @param port
     *            SMTP server port
     * @param username
     *            authentication username, blank for an open relay
     * @param password
     *            authentication password
     * @param security
     *            connection security mode
     * @param connectTimeout
     *            connection timeout in milliseconds
     * @param readTimeout
     *            read timeout in milliseconds
     * @return configured Mail Session
     */
    public static Session createSmtpSession(String host, int port, String username, String password,
            MailSecurity security, int connectTimeout, int readTimeout) {

        Properties props = new Properties();
        String protocol = (security == MailSecurity.SSL) ? "smtps" : "smtp";
        String prefix = MAIL_PREFIX + protocol + ".";
        boolean authenticated = username != null && !username.isBlank();

        props.put("mail.transport.protocol", protocol);
        // Transport.send resolves the transport by address type
        props.put("mail.transport.protocol.rfc822", protocol);
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "auth", String.valueOf(authenticated));
        props.put(prefix + "connectiontimeout", String.valueOf(connectTimeout));
        props.put(prefix + "timeout", String.valueOf(readTimeout));
        props.put(prefix + "writetimeout", String.valueOf(readTimeout));

        if (security == MailSecurity.SSL) {
            props.put(MAIL_PREFIX + "smtps.ssl.enable", TRUE_VALUE);
        } else if (security == MailSecurity.STARTTLS) {
            props.put(MAIL_PREFIX + "smtp.starttls.enable", TRUE_VALUE);
            props.put(MAIL_PREFIX + "smtp.starttls.required", TRUE_VALUE);
        }

        if (!authenticated) {
            return Session.getInstance(props);
        }
        return Session.getInstance(props, createAuthenticator(username, password));
    }

    private static Authenticator createAuthenticator(String username, String password) {
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        };
    }
}
