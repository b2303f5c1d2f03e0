package me.golemcore.reports.adapter.outbound.mail;

import jakarta.mail.Session;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MailSessionFactoryTest {

    @Test
    void shouldConfigureStartTlsWithAuth() {
        Session session = MailSessionFactory.createSmtpSession("smtp.example.com", 587, "user", "pass",
                MailSecurity.STARTTLS, 1000, 2000);

        Properties props = session.getProperties();
        assertEquals("smtp", props.getProperty("mail.transport.protocol"));
        assertEquals("smtp.example.com", props.getProperty("mail.smtp.host"));
        assertEquals("587", props.getProperty("mail.smtp.port"));
        assertEquals("true", props.getProperty("mail.smtp.auth"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.enable"));
        assertEquals("1000", props.getProperty("mail.smtp.connectiontimeout"));
        assertEquals("2000", props.getProperty("mail.smtp.timeout"));
    }

    @Test
    void shouldConfigureImplicitSsl() {
        Session session = MailSessionFactory.createSmtpSession("smtp.example.com", 465, "user", "pass",
                MailSecurity.SSL, 1000, 2000);

        Properties props = session.getProperties();
        assertEquals("smtps", props.getProperty("mail.transport.protocol.rfc822"));
        assertEquals("true", props.getProperty("mail.smtps.ssl.enable"));
        assertEquals("465", props.getProperty("mail.smtps.port"));
    }

    @Test
    void shouldSkipAuthForOpenRelay() {
        Session session = MailSessionFactory.createSmtpSession("relay.local", 25, "", "",
                MailSecurity.NONE, 1000, 2000);

        Properties props = session.getProperties();
        assertEquals("false", props.getProperty("mail.smtp.auth"));
        assertNull(props.getProperty("mail.smtp.starttls.enable"));
    }

    @Test
    void securityParsingDefaultsToStartTls() {
        assertEquals(MailSecurity.STARTTLS, MailSecurity.fromString(""));
        assertEquals(MailSecurity.STARTTLS, MailSecurity.fromString(null));
        assertEquals(MailSecurity.SSL, MailSecurity.fromString("ssl"));
        assertEquals(MailSecurity.NONE, MailSecurity.fromString("NONE"));
    }
}
