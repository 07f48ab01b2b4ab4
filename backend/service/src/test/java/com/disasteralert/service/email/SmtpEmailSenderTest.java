package com.disasteralert.service.email;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmtpEmailSenderTest {
    @Test
    void sessionUsesImplicitTlsWithAuthAndTimeouts() {
        Properties props = SmtpEmailSender.sessionProperties("smtp.gmail.com", 465, Duration.ofSeconds(10));

        assertEquals("smtp.gmail.com", props.get("mail.smtp.host"));
        assertEquals("465", props.get("mail.smtp.port"));
        assertEquals("true", props.get("mail.smtp.auth"));
        assertEquals("true", props.get("mail.smtp.ssl.enable"));
        assertEquals("10000", props.get("mail.smtp.timeout"));
    }

    @Test
    void missingCredentialsFailWithoutContactingTheServer() {
        SmtpEmailSender sender = new SmtpEmailSender("localhost", 1, "", "", Duration.ofMillis(200));

        assertFalse(sender.credentialsConfigured());
        assertFalse(sender.send("a@example.com", "subject", "body"));
    }

    @Test
    void credentialsAreConfiguredWhenBothArePresent() {
        SmtpEmailSender sender = new SmtpEmailSender("localhost", 465, "alerts@example.com", "app-password", Duration.ofSeconds(1));

        assertTrue(sender.credentialsConfigured());
    }
}
