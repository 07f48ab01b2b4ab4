package com.disasteralert.service.email;

import com.disasteralert.engine.api.AlertTransport;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends alerts over SMTPS with username/password authentication.
 */
public final class SmtpEmailSender implements AlertTransport {
    private static final Logger LOGGER = Logger.getLogger(SmtpEmailSender.class.getName());

    private final String host;
    private final String username;
    private final String password;
    private final Session session;

    public SmtpEmailSender(String host, int port, String username, String password, Duration timeout) {
        this.host = host;
        this.username = username;
        this.password = password;
        this.session = Session.getInstance(sessionProperties(host, port, timeout), new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    static Properties sessionProperties(String host, int port, Duration timeout) {
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.ssl.enable", "true");
        props.put("mail.smtp.connectiontimeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(timeout.toMillis()));
        return props;
    }

    public boolean credentialsConfigured() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public boolean send(String recipient, String subject, String body) {
        if (!credentialsConfigured()) {
            LOGGER.warning("EMAIL_ADDRESS / EMAIL_PASSWORD not set; cannot send alert to " + recipient);
            return false;
        }
        try {
            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(username));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(recipient));
            message.setSubject(subject, StandardCharsets.UTF_8.name());
            message.setText(body, StandardCharsets.UTF_8.name());
            Transport.send(message);
            LOGGER.info("Alert sent to " + recipient);
            return true;
        } catch (AuthenticationFailedException e) {
            LOGGER.warning("Authentication failed for " + username + " on " + host + "; check the app password");
            return false;
        } catch (MessagingException e) {
            LOGGER.log(Level.WARNING, "Sending alert to " + recipient + " via " + host + " failed", e);
            return false;
        }
    }
}
