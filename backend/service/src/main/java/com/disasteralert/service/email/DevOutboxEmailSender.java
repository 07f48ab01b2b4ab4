package com.disasteralert.service.email;

import com.disasteralert.core.util.JsonUtils;
import com.disasteralert.engine.api.AlertTransport;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Development transport: every alert lands in a JSON outbox file instead of a mail server.
 */
public final class DevOutboxEmailSender implements AlertTransport {
    private static final Logger LOGGER = Logger.getLogger(DevOutboxEmailSender.class.getName());

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public DevOutboxEmailSender(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    @Override
    public boolean send(String recipient, String subject, String body) {
        lock.lock();
        try {
            List<OutboxMessage> messages = new ArrayList<>(readMessages());
            messages.add(new OutboxMessage(recipient, subject, body, Instant.now(clock)));
            write(messages);
            LOGGER.info("Alert for " + recipient + " written to dev outbox " + file);
            return true;
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Dev outbox write failed for " + recipient, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    public List<OutboxMessage> messages() {
        lock.lock();
        try {
            return readMessages();
        } finally {
            lock.unlock();
        }
    }

    private List<OutboxMessage> readMessages() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<OutboxMessage> stored = JsonUtils.readFile(file, new TypeReference<List<OutboxMessage>>() {
            });
            return stored == null ? List.of() : stored;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read dev outbox " + file, e);
        }
    }

    private void write(List<OutboxMessage> messages) {
        try {
            JsonUtils.writeFileAtomically(file, messages);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write dev outbox " + file, e);
        }
    }

    public record OutboxMessage(String to, String subject, String body, Instant createdAt) {
    }
}
