package com.disasteralert.service.store;

import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.model.SentAlertRecord;
import com.disasteralert.core.util.JsonUtils;
import com.disasteralert.core.util.KeyedLocks;
import com.disasteralert.engine.api.AlertLog;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sent-alert log kept as one JSON object per line. Rows are only ever appended.
 *
 * <p>Key claims lock one byte of the sidecar {@code <file>.lock}, chosen from the key's hash, so
 * dispatchers in other processes sharing the file exclude each other per key. Threads of this JVM
 * claiming the same byte queue on an in-process lock first, since a JVM cannot hold overlapping
 * file locks.
 */
public class JsonlAlertLog implements AlertLog {
    private static final Logger LOGGER = Logger.getLogger(JsonlAlertLog.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final KeyedLocks<String> CLAIMS = new KeyedLocks<>();
    private static final int CLAIM_REGIONS = 1 << 16;
    private static final Map<Path, SharedChannel> SIDECARS = new ConcurrentHashMap<>();

    private final JsonlFile file;
    private final Path lockFile;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlAlertLog(Path file, Clock clock) {
        this.file = new JsonlFile(file);
        this.lockFile = file.toAbsolutePath().normalize().resolveSibling(file.getFileName() + ".lock");
        this.clock = clock;
    }

    @Override
    public <T> T withKeyLock(EventKey key, Supplier<T> action) {
        long region = Math.floorMod(key.toString().hashCode(), CLAIM_REGIONS);
        return CLAIMS.withLock(lockFile + "#" + region, () -> {
            FileChannel channel = openSidecar(key);
            try (FileLock ignored = channel.lock(region, 1, false)) {
                return action.get();
            } catch (IOException e) {
                throw new IllegalStateException("Failed claiming " + key + " in " + lockFile, e);
            } finally {
                closeSidecar();
            }
        });
    }

    // Closing any channel on a file drops every lock this JVM holds on it, so claims share one channel.
    private FileChannel openSidecar(EventKey key) {
        try {
            return SIDECARS.compute(lockFile, (path, existing) -> {
                SharedChannel shared = existing;
                if (shared == null) {
                    try {
                        Files.createDirectories(path.getParent());
                        shared = new SharedChannel(FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE));
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
                shared.users++;
                return shared;
            }).channel;
        } catch (UncheckedIOException e) {
            throw new IllegalStateException("Failed claiming " + key + " in " + lockFile, e.getCause());
        }
    }

    private void closeSidecar() {
        SIDECARS.compute(lockFile, (path, shared) -> {
            if (--shared.users > 0) {
                return shared;
            }
            try {
                shared.channel.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed closing " + path, e);
            }
            return null;
        });
    }

    @Override
    public boolean wasRecentlySent(EventKey key, Duration window) {
        Instant cutoff = clock.instant().minus(window);
        lock.lock();
        try {
            for (SentAlertRecord record : readRecords()) {
                if (record.matches(key) && record.sentAt().isAfter(cutoff)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSent(EventKey key) {
        SentAlertRecord record = new SentAlertRecord(key.location(), key.disasterType(), clock.instant());
        lock.lock();
        try {
            file.append(List.of(MAPPER.writeValueAsString(record)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending sent alert to " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    public List<SentAlertRecord> records() {
        lock.lock();
        try {
            return readRecords();
        } finally {
            lock.unlock();
        }
    }

    private List<SentAlertRecord> readRecords() {
        List<String> lines;
        try {
            lines = file.readLines();
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading sent alerts from " + file.path(), e);
        }
        List<SentAlertRecord> records = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            SentAlertRecord record;
            try {
                record = MAPPER.readValue(line, SentAlertRecord.class);
            } catch (IOException decodeError) {
                throw new IllegalStateException("Invalid sent alert at line " + lineNumber + " of " + file.path(), decodeError);
            }
            if (record.location() == null || record.disasterType() == null || record.sentAt() == null) {
                throw new IllegalStateException("Incomplete sent alert at line " + lineNumber + " of " + file.path());
            }
            records.add(record);
        }
        return records;
    }

    private static final class SharedChannel {
        private final FileChannel channel;
        private int users;

        private SharedChannel(FileChannel channel) {
            this.channel = channel;
        }
    }
}
