package com.disasteralert.service.store;

import com.disasteralert.core.model.Report;
import com.disasteralert.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Archive of every report received, for audit. Dispatch never reads it back.
 */
public class JsonlReportArchive {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final JsonlFile file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlReportArchive(Path file, Clock clock) {
        this.file = new JsonlFile(file);
        this.clock = clock;
    }

    public int archive(List<Report> reports) {
        if (reports.isEmpty()) {
            return 0;
        }
        Instant savedAt = clock.instant();
        lock.lock();
        try {
            List<String> lines = new ArrayList<>(reports.size());
            for (Report report : reports) {
                lines.add(MAPPER.writeValueAsString(new ArchivedReport(savedAt, report)));
            }
            file.append(lines);
            return reports.size();
        } catch (IOException e) {
            throw new IllegalStateException("Failed archiving reports to " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    public List<ArchivedReport> readAll() {
        lock.lock();
        try {
            List<ArchivedReport> archived = new ArrayList<>();
            for (String line : file.readLines()) {
                if (!line.isBlank()) {
                    archived.add(MAPPER.readValue(line, ArchivedReport.class));
                }
            }
            return archived;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading report archive " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    public record ArchivedReport(Instant savedAt, Report report) {
    }
}
