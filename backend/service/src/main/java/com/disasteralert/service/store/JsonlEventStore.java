package com.disasteralert.service.store;

import com.disasteralert.core.events.Event;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Journal of dispatch lifecycle events, fed from the event bus and read back by the
 * {@code history} command.
 */
public class JsonlEventStore {
    private final JsonlFile file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path path) {
        this.file = new JsonlFile(path);
    }

    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            file.append(List.of(line));
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Newest {@code limit} events at or after {@code since}, optionally of one type, oldest first.
     */
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Event> matches = new ArrayList<>();
        for (Event event : readAll()) {
            if (!event.timestamp().isBefore(since) && type.map(event.type()::equals).orElse(true)) {
                matches.add(event);
            }
        }
        if (matches.size() <= limit) {
            return matches;
        }
        return List.copyOf(matches.subList(matches.size() - limit, matches.size()));
    }

    public Map<String, Integer> countByType(Instant since) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Event event : readAll()) {
            if (!event.timestamp().isBefore(since)) {
                counts.merge(event.type(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private List<Event> readAll() {
        List<String> lines;
        lock.lock();
        try {
            lines = file.readLines();
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + file.path(), e);
        } finally {
            lock.unlock();
        }
        List<Event> events = new ArrayList<>(lines.size());
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(EventCodec.fromJsonLine(line));
            } catch (RuntimeException decodeError) {
                throw new IllegalStateException("Invalid JSONL event at line " + lineNumber + " of " + file.path(), decodeError);
            }
        }
        return events;
    }
}
