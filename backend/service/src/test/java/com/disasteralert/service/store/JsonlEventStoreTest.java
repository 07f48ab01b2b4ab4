package com.disasteralert.service.store;

import com.disasteralert.core.events.AlertRaised;
import com.disasteralert.core.events.AlertSuppressed;
import com.disasteralert.core.events.Event;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlEventStoreTest {
    @Test
    void appendedEventsReloadInOrder() throws Exception {
        Path file = Files.createTempDirectory("event-store-roundtrip-").resolve("logs/dispatch-events.jsonl");
        new JsonlEventStore(file).append(alert("first", Instant.parse("2026-02-12T09:00:00Z")));
        new JsonlEventStore(file).append(suppressed(Instant.parse("2026-02-12T09:01:00Z")));

        List<Event> events = new JsonlEventStore(file).query(Instant.EPOCH, Optional.empty(), 10);

        assertEquals(2, events.size());
        assertEquals("AlertRaised", events.get(0).type());
        assertEquals("AlertSuppressed", events.get(1).type());
    }

    @Test
    void querySupportsSinceTypeAndLimit() throws Exception {
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-query-").resolve("logs/events.jsonl"));
        store.append(alert("a", Instant.parse("2026-02-12T09:00:00Z")));
        store.append(alert("b", Instant.parse("2026-02-12T09:01:00Z")));
        store.append(suppressed(Instant.parse("2026-02-12T09:02:00Z")));

        assertEquals(2, store.query(Instant.parse("2026-02-12T09:00:30Z"), Optional.empty(), 10).size());
        assertEquals(2, store.query(Instant.EPOCH, Optional.of("AlertRaised"), 10).size());
        List<Event> newest = store.query(Instant.EPOCH, Optional.empty(), 1);
        assertEquals(1, newest.size());
        assertEquals("AlertSuppressed", newest.get(0).type());
        assertTrue(store.query(Instant.EPOCH, Optional.empty(), 0).isEmpty());
    }

    @Test
    void countsEventsPerType() throws Exception {
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-counts-").resolve("events.jsonl"));
        store.append(alert("a", Instant.parse("2026-02-12T09:00:00Z")));
        store.append(suppressed(Instant.parse("2026-02-12T09:01:00Z")));
        store.append(suppressed(Instant.parse("2026-02-12T09:02:00Z")));

        assertEquals(Map.of("AlertRaised", 1, "AlertSuppressed", 2), store.countByType(Instant.EPOCH));
        assertEquals(Map.of("AlertSuppressed", 1), store.countByType(Instant.parse("2026-02-12T09:02:00Z")));
    }

    @Test
    void missingFileQueriesAsEmpty() throws Exception {
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-missing-").resolve("logs/none.jsonl"));

        assertTrue(store.query(Instant.EPOCH, Optional.empty(), 10).isEmpty());
    }

    @Test
    void invalidLineFailsFastWithClearException() throws Exception {
        Path file = Files.createTempDirectory("event-store-corrupt-").resolve("events.jsonl");
        Files.writeString(file, "not-json\n", StandardCharsets.UTF_8);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
                new JsonlEventStore(file).query(Instant.EPOCH, Optional.empty(), 10));
        assertTrue(ex.getMessage().contains("Invalid JSONL event at line 1"));
    }

    @Test
    void concurrentAppendsKeepEveryLineIntact() throws Exception {
        Path file = Files.createTempDirectory("event-store-concurrent-").resolve("logs/events.jsonl");
        JsonlEventStore store = new JsonlEventStore(file);
        int total = 200;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < total; i++) {
                int idx = i;
                futures.add(executor.submit(() -> store.append(alert("event-" + idx, Instant.EPOCH.plusSeconds(idx)))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(total, lines.size());
        for (String line : lines) {
            EventCodec.fromJsonLine(line);
        }
    }

    private static AlertRaised alert(String message, Instant timestamp) {
        return new AlertRaised(timestamp, "storage", message, Map.of("m", message));
    }

    private static AlertSuppressed suppressed(Instant timestamp) {
        return new AlertSuppressed(timestamp, "mumbai", "flood", 2);
    }
}
