package com.disasteralert.core.bus;

import com.disasteralert.core.events.AlertSuppressed;
import com.disasteralert.core.events.DispatchPassStarted;
import com.disasteralert.core.events.Event;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EventBusTest {
    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(DispatchPassStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(DispatchPassStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new DispatchPassStarted(Instant.parse("2026-01-01T00:00:00Z"), 2, 1));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventTypeAndToAllEventSubscribers() {
        EventBus bus = new EventBus();
        AtomicInteger passHits = new AtomicInteger();
        AtomicInteger suppressedHits = new AtomicInteger();
        List<Event> journal = new CopyOnWriteArrayList<>();

        bus.subscribe(DispatchPassStarted.class, event -> passHits.incrementAndGet());
        bus.subscribe(AlertSuppressed.class, event -> suppressedHits.incrementAndGet());
        bus.subscribeAll(journal::add);

        bus.publish(new DispatchPassStarted(Instant.parse("2026-01-01T00:00:00Z"), 1, 1));
        bus.publish(new AlertSuppressed(Instant.parse("2026-01-01T00:00:01Z"), "mumbai", "flood", 4));

        assertEquals(1, passHits.get());
        assertEquals(1, suppressedHits.get());
        assertEquals(2, journal.size());
        assertEquals("AlertSuppressed", journal.get(1).type());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(DispatchPassStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(DispatchPassStarted.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(event -> safeHits.incrementAndGet());

        bus.publish(new DispatchPassStarted(Instant.parse("2026-01-01T00:00:00Z"), 0, 0));

        assertEquals(2, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void unsubscribeHandleStopsFurtherDelivery() {
        EventBus bus = new EventBus();
        AtomicInteger typedHits = new AtomicInteger();
        AtomicInteger journalHits = new AtomicInteger();

        Runnable typed = bus.subscribe(AlertSuppressed.class, event -> typedHits.incrementAndGet());
        Runnable journal = bus.subscribeAll(event -> journalHits.incrementAndGet());
        assertEquals(2, bus.handlerCount());

        bus.publish(new AlertSuppressed(Instant.parse("2026-01-01T00:00:00Z"), "pune", "fire", 1));
        typed.run();
        journal.run();
        bus.publish(new AlertSuppressed(Instant.parse("2026-01-01T00:00:01Z"), "pune", "fire", 1));

        assertEquals(1, typedHits.get());
        assertEquals(1, journalHits.get());
        assertEquals(0, bus.handlerCount());
    }

    @Test
    void publishingNullIsRejected() {
        assertThrows(NullPointerException.class, () -> new EventBus().publish(null));
    }
}
