package com.disasteralert.service.store;

import com.disasteralert.core.bus.EventBus;
import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.model.Report;
import com.disasteralert.engine.api.AlertTransport;
import com.disasteralert.engine.api.DispatchContext;
import com.disasteralert.engine.api.SubscriberDirectory;
import com.disasteralert.engine.dispatch.DispatchOrchestrator;
import com.disasteralert.engine.dispatch.DispatchOutcome;
import com.disasteralert.engine.dispatch.DispatchReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.channels.FileChannel;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Two dispatchers that share nothing but the sent-alert file, as two CLI runs would.
 */
class SharedAlertLogDispatchTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-12T09:00:00Z"), ZoneOffset.UTC);
    private static final EventKey MUMBAI_FLOOD = new EventKey("mumbai", "flood");

    private final ExecutorService callers = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() throws InterruptedException {
        callers.shutdownNow();
        callers.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void twoOrchestratorsOverOneFileSendTheEventOnce() throws Exception {
        Path file = Files.createTempDirectory("shared-alert-log-").resolve("sent_alerts.jsonl");
        AtomicInteger sends = new AtomicInteger();
        AlertTransport slowTransport = (recipient, subject, body) -> {
            sends.incrementAndGet();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        };
        Map<EventKey, List<Report>> groups = Map.of(MUMBAI_FLOOD, List.of(
                new Report("u1", "2026-02-12T08:55:00Z", "Waterlogging at Sion", "Mumbai", "Flood", null, null)
        ));

        CountDownLatch start = new CountDownLatch(1);
        List<Future<DispatchReport>> passes = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            DispatchOrchestrator orchestrator = orchestrator(new JsonlAlertLog(file, CLOCK), slowTransport);
            passes.add(callers.submit(() -> {
                start.await();
                return orchestrator.process(groups);
            }));
        }
        start.countDown();

        int sent = 0;
        int suppressed = 0;
        for (Future<DispatchReport> pass : passes) {
            DispatchReport report = pass.get(10, TimeUnit.SECONDS);
            sent += (int) report.count(DispatchOutcome.SENT);
            suppressed += (int) report.count(DispatchOutcome.SUPPRESSED_DUPLICATE);
        }

        assertEquals(1, sent);
        assertEquals(1, suppressed);
        assertEquals(1, sends.get());
        assertEquals(1, new JsonlAlertLog(file, CLOCK).records().size());
    }

    @Test
    void keyClaimHoldsAFileLockOnTheSidecar() throws Exception {
        Path file = Files.createTempDirectory("shared-alert-claim-").resolve("sent_alerts.jsonl");
        Path sidecar = file.resolveSibling("sent_alerts.jsonl.lock");

        try (FileChannel other = FileChannel.open(sidecar, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            boolean lockedWhileClaimed = new JsonlAlertLog(file, CLOCK).withKeyLock(MUMBAI_FLOOD, () -> {
                assertThrows(OverlappingFileLockException.class, () -> other.tryLock(0, Long.MAX_VALUE, false));
                return true;
            });

            assertTrue(lockedWhileClaimed);
            other.tryLock(0, Long.MAX_VALUE, false).release();
        }
    }

    @Test
    void claimOnUnusableDirectoryFailsWithLockFileInMessage() throws Exception {
        Path blocker = Files.createTempDirectory("shared-alert-blocked-").resolve("not-a-dir");
        Files.writeString(blocker, "blocker");

        JsonlAlertLog log = new JsonlAlertLog(blocker.resolve("sent_alerts.jsonl"), CLOCK);
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> log.withKeyLock(MUMBAI_FLOOD, () -> "unreachable"));
        assertTrue(ex.getMessage().contains("sent_alerts.jsonl.lock"));
    }

    private static DispatchOrchestrator orchestrator(JsonlAlertLog alertLog, AlertTransport transport) {
        SubscriberDirectory directory = locations -> Map.of("mumbai", List.of("m@example.com"));
        return new DispatchOrchestrator(new DispatchContext(
                directory,
                alertLog,
                transport,
                new EventBus(),
                CLOCK,
                DispatchContext.DEFAULT_SUPPRESSION_WINDOW,
                Runnable::run,
                Runnable::run
        ));
    }
}
