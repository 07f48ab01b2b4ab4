package com.disasteralert.engine.dispatch;

import com.disasteralert.core.events.AlertDispatched;
import com.disasteralert.core.events.AlertRaised;
import com.disasteralert.core.events.AlertSkipped;
import com.disasteralert.core.events.AlertSuppressed;
import com.disasteralert.core.events.DeliveryFailed;
import com.disasteralert.core.events.DispatchPassCompleted;
import com.disasteralert.core.events.DispatchPassStarted;
import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.model.Report;
import com.disasteralert.engine.api.DispatchContext;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends one consolidated alert per event group unless the same event was alerted within the
 * suppression window or nobody subscribed to its location.
 */
public final class DispatchOrchestrator {
    private static final Logger LOGGER = Logger.getLogger(DispatchOrchestrator.class.getName());

    private final DispatchContext ctx;
    private final MessageComposer composer;
    private final EventKeyLocks locks;

    public DispatchOrchestrator(DispatchContext ctx) {
        this(ctx, new MessageComposer(), new EventKeyLocks());
    }

    public DispatchOrchestrator(DispatchContext ctx, MessageComposer composer, EventKeyLocks locks) {
        this.ctx = ctx;
        this.composer = composer;
        this.locks = locks;
    }

    public DispatchReport process(Map<EventKey, List<Report>> groups) {
        Instant passStartedAt = ctx.clock().instant();
        Set<String> locations = new LinkedHashSet<>();
        for (EventKey key : groups.keySet()) {
            locations.add(key.location());
        }
        ctx.eventBus().publish(new DispatchPassStarted(passStartedAt, groups.size(), locations.size()));

        if (groups.isEmpty()) {
            DispatchReport report = DispatchReport.empty();
            publishCompleted(report, passStartedAt);
            return report;
        }

        Map<String, List<String>> recipientsByLocation;
        try {
            recipientsByLocation = ctx.subscriberDirectory().lookup(locations);
        } catch (RuntimeException lookupError) {
            raiseStorageAlert("Subscriber lookup failed", Map.of("locations", List.copyOf(locations)), lookupError);
            publishCompleted(DispatchReport.empty(), passStartedAt);
            throw new DispatchFailedException(
                    "Subscriber lookup failed for " + locations.size() + " location(s)",
                    DispatchReport.empty(),
                    lookupError
            );
        }

        List<CompletableFuture<GroupResult>> tasks = groups.entrySet().stream()
                .map(entry -> {
                    EventKey key = entry.getKey();
                    List<Report> reports = entry.getValue();
                    List<String> recipients = recipientsByLocation.getOrDefault(key.location(), List.of());
                    return CompletableFuture.supplyAsync(() -> processGroup(key, reports, recipients), ctx.groupExecutor())
                            .exceptionally(error -> unexpectedFailure(key, reports.size(), error));
                })
                .toList();
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

        DispatchReport report = new DispatchReport(tasks.stream().map(CompletableFuture::join).toList());
        publishCompleted(report, passStartedAt);
        if (report.hasStorageFailures()) {
            throw new DispatchFailedException(
                    "Alert log unavailable for " + (report.count(DispatchOutcome.FAILED)
                            + report.count(DispatchOutcome.SENT_BUT_UNLOGGED)) + " event(s)",
                    report
            );
        }
        return report;
    }

    private GroupResult processGroup(EventKey key, List<Report> reports, List<String> recipients) {
        return locks.withLock(key, () -> ctx.alertLog().withKeyLock(key, () -> {
            boolean recentlySent;
            try {
                recentlySent = ctx.alertLog().wasRecentlySent(key, ctx.suppressionWindow());
            } catch (RuntimeException checkError) {
                raiseStorageAlert("Alert log check failed for " + key, details(key), checkError);
                return GroupResult.failed(key, reports.size(), rootMessage(checkError));
            }

            if (recentlySent) {
                LOGGER.info("Alert for " + key.disasterType() + " in " + key.location()
                        + " already sent within " + ctx.suppressionWindow() + "; suppressing");
                ctx.eventBus().publish(new AlertSuppressed(ctx.clock().instant(), key.location(), key.disasterType(), reports.size()));
                return GroupResult.suppressed(key, reports.size());
            }

            if (recipients.isEmpty()) {
                LOGGER.info("No subscribers for " + key.location() + "; skipping " + key.disasterType() + " alert");
                ctx.eventBus().publish(new AlertSkipped(ctx.clock().instant(), key.location(), key.disasterType(), "no subscribers"));
                return GroupResult.skipped(key, reports.size());
            }

            AlertMessage message = composer.compose(key, reports);
            LOGGER.info("New event " + key + " from " + reports.size() + " report(s); notifying "
                    + recipients.size() + " subscriber(s)");
            List<DeliveryResult> deliveries = deliver(key, message, recipients);
            int failedDeliveries = (int) deliveries.stream().filter(delivery -> !delivery.success()).count();

            try {
                ctx.alertLog().recordSent(key);
            } catch (RuntimeException recordError) {
                raiseStorageAlert("Alert sent but not logged for " + key, details(key), recordError);
                ctx.eventBus().publish(new AlertDispatched(
                        ctx.clock().instant(),
                        key.location(),
                        key.disasterType(),
                        reports.size(),
                        recipients.size(),
                        failedDeliveries,
                        false
                ));
                return GroupResult.sentButUnlogged(key, reports.size(), deliveries, rootMessage(recordError));
            }

            ctx.eventBus().publish(new AlertDispatched(
                    ctx.clock().instant(),
                    key.location(),
                    key.disasterType(),
                    reports.size(),
                    recipients.size(),
                    failedDeliveries,
                    true
            ));
            return GroupResult.sent(key, reports.size(), deliveries);
        }));
    }

    private List<DeliveryResult> deliver(EventKey key, AlertMessage message, List<String> recipients) {
        // a group blocked on deliveries queued behind it on its own pool would never finish
        Executor deliveryExecutor = ctx.sharesExecutor() ? Runnable::run : ctx.deliveryExecutor();
        List<CompletableFuture<DeliveryResult>> attempts = recipients.stream()
                .map(recipient -> CompletableFuture.supplyAsync(
                                () -> attemptDelivery(recipient, message), deliveryExecutor)
                        .exceptionally(error -> DeliveryResult.failure(recipient, rootMessage(error))))
                .toList();
        CompletableFuture.allOf(attempts.toArray(CompletableFuture[]::new)).join();

        List<DeliveryResult> results = attempts.stream().map(CompletableFuture::join).toList();
        for (DeliveryResult result : results) {
            if (!result.success()) {
                LOGGER.warning("Delivery of " + key + " alert to " + result.recipient() + " failed: " + result.message());
                ctx.eventBus().publish(new DeliveryFailed(
                        ctx.clock().instant(),
                        key.location(),
                        key.disasterType(),
                        result.recipient(),
                        result.message()
                ));
            }
        }
        return results;
    }

    private DeliveryResult attemptDelivery(String recipient, AlertMessage message) {
        try {
            boolean delivered = ctx.transport().send(recipient, message.subject(), message.body());
            return delivered
                    ? DeliveryResult.success(recipient)
                    : DeliveryResult.failure(recipient, "transport reported failure");
        } catch (RuntimeException sendError) {
            return DeliveryResult.failure(recipient, rootMessage(sendError));
        }
    }

    private GroupResult unexpectedFailure(EventKey key, int reportCount, Throwable error) {
        LOGGER.log(Level.SEVERE, "Dispatch of " + key + " failed unexpectedly", error);
        return GroupResult.failed(key, reportCount, rootMessage(error));
    }

    private void raiseStorageAlert(String message, Map<String, Object> details, RuntimeException error) {
        LOGGER.log(Level.WARNING, message, error);
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "storage",
                message + " - " + rootMessage(error),
                details
        ));
    }

    private void publishCompleted(DispatchReport report, Instant passStartedAt) {
        long durationMillis = Duration.between(passStartedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new DispatchPassCompleted(
                ctx.clock().instant(),
                (int) report.count(DispatchOutcome.SENT),
                (int) report.count(DispatchOutcome.SUPPRESSED_DUPLICATE),
                (int) report.count(DispatchOutcome.SKIPPED_NO_SUBSCRIBERS),
                (int) report.count(DispatchOutcome.SENT_BUT_UNLOGGED),
                (int) report.count(DispatchOutcome.FAILED),
                durationMillis
        ));
    }

    private static Map<String, Object> details(EventKey key) {
        return Map.of("location", key.location(), "disasterType", key.disasterType());
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
