package com.disasteralert.engine.api;

import com.disasteralert.core.bus.EventBus;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators and executors for one orchestrator. Groups and deliveries may share one executor:
 * deliveries then run on the group's own thread instead of waiting for a second pool slot.
 */
public record DispatchContext(
        SubscriberDirectory subscriberDirectory,
        AlertLog alertLog,
        AlertTransport transport,
        EventBus eventBus,
        Clock clock,
        Duration suppressionWindow,
        Executor groupExecutor,
        Executor deliveryExecutor
) {
    public static final Duration DEFAULT_SUPPRESSION_WINDOW = Duration.ofHours(6);

    public DispatchContext {
        Objects.requireNonNull(subscriberDirectory, "subscriberDirectory is required");
        Objects.requireNonNull(alertLog, "alertLog is required");
        Objects.requireNonNull(transport, "transport is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(suppressionWindow, "suppressionWindow is required");
        Objects.requireNonNull(groupExecutor, "groupExecutor is required");
        Objects.requireNonNull(deliveryExecutor, "deliveryExecutor is required");
        if (suppressionWindow.isNegative() || suppressionWindow.isZero()) {
            throw new IllegalArgumentException("suppressionWindow must be positive");
        }
    }

    public boolean sharesExecutor() {
        return groupExecutor == deliveryExecutor;
    }

    /**
     * Runs every group and delivery on the calling thread.
     */
    public static DispatchContext sequential(
            SubscriberDirectory subscriberDirectory,
            AlertLog alertLog,
            AlertTransport transport,
            EventBus eventBus,
            Clock clock
    ) {
        return new DispatchContext(
                subscriberDirectory,
                alertLog,
                transport,
                eventBus,
                clock,
                DEFAULT_SUPPRESSION_WINDOW,
                Runnable::run,
                Runnable::run
        );
    }
}
