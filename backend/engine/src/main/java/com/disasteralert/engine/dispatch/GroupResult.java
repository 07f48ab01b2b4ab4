package com.disasteralert.engine.dispatch;

import com.disasteralert.core.model.EventKey;

import java.util.List;

public record GroupResult(
        EventKey key,
        DispatchOutcome outcome,
        int reportCount,
        List<DeliveryResult> deliveries,
        String error
) {
    public GroupResult {
        deliveries = List.copyOf(deliveries);
    }

    public static GroupResult suppressed(EventKey key, int reportCount) {
        return new GroupResult(key, DispatchOutcome.SUPPRESSED_DUPLICATE, reportCount, List.of(), null);
    }

    public static GroupResult skipped(EventKey key, int reportCount) {
        return new GroupResult(key, DispatchOutcome.SKIPPED_NO_SUBSCRIBERS, reportCount, List.of(), null);
    }

    public static GroupResult sent(EventKey key, int reportCount, List<DeliveryResult> deliveries) {
        return new GroupResult(key, DispatchOutcome.SENT, reportCount, deliveries, null);
    }

    public static GroupResult sentButUnlogged(EventKey key, int reportCount, List<DeliveryResult> deliveries, String error) {
        return new GroupResult(key, DispatchOutcome.SENT_BUT_UNLOGGED, reportCount, deliveries, error);
    }

    public static GroupResult failed(EventKey key, int reportCount, String error) {
        return new GroupResult(key, DispatchOutcome.FAILED, reportCount, List.of(), error);
    }

    public long successfulDeliveries() {
        return deliveries.stream().filter(DeliveryResult::success).count();
    }

    public long failedDeliveries() {
        return deliveries.size() - successfulDeliveries();
    }
}
