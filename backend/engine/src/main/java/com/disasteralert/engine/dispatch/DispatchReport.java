package com.disasteralert.engine.dispatch;

import com.disasteralert.core.model.EventKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one dispatch pass, one {@link GroupResult} per event key.
 */
public record DispatchReport(List<GroupResult> groups) {
    public DispatchReport {
        groups = List.copyOf(groups);
    }

    public static DispatchReport empty() {
        return new DispatchReport(List.of());
    }

    public Map<EventKey, GroupResult> byKey() {
        Map<EventKey, GroupResult> byKey = new LinkedHashMap<>();
        for (GroupResult group : groups) {
            byKey.put(group.key(), group);
        }
        return byKey;
    }

    public DispatchOutcome outcome(EventKey key) {
        GroupResult group = byKey().get(key);
        if (group == null) {
            throw new IllegalArgumentException("No result for event " + key);
        }
        return group.outcome();
    }

    public List<DeliveryResult> deliveries(EventKey key) {
        GroupResult group = byKey().get(key);
        return group == null ? List.of() : group.deliveries();
    }

    public long count(DispatchOutcome outcome) {
        return groups.stream().filter(group -> group.outcome() == outcome).count();
    }

    public boolean hasStorageFailures() {
        return groups.stream().anyMatch(group -> group.outcome().storageFailure());
    }
}
