package com.disasteralert.engine.grouping;

import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.model.Report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public final class EventGrouper {
    private static final Logger LOGGER = Logger.getLogger(EventGrouper.class.getName());

    private final LocationNormalizer normalizer;

    public EventGrouper(LocationNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Partitions reports by (canonical location, disaster type). Reports without a location or
     * a disaster type are left out. Groups keep the input order of their reports and iterate in
     * the order their first report was seen.
     */
    public Map<EventKey, List<Report>> group(List<Report> reports) {
        Map<EventKey, List<Report>> groups = new LinkedHashMap<>();
        int excluded = 0;
        for (Report report : reports) {
            if (report == null || !report.hasEventIdentity()) {
                excluded++;
                continue;
            }
            EventKey key = new EventKey(normalizer.normalize(report.extractedLocation()), report.disasterType());
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(report);
        }
        if (excluded > 0) {
            LOGGER.fine("Excluded " + excluded + " report(s) without location or disaster type");
        }
        Map<EventKey, List<Report>> frozen = new LinkedHashMap<>();
        groups.forEach((key, grouped) -> frozen.put(key, List.copyOf(grouped)));
        return frozen;
    }
}
