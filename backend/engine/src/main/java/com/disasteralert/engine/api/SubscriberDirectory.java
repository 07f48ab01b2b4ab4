package com.disasteralert.engine.api;

import java.util.List;
import java.util.Map;
import java.util.Set;

public interface SubscriberDirectory {
    /**
     * Resolves recipients for a batch of canonical locations in a single storage read.
     * Every requested location is present in the result, with an empty list when nobody
     * subscribed to it. Recipient order is stable across identical reads.
     */
    Map<String, List<String>> lookup(Set<String> locations);
}
