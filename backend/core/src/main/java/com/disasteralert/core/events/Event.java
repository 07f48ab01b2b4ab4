package com.disasteralert.core.events;

import java.time.Instant;

public interface Event {
    String type();

    Instant timestamp();
}
