package com.schemagov.tracking;

import java.time.Instant;
import java.util.List;

public record NotificationEntry(
        String team,
        String type,
        Instant timestamp,
        List<String> channels,
        boolean delivered,
        String error) {

    public NotificationEntry {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }
}
