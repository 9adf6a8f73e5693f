package com.schemagov.notify;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record NotificationPayload(
        String type,
        String subjectId,
        String target,
        Map<String, Object> details,
        Instant timestamp) {

    public NotificationPayload {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        details = Collections.unmodifiableMap(copy);
    }
}
