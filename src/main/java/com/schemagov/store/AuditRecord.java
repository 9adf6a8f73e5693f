package com.schemagov.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditRecord(
        String action,
        String target,
        String actor,
        Instant timestamp,
        AuditResult result,
        Map<String, Object> details) {

    public AuditRecord {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
        target = target == null ? "" : target;
        actor = actor == null ? "system" : actor;
        result = result == null ? AuditResult.SUCCESS : result;
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
