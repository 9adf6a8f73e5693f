package com.schemagov.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BreakingChangePolicy {
    ALLOW,
    WARN,
    ERROR,
    REQUIRE_APPROVAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configured policy value. Unknown values are rejected rather than mapped to a default.
     */
    public static BreakingChangePolicy fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (BreakingChangePolicy policy : values()) {
                if (policy.name().equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new GovernanceException("Unknown breaking change policy: " + value);
    }
}
