package com.schemagov.governance;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BreakingChangeApproval(String repository, String location, String approver, String target, Instant approvedAt) {

    public static String key(String repository, String location) {
        return (repository == null ? "" : repository) + ":" + (location == null ? "" : location);
    }
}
