package com.schemagov.governance;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeApprovals(String changeId, List<String> approvers, Instant updatedAt) {
    public ChangeApprovals {
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
    }
}
