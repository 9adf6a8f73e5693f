package com.schemagov.dependency;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceInfo(String serviceName, String system, String description, String owningTeam) {
    public static final String UNKNOWN_SYSTEM = "unknown";

    public ServiceInfo {
        Objects.requireNonNull(serviceName, "serviceName");
        system = system == null || system.isBlank() ? UNKNOWN_SYSTEM : system;
        description = description == null ? "" : description;
    }
}
