package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall health derived from the currently active alerts.
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
