package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of an operational alert.
 */
public enum AlertSeverity {
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
