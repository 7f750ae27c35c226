package com.strata.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens to data older than a policy's retention.
 */
public enum PolicyAction {

    /**
     * Remove rows from every store-resident tier
     */
    DELETE("delete"),

    /**
     * Replace raw rows with time-bucketed aggregates in the warm tier
     */
    DOWNSAMPLE("downsample"),

    /**
     * Export rows to object storage, then remove them from the store
     */
    ARCHIVE("archive");

    private final String value;

    PolicyAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether data leaves the store under this action
     */
    public boolean isColdAction() {
        return this == DELETE || this == ARCHIVE;
    }

    @JsonCreator
    public static PolicyAction fromValue(String value) {
        for (PolicyAction action : PolicyAction.values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown PolicyAction value: " + value);
    }
}
