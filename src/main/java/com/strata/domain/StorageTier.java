package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Storage tiers managed by the lifecycle engine.
 * Data is demoted from hot to warm by downsampling and from warm/hot to cold by
 * archival or deletion.
 */
public enum StorageTier {

    /**
     * Raw, full-resolution recent data
     */
    HOT("hot", "Raw events at full resolution"),

    /**
     * Downsampled aggregates
     */
    WARM("warm", "Time-bucketed aggregates"),

    /**
     * Archived to object storage or deleted
     */
    COLD("cold", "Columnar batches on object storage");

    private final String value;
    private final String description;

    StorageTier(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether rows of this tier live in the time-series store
     */
    public boolean isStoreResident() {
        return this != COLD;
    }

    /**
     * Parse a string value to StorageTier
     */
    public static StorageTier fromValue(String value) {
        for (StorageTier tier : StorageTier.values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown StorageTier value: " + value);
    }
}
