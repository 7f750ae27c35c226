package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Storage usage of one tier at a point in time.
 */
public class StorageMetrics {

    @JsonProperty("tier")
    private final StorageTier tier;

    @JsonProperty("bytes_used")
    private final long bytesUsed;

    @JsonProperty("row_count")
    private final long rowCount;

    /**
     * Bytes per hour relative to the previous measurement; 0 on the first one
     */
    @JsonProperty("growth_rate")
    private final double growthRate;

    @JsonProperty("measured_at")
    private final Instant measuredAt;

    public StorageMetrics(StorageTier tier, long bytesUsed, long rowCount, double growthRate, Instant measuredAt) {
        this.tier = tier;
        this.bytesUsed = bytesUsed;
        this.rowCount = rowCount;
        this.growthRate = growthRate;
        this.measuredAt = measuredAt;
    }

    public StorageTier getTier() {
        return tier;
    }

    public long getBytesUsed() {
        return bytesUsed;
    }

    public long getRowCount() {
        return rowCount;
    }

    public double getGrowthRate() {
        return growthRate;
    }

    public Instant getMeasuredAt() {
        return measuredAt;
    }

    @Override
    public String toString() {
        return "StorageMetrics{" + tier.getValue() + ", bytes=" + bytesUsed + ", rows=" + rowCount
            + ", growth=" + String.format("%.1f", growthRate) + "B/h}";
    }
}
