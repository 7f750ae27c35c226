package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the time-series store.
 *
 * Raw hot rows carry a single sample ({@code sampleCount == 1}, min and max equal
 * to the value). Warm rows are bucket aggregates: {@code value} holds the
 * aggregate for the series' statistic kind and the timestamp is the bucket start.
 */
public final class DataPoint {

    @JsonProperty("tier")
    private final StorageTier tier;

    @JsonProperty("dataset")
    private final String dataset;

    @JsonProperty("entity_id")
    private final String entityId;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("value")
    private final double value;

    @JsonProperty("sample_count")
    private final long sampleCount;

    @JsonProperty("min")
    private final double min;

    @JsonProperty("max")
    private final double max;

    @JsonCreator
    public DataPoint(
            @JsonProperty("tier") StorageTier tier,
            @JsonProperty("dataset") String dataset,
            @JsonProperty("entity_id") String entityId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") double value,
            @JsonProperty("sample_count") long sampleCount,
            @JsonProperty("min") double min,
            @JsonProperty("max") double max) {
        this.tier = Objects.requireNonNull(tier, "tier");
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
        this.sampleCount = sampleCount;
        this.min = min;
        this.max = max;
    }

    /**
     * A raw hot-tier sample.
     */
    public static DataPoint raw(String dataset, String entityId, Instant timestamp, double value) {
        return new DataPoint(StorageTier.HOT, dataset, entityId, timestamp, value, 1, value, value);
    }

    public StorageTier getTier() {
        return tier;
    }

    public String getDataset() {
        return dataset;
    }

    public String getEntityId() {
        return entityId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataPoint)) {
            return false;
        }
        DataPoint other = (DataPoint) o;
        return Double.compare(value, other.value) == 0
            && sampleCount == other.sampleCount
            && Double.compare(min, other.min) == 0
            && Double.compare(max, other.max) == 0
            && tier == other.tier
            && dataset.equals(other.dataset)
            && entityId.equals(other.entityId)
            && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tier, dataset, entityId, timestamp, value, sampleCount, min, max);
    }

    @Override
    public String toString() {
        return "DataPoint{" + tier.getValue() + ", " + dataset + "/" + entityId + " @ " + timestamp
            + " = " + value + " (n=" + sampleCount + ")}";
    }
}
