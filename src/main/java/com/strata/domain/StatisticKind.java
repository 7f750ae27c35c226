package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

/**
 * Declared statistic kind of a series. Decides how raw values are folded into a
 * downsampled bucket.
 */
public enum StatisticKind {
    MEAN("mean"),
    MIN("min"),
    MAX("max"),
    SUM("sum");

    private final String value;

    StatisticKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Fold the values of one bucket. Callers never pass an empty collection.
     */
    public double aggregate(Collection<Double> values) {
        switch (this) {
            case MIN:
                return values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            case MAX:
                return values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case SUM:
                return values.stream().mapToDouble(Double::doubleValue).sum();
            case MEAN:
            default:
                return values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        }
    }

    /**
     * Combine two aggregates of the same bucket. MEAN is weighted by sample count.
     */
    public double merge(double existing, long existingSamples, double added, long addedSamples) {
        switch (this) {
            case MIN:
                return Math.min(existing, added);
            case MAX:
                return Math.max(existing, added);
            case SUM:
                return existing + added;
            case MEAN:
            default:
                long total = existingSamples + addedSamples;
                if (total <= 0) {
                    return (existing + added) / 2;
                }
                return (existing * existingSamples + added * addedSamples) / total;
        }
    }

    public static StatisticKind fromValue(String value) {
        for (StatisticKind kind : StatisticKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown StatisticKind value: " + value);
    }
}
