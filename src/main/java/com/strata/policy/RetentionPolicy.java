package com.strata.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StatisticKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Named retention rule: what to do with data of the selected datasets once it is
 * older than {@code retention}.
 *
 * Policies are created and changed only through {@link RetentionPolicyStore},
 * which validates every mutation.
 */
public class RetentionPolicy {

    @JsonProperty("name")
    private String name;

    /**
     * Dataset name, or prefix ending in '*'
     */
    @JsonProperty("dataset_selector")
    private String datasetSelector;

    @JsonProperty("retention")
    private Duration retention;

    @JsonProperty("action")
    private PolicyAction action;

    @JsonProperty("enabled")
    private boolean enabled = true;

    /**
     * Aggregate applied when downsampling; required for DOWNSAMPLE
     */
    @JsonProperty("statistic_kind")
    private StatisticKind statisticKind;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public RetentionPolicy() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Detached copy, so callers of the store never mutate stored state
     */
    public RetentionPolicy copy() {
        RetentionPolicy copy = new RetentionPolicy();
        copy.name = name;
        copy.datasetSelector = datasetSelector;
        copy.retention = retention;
        copy.action = action;
        copy.enabled = enabled;
        copy.statisticKind = statisticKind;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    /**
     * Parsed selector. Only call on validated policies.
     */
    @JsonIgnore
    public DatasetSelector selector() {
        return DatasetSelector.of(datasetSelector);
    }

    /**
     * Rows strictly older than the returned instant fall under this policy.
     */
    public Instant cutoff(Instant now) {
        return now.minus(retention);
    }

    public static class Builder {
        private final RetentionPolicy policy = new RetentionPolicy();

        public Builder name(String name) {
            policy.name = name;
            return this;
        }

        public Builder datasetSelector(String datasetSelector) {
            policy.datasetSelector = datasetSelector;
            return this;
        }

        public Builder retention(Duration retention) {
            policy.retention = retention;
            return this;
        }

        public Builder action(PolicyAction action) {
            policy.action = action;
            return this;
        }

        public Builder enabled(boolean enabled) {
            policy.enabled = enabled;
            return this;
        }

        public Builder statisticKind(StatisticKind statisticKind) {
            policy.statisticKind = statisticKind;
            return this;
        }

        public RetentionPolicy build() {
            return policy;
        }
    }

    // Getters and Setters

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDatasetSelector() {
        return datasetSelector;
    }

    public void setDatasetSelector(String datasetSelector) {
        this.datasetSelector = datasetSelector;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public PolicyAction getAction() {
        return action;
    }

    public void setAction(PolicyAction action) {
        this.action = action;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public StatisticKind getStatisticKind() {
        return statisticKind;
    }

    public void setStatisticKind(StatisticKind statisticKind) {
        this.statisticKind = statisticKind;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "RetentionPolicy{" + name + ", selector=" + datasetSelector + ", retention=" + retention
            + ", action=" + (action != null ? action.getValue() : null) + ", enabled=" + enabled + "}";
    }
}
