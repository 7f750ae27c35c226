package com.strata.transition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.history.OperationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one tier transition run across all downsample and delete policies.
 */
public class CleanupResult extends OperationResult {

    @JsonProperty("policies_evaluated")
    private int policiesEvaluated;

    @JsonProperty("chunks_processed")
    private int chunksProcessed;

    @JsonProperty("rows_downsampled")
    private long rowsDownsampled;

    @JsonProperty("aggregates_written")
    private long aggregatesWritten;

    @JsonProperty("rows_deleted")
    private long rowsDeleted;

    @JsonProperty("failed_policies")
    private final List<String> failedPolicies = new ArrayList<>();

    public CleanupResult(Instant startedAt) {
        super("cleanup", startedAt);
    }

    public void policyEvaluated() {
        policiesEvaluated++;
    }

    public void chunkProcessed() {
        chunksProcessed++;
    }

    public void addDownsampled(long sourceRows, long aggregates) {
        rowsDownsampled += sourceRows;
        aggregatesWritten += aggregates;
        addItemsProcessed(sourceRows);
    }

    public void addDeleted(long rows) {
        if (rows > 0) {
            rowsDeleted += rows;
            addItemsProcessed(rows);
        }
    }

    public void policyFailed(String policyName) {
        failedPolicies.add(policyName);
    }

    public int getPoliciesEvaluated() {
        return policiesEvaluated;
    }

    public int getChunksProcessed() {
        return chunksProcessed;
    }

    public long getRowsDownsampled() {
        return rowsDownsampled;
    }

    public long getAggregatesWritten() {
        return aggregatesWritten;
    }

    public long getRowsDeleted() {
        return rowsDeleted;
    }

    public List<String> getFailedPolicies() {
        return failedPolicies;
    }
}
