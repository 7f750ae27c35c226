package com.strata.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.history.OperationResult;

import java.time.Instant;

/**
 * Outcome of one restore. {@code compensated} is set when applying data failed
 * and the previous state was written back.
 */
public class RecoveryAttempt extends OperationResult {

    @JsonProperty("backup_id")
    private final String backupId;

    @JsonProperty("policies_restored")
    private int policiesRestored;

    @JsonProperty("rows_restored")
    private long rowsRestored;

    @JsonProperty("compensated")
    private boolean compensated;

    public RecoveryAttempt(String backupId, Instant startedAt) {
        super("restore", startedAt);
        this.backupId = backupId;
    }

    public String getBackupId() {
        return backupId;
    }

    public int getPoliciesRestored() {
        return policiesRestored;
    }

    public void setPoliciesRestored(int policiesRestored) {
        this.policiesRestored = policiesRestored;
    }

    public long getRowsRestored() {
        return rowsRestored;
    }

    public void setRowsRestored(long rowsRestored) {
        this.rowsRestored = rowsRestored;
        setItemsProcessed(rowsRestored);
    }

    public boolean isCompensated() {
        return compensated;
    }

    public void setCompensated(boolean compensated) {
        this.compensated = compensated;
    }
}
