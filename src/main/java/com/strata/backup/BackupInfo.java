package com.strata.backup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.history.OperationResult;

import java.time.Instant;

/**
 * Outcome of one backup run.
 */
public class BackupInfo extends OperationResult {

    @JsonProperty("backup_id")
    private final String backupId;

    @JsonProperty("size_bytes")
    private long sizeBytes;

    @JsonProperty("compression_ratio")
    private double compressionRatio = 1.0;

    @JsonIgnore
    private BackupManifest manifest;

    public BackupInfo(String backupId, Instant startedAt) {
        super("backup", startedAt);
        this.backupId = backupId;
    }

    public String getBackupId() {
        return backupId;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public double getCompressionRatio() {
        return compressionRatio;
    }

    public void setCompressionRatio(double compressionRatio) {
        this.compressionRatio = compressionRatio;
    }

    public BackupManifest getManifest() {
        return manifest;
    }

    public void setManifest(BackupManifest manifest) {
        this.manifest = manifest;
    }
}
