package com.strata.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.compression.CompressionAlgorithm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes one backup artifact. Written after the artifact; an artifact
 * without a manifest is treated as corrupt and never restored.
 */
public class BackupManifest {

    public static final int FORMAT_VERSION = 1;

    @JsonProperty("backup_id")
    private String backupId;

    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * File name of the compressed artifact, relative to the backup directory
     */
    @JsonProperty("artifact")
    private String artifact;

    @JsonProperty("included_policies")
    private List<String> includedPolicies = new ArrayList<>();

    /**
     * Hex SHA-256 of the stored (compressed) artifact
     */
    @JsonProperty("checksum")
    private String checksum;

    @JsonProperty("size_bytes")
    private long sizeBytes;

    @JsonProperty("compression_algorithm")
    private CompressionAlgorithm compressionAlgorithm;

    @JsonProperty("row_counts")
    private Map<String, Long> rowCounts = new LinkedHashMap<>();

    @JsonProperty("includes_storage_thresholds")
    private boolean includesStorageThresholds;

    @JsonProperty("format_version")
    private int formatVersion = FORMAT_VERSION;

    public BackupManifest() {
    }

    // Getters and Setters

    public String getBackupId() {
        return backupId;
    }

    public void setBackupId(String backupId) {
        this.backupId = backupId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getArtifact() {
        return artifact;
    }

    public void setArtifact(String artifact) {
        this.artifact = artifact;
    }

    public List<String> getIncludedPolicies() {
        return includedPolicies;
    }

    public void setIncludedPolicies(List<String> includedPolicies) {
        this.includedPolicies = includedPolicies;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public CompressionAlgorithm getCompressionAlgorithm() {
        return compressionAlgorithm;
    }

    public void setCompressionAlgorithm(CompressionAlgorithm compressionAlgorithm) {
        this.compressionAlgorithm = compressionAlgorithm;
    }

    public Map<String, Long> getRowCounts() {
        return rowCounts;
    }

    public void setRowCounts(Map<String, Long> rowCounts) {
        this.rowCounts = rowCounts;
    }

    public boolean isIncludesStorageThresholds() {
        return includesStorageThresholds;
    }

    public void setIncludesStorageThresholds(boolean includesStorageThresholds) {
        this.includesStorageThresholds = includesStorageThresholds;
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
    }

    @Override
    public String toString() {
        return "BackupManifest{" + backupId + ", " + sizeBytes + " bytes, "
            + (compressionAlgorithm != null ? compressionAlgorithm.getValue() : null) + ", rows=" + rowCounts + "}";
    }
}
