package com.strata.storage.cold;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.history.OperationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class ArchivalResult extends OperationResult {

    @JsonProperty("rows_archived")
    private long rowsArchived;

    @JsonProperty("bytes_uploaded")
    private long bytesUploaded;

    @JsonProperty("object_keys")
    private final List<String> objectKeys = new ArrayList<>();

    public ArchivalResult(String operation, Instant startedAt) {
        super(operation, startedAt);
    }

    public void addObject(String key, long rows, long bytes) {
        objectKeys.add(key);
        rowsArchived += rows;
        bytesUploaded += bytes;
        addItemsProcessed(rows);
    }

    public void merge(ArchivalResult other) {
        objectKeys.addAll(other.objectKeys);
        rowsArchived += other.rowsArchived;
        bytesUploaded += other.bytesUploaded;
        addItemsProcessed(other.getItemsProcessed());
    }

    public long getRowsArchived() {
        return rowsArchived;
    }

    public long getBytesUploaded() {
        return bytesUploaded;
    }

    public List<String> getObjectKeys() {
        return objectKeys;
    }
}
