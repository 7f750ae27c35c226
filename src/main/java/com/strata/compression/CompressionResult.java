package com.strata.compression;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.history.OperationResult;

import java.time.Instant;

public class CompressionResult extends OperationResult {

    @JsonProperty("algorithm")
    private CompressionAlgorithm algorithm;

    @JsonProperty("original_size")
    private long originalSize;

    @JsonProperty("compressed_size")
    private long compressedSize;

    @JsonProperty("ratio")
    private double ratio = 1.0;

    /**
     * Whether the algorithm was picked by trying every codec
     */
    @JsonProperty("selected_by_trial")
    private boolean selectedByTrial;

    public CompressionResult(Instant startedAt, CompressionAlgorithm algorithm) {
        super("compress", startedAt);
        this.algorithm = algorithm;
    }

    public void record(CompressedPayload payload) {
        this.algorithm = payload.getAlgorithm();
        this.originalSize = payload.getOriginalSize();
        this.compressedSize = payload.getCompressedSize();
        this.ratio = payload.getRatio();
        setItemsProcessed(payload.getOriginalSize());
    }

    public CompressionAlgorithm getAlgorithm() {
        return algorithm;
    }

    public long getOriginalSize() {
        return originalSize;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public double getRatio() {
        return ratio;
    }

    public boolean isSelectedByTrial() {
        return selectedByTrial;
    }

    public void setSelectedByTrial(boolean selectedByTrial) {
        this.selectedByTrial = selectedByTrial;
    }
}
