package com.strata.compression;

/**
 * Compressed bytes together with the codec that produced them.
 */
public final class CompressedPayload {

    private final byte[] data;
    private final long originalSize;
    private final CompressionAlgorithm algorithm;

    public CompressedPayload(byte[] data, long originalSize, CompressionAlgorithm algorithm) {
        this.data = data;
        this.originalSize = originalSize;
        this.algorithm = algorithm;
    }

    public byte[] getData() {
        return data;
    }

    public long getOriginalSize() {
        return originalSize;
    }

    public long getCompressedSize() {
        return data.length;
    }

    public CompressionAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * compressed / original; 1.0 for empty input
     */
    public double getRatio() {
        return ratio(originalSize, data.length);
    }

    static double ratio(long originalSize, long compressedSize) {
        if (originalSize == 0) {
            return 1.0;
        }
        return (double) compressedSize / originalSize;
    }

    @Override
    public String toString() {
        return "CompressedPayload{" + algorithm.getValue() + ", " + originalSize + " -> " + data.length + " bytes}";
    }
}
