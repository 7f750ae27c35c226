package com.strata.compression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Codecs available for archive batches and backup artifacts.
 */
public enum CompressionAlgorithm {
    GZIP("gzip", "gz"),
    ZSTD("zstd", "zst"),
    LZ4("lz4", "lz4"),
    SNAPPY("snappy", "snappy");

    private final String value;
    private final String extension;

    CompressionAlgorithm(String value, String extension) {
        this.value = value;
        this.extension = extension;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * File extension appended to compressed objects, without the dot
     */
    public String getExtension() {
        return extension;
    }

    @JsonCreator
    public static CompressionAlgorithm fromValue(String value) {
        for (CompressionAlgorithm algorithm : CompressionAlgorithm.values()) {
            if (algorithm.value.equalsIgnoreCase(value) || algorithm.name().equalsIgnoreCase(value)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown CompressionAlgorithm value: " + value);
    }

    public static CompressionAlgorithm fromExtension(String extension) {
        for (CompressionAlgorithm algorithm : CompressionAlgorithm.values()) {
            if (algorithm.extension.equalsIgnoreCase(extension)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown compression extension: " + extension);
    }
}
