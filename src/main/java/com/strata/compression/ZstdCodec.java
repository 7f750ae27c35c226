package com.strata.compression;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Zstandard frames via zstd-jni.
 */
public class ZstdCodec implements CompressionCodec {

    public static final int DEFAULT_LEVEL = 3;

    private final int level;

    public ZstdCodec() {
        this(DEFAULT_LEVEL);
    }

    public ZstdCodec(int level) {
        this.level = level;
    }

    @Override
    public CompressionAlgorithm algorithm() {
        return CompressionAlgorithm.ZSTD;
    }

    @Override
    public byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (ZstdOutputStream out = new ZstdOutputStream(buffer, level)) {
            out.write(data);
        }
        return buffer.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) throws IOException {
        try (ZstdInputStream in = new ZstdInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
