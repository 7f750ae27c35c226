package com.strata.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JDK gzip at a fixed deflate level.
 */
public class GzipCodec implements CompressionCodec {

    public static final int DEFAULT_LEVEL = 6;

    private final int level;

    public GzipCodec() {
        this(DEFAULT_LEVEL);
    }

    public GzipCodec(int level) {
        this.level = level;
    }

    @Override
    public CompressionAlgorithm algorithm() {
        return CompressionAlgorithm.GZIP;
    }

    @Override
    public byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (OutputStream out = new LeveledGzipOutputStream(buffer, level)) {
            out.write(data);
        }
        return buffer.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
