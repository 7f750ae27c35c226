package com.strata.compression;

import net.jpountz.lz4.LZ4FrameInputStream;
import net.jpountz.lz4.LZ4FrameOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * LZ4 frame format (fast compressor), readable by the lz4 command line tool.
 */
public class Lz4Codec implements CompressionCodec {

    @Override
    public CompressionAlgorithm algorithm() {
        return CompressionAlgorithm.LZ4;
    }

    @Override
    public byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (LZ4FrameOutputStream out = new LZ4FrameOutputStream(buffer)) {
            out.write(data);
        }
        return buffer.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) throws IOException {
        try (LZ4FrameInputStream in = new LZ4FrameInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
