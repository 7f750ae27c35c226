package com.strata.compression;

import org.xerial.snappy.Snappy;

import java.io.IOException;

public class SnappyCodec implements CompressionCodec {

    @Override
    public CompressionAlgorithm algorithm() {
        return CompressionAlgorithm.SNAPPY;
    }

    @Override
    public byte[] compress(byte[] data) throws IOException {
        return Snappy.compress(data);
    }

    @Override
    public byte[] decompress(byte[] data) throws IOException {
        return Snappy.uncompress(data);
    }
}
