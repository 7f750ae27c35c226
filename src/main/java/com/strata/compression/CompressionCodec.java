package com.strata.compression;

import java.io.IOException;

/**
 * Whole-buffer codec. Implementations are stateless and thread-safe.
 */
public interface CompressionCodec {

    CompressionAlgorithm algorithm();

    byte[] compress(byte[] data) throws IOException;

    byte[] decompress(byte[] data) throws IOException;
}
