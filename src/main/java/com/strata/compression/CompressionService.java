package com.strata.compression;

import com.strata.error.ErrorCategory;
import com.strata.error.ErrorSummaries;
import com.strata.error.IntegrityViolationException;
import com.strata.error.LifecycleException;
import com.strata.history.BoundedHistory;
import com.strata.metrics.LifecycleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Compresses archive batches and backup artifacts.
 *
 * {@link #findBest(byte[])} tries every codec in parallel on the bounded
 * compression executor and keeps the smallest output. Only the winner is
 * recorded in history.
 */
public class CompressionService {
    private static final Logger logger = LoggerFactory.getLogger(CompressionService.class);

    private final Map<CompressionAlgorithm, CompressionCodec> codecs = new EnumMap<>(CompressionAlgorithm.class);
    private final Executor executor;
    private final CompressionAlgorithm defaultAlgorithm;
    private final Clock clock;
    private final LifecycleMetrics metrics;
    private final BoundedHistory<CompressionResult> history;

    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong bytesIn = new AtomicLong();
    private final AtomicLong bytesOut = new AtomicLong();

    public CompressionService(Executor executor, CompressionAlgorithm defaultAlgorithm, int historyCapacity,
                              Clock clock, LifecycleMetrics metrics) {
        this.executor = executor;
        this.defaultAlgorithm = defaultAlgorithm;
        this.clock = clock;
        this.metrics = metrics;
        this.history = new BoundedHistory<>(historyCapacity);
        register(new GzipCodec());
        register(new ZstdCodec());
        register(new Lz4Codec());
        register(new SnappyCodec());
    }

    private void register(CompressionCodec codec) {
        codecs.put(codec.algorithm(), codec);
    }

    public CompressedPayload compress(byte[] data) {
        return compress(data, defaultAlgorithm);
    }

    public CompressedPayload compress(byte[] data, CompressionAlgorithm algorithm) {
        CompressionAlgorithm chosen = algorithm != null ? algorithm : defaultAlgorithm;
        Instant startedAt = clock.instant();
        CompressionResult result = new CompressionResult(startedAt, chosen);
        try {
            CompressedPayload payload = encode(data, chosen);
            record(result, payload);
            return payload;
        } catch (LifecycleException e) {
            result.fail(clock.instant(), e);
            history.append(result);
            throw e;
        }
    }

    /**
     * Try every codec and return the smallest output.
     */
    public CompressedPayload findBest(byte[] data) {
        Instant startedAt = clock.instant();
        List<CompletableFuture<CompressedPayload>> trials = new ArrayList<>();
        for (CompressionAlgorithm algorithm : codecs.keySet()) {
            trials.add(CompletableFuture.supplyAsync(() -> encode(data, algorithm), executor));
        }

        List<CompressedPayload> candidates = new ArrayList<>();
        for (CompletableFuture<CompressedPayload> trial : trials) {
            try {
                candidates.add(trial.join());
            } catch (CompletionException e) {
                logger.warn("Compression trial failed: {}", ErrorSummaries.summarize(e), e.getCause());
            }
        }
        CompressedPayload best = candidates.stream()
            .min(Comparator.comparingLong(CompressedPayload::getCompressedSize))
            .orElseThrow(() -> new LifecycleException(ErrorCategory.INTERNAL, "no compression codec succeeded"));

        CompressionResult result = new CompressionResult(startedAt, best.getAlgorithm());
        result.setSelectedByTrial(true);
        record(result, best);
        logger.debug("Best codec for {} bytes is {} (ratio {})", data.length, best.getAlgorithm(),
            String.format("%.3f", best.getRatio()));
        return best;
    }

    /**
     * Reverse {@link #compress}. Corrupt input is an integrity violation.
     */
    public byte[] decompress(byte[] data, CompressionAlgorithm algorithm) {
        try {
            return codec(algorithm).decompress(data);
        } catch (IOException | RuntimeException e) {
            throw new IntegrityViolationException("compressed payload is corrupt", e);
        }
    }

    private CompressedPayload encode(byte[] data, CompressionAlgorithm algorithm) {
        try {
            return new CompressedPayload(codec(algorithm).compress(data), data.length, algorithm);
        } catch (IOException e) {
            throw new LifecycleException(ErrorCategory.INTERNAL, algorithm.getValue() + " compression failed", e);
        }
    }

    private CompressionCodec codec(CompressionAlgorithm algorithm) {
        CompressionCodec codec = codecs.get(algorithm);
        if (codec == null) {
            throw new IllegalArgumentException("No codec registered for " + algorithm);
        }
        return codec;
    }

    private void record(CompressionResult result, CompressedPayload payload) {
        result.record(payload);
        result.succeed(clock.instant());
        history.append(result);
        runs.incrementAndGet();
        bytesIn.addAndGet(payload.getOriginalSize());
        bytesOut.addAndGet(payload.getCompressedSize());
        metrics.recordCompressionRatio(payload.getRatio());
    }

    public List<CompressionResult> history() {
        return history.snapshot();
    }

    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        long in = bytesIn.get();
        long out = bytesOut.get();
        stats.put("runs", runs.get());
        stats.put("bytes_in", in);
        stats.put("bytes_out", out);
        stats.put("average_ratio", CompressedPayload.ratio(in, out));
        stats.put("default_algorithm", defaultAlgorithm.getValue());
        return stats;
    }

    public CompressionAlgorithm getDefaultAlgorithm() {
        return defaultAlgorithm;
    }
}
