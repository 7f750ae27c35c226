package com.strata.storage.cold;

import com.strata.compression.CompressedPayload;
import com.strata.compression.CompressionAlgorithm;
import com.strata.compression.CompressionService;
import com.strata.config.LifecycleProperties;
import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.ErrorCategory;
import com.strata.error.IntegrityViolationException;
import com.strata.error.LifecycleException;
import com.strata.error.NotFoundException;
import com.strata.history.BoundedHistory;
import com.strata.metrics.LifecycleMetrics;
import com.strata.policy.PolicyAction;
import com.strata.policy.RetentionPolicy;
import com.strata.policy.RetentionPolicyStore;
import com.strata.scheduler.JobContext;
import com.strata.storage.LocalFiles;
import com.strata.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Moves hot and warm rows past an ARCHIVE policy's retention to object storage.
 *
 * Each batch is written as a Parquet file in a scoped temp directory,
 * compressed, uploaded under a deterministic key and only then removed from
 * the store. Re-running a batch after a partial failure overwrites the same
 * object.
 */
@Service
public class ArchivalService {
    private static final Logger logger = LoggerFactory.getLogger(ArchivalService.class);

    private static final DateTimeFormatter KEY_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern UNSAFE_KEY_CHARS = Pattern.compile("[^A-Za-z0-9_.\\-]");

    private final TimeSeriesStore store;
    private final ObjectStorage objectStorage;
    private final ParquetBatchWriter parquetWriter;
    private final CompressionService compressionService;
    private final RetentionPolicyStore policyStore;
    private final Clock clock;
    private final LifecycleMetrics metrics;
    private final Path workDirectory;
    private final String keyPrefix;
    private final Duration chunk;
    private final boolean findBestCompression;
    private final BoundedHistory<ArchivalResult> history;

    public ArchivalService(TimeSeriesStore store, ObjectStorage objectStorage, ParquetBatchWriter parquetWriter,
                           CompressionService compressionService, RetentionPolicyStore policyStore,
                           LifecycleProperties properties, Clock clock, LifecycleMetrics metrics) {
        this.store = store;
        this.objectStorage = objectStorage;
        this.parquetWriter = parquetWriter;
        this.compressionService = compressionService;
        this.policyStore = policyStore;
        this.clock = clock;
        this.metrics = metrics;
        this.workDirectory = properties.getDirectories().getWork();
        this.keyPrefix = properties.getArchive().getKeyPrefix();
        this.chunk = properties.getArchive().getChunk();
        this.findBestCompression = properties.getArchive().isFindBestCompression();
        this.history = new BoundedHistory<>(properties.getHistoryCapacity());
    }

    /**
     * Archive every enabled ARCHIVE policy's due range.
     */
    public ArchivalResult run(JobContext context) {
        ArchivalResult total = new ArchivalResult("archive_due", clock.instant());
        for (RetentionPolicy policy : policyStore.enabled(PolicyAction.ARCHIVE)) {
            context.throwIfCancelled();
            total.merge(archiveDue(policy, context));
        }
        total.succeed(clock.instant());
        logger.info("Archival finished: {} rows in {} objects", total.getRowsArchived(), total.getObjectKeys().size());
        return total;
    }

    /**
     * Archive one policy's cold range one chunk at a time, oldest first.
     */
    public ArchivalResult archiveDue(RetentionPolicy policy, JobContext context) {
        Instant now = clock.instant();
        ArchivalResult result = new ArchivalResult("archive_policy:" + policy.getName(), now);
        DatasetSelector selector = policy.selector();
        Instant cutoff = policyStore.windowFor(policy, now).getWarmCutoff();

        Optional<Instant> oldest = store.oldestTimestamp(selector);
        if (oldest.isPresent() && oldest.get().isBefore(cutoff)) {
            for (TimeRange range : TimeRange.of(oldest.get(), cutoff).split(chunk)) {
                context.throwIfCancelled();
                result.merge(archive(selector, range));
            }
        }
        result.succeed(clock.instant());
        return result;
    }

    /**
     * Archive the rows of {@code range} matching {@code selector}: one object
     * per dataset, source rows deleted only after every upload succeeded.
     */
    public ArchivalResult archive(DatasetSelector selector, TimeRange range) {
        ArchivalResult result = new ArchivalResult("archive", clock.instant());
        Path scratch = null;
        try {
            List<DataPoint> rows = new ArrayList<>(store.query(StorageTier.HOT, range, selector));
            rows.addAll(store.query(StorageTier.WARM, range, selector));
            if (rows.isEmpty()) {
                result.succeed(clock.instant());
                return result;
            }

            Files.createDirectories(workDirectory);
            scratch = Files.createTempDirectory(workDirectory, "archive-");

            Map<String, List<DataPoint>> byDataset = new TreeMap<>();
            for (DataPoint row : rows) {
                byDataset.computeIfAbsent(row.getDataset(), d -> new ArrayList<>()).add(row);
            }
            for (Map.Entry<String, List<DataPoint>> batch : byDataset.entrySet()) {
                Path file = scratch.resolve(keySegment(batch.getKey()) + ".parquet");
                parquetWriter.write(batch.getValue(), file);

                byte[] parquet = Files.readAllBytes(file);
                CompressedPayload payload = findBestCompression
                    ? compressionService.findBest(parquet)
                    : compressionService.compress(parquet);
                String key = objectKey(batch.getKey(), range, payload.getAlgorithm());
                objectStorage.put(key, payload.getData());
                result.addObject(key, batch.getValue().size(), payload.getCompressedSize());
            }

            store.delete(StorageTier.HOT, range, selector);
            store.delete(StorageTier.WARM, range, selector);

            metrics.recordArchived(result.getRowsArchived(), result.getBytesUploaded());
            result.succeed(clock.instant());
            logger.info("Archived {} rows of {} in {} to {} objects", result.getRowsArchived(), selector, range,
                result.getObjectKeys().size());
            return result;
        } catch (IOException e) {
            logger.error("Failed to write archive batch for {} in {}", selector, range, e);
            LifecycleException failure = new LifecycleException(ErrorCategory.INTERNAL,
                "archive batch could not be written", e);
            result.fail(clock.instant(), failure);
            throw failure;
        } catch (LifecycleException e) {
            result.fail(clock.instant(), e);
            throw e;
        } finally {
            history.append(result);
            LocalFiles.deleteQuietly(scratch);
        }
    }

    /**
     * Download an archived batch and write its rows back into the store.
     */
    public ArchivalResult restoreArchive(String key) {
        ArchivalResult result = new ArchivalResult("restore_archive", clock.instant());
        CompressionAlgorithm algorithm = algorithmOf(key);
        Path scratch = null;
        try {
            byte[] compressed = objectStorage.get(key);
            byte[] parquet = compressionService.decompress(compressed, algorithm);

            Files.createDirectories(workDirectory);
            scratch = Files.createTempDirectory(workDirectory, "rehydrate-");
            Path file = scratch.resolve("batch.parquet");
            Files.write(file, parquet);

            List<DataPoint> rows = parquetWriter.read(file);
            store.write(rows);
            result.addObject(key, rows.size(), compressed.length);
            result.succeed(clock.instant());
            logger.info("Rehydrated {} rows from {}", rows.size(), key);
            return result;
        } catch (IOException e) {
            logger.error("Failed to read archive {}", key, e);
            IntegrityViolationException failure = new IntegrityViolationException("archive batch is unreadable", e);
            result.fail(clock.instant(), failure);
            throw failure;
        } catch (LifecycleException e) {
            result.fail(clock.instant(), e);
            throw e;
        } finally {
            history.append(result);
            LocalFiles.deleteQuietly(scratch);
        }
    }

    /**
     * Archive keys of one dataset, or of every dataset when {@code dataset} is null.
     */
    public List<String> listArchives(String dataset) {
        String prefix = dataset == null ? keyPrefix + "/" : keyPrefix + "/" + keySegment(dataset) + "/";
        return objectStorage.list(prefix);
    }

    public List<ArchivalResult> history() {
        return history.snapshot();
    }

    /**
     * {@code {prefix}/{dataset}/year=YYYY/month=MM/{start}_{end}.parquet.{ext}}
     */
    String objectKey(String dataset, TimeRange range, CompressionAlgorithm algorithm) {
        ZonedDateTime start = range.getStart().atZone(ZoneOffset.UTC);
        return String.format("%s/%s/year=%d/month=%02d/%s_%s.parquet.%s",
            keyPrefix,
            keySegment(dataset),
            start.getYear(),
            start.getMonthValue(),
            KEY_TIMESTAMP.format(range.getStart()),
            KEY_TIMESTAMP.format(range.getEnd()),
            algorithm.getExtension());
    }

    private CompressionAlgorithm algorithmOf(String key) {
        int marker = key == null ? -1 : key.lastIndexOf(".parquet.");
        if (marker < 0 || !key.startsWith(keyPrefix + "/")) {
            throw new NotFoundException("archive", String.valueOf(key));
        }
        try {
            return CompressionAlgorithm.fromExtension(key.substring(marker + ".parquet.".length()));
        } catch (IllegalArgumentException e) {
            throw new NotFoundException("archive", key);
        }
    }

    private static String keySegment(String dataset) {
        return UNSAFE_KEY_CHARS.matcher(dataset).replaceAll("_");
    }
}
