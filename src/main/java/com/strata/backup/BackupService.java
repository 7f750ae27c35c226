package com.strata.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.compression.CompressedPayload;
import com.strata.compression.CompressionAlgorithm;
import com.strata.compression.CompressionService;
import com.strata.config.LifecycleProperties;
import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.ErrorCategory;
import com.strata.error.ErrorSummaries;
import com.strata.error.IntegrityViolationException;
import com.strata.error.LifecycleException;
import com.strata.error.NotFoundException;
import com.strata.history.BoundedHistory;
import com.strata.history.OperationResult;
import com.strata.metrics.LifecycleMetrics;
import com.strata.monitor.StorageThresholdRepository;
import com.strata.policy.PolicyRepository;
import com.strata.policy.RetentionPolicy;
import com.strata.policy.RetentionPolicyStore;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.storage.LocalFiles;
import com.strata.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Full-system backup and restore of policies, storage thresholds and store data.
 *
 * A backup is a zip of {@code config/} files and {@code data/<tier>.jsonl}
 * exports, compressed as a whole. The artifact is written first and the
 * manifest carrying its checksum second, both by atomic rename.
 *
 * A restore stages and validates everything before touching live state. Only
 * allow-listed config files are copied back, and a failed data apply is
 * compensated with the rows captured beforehand.
 */
@Service
public class BackupService {
    private static final Logger logger = LoggerFactory.getLogger(BackupService.class);

    static final String MANIFEST_SUFFIX = ".manifest.json";
    static final String CONFIG_PREFIX = "config/";
    static final String DATA_PREFIX = "data/";

    /**
     * Config files a restore may write into the live configuration directory
     */
    static final List<String> RESTORABLE_CONFIG_FILES = List.of(
        PolicyRepository.POLICIES_FILE,
        StorageThresholdRepository.THRESHOLDS_FILE);

    private static final Pattern BACKUP_ID = Pattern.compile("^[A-Za-z0-9_\\-]+$");
    private static final DateTimeFormatter ID_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final DatasetSelector ALL_DATASETS = DatasetSelector.of("*");
    private static final TimeRange ALL_TIME = TimeRange.of(Instant.EPOCH, Instant.parse("2200-01-01T00:00:00Z"));

    private final TimeSeriesStore store;
    private final RetentionPolicyStore policyStore;
    private final StorageThresholdRepository thresholdRepository;
    private final CompressionService compressionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final LifecycleMetrics metrics;
    private final Path backupDirectory;
    private final Path configDirectory;
    private final Path workDirectory;
    private final CompressionAlgorithm algorithm;
    private final BoundedHistory<OperationResult> history;

    public BackupService(TimeSeriesStore store, RetentionPolicyStore policyStore,
                         StorageThresholdRepository thresholdRepository, CompressionService compressionService,
                         ObjectMapper objectMapper, LifecycleProperties properties, Clock clock,
                         LifecycleMetrics metrics) {
        this.store = store;
        this.policyStore = policyStore;
        this.thresholdRepository = thresholdRepository;
        this.compressionService = compressionService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.backupDirectory = properties.getDirectories().getBackups();
        this.configDirectory = properties.getDirectories().getConfig();
        this.workDirectory = properties.getDirectories().getWork();
        this.algorithm = properties.getBackup().getAlgorithm();
        this.history = new BoundedHistory<>(properties.getHistoryCapacity());
    }

    /**
     * Write a new backup of the current policies, thresholds and store data.
     */
    public BackupManifest backup() {
        return createBackup().getManifest();
    }

    /**
     * Same as {@link #backup()}, returning the run outcome with the manifest attached.
     */
    public BackupInfo createBackup() {
        return createBackup(JobContext.detached(JobType.BACKUP));
    }

    /**
     * Write a new backup, checking {@code context} between the export, pack and
     * write phases. A run that fails or is cancelled before its manifest is
     * written leaves no artifact behind.
     */
    public BackupInfo createBackup(JobContext context) {
        Instant now = clock.instant();
        String backupId = "backup-" + ID_TIMESTAMP.format(now) + "-" + UUID.randomUUID().toString().substring(0, 8);
        BackupInfo info = new BackupInfo(backupId, now);
        Path artifactPath = null;
        boolean committed = false;
        try {
            context.throwIfCancelled();
            List<RetentionPolicy> policies = policyStore.list();
            Map<String, byte[]> entries = new LinkedHashMap<>();
            entries.put(CONFIG_PREFIX + PolicyRepository.POLICIES_FILE,
                policyStore.getRepository().serialize(policies));
            Path thresholds = thresholdRepository.getFile();
            boolean includesThresholds = Files.exists(thresholds);
            if (includesThresholds) {
                entries.put(CONFIG_PREFIX + StorageThresholdRepository.THRESHOLDS_FILE, Files.readAllBytes(thresholds));
            }
            Map<String, Long> rowCounts = new LinkedHashMap<>();
            for (StorageTier tier : storeTiers()) {
                context.throwIfCancelled();
                List<DataPoint> rows = store.query(tier, ALL_TIME, ALL_DATASETS);
                entries.put(DATA_PREFIX + tier.getValue() + ".jsonl", toJsonLines(rows));
                rowCounts.put(tier.getValue(), (long) rows.size());
            }

            context.throwIfCancelled();
            CompressedPayload payload = compressionService.compress(BackupArchive.pack(entries), algorithm);
            String artifact = backupId + ".zip." + payload.getAlgorithm().getExtension();

            context.throwIfCancelled();
            artifactPath = backupDirectory.resolve(artifact);
            LocalFiles.writeAtomically(artifactPath, payload.getData());

            BackupManifest manifest = new BackupManifest();
            manifest.setBackupId(backupId);
            manifest.setCreatedAt(now);
            manifest.setArtifact(artifact);
            manifest.setIncludedPolicies(policies.stream().map(RetentionPolicy::getName).collect(Collectors.toList()));
            manifest.setChecksum(sha256(payload.getData()));
            manifest.setSizeBytes(payload.getCompressedSize());
            manifest.setCompressionAlgorithm(payload.getAlgorithm());
            manifest.setRowCounts(rowCounts);
            manifest.setIncludesStorageThresholds(includesThresholds);

            context.throwIfCancelled();
            LocalFiles.writeAtomically(manifestPath(backupId),
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest));
            committed = true;

            info.setSizeBytes(payload.getCompressedSize());
            info.setCompressionRatio(payload.getRatio());
            info.setItemsProcessed(rowCounts.values().stream().mapToLong(Long::longValue).sum());
            info.setManifest(manifest);
            info.succeed(clock.instant());
            metrics.recordBackupCreated();
            logger.info("Backup {} written: {} policies, rows {}, {} bytes", backupId, policies.size(), rowCounts,
                payload.getCompressedSize());
            return info;
        } catch (IOException e) {
            logger.error("Failed to write backup {}", backupId, e);
            LifecycleException failure = new LifecycleException(ErrorCategory.INTERNAL, "backup could not be written", e);
            info.fail(clock.instant(), failure);
            throw failure;
        } catch (RuntimeException e) {
            logger.warn("Backup {} did not complete: {}", backupId, ErrorSummaries.summarize(e));
            info.fail(clock.instant(), e);
            throw e;
        } finally {
            if (!committed && artifactPath != null) {
                logger.info("Discarding partial backup artifact {}", artifactPath.getFileName());
                LocalFiles.deleteQuietly(artifactPath);
            }
            history.append(info);
        }
    }

    /**
     * Restore policies, thresholds and store data from a backup.
     */
    public RecoveryAttempt restore(String backupId) {
        return restore(backupId, JobContext.detached(JobType.RESTORE));
    }

    /**
     * Restore from a backup, checking {@code context} at every step before live
     * state is touched. Once applying has started the restore runs to the end
     * or is compensated.
     */
    public RecoveryAttempt restore(String backupId, JobContext context) {
        RecoveryAttempt attempt = new RecoveryAttempt(backupId, clock.instant());
        Path staging = null;
        try {
            BackupManifest manifest = get(backupId);
            byte[] archive = readVerifiedArtifact(manifest);
            context.throwIfCancelled();

            Files.createDirectories(workDirectory);
            staging = Files.createTempDirectory(workDirectory, "restore-");
            BackupArchive.extract(archive, staging);
            context.throwIfCancelled();

            StagedBackup staged = parseStaged(staging, manifest);
            context.throwIfCancelled();
            apply(staged, attempt);

            attempt.setPoliciesRestored(staged.policies.size());
            attempt.setRowsRestored(staged.rowCount());
            attempt.succeed(clock.instant());
            metrics.recordRestore(true);
            logger.info("Restored backup {}: {} policies, {} rows", backupId, staged.policies.size(), staged.rowCount());
            return attempt;
        } catch (IOException e) {
            logger.error("Restore of backup {} failed", backupId, e);
            IntegrityViolationException failure = new IntegrityViolationException("backup content is unreadable", e);
            attempt.fail(clock.instant(), failure);
            metrics.recordRestore(false);
            throw failure;
        } catch (RuntimeException e) {
            logger.error("Restore of backup {} failed: {}", backupId, e.getMessage());
            attempt.fail(clock.instant(), e);
            metrics.recordRestore(false);
            throw e;
        } finally {
            history.append(attempt);
            LocalFiles.deleteQuietly(staging);
        }
    }

    private byte[] readVerifiedArtifact(BackupManifest manifest) throws IOException {
        if (manifest.getArtifact() == null || manifest.getChecksum() == null
                || manifest.getCompressionAlgorithm() == null) {
            throw new IntegrityViolationException("backup manifest is incomplete");
        }
        Path artifact = LocalFiles.resolveInside(backupDirectory, manifest.getArtifact());
        if (!Files.exists(artifact)) {
            throw new IntegrityViolationException("backup artifact is missing");
        }
        byte[] stored = Files.readAllBytes(artifact);
        if (!MessageDigest.isEqual(sha256(stored).getBytes(StandardCharsets.US_ASCII),
                manifest.getChecksum().toLowerCase().getBytes(StandardCharsets.US_ASCII))) {
            throw new IntegrityViolationException("backup checksum mismatch",
                "checksum mismatch for " + artifact);
        }
        return compressionService.decompress(stored, manifest.getCompressionAlgorithm());
    }

    /**
     * Parse and validate every staged file. Nothing live is touched here.
     */
    private StagedBackup parseStaged(Path staging, BackupManifest manifest) throws IOException {
        StagedBackup staged = new StagedBackup();

        Path policiesFile = staging.resolve(CONFIG_PREFIX + PolicyRepository.POLICIES_FILE);
        if (!Files.isRegularFile(policiesFile)) {
            throw new IntegrityViolationException("backup contains no retention policies");
        }
        staged.configFiles.put(PolicyRepository.POLICIES_FILE, Files.readAllBytes(policiesFile));
        staged.policies = policyStore.getRepository().parse(staged.configFiles.get(PolicyRepository.POLICIES_FILE));
        List<String> policyErrors = policyStore.validateAll(staged.policies);
        if (!policyErrors.isEmpty()) {
            throw new IntegrityViolationException("backup contains invalid retention policies",
                String.join("; ", policyErrors));
        }

        Path thresholdsFile = staging.resolve(CONFIG_PREFIX + StorageThresholdRepository.THRESHOLDS_FILE);
        if (Files.isRegularFile(thresholdsFile)) {
            byte[] content = Files.readAllBytes(thresholdsFile);
            try {
                thresholdRepository.parse(content);
            } catch (IllegalArgumentException e) {
                throw new IntegrityViolationException("backup contains invalid storage thresholds", e);
            }
            staged.configFiles.put(StorageThresholdRepository.THRESHOLDS_FILE, content);
        }

        for (StorageTier tier : storeTiers()) {
            Path dataFile = staging.resolve(DATA_PREFIX + tier.getValue() + ".jsonl");
            List<DataPoint> rows = Files.isRegularFile(dataFile) ? fromJsonLines(Files.readAllLines(dataFile)) : List.of();
            for (DataPoint row : rows) {
                if (row.getTier() != tier) {
                    throw new IntegrityViolationException("backup data file holds rows of another tier");
                }
            }
            Long expected = manifest.getRowCounts().get(tier.getValue());
            if (expected != null && expected != rows.size()) {
                throw new IntegrityViolationException("backup row count does not match its manifest",
                    tier.getValue() + ": expected " + expected + ", found " + rows.size());
            }
            staged.rows.put(tier, rows);
        }
        return staged;
    }

    /**
     * Write staged config into the live directory and replace store data. Any
     * failure writes back the previous config and rows before it propagates.
     */
    private void apply(StagedBackup staged, RecoveryAttempt attempt) throws IOException {
        Map<String, byte[]> previousConfig = new LinkedHashMap<>();
        for (String name : RESTORABLE_CONFIG_FILES) {
            Path live = LocalFiles.resolveInside(configDirectory, name);
            if (Files.isRegularFile(live)) {
                previousConfig.put(name, Files.readAllBytes(live));
            }
        }
        Map<StorageTier, List<DataPoint>> previousRows = new EnumMap<>(StorageTier.class);
        for (StorageTier tier : storeTiers()) {
            previousRows.put(tier, store.query(tier, ALL_TIME, ALL_DATASETS));
        }

        try {
            writeConfig(staged.configFiles);
            replaceRows(staged.rows);
        } catch (IOException e) {
            LifecycleException failure = new LifecycleException(ErrorCategory.INTERNAL,
                "restored configuration could not be written", e);
            compensate(attempt, previousConfig, previousRows, failure);
            throw failure;
        } catch (RuntimeException e) {
            compensate(attempt, previousConfig, previousRows, e);
            throw e;
        }
        policyStore.reload();
    }

    private void compensate(RecoveryAttempt attempt, Map<String, byte[]> previousConfig,
                            Map<StorageTier, List<DataPoint>> previousRows, RuntimeException cause) {
        logger.error("Applying restored backup failed, writing back previous state", cause);
        attempt.setCompensated(true);
        try {
            writeConfig(previousConfig);
        } catch (IOException | RuntimeException e) {
            logger.error("Could not write back previous configuration", e);
            cause.addSuppressed(e);
        }
        try {
            replaceRows(previousRows);
        } catch (RuntimeException e) {
            logger.error("Could not write back previous store rows", e);
            cause.addSuppressed(e);
        }
        try {
            policyStore.reload();
        } catch (RuntimeException e) {
            logger.error("Could not reload retention policies after compensation", e);
            cause.addSuppressed(e);
        }
    }

    private void writeConfig(Map<String, byte[]> files) throws IOException {
        for (String name : RESTORABLE_CONFIG_FILES) {
            Path live = LocalFiles.resolveInside(configDirectory, name);
            byte[] content = files.get(name);
            if (content != null) {
                LocalFiles.writeAtomically(live, content);
            } else {
                Files.deleteIfExists(live);
            }
        }
    }

    private void replaceRows(Map<StorageTier, List<DataPoint>> rows) {
        for (StorageTier tier : storeTiers()) {
            store.delete(tier, ALL_TIME, ALL_DATASETS);
            store.write(rows.getOrDefault(tier, List.of()));
        }
    }

    /**
     * Manifests newest first. Unreadable manifests are skipped.
     */
    public List<BackupManifest> list() {
        if (!Files.isDirectory(backupDirectory)) {
            return new ArrayList<>();
        }
        List<BackupManifest> manifests = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(backupDirectory, "*" + MANIFEST_SUFFIX)) {
            for (Path file : files) {
                try {
                    manifests.add(objectMapper.readValue(file.toFile(), BackupManifest.class));
                } catch (IOException e) {
                    logger.warn("Skipping unreadable backup manifest {}", file, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups", e);
        }
        manifests.sort(Comparator.comparing(BackupManifest::getCreatedAt,
            Comparator.nullsLast(Comparator.reverseOrder())));
        return manifests;
    }

    public BackupManifest get(String backupId) {
        if (backupId == null || !BACKUP_ID.matcher(backupId).matches()) {
            throw new NotFoundException("backup", String.valueOf(backupId));
        }
        Path manifest = manifestPath(backupId);
        if (!Files.exists(manifest)) {
            throw new NotFoundException("backup", backupId);
        }
        try {
            return objectMapper.readValue(manifest.toFile(), BackupManifest.class);
        } catch (IOException e) {
            throw new IntegrityViolationException("backup manifest is unreadable", e);
        }
    }

    /**
     * Delete all but the {@code keep} newest backups. The manifest goes first so
     * a half-deleted backup is never listed.
     */
    public OperationResult pruneOldBackups(int keep) {
        OperationResult result = new OperationResult("prune_backups", clock.instant());
        List<BackupManifest> manifests = list();
        try {
            for (BackupManifest manifest : manifests.subList(Math.min(Math.max(keep, 0), manifests.size()),
                    manifests.size())) {
                Files.deleteIfExists(manifestPath(manifest.getBackupId()));
                if (manifest.getArtifact() != null) {
                    Files.deleteIfExists(LocalFiles.resolveInside(backupDirectory, manifest.getArtifact()));
                }
                result.addItemsProcessed(1);
                logger.info("Pruned backup {}", manifest.getBackupId());
            }
        } catch (IOException e) {
            LifecycleException failure = new LifecycleException(ErrorCategory.INTERNAL, "old backups could not be removed", e);
            result.fail(clock.instant(), failure);
            history.append(result);
            throw failure;
        }
        result.succeed(clock.instant());
        history.append(result);
        return result;
    }

    public Map<String, Object> statistics() {
        List<BackupManifest> manifests = list();
        List<OperationResult> runs = history.snapshot();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_backups", manifests.size());
        stats.put("total_size_bytes", manifests.stream().mapToLong(BackupManifest::getSizeBytes).sum());
        stats.put("latest_backup", manifests.isEmpty() ? null : manifests.get(0).getBackupId());
        stats.put("successful_backups", runs.stream().filter(r -> r instanceof BackupInfo && r.isSuccess()).count());
        stats.put("failed_backups", runs.stream().filter(r -> r instanceof BackupInfo && !r.isSuccess()).count());
        stats.put("restores", runs.stream().filter(r -> r instanceof RecoveryAttempt).count());
        return stats;
    }

    public List<OperationResult> history() {
        return history.snapshot();
    }

    public Optional<OperationResult> lastResult() {
        return Optional.ofNullable(history.latest());
    }

    private Path manifestPath(String backupId) {
        return backupDirectory.resolve(backupId + MANIFEST_SUFFIX);
    }

    private byte[] toJsonLines(List<DataPoint> rows) throws IOException {
        StringBuilder lines = new StringBuilder();
        for (DataPoint row : rows) {
            lines.append(objectMapper.writeValueAsString(row)).append('\n');
        }
        return lines.toString().getBytes(StandardCharsets.UTF_8);
    }

    private List<DataPoint> fromJsonLines(List<String> lines) throws IOException {
        List<DataPoint> rows = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (!line.isBlank()) {
                rows.add(objectMapper.readValue(line, DataPoint.class));
            }
        }
        return rows;
    }

    private static List<StorageTier> storeTiers() {
        List<StorageTier> tiers = new ArrayList<>();
        for (StorageTier tier : StorageTier.values()) {
            if (tier.isStoreResident()) {
                tiers.add(tier);
            }
        }
        return tiers;
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class StagedBackup {
        private final Map<String, byte[]> configFiles = new LinkedHashMap<>();
        private final Map<StorageTier, List<DataPoint>> rows = new EnumMap<>(StorageTier.class);
        private List<RetentionPolicy> policies = List.of();

        long rowCount() {
            return rows.values().stream().mapToLong(List::size).sum();
        }
    }
}
