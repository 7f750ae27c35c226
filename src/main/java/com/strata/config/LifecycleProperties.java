package com.strata.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.compression.CompressionAlgorithm;
import com.strata.domain.StorageTier;
import com.strata.scheduler.JobType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the data lifecycle engine, bound from {@code lifecycle.*}.
 */
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {

    private Directories directories = new Directories();
    private Scheduler scheduler = new Scheduler();
    private Compression compression = new Compression();
    private Transition transition = new Transition();
    private Archive archive = new Archive();
    private Backup backup = new Backup();
    private Monitor monitor = new Monitor();
    private View view = new View();

    /**
     * Bounded history ring size used by every component
     */
    private int historyCapacity = 100;

    public Directories getDirectories() {
        return directories;
    }

    public void setDirectories(Directories directories) {
        this.directories = directories;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Compression getCompression() {
        return compression;
    }

    public void setCompression(Compression compression) {
        this.compression = compression;
    }

    public Transition getTransition() {
        return transition;
    }

    public void setTransition(Transition transition) {
        this.transition = transition;
    }

    public Archive getArchive() {
        return archive;
    }

    public void setArchive(Archive archive) {
        this.archive = archive;
    }

    public Backup getBackup() {
        return backup;
    }

    public void setBackup(Backup backup) {
        this.backup = backup;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public void setMonitor(Monitor monitor) {
        this.monitor = monitor;
    }

    public View getView() {
        return view;
    }

    public void setView(View view) {
        this.view = view;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    /**
     * Local directories owned by the engine.
     */
    public static class Directories {

        /**
         * Live configuration (policies, storage thresholds)
         */
        private Path config = Path.of("data/config");

        /**
         * Scheduler state
         */
        private Path state = Path.of("data/state");

        /**
         * Backup artifacts and manifests
         */
        private Path backups = Path.of("data/backups");

        /**
         * Scratch space for archive batches and restore staging
         */
        private Path work = Path.of("data/work");

        public Path getConfig() {
            return config;
        }

        public void setConfig(Path config) {
            this.config = config;
        }

        public Path getState() {
            return state;
        }

        public void setState(Path state) {
            this.state = state;
        }

        public Path getBackups() {
            return backups;
        }

        public void setBackups(Path backups) {
            this.backups = backups;
        }

        public Path getWork() {
            return work;
        }

        public void setWork(Path work) {
            this.work = work;
        }
    }

    public static class Scheduler {

        /**
         * Start the scheduling loop with the application
         */
        private boolean enabled = true;

        private Map<JobType, Duration> intervals = defaultIntervals();

        private int workerPoolSize = 4;

        private Duration jobTimeout = Duration.ofMinutes(30);

        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofSeconds(5);

        private double backoffMultiplier = 2.0;

        private Duration maxBackoff = Duration.ofMinutes(5);

        /**
         * How long a job waits for the exclusion lock before giving up for this cycle
         */
        private Duration lockWaitTimeout = Duration.ofMinutes(10);

        /**
         * Delay before a job that found the exclusion lock busy becomes due again
         */
        private Duration busyRetryDelay = Duration.ofMinutes(1);

        private static Map<JobType, Duration> defaultIntervals() {
            Map<JobType, Duration> intervals = new EnumMap<>(JobType.class);
            intervals.put(JobType.CLEANUP, Duration.ofHours(1));
            intervals.put(JobType.ARCHIVE, Duration.ofHours(6));
            intervals.put(JobType.BACKUP, Duration.ofDays(1));
            intervals.put(JobType.BACKUP_PRUNE, Duration.ofDays(1));
            intervals.put(JobType.STORAGE_CHECK, Duration.ofMinutes(5));
            intervals.put(JobType.VIEW_REFRESH, Duration.ofMinutes(15));
            return intervals;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<JobType, Duration> getIntervals() {
            return intervals;
        }

        public void setIntervals(Map<JobType, Duration> intervals) {
            this.intervals = intervals;
        }

        public int getWorkerPoolSize() {
            return workerPoolSize;
        }

        public void setWorkerPoolSize(int workerPoolSize) {
            this.workerPoolSize = workerPoolSize;
        }

        public Duration getJobTimeout() {
            return jobTimeout;
        }

        public void setJobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public Duration getLockWaitTimeout() {
            return lockWaitTimeout;
        }

        public void setLockWaitTimeout(Duration lockWaitTimeout) {
            this.lockWaitTimeout = lockWaitTimeout;
        }

        public Duration getBusyRetryDelay() {
            return busyRetryDelay;
        }

        public void setBusyRetryDelay(Duration busyRetryDelay) {
            this.busyRetryDelay = busyRetryDelay;
        }
    }

    public static class Compression {

        private CompressionAlgorithm defaultAlgorithm = CompressionAlgorithm.GZIP;

        /**
         * Size of the compression pool; trials of findBest run in parallel on it
         */
        private int poolSize = 2;

        private int queueCapacity = 64;

        public CompressionAlgorithm getDefaultAlgorithm() {
            return defaultAlgorithm;
        }

        public void setDefaultAlgorithm(CompressionAlgorithm defaultAlgorithm) {
            this.defaultAlgorithm = defaultAlgorithm;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Transition {

        /**
         * Downsample bucket width
         */
        private Duration bucket = Duration.ofHours(1);

        /**
         * Width of one bounded range processed per store round trip
         */
        private Duration chunk = Duration.ofDays(1);

        public Duration getBucket() {
            return bucket;
        }

        public void setBucket(Duration bucket) {
            this.bucket = bucket;
        }

        public Duration getChunk() {
            return chunk;
        }

        public void setChunk(Duration chunk) {
            this.chunk = chunk;
        }

        /**
         * A bucket never straddles two chunks: the chunk must be a whole
         * number of buckets.
         *
         * @throws IllegalStateException if the widths are not positive or not aligned
         */
        public void validate() {
            if (bucket == null || bucket.toMillis() <= 0) {
                throw new IllegalStateException("lifecycle.transition.bucket must be positive, was " + bucket);
            }
            if (chunk == null || chunk.toMillis() <= 0) {
                throw new IllegalStateException("lifecycle.transition.chunk must be positive, was " + chunk);
            }
            if (chunk.toMillis() % bucket.toMillis() != 0) {
                throw new IllegalStateException("lifecycle.transition.chunk (" + chunk
                    + ") must be a multiple of lifecycle.transition.bucket (" + bucket + ")");
            }
        }
    }

    public static class Archive {

        private String keyPrefix = "archives";

        /**
         * Width of one archived batch
         */
        private Duration chunk = Duration.ofDays(1);

        /**
         * Pick the smallest codec per batch instead of the default algorithm
         */
        private boolean findBestCompression = false;

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getChunk() {
            return chunk;
        }

        public void setChunk(Duration chunk) {
            this.chunk = chunk;
        }

        public boolean isFindBestCompression() {
            return findBestCompression;
        }

        public void setFindBestCompression(boolean findBestCompression) {
            this.findBestCompression = findBestCompression;
        }
    }

    public static class Backup {

        /**
         * Number of most recent backups kept by the prune job
         */
        private int keep = 7;

        private CompressionAlgorithm algorithm = CompressionAlgorithm.GZIP;

        public int getKeep() {
            return keep;
        }

        public void setKeep(int keep) {
            this.keep = keep;
        }

        public CompressionAlgorithm getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(CompressionAlgorithm algorithm) {
            this.algorithm = algorithm;
        }
    }

    public static class Monitor {

        private Map<StorageTier, Threshold> thresholds = defaultThresholds();

        private static Map<StorageTier, Threshold> defaultThresholds() {
            Map<StorageTier, Threshold> thresholds = new EnumMap<>(StorageTier.class);
            thresholds.put(StorageTier.HOT, new Threshold(80L * 1024 * 1024 * 1024, 95L * 1024 * 1024 * 1024));
            thresholds.put(StorageTier.WARM, new Threshold(400L * 1024 * 1024 * 1024, 475L * 1024 * 1024 * 1024));
            return thresholds;
        }

        public Map<StorageTier, Threshold> getThresholds() {
            return thresholds;
        }

        public void setThresholds(Map<StorageTier, Threshold> thresholds) {
            this.thresholds = thresholds;
        }
    }

    /**
     * Warning and critical usage levels for one tier, in bytes.
     */
    public static class Threshold {

        @JsonProperty("warning_bytes")
        private long warningBytes;

        @JsonProperty("critical_bytes")
        private long criticalBytes;

        public Threshold() {
        }

        public Threshold(long warningBytes, long criticalBytes) {
            this.warningBytes = warningBytes;
            this.criticalBytes = criticalBytes;
        }

        public long getWarningBytes() {
            return warningBytes;
        }

        public void setWarningBytes(long warningBytes) {
            this.warningBytes = warningBytes;
        }

        public long getCriticalBytes() {
            return criticalBytes;
        }

        public void setCriticalBytes(long criticalBytes) {
            this.criticalBytes = criticalBytes;
        }
    }

    public static class View {

        private Duration cacheTtl = Duration.ofMinutes(5);

        private int cacheMaxSize = 1000;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public int getCacheMaxSize() {
            return cacheMaxSize;
        }

        public void setCacheMaxSize(int cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
        }
    }
}
