package com.strata.storage.cold;

import com.strata.compression.CompressionAlgorithm;
import com.strata.compression.CompressionService;
import com.strata.config.JacksonConfig;
import com.strata.config.LifecycleProperties;
import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.NotFoundException;
import com.strata.error.TransientStoreException;
import com.strata.policy.PolicyAction;
import com.strata.policy.PolicyRepository;
import com.strata.policy.RetentionPolicy;
import com.strata.policy.RetentionPolicyStore;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.support.InMemoryObjectStorage;
import com.strata.support.InMemoryTimeSeriesStore;
import com.strata.support.MutableClock;
import com.strata.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArchivalService Tests")
class ArchivalServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T00:00:00Z");
    private static final TimeRange MARCH_FIRST =
        TimeRange.of(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-02T00:00:00Z"));

    @TempDir
    Path tempDir;

    private LifecycleProperties properties;
    private InMemoryTimeSeriesStore store;
    private InMemoryObjectStorage objectStorage;
    private RetentionPolicyStore policyStore;
    private ArchivalService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        properties = TestProperties.under(tempDir);
        store = new InMemoryTimeSeriesStore();
        objectStorage = new InMemoryObjectStorage();
        policyStore = new RetentionPolicyStore(
            new PolicyRepository(tempDir.resolve("config"), JacksonConfig.createObjectMapper()),
            clock, Duration.ofHours(1));
        CompressionService compression = new CompressionService(Runnable::run, CompressionAlgorithm.ZSTD, 10,
            clock, TestProperties.metrics());
        service = new ArchivalService(store, objectStorage, new ParquetBatchWriter(), compression, policyStore,
            properties, clock, TestProperties.metrics());
    }

    @Test
    @DisplayName("Object keys follow the dataset/year/month layout")
    void objectKeyShouldBeDeterministic() {
        String key = service.objectKey("cpu.load", MARCH_FIRST, CompressionAlgorithm.ZSTD);

        assertThat(key).isEqualTo(
            "archives/cpu.load/year=2024/month=03/20240301T000000Z_20240302T000000Z.parquet.zst");
        assertThat(service.objectKey("a/b c", MARCH_FIRST, CompressionAlgorithm.GZIP))
            .startsWith("archives/a_b_c/");
    }

    @Test
    @DisplayName("Archiving uploads one object per dataset and then deletes the source rows")
    void archiveShouldUploadThenDelete() throws IOException {
        // Given
        store.write(List.of(
            DataPoint.raw("cpu", "host-1", MARCH_FIRST.getStart().plusSeconds(60), 1.0),
            DataPoint.raw("mem", "host-1", MARCH_FIRST.getStart().plusSeconds(120), 2.0),
            new DataPoint(StorageTier.WARM, "cpu", "host-2", MARCH_FIRST.getStart(), 3.0, 4, 1.0, 5.0)));

        // When
        ArchivalResult result = service.archive(DatasetSelector.of("*"), MARCH_FIRST);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRowsArchived()).isEqualTo(3);
        assertThat(result.getObjectKeys()).containsExactly(
            "archives/cpu/year=2024/month=03/20240301T000000Z_20240302T000000Z.parquet.zst",
            "archives/mem/year=2024/month=03/20240301T000000Z_20240302T000000Z.parquet.zst");
        assertThat(objectStorage.size()).isEqualTo(2);
        assertThat(store.all(StorageTier.HOT)).isEmpty();
        assertThat(store.all(StorageTier.WARM)).isEmpty();
        assertThat(scratchDirectories()).isEmpty();
    }

    @Test
    @DisplayName("An upload failure never deletes rows and always removes temp files")
    void uploadFailureShouldKeepRows() throws IOException {
        // Given
        List<DataPoint> rows = List.of(DataPoint.raw("cpu", "host-1", MARCH_FIRST.getStart().plusSeconds(5), 1.0));
        store.write(rows);
        objectStorage.setFailPuts(true);

        // When / Then
        assertThatThrownBy(() -> service.archive(DatasetSelector.of("cpu"), MARCH_FIRST))
            .isInstanceOf(TransientStoreException.class);
        assertThat(store.all(StorageTier.HOT)).containsExactlyElementsOf(rows);
        assertThat(scratchDirectories()).isEmpty();
        assertThat(service.history()).last().satisfies(r -> assertThat(r.isSuccess()).isFalse());
    }

    @Test
    @DisplayName("An empty range uploads nothing")
    void emptyRangeShouldUploadNothing() {
        ArchivalResult result = service.archive(DatasetSelector.of("cpu"), MARCH_FIRST);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getObjectKeys()).isEmpty();
        assertThat(objectStorage.size()).isZero();
    }

    @Test
    @DisplayName("Archived batches can be listed and rehydrated into the store")
    void archivedBatchShouldRoundTripThroughRestore() {
        // Given
        policyStore.add(RetentionPolicy.builder()
            .name("cpu-archive").datasetSelector("cpu").retention(Duration.ofDays(30))
            .action(PolicyAction.ARCHIVE).build());
        DataPoint expired = DataPoint.raw("cpu", "host-1", NOW.minus(Duration.ofDays(40)), 12.5);
        DataPoint fresh = DataPoint.raw("cpu", "host-1", NOW.minus(Duration.ofDays(3)), 7.0);
        store.write(List.of(expired, fresh));

        // When
        ArchivalResult archived = service.run(JobContext.detached(JobType.ARCHIVE));

        // Then
        assertThat(archived.getRowsArchived()).isEqualTo(1);
        assertThat(store.all(StorageTier.HOT)).containsExactly(fresh);
        List<String> keys = service.listArchives("cpu");
        assertThat(keys).hasSize(1);

        // When
        ArchivalResult restored = service.restoreArchive(keys.get(0));

        // Then
        assertThat(restored.getRowsArchived()).isEqualTo(1);
        assertThat(store.all(StorageTier.HOT)).containsExactlyInAnyOrder(fresh, expired);
    }

    @Test
    @DisplayName("Rehydrating an unknown or malformed key fails with NotFoundException")
    void restoreOfUnknownKeyShouldFail() {
        assertThatThrownBy(() -> service.restoreArchive("archives/cpu/missing.parquet.zst"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.restoreArchive("../../etc/passwd"))
            .isInstanceOf(NotFoundException.class);
    }

    private List<Path> scratchDirectories() throws IOException {
        Path work = properties.getDirectories().getWork();
        if (!Files.exists(work)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(work)) {
            return entries.collect(Collectors.toList());
        }
    }
}
