package com.strata.scheduler;

import com.strata.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchedulerStateRepository Tests")
class SchedulerStateRepositoryTest {

    @TempDir
    Path tempDir;

    private SchedulerStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SchedulerStateRepository(tempDir.resolve("state"), JacksonConfig.createObjectMapper());
    }

    @Test
    @DisplayName("A missing state file means no job has run yet")
    void missingFileShouldLoadEmpty() {
        assertThat(repository.load()).isEmpty();
    }

    @Test
    @DisplayName("Saved last run times load back unchanged")
    void saveThenLoad() {
        Map<JobType, Instant> lastRuns = new EnumMap<>(JobType.class);
        lastRuns.put(JobType.CLEANUP, Instant.parse("2024-03-10T08:00:00Z"));
        lastRuns.put(JobType.BACKUP, Instant.parse("2024-03-09T00:00:00Z"));

        repository.save(lastRuns);

        assertThat(repository.getFile()).exists();
        assertThat(repository.load()).isEqualTo(lastRuns);
    }

    @Test
    @DisplayName("A corrupt state file is ignored")
    void corruptFileShouldLoadEmpty() throws Exception {
        Files.createDirectories(repository.getFile().getParent());
        Files.write(repository.getFile(), "{not json".getBytes(StandardCharsets.UTF_8));

        assertThat(repository.load()).isEmpty();
    }
}
