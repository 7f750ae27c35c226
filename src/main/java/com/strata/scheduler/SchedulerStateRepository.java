package com.strata.scheduler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.storage.LocalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Persists the last run time of each job type in {@code scheduler-state.json}
 * so intervals survive restarts.
 */
public class SchedulerStateRepository {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerStateRepository.class);

    public static final String STATE_FILE = "scheduler-state.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public SchedulerStateRepository(Path stateDirectory, ObjectMapper objectMapper) {
        this.file = stateDirectory.resolve(STATE_FILE);
        this.objectMapper = objectMapper;
    }

    /**
     * Last run times; empty if the file is missing or unreadable, in which case
     * every job is due immediately.
     */
    public Map<JobType, Instant> load() {
        Map<JobType, Instant> lastRuns = new EnumMap<>(JobType.class);
        if (!Files.exists(file)) {
            return lastRuns;
        }
        try {
            Map<JobType, Instant> stored = objectMapper.readValue(file.toFile(),
                new TypeReference<Map<JobType, Instant>>() { });
            lastRuns.putAll(stored);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable scheduler state {}", file, e);
        }
        return lastRuns;
    }

    public void save(Map<JobType, Instant> lastRuns) {
        try {
            LocalFiles.writeAtomically(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(lastRuns));
        } catch (IOException e) {
            // the next run time is recomputed from memory; only a restart loses it
            logger.error("Failed to persist scheduler state to {}", file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
