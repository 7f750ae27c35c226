package com.strata.monitor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.config.LifecycleProperties.Threshold;
import com.strata.domain.StorageTier;
import com.strata.storage.LocalFiles;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator overrides of the per-tier storage thresholds, kept as
 * {@code storage-thresholds.json} in the live configuration directory.
 */
public class StorageThresholdRepository {

    public static final String THRESHOLDS_FILE = "storage-thresholds.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public StorageThresholdRepository(Path configDirectory, ObjectMapper objectMapper) {
        this.file = configDirectory.resolve(THRESHOLDS_FILE);
        this.objectMapper = objectMapper;
    }

    /**
     * Overrides by tier; empty when the file does not exist.
     */
    public Map<StorageTier, Threshold> load() {
        if (!Files.exists(file)) {
            return new EnumMap<>(StorageTier.class);
        }
        try {
            return parse(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read storage thresholds", e);
        }
    }

    public void save(Map<StorageTier, Threshold> thresholds) {
        Map<String, Threshold> byName = new LinkedHashMap<>();
        thresholds.forEach((tier, threshold) -> byName.put(tier.getValue(), threshold));
        try {
            LocalFiles.writeAtomically(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(byName));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist storage thresholds", e);
        }
    }

    /**
     * Parse and validate a thresholds document.
     *
     * @throws IOException if the content is not valid JSON
     * @throws IllegalArgumentException if a tier is unknown or a threshold is inconsistent
     */
    public Map<StorageTier, Threshold> parse(byte[] content) throws IOException {
        Map<String, Threshold> byName = objectMapper.readValue(content, new TypeReference<Map<String, Threshold>>() { });
        Map<StorageTier, Threshold> thresholds = new EnumMap<>(StorageTier.class);
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, Threshold> entry : byName.entrySet()) {
            StorageTier tier = StorageTier.fromValue(entry.getKey());
            Threshold threshold = entry.getValue();
            if (threshold == null || threshold.getWarningBytes() <= 0) {
                errors.add(entry.getKey() + ": warning_bytes must be positive");
            } else if (threshold.getCriticalBytes() < threshold.getWarningBytes()) {
                errors.add(entry.getKey() + ": critical_bytes must not be below warning_bytes");
            } else {
                thresholds.put(tier, threshold);
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid storage thresholds: " + String.join("; ", errors));
        }
        return thresholds;
    }

    public Path getFile() {
        return file;
    }
}
