package com.strata.policy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.storage.LocalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists retention policies as JSON in the live configuration directory.
 */
public class PolicyRepository {
    private static final Logger logger = LoggerFactory.getLogger(PolicyRepository.class);

    /**
     * File name inside the configuration directory; also the name used inside backups
     */
    public static final String POLICIES_FILE = "retention-policies.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public PolicyRepository(Path configDirectory, ObjectMapper objectMapper) {
        this.file = configDirectory.resolve(POLICIES_FILE);
        this.objectMapper = objectMapper;
    }

    public List<RetentionPolicy> load() {
        if (!Files.exists(file)) {
            logger.info("No policy file at {}, starting with an empty policy set", file);
            return new ArrayList<>();
        }
        try {
            return parse(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read retention policies", e);
        }
    }

    public void save(List<RetentionPolicy> policies) {
        try {
            LocalFiles.writeAtomically(file, serialize(policies));
            logger.debug("Persisted {} retention policies", policies.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist retention policies", e);
        }
    }

    public byte[] serialize(List<RetentionPolicy> policies) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(policies);
    }

    public List<RetentionPolicy> parse(byte[] content) throws IOException {
        return objectMapper.readValue(content, new TypeReference<List<RetentionPolicy>>() { });
    }

    public Path getFile() {
        return file;
    }
}
