package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.storage.SecureFiles;
import tech.yump.ledger.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Last successful run per policy id, kept apart from the policy definitions so that editing a policy does
 * not reset its schedule. File format: {@code {"runs": {"<policy id>": "<ISO instant>"}}}.
 */
@Slf4j
public class RetentionRunStore {

    public static final String FILE_NAME = "retention-last-run.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public RetentionRunStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    /**
     * All recorded runs. A missing or unreadable file reads as "never run", which makes every policy due.
     */
    public synchronized Map<String, Instant> lastRuns() {
        return Collections.unmodifiableMap(readRuns());
    }

    public synchronized Optional<Instant> lastRun(String policyId) {
        return Optional.ofNullable(readRuns().get(policyId));
    }

    /**
     * @throws StorageException if the file cannot be written.
     */
    public synchronized void recordRun(String policyId, Instant runAt) {
        Map<String, Instant> runs = readRuns();
        runs.put(policyId, runAt);
        try {
            SecureFiles.writeAtomically(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(new RunFile(runs)));
        } catch (IOException e) {
            log.error("Failed to record retention run of '{}' in {}: {}", policyId, file, e.getMessage(), e);
            throw new StorageException("Failed to record retention run: " + file, e);
        }
    }

    private Map<String, Instant> readRuns() {
        Map<String, Instant> runs = new TreeMap<>();
        if (!Files.exists(file)) {
            return runs;
        }
        try {
            RunFile content = objectMapper.readValue(file.toFile(), RunFile.class);
            if (content != null && content.runs() != null) {
                content.runs().forEach((id, at) -> {
                    if (id != null && at != null) {
                        runs.put(id, at);
                    }
                });
            }
        } catch (IOException e) {
            log.warn("Retention run file {} is unreadable, treating all policies as never run: {}", file, e.getMessage());
        }
        return runs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RunFile(Map<String, Instant> runs) {
    }
}
