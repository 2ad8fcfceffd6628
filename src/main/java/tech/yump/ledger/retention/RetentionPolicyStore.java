package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.storage.SecureFiles;
import tech.yump.ledger.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Built-in policies merged with user policies persisted as JSON.
 * <p>
 * Only user policies are written to the file. Built-in ids are reserved: a file entry using one is ignored,
 * and built-in policies can be neither updated nor removed. Every mutation is persisted before it returns.
 */
@Slf4j
public class RetentionPolicyStore {

    public static final String FILE_NAME = "retention-policies.json";
    static final String FORMAT_VERSION = "1.0.0";
    private static final String ID_PREFIX = "policy_";

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, RetentionPolicy> userPolicies = new LinkedHashMap<>();
    private boolean loaded;

    public RetentionPolicyStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    /**
     * (Re)reads the user policies from disk. A file that cannot be parsed is moved aside as
     * {@code <name>.corrupt-<epoch-millis>} and the store starts over with built-ins only.
     */
    public synchronized void load() {
        userPolicies.clear();
        loaded = true;
        if (!Files.exists(file)) {
            log.debug("No retention policy file at {}, using built-in policies only", file);
            return;
        }
        PolicyFile content;
        try {
            content = objectMapper.readValue(file.toFile(), PolicyFile.class);
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
            log.error("Retention policy file {} is unreadable ({}); moving it to {}", file, e.getMessage(), aside);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new StorageException("Unreadable retention policy file could not be moved aside: " + file, moveError);
            }
            return;
        }
        if (content == null || content.policies() == null) {
            return;
        }
        for (RetentionPolicy policy : content.policies()) {
            if (policy == null || policy.id() == null) {
                log.warn("Ignoring retention policy without id in {}", file);
                continue;
            }
            if (BuiltInPolicies.isBuiltIn(policy.id())) {
                log.warn("Ignoring stored policy '{}': the id is reserved for a built-in policy", policy.id());
                continue;
            }
            List<String> problems = policy.problems();
            if (!problems.isEmpty()) {
                log.warn("Ignoring invalid stored policy '{}': {}", policy.id(), problems);
                continue;
            }
            userPolicies.put(policy.id(), policy);
        }
        log.info("Loaded {} user retention policies from {}", userPolicies.size(), file);
    }

    /**
     * Built-in policies first, then user policies in insertion order.
     */
    public synchronized List<RetentionPolicy> list() {
        ensureLoaded();
        List<RetentionPolicy> all = new ArrayList<>(BuiltInPolicies.all());
        all.addAll(userPolicies.values());
        return all;
    }

    public synchronized Optional<RetentionPolicy> get(String id) {
        ensureLoaded();
        return BuiltInPolicies.all().stream()
                .filter(p -> p.id().equals(id))
                .findFirst()
                .or(() -> Optional.ofNullable(userPolicies.get(id)));
    }

    /**
     * Stores a new user policy under a generated {@code policy_xxxxxxxx} id. Any id on the input is discarded.
     *
     * @throws IllegalArgumentException if the policy is incomplete.
     * @throws StorageException         if the policy file cannot be written; the policy is then not added.
     */
    public synchronized RetentionPolicy add(RetentionPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        ensureLoaded();
        String id = newId();
        RetentionPolicy stored = policy.toBuilder().id(id).build();
        requireValid(stored);
        userPolicies.put(id, stored);
        try {
            save();
        } catch (StorageException e) {
            userPolicies.remove(id);
            throw e;
        }
        log.info("Added retention policy '{}' ({})", id, stored.name());
        return stored;
    }

    /**
     * Applies a partial update to a user policy.
     *
     * @return the updated policy, or empty when the id is unknown or belongs to a built-in policy.
     */
    public synchronized Optional<RetentionPolicy> update(String id, RetentionPolicyUpdate update) {
        ensureLoaded();
        RetentionPolicy current = userPolicies.get(id);
        if (current == null || update == null) {
            return Optional.empty();
        }
        RetentionPolicy updated = update.applyTo(current);
        requireValid(updated);
        userPolicies.put(id, updated);
        try {
            save();
        } catch (StorageException e) {
            userPolicies.put(id, current);
            throw e;
        }
        log.info("Updated retention policy '{}'", id);
        return Optional.of(updated);
    }

    /**
     * @return false when the id is unknown or belongs to a built-in policy.
     */
    public synchronized boolean remove(String id) {
        ensureLoaded();
        if (BuiltInPolicies.isBuiltIn(id)) {
            return false;
        }
        RetentionPolicy removed = userPolicies.remove(id);
        if (removed == null) {
            return false;
        }
        try {
            save();
        } catch (StorageException e) {
            userPolicies.put(id, removed);
            throw e;
        }
        log.info("Removed retention policy '{}'", id);
        return true;
    }

    private void ensureLoaded() {
        if (!loaded) {
            load();
        }
    }

    private String newId() {
        String id;
        do {
            id = ID_PREFIX + UUID.randomUUID().toString().substring(0, 8);
        } while (userPolicies.containsKey(id) || BuiltInPolicies.isBuiltIn(id));
        return id;
    }

    private static void requireValid(RetentionPolicy policy) {
        List<String> problems = policy.problems();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid retention policy: " + String.join(", ", problems));
        }
    }

    private void save() {
        PolicyFile content = new PolicyFile(FORMAT_VERSION, Instant.now(clock), new ArrayList<>(userPolicies.values()));
        try {
            SecureFiles.writeAtomically(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(content));
        } catch (IOException e) {
            log.error("Failed to write retention policies to {}: {}", file, e.getMessage(), e);
            throw new StorageException("Failed to write retention policies: " + file, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PolicyFile(
            String version,
            @JsonProperty("last_updated") Instant lastUpdated,
            List<RetentionPolicy> policies
    ) {
    }
}
