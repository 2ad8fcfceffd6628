package tech.yump.ledger.retention;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default locations under the base directory, overridden or extended by configured ones.
 */
@Slf4j
public class ConfiguredStorageLocationResolver implements StorageLocationResolver {

    private final Map<String, StorageLocation> locations;

    public ConfiguredStorageLocationResolver(Path baseDir, Map<String, StorageLocation> configured) {
        Map<String, StorageLocation> merged = new LinkedHashMap<>(defaults(baseDir));
        if (configured != null) {
            merged.putAll(configured);
        }
        this.locations = Collections.unmodifiableMap(merged);
        log.debug("Retention storage locations: {}", this.locations);
    }

    /**
     * Built-in layout. The compliance, audit and security trails are tagged as regulated data.
     */
    public static Map<String, StorageLocation> defaults(Path baseDir) {
        Map<String, StorageLocation> defaults = new LinkedHashMap<>();
        defaults.put("audit_logs", new StorageLocation(baseDir.resolve("audit"), DataClassification.REGULATED));
        defaults.put("compliance_events", new StorageLocation(baseDir.resolve("compliance"), DataClassification.REGULATED));
        defaults.put("security_logs", new StorageLocation(baseDir.resolve("security"), DataClassification.REGULATED));
        defaults.put("session_state", StorageLocation.of(baseDir.resolve("sessions")));
        defaults.put("browser_cache", StorageLocation.of(baseDir.resolve("browser_cache")));
        defaults.put("browser_local_storage", StorageLocation.of(baseDir.resolve("browser_state")));
        defaults.put("error_logs", StorageLocation.of(baseDir.resolve("logs")));
        return defaults;
    }

    @Override
    public Optional<StorageLocation> resolve(String dataType) {
        return Optional.ofNullable(locations.get(dataType));
    }

    public Map<String, StorageLocation> locations() {
        return locations;
    }
}
