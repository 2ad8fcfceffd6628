package tech.yump.ledger.retention;

import java.util.Optional;

/**
 * Maps a logical data type ("audit_logs", "session_state") to its storage location.
 */
@FunctionalInterface
public interface StorageLocationResolver {

    Optional<StorageLocation> resolve(String dataType);
}
