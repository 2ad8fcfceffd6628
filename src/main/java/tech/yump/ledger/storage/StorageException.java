package tech.yump.ledger.storage;

/**
 * Unrecoverable failure of the local storage: a directory that cannot be created,
 * a segment that cannot be appended to, a state file that cannot be written.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
