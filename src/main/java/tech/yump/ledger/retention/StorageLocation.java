package tech.yump.ledger.retention;

import java.nio.file.Path;

/**
 * Where the items of one data type live: a single file or a directory of files.
 *
 * @param classification sensitivity of the location, null when untagged.
 */
public record StorageLocation(Path path, DataClassification classification) {

    public static StorageLocation of(Path path) {
        return new StorageLocation(path, null);
    }
}
