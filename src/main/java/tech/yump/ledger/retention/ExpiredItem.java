package tech.yump.ledger.retention;

import java.nio.file.Path;

/**
 * A file past its retention period, with its size at scan time.
 */
public record ExpiredItem(Path path, long size) {
}
