package tech.yump.ledger.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Append-only storage of ledger lines, split into one segment per UTC calendar month.
 */
public interface SegmentStore {

    /**
     * Directory holding the segments of this store.
     */
    Path directory();

    /**
     * Segment for the current UTC year-month. Recomputed on every call, so appends roll over to a new
     * segment as soon as the month changes.
     */
    Path currentSegmentPath();

    /**
     * Appends one line (a terminator is added) and forces it to disk before returning. Existing content is
     * never rewritten; a segment whose last line lacks its terminator gets one before the new line.
     *
     * @throws StorageException if the directory cannot be created or the write fails.
     */
    void append(Path segment, String line) throws StorageException;

    /**
     * All segments of this store, ordered by period. Files not following the segment naming are ignored.
     * A missing directory yields an empty list.
     */
    List<Path> listSegments(SegmentOrder order);

    /**
     * Reads a segment, skipping lines that cannot be parsed. A missing file yields no lines.
     */
    SegmentLines readLines(Path segment);
}
