package tech.yump.ledger.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Content of one segment file. Lines that are not JSON objects are left out and counted in
 * {@code skippedLines}; blank lines are neither returned nor counted. {@code error} is set when
 * the file itself could not be read, in which case {@code lines} is empty.
 */
public record SegmentLines(
        Path segment,
        List<SegmentLine> lines,
        int skippedLines,
        String error
) {

    public SegmentLines {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static SegmentLines unreadable(Path segment, String error) {
        return new SegmentLines(segment, List.of(), 0, error);
    }

    public boolean readable() {
        return error == null;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public SegmentLine last() {
        return lines.isEmpty() ? null : lines.get(lines.size() - 1);
    }
}
