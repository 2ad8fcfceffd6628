package tech.yump.ledger.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A parsed line of a segment.
 *
 * @param number 1-based line number within the segment file.
 * @param raw    the line as stored, without its terminator.
 * @param node   the parsed JSON object.
 */
public record SegmentLine(int number, String raw, ObjectNode node) {
}
