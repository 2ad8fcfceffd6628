package tech.yump.ledger.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.chain.HashChainer;
import tech.yump.ledger.storage.SegmentLine;
import tech.yump.ledger.storage.SegmentLines;
import tech.yump.ledger.storage.SegmentOrder;
import tech.yump.ledger.storage.SegmentStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Replays every segment of a store from oldest to newest and checks each event against the chain.
 * <p>
 * An event is valid when its {@code previous_hash} equals the hash of the last valid event (the genesis hash
 * at the start) and its stored {@code hash} matches the recomputed one. An invalid event does not move the
 * expected link forward, and the walk always runs to the end so the report covers the whole chain.
 * Read-only; safe to run while the ledger keeps appending.
 */
@Slf4j
@RequiredArgsConstructor
public class IntegrityVerifier {

    private final SegmentStore store;
    private final HashChainer chainer;
    private final Clock clock;

    public IntegrityReport verify() {
        List<Path> segments = store.listSegments(SegmentOrder.OLDEST_FIRST);

        String expectedPreviousHash = HashChainer.GENESIS_HASH;
        int total = 0;
        int valid = 0;
        int unreadable = 0;
        String lastValidId = null;
        String firstInvalidId = null;
        boolean invalidSeen = false;

        for (Path segment : segments) {
            SegmentLines content = store.readLines(segment);
            unreadable += content.skippedLines();
            if (!content.readable()) {
                log.warn("Segment {} skipped during verification: {}", segment, content.error());
                continue;
            }
            for (SegmentLine line : content.lines()) {
                ObjectNode event = line.node();
                total++;
                String id = text(event, "id");
                String previousHash = text(event, "previous_hash");
                String storedHash = text(event, "hash");

                if (!expectedPreviousHash.equals(previousHash)) {
                    log.debug("Event {} in {} (line {}) does not link to the expected previous hash", id, segment, line.number());
                    if (!invalidSeen) {
                        firstInvalidId = id;
                        invalidSeen = true;
                    }
                    continue;
                }
                if (storedHash == null || !storedHash.equals(chainer.compute(event))) {
                    log.debug("Event {} in {} (line {}) has a hash mismatch", id, segment, line.number());
                    if (!invalidSeen) {
                        firstInvalidId = id;
                        invalidSeen = true;
                    }
                    continue;
                }
                valid++;
                expectedPreviousHash = storedHash;
                lastValidId = id;
            }
        }

        IntegrityReport report = IntegrityReport.builder()
                .valid(valid == total)
                .totalEvents(total)
                .validEvents(valid)
                .lastValidEventId(lastValidId)
                .firstInvalidEventId(firstInvalidId)
                .segmentsScanned(segments.size())
                .unreadableLines(unreadable)
                .verifiedAt(clock.instant())
                .build();
        if (report.valid()) {
            log.debug("Chain in {} verified: {} event(s) across {} segment(s)", store.directory(), total, segments.size());
        } else {
            log.warn("Chain in {} is broken: {}/{} valid event(s), first invalid event {}",
                    store.directory(), valid, total, firstInvalidId);
        }
        return report;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
