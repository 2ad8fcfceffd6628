package tech.yump.ledger.verify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * Outcome of a full chain walk. Damage is described here, never thrown.
 *
 * @param valid               true when every readable event links and hashes correctly.
 * @param totalEvents         events read across all segments.
 * @param validEvents         events whose link and hash were both correct.
 * @param lastValidEventId    id of the last event that extended the valid chain.
 * @param firstInvalidEventId id of the first event that broke the chain.
 * @param segmentsScanned     segment files visited.
 * @param unreadableLines     lines skipped because they were not JSON objects.
 * @param verifiedAt          when the walk finished.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrityReport(
        boolean valid,
        @JsonProperty("total_events") int totalEvents,
        @JsonProperty("valid_events") int validEvents,
        @JsonProperty("last_valid_event_id") String lastValidEventId,
        @JsonProperty("first_invalid_event_id") String firstInvalidEventId,
        @JsonProperty("segments_scanned") int segmentsScanned,
        @JsonProperty("unreadable_lines") int unreadableLines,
        @JsonProperty("verified_at") Instant verifiedAt
) {

    public static IntegrityReport empty(Instant verifiedAt) {
        return IntegrityReport.builder()
                .valid(true)
                .verifiedAt(verifiedAt)
                .build();
    }
}
