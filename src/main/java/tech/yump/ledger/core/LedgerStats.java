package tech.yump.ledger.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

@Builder
public record LedgerStats(
        boolean enabled,
        @JsonProperty("retention_years") int retentionYears,
        String directory,
        @JsonProperty("segment_count") int segmentCount,
        @JsonProperty("total_events") int totalEvents,
        @JsonProperty("events_by_category") Map<String, Integer> eventsByCategory
) {

    public LedgerStats {
        eventsByCategory = eventsByCategory == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(eventsByCategory));
    }
}
