package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One immutable entry of the hash-chained ledger, stored as a single JSON line.
 * <p>
 * {@code hash} is the SHA-256 of the canonical form of every other field, {@code previousHash}
 * is the hash of the entry appended immediately before (or the genesis hash for the first one).
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEvent(
        String id,
        Instant timestamp,
        EventCategory category,
        @JsonProperty("event_type") String eventType,
        Actor actor,
        Resource resource,
        Map<String, Object> details,
        @JsonProperty("legal_basis") LegalBasis legalBasis,
        @JsonProperty("data_categories") List<DataCategory> dataCategories,
        @JsonProperty("retention_days") RetentionPeriod retentionDays,
        Outcome outcome,
        @JsonProperty("failure_reason") String failureReason,
        String hash,
        @JsonProperty("previous_hash") String previousHash
) {

    public LedgerEvent {
        details = details == null ? null : Collections.unmodifiableMap(details);
        dataCategories = dataCategories == null ? null : List.copyOf(dataCategories);
    }
}
