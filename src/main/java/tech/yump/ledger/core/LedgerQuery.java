package tech.yump.ledger.core;

import lombok.Builder;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.LedgerEvent;

import java.time.Instant;

/**
 * Filter for {@link Ledger#read(LedgerQuery)}. Both bounds are inclusive; absent fields do not filter.
 */
@Builder
public record LedgerQuery(
        EventCategory category,
        Instant from,
        Instant to,
        Integer limit
) {

    public static final int DEFAULT_LIMIT = 100;

    public LedgerQuery {
        if (limit == null || limit < 1) {
            limit = DEFAULT_LIMIT;
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Query start " + from + " is after its end " + to);
        }
    }

    public static LedgerQuery latest(int limit) {
        return LedgerQuery.builder().limit(limit).build();
    }

    boolean matches(LedgerEvent event) {
        if (category != null && category != event.category()) {
            return false;
        }
        Instant timestamp = event.timestamp();
        if ((from != null || to != null) && timestamp == null) {
            return false;
        }
        if (from != null && timestamp.isBefore(from)) {
            return false;
        }
        return to == null || !timestamp.isAfter(to);
    }
}
