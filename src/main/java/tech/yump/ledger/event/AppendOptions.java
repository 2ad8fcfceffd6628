package tech.yump.ledger.event;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Optional parts of an event passed to {@code Ledger.append}.
 * A null {@code retention} means "use the ledger's default retention".
 */
@Builder
public record AppendOptions(
        Resource resource,
        Map<String, Object> details,
        LegalBasis legalBasis,
        List<DataCategory> dataCategories,
        RetentionPeriod retention,
        String failureReason
) {

    private static final AppendOptions NONE = AppendOptions.builder().build();

    public static AppendOptions none() {
        return NONE;
    }

    public static AppendOptions withDetails(Map<String, Object> details) {
        return AppendOptions.builder().details(details).build();
    }
}
