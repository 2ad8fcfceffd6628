package tech.yump.ledger.api.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.AppendOptions;
import tech.yump.ledger.event.DataCategory;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.LegalBasis;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.event.Resource;
import tech.yump.ledger.event.RetentionPeriod;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v1/ledger/events}. When {@code actor} is omitted the authenticated caller is recorded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A compliance event to append to the ledger")
public record AppendEventRequest(
        @NotNull(message = "category is required")
        @Schema(example = "consent", requiredMode = Schema.RequiredMode.REQUIRED)
        EventCategory category,

        @NotBlank(message = "event_type is required")
        @Size(max = 200, message = "event_type must be at most 200 characters")
        @JsonProperty("event_type")
        @Schema(example = "consent_granted", requiredMode = Schema.RequiredMode.REQUIRED)
        String eventType,

        Actor actor,

        Resource resource,

        Map<String, Object> details,

        @JsonProperty("legal_basis")
        LegalBasis legalBasis,

        @JsonProperty("data_categories")
        List<DataCategory> dataCategories,

        @JsonProperty("retention_days")
        @Schema(description = "Number of days, or \"indefinite\". Defaults to the configured retention.", example = "2555")
        RetentionPeriod retentionDays,

        @NotNull(message = "outcome is required")
        @Schema(example = "success", requiredMode = Schema.RequiredMode.REQUIRED)
        Outcome outcome,

        @JsonProperty("failure_reason")
        String failureReason
) {

    AppendOptions toOptions() {
        return AppendOptions.builder()
                .resource(resource)
                .details(details)
                .legalBasis(legalBasis)
                .dataCategories(dataCategories)
                .retention(retentionDays)
                .failureReason(failureReason)
                .build();
    }
}
