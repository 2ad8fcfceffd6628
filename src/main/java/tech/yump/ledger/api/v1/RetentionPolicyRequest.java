package tech.yump.ledger.api.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import tech.yump.ledger.retention.DataClassification;
import tech.yump.ledger.retention.RetentionAction;
import tech.yump.ledger.retention.RetentionPolicy;
import tech.yump.ledger.retention.RetentionSchedule;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A new user retention policy; the id is generated")
public record RetentionPolicyRequest(
        @NotBlank(message = "name is required")
        @Schema(example = "Temp export cleanup", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,

        @NotEmpty(message = "data_types must list at least one data type")
        @JsonProperty("data_types")
        @Schema(example = "[\"exports\"]", requiredMode = Schema.RequiredMode.REQUIRED)
        List<@NotBlank String> dataTypes,

        List<DataClassification> classifications,

        @NotNull(message = "retention_days is required")
        @Min(value = 1, message = "retention_days must be at least 1")
        @JsonProperty("retention_days")
        @Schema(example = "30", requiredMode = Schema.RequiredMode.REQUIRED)
        Integer retentionDays,

        @NotNull(message = "action is required")
        @Schema(example = "delete", requiredMode = Schema.RequiredMode.REQUIRED)
        RetentionAction action,

        @NotNull(message = "schedule is required")
        @Schema(example = "daily", requiredMode = Schema.RequiredMode.REQUIRED)
        RetentionSchedule schedule,

        @JsonProperty("regulatory_requirement")
        String regulatoryRequirement
) {

    RetentionPolicy toPolicy() {
        return RetentionPolicy.builder()
                .name(name)
                .dataTypes(dataTypes)
                .classifications(classifications)
                .retentionDays(retentionDays)
                .action(action)
                .schedule(schedule)
                .regulatoryRequirement(regulatoryRequirement)
                .build();
    }
}
