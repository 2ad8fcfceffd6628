package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Partial change to a user policy. Null fields keep their current value; the id never changes.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetentionPolicyUpdate(
        String name,
        @JsonProperty("data_types") List<String> dataTypes,
        List<DataClassification> classifications,
        @JsonProperty("retention_days") Integer retentionDays,
        RetentionAction action,
        RetentionSchedule schedule,
        @JsonProperty("regulatory_requirement") String regulatoryRequirement
) {

    public RetentionPolicy applyTo(RetentionPolicy policy) {
        RetentionPolicy.RetentionPolicyBuilder updated = policy.toBuilder();
        if (name != null) {
            updated.name(name);
        }
        if (dataTypes != null) {
            updated.dataTypes(dataTypes);
        }
        if (classifications != null) {
            updated.classifications(classifications);
        }
        if (retentionDays != null) {
            updated.retentionDays(retentionDays);
        }
        if (action != null) {
            updated.action(action);
        }
        if (schedule != null) {
            updated.schedule(schedule);
        }
        if (regulatoryRequirement != null) {
            updated.regulatoryRequirement(regulatoryRequirement);
        }
        return updated.build();
    }
}
