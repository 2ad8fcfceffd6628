package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative rule: items of the listed data types older than {@code retentionDays} get {@code action}.
 *
 * @param classifications when non-empty, only locations tagged with one of these are governed.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetentionPolicy(
        String id,
        String name,
        @JsonProperty("data_types") List<String> dataTypes,
        List<DataClassification> classifications,
        @JsonProperty("retention_days") int retentionDays,
        RetentionAction action,
        RetentionSchedule schedule,
        @JsonProperty("regulatory_requirement") String regulatoryRequirement
) {

    public RetentionPolicy {
        dataTypes = dataTypes == null ? List.of() : List.copyOf(dataTypes);
        classifications = classifications == null || classifications.isEmpty() ? null : List.copyOf(classifications);
    }

    /**
     * Whether a location with the given classification falls under this policy. Unclassified locations are
     * only governed by policies without a classification filter.
     */
    @JsonIgnore
    public boolean governs(DataClassification classification) {
        if (classifications == null) {
            return true;
        }
        return classification != null && classifications.contains(classification);
    }

    /**
     * Problems that make this policy unusable, empty when it is valid.
     */
    @JsonIgnore
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (name == null || name.isBlank()) {
            problems.add("name is required");
        }
        if (dataTypes.isEmpty() || dataTypes.stream().anyMatch(t -> t == null || t.isBlank())) {
            problems.add("data_types must list at least one non-blank data type");
        }
        if (retentionDays < 1) {
            problems.add("retention_days must be at least 1");
        }
        if (action == null) {
            problems.add("action is required");
        }
        if (schedule == null) {
            problems.add("schedule is required");
        }
        return problems;
    }
}
