package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * Outcome of applying one policy to one data type. Items that could not be disposed of are not counted.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetentionResult(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("policy_name") String policyName,
        @JsonProperty("executed_at") Instant executedAt,
        @JsonProperty("data_type") String dataType,
        RetentionAction action,
        @JsonProperty("items_processed") int itemsProcessed,
        @JsonProperty("bytes_freed") long bytesFreed,
        boolean success,
        String error
) {

    public RetentionResult failed(String message) {
        return toBuilder().success(false).error(message).build();
    }
}
