package tech.yump.ledger.retention;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RetentionStatus(
        @JsonProperty("total_policies") int totalPolicies,
        @JsonProperty("active_policies") int activePolicies,
        @JsonProperty("last_runs") Map<String, Instant> lastRuns,
        @JsonProperty("next_due") List<NextDue> nextDue
) {

    public record NextDue(
            @JsonProperty("policy_id") String policyId,
            @JsonProperty("policy_name") String policyName,
            @JsonProperty("due_in_days") double dueInDays
    ) {
    }
}
