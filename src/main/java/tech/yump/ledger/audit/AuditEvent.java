package tech.yump.ledger.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import tech.yump.ledger.event.Outcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One operational audit entry: who called what, and how it ended.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // "auth", "ledger", "retention", "policy", "request_error"
        String action,          // "token_validation", "append", "run_due", ...
        Outcome outcome,

        AuthInfo authInfo,

        RequestInfo requestInfo,

        ResponseInfo responseInfo,

        Map<String, Object> data
) {

    /**
     * The caller. {@code principal} is the static token mapping name, "anonymous" or "system".
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress,
            List<String> authorities
    ) {
        public static final String SYSTEM = "system";
        public static final String ANONYMOUS = "anonymous";
    }

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
