package tech.yump.ledger.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.net.URI;

/**
 * Documentation shape of the RFC 7807 problem bodies returned on errors.
 */
@Schema(description = "RFC 7807 problem detail returned for every error")
public record ApiError(
        @Schema(description = "Problem type.", example = "about:blank")
        URI type,
        @Schema(description = "Short summary of the problem.", example = "Policy Not Found", requiredMode = Schema.RequiredMode.REQUIRED)
        String title,
        @Schema(description = "HTTP status code.", example = "404", requiredMode = Schema.RequiredMode.REQUIRED)
        int status,
        @Schema(description = "Explanation specific to this occurrence.", example = "Retention policy not found: policy_1a2b3c4d")
        String detail,
        @Schema(description = "Request path.", example = "/v1/retention/policies/policy_1a2b3c4d")
        URI instance
) {
}
