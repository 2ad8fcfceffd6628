package tech.yump.ledger.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.ledger.api.ApiError;
import tech.yump.ledger.audit.AuditHelper;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.retention.BuiltInPolicies;
import tech.yump.ledger.retention.BuiltInPolicyException;
import tech.yump.ledger.retention.PolicyNotFoundException;
import tech.yump.ledger.retention.RetentionEngine;
import tech.yump.ledger.retention.RetentionPolicy;
import tech.yump.ledger.retention.RetentionPolicyStore;
import tech.yump.ledger.retention.RetentionPolicyUpdate;
import tech.yump.ledger.retention.RetentionResult;
import tech.yump.ledger.retention.RetentionStatus;
import tech.yump.ledger.service.ComplianceRecorder;

import java.util.List;
import java.util.Map;

/**
 * Retention policy management and on-demand runs. Every policy mutation is recorded as a
 * {@code policy_change} event in the compliance ledger.
 */
@RestController
@RequestMapping("/v1/retention")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Retention", description = "Retention policies and their execution")
public class RetentionController {

    private static final String POLICY_SETTING_PREFIX = "retention_policy:";

    private final RetentionPolicyStore policyStore;
    private final RetentionEngine retentionEngine;
    private final ComplianceRecorder complianceRecorder;
    private final AuditHelper auditHelper;

    @GetMapping("/policies")
    @Operation(summary = "List policies", description = "Built-in policies first, then user policies.")
    public List<RetentionPolicy> listPolicies() {
        List<RetentionPolicy> policies = policyStore.list();
        auditHelper.logHttpEvent("retention", "list_policies", Outcome.SUCCESS, HttpStatus.OK.value(), null,
                Map.of("count", policies.size()));
        return policies;
    }

    @GetMapping("/policies/{id}")
    @Operation(summary = "Get policy")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "The policy."),
            @ApiResponse(responseCode = "404", description = "No policy with this id.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public RetentionPolicy getPolicy(@Parameter(description = "Policy id", example = "policy_consent") @PathVariable String id) {
        RetentionPolicy policy = policyStore.get(id).orElseThrow(() -> new PolicyNotFoundException(id));
        auditHelper.logHttpEvent("retention", "get_policy", Outcome.SUCCESS, HttpStatus.OK.value(), null,
                Map.of("policy_id", id));
        return policy;
    }

    @PostMapping(value = "/policies", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create policy", description = "Stores a user policy under a generated id.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Policy created.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RetentionPolicy.class))),
            @ApiResponse(responseCode = "400", description = "Missing or invalid fields.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Token lacks RETENTION_ADMIN.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RetentionPolicy> createPolicy(@Valid @RequestBody RetentionPolicyRequest body,
                                                        HttpServletRequest request) {
        RetentionPolicy created = policyStore.add(body.toPolicy());
        complianceRecorder.logPolicyChange(POLICY_SETTING_PREFIX + created.id(), null, created,
                CallerActors.current(request));

        auditHelper.logHttpEvent("policy", "create_policy", Outcome.SUCCESS, HttpStatus.CREATED.value(), null,
                Map.of("policy_id", created.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping(value = "/policies/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update policy", description = "Partial update of a user policy. Built-in policies are read-only.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "The updated policy."),
            @ApiResponse(responseCode = "400", description = "The update leaves the policy invalid.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "No policy with this id.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "The policy is built in.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public RetentionPolicy updatePolicy(@PathVariable String id, @RequestBody RetentionPolicyUpdate update,
                                        HttpServletRequest request) {
        requireUserPolicy(id);
        RetentionPolicy before = policyStore.get(id).orElseThrow(() -> new PolicyNotFoundException(id));
        RetentionPolicy updated = policyStore.update(id, update).orElseThrow(() -> new PolicyNotFoundException(id));
        complianceRecorder.logPolicyChange(POLICY_SETTING_PREFIX + id, before, updated, CallerActors.current(request));

        auditHelper.logHttpEvent("policy", "update_policy", Outcome.SUCCESS, HttpStatus.OK.value(), null,
                Map.of("policy_id", id));
        return updated;
    }

    @DeleteMapping("/policies/{id}")
    @Operation(summary = "Delete policy", description = "Removes a user policy. Built-in policies cannot be removed.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Policy removed."),
            @ApiResponse(responseCode = "404", description = "No policy with this id.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "The policy is built in.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<Void> deletePolicy(@PathVariable String id, HttpServletRequest request) {
        requireUserPolicy(id);
        RetentionPolicy before = policyStore.get(id).orElseThrow(() -> new PolicyNotFoundException(id));
        if (!policyStore.remove(id)) {
            throw new PolicyNotFoundException(id);
        }
        complianceRecorder.logPolicyChange(POLICY_SETTING_PREFIX + id, before, null, CallerActors.current(request));

        auditHelper.logHttpEvent("policy", "delete_policy", Outcome.SUCCESS, HttpStatus.NO_CONTENT.value(), null,
                Map.of("policy_id", id));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/policies/{id}/run")
    @Operation(summary = "Run policy now", description = "Executes one policy regardless of its schedule.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "One result per data type of the policy."),
            @ApiResponse(responseCode = "404", description = "No policy with this id.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public List<RetentionResult> runPolicy(@PathVariable String id) {
        List<RetentionResult> results = retentionEngine.forceRunPolicy(id)
                .orElseThrow(() -> new PolicyNotFoundException(id));
        boolean allSucceeded = results.stream().allMatch(RetentionResult::success);
        auditHelper.logHttpEvent("retention", "force_run", Outcome.of(allSucceeded), HttpStatus.OK.value(), null,
                Map.of("policy_id", id, "items_processed", results.stream().mapToInt(RetentionResult::itemsProcessed).sum()));
        return results;
    }

    @PostMapping("/run")
    @Operation(summary = "Run due policies", description = "Executes every policy whose schedule is due.")
    public List<RetentionResult> runDuePolicies() {
        List<RetentionResult> results = retentionEngine.runDuePolicies();
        boolean allSucceeded = results.stream().allMatch(RetentionResult::success);
        auditHelper.logHttpEvent("retention", "run_due", Outcome.of(allSucceeded), HttpStatus.OK.value(), null,
                Map.of("results", results.size()));
        return results;
    }

    @GetMapping("/status")
    @Operation(summary = "Retention status", description = "Policy counts, last runs and days until each policy is due.")
    public RetentionStatus status() {
        RetentionStatus status = retentionEngine.getStatus();
        auditHelper.logHttpEvent("retention", "status", Outcome.SUCCESS, HttpStatus.OK.value(), null, null);
        return status;
    }

    private static void requireUserPolicy(String id) {
        if (BuiltInPolicies.isBuiltIn(id)) {
            log.warn("Rejected change to built-in retention policy '{}'", id);
            throw new BuiltInPolicyException(id);
        }
    }
}
