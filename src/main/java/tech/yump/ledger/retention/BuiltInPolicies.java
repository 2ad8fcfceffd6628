package tech.yump.ledger.retention;

import java.util.List;

/**
 * Policies that are always in force. They cannot be updated or removed, and their ids are reserved.
 */
public final class BuiltInPolicies {

    public static final String AUDIT_LOGS = "policy_audit_logs";
    public static final String CONSENT = "policy_consent";
    public static final String SESSION = "policy_session";
    public static final String BROWSER_CACHE = "policy_browser_cache";
    public static final String ERROR_LOGS = "policy_error_logs";

    private static final int SEVEN_YEARS = 2555;

    private static final List<RetentionPolicy> POLICIES = List.of(
            RetentionPolicy.builder()
                    .id(AUDIT_LOGS)
                    .name("Audit Log Retention")
                    .dataTypes(List.of("audit_logs", "compliance_events", "security_logs"))
                    .classifications(List.of(DataClassification.REGULATED))
                    .retentionDays(SEVEN_YEARS)
                    .action(RetentionAction.ARCHIVE)
                    .schedule(RetentionSchedule.MONTHLY)
                    .regulatoryRequirement("CSSF Circular 20/750")
                    .build(),
            RetentionPolicy.builder()
                    .id(CONSENT)
                    .name("Consent Record Retention")
                    .dataTypes(List.of("consent_records"))
                    .retentionDays(SEVEN_YEARS)
                    .action(RetentionAction.ARCHIVE)
                    .schedule(RetentionSchedule.MONTHLY)
                    .regulatoryRequirement("GDPR Article 7")
                    .build(),
            RetentionPolicy.builder()
                    .id(SESSION)
                    .name("Session Data Cleanup")
                    .dataTypes(List.of("session_state", "browser_local_storage"))
                    .retentionDays(1)
                    .action(RetentionAction.DELETE)
                    .schedule(RetentionSchedule.DAILY)
                    .build(),
            RetentionPolicy.builder()
                    .id(BROWSER_CACHE)
                    .name("Browser Cache Cleanup")
                    .dataTypes(List.of("browser_cache"))
                    .retentionDays(7)
                    .action(RetentionAction.DELETE)
                    .schedule(RetentionSchedule.WEEKLY)
                    .build(),
            RetentionPolicy.builder()
                    .id(ERROR_LOGS)
                    .name("Error Log Cleanup")
                    .dataTypes(List.of("error_logs"))
                    .retentionDays(30)
                    .action(RetentionAction.DELETE)
                    .schedule(RetentionSchedule.MONTHLY)
                    .build()
    );

    private BuiltInPolicies() {
    }

    public static List<RetentionPolicy> all() {
        return POLICIES;
    }

    public static boolean isBuiltIn(String id) {
        return id != null && POLICIES.stream().anyMatch(p -> p.id().equals(id));
    }
}
