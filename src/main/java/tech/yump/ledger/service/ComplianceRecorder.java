package tech.yump.ledger.service;

import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.AppendOptions;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.LedgerEvent;
import tech.yump.ledger.event.LegalBasis;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.event.Resource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed shortcuts for the compliance events the application records most often.
 * Each method appends exactly one event to the compliance ledger and returns it.
 */
@Service
@RequiredArgsConstructor
public class ComplianceRecorder {

    private final Ledger ledger;

    public enum ConsentAction { GRANTED, REVOKED, UPDATED }

    public enum DataAccessAction { VIEW, EXPORT, DELETE, REQUEST }

    public enum AccessControlAction { LOGIN, LOGOUT, AUTH_FAILED, LOCKED_OUT }

    public enum RetentionEventAction { CLEANUP, ARCHIVE, DELETE }

    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }

    /**
     * GDPR Article 7: consent given, withdrawn or changed for the listed purposes.
     */
    public LedgerEvent logConsent(ConsentAction action, Actor actor, List<String> purposes, boolean success,
                                  @Nullable Map<String, Object> details) {
        Map<String, Object> merged = merge(details);
        merged.put("purposes", purposes);
        return ledger.append(EventCategory.CONSENT, "consent_" + lower(action), actor, Outcome.of(success),
                AppendOptions.builder()
                        .details(merged)
                        .legalBasis(LegalBasis.CONSENT)
                        .build());
    }

    public LedgerEvent logDataAccess(DataAccessAction action, Actor actor, String dataType, boolean success,
                                     @Nullable Map<String, Object> details) {
        return ledger.append(EventCategory.DATA_ACCESS, "data_" + lower(action), actor, Outcome.of(success),
                AppendOptions.builder()
                        .resource(Resource.of(dataType))
                        .details(details)
                        .build());
    }

    /**
     * GDPR Article 20: data handed over to the data subject.
     */
    public LedgerEvent logDataExport(Actor actor, List<String> dataTypes, boolean success,
                                     @Nullable Map<String, Object> details) {
        Map<String, Object> merged = merge(details);
        merged.put("data_types", dataTypes);
        return ledger.append(EventCategory.DATA_EXPORT, "data_portability_export", actor, Outcome.of(success),
                AppendOptions.builder()
                        .details(merged)
                        .legalBasis(LegalBasis.CONSENT)
                        .build());
    }

    /**
     * GDPR Article 17: erasure carried out.
     */
    public LedgerEvent logDataDeletion(Actor actor, String dataType, int itemCount, boolean success,
                                       @Nullable Map<String, Object> details) {
        Map<String, Object> merged = merge(details);
        merged.put("items_deleted", itemCount);
        return ledger.append(EventCategory.DATA_DELETION, "erasure_completed", actor, Outcome.of(success),
                AppendOptions.builder()
                        .resource(Resource.of(dataType))
                        .details(merged)
                        .build());
    }

    public LedgerEvent logSecurityIncident(String incidentType, Severity severity, @Nullable Map<String, Object> details) {
        Map<String, Object> merged = merge(details);
        merged.put("severity", lower(severity));
        return ledger.append(EventCategory.SECURITY_INCIDENT, incidentType, Actor.system(), Outcome.SUCCESS,
                AppendOptions.withDetails(merged));
    }

    /**
     * A configuration or policy setting changed from {@code oldValue} to {@code newValue}.
     */
    public LedgerEvent logPolicyChange(String setting, @Nullable Object oldValue, @Nullable Object newValue, Actor changedBy) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("old_value", oldValue);
        details.put("new_value", newValue);
        return ledger.append(EventCategory.POLICY_CHANGE, "configuration_changed", changedBy, Outcome.SUCCESS,
                AppendOptions.builder()
                        .resource(Resource.of("configuration", setting))
                        .details(details)
                        .build());
    }

    public LedgerEvent logAccessControl(AccessControlAction action, Actor actor, boolean success,
                                        @Nullable Map<String, Object> details) {
        return ledger.append(EventCategory.ACCESS_CONTROL, lower(action), actor, Outcome.of(success),
                AppendOptions.withDetails(details));
    }

    public LedgerEvent logRetention(RetentionEventAction action, String dataType, int itemCount,
                                    @Nullable Map<String, Object> details) {
        Map<String, Object> merged = merge(details);
        merged.put("items_affected", itemCount);
        return ledger.append(EventCategory.RETENTION, "retention_" + lower(action), Actor.system(), Outcome.SUCCESS,
                AppendOptions.builder()
                        .resource(Resource.of(dataType))
                        .details(merged)
                        .build());
    }

    public LedgerEvent logBreach(String breachType, Severity severity, boolean notificationSent,
                                 @Nullable Map<String, Object> details) {
        Map<String, Object> merged = merge(details);
        merged.put("severity", lower(severity));
        merged.put("notification_sent", notificationSent);
        return ledger.append(EventCategory.BREACH, breachType, Actor.system(), Outcome.SUCCESS,
                AppendOptions.withDetails(merged));
    }

    private static Map<String, Object> merge(@Nullable Map<String, Object> details) {
        return details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
