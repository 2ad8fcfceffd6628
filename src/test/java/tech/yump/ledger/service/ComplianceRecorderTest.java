package tech.yump.ledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.ledger.chain.HashChainer;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.core.LedgerQuery;
import tech.yump.ledger.core.LedgerSettings;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.EventSanitizer;
import tech.yump.ledger.event.LedgerEvent;
import tech.yump.ledger.event.LedgerJson;
import tech.yump.ledger.event.LegalBasis;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.event.Resource;
import tech.yump.ledger.storage.FileSystemSegmentStore;
import tech.yump.ledger.support.MutableClock;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceRecorderTest {

    @TempDir
    Path tempDir;

    private Ledger ledger;
    private ComplianceRecorder recorder;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = LedgerJson.newObjectMapper();
        MutableClock clock = MutableClock.at("2024-02-10T09:30:00Z");
        ledger = Ledger.open(new LedgerSettings("compliance", true, 7),
                new FileSystemSegmentStore(tempDir, "events", objectMapper, clock),
                new HashChainer(objectMapper), new EventSanitizer(objectMapper, 1000), objectMapper, clock);
        recorder = new ComplianceRecorder(ledger);
    }

    @Test
    @DisplayName("logConsent: consent category, consent legal basis and the purposes")
    void logConsent() {
        LedgerEvent event = recorder.logConsent(ComplianceRecorder.ConsentAction.GRANTED, Actor.user("alice", null),
                List.of("analytics", "marketing"), true, Map.of("source", "banner"));

        assertThat(event.category()).isEqualTo(EventCategory.CONSENT);
        assertThat(event.eventType()).isEqualTo("consent_granted");
        assertThat(event.legalBasis()).isEqualTo(LegalBasis.CONSENT);
        assertThat(event.details())
                .containsEntry("purposes", List.of("analytics", "marketing"))
                .containsEntry("source", "banner");
    }

    @Test
    @DisplayName("logDataAccess and logDataDeletion: the data type becomes the resource")
    void dataSubjectEvents() {
        LedgerEvent access = recorder.logDataAccess(ComplianceRecorder.DataAccessAction.EXPORT, Actor.user("bob", null),
                "profile", false, null);
        LedgerEvent deletion = recorder.logDataDeletion(Actor.admin("ops"), "profile", 12, true, null);

        assertThat(access.eventType()).isEqualTo("data_export");
        assertThat(access.outcome()).isEqualTo(Outcome.FAILURE);
        assertThat(access.resource()).isEqualTo(Resource.of("profile"));
        assertThat(deletion.category()).isEqualTo(EventCategory.DATA_DELETION);
        assertThat(deletion.eventType()).isEqualTo("erasure_completed");
        assertThat(deletion.details()).containsEntry("items_deleted", 12);
    }

    @Test
    @DisplayName("logPolicyChange: old and new values under a configuration resource")
    void logPolicyChange() {
        LedgerEvent event = recorder.logPolicyChange("retention_years", 7, 10, Actor.admin("ops"));

        assertThat(event.category()).isEqualTo(EventCategory.POLICY_CHANGE);
        assertThat(event.eventType()).isEqualTo("configuration_changed");
        assertThat(event.resource()).isEqualTo(Resource.of("configuration", "retention_years"));
        assertThat(event.details()).containsEntry("old_value", 7).containsEntry("new_value", 10);
        assertThat(event.actor().type()).isEqualTo(Actor.Type.ADMIN);
    }

    @Test
    @DisplayName("logBreach and logSecurityIncident: system actor with a lower-case severity")
    void incidents() {
        LedgerEvent breach = recorder.logBreach("unauthorized_disclosure", ComplianceRecorder.Severity.HIGH, true, null);
        LedgerEvent incident = recorder.logSecurityIncident("brute_force", ComplianceRecorder.Severity.MEDIUM, Map.of("attempts", 20));

        assertThat(breach.actor()).isEqualTo(Actor.system());
        assertThat(breach.details()).containsEntry("severity", "high").containsEntry("notification_sent", true);
        assertThat(incident.category()).isEqualTo(EventCategory.SECURITY_INCIDENT);
        assertThat(incident.details()).containsEntry("severity", "medium").containsEntry("attempts", 20);
    }

    @Test
    @DisplayName("every recorded event lands in one valid chain")
    void eventsAreChained() {
        recorder.logAccessControl(ComplianceRecorder.AccessControlAction.LOGIN, Actor.user("alice", "10.0.0.1"), true, null);
        recorder.logRetention(ComplianceRecorder.RetentionEventAction.DELETE, "session_state", 4, null);
        recorder.logDataExport(Actor.user("alice", null), List.of("profile", "orders"), true, null);

        assertThat(ledger.read(LedgerQuery.latest(10))).extracting(LedgerEvent::eventType)
                .containsExactly("data_portability_export", "retention_delete", "login");
        assertThat(ledger.verifyIntegrity().valid()).isTrue();
    }
}
