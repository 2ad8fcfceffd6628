package tech.yump.ledger.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.verify.IntegrityReport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerIntegrityHealthIndicatorTest {

    @Mock
    private Ledger complianceLedger;

    @InjectMocks
    private LedgerIntegrityHealthIndicator indicator;

    @Test
    @DisplayName("health: UP with counts when the chain verifies")
    void health_up() {
        when(complianceLedger.isEnabled()).thenReturn(true);
        when(complianceLedger.verifyIntegrity()).thenReturn(IntegrityReport.builder()
                .valid(true).totalEvents(3).validEvents(3).segmentsScanned(1).lastValidEventId("e3").build());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("total_events", 3)
                .containsEntry("last_valid_event_id", "e3")
                .doesNotContainKey("first_invalid_event_id");
    }

    @Test
    @DisplayName("health: DOWN naming the first invalid event when the chain is broken")
    void health_down() {
        when(complianceLedger.isEnabled()).thenReturn(true);
        when(complianceLedger.verifyIntegrity()).thenReturn(IntegrityReport.builder()
                .valid(false).totalEvents(3).validEvents(1).segmentsScanned(1)
                .lastValidEventId("e1").firstInvalidEventId("e2").build());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("valid_events", 1)
                .containsEntry("first_invalid_event_id", "e2");
    }

    @Test
    @DisplayName("health: UNKNOWN without verifying when the ledger is disabled")
    void health_disabled() {
        when(complianceLedger.isEnabled()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        verify(complianceLedger, never()).verifyIntegrity();
    }
}
