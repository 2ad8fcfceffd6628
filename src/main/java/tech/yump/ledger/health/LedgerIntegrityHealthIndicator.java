package tech.yump.ledger.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.verify.IntegrityReport;

/**
 * Reports DOWN as soon as the compliance ledger's hash chain no longer verifies.
 * Exposed as the {@code ledgerIntegrity} component of {@code /actuator/health}.
 */
@Component("ledgerIntegrity")
@RequiredArgsConstructor
public class LedgerIntegrityHealthIndicator implements HealthIndicator {

    private final Ledger complianceLedger;

    @Override
    public Health health() {
        if (!complianceLedger.isEnabled()) {
            return Health.unknown().withDetail("enabled", false).build();
        }
        IntegrityReport report = complianceLedger.verifyIntegrity();
        Health.Builder builder = report.valid() ? Health.up() : Health.down();
        builder.withDetail("total_events", report.totalEvents())
                .withDetail("valid_events", report.validEvents())
                .withDetail("segments_scanned", report.segmentsScanned());
        if (report.firstInvalidEventId() != null) {
            builder.withDetail("first_invalid_event_id", report.firstInvalidEventId());
        }
        if (report.lastValidEventId() != null) {
            builder.withDetail("last_valid_event_id", report.lastValidEventId());
        }
        return builder.build();
    }
}
