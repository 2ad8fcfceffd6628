package tech.yump.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.ledger.audit.AuditBackend;
import tech.yump.ledger.audit.LedgerAuditBackend;
import tech.yump.ledger.audit.LogAuditBackend;
import tech.yump.ledger.chain.HashChainer;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.core.LedgerSettings;
import tech.yump.ledger.event.EventSanitizer;
import tech.yump.ledger.event.LedgerJson;
import tech.yump.ledger.storage.FileSystemSegmentStore;

import java.time.Clock;

/**
 * Selects the operational audit backend from {@code ledger.audit.backend}.
 */
@Configuration
@Slf4j
public class AuditConfiguration {

    @Bean
    @ConditionalOnProperty(name = LedgerProperties.AuditProperties.BACKEND_PROPERTY, havingValue = "slf4j")
    public AuditBackend logAuditBackend(ObjectMapper objectMapper) {
        log.info("Configuring SLF4J audit backend (logger '{}')", LogAuditBackend.AUDIT_LOGGER_NAME);
        return new LogAuditBackend(objectMapper);
    }

    /**
     * Audit events go to their own ledger instance, separate from the compliance ledger and not exposed as
     * a bean, so it cannot be injected where the compliance ledger is expected.
     */
    @Bean
    @ConditionalOnProperty(name = LedgerProperties.AuditProperties.BACKEND_PROPERTY, havingValue = "ledger", matchIfMissing = true)
    public AuditBackend ledgerAuditBackend(LedgerProperties properties,
                                           HashChainer hashChainer,
                                           EventSanitizer eventSanitizer,
                                           Clock clock) {
        log.info("Configuring ledger audit backend at {}", properties.auditDirectory());
        Ledger auditLedger = Ledger.open(
                new LedgerSettings("audit", properties.enabled(), properties.retentionYears()),
                new FileSystemSegmentStore(properties.auditDirectory(), properties.audit().prefix(), LedgerJson.newObjectMapper(), clock),
                hashChainer,
                eventSanitizer,
                LedgerJson.newObjectMapper(),
                clock);
        return new LedgerAuditBackend(auditLedger);
    }
}
