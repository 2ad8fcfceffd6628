package tech.yump.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as single-line JSON to a dedicated logger, {@value #AUDIT_LOGGER_NAME}, which
 * {@code logback-spring.xml} can route to its own appender.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER_NAME = "tech.yump.ledger.AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            // Serialization problems go to the application log so the audit stream stays pure JSON.
            log.error("Failed to serialize audit event {}/{}", event.type(), event.action(), e);
            return;
        }
        auditLogger.info(json);
    }
}
