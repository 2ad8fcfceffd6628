package tech.yump.ledger.audit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import tech.yump.ledger.event.Outcome;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogAuditBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private Logger auditLogger;
    private ListAppender<ILoggingEvent> appender;
    private LogAuditBackend backend;

    @BeforeEach
    void setUp() {
        auditLogger = (Logger) LoggerFactory.getLogger(LogAuditBackend.AUDIT_LOGGER_NAME);
        appender = new ListAppender<>();
        appender.start();
        auditLogger.addAppender(appender);
        backend = new LogAuditBackend(objectMapper);
    }

    @AfterEach
    void tearDown() {
        auditLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("logEvent: writes one JSON line to the audit logger, without null sections")
    void logEvent_writesJson() throws Exception {
        backend.logEvent(AuditEvent.builder()
                .timestamp(Instant.parse("2024-03-01T08:00:00Z"))
                .type("retention")
                .action("scheduled_run")
                .outcome(Outcome.SUCCESS)
                .authInfo(AuditEvent.AuthInfo.builder().principal(AuditEvent.AuthInfo.SYSTEM).build())
                .data(Map.of("policies_run", 2))
                .build());

        assertThat(appender.list).hasSize(1);
        String message = appender.list.get(0).getFormattedMessage();
        assertThat(message).doesNotContain("\n");

        JsonNode json = objectMapper.readTree(message);
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T08:00:00Z");
        assertThat(json.get("type").asText()).isEqualTo("retention");
        assertThat(json.get("outcome").asText()).isEqualTo("success");
        assertThat(json.at("/authInfo/principal").asText()).isEqualTo("system");
        assertThat(json.at("/data/policies_run").asInt()).isEqualTo(2);
        assertThat(json.has("requestInfo")).isFalse();
    }

    @Test
    @DisplayName("logEvent: null events are ignored")
    void logEvent_null() {
        backend.logEvent(null);

        assertThat(appender.list).isEmpty();
    }
}
