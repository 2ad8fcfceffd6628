package tech.yump.ledger.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.auth.LedgerAuthority;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.AppendOptions;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.event.Resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Records audit events in a dedicated, hash-chained audit ledger so the operational trail is as
 * tamper-evident as the compliance one.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerAuditBackend implements AuditBackend {

    private final Ledger auditLedger;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }
        // Detail keys must not contain "auth", "token" or "key": the sanitizer redacts such keys.
        Map<String, Object> details = new LinkedHashMap<>();
        Resource resource = null;
        if (event.requestInfo() != null) {
            AuditEvent.RequestInfo request = event.requestInfo();
            resource = Resource.of("http_request", request.path());
            details.put("request_id", request.requestId());
            details.put("method", request.httpMethod());
        }
        if (event.responseInfo() != null) {
            details.put("status_code", event.responseInfo().statusCode());
        }
        if (event.authInfo() != null && event.authInfo().authorities() != null) {
            details.put("roles", event.authInfo().authorities());
        }
        if (event.data() != null) {
            details.putAll(event.data());
        }
        details.values().removeIf(Objects::isNull);

        auditLedger.append(
                categoryOf(event.type()),
                event.type() + "_" + event.action(),
                actorOf(event.authInfo()),
                event.outcome() == null ? Outcome.SUCCESS : event.outcome(),
                AppendOptions.builder()
                        .resource(resource)
                        .details(details)
                        .failureReason(event.responseInfo() != null ? event.responseInfo().errorMessage() : null)
                        .build());
    }

    static EventCategory categoryOf(String type) {
        if (type == null) {
            return EventCategory.DATA_PROCESSING;
        }
        return switch (type) {
            case "auth" -> EventCategory.ACCESS_CONTROL;
            case "ledger" -> EventCategory.DATA_ACCESS;
            case "retention" -> EventCategory.RETENTION;
            case "policy" -> EventCategory.POLICY_CHANGE;
            default -> EventCategory.DATA_PROCESSING;
        };
    }

    static Actor actorOf(AuditEvent.AuthInfo authInfo) {
        if (authInfo == null || authInfo.principal() == null || AuditEvent.AuthInfo.SYSTEM.equals(authInfo.principal())) {
            return Actor.system();
        }
        boolean admin = authInfo.authorities() != null
                && authInfo.authorities().contains(LedgerAuthority.RETENTION_ADMIN.name());
        return Actor.builder()
                .type(admin ? Actor.Type.ADMIN : Actor.Type.USER)
                .id(authInfo.principal())
                .ip(authInfo.sourceAddress())
                .build();
    }
}
