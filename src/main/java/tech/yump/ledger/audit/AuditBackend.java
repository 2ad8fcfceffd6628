package tech.yump.ledger.audit;

/**
 * Destination of operational audit events (API calls, authentication attempts, scheduled runs).
 */
public interface AuditBackend {

    /**
     * Records an audit event. Implementations decide where it goes (application log, audit ledger).
     *
     * @param event the event to record. Null events are ignored.
     */
    void logEvent(AuditEvent event);

}
