package tech.yump.bootstrap.audit;

/**
 * Interface for audit logging backends.
 */
public interface AuditBackend {

    /**
     * Records a given audit event.
     * Implementations determine how the event is persisted (console, file, ...).
     *
     * @param event The AuditEvent to log. Must not be null.
     */
    void logEvent(AuditEvent event);

}
