package tech.medops.identity.audit;

/**
 * Destination for audit events. Implementations may throw; {@link AuditService}
 * shields callers from any failure.
 */
public interface AuditSink {

    void write(AuditEvent event);
}
