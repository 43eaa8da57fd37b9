package tech.medops.identity.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One audit trail entry as handed to an {@link AuditSink}.
 *
 * @param tenantId   tenant the action happened in; null for platform-level events
 * @param userId     acting user, when known
 * @param entityId   affected record, when there is one
 * @param metadata   free-form context; never contains secrets
 */
public record AuditEvent(
    String tenantId,
    String userId,
    String action,
    String entityType,
    String entityId,
    Map<String, Object> metadata,
    Instant occurredAt
) {
    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
