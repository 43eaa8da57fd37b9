package tech.medops.identity.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Best-effort audit recording.
 *
 * <p>A failing sink never aborts the operation that produced the event: the
 * failure is logged and the caller carries on.
 */
@ApplicationScoped
public class AuditService {

    private static final Logger LOG = Logger.getLogger(AuditService.class);

    private final AuditSink sink;
    private final Clock clock;

    @Inject
    public AuditService(AuditSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    public void recordEvent(String tenantId, String userId, String action,
                            String entityType, String entityId, Map<String, Object> metadata) {
        AuditEvent event = new AuditEvent(tenantId, userId, action, entityType, entityId,
            withoutNulls(metadata), clock.instant());
        try {
            sink.write(event);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record audit event [%s] for %s %s", action, entityType, entityId);
        }
    }

    public void recordEvent(String tenantId, String userId, String action, String entityType, String entityId) {
        recordEvent(tenantId, userId, action, entityType, entityId, Map.of());
    }

    // Map.copyOf rejects null values; callers pass optional request metadata freely
    private static Map<String, Object> withoutNulls(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new HashMap<>();
        metadata.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
