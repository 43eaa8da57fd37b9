package tech.medops.identity.audit.panache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import tech.medops.identity.audit.AuditEvent;
import tech.medops.identity.audit.AuditSink;
import tech.medops.identity.audit.entity.AuditLogEntity;
import tech.medops.identity.shared.EntityType;
import tech.medops.identity.shared.TsidGenerator;

import java.io.UncheckedIOException;

/**
 * Writes audit events to the audit_logs table.
 *
 * <p>Runs in its own transaction so a failed primary operation still leaves
 * its audit trail, and a failed audit insert never rolls back the caller.
 */
@ApplicationScoped
public class PanacheAuditLogSink implements AuditSink, PanacheRepositoryBase<AuditLogEntity, String> {

    @Inject
    ObjectMapper objectMapper;

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void write(AuditEvent event) {
        AuditLogEntity entity = new AuditLogEntity();
        entity.id = TsidGenerator.generate(EntityType.AUDIT_LOG);
        entity.tenantId = event.tenantId();
        entity.userId = event.userId();
        entity.action = event.action();
        entity.entityType = event.entityType();
        entity.entityId = event.entityId();
        entity.performedAt = event.occurredAt();
        try {
            entity.metadata = objectMapper.writeValueAsString(event.metadata());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Audit metadata is not serializable", e);
        }
        persist(entity);
    }
}
