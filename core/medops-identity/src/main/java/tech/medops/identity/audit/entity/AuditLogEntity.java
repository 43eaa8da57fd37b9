package tech.medops.identity.audit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for audit_logs table.
 */
@Entity
@Table(name = "audit_logs")
public class AuditLogEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "tenant_id", length = 17)
    public String tenantId;

    @Column(name = "user_id", length = 17)
    public String userId;

    @Column(name = "action", nullable = false, length = 64)
    public String action;

    @Column(name = "entity_type", nullable = false, length = 32)
    public String entityType;

    @Column(name = "entity_id", length = 17)
    public String entityId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    public String metadata;

    @Column(name = "performed_at", nullable = false)
    public Instant performedAt;

    public AuditLogEntity() {
    }
}
