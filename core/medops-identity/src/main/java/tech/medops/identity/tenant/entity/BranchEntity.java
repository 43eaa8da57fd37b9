package tech.medops.identity.tenant.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for branches table.
 */
@Entity
@Table(name = "branches")
public class BranchEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "tenant_id", nullable = false, length = 17)
    public String tenantId;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "code", nullable = false, length = 20)
    public String code;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public BranchEntity() {
    }
}
