package tech.medops.identity.tenant.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for user_branches table.
 */
@Entity
@Table(name = "user_branches", uniqueConstraints = @UniqueConstraint(name = "uq_user_branches_user_branch", columnNames = {"user_id", "branch_id"}))
public class UserBranchEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "tenant_id", nullable = false, length = 17)
    public String tenantId;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Column(name = "branch_id", nullable = false, length = 17)
    public String branchId;

    @Column(name = "is_primary", nullable = false)
    public boolean primary;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public UserBranchEntity() {
    }
}
