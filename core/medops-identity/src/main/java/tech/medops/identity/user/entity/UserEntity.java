package tech.medops.identity.user.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import tech.medops.identity.authorization.UserRole;

import java.time.Instant;

/**
 * JPA entity for users table.
 */
@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = "uq_users_tenant_phone", columnNames = {"tenant_id", "phone"}))
public class UserEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "tenant_id", nullable = false, length = 17)
    public String tenantId;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "email")
    public String email;

    @Column(name = "phone", nullable = false, length = 20)
    public String phone;

    @Column(name = "password_hash", nullable = false)
    public String passwordHash;

    @Column(name = "role", nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    public UserRole role;

    @Column(name = "avatar_url")
    public String avatarUrl;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "failed_login_count", nullable = false)
    public int failedLoginCount;

    @Column(name = "locked_until")
    public Instant lockedUntil;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    @Column(name = "deleted_at")
    public Instant deletedAt;

    public UserEntity() {
    }
}
