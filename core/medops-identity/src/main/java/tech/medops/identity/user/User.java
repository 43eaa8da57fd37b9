package tech.medops.identity.user;

import tech.medops.identity.authorization.UserRole;

import java.time.Instant;

/**
 * Staff member of a tenant. Identified by (tenantId, phone).
 *
 * <p>Users are never hard-deleted: removal sets {@link #deletedAt} and
 * deactivation clears {@link #active}.
 */
public class User {

    public String id;

    public String tenantId;

    public String name;

    public String email;

    public String phone;

    /**
     * Argon2id hash in PHC format. Never logged or returned to callers.
     */
    public String passwordHash;

    public UserRole role;

    public String avatarUrl;

    public boolean active = true;

    public int failedLoginCount;

    /**
     * Login is refused until this instant. Null when not locked.
     */
    public Instant lockedUntil;

    public Instant lastLoginAt;

    public Instant createdAt;

    public Instant updatedAt;

    public Instant deletedAt;

    public User() {
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
