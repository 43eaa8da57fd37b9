package tech.medops.identity.user.mapper;

import tech.medops.identity.user.User;
import tech.medops.identity.user.entity.UserEntity;

/**
 * Mapper for converting between User domain model and JPA entity.
 */
public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }

        User domain = new User();
        domain.id = entity.id;
        domain.tenantId = entity.tenantId;
        domain.name = entity.name;
        domain.email = entity.email;
        domain.phone = entity.phone;
        domain.passwordHash = entity.passwordHash;
        domain.role = entity.role;
        domain.avatarUrl = entity.avatarUrl;
        domain.active = entity.active;
        domain.failedLoginCount = entity.failedLoginCount;
        domain.lockedUntil = entity.lockedUntil;
        domain.lastLoginAt = entity.lastLoginAt;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        domain.deletedAt = entity.deletedAt;
        return domain;
    }

    public static UserEntity toEntity(User domain) {
        if (domain == null) {
            return null;
        }

        UserEntity entity = new UserEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        entity.failedLoginCount = domain.failedLoginCount;
        entity.lockedUntil = domain.lockedUntil;
        entity.lastLoginAt = domain.lastLoginAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy mutable profile fields. Lockout counters are left to the atomic
     * repository updates.
     */
    public static void updateEntity(UserEntity entity, User domain) {
        entity.tenantId = domain.tenantId;
        entity.name = domain.name;
        entity.email = domain.email;
        entity.phone = domain.phone;
        entity.passwordHash = domain.passwordHash;
        entity.role = domain.role;
        entity.avatarUrl = domain.avatarUrl;
        entity.active = domain.active;
        entity.updatedAt = domain.updatedAt;
        entity.deletedAt = domain.deletedAt;
    }
}
