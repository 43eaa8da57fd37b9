package tech.medops.identity.user.mapper;

import tech.medops.identity.user.PasswordHistory;
import tech.medops.identity.user.entity.PasswordHistoryEntity;

public final class PasswordHistoryMapper {

    private PasswordHistoryMapper() {
    }

    public static PasswordHistoryEntity toEntity(PasswordHistory domain) {
        if (domain == null) {
            return null;
        }
        PasswordHistoryEntity entity = new PasswordHistoryEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.passwordHash = domain.passwordHash;
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
