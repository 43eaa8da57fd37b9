package tech.medops.identity.authentication.token.mapper;

import tech.medops.identity.authentication.token.RefreshToken;
import tech.medops.identity.authentication.token.entity.RefreshTokenEntity;

/**
 * Mapper for converting between RefreshToken domain model and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken domain = new RefreshToken();
        domain.tokenHash = entity.tokenHash;
        domain.userId = entity.userId;
        domain.tenantId = entity.tenantId;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.revokedAt = entity.revokedAt;
        domain.replacedBy = entity.replacedBy;
        domain.ipAddress = entity.ipAddress;
        domain.userAgent = entity.userAgent;
        return domain;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.tokenHash = domain.tokenHash;
        entity.userId = domain.userId;
        entity.tenantId = domain.tenantId;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.revokedAt = domain.revokedAt;
        entity.replacedBy = domain.replacedBy;
        entity.ipAddress = domain.ipAddress;
        entity.userAgent = domain.userAgent;
        return entity;
    }
}
