package tech.medops.identity.otp.mapper;

import tech.medops.identity.otp.OtpCode;
import tech.medops.identity.otp.entity.OtpCodeEntity;

/**
 * Mapper for converting between OtpCode domain model and JPA entity.
 */
public final class OtpCodeMapper {

    private OtpCodeMapper() {
    }

    public static OtpCode toDomain(OtpCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        OtpCode domain = new OtpCode();
        domain.id = entity.id;
        domain.phone = entity.phone;
        domain.tenantId = entity.tenantId;
        domain.purpose = entity.purpose;
        domain.codeHash = entity.codeHash;
        domain.attempts = entity.attempts;
        domain.expiresAt = entity.expiresAt;
        domain.consumedAt = entity.consumedAt;
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static OtpCodeEntity toEntity(OtpCode domain) {
        if (domain == null) {
            return null;
        }

        OtpCodeEntity entity = new OtpCodeEntity();
        entity.id = domain.id;
        entity.phone = domain.phone;
        entity.tenantId = domain.tenantId;
        entity.purpose = domain.purpose;
        entity.codeHash = domain.codeHash;
        entity.attempts = domain.attempts;
        entity.expiresAt = domain.expiresAt;
        entity.consumedAt = domain.consumedAt;
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
