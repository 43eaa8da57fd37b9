package tech.medops.identity.tenant.mapper;

import tech.medops.identity.tenant.Tenant;
import tech.medops.identity.tenant.entity.TenantEntity;

/**
 * Mapper for converting Tenant domain model to JPA entity.
 */
public final class TenantMapper {

    private TenantMapper() {
    }

    public static TenantEntity toEntity(Tenant domain) {
        if (domain == null) {
            return null;
        }

        TenantEntity entity = new TenantEntity();
        entity.id = domain.id;
        entity.name = domain.name;
        entity.slug = domain.slug;
        entity.email = domain.email;
        entity.phone = domain.phone;
        entity.subscriptionPlan = domain.subscriptionPlan;
        entity.status = domain.status;
        entity.trialEndsAt = domain.trialEndsAt;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }
}
