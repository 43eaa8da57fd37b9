package tech.medops.identity.tenant.mapper;

import tech.medops.identity.tenant.Branch;
import tech.medops.identity.tenant.UserBranch;
import tech.medops.identity.tenant.entity.BranchEntity;
import tech.medops.identity.tenant.entity.UserBranchEntity;

/**
 * Mapper for branches and branch assignments.
 */
public final class BranchMapper {

    private BranchMapper() {
    }

    public static BranchEntity toEntity(Branch domain) {
        if (domain == null) {
            return null;
        }

        BranchEntity entity = new BranchEntity();
        entity.id = domain.id;
        entity.tenantId = domain.tenantId;
        entity.name = domain.name;
        entity.code = domain.code;
        entity.active = domain.active;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }

    public static UserBranchEntity toEntity(UserBranch domain) {
        if (domain == null) {
            return null;
        }

        UserBranchEntity entity = new UserBranchEntity();
        entity.id = domain.id;
        entity.tenantId = domain.tenantId;
        entity.userId = domain.userId;
        entity.branchId = domain.branchId;
        entity.primary = domain.primary;
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
