package tech.medops.identity.tenant.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.medops.identity.tenant.BranchMembership;
import tech.medops.identity.tenant.BranchRepository;
import tech.medops.identity.tenant.entity.BranchEntity;

import java.util.List;

/**
 * Panache-based implementation of BranchRepository.
 */
@ApplicationScoped
public class PanacheBranchRepository
    implements BranchRepository, PanacheRepositoryBase<BranchEntity, String> {

    @Override
    public List<BranchMembership> findMembershipsForUser(String userId) {
        return getEntityManager().createQuery(
                "SELECT new tech.medops.identity.tenant.BranchMembership(ub.id, b.id, b.name, b.code, ub.primary) " +
                "FROM UserBranchEntity ub, BranchEntity b " +
                "WHERE b.id = ub.branchId AND ub.userId = :userId AND b.active = true " +
                "ORDER BY ub.primary DESC, b.name ASC",
                BranchMembership.class)
            .setParameter("userId", userId)
            .getResultList();
    }
}
