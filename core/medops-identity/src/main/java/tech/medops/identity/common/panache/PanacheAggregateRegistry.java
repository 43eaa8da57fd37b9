package tech.medops.identity.common.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.medops.identity.tenant.Branch;
import tech.medops.identity.tenant.Tenant;
import tech.medops.identity.tenant.UserBranch;
import tech.medops.identity.tenant.mapper.BranchMapper;
import tech.medops.identity.tenant.mapper.TenantMapper;
import tech.medops.identity.user.PasswordHistory;
import tech.medops.identity.user.User;
import tech.medops.identity.user.entity.UserEntity;
import tech.medops.identity.user.mapper.PasswordHistoryMapper;
import tech.medops.identity.user.mapper.UserMapper;

import java.time.Clock;
import java.time.Instant;

/**
 * Registry for persisting aggregates within the caller's transaction.
 *
 * <p>All operations use the injected EntityManager so they participate in the
 * surrounding JTA transaction.
 */
@ApplicationScoped
public class PanacheAggregateRegistry {

    @Inject
    EntityManager em;

    @Inject
    Clock clock;

    /**
     * Persist an aggregate (insert, or update for users) within the current transaction.
     *
     * @throws IllegalArgumentException for a null or unregistered aggregate type
     */
    public void persist(Object aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("Aggregate cannot be null");
        }

        Instant now = clock.instant();
        Class<?> clazz = aggregate.getClass();

        if (clazz == Tenant.class) {
            Tenant tenant = (Tenant) aggregate;
            if (tenant.createdAt == null) {
                tenant.createdAt = now;
            }
            tenant.updatedAt = now;
            em.persist(TenantMapper.toEntity(tenant));
        } else if (clazz == Branch.class) {
            Branch branch = (Branch) aggregate;
            if (branch.createdAt == null) {
                branch.createdAt = now;
            }
            branch.updatedAt = now;
            em.persist(BranchMapper.toEntity(branch));
        } else if (clazz == UserBranch.class) {
            UserBranch membership = (UserBranch) aggregate;
            if (membership.createdAt == null) {
                membership.createdAt = now;
            }
            em.persist(BranchMapper.toEntity(membership));
        } else if (clazz == User.class) {
            persistUser((User) aggregate, now);
        } else if (clazz == PasswordHistory.class) {
            PasswordHistory entry = (PasswordHistory) aggregate;
            if (entry.createdAt == null) {
                entry.createdAt = now;
            }
            em.persist(PasswordHistoryMapper.toEntity(entry));
        } else {
            throw new IllegalArgumentException("Unknown aggregate type: " + clazz.getName() +
                ". Register it in PanacheAggregateRegistry.");
        }
    }

    private void persistUser(User user, Instant now) {
        if (user.createdAt == null) {
            user.createdAt = now;
        }
        user.updatedAt = now;

        UserEntity existing = em.find(UserEntity.class, user.id);
        if (existing == null) {
            em.persist(UserMapper.toEntity(user));
        } else {
            UserMapper.updateEntity(existing, user);
        }
    }
}
