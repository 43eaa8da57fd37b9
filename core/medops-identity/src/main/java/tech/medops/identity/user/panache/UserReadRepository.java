package tech.medops.identity.user.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.user.FailedLoginOutcome;
import tech.medops.identity.user.User;
import tech.medops.identity.user.UserRepository;
import tech.medops.identity.user.entity.UserEntity;
import tech.medops.identity.user.mapper.UserMapper;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Read-side repository for User entities.
 * Uses EntityManager directly to return domain objects; writes go through
 * {@link UserWriteRepository}.
 */
@ApplicationScoped
public class UserReadRepository implements UserRepository {

    @Inject
    EntityManager em;

    @Inject
    UserWriteRepository writeRepo;

    @Override
    public Optional<User> findById(String id) {
        UserEntity entity = em.find(UserEntity.class, id);
        if (entity == null || entity.deletedAt != null) {
            return Optional.empty();
        }
        return Optional.of(UserMapper.toDomain(entity));
    }

    @Override
    public Optional<User> findByPhone(String tenantId, String phone) {
        if (tenantId != null) {
            return em.createQuery(
                    "FROM UserEntity WHERE tenantId = :tenantId AND phone = :phone AND deletedAt IS NULL",
                    UserEntity.class)
                .setParameter("tenantId", tenantId)
                .setParameter("phone", phone)
                .getResultStream()
                .findFirst()
                .map(UserMapper::toDomain);
        }
        return em.createQuery(
                "FROM UserEntity WHERE phone = :phone AND deletedAt IS NULL ORDER BY createdAt ASC",
                UserEntity.class)
            .setParameter("phone", phone)
            .setMaxResults(1)
            .getResultStream()
            .findFirst()
            .map(UserMapper::toDomain);
    }

    @Override
    public boolean existsByPhone(String phone) {
        return em.createQuery(
                "SELECT COUNT(u) FROM UserEntity u WHERE u.phone = :phone AND u.deletedAt IS NULL", Long.class)
            .setParameter("phone", phone)
            .getSingleResult() > 0;
    }

    @Override
    public boolean existsByEmail(String email) {
        return em.createQuery(
                "SELECT COUNT(u) FROM UserEntity u WHERE lower(u.email) = lower(:email) AND u.deletedAt IS NULL", Long.class)
            .setParameter("email", email)
            .getSingleResult() > 0;
    }

    @Override
    public FailedLoginOutcome recordFailedLogin(String userId, int threshold, Duration lockDuration, Instant now) {
        return writeRepo.recordFailedLogin(userId, threshold, lockDuration, now);
    }

    @Override
    public void recordSuccessfulLogin(String userId, Instant now) {
        writeRepo.recordSuccessfulLogin(userId, now);
    }

    @Override
    public void clearLockout(String userId, Instant now) {
        writeRepo.clearLockout(userId, now);
    }

    @Override
    public void updatePasswordHash(String userId, String passwordHash, Instant now) {
        writeRepo.updatePasswordHash(userId, passwordHash, now);
    }

    @Override
    public void updateRole(String userId, UserRole role, Instant now) {
        writeRepo.updateRole(userId, role, now);
    }

    @Override
    public void updateActive(String userId, boolean active, Instant now) {
        writeRepo.updateActive(userId, active, now);
    }
}
