package tech.medops.identity.user.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.user.FailedLoginOutcome;
import tech.medops.identity.user.entity.UserEntity;

import java.time.Duration;
import java.time.Instant;

/**
 * Write-side repository for User entities.
 * Counter and lock changes are single UPDATE statements, never read-modify-write.
 */
@ApplicationScoped
@Transactional
public class UserWriteRepository implements PanacheRepositoryBase<UserEntity, String> {

    public FailedLoginOutcome recordFailedLogin(String userId, int threshold, Duration lockDuration, Instant now) {
        // A lapsed lock restarts the count; both CASE branches read the pre-update row
        int updated = getEntityManager().createQuery(
                "UPDATE UserEntity u SET " +
                "u.failedLoginCount = CASE WHEN u.lockedUntil IS NOT NULL AND u.lockedUntil <= :now " +
                "THEN 1 ELSE u.failedLoginCount + 1 END, " +
                "u.lockedUntil = CASE WHEN u.lockedUntil IS NOT NULL AND u.lockedUntil <= :now " +
                "THEN NULL ELSE u.lockedUntil END, " +
                "u.updatedAt = :now " +
                "WHERE u.id = :id")
            .setParameter("now", now)
            .setParameter("id", userId)
            .executeUpdate();
        if (updated == 0) {
            return new FailedLoginOutcome(0, null);
        }

        // Row is locked by the update above until commit, so this read is our own increment
        Integer count = getEntityManager().createQuery(
                "SELECT u.failedLoginCount FROM UserEntity u WHERE u.id = :id", Integer.class)
            .setParameter("id", userId)
            .getSingleResult();

        if (count < threshold) {
            return new FailedLoginOutcome(count, null);
        }

        Instant lockedUntil = now.plus(lockDuration);
        update("lockedUntil = :until, updatedAt = :now where id = :id",
            Parameters.with("until", lockedUntil).and("now", now).and("id", userId));
        return new FailedLoginOutcome(count, lockedUntil);
    }

    public void recordSuccessfulLogin(String userId, Instant now) {
        update("failedLoginCount = 0, lockedUntil = null, lastLoginAt = :now, updatedAt = :now where id = :id",
            Parameters.with("now", now).and("id", userId));
    }

    public void clearLockout(String userId, Instant now) {
        update("failedLoginCount = 0, lockedUntil = null, updatedAt = :now where id = :id",
            Parameters.with("now", now).and("id", userId));
    }

    public void updatePasswordHash(String userId, String passwordHash, Instant now) {
        update("passwordHash = :hash, updatedAt = :now where id = :id",
            Parameters.with("hash", passwordHash).and("now", now).and("id", userId));
    }

    public void updateRole(String userId, UserRole role, Instant now) {
        update("role = :role, updatedAt = :now where id = :id",
            Parameters.with("role", role).and("now", now).and("id", userId));
    }

    public void updateActive(String userId, boolean active, Instant now) {
        update("active = :active, updatedAt = :now where id = :id",
            Parameters.with("active", active).and("now", now).and("id", userId));
    }
}
