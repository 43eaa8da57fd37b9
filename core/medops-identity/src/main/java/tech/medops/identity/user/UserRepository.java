package tech.medops.identity.user;

import tech.medops.identity.authorization.UserRole;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Store operations for users. Soft-deleted users are invisible to every lookup.
 */
public interface UserRepository {

    Optional<User> findById(String id);

    /**
     * Find a user by phone.
     *
     * @param tenantId scope the lookup to one tenant; null searches all tenants
     *                 and returns the earliest-created match
     */
    Optional<User> findByPhone(String tenantId, String phone);

    boolean existsByPhone(String phone);

    boolean existsByEmail(String email);

    /**
     * Atomically increment the failed-login counter and return the new state.
     *
     * <p>When an earlier lock has already lapsed the counter restarts at 1.
     * When the counter reaches {@code threshold} the user is locked until
     * {@code now + lockDuration}. Concurrent calls never observe the same
     * post-increment value.
     */
    FailedLoginOutcome recordFailedLogin(String userId, int threshold, Duration lockDuration, Instant now);

    /**
     * Reset the failure counter, clear any lock and stamp the last login.
     */
    void recordSuccessfulLogin(String userId, Instant now);

    void clearLockout(String userId, Instant now);

    void updatePasswordHash(String userId, String passwordHash, Instant now);

    void updateRole(String userId, UserRole role, Instant now);

    void updateActive(String userId, boolean active, Instant now);
}
