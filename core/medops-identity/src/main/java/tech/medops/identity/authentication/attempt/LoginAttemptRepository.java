package tech.medops.identity.authentication.attempt;

import java.time.Instant;

/**
 * Write-only log of login attempts.
 */
public interface LoginAttemptRepository {

    void record(LoginAttempt attempt);

    long deleteOlderThan(Instant cutoff);
}
