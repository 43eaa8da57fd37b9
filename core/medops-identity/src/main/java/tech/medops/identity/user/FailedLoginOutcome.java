package tech.medops.identity.user;

import java.time.Instant;

/**
 * Counter state observed right after an atomic failed-login increment.
 *
 * @param failedCount consecutive failures including the one just recorded
 * @param lockedUntil lock expiry, or null when the threshold was not reached
 */
public record FailedLoginOutcome(int failedCount, Instant lockedUntil) {

    public boolean locked() {
        return lockedUntil != null;
    }
}
