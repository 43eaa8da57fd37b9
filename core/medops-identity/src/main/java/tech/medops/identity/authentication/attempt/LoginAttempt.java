package tech.medops.identity.authentication.attempt;

import java.time.Instant;

/**
 * Immutable record of one login attempt. Written once, never updated.
 */
public class LoginAttempt {

    public String id;

    public String phone;

    /**
     * Tenant the caller asked for; null for platform-level sign-in.
     */
    public String tenantId;

    /**
     * Resolved user, when one was found.
     */
    public String userId;

    public String ipAddress;

    public String userAgent;

    public boolean success;

    public LoginFailureReason failureReason;

    public Instant createdAt;

    public LoginAttempt() {
    }
}
