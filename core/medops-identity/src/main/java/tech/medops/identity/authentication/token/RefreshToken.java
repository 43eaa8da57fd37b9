package tech.medops.identity.authentication.token;

import java.time.Instant;

/**
 * Refresh token for obtaining new access tokens.
 *
 * <p>Security: Only the token hash is stored, not the actual token.
 * Tokens are created on login, revoked on logout or password reset, and
 * never updated otherwise.
 */
public class RefreshToken {

    /**
     * SHA-256 hash of the refresh token. Primary key.
     */
    public String tokenHash;

    public String userId;

    public String tenantId;

    public Instant createdAt;

    public Instant expiresAt;

    public Instant revokedAt;

    /**
     * Hash of the token that replaced this one when rotate-on-use is enabled.
     */
    public String replacedBy;

    public String ipAddress;

    public String userAgent;

    public RefreshToken() {
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
