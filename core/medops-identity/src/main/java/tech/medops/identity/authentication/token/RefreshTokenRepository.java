package tech.medops.identity.authentication.token;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for RefreshToken entities.
 */
public interface RefreshTokenRepository {

    /**
     * Find a token by hash regardless of state, so callers can tell revoked
     * and expired tokens apart in logs.
     */
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    void persist(RefreshToken token);

    /**
     * Revoke one token. Revoking an already-revoked or unknown token is a no-op.
     *
     * @return true if this call revoked the token
     */
    boolean revoke(String tokenHash, String replacedBy, Instant now);

    /**
     * Revoke every live token owned by the user.
     *
     * @return number of tokens revoked
     */
    int revokeAllForUser(String userId, Instant now);

    /**
     * Delete tokens whose expiry is before {@code cutoff}.
     */
    long deleteExpiredBefore(Instant cutoff);
}
