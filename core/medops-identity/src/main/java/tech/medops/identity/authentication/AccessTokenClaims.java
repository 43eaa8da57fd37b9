package tech.medops.identity.authentication;

import tech.medops.identity.authorization.UserRole;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Verified contents of an access token.
 *
 * <p>{@code permissions} were resolved when the token was issued and are not
 * re-derived per request.
 */
public record AccessTokenClaims(
    String subject,
    String tenantId,
    List<String> branchIds,
    UserRole role,
    Set<String> permissions,
    Instant issuedAt,
    Instant expiresAt
) {}
