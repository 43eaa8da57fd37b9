package tech.medops.identity.authentication;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import io.smallrye.jwt.build.Jwt;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.medops.identity.authorization.PermissionResolver;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.common.CompactDurations;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.errors.UseCaseError;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mints and verifies session credentials.
 *
 * <ul>
 *   <li>Access tokens are RS256-signed JWTs carrying subject, tenant, branches,
 *       role and the role's permissions. Verification is stateless.</li>
 *   <li>Refresh tokens are 512 random bits, hex encoded, with no embedded
 *       claims. They are only a lookup key; the store keeps their SHA-256 digest.</li>
 * </ul>
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final long DEFAULT_EXPIRY_SECONDS = 900;
    private static final int REFRESH_TOKEN_BYTES = 64;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public static final String CLAIM_TENANT_ID = "tenantId";
    public static final String CLAIM_BRANCH_IDS = "branchIds";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_PERMISSIONS = "permissions";

    private final SigningKeys keys;
    private final PermissionResolver permissionResolver;
    private final Clock clock;
    private final String issuer;
    private final long accessTokenSeconds;
    private final long refreshTokenSeconds;
    private final JWTParser parser = new DefaultJWTParser();

    @Inject
    public TokenService(SigningKeys keys, AuthConfig config, PermissionResolver permissionResolver, Clock clock) {
        this.keys = keys;
        this.permissionResolver = permissionResolver;
        this.clock = clock;
        this.issuer = config.jwt().issuer();
        this.accessTokenSeconds = parseExpiry(config.jwt().accessTokenExpiry());
        this.refreshTokenSeconds = CompactDurations.toSeconds(config.refresh().expiry(), 7 * 86400L);
    }

    /**
     * Issue a signed access token. Permissions are resolved from the role now
     * and embedded in the token.
     */
    public String issueAccessToken(String userId, String tenantId, List<String> branchIds, UserRole role) {
        Instant now = clock.instant();
        Set<String> permissions = permissionResolver.permissionsFor(role);

        return Jwt.issuer(issuer)
            .subject(userId)
            .claim(CLAIM_TENANT_ID, tenantId)
            .claim(CLAIM_BRANCH_IDS, branchIds == null ? List.of() : List.copyOf(branchIds))
            .claim(CLAIM_ROLE, role.code())
            .claim(CLAIM_PERMISSIONS, new ArrayList<>(permissions))
            .groups(Set.of(role.code()))
            .issuedAt(now)
            .expiresAt(now.plusSeconds(accessTokenSeconds))
            .jws()
            .keyId(keys.keyId())
            .sign(keys.privateKey());
    }

    /**
     * Generate an opaque refresh token: 64 bytes from a secure random source, hex encoded.
     */
    public String issueRefreshToken() {
        byte[] bytes = new byte[REFRESH_TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public TokenPair issueTokenPair(String userId, String tenantId, List<String> branchIds, UserRole role) {
        return new TokenPair(
            issueAccessToken(userId, tenantId, branchIds, role),
            issueRefreshToken(),
            accessTokenSeconds
        );
    }

    /**
     * Verify signature, issuer and expiry. Does not consult the store.
     */
    public Result<AccessTokenClaims> verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            return unauthorized("Access token is missing");
        }

        JsonWebToken jwt;
        try {
            jwt = parser.verify(token, keys.publicKey());
        } catch (ParseException e) {
            LOG.debugf("Access token rejected: %s", e.getMessage());
            return unauthorized("Invalid or expired access token");
        }

        if (!issuer.equals(jwt.getIssuer())) {
            LOG.debugf("Token issuer mismatch: expected %s, got %s", issuer, jwt.getIssuer());
            return unauthorized("Invalid or expired access token");
        }
        if (jwt.getExpirationTime() <= clock.instant().getEpochSecond()) {
            LOG.debug("Token expired");
            return unauthorized("Invalid or expired access token");
        }

        Optional<UserRole> role = UserRole.fromCode(stringClaim(jwt.getClaim(CLAIM_ROLE)));
        if (role.isEmpty()) {
            LOG.debugf("Token for subject %s carries an unknown role", jwt.getSubject());
            return unauthorized("Invalid or expired access token");
        }

        return Result.success(new AccessTokenClaims(
            jwt.getSubject(),
            stringClaim(jwt.getClaim(CLAIM_TENANT_ID)),
            stringList(jwt.getClaim(CLAIM_BRANCH_IDS)),
            role.get(),
            new LinkedHashSet<>(stringList(jwt.getClaim(CLAIM_PERMISSIONS))),
            Instant.ofEpochSecond(jwt.getIssuedAtTime()),
            Instant.ofEpochSecond(jwt.getExpirationTime())
        ));
    }

    /**
     * Access token lifetime in seconds.
     */
    public long accessTokenTtlSeconds() {
        return accessTokenSeconds;
    }

    /**
     * Expiry for a refresh token issued at {@code issuedAt}.
     */
    public Instant refreshTokenExpiresAt(Instant issuedAt) {
        return issuedAt.plusSeconds(refreshTokenSeconds);
    }

    /**
     * Interpret {@code \d+[smhd]} as seconds. Malformed input degrades to 900
     * seconds instead of failing; {@link AuthConfigValidator} rejects such
     * values at startup.
     */
    public static long parseExpiry(String duration) {
        if (!CompactDurations.isValid(duration)) {
            LOG.warnf("Malformed token expiry '%s', falling back to %d seconds", duration, DEFAULT_EXPIRY_SECONDS);
            return DEFAULT_EXPIRY_SECONDS;
        }
        return CompactDurations.toSeconds(duration, DEFAULT_EXPIRY_SECONDS);
    }

    /**
     * SHA-256 digest (base64url) under which refresh tokens are stored.
     */
    public static String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String stringClaim(Object claim) {
        if (claim == null) {
            return null;
        }
        if (claim instanceof JsonString json) {
            return json.getString();
        }
        return claim.toString();
    }

    private static List<String> stringList(Object claim) {
        if (!(claim instanceof Collection<?> values)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(values.size());
        for (Object value : values) {
            String text = stringClaim(value);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    private static <T> Result<T> unauthorized(String message) {
        return Result.failure(new UseCaseError.UnauthorizedError("INVALID_TOKEN", message, Map.of()));
    }
}
