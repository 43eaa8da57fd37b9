package tech.medops.identity.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.medops.identity.audit.AuditAction;
import tech.medops.identity.audit.AuditEntityType;
import tech.medops.identity.audit.AuditService;
import tech.medops.identity.authentication.attempt.LoginAttempt;
import tech.medops.identity.authentication.attempt.LoginAttemptRepository;
import tech.medops.identity.authentication.attempt.LoginFailureReason;
import tech.medops.identity.authentication.token.RefreshToken;
import tech.medops.identity.authentication.token.RefreshTokenRepository;
import tech.medops.identity.common.CompactDurations;
import tech.medops.identity.common.RequestMetadata;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.UnitOfWork;
import tech.medops.identity.common.errors.UseCaseError;
import tech.medops.identity.otp.OtpService;
import tech.medops.identity.shared.EntityType;
import tech.medops.identity.shared.TsidGenerator;
import tech.medops.identity.tenant.BranchMembership;
import tech.medops.identity.tenant.BranchRepository;
import tech.medops.identity.user.FailedLoginOutcome;
import tech.medops.identity.user.PasswordService;
import tech.medops.identity.user.User;
import tech.medops.identity.user.UserRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session lifecycle: login, refresh, logout and the current user's profile.
 *
 * <p>Account state per user is {@code Active -> Locked(until) -> Active}.
 * A lock lapses on its own once {@code until} has passed. Every refused
 * login answers with the same generic message except a locked account,
 * which is told to wait. The specific reason only reaches the login
 * attempt log, the audit trail and the application log.
 */
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String ACCOUNT_LOCKED = "Account is temporarily locked. Please try again later.";
    static final String INVALID_REFRESH_TOKEN = "Invalid refresh token";
    static final int PHONE_MAX = 20;

    private final UserRepository userRepository;
    private final BranchRepository branchRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final LoginAttemptRepository loginAttemptRepository;
    private final PasswordService passwordService;
    private final TokenService tokenService;
    private final AuditService auditService;
    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final int maxFailedAttempts;
    private final Duration lockDuration;
    private final boolean rotateOnUse;

    @Inject
    public SessionService(UserRepository userRepository,
                          BranchRepository branchRepository,
                          RefreshTokenRepository refreshTokenRepository,
                          LoginAttemptRepository loginAttemptRepository,
                          PasswordService passwordService,
                          TokenService tokenService,
                          AuditService auditService,
                          UnitOfWork unitOfWork,
                          AuthConfig config,
                          Clock clock) {
        this.userRepository = userRepository;
        this.branchRepository = branchRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.loginAttemptRepository = loginAttemptRepository;
        this.passwordService = passwordService;
        this.tokenService = tokenService;
        this.auditService = auditService;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
        this.maxFailedAttempts = config.lockout().maxFailedAttempts();
        this.lockDuration = Duration.ofSeconds(CompactDurations.toSeconds(config.lockout().duration(), 1800));
        this.rotateOnUse = config.refresh().rotateOnUse();
    }

    // ========================================================================
    // Login
    // ========================================================================

    /**
     * Authenticate with phone and password.
     *
     * @param tenantId scope the lookup to one tenant; null for platform-level
     *                 sign-in across all tenants
     */
    public Result<LoginResponse> login(String phone, String password, String tenantId, RequestMetadata meta) {
        Map<String, List<String>> fieldErrors = new HashMap<>();
        if (phone == null || phone.isBlank()) {
            fieldErrors.put("phone", List.of("Phone is required"));
        } else if (phone.length() > PHONE_MAX) {
            fieldErrors.put("phone", List.of("Invalid phone number"));
        }
        if (password == null || password.isEmpty()) {
            fieldErrors.put("password", List.of("Password is required"));
        }
        if (!fieldErrors.isEmpty()) {
            return Result.failure(UseCaseError.ValidationError.ofFields(fieldErrors));
        }

        RequestMetadata request = meta == null ? RequestMetadata.empty() : meta;
        Instant now = clock.instant();

        Optional<User> found = userRepository.findByPhone(tenantId, phone);
        if (found.isEmpty()) {
            recordFailure(phone, tenantId, null, LoginFailureReason.USER_NOT_FOUND, request, now, Map.of());
            return invalidCredentials();
        }

        User user = found.get();

        if (user.isLockedAt(now)) {
            recordFailure(phone, user.tenantId, user.id, LoginFailureReason.ACCOUNT_LOCKED, request, now,
                Map.of("lockedUntil", user.lockedUntil.toString()));
            return Result.failure(new UseCaseError.UnauthorizedError(
                "ACCOUNT_LOCKED",
                ACCOUNT_LOCKED,
                Map.of()
            ));
        }

        if (!user.active) {
            recordFailure(phone, user.tenantId, user.id, LoginFailureReason.ACCOUNT_INACTIVE, request, now, Map.of());
            return invalidCredentials();
        }

        if (!passwordService.verify(password, user.passwordHash)) {
            FailedLoginOutcome outcome = userRepository.recordFailedLogin(user.id, maxFailedAttempts, lockDuration, now);
            recordFailure(phone, user.tenantId, user.id, LoginFailureReason.INVALID_PASSWORD, request, now,
                Map.of("failedCount", outcome.failedCount()));

            if (outcome.locked()) {
                LOG.warnf("User %s locked until %s after %d failed logins",
                    user.id, outcome.lockedUntil(), outcome.failedCount());
                auditService.recordEvent(user.tenantId, user.id, AuditAction.ACCOUNT_LOCKED,
                    AuditEntityType.USER, user.id,
                    Map.of("lockedUntil", outcome.lockedUntil().toString(), "failedCount", outcome.failedCount()));
            }
            return invalidCredentials();
        }

        userRepository.recordSuccessfulLogin(user.id, now);
        if (passwordService.needsRehash(user.passwordHash)) {
            userRepository.updatePasswordHash(user.id, passwordService.hash(password), now);
            LOG.debugf("Rehashed password for user %s with current cost parameters", user.id);
        }
        loginAttemptRepository.record(attempt(phone, user.tenantId, user.id, true, null, request, now));

        List<BranchMembership> memberships = branchRepository.findMembershipsForUser(user.id);
        TokenPair pair = tokenService.issueTokenPair(user.id, user.tenantId, branchIds(memberships), user.role);
        persistRefreshToken(pair.refreshToken(), user, request, now);

        auditService.recordEvent(user.tenantId, user.id, AuditAction.LOGIN_SUCCESS,
            AuditEntityType.USER, user.id, requestMetadata(request));
        LOG.infof("Login successful for user %s (tenant %s)", user.id, user.tenantId);

        return Result.success(new LoginResponse(
            pair.accessToken(),
            pair.refreshToken(),
            pair.expiresInSeconds(),
            AuthUser.from(user, memberships)
        ));
    }

    // ========================================================================
    // Refresh / Logout
    // ========================================================================

    /**
     * Mint a new access token from a live refresh token. Role and branches are
     * re-read so changes since login take effect.
     */
    public Result<RefreshResponse> refresh(String refreshToken, RequestMetadata meta) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return invalidRefreshToken();
        }

        RequestMetadata request = meta == null ? RequestMetadata.empty() : meta;
        Instant now = clock.instant();
        String tokenHash = TokenService.hashToken(refreshToken);

        Optional<RefreshToken> found = refreshTokenRepository.findByTokenHash(tokenHash);
        if (found.isEmpty()) {
            LOG.debug("Refresh rejected: unknown token");
            return invalidRefreshToken();
        }

        RefreshToken stored = found.get();
        if (stored.isRevoked()) {
            LOG.warnf("Refresh rejected: revoked token presented for user %s", stored.userId);
            return invalidRefreshToken();
        }
        if (stored.isExpiredAt(now)) {
            LOG.debugf("Refresh rejected: expired token for user %s", stored.userId);
            return invalidRefreshToken();
        }

        Optional<User> owner = userRepository.findById(stored.userId);
        if (owner.isEmpty() || !owner.get().active) {
            refreshTokenRepository.revoke(tokenHash, null, now);
            LOG.warnf("Refresh rejected: user %s is inactive or removed, token revoked", stored.userId);
            return invalidRefreshToken();
        }

        User user = owner.get();
        List<BranchMembership> memberships = branchRepository.findMembershipsForUser(user.id);
        String accessToken = tokenService.issueAccessToken(user.id, user.tenantId, branchIds(memberships), user.role);

        String replacement = null;
        if (rotateOnUse) {
            String next = tokenService.issueRefreshToken();
            // Revoke and successor insert commit together
            boolean rotated = unitOfWork.inTransaction(() -> {
                if (!refreshTokenRepository.revoke(tokenHash, TokenService.hashToken(next), now)) {
                    return false;
                }
                persistRefreshToken(next, user, request, now);
                return true;
            });
            if (!rotated) {
                // Another request rotated this token first
                LOG.warnf("Refresh rejected: concurrent reuse of token for user %s", user.id);
                return invalidRefreshToken();
            }
            replacement = next;
        }

        LOG.debugf("Access token refreshed for user %s", user.id);
        return Result.success(new RefreshResponse(accessToken, tokenService.accessTokenTtlSeconds(), replacement));
    }

    /**
     * Revoke one refresh token. Unknown and already revoked tokens are ignored.
     */
    public void logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }
        String tokenHash = TokenService.hashToken(refreshToken);
        Optional<RefreshToken> found = refreshTokenRepository.findByTokenHash(tokenHash);
        if (found.isEmpty()) {
            return;
        }

        RefreshToken stored = found.get();
        if (refreshTokenRepository.revoke(tokenHash, null, clock.instant())) {
            auditService.recordEvent(stored.tenantId, stored.userId, AuditAction.LOGOUT,
                AuditEntityType.USER, stored.userId);
            LOG.infof("User %s logged out", stored.userId);
        }
    }

    /**
     * Revoke every live refresh token of the user.
     *
     * @return number of tokens revoked
     */
    public int logoutAll(String userId) {
        Instant now = clock.instant();
        int revoked = refreshTokenRepository.revokeAllForUser(userId, now);
        String tenantId = userRepository.findById(userId).map(u -> u.tenantId).orElse(null);
        auditService.recordEvent(tenantId, userId, AuditAction.LOGOUT_ALL, AuditEntityType.USER, userId,
            Map.of("revokedCount", revoked));
        LOG.infof("Revoked %d refresh tokens for user %s", revoked, userId);
        return revoked;
    }

    // ========================================================================
    // Current user
    // ========================================================================

    public Result<AuthUser> currentUser(String userId) {
        Optional<User> found = userId == null ? Optional.empty() : userRepository.findById(userId);
        if (found.isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError(
                "USER_NOT_FOUND",
                "User not found",
                Map.of("userId", String.valueOf(userId))
            ));
        }
        User user = found.get();
        return Result.success(AuthUser.from(user, branchRepository.findMembershipsForUser(user.id)));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void recordFailure(String phone, String tenantId, String userId, LoginFailureReason reason,
                               RequestMetadata request, Instant now, Map<String, Object> extra) {
        loginAttemptRepository.record(attempt(phone, tenantId, userId, false, reason, request, now));

        LOG.warnf("Login failed for %s: %s", OtpService.maskPhone(phone), reason.description());

        Map<String, Object> metadata = new HashMap<>(requestMetadata(request));
        metadata.putAll(extra);
        metadata.put("reason", reason.name());
        metadata.put("phone", OtpService.maskPhone(phone));
        auditService.recordEvent(tenantId, userId, AuditAction.LOGIN_FAILED, AuditEntityType.USER, userId, metadata);
    }

    private static LoginAttempt attempt(String phone, String tenantId, String userId, boolean success,
                                        LoginFailureReason reason, RequestMetadata request, Instant now) {
        LoginAttempt attempt = new LoginAttempt();
        attempt.id = TsidGenerator.generate(EntityType.LOGIN_ATTEMPT);
        attempt.phone = phone;
        attempt.tenantId = tenantId;
        attempt.userId = userId;
        attempt.ipAddress = request.ipAddress();
        attempt.userAgent = request.userAgent();
        attempt.success = success;
        attempt.failureReason = reason;
        attempt.createdAt = now;
        return attempt;
    }

    private void persistRefreshToken(String rawToken, User user, RequestMetadata request, Instant now) {
        RefreshToken token = new RefreshToken();
        token.tokenHash = TokenService.hashToken(rawToken);
        token.userId = user.id;
        token.tenantId = user.tenantId;
        token.createdAt = now;
        token.expiresAt = tokenService.refreshTokenExpiresAt(now);
        token.ipAddress = request.ipAddress();
        token.userAgent = request.userAgent();
        refreshTokenRepository.persist(token);
    }

    private static List<String> branchIds(List<BranchMembership> memberships) {
        List<String> ids = new ArrayList<>(memberships.size());
        for (BranchMembership membership : memberships) {
            ids.add(membership.branchId());
        }
        return ids;
    }

    private static Map<String, Object> requestMetadata(RequestMetadata request) {
        Map<String, Object> metadata = new HashMap<>();
        if (request.ipAddress() != null) {
            metadata.put("ipAddress", request.ipAddress());
        }
        if (request.userAgent() != null) {
            metadata.put("userAgent", request.userAgent());
        }
        return metadata;
    }

    private static <T> Result<T> invalidCredentials() {
        return Result.failure(new UseCaseError.UnauthorizedError("INVALID_CREDENTIALS", INVALID_CREDENTIALS, Map.of()));
    }

    private static <T> Result<T> invalidRefreshToken() {
        return Result.failure(new UseCaseError.UnauthorizedError("INVALID_REFRESH_TOKEN", INVALID_REFRESH_TOKEN, Map.of()));
    }
}
