package tech.medops.identity.authentication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.medops.identity.audit.AuditAction;
import tech.medops.identity.audit.AuditEvent;
import tech.medops.identity.audit.AuditService;
import tech.medops.identity.audit.AuditSink;
import tech.medops.identity.authentication.attempt.LoginAttempt;
import tech.medops.identity.authentication.attempt.LoginFailureReason;
import tech.medops.identity.authentication.token.RefreshToken;
import tech.medops.identity.authentication.token.RefreshTokenRepository;
import tech.medops.identity.authorization.PermissionResolver;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.common.RequestMetadata;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.errors.UseCaseError;
import tech.medops.identity.support.IdentityFixtures;
import tech.medops.identity.support.InMemoryIdentityStore;
import tech.medops.identity.support.MutableClock;
import tech.medops.identity.tenant.Branch;
import tech.medops.identity.tenant.Tenant;
import tech.medops.identity.tenant.UserBranch;
import tech.medops.identity.user.PasswordService;
import tech.medops.identity.user.User;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionService against the in-memory store.
 * Covers login outcomes, lockout timing, refresh, logout and the current user profile.
 */
@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final String PHONE = "9876543210";
    private static final String PASSWORD = "Passw0rd!";
    private static final String TENANT_ID = "ten_0000000000001";
    private static final String USER_ID = "usr_0000000000001";
    private static final String BRANCH_ID = "brn_0000000000001";
    private static final RequestMetadata META = new RequestMetadata("10.0.0.1", "JUnit");

    @Mock
    AuditSink auditSink;

    private InMemoryIdentityStore store;
    private MutableClock clock;
    private AuthConfig config;
    private PasswordService passwordService;
    private TokenService tokenService;
    private SessionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryIdentityStore();
        clock = MutableClock.startingNow();
        config = IdentityFixtures.authConfig();
        passwordService = new PasswordService(config);
        service = newService(config);
        seedUser(USER_ID, TENANT_ID, PHONE, UserRole.DOCTOR, passwordService.hash(PASSWORD));
    }

    private SessionService newService(AuthConfig authConfig) {
        return newService(authConfig, store.refreshTokens());
    }

    private SessionService newService(AuthConfig authConfig, RefreshTokenRepository refreshTokens) {
        tokenService = new TokenService(IdentityFixtures.signingKeys(), authConfig, new PermissionResolver(), clock);
        return new SessionService(
            store.users(),
            store.branches(),
            refreshTokens,
            store.loginAttempts(),
            passwordService,
            tokenService,
            new AuditService(auditSink, clock),
            store.unitOfWork(),
            authConfig,
            clock
        );
    }

    // ========================================
    // LOGIN SUCCESS TESTS
    // ========================================

    @Test
    @DisplayName("login should return a token pair and the sanitized profile when credentials are correct")
    void login_shouldReturnSession_whenCredentialsCorrect() {
        // Act
        Result<LoginResponse> result = service.login(PHONE, PASSWORD, null, META);

        // Assert
        LoginResponse response = success(result);
        assertThat(response.accessToken()).isNotBlank();
        assertThat(response.refreshToken()).isNotBlank();
        assertThat(response.expiresIn()).isEqualTo(900);
        assertThat(response.user().id()).isEqualTo(USER_ID);
        assertThat(response.user().role()).isEqualTo(UserRole.DOCTOR);
        assertThat(response.user().primaryBranchId()).isEqualTo(BRANCH_ID);
        assertThat(response.user().branches()).hasSize(1);

        AccessTokenClaims claims = success(tokenService.verifyAccessToken(response.accessToken()));
        assertThat(claims.tenantId()).isEqualTo(TENANT_ID);
        assertThat(claims.branchIds()).containsExactly(BRANCH_ID);
    }

    @Test
    @DisplayName("login should persist only the hash of the refresh token along with request metadata")
    void login_shouldPersistHashedRefreshToken_whenSuccessful() {
        LoginResponse response = success(service.login(PHONE, PASSWORD, null, META));

        List<RefreshToken> tokens = store.allRefreshTokens();
        assertThat(tokens).hasSize(1);
        RefreshToken stored = tokens.get(0);
        assertThat(stored.tokenHash).isEqualTo(TokenService.hashToken(response.refreshToken()));
        assertThat(stored.tokenHash).isNotEqualTo(response.refreshToken());
        assertThat(stored.userId).isEqualTo(USER_ID);
        assertThat(stored.ipAddress).isEqualTo("10.0.0.1");
        assertThat(stored.userAgent).isEqualTo("JUnit");
        assertThat(stored.expiresAt).isEqualTo(clock.instant().plus(Duration.ofDays(7)));
    }

    @Test
    @DisplayName("login should cut an oversized user agent to the stored column width")
    void login_shouldTruncateUserAgent_whenLongerThanColumn() {
        RequestMetadata oversized = new RequestMetadata("10.0.0.1", "A".repeat(2000));

        success(service.login(PHONE, PASSWORD, null, oversized));
        failure(service.login(PHONE, "Wrong-pass1", null, oversized));

        assertThat(store.allRefreshTokens().get(0).userAgent).hasSize(RequestMetadata.USER_AGENT_MAX);
        assertThat(store.allLoginAttempts())
            .hasSize(2)
            .allSatisfy(attempt -> assertThat(attempt.userAgent).hasSize(RequestMetadata.USER_AGENT_MAX));
    }

    @Test
    @DisplayName("login should record a successful attempt, reset the counter and stamp last login")
    void login_shouldResetCounterAndRecordAttempt_whenSuccessful() {
        // Arrange: two earlier failures
        service.login(PHONE, "Wrong1!x", null, META);
        service.login(PHONE, "Wrong1!x", null, META);

        // Act
        success(service.login(PHONE, PASSWORD, null, META));

        // Assert
        User user = store.user(USER_ID);
        assertThat(user.failedLoginCount).isZero();
        assertThat(user.lockedUntil).isNull();
        assertThat(user.lastLoginAt).isEqualTo(clock.instant());
        List<LoginAttempt> attempts = store.allLoginAttempts();
        assertThat(attempts).hasSize(3);
        assertThat(attempts.get(2).success).isTrue();
        assertThat(attempts.get(2).failureReason).isNull();
        assertThat(auditedActions()).contains(AuditAction.LOGIN_SUCCESS);
    }

    @Test
    @DisplayName("login should rehash the password when the stored hash uses outdated cost parameters")
    void login_shouldRehash_whenCostChanged() {
        // Arrange
        PasswordService older = new PasswordService(IdentityFixtures.authConfig(
            Map.of("medops.auth.password.argon2.iterations", "2")));
        seedUser("usr_0000000000002", TENANT_ID, "9123456789", UserRole.NURSE, older.hash(PASSWORD));

        // Act
        success(service.login("9123456789", PASSWORD, null, META));

        // Assert
        String storedHash = store.user("usr_0000000000002").passwordHash;
        assertThat(passwordService.needsRehash(storedHash)).isFalse();
        assertThat(passwordService.verify(PASSWORD, storedHash)).isTrue();
    }

    @Test
    @DisplayName("login should scope the lookup to the tenant when one is given")
    void login_shouldScopeToTenant_whenTenantGiven() {
        Result<LoginResponse> otherTenant = service.login(PHONE, PASSWORD, "ten_0000000000999", META);
        Result<LoginResponse> ownTenant = service.login(PHONE, PASSWORD, TENANT_ID, META);

        assertUnauthorized(otherTenant, "Invalid credentials");
        assertThat(ownTenant.isSuccess()).isTrue();
    }

    // ========================================
    // LOGIN FAILURE TESTS
    // ========================================

    @Test
    @DisplayName("login should reject blank input before touching the store")
    void login_shouldReturnValidationError_whenInputBlank() {
        Result<LoginResponse> result = service.login(" ", "", null, META);

        UseCaseError error = failure(result);
        assertThat(error).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(error.details()).containsKeys("phone", "password");
        assertThat(store.allLoginAttempts()).isEmpty();
    }

    @Test
    @DisplayName("login should reject a phone longer than the stored column before recording an attempt")
    void login_shouldReturnValidationError_whenPhoneTooLong() {
        Result<LoginResponse> result = service.login("9".repeat(21), PASSWORD, null, META);

        UseCaseError error = failure(result);
        assertThat(error).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(error.details()).containsOnlyKeys("phone");
        assertThat(store.allLoginAttempts()).isEmpty();
    }

    @Test
    @DisplayName("login should give the same generic answer for unknown phone and wrong password")
    void login_shouldNotRevealWhichCheckFailed_whenCredentialsWrong() {
        // Act
        Result<LoginResponse> unknown = service.login("9000000000", PASSWORD, null, META);
        Result<LoginResponse> wrongPassword = service.login(PHONE, "Wrong1!x", null, META);

        // Assert: identical outward errors, distinct internal reasons
        assertThat(failure(unknown)).isEqualTo(failure(wrongPassword));
        assertUnauthorized(unknown, "Invalid credentials");
        assertThat(store.allLoginAttempts())
            .extracting(attempt -> attempt.failureReason)
            .containsExactly(LoginFailureReason.USER_NOT_FOUND, LoginFailureReason.INVALID_PASSWORD);
    }

    @Test
    @DisplayName("login should reject an inactive account with the generic message")
    void login_shouldRejectGenerically_whenAccountInactive() {
        // Arrange
        store.users().updateActive(USER_ID, false, clock.instant());

        // Act
        Result<LoginResponse> result = service.login(PHONE, PASSWORD, null, META);

        // Assert
        assertUnauthorized(result, "Invalid credentials");
        assertThat(store.allLoginAttempts().get(0).failureReason).isEqualTo(LoginFailureReason.ACCOUNT_INACTIVE);
        assertThat(store.allRefreshTokens()).isEmpty();
    }

    // ========================================
    // LOCKOUT TESTS
    // ========================================

    @Test
    @DisplayName("login should lock the account after five failures and refuse the correct password")
    void login_shouldLockAccount_whenFiveConsecutiveFailures() {
        // Arrange
        for (int i = 0; i < 5; i++) {
            assertUnauthorized(service.login(PHONE, "Wrong1!x", null, META), "Invalid credentials");
        }

        // Act
        Result<LoginResponse> sixth = service.login(PHONE, PASSWORD, null, META);

        // Assert
        assertUnauthorized(sixth, "Account is temporarily locked. Please try again later.");
        assertThat(failure(sixth).code()).isEqualTo("ACCOUNT_LOCKED");
        User user = store.user(USER_ID);
        assertThat(user.failedLoginCount).isEqualTo(5);
        assertThat(user.lockedUntil).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
        assertThat(auditedActions()).containsOnlyOnce(AuditAction.ACCOUNT_LOCKED);
    }

    @Test
    @DisplayName("login should stay locked at T+29 minutes and unlock at T+31 minutes")
    void login_shouldUnlockAutomatically_whenLockDurationElapsed() {
        // Arrange: lock at T
        for (int i = 0; i < 5; i++) {
            service.login(PHONE, "Wrong1!x", null, META);
        }

        // Act & Assert
        clock.advance(Duration.ofMinutes(29));
        assertUnauthorized(service.login(PHONE, PASSWORD, null, META),
            "Account is temporarily locked. Please try again later.");

        clock.advance(Duration.ofMinutes(2));
        assertThat(service.login(PHONE, PASSWORD, null, META).isSuccess()).isTrue();
        assertThat(store.user(USER_ID).failedLoginCount).isZero();
    }

    @Test
    @DisplayName("login should restart the failure count after a lapsed lock")
    void login_shouldRestartCount_whenLockLapsed() {
        // Arrange
        for (int i = 0; i < 5; i++) {
            service.login(PHONE, "Wrong1!x", null, META);
        }
        clock.advance(Duration.ofMinutes(31));

        // Act
        assertUnauthorized(service.login(PHONE, "Wrong1!x", null, META), "Invalid credentials");

        // Assert: one fresh failure, not an immediate relock
        User user = store.user(USER_ID);
        assertThat(user.failedLoginCount).isEqualTo(1);
        assertThat(user.lockedUntil).isNull();
        assertThat(service.login(PHONE, PASSWORD, null, META).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("login should lock after concurrent failures without losing any increment")
    void login_shouldCountEveryFailure_whenFailuresConcurrent() throws Exception {
        // Arrange
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Result<LoginResponse>>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return service.login(PHONE, "Wrong1!x", null, META);
                }));
            }

            // Act
            start.countDown();
            for (Future<Result<LoginResponse>> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS).isFailure()).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }

        // Assert
        User user = store.user(USER_ID);
        assertThat(user.failedLoginCount).isEqualTo(5);
        assertThat(user.lockedUntil).isNotNull();
        assertUnauthorized(service.login(PHONE, PASSWORD, null, META),
            "Account is temporarily locked. Please try again later.");
    }

    // ========================================
    // REFRESH TESTS
    // ========================================

    @Test
    @DisplayName("refresh should mint a new access token and keep the refresh token by default")
    void refresh_shouldIssueAccessToken_whenTokenValid() {
        // Arrange
        LoginResponse login = success(service.login(PHONE, PASSWORD, null, META));

        // Act
        RefreshResponse refreshed = success(service.refresh(login.refreshToken(), META));

        // Assert
        assertThat(refreshed.accessToken()).isNotBlank();
        assertThat(refreshed.expiresIn()).isEqualTo(900);
        assertThat(refreshed.refreshToken()).isNull();
        assertThat(service.refresh(login.refreshToken(), META).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("refresh should embed the current role, not the role at login")
    void refresh_shouldReflectRoleChange_whenRoleUpdatedSinceLogin() {
        // Arrange
        LoginResponse login = success(service.login(PHONE, PASSWORD, null, META));
        store.users().updateRole(USER_ID, UserRole.NURSE, clock.instant());

        // Act
        RefreshResponse refreshed = success(service.refresh(login.refreshToken(), META));

        // Assert
        assertThat(success(tokenService.verifyAccessToken(refreshed.accessToken())).role()).isEqualTo(UserRole.NURSE);
    }

    @Test
    @DisplayName("refresh should reject unknown, revoked and expired tokens with the same message")
    void refresh_shouldReject_whenTokenUnusable() {
        // Arrange
        LoginResponse revoked = success(service.login(PHONE, PASSWORD, null, META));
        service.logout(revoked.refreshToken());
        LoginResponse expiring = success(service.login(PHONE, PASSWORD, null, META));

        // Act & Assert
        assertUnauthorized(service.refresh("deadbeef", META), "Invalid refresh token");
        assertUnauthorized(service.refresh(null, META), "Invalid refresh token");
        assertUnauthorized(service.refresh(revoked.refreshToken(), META), "Invalid refresh token");

        clock.advance(Duration.ofDays(7).plusSeconds(1));
        assertUnauthorized(service.refresh(expiring.refreshToken(), META), "Invalid refresh token");
    }

    @Test
    @DisplayName("refresh should revoke the token when its owner has been deactivated")
    void refresh_shouldRevokeToken_whenUserInactive() {
        // Arrange
        LoginResponse login = success(service.login(PHONE, PASSWORD, null, META));
        store.users().updateActive(USER_ID, false, clock.instant());

        // Act
        Result<RefreshResponse> result = service.refresh(login.refreshToken(), META);

        // Assert
        assertUnauthorized(result, "Invalid refresh token");
        assertThat(store.allRefreshTokens().get(0).revokedAt).isNotNull();
    }

    @Test
    @DisplayName("refresh should rotate the token when rotate-on-use is enabled")
    void refresh_shouldRotateToken_whenRotationEnabled() {
        // Arrange
        SessionService rotating = newService(IdentityFixtures.authConfig(
            Map.of("medops.auth.refresh.rotate-on-use", "true")));
        LoginResponse login = success(rotating.login(PHONE, PASSWORD, null, META));

        // Act
        RefreshResponse refreshed = success(rotating.refresh(login.refreshToken(), META));

        // Assert
        assertThat(refreshed.refreshToken()).isNotBlank().isNotEqualTo(login.refreshToken());
        assertUnauthorized(rotating.refresh(login.refreshToken(), META), "Invalid refresh token");
        assertThat(rotating.refresh(refreshed.refreshToken(), META).isSuccess()).isTrue();

        RefreshToken old = store.refreshTokens().findByTokenHash(TokenService.hashToken(login.refreshToken())).orElseThrow();
        assertThat(old.replacedBy).isEqualTo(TokenService.hashToken(refreshed.refreshToken()));
    }

    @Test
    @DisplayName("refresh should leave the presented token usable when storing its successor fails")
    void refresh_shouldKeepOldToken_whenSuccessorNotStored() {
        // Arrange
        RefreshTokenRepository tokens = mock(RefreshTokenRepository.class, delegatesTo(store.refreshTokens()));
        SessionService rotating = newService(IdentityFixtures.authConfig(
            Map.of("medops.auth.refresh.rotate-on-use", "true")), tokens);
        LoginResponse login = success(rotating.login(PHONE, PASSWORD, null, META));
        doThrow(new IllegalStateException("connection lost")).when(tokens).persist(any());

        // Act & Assert
        assertThatThrownBy(() -> rotating.refresh(login.refreshToken(), META))
            .isInstanceOf(IllegalStateException.class);

        RefreshToken old = store.refreshTokens().findByTokenHash(TokenService.hashToken(login.refreshToken())).orElseThrow();
        assertThat(old.revokedAt).isNull();
        assertThat(old.replacedBy).isNull();
        assertThat(store.allRefreshTokens()).hasSize(1);
    }

    // ========================================
    // LOGOUT TESTS
    // ========================================

    @Test
    @DisplayName("logout should revoke the token and be idempotent")
    void logout_shouldBeIdempotent() {
        // Arrange
        LoginResponse login = success(service.login(PHONE, PASSWORD, null, META));

        // Act
        service.logout(login.refreshToken());
        Instant firstRevocation = store.allRefreshTokens().get(0).revokedAt;
        clock.advance(Duration.ofMinutes(1));
        service.logout(login.refreshToken());
        service.logout("never-issued");
        service.logout(null);

        // Assert
        assertThat(firstRevocation).isNotNull();
        assertThat(store.allRefreshTokens().get(0).revokedAt).isEqualTo(firstRevocation);
        assertThat(auditedActions()).containsOnlyOnce(AuditAction.LOGOUT);
    }

    @Test
    @DisplayName("logoutAll should revoke every live token of the user")
    void logoutAll_shouldRevokeAllTokens() {
        // Arrange
        LoginResponse first = success(service.login(PHONE, PASSWORD, null, META));
        LoginResponse second = success(service.login(PHONE, PASSWORD, null, META));

        // Act
        int revoked = service.logoutAll(USER_ID);

        // Assert
        assertThat(revoked).isEqualTo(2);
        assertUnauthorized(service.refresh(first.refreshToken(), META), "Invalid refresh token");
        assertUnauthorized(service.refresh(second.refreshToken(), META), "Invalid refresh token");
        assertThat(service.logoutAll(USER_ID)).isZero();
    }

    // ========================================
    // CURRENT USER TESTS
    // ========================================

    @Test
    @DisplayName("currentUser should return the profile without credential material")
    void currentUser_shouldReturnProfile_whenUserExists() {
        AuthUser user = success(service.currentUser(USER_ID));

        assertThat(user.phone()).isEqualTo(PHONE);
        assertThat(user.branches()).extracting(b -> b.branchCode()).containsExactly("MAIN");
        assertThat(user.toString()).doesNotContain("argon2");
    }

    @Test
    @DisplayName("currentUser should return not found for unknown users")
    void currentUser_shouldReturnNotFound_whenUserUnknown() {
        assertThat(failure(service.currentUser("usr_missing"))).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(failure(service.currentUser(null))).isInstanceOf(UseCaseError.NotFoundError.class);
    }

    // ========================================
    // AUDIT TESTS
    // ========================================

    @Test
    @DisplayName("login should succeed even when the audit sink fails")
    void login_shouldSucceed_whenAuditSinkFails() {
        // Arrange
        doThrow(new RuntimeException("audit store down")).when(auditSink).write(any());

        // Act
        Result<LoginResponse> ok = service.login(PHONE, PASSWORD, null, META);
        Result<LoginResponse> bad = service.login(PHONE, "Wrong1!x", null, META);

        // Assert
        assertThat(ok.isSuccess()).isTrue();
        assertUnauthorized(bad, "Invalid credentials");
    }

    @Test
    @DisplayName("failed login audit should carry the internal reason and a masked phone")
    void login_shouldAuditReason_whenLoginFails() {
        service.login(PHONE, "Wrong1!x", null, META);

        AuditEvent event = auditEvents().stream()
            .filter(e -> e.action().equals(AuditAction.LOGIN_FAILED))
            .findFirst()
            .orElseThrow();
        assertThat(event.metadata())
            .containsEntry("reason", "INVALID_PASSWORD")
            .containsEntry("phone", "******3210")
            .containsEntry("failedCount", 1);
        assertThat(event.metadata().values()).doesNotContain("Wrong1!x");
    }

    // ========================================
    // Helpers
    // ========================================

    private void seedUser(String id, String tenantId, String phone, UserRole role, String passwordHash) {
        Instant now = clock.instant();
        if (store.allTenants().stream().noneMatch(t -> t.id.equals(tenantId))) {
            Tenant tenant = new Tenant();
            tenant.id = tenantId;
            tenant.name = "Demo Clinic";
            tenant.slug = "demo-clinic";
            tenant.email = "demo@medops.local";
            tenant.subscriptionPlan = Tenant.PLAN_TRIAL;
            tenant.createdAt = now;
            store.addTenant(tenant);

            Branch branch = new Branch();
            branch.id = BRANCH_ID;
            branch.tenantId = tenantId;
            branch.name = "Main Branch";
            branch.code = "MAIN";
            branch.createdAt = now;
            store.addBranch(branch);
        }

        User user = new User();
        user.id = id;
        user.tenantId = tenantId;
        user.name = "Dr. Owner";
        user.phone = phone;
        user.passwordHash = passwordHash;
        user.role = role;
        user.createdAt = now;
        store.addUser(user);

        UserBranch membership = new UserBranch();
        membership.id = "ubr_" + id.substring(4);
        membership.tenantId = tenantId;
        membership.userId = id;
        membership.branchId = BRANCH_ID;
        membership.primary = true;
        membership.createdAt = now;
        store.addUserBranch(membership);
    }

    private List<AuditEvent> auditEvents() {
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink, atLeast(0)).write(captor.capture());
        return captor.getAllValues();
    }

    private List<String> auditedActions() {
        return auditEvents().stream().map(AuditEvent::action).toList();
    }

    private static <T> T success(Result<T> result) {
        assertThat(result.isSuccess()).as("expected success but got %s", result).isTrue();
        return ((Result.Success<T>) result).value();
    }

    private static <T> UseCaseError failure(Result<T> result) {
        assertThat(result.isFailure()).as("expected failure but got %s", result).isTrue();
        return ((Result.Failure<T>) result).error();
    }

    private static <T> void assertUnauthorized(Result<T> result, String message) {
        UseCaseError error = failure(result);
        assertThat(error).isInstanceOf(UseCaseError.UnauthorizedError.class);
        assertThat(error.message()).isEqualTo(message);
    }
}
