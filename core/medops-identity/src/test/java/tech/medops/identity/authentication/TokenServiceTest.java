package tech.medops.identity.authentication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.medops.identity.authorization.PermissionResolver;
import tech.medops.identity.authorization.Permissions;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.errors.UseCaseError;
import tech.medops.identity.support.IdentityFixtures;
import tech.medops.identity.support.MutableClock;

import java.security.KeyPairGenerator;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TokenService.
 * Tests access token issuance and verification, refresh token generation and expiry parsing.
 */
class TokenServiceTest {

    private MutableClock clock;
    private TokenService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        service = newService(IdentityFixtures.signingKeys(), IdentityFixtures.authConfig());
    }

    private TokenService newService(SigningKeys keys, AuthConfig config) {
        return new TokenService(keys, config, new PermissionResolver(), clock);
    }

    // ========================================
    // ACCESS TOKEN TESTS
    // ========================================

    @Test
    @DisplayName("verifyAccessToken should return the claims embedded at issuance")
    void verifyAccessToken_shouldReturnClaims_whenTokenIssuedByService() {
        // Arrange
        String token = service.issueAccessToken("usr_0001", "ten_0001", List.of("brn_a", "brn_b"), UserRole.NURSE);

        // Act
        Result<AccessTokenClaims> result = service.verifyAccessToken(token);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        AccessTokenClaims claims = ((Result.Success<AccessTokenClaims>) result).value();
        assertThat(claims.subject()).isEqualTo("usr_0001");
        assertThat(claims.tenantId()).isEqualTo("ten_0001");
        assertThat(claims.branchIds()).containsExactly("brn_a", "brn_b");
        assertThat(claims.role()).isEqualTo(UserRole.NURSE);
        assertThat(claims.permissions()).contains(Permissions.VITALS_WRITE, Permissions.PATIENTS_READ);
        assertThat(claims.expiresAt()).isEqualTo(clock.instant().plusSeconds(900));
    }

    @Test
    @DisplayName("verifyAccessToken should reject a token with a tampered signature")
    void verifyAccessToken_shouldReject_whenSignatureTampered() {
        // Arrange
        String token = service.issueAccessToken("usr_0001", "ten_0001", List.of(), UserRole.DOCTOR);
        String[] parts = token.split("\\.");
        char last = parts[2].charAt(parts[2].length() - 2);
        parts[2] = parts[2].substring(0, parts[2].length() - 2) + (last == 'A' ? 'B' : 'A')
            + parts[2].charAt(parts[2].length() - 1);
        String tampered = String.join(".", parts);

        // Act
        Result<AccessTokenClaims> result = service.verifyAccessToken(tampered);

        // Assert
        assertUnauthorized(result);
    }

    @Test
    @DisplayName("verifyAccessToken should reject a token signed with another key")
    void verifyAccessToken_shouldReject_whenSignedByForeignKey() throws Exception {
        // Arrange
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        TokenService foreign = newService(SigningKeys.of(generator.generateKeyPair()), IdentityFixtures.authConfig());
        String token = foreign.issueAccessToken("usr_0001", "ten_0001", List.of(), UserRole.DOCTOR);

        // Act & Assert
        assertUnauthorized(service.verifyAccessToken(token));
    }

    @Test
    @DisplayName("verifyAccessToken should reject a token past its expiry")
    void verifyAccessToken_shouldReject_whenExpired() {
        // Arrange
        String token = service.issueAccessToken("usr_0001", "ten_0001", List.of(), UserRole.DOCTOR);
        clock.advance(Duration.ofMinutes(16));

        // Act & Assert
        assertUnauthorized(service.verifyAccessToken(token));
    }

    @Test
    @DisplayName("verifyAccessToken should reject a token from another issuer")
    void verifyAccessToken_shouldReject_whenIssuerDiffers() {
        TokenService otherIssuer = newService(IdentityFixtures.signingKeys(),
            IdentityFixtures.authConfig(Map.of("medops.auth.jwt.issuer", "someone-else")));
        String token = otherIssuer.issueAccessToken("usr_0001", "ten_0001", List.of(), UserRole.DOCTOR);

        assertUnauthorized(service.verifyAccessToken(token));
    }

    @Test
    @DisplayName("verifyAccessToken should reject missing and garbage tokens")
    void verifyAccessToken_shouldReject_whenTokenMalformed() {
        assertUnauthorized(service.verifyAccessToken(null));
        assertUnauthorized(service.verifyAccessToken(""));
        assertUnauthorized(service.verifyAccessToken("not.a.jwt"));
    }

    // ========================================
    // REFRESH TOKEN TESTS
    // ========================================

    @Test
    @DisplayName("issueRefreshToken should return 512 random bits hex encoded")
    void issueRefreshToken_shouldReturnOpaqueHex() {
        String first = service.issueRefreshToken();
        String second = service.issueRefreshToken();

        assertThat(first).matches("[0-9a-f]{128}");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("issueTokenPair should combine access token, refresh token and lifetime")
    void issueTokenPair_shouldCombineBothTokens() {
        TokenPair pair = service.issueTokenPair("usr_0001", "ten_0001", List.of("brn_a"), UserRole.SUPER_ADMIN);

        assertThat(pair.accessToken()).isNotBlank();
        assertThat(pair.refreshToken()).hasSize(128);
        assertThat(pair.expiresInSeconds()).isEqualTo(900);
        assertThat(pair.toString()).doesNotContain(pair.refreshToken());
    }

    @Test
    @DisplayName("hashToken should be deterministic and differ from the raw token")
    void hashToken_shouldBeDeterministic() {
        String raw = service.issueRefreshToken();

        assertThat(TokenService.hashToken(raw)).isEqualTo(TokenService.hashToken(raw));
        assertThat(TokenService.hashToken(raw)).isNotEqualTo(raw).hasSize(43);
    }

    @Test
    @DisplayName("refreshTokenExpiresAt should add seven days by default")
    void refreshTokenExpiresAt_shouldAddConfiguredLifetime() {
        assertThat(service.refreshTokenExpiresAt(clock.instant()))
            .isEqualTo(clock.instant().plus(Duration.ofDays(7)));
    }

    // ========================================
    // EXPIRY PARSING TESTS
    // ========================================

    @Test
    @DisplayName("parseExpiry should interpret compact durations")
    void parseExpiry_shouldInterpretCompactDurations() {
        assertThat(TokenService.parseExpiry("15m")).isEqualTo(900);
        assertThat(TokenService.parseExpiry("30s")).isEqualTo(30);
        assertThat(TokenService.parseExpiry("12h")).isEqualTo(43_200);
        assertThat(TokenService.parseExpiry("7d")).isEqualTo(604_800);
    }

    @Test
    @DisplayName("parseExpiry should fall back to 900 seconds on malformed input")
    void parseExpiry_shouldFallBack_whenMalformed() {
        assertThat(TokenService.parseExpiry("garbage")).isEqualTo(900);
        assertThat(TokenService.parseExpiry("15")).isEqualTo(900);
        assertThat(TokenService.parseExpiry("15w")).isEqualTo(900);
        assertThat(TokenService.parseExpiry(null)).isEqualTo(900);
    }

    @Test
    @DisplayName("accessTokenTtlSeconds should follow the configured expiry")
    void accessTokenTtlSeconds_shouldFollowConfig() {
        TokenService hourly = newService(IdentityFixtures.signingKeys(),
            IdentityFixtures.authConfig(Map.of("medops.auth.jwt.access-token-expiry", "1h")));

        assertThat(hourly.accessTokenTtlSeconds()).isEqualTo(3600);
    }

    private static void assertUnauthorized(Result<AccessTokenClaims> result) {
        assertThat(result.isFailure()).isTrue();
        assertThat(((Result.Failure<AccessTokenClaims>) result).error())
            .isInstanceOf(UseCaseError.UnauthorizedError.class);
    }
}
