package tech.medops.identity.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the MedOps identity module.
 *
 * <p>Durations use the compact notation {@code <number><s|m|h|d>}. Malformed
 * values are rejected at startup by {@link AuthConfigValidator}.
 *
 * Example configuration:
 * <pre>
 * medops.auth.jwt.issuer=https://auth.medops.example
 * medops.auth.jwt.private-key-path=/keys/private.pem
 * medops.auth.jwt.public-key-path=/keys/public.pem
 * medops.auth.jwt.access-token-expiry=15m
 * medops.auth.refresh.expiry=7d
 * medops.auth.lockout.max-failed-attempts=5
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "medops.auth")
public interface AuthConfig {

    JwtConfig jwt();

    RefreshConfig refresh();

    LockoutConfig lockout();

    OtpConfig otp();

    PasswordConfig password();

    RegistrationConfig registration();

    PurgeConfig purge();

    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         */
        @WithDefault("medops")
        String issuer();

        @WithName("access-token-expiry")
        @WithDefault("15m")
        String accessTokenExpiry();

        /**
         * Path to the RSA private key for signing tokens (PEM format).
         * When absent a development key pair is generated under {@link #devKeyDir()}.
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();
    }

    interface RefreshConfig {
        @WithDefault("7d")
        String expiry();

        /**
         * Revoke the presented refresh token and hand out a new one on every refresh.
         */
        @WithName("rotate-on-use")
        @WithDefault("false")
        boolean rotateOnUse();
    }

    interface LockoutConfig {
        @WithName("max-failed-attempts")
        @WithDefault("5")
        int maxFailedAttempts();

        @WithDefault("30m")
        String duration();
    }

    interface OtpConfig {
        @WithDefault("6")
        int length();

        @WithDefault("10m")
        String expiry();

        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();
    }

    interface PasswordConfig {
        @WithName("min-length")
        @WithDefault("8")
        int minLength();

        /**
         * Number of previous passwords that may not be reused.
         */
        @WithName("history-limit")
        @WithDefault("5")
        int historyLimit();

        Argon2Config argon2();
    }

    /**
     * Argon2id cost parameters. Tune so one hash takes 100-300ms on production hardware.
     */
    interface Argon2Config {
        @WithDefault("3")
        int iterations();

        @WithName("memory-kb")
        @WithDefault("65536")
        int memoryKb();

        @WithDefault("4")
        int parallelism();
    }

    interface RegistrationConfig {
        @WithName("trial-days")
        @WithDefault("30")
        int trialDays();

        @WithName("default-branch-name")
        @WithDefault("Main Branch")
        String defaultBranchName();

        @WithName("default-branch-code")
        @WithDefault("MAIN")
        String defaultBranchCode();

        @WithName("phone-pattern")
        @WithDefault("^[6-9]\\d{9}$")
        String phonePattern();

        /**
         * Domain used for the tenant contact address when registration supplies no email.
         */
        @WithName("placeholder-email-domain")
        @WithDefault("medops.local")
        String placeholderEmailDomain();
    }

    interface PurgeConfig {
        @WithDefault("true")
        boolean enabled();

        @WithName("login-attempt-retention")
        @WithDefault("90d")
        String loginAttemptRetention();
    }
}
