package tech.medops.identity.maintenance;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.medops.identity.authentication.AuthConfig;
import tech.medops.identity.authentication.attempt.LoginAttemptRepository;
import tech.medops.identity.authentication.token.RefreshTokenRepository;
import tech.medops.identity.common.CompactDurations;
import tech.medops.identity.otp.OtpCodeRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Hourly cleanup of credential rows that can no longer be used.
 *
 * <p>Refresh tokens and one-time codes are kept for a day past their useful
 * life so revoked or expired credentials still show up when investigating a
 * report. Login attempts are kept for the configured retention.
 */
@ApplicationScoped
public class ExpiredCredentialPurgeJob {

    private static final Logger LOG = Logger.getLogger(ExpiredCredentialPurgeJob.class);
    private static final Duration GRACE = Duration.ofDays(1);
    private static final long DEFAULT_ATTEMPT_RETENTION_SECONDS = 90L * 86400;

    @Inject
    AuthConfig config;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    OtpCodeRepository otpCodeRepository;

    @Inject
    LoginAttemptRepository loginAttemptRepository;

    @Inject
    Clock clock;

    @Scheduled(every = "1h", delayed = "5m", identity = "expired-credential-purge")
    void run() {
        if (!config.purge().enabled()) {
            return;
        }

        try {
            purge();
        } catch (Exception e) {
            LOG.errorf(e, "Error purging expired credentials");
        }
    }

    void purge() {
        Instant now = clock.instant();
        Instant credentialCutoff = now.minus(GRACE);
        long retention = CompactDurations.toSeconds(
            config.purge().loginAttemptRetention(), DEFAULT_ATTEMPT_RETENTION_SECONDS);

        long tokens = refreshTokenRepository.deleteExpiredBefore(credentialCutoff);
        long codes = otpCodeRepository.deleteStaleBefore(credentialCutoff);
        long attempts = loginAttemptRepository.deleteOlderThan(now.minusSeconds(retention));

        if (tokens + codes + attempts == 0) {
            LOG.trace("Nothing to purge");
            return;
        }
        LOG.infof("Purged %d refresh tokens, %d OTP codes and %d login attempts", tokens, codes, attempts);
    }
}
