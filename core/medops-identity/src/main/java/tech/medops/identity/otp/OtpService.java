package tech.medops.identity.otp;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.medops.identity.authentication.AuthConfig;
import tech.medops.identity.common.CompactDurations;
import tech.medops.identity.shared.EntityType;
import tech.medops.identity.shared.TsidGenerator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Generates, stores and verifies one-time codes.
 *
 * <p>Per (phone, purpose) a code moves from pending to exactly one of
 * verified, expired or exhausted. Issuing a new code consumes the previous
 * pending one. Every verification attempt on a pending code increments its
 * attempt counter before the comparison, so guesses burn the budget
 * deterministically.
 */
@ApplicationScoped
public class OtpService {

    private static final Logger LOG = Logger.getLogger(OtpService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final char MASK_CHAR = '*';
    private static final int MASK_VISIBLE_DIGITS = 4;
    private static final int MASK_MIN_LENGTH = 6;

    private final OtpCodeRepository otpCodeRepository;
    private final Clock clock;
    private final int length;
    private final int maxAttempts;
    private final long expirySeconds;

    @Inject
    public OtpService(OtpCodeRepository otpCodeRepository, AuthConfig config, Clock clock) {
        this.otpCodeRepository = otpCodeRepository;
        this.clock = clock;
        this.length = config.otp().length();
        this.maxAttempts = config.otp().maxAttempts();
        this.expirySeconds = CompactDurations.toSeconds(config.otp().expiry(), 600);
    }

    /**
     * Random numeric code of the configured length; the first digit is never zero.
     */
    public String generate() {
        int lower = (int) Math.pow(10, length - 1);
        int upper = (int) Math.pow(10, length);
        return Integer.toString(lower + SECURE_RANDOM.nextInt(upper - lower));
    }

    public Instant expiry() {
        return clock.instant().plusSeconds(expirySeconds);
    }

    public long expirySeconds() {
        return expirySeconds;
    }

    /**
     * Generate and store a new code, invalidating any pending code for the pair.
     */
    public IssuedOtp issue(String phone, OtpPurpose purpose, String tenantId) {
        Instant now = clock.instant();
        String code = generate();

        OtpCode otp = new OtpCode();
        otp.id = TsidGenerator.generate(EntityType.OTP_CODE);
        otp.phone = phone;
        otp.tenantId = tenantId;
        otp.purpose = purpose;
        otp.codeHash = digest(otp.id, code);
        otp.attempts = 0;
        otp.expiresAt = now.plusSeconds(expirySeconds);
        otp.createdAt = now;

        otpCodeRepository.replacePending(otp, now);
        LOG.debugf("Issued %s OTP %s for %s", purpose.code(), otp.id, maskPhone(phone));
        return new IssuedOtp(otp.id, code, otp.expiresAt);
    }

    public OtpVerification verify(String phone, String code, OtpPurpose purpose) {
        Optional<OtpCode> pending = otpCodeRepository.findLatestPending(phone, purpose);
        if (pending.isEmpty()) {
            return OtpVerification.notFound();
        }

        OtpCode otp = pending.get();
        Instant now = clock.instant();
        int attempts = otpCodeRepository.incrementAttempts(otp.id);

        if (otp.isExpiredAt(now)) {
            return OtpVerification.expired();
        }
        if (attempts > maxAttempts) {
            LOG.debugf("OTP %s exhausted for %s", otp.id, maskPhone(phone));
            return OtpVerification.exhausted();
        }

        byte[] expected = otp.codeHash.getBytes(StandardCharsets.US_ASCII);
        byte[] actual = digest(otp.id, code == null ? "" : code).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            return OtpVerification.invalid();
        }

        if (!otpCodeRepository.markConsumed(otp.id, now)) {
            // Consumed concurrently by another request
            return OtpVerification.notFound();
        }
        return OtpVerification.verified();
    }

    /**
     * Display-safe phone: every digit but the last four replaced with '*'.
     * Numbers shorter than six characters are returned unchanged.
     */
    public static String maskPhone(String phone) {
        if (phone == null || phone.length() < MASK_MIN_LENGTH) {
            return phone;
        }
        int hidden = phone.length() - MASK_VISIBLE_DIGITS;
        return String.valueOf(MASK_CHAR).repeat(hidden) + phone.substring(hidden);
    }

    static String digest(String otpId, String code) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((otpId + ":" + code).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
