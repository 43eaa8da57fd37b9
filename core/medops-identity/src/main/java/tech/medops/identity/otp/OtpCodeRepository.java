package tech.medops.identity.otp;

import java.time.Instant;
import java.util.Optional;

public interface OtpCodeRepository {

    /**
     * In one transaction: mark every pending code for the same (phone, purpose)
     * consumed, then insert {@code otp}. A concurrent verify sees either the old
     * code or the new one, never both.
     */
    void replacePending(OtpCode otp, Instant now);

    /**
     * Most recent unconsumed code for the pair, expired or not.
     */
    Optional<OtpCode> findLatestPending(String phone, OtpPurpose purpose);

    /**
     * Atomic increment-and-fetch of the attempt counter.
     *
     * @return the counter value after this increment
     */
    int incrementAttempts(String otpId);

    /**
     * Consume the code if it is still unconsumed.
     *
     * @return true for exactly one caller
     */
    boolean markConsumed(String otpId, Instant now);

    /**
     * Delete codes that were consumed or expired before {@code cutoff}.
     */
    long deleteStaleBefore(Instant cutoff);
}
