package tech.medops.identity.otp;

/**
 * Outcome of a verification attempt.
 */
public enum OtpStatus {
    VERIFIED,
    /** No pending code for the pair, or it was already consumed. */
    NOT_FOUND,
    EXPIRED,
    EXHAUSTED,
    INVALID
}
