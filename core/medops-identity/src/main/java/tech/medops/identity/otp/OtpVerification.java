package tech.medops.identity.otp;

/**
 * Verification result with a user-facing message. Internal counters are never exposed.
 */
public record OtpVerification(OtpStatus status, String message) {

    static OtpVerification verified() {
        return new OtpVerification(OtpStatus.VERIFIED, "OTP verified successfully");
    }

    static OtpVerification notFound() {
        return new OtpVerification(OtpStatus.NOT_FOUND, "Invalid or expired OTP");
    }

    static OtpVerification expired() {
        return new OtpVerification(OtpStatus.EXPIRED, "OTP has expired");
    }

    static OtpVerification exhausted() {
        return new OtpVerification(OtpStatus.EXHAUSTED, "Maximum attempts exceeded. Please request a new OTP.");
    }

    static OtpVerification invalid() {
        return new OtpVerification(OtpStatus.INVALID, "Invalid OTP");
    }

    public boolean valid() {
        return status == OtpStatus.VERIFIED;
    }
}
