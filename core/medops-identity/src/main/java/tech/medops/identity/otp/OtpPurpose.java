package tech.medops.identity.otp;

import java.util.Optional;

/**
 * What a one-time code may be used for. Codes never cross purposes.
 */
public enum OtpPurpose {
    LOGIN("login"),
    REGISTER("register"),
    RESET_PASSWORD("reset_password"),
    VERIFY_PHONE("verify_phone");

    private final String code;

    OtpPurpose(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Purposes that only make sense for an already registered phone. Requests
     * for unknown phones are answered generically and nothing is stored.
     */
    public boolean requiresRegisteredUser() {
        return this == LOGIN || this == RESET_PASSWORD;
    }

    public static Optional<OtpPurpose> fromCode(String code) {
        for (OtpPurpose purpose : values()) {
            if (purpose.code.equals(code)) {
                return Optional.of(purpose);
            }
        }
        return Optional.empty();
    }
}
