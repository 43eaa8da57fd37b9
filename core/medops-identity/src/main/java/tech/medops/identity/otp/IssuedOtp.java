package tech.medops.identity.otp;

import java.time.Instant;

/**
 * A freshly stored code. {@code code} is only handed to the delivery channel.
 */
public record IssuedOtp(String id, String code, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedOtp[id=" + id + ", expiresAt=" + expiresAt + "]";
    }
}
