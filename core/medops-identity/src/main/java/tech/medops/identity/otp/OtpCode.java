package tech.medops.identity.otp;

import java.time.Instant;

/**
 * One-time code bound to (phone, purpose).
 *
 * <p>State is derived from the fields: pending while {@code consumedAt} is null
 * and {@code expiresAt} is in the future; at most one pending code exists per
 * (phone, purpose).
 */
public class OtpCode {

    public String id;

    public String phone;

    public String tenantId;

    public OtpPurpose purpose;

    /**
     * SHA-256 digest of the code, never the code itself.
     */
    public String codeHash;

    public int attempts;

    public Instant expiresAt;

    public Instant consumedAt;

    public Instant createdAt;

    public OtpCode() {
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
