package tech.medops.identity.notification;

import tech.medops.identity.otp.OtpPurpose;

/**
 * Hands a freshly issued one-time code to the channel that reaches the user.
 *
 * <p>Delivery is fire-and-forget. The code is already stored when this is
 * called, so a failed delivery can simply be requested again.
 */
public interface OtpDeliveryService {

    void deliverOtp(String phone, String code, OtpPurpose purpose);
}
