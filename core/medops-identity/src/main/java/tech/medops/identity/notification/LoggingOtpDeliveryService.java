package tech.medops.identity.notification;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.medops.identity.otp.OtpPurpose;
import tech.medops.identity.otp.OtpService;

/**
 * Placeholder delivery that logs the hand-off instead of sending an SMS.
 * Deployments replace it by providing their own {@link OtpDeliveryService} bean.
 */
@DefaultBean
@ApplicationScoped
public class LoggingOtpDeliveryService implements OtpDeliveryService {

    private static final Logger LOG = Logger.getLogger(LoggingOtpDeliveryService.class);

    @Override
    public void deliverOtp(String phone, String code, OtpPurpose purpose) {
        LOG.infof("OTP DELIVERY: [%s] to %s", purpose.code(), OtpService.maskPhone(phone));
    }
}
