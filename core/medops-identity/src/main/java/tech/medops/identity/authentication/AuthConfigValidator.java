package tech.medops.identity.authentication;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.medops.identity.common.CompactDurations;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects malformed identity configuration at startup.
 *
 * <p>{@link TokenService#parseExpiry(String)} falls back to 900 seconds on a bad
 * value at runtime; this check makes sure such a value never reaches a running
 * instance in the first place.
 */
@ApplicationScoped
public class AuthConfigValidator {

    private static final Logger LOG = Logger.getLogger(AuthConfigValidator.class);

    @Inject
    AuthConfig config;

    void onStart(@Observes StartupEvent event) {
        validate(config);
        LOG.infof("Identity configuration validated (access token %s, refresh token %s, lockout %d attempts / %s)",
            config.jwt().accessTokenExpiry(), config.refresh().expiry(),
            config.lockout().maxFailedAttempts(), config.lockout().duration());
    }

    /**
     * @throws IllegalStateException listing every invalid key
     */
    static void validate(AuthConfig config) {
        Map<String, String> durations = new LinkedHashMap<>();
        durations.put("medops.auth.jwt.access-token-expiry", config.jwt().accessTokenExpiry());
        durations.put("medops.auth.refresh.expiry", config.refresh().expiry());
        durations.put("medops.auth.lockout.duration", config.lockout().duration());
        durations.put("medops.auth.otp.expiry", config.otp().expiry());
        durations.put("medops.auth.purge.login-attempt-retention", config.purge().loginAttemptRetention());

        List<String> problems = new ArrayList<>();
        durations.forEach((key, value) -> {
            if (!CompactDurations.isValid(value) || CompactDurations.toSeconds(value, 0) <= 0) {
                problems.add(key + "='" + value + "' is not a positive duration like 15m, 12h or 7d");
            }
        });

        if (config.lockout().maxFailedAttempts() < 1) {
            problems.add("medops.auth.lockout.max-failed-attempts must be at least 1");
        }
        if (config.otp().length() < 4 || config.otp().length() > 9) {
            problems.add("medops.auth.otp.length must be between 4 and 9");
        }
        if (config.otp().maxAttempts() < 1) {
            problems.add("medops.auth.otp.max-attempts must be at least 1");
        }
        if (config.password().historyLimit() < 0) {
            problems.add("medops.auth.password.history-limit must not be negative");
        }
        try {
            Pattern.compile(config.registration().phonePattern());
        } catch (PatternSyntaxException e) {
            problems.add("medops.auth.registration.phone-pattern is not a valid regular expression: " + e.getDescription());
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid identity configuration: " + String.join("; ", problems));
        }
    }
}
