package tech.medops.identity.user;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.medops.identity.authentication.AuthConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Password complexity rules and history reuse check.
 */
@ApplicationScoped
public class PasswordPolicy {

    static final String SPECIAL_CHARS = "!@#$%^&*()_+-=[]{}|;':\",./<>?`~\\";

    private final PasswordService passwordService;
    private final int minLength;

    @Inject
    public PasswordPolicy(PasswordService passwordService, AuthConfig config) {
        this.passwordService = passwordService;
        this.minLength = config.password().minLength();
    }

    /**
     * Check length and character classes. All violated rules are reported,
     * not just the first.
     */
    public PasswordValidation validateComplexity(String password) {
        String candidate = password == null ? "" : password;
        List<String> errors = new ArrayList<>();

        if (candidate.length() < minLength) {
            errors.add("Password must be at least " + minLength + " characters");
        }
        if (candidate.chars().noneMatch(Character::isUpperCase)) {
            errors.add("Password must contain at least one uppercase letter");
        }
        if (candidate.chars().noneMatch(Character::isLowerCase)) {
            errors.add("Password must contain at least one lowercase letter");
        }
        if (candidate.chars().noneMatch(Character::isDigit)) {
            errors.add("Password must contain at least one number");
        }
        if (candidate.chars().noneMatch(ch -> SPECIAL_CHARS.indexOf(ch) >= 0)) {
            errors.add("Password must contain at least one special character");
        }

        return errors.isEmpty() ? PasswordValidation.ok() : PasswordValidation.failed(errors);
    }

    /**
     * Check the candidate against the first {@code limit} hashes, most recent
     * first. Stops at the first match.
     */
    public boolean isReused(String candidate, List<String> recentHashes, int limit) {
        if (candidate == null || recentHashes == null) {
            return false;
        }
        int checked = 0;
        for (String hash : recentHashes) {
            if (checked >= limit) {
                break;
            }
            checked++;
            if (passwordService.verify(candidate, hash)) {
                return true;
            }
        }
        return false;
    }
}
