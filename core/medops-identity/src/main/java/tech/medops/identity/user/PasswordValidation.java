package tech.medops.identity.user;

import java.util.List;

/**
 * Outcome of a complexity check. {@code errors} lists every violated rule.
 */
public record PasswordValidation(boolean valid, List<String> errors) {

    public static PasswordValidation ok() {
        return new PasswordValidation(true, List.of());
    }

    public static PasswordValidation failed(List<String> errors) {
        return new PasswordValidation(false, List.copyOf(errors));
    }
}
