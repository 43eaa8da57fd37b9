package tech.medops.identity.authentication.attempt;

/**
 * Internal reason a login was refused. Recorded in the audit trail only;
 * callers always see a generic message.
 */
public enum LoginFailureReason {
    USER_NOT_FOUND("User not found"),
    ACCOUNT_LOCKED("Account locked"),
    ACCOUNT_INACTIVE("Account inactive"),
    INVALID_PASSWORD("Invalid password");

    private final String description;

    LoginFailureReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
