package tech.medops.identity.shared;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix: "{prefix}_{tsid}" (e.g., "usr_0HZXEQ5Y8JY5Z"),
 * 17 characters in total.
 *
 * <pre>
 * String id = TsidGenerator.generate(EntityType.USER);  // "usr_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Organisation
    TENANT("ten"),
    BRANCH("brn"),
    USER("usr"),
    USER_BRANCH("ubr"),

    // Credentials
    OTP_CODE("otp"),
    PASSWORD_HISTORY("pwh"),

    // Audit trail
    LOGIN_ATTEMPT("lat"),
    AUDIT_LOG("aud");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
