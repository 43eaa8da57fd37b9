package tech.medops.identity.authorization;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed set of staff roles, ordered by rank.
 *
 * <p>Administrative roles outrank clinical roles, which outrank front-desk and
 * support roles. Roles sharing a rank are peers and cannot manage each other.
 */
public enum UserRole {

    SUPER_ADMIN("super_admin", "Super Admin", 100),
    BRANCH_ADMIN("branch_admin", "Branch Admin", 80),
    DOCTOR("doctor", "Doctor", 60),
    NURSE("nurse", "Nurse", 50),
    RECEPTIONIST("receptionist", "Receptionist", 40),
    PHARMACIST("pharmacist", "Pharmacist", 40),
    LAB_TECH("lab_tech", "Lab Technician", 40),
    ACCOUNTANT("accountant", "Accountant", 40);

    private final String code;
    private final String displayName;
    private final int rank;

    UserRole(String code, String displayName, int rank) {
        this.code = code;
        this.displayName = displayName;
        this.rank = rank;
    }

    /**
     * Wire and storage form, e.g. {@code branch_admin}.
     */
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public int rank() {
        return rank;
    }

    /**
     * The top-ranked role, granted to the owner of a newly registered tenant.
     */
    public static UserRole highest() {
        return Arrays.stream(values())
            .max((a, b) -> Integer.compare(a.rank, b.rank))
            .orElseThrow();
    }

    public static Optional<UserRole> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (UserRole role : values()) {
            if (role.code.equals(code)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
