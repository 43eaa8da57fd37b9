package tech.medops.identity.authorization;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static tech.medops.identity.authorization.Permissions.*;

/**
 * Role to capability table.
 *
 * <p>Every {@link UserRole} must have an entry; {@link #missingRoles()} is
 * checked at startup by {@link PermissionResolver}.
 */
final class RolePermissions {

    private static final Map<UserRole, Set<String>> TABLE = new EnumMap<>(UserRole.class);

    static {
        grant(UserRole.SUPER_ADMIN, ALL);

        grant(UserRole.BRANCH_ADMIN,
            TENANTS_READ,
            BRANCHES_READ,
            USERS_READ,
            USERS_WRITE,
            USERS_CREATE,
            USERS_DELETE,
            PATIENTS_MANAGE,
            APPOINTMENTS_MANAGE,
            CONSULTATIONS_MANAGE,
            PRESCRIPTIONS_MANAGE,
            BILLING_MANAGE,
            REPORTS_READ,
            INVENTORY_MANAGE,
            AUDIT_READ);

        grant(UserRole.DOCTOR,
            PATIENTS_READ,
            PATIENTS_WRITE,
            APPOINTMENTS_READ,
            APPOINTMENTS_WRITE_OWN,
            CONSULTATIONS_MANAGE,
            PRESCRIPTIONS_MANAGE,
            LAB_ORDERS_WRITE,
            LAB_RESULTS_READ,
            IPD_READ,
            IPD_WRITE_OWN);

        grant(UserRole.NURSE,
            PATIENTS_READ,
            APPOINTMENTS_READ,
            VITALS_WRITE,
            IPD_READ,
            IPD_WRITE_NURSING,
            MEDICATION_ADMIN_WRITE);

        grant(UserRole.RECEPTIONIST,
            PATIENTS_READ,
            PATIENTS_WRITE,
            APPOINTMENTS_MANAGE,
            BILLING_READ,
            BILLING_WRITE,
            QUEUE_MANAGE);

        grant(UserRole.PHARMACIST,
            PATIENTS_READ_LIMITED,
            PRESCRIPTIONS_READ,
            DISPENSING_MANAGE,
            INVENTORY_MANAGE);

        grant(UserRole.LAB_TECH,
            PATIENTS_READ_LIMITED,
            LAB_ORDERS_READ,
            LAB_RESULTS_WRITE,
            SAMPLES_MANAGE);

        grant(UserRole.ACCOUNTANT,
            TENANTS_READ,
            BRANCHES_READ,
            USERS_READ,
            BILLING_READ,
            REPORTS_READ,
            REPORTS_READ_FINANCIAL,
            INSURANCE_READ,
            AUDIT_READ);
    }

    private static void grant(UserRole role, String... permissions) {
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set, permissions);
        TABLE.put(role, Collections.unmodifiableSet(set));
    }

    /**
     * @throws IllegalStateException if the role has no entry
     */
    static Set<String> of(UserRole role) {
        Set<String> permissions = TABLE.get(role);
        if (permissions == null) {
            throw new IllegalStateException("No permission set defined for role " + role.code());
        }
        return permissions;
    }

    static Set<UserRole> missingRoles() {
        Set<UserRole> missing = EnumSet.allOf(UserRole.class);
        missing.removeAll(TABLE.keySet());
        return missing;
    }

    private RolePermissions() {
    }
}
