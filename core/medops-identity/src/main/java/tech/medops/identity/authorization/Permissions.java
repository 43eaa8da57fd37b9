package tech.medops.identity.authorization;

/**
 * Capability strings granted to roles.
 *
 * Format: {@code resource:action} or {@code resource:action:qualifier}.
 * {@code resource:*} grants every action on the resource and {@link #ALL}
 * grants everything.
 */
public final class Permissions {

    public static final String ALL = "*";
    public static final String WILDCARD_ACTION = "*";

    // Tenant
    public static final String TENANTS_READ = "tenants:read";
    public static final String TENANTS_WRITE = "tenants:write";
    public static final String TENANTS_MANAGE = "tenants:*";

    // Branches
    public static final String BRANCHES_READ = "branches:read";
    public static final String BRANCHES_WRITE = "branches:write";
    public static final String BRANCHES_CREATE = "branches:create";
    public static final String BRANCHES_DELETE = "branches:delete";
    public static final String BRANCHES_MANAGE = "branches:*";

    // Users / staff
    public static final String USERS_READ = "users:read";
    public static final String USERS_WRITE = "users:write";
    public static final String USERS_CREATE = "users:create";
    public static final String USERS_DELETE = "users:delete";
    public static final String USERS_MANAGE = "users:*";

    public static final String AUDIT_READ = "audit:read";

    // Patients
    public static final String PATIENTS_READ = "patients:read";
    public static final String PATIENTS_WRITE = "patients:write";
    public static final String PATIENTS_READ_LIMITED = "patients:read:limited";
    public static final String PATIENTS_MANAGE = "patients:*";

    // Appointments
    public static final String APPOINTMENTS_READ = "appointments:read";
    public static final String APPOINTMENTS_WRITE = "appointments:write";
    public static final String APPOINTMENTS_READ_OWN = "appointments:read:own";
    public static final String APPOINTMENTS_WRITE_OWN = "appointments:write:own";
    public static final String APPOINTMENTS_MANAGE = "appointments:*";

    // Clinical
    public static final String CONSULTATIONS_READ = "consultations:read";
    public static final String CONSULTATIONS_WRITE = "consultations:write";
    public static final String CONSULTATIONS_MANAGE = "consultations:*";
    public static final String PRESCRIPTIONS_READ = "prescriptions:read";
    public static final String PRESCRIPTIONS_WRITE = "prescriptions:write";
    public static final String PRESCRIPTIONS_MANAGE = "prescriptions:*";
    public static final String IPD_READ = "ipd:read";
    public static final String IPD_WRITE = "ipd:write";
    public static final String IPD_WRITE_OWN = "ipd:write:own";
    public static final String IPD_WRITE_NURSING = "ipd:write:nursing";
    public static final String IPD_MANAGE = "ipd:*";
    public static final String VITALS_READ = "vitals:read";
    public static final String VITALS_WRITE = "vitals:write";
    public static final String MEDICATION_ADMIN_WRITE = "medication_admin:write";

    // Laboratory
    public static final String LAB_ORDERS_READ = "lab_orders:read";
    public static final String LAB_ORDERS_WRITE = "lab_orders:write";
    public static final String LAB_RESULTS_READ = "lab_results:read";
    public static final String LAB_RESULTS_WRITE = "lab_results:write";
    public static final String SAMPLES_MANAGE = "samples:*";

    // Pharmacy
    public static final String DISPENSING_READ = "dispensing:read";
    public static final String DISPENSING_WRITE = "dispensing:write";
    public static final String DISPENSING_MANAGE = "dispensing:*";

    public static final String QUEUE_MANAGE = "queue:*";

    // Finance
    public static final String BILLING_READ = "billing:read";
    public static final String BILLING_WRITE = "billing:write";
    public static final String BILLING_MANAGE = "billing:*";
    public static final String INSURANCE_READ = "insurance:read";
    public static final String INSURANCE_WRITE = "insurance:write";

    // Reports
    public static final String REPORTS_READ = "reports:read";
    public static final String REPORTS_READ_BRANCH = "reports:read:branch";
    public static final String REPORTS_READ_FINANCIAL = "reports:read:financial";
    public static final String REPORTS_MANAGE = "reports:*";

    // Inventory
    public static final String INVENTORY_READ = "inventory:read";
    public static final String INVENTORY_WRITE = "inventory:write";
    public static final String INVENTORY_MANAGE = "inventory:*";

    public static final String SETTINGS_MANAGE = "settings:manage";

    /**
     * Resource part of a permission string ({@code users} for {@code users:write}).
     */
    public static String resourceOf(String permission) {
        int colon = permission.indexOf(':');
        return colon < 0 ? permission : permission.substring(0, colon);
    }

    private Permissions() {
    }
}
