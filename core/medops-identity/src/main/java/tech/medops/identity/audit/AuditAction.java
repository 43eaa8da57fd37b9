package tech.medops.identity.audit;

/**
 * Action names written to the audit trail.
 */
public final class AuditAction {

    public static final String LOGIN_SUCCESS = "auth.login_success";
    public static final String LOGIN_FAILED = "auth.login_failed";
    public static final String ACCOUNT_LOCKED = "auth.account_locked";
    public static final String LOGOUT = "auth.logout";
    public static final String LOGOUT_ALL = "auth.logout_all";
    public static final String PASSWORD_CHANGE = "auth.password_change";
    public static final String PASSWORD_RESET = "auth.password_reset";

    public static final String TENANT_REGISTER = "tenant.register";

    public static final String USER_UNLOCK = "user.unlock";
    public static final String USER_DEACTIVATE = "user.deactivate";
    public static final String USER_REACTIVATE = "user.reactivate";
    public static final String USER_ROLE_CHANGE = "user.role_change";

    private AuditAction() {
    }
}
