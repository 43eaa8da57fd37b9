package tech.medops.identity.audit;

public final class AuditEntityType {

    public static final String USER = "user";
    public static final String TENANT = "tenant";

    private AuditEntityType() {
    }
}
