package tech.medops.identity.tenant;

public enum TenantStatus {
    ACTIVE,
    SUSPENDED,
    CANCELLED
}
