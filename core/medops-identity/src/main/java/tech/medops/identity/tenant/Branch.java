package tech.medops.identity.tenant;

import java.time.Instant;

/**
 * Physical site within a tenant.
 */
public class Branch {

    public String id;

    public String tenantId;

    public String name;

    public String code;

    public boolean active = true;

    public Instant createdAt;

    public Instant updatedAt;

    public Branch() {
    }
}
