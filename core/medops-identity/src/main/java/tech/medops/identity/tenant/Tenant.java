package tech.medops.identity.tenant;

import java.time.Instant;

/**
 * Isolated customer organisation. Every other identity record carries its id.
 */
public class Tenant {

    public static final String PLAN_TRIAL = "trial";

    public String id;

    public String name;

    /**
     * URL-safe unique key derived from the name.
     */
    public String slug;

    public String email;

    public String phone;

    public String subscriptionPlan;

    public TenantStatus status = TenantStatus.ACTIVE;

    public Instant trialEndsAt;

    public Instant createdAt;

    public Instant updatedAt;

    public Tenant() {
    }
}
