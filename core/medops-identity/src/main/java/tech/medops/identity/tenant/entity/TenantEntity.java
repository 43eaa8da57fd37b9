package tech.medops.identity.tenant.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import tech.medops.identity.tenant.TenantStatus;

import java.time.Instant;

/**
 * JPA entity for tenants table.
 */
@Entity
@Table(name = "tenants")
public class TenantEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false)
    public String name;

    @Column(name = "slug", nullable = false, unique = true, length = 100)
    public String slug;

    @Column(name = "email", nullable = false)
    public String email;

    @Column(name = "phone", length = 20)
    public String phone;

    @Column(name = "subscription_plan", nullable = false, length = 50)
    public String subscriptionPlan;

    @Column(name = "status", nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    public TenantStatus status;

    @Column(name = "trial_ends_at")
    public Instant trialEndsAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public TenantEntity() {
    }
}
