package tech.medops.identity.authentication.attempt.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import tech.medops.identity.authentication.attempt.LoginFailureReason;

import java.time.Instant;

/**
 * JPA entity for login_attempts table.
 */
@Entity
@Table(name = "login_attempts")
public class LoginAttemptEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "phone", nullable = false, length = 20)
    public String phone;

    @Column(name = "tenant_id", length = 17)
    public String tenantId;

    @Column(name = "user_id", length = 17)
    public String userId;

    @Column(name = "ip_address", length = 64)
    public String ipAddress;

    @Column(name = "user_agent", length = 512)
    public String userAgent;

    @Column(name = "success", nullable = false)
    public boolean success;

    @Column(name = "failure_reason", length = 50)
    @Enumerated(EnumType.STRING)
    public LoginFailureReason failureReason;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public LoginAttemptEntity() {
    }
}
