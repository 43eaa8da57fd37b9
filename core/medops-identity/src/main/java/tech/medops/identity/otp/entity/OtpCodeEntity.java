package tech.medops.identity.otp.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import tech.medops.identity.otp.OtpPurpose;

import java.time.Instant;

/**
 * JPA entity for otp_codes table.
 */
@Entity
@Table(name = "otp_codes")
public class OtpCodeEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "phone", nullable = false, length = 20)
    public String phone;

    @Column(name = "tenant_id", length = 17)
    public String tenantId;

    @Column(name = "purpose", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    public OtpPurpose purpose;

    @Column(name = "code_hash", nullable = false, length = 64)
    public String codeHash;

    @Column(name = "attempts", nullable = false)
    public int attempts;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "consumed_at")
    public Instant consumedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public OtpCodeEntity() {
    }
}
