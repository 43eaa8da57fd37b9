package tech.medops.identity.authentication.attempt.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.medops.identity.authentication.attempt.LoginAttempt;
import tech.medops.identity.authentication.attempt.LoginAttemptRepository;
import tech.medops.identity.authentication.attempt.entity.LoginAttemptEntity;

import java.time.Instant;

/**
 * Panache-based implementation of LoginAttemptRepository.
 */
@ApplicationScoped
public class PanacheLoginAttemptRepository
    implements LoginAttemptRepository, PanacheRepositoryBase<LoginAttemptEntity, String> {

    @Override
    @Transactional
    public void record(LoginAttempt attempt) {
        LoginAttemptEntity entity = new LoginAttemptEntity();
        entity.id = attempt.id;
        entity.phone = attempt.phone;
        entity.tenantId = attempt.tenantId;
        entity.userId = attempt.userId;
        entity.ipAddress = attempt.ipAddress;
        entity.userAgent = attempt.userAgent;
        entity.success = attempt.success;
        entity.failureReason = attempt.failureReason;
        entity.createdAt = attempt.createdAt;
        persist(entity);
    }

    @Override
    @Transactional
    public long deleteOlderThan(Instant cutoff) {
        return delete("createdAt < ?1", cutoff);
    }
}
