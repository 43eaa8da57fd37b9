package tech.medops.identity.otp.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.medops.identity.otp.OtpCode;
import tech.medops.identity.otp.OtpCodeRepository;
import tech.medops.identity.otp.OtpPurpose;
import tech.medops.identity.otp.entity.OtpCodeEntity;
import tech.medops.identity.otp.mapper.OtpCodeMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of OtpCodeRepository.
 */
@ApplicationScoped
public class PanacheOtpCodeRepository
    implements OtpCodeRepository, PanacheRepositoryBase<OtpCodeEntity, String> {

    @Override
    @Transactional
    public void replacePending(OtpCode otp, Instant now) {
        // Serialize concurrent issues for the same phone and purpose until commit
        getEntityManager()
            .createNativeQuery("SELECT COUNT(*) FROM (SELECT pg_advisory_xact_lock(hashtext(:key))) locked")
            .setParameter("key", otp.phone + ":" + otp.purpose.code())
            .getSingleResult();
        update("consumedAt = :now where phone = :phone and purpose = :purpose and consumedAt is null",
            Parameters.with("now", now).and("phone", otp.phone).and("purpose", otp.purpose));
        persist(OtpCodeMapper.toEntity(otp));
    }

    @Override
    public Optional<OtpCode> findLatestPending(String phone, OtpPurpose purpose) {
        return find("phone = ?1 and purpose = ?2 and consumedAt is null", Sort.descending("createdAt"), phone, purpose)
            .firstResultOptional()
            .map(OtpCodeMapper::toDomain);
    }

    @Override
    @Transactional
    public int incrementAttempts(String otpId) {
        update("attempts = attempts + 1 where id = ?1", otpId);
        // Row stays locked by the update until commit, so this read sees our own increment
        return getEntityManager().createQuery(
                "SELECT o.attempts FROM OtpCodeEntity o WHERE o.id = :id", Integer.class)
            .setParameter("id", otpId)
            .getSingleResult();
    }

    @Override
    @Transactional
    public boolean markConsumed(String otpId, Instant now) {
        return update("consumedAt = ?1 where id = ?2 and consumedAt is null", now, otpId) == 1;
    }

    @Override
    @Transactional
    public long deleteStaleBefore(Instant cutoff) {
        return delete("(consumedAt is not null and consumedAt < ?1) or expiresAt < ?1", cutoff);
    }
}
