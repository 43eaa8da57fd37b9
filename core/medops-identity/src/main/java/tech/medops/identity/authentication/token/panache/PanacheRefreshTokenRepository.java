package tech.medops.identity.authentication.token.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.medops.identity.authentication.token.RefreshToken;
import tech.medops.identity.authentication.token.RefreshTokenRepository;
import tech.medops.identity.authentication.token.entity.RefreshTokenEntity;
import tech.medops.identity.authentication.token.mapper.RefreshTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(RefreshToken token) {
        persist(RefreshTokenMapper.toEntity(token));
    }

    @Override
    @Transactional
    public boolean revoke(String tokenHash, String replacedBy, Instant now) {
        return update("revokedAt = ?1, replacedBy = ?2 where tokenHash = ?3 and revokedAt is null",
            now, replacedBy, tokenHash) > 0;
    }

    @Override
    @Transactional
    public int revokeAllForUser(String userId, Instant now) {
        return update("revokedAt = ?1 where userId = ?2 and revokedAt is null", now, userId);
    }

    @Override
    @Transactional
    public long deleteExpiredBefore(Instant cutoff) {
        return delete("expiresAt < ?1", cutoff);
    }
}
