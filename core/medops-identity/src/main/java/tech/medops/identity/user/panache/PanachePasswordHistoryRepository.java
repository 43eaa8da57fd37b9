package tech.medops.identity.user.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.medops.identity.user.PasswordHistory;
import tech.medops.identity.user.PasswordHistoryRepository;
import tech.medops.identity.user.entity.PasswordHistoryEntity;
import tech.medops.identity.user.mapper.PasswordHistoryMapper;

import java.util.List;

/**
 * Panache-based implementation of PasswordHistoryRepository.
 */
@ApplicationScoped
public class PanachePasswordHistoryRepository
    implements PasswordHistoryRepository, PanacheRepositoryBase<PasswordHistoryEntity, String> {

    @Override
    public List<String> findRecentHashes(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return find("userId", Sort.descending("createdAt"), userId)
            .page(Page.ofSize(limit))
            .list()
            .stream()
            .map(entity -> entity.passwordHash)
            .toList();
    }

    /**
     * @throws IllegalArgumentException when the entry carries no timestamp
     */
    @Override
    @Transactional
    public void append(PasswordHistory entry) {
        if (entry.createdAt == null) {
            throw new IllegalArgumentException("Password history entry " + entry.id + " has no createdAt");
        }
        persist(PasswordHistoryMapper.toEntity(entry));
    }
}
