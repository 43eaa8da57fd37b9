package tech.medops.identity.user;

import java.util.List;

public interface PasswordHistoryRepository {

    /**
     * Most recent hashes first.
     */
    List<String> findRecentHashes(String userId, int limit);

    void append(PasswordHistory entry);
}
