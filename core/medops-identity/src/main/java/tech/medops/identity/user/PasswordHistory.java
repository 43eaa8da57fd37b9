package tech.medops.identity.user;

import java.time.Instant;

/**
 * One prior password hash of a user. Append-only.
 */
public class PasswordHistory {

    public String id;

    public String userId;

    public String passwordHash;

    public Instant createdAt;

    public PasswordHistory() {
    }
}
