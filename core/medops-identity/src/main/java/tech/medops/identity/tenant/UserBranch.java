package tech.medops.identity.tenant;

import java.time.Instant;

/**
 * Assignment of a user to a branch. Exactly one assignment per user is primary.
 */
public class UserBranch {

    public String id;

    public String tenantId;

    public String userId;

    public String branchId;

    public boolean primary;

    public Instant createdAt;

    public UserBranch() {
    }
}
