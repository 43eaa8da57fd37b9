package tech.medops.identity.tenant;

import java.util.List;

public interface BranchRepository {

    /**
     * Active branch assignments of a user, primary first.
     */
    List<BranchMembership> findMembershipsForUser(String userId);
}
