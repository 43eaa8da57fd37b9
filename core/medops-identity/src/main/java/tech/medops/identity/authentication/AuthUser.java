package tech.medops.identity.authentication;

import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.tenant.BranchMembership;
import tech.medops.identity.user.User;

import java.util.List;

/**
 * Sanitized user profile returned by login and get-current-user.
 * Carries no credential material and no lockout counters.
 */
public record AuthUser(
    String id,
    String tenantId,
    String name,
    String email,
    String phone,
    UserRole role,
    String avatarUrl,
    List<BranchMembership> branches,
    String primaryBranchId
) {

    public static AuthUser from(User user, List<BranchMembership> branches) {
        String primaryBranchId = branches.stream()
            .filter(BranchMembership::primary)
            .map(BranchMembership::branchId)
            .findFirst()
            .orElse(null);
        return new AuthUser(
            user.id,
            user.tenantId,
            user.name,
            user.email,
            user.phone,
            user.role,
            user.avatarUrl,
            List.copyOf(branches),
            primaryBranchId
        );
    }
}
