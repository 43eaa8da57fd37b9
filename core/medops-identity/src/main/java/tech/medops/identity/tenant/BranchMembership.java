package tech.medops.identity.tenant;

/**
 * Read model of a user's branch assignment joined with the branch details.
 *
 * @param id         the assignment id
 * @param branchId   the branch id
 * @param branchName display name of the branch
 * @param branchCode short branch code
 * @param primary    whether this is the user's primary branch
 */
public record BranchMembership(
    String id,
    String branchId,
    String branchName,
    String branchCode,
    boolean primary
) {}
