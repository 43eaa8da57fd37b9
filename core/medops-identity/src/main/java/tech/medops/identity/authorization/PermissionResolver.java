package tech.medops.identity.authorization;

import io.quarkus.logging.Log;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves roles to capability sets and answers rank comparisons.
 *
 * Permission checks honour two wildcards:
 * <ul>
 *   <li>{@code *} grants every permission</li>
 *   <li>{@code resource:*} grants every action on {@code resource}</li>
 * </ul>
 *
 * This service ONLY answers RBAC questions. Tenant isolation is enforced by
 * the callers.
 */
@ApplicationScoped
@Startup
public class PermissionResolver {

    void onStart(@Observes StartupEvent event) {
        verifyRoleTable();
        Log.info("PermissionResolver ready with " + UserRole.values().length + " roles");
    }

    /**
     * Fail fast when a role was added without a permission entry.
     *
     * @throws IllegalStateException naming the roles without a permission set
     */
    public void verifyRoleTable() {
        Set<UserRole> missing = RolePermissions.missingRoles();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Roles without a permission set: " +
                missing.stream().map(UserRole::code).collect(Collectors.joining(", ")));
        }
    }

    /**
     * Capability set granted to a role, as stored (wildcards unexpanded).
     */
    public Set<String> permissionsFor(UserRole role) {
        return RolePermissions.of(role);
    }

    /**
     * Check a single permission against a role, expanding wildcards.
     */
    public boolean hasPermission(UserRole role, String permission) {
        if (role == null || permission == null || permission.isBlank()) {
            return false;
        }
        Set<String> granted = RolePermissions.of(role);
        if (granted.contains(Permissions.ALL)) {
            return true;
        }
        if (granted.contains(permission)) {
            return true;
        }
        return granted.contains(Permissions.resourceOf(permission) + ":" + Permissions.WILDCARD_ACTION);
    }

    public boolean hasAny(UserRole role, Collection<String> required) {
        return required.stream().anyMatch(permission -> hasPermission(role, permission));
    }

    /**
     * True when every required permission is granted. An empty requirement is always satisfied.
     */
    public boolean hasAll(UserRole role, Collection<String> required) {
        return required.stream().allMatch(permission -> hasPermission(role, permission));
    }

    /**
     * Strict rank comparison. Equal ranks do not outrank each other.
     */
    public boolean outranks(UserRole actor, UserRole target) {
        return actor.rank() > target.rank();
    }

    /**
     * Roles an actor may grant to others: everything ranked strictly below it.
     */
    public List<UserRole> assignableRoles(UserRole actor) {
        return Arrays.stream(UserRole.values())
            .filter(role -> outranks(actor, role))
            .toList();
    }
}
