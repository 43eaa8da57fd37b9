package tech.medops.identity.account;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.medops.identity.audit.AuditAction;
import tech.medops.identity.audit.AuditEntityType;
import tech.medops.identity.audit.AuditService;
import tech.medops.identity.authentication.AccessTokenClaims;
import tech.medops.identity.authentication.token.RefreshTokenRepository;
import tech.medops.identity.authorization.PermissionResolver;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.UnitOfWork;
import tech.medops.identity.common.errors.UseCaseError;
import tech.medops.identity.user.User;
import tech.medops.identity.user.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Administrative overrides on another user's account.
 *
 * <p>The actor is identified by its verified access token. Targets outside the
 * actor's tenant are reported as not found. An actor may only manage users
 * ranked strictly below itself. Every operation returns the target user id.
 */
@ApplicationScoped
public class AccountAdministrationService {

    private static final Logger LOG = Logger.getLogger(AccountAdministrationService.class);

    private final UserRepository userRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final PermissionResolver permissionResolver;
    private final AuditService auditService;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    @Inject
    public AccountAdministrationService(UserRepository userRepository,
                                        RefreshTokenRepository refreshTokenRepository,
                                        PermissionResolver permissionResolver,
                                        AuditService auditService,
                                        UnitOfWork unitOfWork,
                                        Clock clock) {
        this.userRepository = userRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.permissionResolver = permissionResolver;
        this.auditService = auditService;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * Clear the failed-login counter and any active lock.
     */
    public Result<String> unlock(AccessTokenClaims actor, String userId) {
        Result<User> target = managedTarget(actor, userId);
        if (target instanceof Result.Failure<User> f) {
            return Result.failure(f.error());
        }

        userRepository.clearLockout(userId, clock.instant());
        audit(actor, AuditAction.USER_UNLOCK, userId, Map.of());
        LOG.infof("User %s unlocked by %s", userId, actor.subject());
        return Result.success(userId);
    }

    /**
     * Deactivate the account and revoke all of its refresh tokens. Access
     * tokens already issued stay valid until they expire.
     */
    public Result<String> deactivate(AccessTokenClaims actor, String userId) {
        Result<User> target = managedTarget(actor, userId);
        if (target instanceof Result.Failure<User> f) {
            return Result.failure(f.error());
        }

        Instant now = clock.instant();
        int revoked = unitOfWork.inTransaction(() -> {
            userRepository.updateActive(userId, false, now);
            return refreshTokenRepository.revokeAllForUser(userId, now);
        });
        audit(actor, AuditAction.USER_DEACTIVATE, userId, Map.of("revokedSessions", revoked));
        LOG.infof("User %s deactivated by %s, %d sessions revoked", userId, actor.subject(), revoked);
        return Result.success(userId);
    }

    public Result<String> reactivate(AccessTokenClaims actor, String userId) {
        Result<User> target = managedTarget(actor, userId);
        if (target instanceof Result.Failure<User> f) {
            return Result.failure(f.error());
        }

        userRepository.updateActive(userId, true, clock.instant());
        audit(actor, AuditAction.USER_REACTIVATE, userId, Map.of());
        LOG.infof("User %s reactivated by %s", userId, actor.subject());
        return Result.success(userId);
    }

    /**
     * Assign a new role. The new role must also rank strictly below the actor.
     * Takes effect on the target's next login or refresh.
     */
    public Result<String> changeRole(AccessTokenClaims actor, String userId, UserRole newRole) {
        if (newRole == null) {
            return Result.failure(UseCaseError.ValidationError.ofField("role", "Role is required"));
        }

        Result<User> target = managedTarget(actor, userId);
        if (target instanceof Result.Failure<User> f) {
            return Result.failure(f.error());
        }
        User user = ((Result.Success<User>) target).value();

        if (!permissionResolver.outranks(actor.role(), newRole)) {
            return Result.failure(new UseCaseError.AuthorizationError(
                "ROLE_NOT_ASSIGNABLE",
                "You cannot assign a role equal to or higher than your own",
                Map.of("role", newRole.code())
            ));
        }

        userRepository.updateRole(userId, newRole, clock.instant());
        audit(actor, AuditAction.USER_ROLE_CHANGE, userId,
            Map.of("from", user.role.code(), "to", newRole.code()));
        LOG.infof("User %s role changed from %s to %s by %s", userId, user.role.code(), newRole.code(), actor.subject());
        return Result.success(userId);
    }

    private Result<User> managedTarget(AccessTokenClaims actor, String userId) {
        Optional<User> found = userId == null ? Optional.empty() : userRepository.findById(userId);
        if (found.isEmpty() || !found.get().tenantId.equals(actor.tenantId())) {
            return Result.failure(new UseCaseError.NotFoundError(
                "USER_NOT_FOUND",
                "User not found",
                Map.of("userId", String.valueOf(userId))
            ));
        }

        User user = found.get();
        if (!permissionResolver.outranks(actor.role(), user.role)) {
            LOG.warnf("User %s (%s) attempted to manage %s (%s)",
                actor.subject(), actor.role().code(), user.id, user.role.code());
            return Result.failure(new UseCaseError.AuthorizationError(
                "INSUFFICIENT_RANK",
                "You cannot manage a user with an equal or higher role",
                Map.of("userId", user.id)
            ));
        }
        return Result.success(user);
    }

    private void audit(AccessTokenClaims actor, String action, String userId, Map<String, Object> metadata) {
        auditService.recordEvent(actor.tenantId(), actor.subject(), action, AuditEntityType.USER, userId, metadata);
    }
}
