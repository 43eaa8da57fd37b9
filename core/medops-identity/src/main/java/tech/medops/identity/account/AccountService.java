package tech.medops.identity.account;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.medops.identity.audit.AuditAction;
import tech.medops.identity.audit.AuditEntityType;
import tech.medops.identity.audit.AuditService;
import tech.medops.identity.authentication.AuthConfig;
import tech.medops.identity.authentication.token.RefreshTokenRepository;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.common.Result;
import tech.medops.identity.common.UnitOfWork;
import tech.medops.identity.common.errors.UseCaseError;
import tech.medops.identity.notification.OtpDeliveryService;
import tech.medops.identity.otp.IssuedOtp;
import tech.medops.identity.otp.OtpPurpose;
import tech.medops.identity.otp.OtpService;
import tech.medops.identity.otp.OtpVerification;
import tech.medops.identity.shared.EntityType;
import tech.medops.identity.shared.TsidGenerator;
import tech.medops.identity.tenant.Branch;
import tech.medops.identity.tenant.Tenant;
import tech.medops.identity.tenant.TenantRepository;
import tech.medops.identity.tenant.TenantStatus;
import tech.medops.identity.tenant.UserBranch;
import tech.medops.identity.user.PasswordHistory;
import tech.medops.identity.user.PasswordHistoryRepository;
import tech.medops.identity.user.PasswordPolicy;
import tech.medops.identity.user.PasswordService;
import tech.medops.identity.user.PasswordValidation;
import tech.medops.identity.user.User;
import tech.medops.identity.user.UserRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Account lifecycle outside of a session: registration, one-time codes and
 * password reset or change.
 *
 * <p>Input is validated before anything is written. Registration writes all of
 * its records in one unit of work. A password reset revokes every refresh
 * token of the user; a routine password change leaves other sessions alone.
 */
@ApplicationScoped
public class AccountService {

    private static final Logger LOG = Logger.getLogger(AccountService.class);

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int NAME_MIN = 2;
    private static final int NAME_MAX = 255;
    private static final int EMAIL_MAX = 255;
    static final int PHONE_MAX = 20;

    static final String OTP_GENERIC = "If the phone number is registered, you will receive an OTP";
    static final String OTP_SENT = "OTP sent successfully";
    static final String PASSWORD_REUSED = "Cannot reuse recent passwords. Please choose a different password.";
    static final String CURRENT_PASSWORD_INCORRECT = "Current password is incorrect";
    static final String RESET_SUCCESS = "Password reset successful. Please login with your new password.";
    static final String CHANGE_SUCCESS = "Password changed successfully";

    private final UserRepository userRepository;
    private final TenantRepository tenantRepository;
    private final PasswordHistoryRepository passwordHistoryRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final PasswordService passwordService;
    private final PasswordPolicy passwordPolicy;
    private final OtpService otpService;
    private final OtpDeliveryService otpDeliveryService;
    private final AuditService auditService;
    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final AuthConfig.RegistrationConfig registration;
    private final Pattern phonePattern;
    private final int historyLimit;

    @Inject
    public AccountService(UserRepository userRepository,
                          TenantRepository tenantRepository,
                          PasswordHistoryRepository passwordHistoryRepository,
                          RefreshTokenRepository refreshTokenRepository,
                          PasswordService passwordService,
                          PasswordPolicy passwordPolicy,
                          OtpService otpService,
                          OtpDeliveryService otpDeliveryService,
                          AuditService auditService,
                          UnitOfWork unitOfWork,
                          AuthConfig config,
                          Clock clock) {
        this.userRepository = userRepository;
        this.tenantRepository = tenantRepository;
        this.passwordHistoryRepository = passwordHistoryRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.passwordService = passwordService;
        this.passwordPolicy = passwordPolicy;
        this.otpService = otpService;
        this.otpDeliveryService = otpDeliveryService;
        this.auditService = auditService;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
        this.registration = config.registration();
        this.phonePattern = Pattern.compile(config.registration().phonePattern());
        this.historyLimit = config.password().historyLimit();
    }

    // ========================================================================
    // Registration
    // ========================================================================

    /**
     * Create a tenant, its default branch and the owner account in one step.
     * The owner gets the highest role and must log in afterwards.
     */
    public Result<RegistrationResult> register(RegistrationRequest request) {
        Map<String, List<String>> fieldErrors = validateRegistration(request);
        if (!fieldErrors.isEmpty()) {
            return Result.failure(UseCaseError.ValidationError.ofFields(fieldErrors));
        }

        if (userRepository.existsByPhone(request.phone())) {
            return Result.failure(phoneExists());
        }
        String email = blankToNull(request.email());
        if (email != null && userRepository.existsByEmail(email)) {
            return Result.failure(emailExists());
        }

        Instant now = clock.instant();
        String passwordHash = passwordService.hash(request.password());

        Tenant tenant = new Tenant();
        tenant.id = TsidGenerator.generate(EntityType.TENANT);
        tenant.name = request.facilityName().trim();
        tenant.slug = TenantSlugs.uniqueSlug(tenant.name, tenantRepository::existsBySlug);
        tenant.email = email != null ? email : request.phone() + "@" + registration.placeholderEmailDomain();
        tenant.phone = request.phone();
        tenant.subscriptionPlan = Tenant.PLAN_TRIAL;
        tenant.status = TenantStatus.ACTIVE;
        tenant.trialEndsAt = now.plus(Duration.ofDays(registration.trialDays()));
        tenant.createdAt = now;

        Branch branch = new Branch();
        branch.id = TsidGenerator.generate(EntityType.BRANCH);
        branch.tenantId = tenant.id;
        branch.name = registration.defaultBranchName();
        branch.code = registration.defaultBranchCode();
        branch.createdAt = now;

        User owner = new User();
        owner.id = TsidGenerator.generate(EntityType.USER);
        owner.tenantId = tenant.id;
        owner.name = request.ownerName().trim();
        owner.email = email;
        owner.phone = request.phone();
        owner.passwordHash = passwordHash;
        owner.role = UserRole.highest();
        owner.createdAt = now;

        UserBranch membership = new UserBranch();
        membership.id = TsidGenerator.generate(EntityType.USER_BRANCH);
        membership.tenantId = tenant.id;
        membership.userId = owner.id;
        membership.branchId = branch.id;
        membership.primary = true;
        membership.createdAt = now;

        PasswordHistory history = historyEntry(owner.id, passwordHash, now);

        RegistrationResult registered = new RegistrationResult(
            tenant.id,
            owner.id,
            "Registration successful. Your " + registration.trialDays() + "-day free trial has started."
        );

        Result<RegistrationResult> result = translateConflict(unitOfWork.commitAll(
            List.of(tenant, branch, owner, membership, history), registered));

        if (result.isSuccess()) {
            auditService.recordEvent(tenant.id, owner.id, AuditAction.TENANT_REGISTER,
                AuditEntityType.TENANT, tenant.id, Map.of("slug", tenant.slug));
            LOG.infof("Registered tenant %s (%s) with owner %s", tenant.id, tenant.slug, owner.id);
        } else {
            LOG.warnf("Registration for %s rejected by the store", OtpService.maskPhone(request.phone()));
        }
        return result;
    }

    // ========================================================================
    // One-time codes
    // ========================================================================

    /**
     * Issue a code and hand it to the delivery channel.
     *
     * <p>For login and password reset an unknown phone gets the generic answer
     * and nothing is stored.
     *
     * @param tenantId optional tenant scope for the user lookup
     */
    public Result<OtpRequestResult> requestOtp(String phone, OtpPurpose purpose, String tenantId) {
        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        if (phone == null || phone.isBlank()) {
            fieldErrors.put("phone", List.of("Phone is required"));
        } else if (phone.length() > PHONE_MAX) {
            fieldErrors.put("phone", List.of("Invalid phone number"));
        }
        if (purpose == null) {
            fieldErrors.put("purpose", List.of("Purpose is required"));
        }
        if (!fieldErrors.isEmpty()) {
            return Result.failure(UseCaseError.ValidationError.ofFields(fieldErrors));
        }

        if (purpose.requiresRegisteredUser() && userRepository.findByPhone(tenantId, phone).isEmpty()) {
            LOG.debugf("OTP %s requested for unregistered %s", purpose.code(), OtpService.maskPhone(phone));
            return Result.success(new OtpRequestResult(OTP_GENERIC, otpService.expirySeconds()));
        }

        IssuedOtp issued = otpService.issue(phone, purpose, tenantId);
        try {
            otpDeliveryService.deliverOtp(phone, issued.code(), purpose);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to deliver %s OTP %s to %s", purpose.code(), issued.id(), OtpService.maskPhone(phone));
        }
        return Result.success(new OtpRequestResult(OTP_SENT, otpService.expirySeconds()));
    }

    public OtpVerification verifyOtp(String phone, String code, OtpPurpose purpose) {
        return otpService.verify(phone, code, purpose);
    }

    // ========================================================================
    // Passwords
    // ========================================================================

    /**
     * Set a new password after proving control of the phone with a
     * {@code reset_password} code. Revokes all sessions and clears any lock.
     */
    public Result<String> resetPassword(String phone, String otp, String newPassword) {
        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        if (phone == null || phone.isBlank()) {
            fieldErrors.put("phone", List.of("Phone is required"));
        }
        if (otp == null || otp.isBlank()) {
            fieldErrors.put("otp", List.of("OTP is required"));
        }
        complexityErrors(newPassword).ifPresent(errors -> fieldErrors.put("newPassword", errors));
        if (!fieldErrors.isEmpty()) {
            return Result.failure(UseCaseError.ValidationError.ofFields(fieldErrors));
        }

        OtpVerification verification = otpService.verify(phone, otp, OtpPurpose.RESET_PASSWORD);
        if (!verification.valid()) {
            return Result.failure(new UseCaseError.ValidationError(
                "OTP_" + verification.status().name(),
                verification.message(),
                Map.of("otp", List.of(verification.message()))
            ));
        }

        Optional<User> found = userRepository.findByPhone(null, phone);
        if (found.isEmpty()) {
            return Result.failure(userNotFound());
        }
        User user = found.get();

        if (isReused(user.id, newPassword)) {
            return Result.failure(passwordReused());
        }

        Instant now = clock.instant();
        storeNewPassword(user.id, passwordService.hash(newPassword), now, true);
        int revoked = refreshTokenRepository.revokeAllForUser(user.id, now);

        auditService.recordEvent(user.tenantId, user.id, AuditAction.PASSWORD_RESET,
            AuditEntityType.USER, user.id, Map.of("revokedSessions", revoked));
        LOG.infof("Password reset for user %s, %d sessions revoked", user.id, revoked);
        return Result.success(RESET_SUCCESS);
    }

    /**
     * Routine password change by an authenticated user. Other sessions stay valid.
     */
    public Result<String> changePassword(String userId, String currentPassword, String newPassword) {
        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        if (currentPassword == null || currentPassword.isEmpty()) {
            fieldErrors.put("currentPassword", List.of("Current password is required"));
        }
        complexityErrors(newPassword).ifPresent(errors -> fieldErrors.put("newPassword", errors));
        if (!fieldErrors.isEmpty()) {
            return Result.failure(UseCaseError.ValidationError.ofFields(fieldErrors));
        }

        Optional<User> found = userId == null ? Optional.empty() : userRepository.findById(userId);
        if (found.isEmpty()) {
            return Result.failure(userNotFound());
        }
        User user = found.get();

        if (!passwordService.verify(currentPassword, user.passwordHash)) {
            return Result.failure(UseCaseError.ValidationError.ofField("currentPassword", CURRENT_PASSWORD_INCORRECT));
        }

        if (isReused(user.id, newPassword)) {
            return Result.failure(passwordReused());
        }

        storeNewPassword(user.id, passwordService.hash(newPassword), clock.instant(), false);

        auditService.recordEvent(user.tenantId, user.id, AuditAction.PASSWORD_CHANGE,
            AuditEntityType.USER, user.id);
        LOG.infof("Password changed for user %s", user.id);
        return Result.success(CHANGE_SUCCESS);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Map<String, List<String>> validateRegistration(RegistrationRequest request) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (request == null) {
            errors.put("request", List.of("Registration details are required"));
            return errors;
        }
        nameError("Facility name", request.facilityName()).ifPresent(e -> errors.put("facilityName", List.of(e)));
        nameError("Owner name", request.ownerName()).ifPresent(e -> errors.put("ownerName", List.of(e)));
        if (request.phone() == null || request.phone().length() > PHONE_MAX
                || !phonePattern.matcher(request.phone()).matches()) {
            errors.put("phone", List.of("Invalid phone number"));
        }
        String email = blankToNull(request.email());
        if (email != null && (email.length() > EMAIL_MAX || !EMAIL.matcher(email).matches())) {
            errors.put("email", List.of("Invalid email address"));
        }
        complexityErrors(request.password()).ifPresent(e -> errors.put("password", e));
        return errors;
    }

    /**
     * A concurrent registration can pass the existence checks and still lose
     * on the unique indexes. Report that the same way as the early check.
     */
    private static Result<RegistrationResult> translateConflict(Result<RegistrationResult> result) {
        if (result instanceof Result.Failure<RegistrationResult> failure
                && failure.error() instanceof UseCaseError.ConflictError conflict) {
            Object constraint = conflict.details().get("constraint");
            if ("uq_tenants_phone".equals(constraint) || "uq_users_tenant_phone".equals(constraint)) {
                return Result.failure(phoneExists());
            }
            if ("uq_users_email".equals(constraint)) {
                return Result.failure(emailExists());
            }
        }
        return result;
    }

    private static Optional<String> nameError(String label, String value) {
        int length = value == null ? 0 : value.trim().length();
        if (length < NAME_MIN) {
            return Optional.of(label + " must be at least " + NAME_MIN + " characters");
        }
        if (length > NAME_MAX) {
            return Optional.of(label + " must be at most " + NAME_MAX + " characters");
        }
        return Optional.empty();
    }

    private Optional<List<String>> complexityErrors(String password) {
        PasswordValidation validation = passwordPolicy.validateComplexity(password);
        return validation.valid() ? Optional.empty() : Optional.of(new ArrayList<>(validation.errors()));
    }

    private boolean isReused(String userId, String candidate) {
        List<String> recent = passwordHistoryRepository.findRecentHashes(userId, historyLimit);
        return passwordPolicy.isReused(candidate, recent, historyLimit);
    }

    private void storeNewPassword(String userId, String passwordHash, Instant now, boolean clearLockout) {
        unitOfWork.inTransaction(() -> {
            userRepository.updatePasswordHash(userId, passwordHash, now);
            passwordHistoryRepository.append(historyEntry(userId, passwordHash, now));
            if (clearLockout) {
                userRepository.clearLockout(userId, now);
            }
            return null;
        });
    }

    private static PasswordHistory historyEntry(String userId, String passwordHash, Instant now) {
        PasswordHistory entry = new PasswordHistory();
        entry.id = TsidGenerator.generate(EntityType.PASSWORD_HISTORY);
        entry.userId = userId;
        entry.passwordHash = passwordHash;
        entry.createdAt = now;
        return entry;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static UseCaseError phoneExists() {
        return new UseCaseError.ConflictError("PHONE_EXISTS", "Phone number is already registered", Map.of());
    }

    private static UseCaseError emailExists() {
        return new UseCaseError.ConflictError("EMAIL_EXISTS", "Email is already registered", Map.of());
    }

    private static UseCaseError userNotFound() {
        return new UseCaseError.NotFoundError("USER_NOT_FOUND", "User not found", Map.of());
    }

    private static UseCaseError passwordReused() {
        return UseCaseError.ValidationError.ofField("newPassword", PASSWORD_REUSED);
    }
}
