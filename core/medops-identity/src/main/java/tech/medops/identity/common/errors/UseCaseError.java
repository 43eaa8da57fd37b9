package tech.medops.identity.common.errors;

import java.util.List;
import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping
 * and client-side handling. Messages are user-facing; internal reasons
 * belong in the logs and the audit trail, not here.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (missing required fields, invalid format, etc.)
     * Maps to HTTP 400 Bad Request.
     *
     * <p>Per-field messages are carried in {@code details} as field name to
     * a list of messages.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {

        public static ValidationError ofField(String field, String message) {
            return new ValidationError("VALIDATION_FAILED", message, Map.of(field, List.of(message)));
        }

        public static ValidationError ofFields(Map<String, List<String>> fieldErrors) {
            String first = fieldErrors.values().stream()
                .flatMap(List::stream)
                .findFirst()
                .orElse("Validation failed");
            return new ValidationError("VALIDATION_FAILED", first, Map.copyOf(fieldErrors));
        }
    }

    /**
     * Credentials or tokens were rejected (bad password, locked or inactive
     * account, invalid/expired/revoked token).
     * Maps to HTTP 401 Unauthorized.
     */
    record UnauthorizedError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Duplicate phone, email or slug.
     * Maps to HTTP 409 Conflict.
     */
    record ConflictError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Entity not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Authorization failed - actor not allowed to perform this action
     * (e.g. managing a user of equal or higher rank).
     * Maps to HTTP 403 Forbidden.
     */
    record AuthorizationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
