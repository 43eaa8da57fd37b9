package tech.medops.identity.account;

public record RegistrationResult(String tenantId, String userId, String message) {}
