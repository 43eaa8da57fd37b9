package tech.medops.identity.account;

/**
 * Answer to an OTP request. Identical in shape whether or not a code was issued.
 */
public record OtpRequestResult(String message, long expiresInSeconds) {}
