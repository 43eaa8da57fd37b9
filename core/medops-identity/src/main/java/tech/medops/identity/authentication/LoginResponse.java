package tech.medops.identity.authentication;

/**
 * Successful login: a fresh token pair plus the caller's profile.
 */
public record LoginResponse(String accessToken, String refreshToken, long expiresIn, AuthUser user) {

    @Override
    public String toString() {
        return "LoginResponse[expiresIn=" + expiresIn + ", user=" + user.id() + "]";
    }
}
