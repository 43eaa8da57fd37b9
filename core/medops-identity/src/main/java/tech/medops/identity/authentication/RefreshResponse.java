package tech.medops.identity.authentication;

/**
 * Result of a refresh.
 *
 * @param refreshToken the replacement refresh token when rotate-on-use is
 *                     enabled; null otherwise, in which case the presented
 *                     token stays valid
 */
public record RefreshResponse(String accessToken, long expiresIn, String refreshToken) {

    @Override
    public String toString() {
        return "RefreshResponse[expiresIn=" + expiresIn + ", rotated=" + (refreshToken != null) + "]";
    }
}
