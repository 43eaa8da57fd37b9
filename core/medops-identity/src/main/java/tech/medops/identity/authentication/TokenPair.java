package tech.medops.identity.authentication;

/**
 * Freshly minted session credentials. The refresh token must be persisted
 * before the pair is handed to the client.
 */
public record TokenPair(String accessToken, String refreshToken, long expiresInSeconds) {

    @Override
    public String toString() {
        return "TokenPair[expiresInSeconds=" + expiresInSeconds + "]";
    }
}
