package tech.medops.identity.authentication;

import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;
import java.util.Objects;

/**
 * RSA key pair used to sign and verify access tokens. Immutable; built once
 * at startup and handed to {@link TokenService}.
 *
 * @param keyId      stable id derived from the public key, sent as the {@code kid} header
 * @param privateKey signing key
 * @param publicKey  verification key
 */
public record SigningKeys(String keyId, RSAPrivateKey privateKey, RSAPublicKey publicKey) {

    public SigningKeys {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(publicKey, "publicKey");
    }

    public static SigningKeys of(RSAPrivateKey privateKey, RSAPublicKey publicKey) {
        return new SigningKeys(keyIdFor(publicKey), privateKey, publicKey);
    }

    public static SigningKeys of(KeyPair keyPair) {
        return of((RSAPrivateKey) keyPair.getPrivate(), (RSAPublicKey) keyPair.getPublic());
    }

    static String keyIdFor(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "SigningKeys[keyId=" + keyId + "]";
    }
}
