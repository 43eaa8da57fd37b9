package tech.medops.identity.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Loads the token signing keys once at startup.
 *
 * Supports two modes:
 * 1. File-based keys (production) - PEM files from the configured paths
 * 2. Auto-generated keys (development) - generated on first start and persisted
 *    to {@code medops.auth.jwt.dev-key-dir} so sessions survive restarts
 *
 * Key rotation happens out-of-band by replacing the files and restarting.
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    private static final int KEY_SIZE = 2048;

    @Inject
    AuthConfig config;

    @Produces
    @Singleton
    SigningKeys signingKeys() {
        AuthConfig.JwtConfig jwt = config.jwt();
        try {
            SigningKeys keys;
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                keys = loadPemKeys(Path.of(jwt.privateKeyPath().get()), Path.of(jwt.publicKeyPath().get()));
            } else {
                keys = loadOrGenerateDevKeys(Path.of(jwt.devKeyDir()));
            }
            LOG.infof("JWT signing keys initialized with key ID: %s", keys.keyId());
            return keys;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
    }

    SigningKeys loadPemKeys(Path privateKeyFile, Path publicKeyFile) throws IOException, GeneralSecurityException {
        LOG.info("Loading JWT keys from PEM files");
        byte[] privateKeyBytes = parsePemKey(Files.readString(privateKeyFile, StandardCharsets.US_ASCII), "PRIVATE KEY");
        byte[] publicKeyBytes = parsePemKey(Files.readString(publicKeyFile, StandardCharsets.US_ASCII), "PUBLIC KEY");
        return decode(privateKeyBytes, publicKeyBytes);
    }

    /**
     * Load dev keys from a local directory, or generate and persist new ones.
     */
    SigningKeys loadOrGenerateDevKeys(Path keyDir) throws IOException, GeneralSecurityException {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        SigningKeys keys;
        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            keys = decode(Files.readAllBytes(privateKeyFile), Files.readAllBytes(publicKeyFile));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(KEY_SIZE, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            keys = SigningKeys.of(keyPair);

            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, keys.privateKey().getEncoded());
            Files.write(publicKeyFile, keys.publicKey().getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure medops.auth.jwt.private-key-path and medops.auth.jwt.public-key-path for production.");
        return keys;
    }

    private static SigningKeys decode(byte[] privateKeyBytes, byte[] publicKeyBytes) throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        RSAPrivateKey privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
        RSAPublicKey publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
        return SigningKeys.of(privateKey, publicKey);
    }

    static byte[] parsePemKey(String pem, String type) {
        String base64 = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }
}
