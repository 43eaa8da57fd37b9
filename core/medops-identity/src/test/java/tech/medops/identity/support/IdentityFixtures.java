package tech.medops.identity.support;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import tech.medops.identity.authentication.AuthConfig;
import tech.medops.identity.authentication.SigningKeys;

import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration and key material shared by unit tests.
 */
public final class IdentityFixtures {

    private static SigningKeys signingKeys;

    private IdentityFixtures() {
    }

    /**
     * Defaults from {@link AuthConfig} with Argon2 turned down to a cheap cost.
     */
    public static AuthConfig authConfig() {
        return authConfig(Map.of());
    }

    public static AuthConfig authConfig(Map<String, String> overrides) {
        Map<String, String> properties = new HashMap<>();
        properties.put("medops.auth.password.argon2.iterations", "1");
        properties.put("medops.auth.password.argon2.memory-kb", "1024");
        properties.put("medops.auth.password.argon2.parallelism", "1");
        properties.putAll(overrides);

        SmallRyeConfig config = new SmallRyeConfigBuilder()
            .withMapping(AuthConfig.class)
            .withSources(new PropertiesConfigSource(properties, "identity-test", 100))
            .build();
        return config.getConfigMapping(AuthConfig.class);
    }

    /**
     * One RSA key pair per test JVM; generating 2048-bit keys is slow.
     */
    public static synchronized SigningKeys signingKeys() {
        if (signingKeys == null) {
            try {
                KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
                generator.initialize(2048);
                signingKeys = SigningKeys.of(generator.generateKeyPair());
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            }
        }
        return signingKeys;
    }
}
