package tech.medops.identity.user;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.medops.identity.authentication.AuthConfig;

/**
 * Password hashing and verification using Argon2id.
 *
 * Argon2id is the OWASP-recommended password hashing algorithm, providing
 * resistance against both GPU and side-channel attacks. Each hash embeds a
 * fresh random salt, so hashing the same password twice yields different
 * outputs.
 *
 * Cost parameters come from {@code medops.auth.password.argon2.*}:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 *
 * Callers must not retry a failed hash speculatively; each attempt costs the
 * full work factor.
 */
@ApplicationScoped
public class PasswordService {

    private static final int HASH_LENGTH = 32;     // Output length in bytes
    private static final int SALT_LENGTH = 16;     // Salt length in bytes

    private final Argon2 argon2;
    private final AuthConfig.Argon2Config cost;

    @Inject
    public PasswordService(AuthConfig config) {
        this.cost = config.password().argon2();
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Hash a password using Argon2id.
     *
     * @param plainPassword The plain text password
     * @return The hashed password in PHC format (e.g., $argon2id$v=19$m=65536,t=3,p=4$...)
     */
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.hash(cost.iterations(), cost.memoryKb(), cost.parallelism(), chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Verify a password against a hash. Comparison is constant-time.
     *
     * @return true if password matches the hash; false on mismatch, null input
     *         or a malformed hash
     */
    public boolean verify(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null || passwordHash.isEmpty()) {
            return false;
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.verify(passwordHash, chars);
        } catch (RuntimeException e) {
            // Invalid hash format
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Check if a hash was produced with different cost parameters than the
     * current configuration and should be regenerated on next successful login.
     */
    public boolean needsRehash(String passwordHash) {
        if (passwordHash == null || !passwordHash.startsWith("$argon2id$")) {
            return true;
        }

        // PHC format: $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>
        String[] parts = passwordHash.split("\\$");
        if (parts.length < 4) {
            return true;
        }
        String params = parts[3];
        return !params.equals("m=" + cost.memoryKb() + ",t=" + cost.iterations() + ",p=" + cost.parallelism());
    }
}
