package tech.medops.identity.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Locale;
import java.util.Objects;

/**
 * Centralized TSID generation for all identity records.
 *
 * <p>Format: "{prefix}_{tsid}" (e.g., "ten_0HZXEQ5Y8JY5Z"). TSIDs are
 * time-sortable, so ids index well and preserve creation order.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    /**
     * Generate a new prefixed ID for the given entity type.
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Generate a raw TSID without prefix (e.g., "0HZXEQ5Y8JY5Z").
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }

    /**
     * Short lowercase suffix taken from the random tail of a fresh TSID.
     * Used to disambiguate human-readable keys such as tenant slugs.
     *
     * @param length number of characters, at most 13
     */
    public static String randomSuffix(int length) {
        String raw = generateRaw();
        if (length <= 0 || length > raw.length()) {
            throw new IllegalArgumentException("Suffix length must be between 1 and " + raw.length());
        }
        return raw.substring(raw.length() - length).toLowerCase(Locale.ROOT);
    }

    private TsidGenerator() {
        // Utility class
    }
}
